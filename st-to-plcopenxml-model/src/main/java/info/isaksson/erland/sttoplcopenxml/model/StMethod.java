package info.isaksson.erland.sttoplcopenxml.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * A {@code METHOD} of a function block.
 *
 * <p>The object id is handed in by the extractor from its {@link ObjectIdAllocator} and never
 * changes afterwards. The serializer emits it twice (method data block and project structure).</p>
 */
@JsonPropertyOrder({"objectId","name","returnType","inputs","outputs","inOuts","locals","body"})
public final class StMethod {
    public final String objectId;
    public final String name;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final StTypeRef returnType;

    public final List<StVariable> inputs;
    public final List<StVariable> outputs;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<StVariable> inOuts;

    public final List<StVariable> locals;
    public final String body;

    @JsonCreator
    public StMethod(
            @JsonProperty("objectId") String objectId,
            @JsonProperty("name") String name,
            @JsonProperty("returnType") StTypeRef returnType,
            @JsonProperty("inputs") List<StVariable> inputs,
            @JsonProperty("outputs") List<StVariable> outputs,
            @JsonProperty("inOuts") List<StVariable> inOuts,
            @JsonProperty("locals") List<StVariable> locals,
            @JsonProperty("body") String body
    ) {
        if (objectId == null || objectId.isBlank()) {
            throw new IllegalArgumentException("method objectId must not be blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("method name must not be blank");
        }
        this.objectId = objectId;
        this.name = name;
        this.returnType = returnType;
        this.inputs = inputs == null ? List.of() : List.copyOf(inputs);
        this.outputs = outputs == null ? List.of() : List.copyOf(outputs);
        this.inOuts = inOuts == null ? List.of() : List.copyOf(inOuts);
        this.locals = locals == null ? List.of() : List.copyOf(locals);
        this.body = body == null ? "" : body;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StMethod)) return false;
        StMethod that = (StMethod) o;
        return Objects.equals(objectId, that.objectId) &&
                Objects.equals(name, that.name) &&
                Objects.equals(returnType, that.returnType) &&
                Objects.equals(inputs, that.inputs) &&
                Objects.equals(outputs, that.outputs) &&
                Objects.equals(inOuts, that.inOuts) &&
                Objects.equals(locals, that.locals) &&
                Objects.equals(body, that.body);
    }

    @Override public int hashCode() {
        return Objects.hash(objectId, name, returnType, inputs, outputs, inOuts, locals, body);
    }

    @Override public String toString() {
        return "StMethod{" + name + " #" + objectId + "}";
    }
}
