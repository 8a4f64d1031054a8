package info.isaksson.erland.sttoplcopenxml.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Root of the extracted model: one {@code FUNCTION_BLOCK} with its declarations and members.
 *
 * <p>Constants and variables are keyed by name and iterate in source order. Methods and
 * properties keep their order of first appearance. Instances are immutable; one is built per
 * conversion and read once by the serializer.</p>
 */
@JsonPropertyOrder({"name","constants","variables","inputs","outputs","inOuts","methods","properties","body"})
public final class StFunctionBlock {

    /** Name used when the source carries no {@code FUNCTION_BLOCK <name>} declaration. */
    public static final String DEFAULT_NAME = "FB";

    public final String name;
    public final Map<String, StVariable> constants;
    public final Map<String, StVariable> variables;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<StVariable> inputs;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<StVariable> outputs;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<StVariable> inOuts;

    public final List<StMethod> methods;
    public final List<StProperty> properties;

    /** Implementation text of the function block itself; empty when there is none. */
    public final String body;

    @JsonCreator
    public StFunctionBlock(
            @JsonProperty("name") String name,
            @JsonProperty("constants") Map<String, StVariable> constants,
            @JsonProperty("variables") Map<String, StVariable> variables,
            @JsonProperty("inputs") List<StVariable> inputs,
            @JsonProperty("outputs") List<StVariable> outputs,
            @JsonProperty("inOuts") List<StVariable> inOuts,
            @JsonProperty("methods") List<StMethod> methods,
            @JsonProperty("properties") List<StProperty> properties,
            @JsonProperty("body") String body
    ) {
        this.name = name == null || name.isBlank() ? DEFAULT_NAME : name.trim();
        this.constants = copyOrdered(constants);
        this.variables = copyOrdered(variables);
        this.inputs = inputs == null ? List.of() : List.copyOf(inputs);
        this.outputs = outputs == null ? List.of() : List.copyOf(outputs);
        this.inOuts = inOuts == null ? List.of() : List.copyOf(inOuts);
        this.methods = methods == null ? List.of() : List.copyOf(methods);
        this.properties = properties == null ? List.of() : List.copyOf(properties);
        this.body = body == null ? "" : body;
    }

    private static Map<String, StVariable> copyOrdered(Map<String, StVariable> in) {
        if (in == null || in.isEmpty()) return Collections.emptyMap();
        return Collections.unmodifiableMap(new LinkedHashMap<>(in));
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StFunctionBlock)) return false;
        StFunctionBlock that = (StFunctionBlock) o;
        return Objects.equals(name, that.name) &&
                Objects.equals(constants, that.constants) &&
                Objects.equals(variables, that.variables) &&
                Objects.equals(inputs, that.inputs) &&
                Objects.equals(outputs, that.outputs) &&
                Objects.equals(inOuts, that.inOuts) &&
                Objects.equals(methods, that.methods) &&
                Objects.equals(properties, that.properties) &&
                Objects.equals(body, that.body);
    }

    @Override public int hashCode() {
        return Objects.hash(name, constants, variables, inputs, outputs, inOuts, methods, properties, body);
    }

    @Override public String toString() {
        return "StFunctionBlock{" + name + ", methods=" + methods.size() + ", properties=" + properties.size() + "}";
    }
}
