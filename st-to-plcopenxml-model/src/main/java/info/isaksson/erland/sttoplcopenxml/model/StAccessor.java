package info.isaksson.erland.sttoplcopenxml.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/** A {@code PROPERTY GET} or {@code PROPERTY SET} sub-block. */
@JsonPropertyOrder({"locals","body"})
public final class StAccessor {
    private static final StAccessor EMPTY = new StAccessor(List.of(), "");

    public final List<StVariable> locals;
    public final String body;

    @JsonCreator
    public StAccessor(
            @JsonProperty("locals") List<StVariable> locals,
            @JsonProperty("body") String body
    ) {
        this.locals = locals == null ? List.of() : List.copyOf(locals);
        this.body = body == null ? "" : body;
    }

    public static StAccessor empty() {
        return EMPTY;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return locals.isEmpty() && body.isEmpty();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StAccessor)) return false;
        StAccessor that = (StAccessor) o;
        return Objects.equals(locals, that.locals) && Objects.equals(body, that.body);
    }

    @Override public int hashCode() {
        return Objects.hash(locals, body);
    }
}
