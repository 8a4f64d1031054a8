package info.isaksson.erland.sttoplcopenxml.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A declared variable, parameter or constant.
 *
 * <p>The initial value is carried as opaque source text; it is not type-checked.</p>
 */
@JsonPropertyOrder({"name","type","initialValue"})
public final class StVariable {
    public final String name;
    public final StTypeRef type;

    /** Initializer text after {@code :=}, or null. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String initialValue;

    @JsonCreator
    public StVariable(
            @JsonProperty("name") String name,
            @JsonProperty("type") StTypeRef type,
            @JsonProperty("initialValue") String initialValue
    ) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("variable name must not be blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("variable type must not be null: " + name);
        }
        this.name = name.trim();
        this.type = type;
        this.initialValue = initialValue == null || initialValue.isBlank() ? null : initialValue.trim();
    }

    public StVariable(String name, StTypeRef type) {
        this(name, type, null);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StVariable)) return false;
        StVariable that = (StVariable) o;
        return Objects.equals(name, that.name) &&
                Objects.equals(type, that.type) &&
                Objects.equals(initialValue, that.initialValue);
    }

    @Override public int hashCode() {
        return Objects.hash(name, type, initialValue);
    }

    @Override public String toString() {
        return name + " : " + type + (initialValue == null ? "" : " := " + initialValue);
    }
}
