package info.isaksson.erland.sttoplcopenxml.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** An {@code {attribute 'key' := 'value'}} pragma, carried as opaque metadata. */
@JsonPropertyOrder({"key","value"})
public final class StAttribute {
    public final String key;
    public final String value;

    @JsonCreator
    public StAttribute(
            @JsonProperty("key") String key,
            @JsonProperty("value") String value
    ) {
        this.key = key == null ? "" : key;
        this.value = value == null ? "" : value;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StAttribute)) return false;
        StAttribute that = (StAttribute) o;
        return Objects.equals(key, that.key) && Objects.equals(value, that.value);
    }

    @Override public int hashCode() {
        return Objects.hash(key, value);
    }

    @Override public String toString() {
        return "StAttribute{" + key + "=" + value + "}";
    }
}
