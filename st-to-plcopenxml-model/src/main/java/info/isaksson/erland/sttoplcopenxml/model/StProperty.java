package info.isaksson.erland.sttoplcopenxml.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A {@code PROPERTY} of a function block.
 *
 * <p>The getter is always present (empty when the source has no {@code PROPERTY GET} block);
 * the setter only when a {@code PROPERTY SET} block exists.</p>
 */
@JsonPropertyOrder({"objectId","name","type","attribute","getter","setter"})
public final class StProperty {
    public final String objectId;
    public final String name;
    public final StTypeRef type;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final StAttribute attribute;

    public final StAccessor getter;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final StAccessor setter;

    @JsonCreator
    public StProperty(
            @JsonProperty("objectId") String objectId,
            @JsonProperty("name") String name,
            @JsonProperty("type") StTypeRef type,
            @JsonProperty("attribute") StAttribute attribute,
            @JsonProperty("getter") StAccessor getter,
            @JsonProperty("setter") StAccessor setter
    ) {
        if (objectId == null || objectId.isBlank()) {
            throw new IllegalArgumentException("property objectId must not be blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("property name must not be blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("property type must not be null: " + name);
        }
        this.objectId = objectId;
        this.name = name;
        this.type = type;
        this.attribute = attribute;
        this.getter = getter == null ? StAccessor.empty() : getter;
        this.setter = setter;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StProperty)) return false;
        StProperty that = (StProperty) o;
        return Objects.equals(objectId, that.objectId) &&
                Objects.equals(name, that.name) &&
                Objects.equals(type, that.type) &&
                Objects.equals(attribute, that.attribute) &&
                Objects.equals(getter, that.getter) &&
                Objects.equals(setter, that.setter);
    }

    @Override public int hashCode() {
        return Objects.hash(objectId, name, type, attribute, getter, setter);
    }

    @Override public String toString() {
        return "StProperty{" + name + " : " + type + " #" + objectId + "}";
    }
}
