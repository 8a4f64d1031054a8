package info.isaksson.erland.sttoplcopenxml.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * One dimension of an {@code ARRAY [..]} declaration.
 *
 * <p>Bounds are kept as source text ({@code 1}, {@code cArrSize}, {@code -5}); they are never
 * evaluated. When the dimension is not of the form {@code lower..upper} both bounds are null and
 * only {@link #raw} is meaningful.</p>
 */
@JsonPropertyOrder({"raw","lower","upper"})
public final class StArrayDimension {
    public final String raw;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String lower;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String upper;

    @JsonCreator
    public StArrayDimension(
            @JsonProperty("raw") String raw,
            @JsonProperty("lower") String lower,
            @JsonProperty("upper") String upper
    ) {
        this.raw = raw == null ? "" : raw.trim();
        String lo = blankToNull(lower);
        String hi = blankToNull(upper);
        // Half a range is no range.
        if (lo == null || hi == null) {
            lo = null;
            hi = null;
        }
        this.lower = lo;
        this.upper = hi;
    }

    /** Dimension with both bounds known. */
    public static StArrayDimension bounded(String lower, String upper) {
        String lo = lower == null ? "" : lower.trim();
        String hi = upper == null ? "" : upper.trim();
        return new StArrayDimension(lo + ".." + hi, lo, hi);
    }

    /** Dimension whose text could not be split into bounds, e.g. {@code *}. */
    public static StArrayDimension unbounded(String raw) {
        return new StArrayDimension(raw, null, null);
    }

    @JsonIgnore
    public boolean isBounded() {
        return lower != null && upper != null;
    }

    private static String blankToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StArrayDimension)) return false;
        StArrayDimension that = (StArrayDimension) o;
        return Objects.equals(raw, that.raw) &&
                Objects.equals(lower, that.lower) &&
                Objects.equals(upper, that.upper);
    }

    @Override public int hashCode() {
        return Objects.hash(raw, lower, upper);
    }

    @Override public String toString() {
        return isBounded() ? lower + ".." + upper : raw;
    }
}
