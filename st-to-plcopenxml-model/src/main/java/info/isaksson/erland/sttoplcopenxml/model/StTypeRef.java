package info.isaksson.erland.sttoplcopenxml.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * A structural representation of a declared Structured Text type.
 *
 * <p>{@link #raw} always holds the type expression as written in the source. The remaining fields
 * depend on {@link #kind}:</p>
 * <ul>
 *   <li>{@link StTypeKind#ELEMENTARY}, {@link StTypeKind#DERIVED}: {@link #name}</li>
 *   <li>{@link StTypeKind#STRING}: {@link #name} ({@code STRING}/{@code WSTRING}) and optional {@link #length}</li>
 *   <li>{@link StTypeKind#ARRAY}: {@link #dimensions} and {@link #baseType}</li>
 *   <li>{@link StTypeKind#POINTER}, {@link StTypeKind#REFERENCE}: {@link #baseType}</li>
 * </ul>
 */
@JsonPropertyOrder({"kind","raw","name","length","dimensions","baseType"})
public final class StTypeRef {

    /** IEC 61131-3 elementary type names (plus the common CODESYS aliases). */
    public static final Set<String> ELEMENTARY_NAMES = Set.of(
            "BOOL", "BYTE", "WORD", "DWORD", "LWORD",
            "SINT", "USINT", "INT", "UINT", "DINT", "UDINT", "LINT", "ULINT",
            "REAL", "LREAL",
            "TIME", "LTIME", "DATE", "LDATE",
            "TIME_OF_DAY", "TOD", "LTOD", "DATE_AND_TIME", "DT", "LDT",
            "CHAR", "WCHAR"
    );

    public final StTypeKind kind;
    public final String raw;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final String name;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String length;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<StArrayDimension> dimensions;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final StTypeRef baseType;

    @JsonCreator
    public StTypeRef(
            @JsonProperty("kind") StTypeKind kind,
            @JsonProperty("raw") String raw,
            @JsonProperty("name") String name,
            @JsonProperty("length") String length,
            @JsonProperty("dimensions") List<StArrayDimension> dimensions,
            @JsonProperty("baseType") StTypeRef baseType
    ) {
        this.kind = kind == null ? StTypeKind.DERIVED : kind;
        this.name = name == null ? "" : name.trim();
        this.raw = raw == null || raw.isBlank() ? this.name : raw.trim();
        this.length = length == null || length.isBlank() ? null : length.trim();
        this.dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
        this.baseType = baseType;
        if ((this.kind == StTypeKind.ARRAY || this.kind == StTypeKind.POINTER || this.kind == StTypeKind.REFERENCE)
                && baseType == null) {
            throw new IllegalArgumentException(this.kind + " type requires a base type: " + this.raw);
        }
    }

    /**
     * Named type: elementary when the name is an IEC elementary type (normalized to upper case),
     * string when it is {@code STRING}/{@code WSTRING}, derived otherwise.
     */
    public static StTypeRef named(String name) {
        String n = name == null ? "" : name.trim();
        String upper = n.toUpperCase(Locale.ROOT);
        if (ELEMENTARY_NAMES.contains(upper)) {
            return elementary(n);
        }
        if (isStringName(upper)) {
            return string(n, upper, null);
        }
        return derived(n);
    }

    public static StTypeRef elementary(String name) {
        String upper = name == null ? "" : name.trim().toUpperCase(Locale.ROOT);
        return new StTypeRef(StTypeKind.ELEMENTARY, name, upper, null, List.of(), null);
    }

    public static StTypeRef string(String raw, String name, String length) {
        String upper = name == null ? "STRING" : name.trim().toUpperCase(Locale.ROOT);
        return new StTypeRef(StTypeKind.STRING, raw, upper, length, List.of(), null);
    }

    public static StTypeRef derived(String name) {
        return new StTypeRef(StTypeKind.DERIVED, name, name, null, List.of(), null);
    }

    public static StTypeRef array(String raw, List<StArrayDimension> dimensions, StTypeRef baseType) {
        return new StTypeRef(StTypeKind.ARRAY, raw, "", null, dimensions, baseType);
    }

    public static StTypeRef pointer(String raw, StTypeRef baseType) {
        return new StTypeRef(StTypeKind.POINTER, raw, "", null, List.of(), baseType);
    }

    public static StTypeRef reference(String raw, StTypeRef baseType) {
        return new StTypeRef(StTypeKind.REFERENCE, raw, "", null, List.of(), baseType);
    }

    public static boolean isStringName(String upperName) {
        return "STRING".equals(upperName) || "WSTRING".equals(upperName);
    }

    /** Innermost non-array element type; the type itself when it is not an array. */
    @JsonIgnore
    public StTypeRef elementType() {
        StTypeRef t = this;
        while (t.kind == StTypeKind.ARRAY && t.baseType != null) {
            t = t.baseType;
        }
        return t;
    }

    @JsonIgnore
    public boolean isArray() {
        return kind == StTypeKind.ARRAY;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StTypeRef)) return false;
        StTypeRef that = (StTypeRef) o;
        return kind == that.kind &&
                Objects.equals(raw, that.raw) &&
                Objects.equals(name, that.name) &&
                Objects.equals(length, that.length) &&
                Objects.equals(dimensions, that.dimensions) &&
                Objects.equals(baseType, that.baseType);
    }

    @Override public int hashCode() {
        return Objects.hash(kind, raw, name, length, dimensions, baseType);
    }

    @Override public String toString() {
        return raw;
    }
}
