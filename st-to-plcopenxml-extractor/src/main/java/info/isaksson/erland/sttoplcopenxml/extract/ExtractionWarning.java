package info.isaksson.erland.sttoplcopenxml.extract;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A non-fatal recovery made while extracting a function block.
 *
 * <p>Extraction never fails on malformed input; every place where the parser fell back to a
 * default is reported as one of these instead.</p>
 */
public final class ExtractionWarning {

    public static final String NO_FUNCTION_BLOCK = "NO_FUNCTION_BLOCK";
    public static final String MISSING_FUNCTION_BLOCK_NAME = "MISSING_FUNCTION_BLOCK_NAME";
    public static final String MULTIPLE_FUNCTION_BLOCKS = "MULTIPLE_FUNCTION_BLOCKS";
    public static final String UNSUPPORTED_SECTION = "UNSUPPORTED_SECTION";
    public static final String MISSING_END_VAR = "MISSING_END_VAR";
    public static final String UNRECOGNIZED_DECLARATION = "UNRECOGNIZED_DECLARATION";
    public static final String UNBOUNDED_DIMENSION = "UNBOUNDED_DIMENSION";
    public static final String ARRAY_WITHOUT_ELEMENT_TYPE = "ARRAY_WITHOUT_ELEMENT_TYPE";
    public static final String METHOD_WITHOUT_NAME = "METHOD_WITHOUT_NAME";
    public static final String PROPERTY_WITHOUT_NAME = "PROPERTY_WITHOUT_NAME";
    public static final String PROPERTY_WITHOUT_TYPE = "PROPERTY_WITHOUT_TYPE";
    public static final String DUPLICATE_ACCESSOR = "DUPLICATE_ACCESSOR";
    public static final String DUPLICATE_ATTRIBUTE = "DUPLICATE_ATTRIBUTE";

    /** Warning code stable across versions. */
    public final String code;

    /** Human-readable message. */
    public final String message;

    /** 1-based source line, or 0 when not tied to a line. */
    public final int line;

    /** Optional structured context (stable keys recommended). */
    public final Map<String, String> context;

    public ExtractionWarning(String code, String message, int line, Map<String, String> context) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.line = Math.max(0, line);
        if (context == null || context.isEmpty()) {
            this.context = Collections.emptyMap();
        } else {
            this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
        }
    }

    @Override public String toString() {
        return (line > 0 ? "line " + line + ": " : "") + code + " - " + message;
    }
}
