package info.isaksson.erland.sttoplcopenxml.extract;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects warnings during extraction.
 *
 * <p>Warnings are deterministic: final output is sorted by (line, code, message, contextString).</p>
 */
public final class ExtractionWarnings {

    private final List<ExtractionWarning> warnings = new ArrayList<>();

    public void warn(String code, String message, int line) {
        warn(code, message, line, null);
    }

    public void warn(String code, String message, int line, Map<String, String> context) {
        warnings.add(new ExtractionWarning(code, message, line, context == null ? Collections.emptyMap() : context));
    }

    public void warn(String code, String message, int line, String k1, String v1) {
        Map<String, String> ctx = new LinkedHashMap<>();
        ctx.put(k1, v1);
        warn(code, message, line, ctx);
    }

    public boolean isEmpty() {
        return warnings.isEmpty();
    }

    public int size() {
        return warnings.size();
    }

    public List<ExtractionWarning> toDeterministicList() {
        List<ExtractionWarning> out = new ArrayList<>(warnings);
        out.sort(Comparator
                .comparingInt((ExtractionWarning w) -> w.line)
                .thenComparing(w -> w.code)
                .thenComparing(w -> w.message)
                .thenComparing(w -> contextString(w.context)));
        return Collections.unmodifiableList(out);
    }

    private static String contextString(Map<String, String> ctx) {
        if (ctx == null || ctx.isEmpty()) return "";
        // stable serialization: key-sorted
        List<String> keys = new ArrayList<>(ctx.keySet());
        keys.sort(String::compareTo);
        StringBuilder sb = new StringBuilder();
        for (String k : keys) {
            sb.append(k).append('=').append(ctx.get(k)).append(';');
        }
        return sb.toString();
    }
}
