package info.isaksson.erland.sttoplcopenxml.extract;

import info.isaksson.erland.sttoplcopenxml.model.ObjectIdAllocator;
import info.isaksson.erland.sttoplcopenxml.model.StFunctionBlock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Extracts a function block model from Structured Text source.
 *
 * <p>Extraction is lenient: any text yields a model. Missing or malformed parts fall back to
 * empty values and are reported through {@link Result#warnings}.</p>
 */
public final class StExtractor {

    private static final Logger log = LoggerFactory.getLogger(StExtractor.class);

    public StExtractor() {
    }

    /** Extract with freshly random object ids. */
    public StFunctionBlock extract(String text) {
        return extract(text, ObjectIdAllocator.random());
    }

    public StFunctionBlock extract(String text, ObjectIdAllocator allocator) {
        return extractWithWarnings(text, allocator).functionBlock;
    }

    /**
     * Extract and keep the recovery warnings.
     *
     * @param text source text; null is treated as empty
     * @param allocator source of method and property object ids, drawn in source order
     */
    public Result extractWithWarnings(String text, ObjectIdAllocator allocator) {
        Objects.requireNonNull(allocator, "allocator");
        ExtractionWarnings warnings = new ExtractionWarnings();
        StFunctionBlock fb = new StParser(text == null ? "" : text, allocator, warnings).parse();

        if (warnings.isEmpty()) {
            log.debug("Extracted {} without warnings", fb);
            return new Result(fb, List.of());
        }
        List<ExtractionWarning> list = warnings.toDeterministicList();
        for (ExtractionWarning w : list) {
            log.warn("{}", w);
        }
        log.debug("Extracted {} with {} warning(s)", fb, warnings.size());
        return new Result(fb, list);
    }

    public static final class Result {
        public final StFunctionBlock functionBlock;
        public final List<ExtractionWarning> warnings;

        public Result(StFunctionBlock functionBlock, List<ExtractionWarning> warnings) {
            this.functionBlock = functionBlock;
            this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
        }
    }
}
