package info.isaksson.erland.sttoplcopenxml.core;

import info.isaksson.erland.sttoplcopenxml.extract.ExtractionWarning;
import info.isaksson.erland.sttoplcopenxml.model.StFunctionBlock;

import java.nio.charset.StandardCharsets;
import java.util.List;

/** Conversion result container for programmatic usage. */
public final class StToPlcOpenXmlResult {
    /** UTF-8 encoded PLCopen XML document. */
    public final byte[] xmlBytes;

    /** Convenience: decoded document. */
    public final String xmlString;

    public final StFunctionBlock functionBlock;

    /** Extraction recoveries; empty when the model was not extracted from text. */
    public final List<ExtractionWarning> warnings;

    StToPlcOpenXmlResult(String xml, StFunctionBlock functionBlock, List<ExtractionWarning> warnings) {
        this.xmlString = xml;
        this.xmlBytes = xml.getBytes(StandardCharsets.UTF_8);
        this.functionBlock = functionBlock;
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
