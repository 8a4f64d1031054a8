package info.isaksson.erland.sttoplcopenxml.core;

import info.isaksson.erland.sttoplcopenxml.emitter.EmitterOptions;
import info.isaksson.erland.sttoplcopenxml.extract.StExtractor;
import info.isaksson.erland.sttoplcopenxml.io.StSourceReader;
import info.isaksson.erland.sttoplcopenxml.model.ObjectIdAllocator;
import info.isaksson.erland.sttoplcopenxml.model.StFunctionBlock;
import info.isaksson.erland.sttoplcopenxml.xml.PlcOpenXmlWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Core API for converting Structured Text function blocks to PLCopen XML.
 *
 * <p>CLI and other wrappers should use this class instead of re-implementing the pipeline.
 * Each call is one conversion with its own object id allocator.</p>
 */
public final class StToPlcOpenXmlService {

    private static final Logger log = LoggerFactory.getLogger(StToPlcOpenXmlService.class);

    /**
     * Convert a source file and write the document.
     *
     * @return the written output path
     * @throws java.nio.file.NoSuchFileException when {@code input} does not exist; no output is created
     */
    public Path convert(Path input, Path output, StToPlcOpenXmlOptions options) throws IOException {
        return convertToFile(input, output, options).outputFile;
    }

    /** Like {@link #convert} but also returns the in-memory result. */
    public FileResult convertToFile(Path input, Path output, StToPlcOpenXmlOptions options) throws IOException {
        if (input == null) throw new IllegalArgumentException("input must not be null");
        if (output == null) throw new IllegalArgumentException("output must not be null");

        String text = StSourceReader.read(input);
        StToPlcOpenXmlResult res = convertText(text, options);
        write(res, output);
        log.info("Converted {} -> {} ({} method(s), {} propert(ies), {} warning(s))",
                input, output, res.functionBlock.methods.size(), res.functionBlock.properties.size(), res.warnings.size());
        return new FileResult(output, res);
    }

    /**
     * Write a conversion result to {@code output}, replacing any existing file.
     *
     * @return the written output path
     */
    public Path write(StToPlcOpenXmlResult result, Path output) throws IOException {
        if (result == null) throw new IllegalArgumentException("result must not be null");
        if (output == null) throw new IllegalArgumentException("output must not be null");
        PlcOpenXmlWriter.writeAtomically(result.xmlString, output);
        return output;
    }

    /** Convert source text in memory. */
    public StToPlcOpenXmlResult convertText(String text, StToPlcOpenXmlOptions options) {
        if (text == null) throw new IllegalArgumentException("text must not be null");
        if (options == null) options = new StToPlcOpenXmlOptions();

        ObjectIdAllocator allocator = allocator(options);
        StExtractor.Result extracted = new StExtractor().extractWithWarnings(text, allocator);
        String xml = PlcOpenXmlWriter.writeToString(extracted.functionBlock, emitterOptions(options, allocator));
        return new StToPlcOpenXmlResult(xml, extracted.functionBlock, extracted.warnings);
    }

    /** Serialize a model that was built elsewhere, for example read from a JSON snapshot. */
    public StToPlcOpenXmlResult convertModel(StFunctionBlock model, StToPlcOpenXmlOptions options) {
        if (model == null) throw new IllegalArgumentException("model must not be null");
        if (options == null) options = new StToPlcOpenXmlOptions();

        String xml = PlcOpenXmlWriter.writeToString(model, emitterOptions(options, allocator(options)));
        return new StToPlcOpenXmlResult(xml, model, List.of());
    }

    private static ObjectIdAllocator allocator(StToPlcOpenXmlOptions options) {
        return options.seed == null ? ObjectIdAllocator.random() : ObjectIdAllocator.seeded(options.seed);
    }

    private static EmitterOptions emitterOptions(StToPlcOpenXmlOptions options, ObjectIdAllocator allocator) {
        return EmitterOptions.defaults()
                .withProduct(options.productName, options.productVersion)
                .withCompanyName(options.companyName)
                .withAuthor(options.author)
                .withTimestamp(options.timestamp)
                .withAllocator(allocator);
    }

    /** Result of a file conversion. */
    public static final class FileResult {
        public final Path outputFile;
        public final StToPlcOpenXmlResult result;

        FileResult(Path outputFile, StToPlcOpenXmlResult result) {
            this.outputFile = outputFile;
            this.result = result;
        }
    }
}
