package info.isaksson.erland.sttoplcopenxml.xml;

import info.isaksson.erland.sttoplcopenxml.emitter.EmitterOptions;
import info.isaksson.erland.sttoplcopenxml.model.StAccessor;
import info.isaksson.erland.sttoplcopenxml.model.StFunctionBlock;
import info.isaksson.erland.sttoplcopenxml.model.StMethod;
import info.isaksson.erland.sttoplcopenxml.model.StProperty;
import info.isaksson.erland.sttoplcopenxml.model.StVariable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Writes an {@link StFunctionBlock} as a PLCopen TC6 XML project with the CODESYS-family
 * extensions for methods, properties, object ids and project structure.
 *
 * <p>The document is built as text in memory. Given the same model, the same timestamp and a
 * seeded allocator, the output is byte-for-byte identical.</p>
 */
public final class PlcOpenXmlWriter {

    private static final Logger log = LoggerFactory.getLogger(PlcOpenXmlWriter.class);

    public static final String PLCOPEN_NS = "http://www.plcopen.org/xml/tc6_0200";
    public static final String XHTML_NS = "http://www.w3.org/1999/xhtml";

    static final String DATA_METHOD = "http://www.3s-software.com/plcopenxml/method";
    static final String DATA_PROPERTY = "http://www.3s-software.com/plcopenxml/property";
    static final String DATA_ATTRIBUTES = "http://www.3s-software.com/plcopenxml/attributes";
    static final String DATA_OBJECT_ID = "http://www.3s-software.com/plcopenxml/objectid";
    static final String DATA_PROJECT_STRUCTURE = "http://www.3s-software.com/plcopenxml/projectstructure";
    static final String DATA_PROJECT_INFORMATION = "http://www.3s-software.com/plcopenxml/projectinformation";

    static final String CONTENT_VERSION = "0.0.0.0";

    /** Seven fractional digits, as the importing tools write them. */
    static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSSS");

    private PlcOpenXmlWriter() {}

    /**
     * Write the document to {@code outFile}. Nothing is written when building the document fails.
     */
    public static void write(StFunctionBlock fb, EmitterOptions options, Path outFile) throws IOException {
        if (outFile == null) {
            throw new IllegalArgumentException("outFile must not be null");
        }
        writeAtomically(writeToString(fb, options), outFile);
    }

    /**
     * Write an already serialized document through a temporary file in the target directory,
     * then move it into place.
     */
    public static void writeAtomically(String xml, Path outFile) throws IOException {
        if (xml == null) {
            throw new IllegalArgumentException("xml must not be null");
        }
        if (outFile == null) {
            throw new IllegalArgumentException("outFile must not be null");
        }
        Path target = outFile.toAbsolutePath().normalize();
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = Files.createTempFile(parent, "." + target.getFileName(), ".tmp");
        try {
            Files.writeString(tmp, xml, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
        log.debug("Wrote {} ({} chars)", target, xml.length());
    }

    public static String writeToString(StFunctionBlock fb, EmitterOptions options) {
        if (fb == null) {
            throw new IllegalArgumentException("function block must not be null");
        }
        EmitterOptions opts = options == null ? EmitterOptions.defaults() : options;

        for (StMethod m : fb.methods) opts.allocator.reserve(m.objectId);
        for (StProperty p : fb.properties) opts.allocator.reserve(p.objectId);
        String projectObjectId = opts.allocator.next();

        LocalDateTime ts = opts.timestamp == null ? LocalDateTime.now() : opts.timestamp;
        String stamp = TIMESTAMP.format(ts);

        XmlOut out = new XmlOut().declaration();
        out.open("project", "xmlns", PLCOPEN_NS);
        out.empty("fileHeader",
                "companyName", opts.companyName,
                "productName", opts.productName,
                "productVersion", opts.productVersion,
                "creationDateTime", stamp);
        contentHeader(out, fb, opts, stamp);

        out.open("types");
        out.empty("dataTypes");
        out.open("pous");
        pou(out, fb, projectObjectId);
        out.close("pous");
        out.close("types");

        out.open("instances");
        out.empty("configurations");
        out.close("instances");

        projectStructure(out, fb, projectObjectId);
        out.close("project");

        log.debug("Serialized {} (project object id {})", fb, projectObjectId);
        return out.toString();
    }

    private static void contentHeader(XmlOut out, StFunctionBlock fb, EmitterOptions opts, String stamp) {
        out.open("contentHeader",
                "name", fb.name,
                "version", CONTENT_VERSION,
                "modificationDateTime", stamp,
                "author", opts.author);
        out.open("coordinateInfo");
        for (String lang : List.of("fbd", "ld", "sfc")) {
            out.open(lang);
            out.empty("scaling", "x", "1", "y", "1");
            out.close(lang);
        }
        out.close("coordinateInfo");

        out.open("addData");
        out.open("data", "name", DATA_PROJECT_INFORMATION, "handleUnknown", "implementation");
        out.open("ProjectInformation");
        out.text("property", opts.author, "name", "Author", "type", "string");
        out.text("property", opts.companyName, "name", "Company", "type", "string");
        out.empty("property", "name", "Description", "type", "string");
        out.text("property", "false", "name", "Git:IsGitManaged", "type", "boolean");
        out.text("property", fb.name, "name", "Project", "type", "string");
        out.text("property", "false", "name", "Svn:IsSvnManaged", "type", "boolean");
        out.text("property", fb.name, "name", "Title", "type", "string");
        out.text("property", CONTENT_VERSION, "name", "Version", "type", "version");
        out.close("ProjectInformation");
        out.close("data");
        out.close("addData");
        out.close("contentHeader");
    }

    private static void pou(XmlOut out, StFunctionBlock fb, String projectObjectId) {
        out.open("pou", "name", fb.name, "pouType", "functionBlock");

        List<VarGroup> groups = new ArrayList<>();
        groups.add(new VarGroup("inputVars", fb.inputs));
        groups.add(new VarGroup("outputVars", fb.outputs));
        groups.add(new VarGroup("inOutVars", fb.inOuts));
        groups.add(new VarGroup("localVars", fb.constants.values(), "constant", "true"));
        groups.add(new VarGroup("localVars", fb.variables.values()));
        interfaceBlock(out, null, groups);

        body(out, fb.body);

        out.open("addData");
        for (StMethod m : fb.methods) {
            method(out, m);
        }
        for (StProperty p : fb.properties) {
            property(out, p);
        }
        out.open("data", "name", DATA_OBJECT_ID, "handleUnknown", "discard");
        out.text("ObjectId", projectObjectId);
        out.close("data");
        out.close("addData");

        out.close("pou");
    }

    private static void method(XmlOut out, StMethod m) {
        out.open("data", "name", DATA_METHOD, "handleUnknown", "implementation");
        out.open("Method", "name", m.name, "ObjectId", m.objectId);

        List<VarGroup> groups = new ArrayList<>();
        groups.add(new VarGroup("inputVars", m.inputs));
        groups.add(new VarGroup("outputVars", m.outputs));
        groups.add(new VarGroup("inOutVars", m.inOuts));
        groups.add(new VarGroup("localVars", m.locals));
        if (m.returnType == null) {
            interfaceBlock(out, null, groups);
        } else {
            interfaceBlock(out, () -> {
                out.open("returnType");
                TypeElementRenderer.render(out, m.returnType);
                out.close("returnType");
            }, groups);
        }

        body(out, m.body);
        out.empty("addData");
        out.close("Method");
        out.close("data");
    }

    private static void property(XmlOut out, StProperty p) {
        out.open("data", "name", DATA_PROPERTY, "handleUnknown", "implementation");
        out.open("Property", "name", p.name, "ObjectId", p.objectId);

        out.open("interface");
        out.open("returnType");
        TypeElementRenderer.render(out, p.type);
        out.close("returnType");
        out.close("interface");

        accessor(out, "GetAccessor", p.getter, p.attribute == null ? null : () -> {
            out.open("addData");
            out.open("data", "name", DATA_ATTRIBUTES, "handleUnknown", "implementation");
            out.open("Attributes");
            out.empty("Attribute", "Name", p.attribute.key, "Value", p.attribute.value);
            out.close("Attributes");
            out.close("data");
            out.close("addData");
        });
        if (p.setter != null) {
            accessor(out, "SetAccessor", p.setter, null);
        }

        out.empty("addData");
        out.close("Property");
        out.close("data");
    }

    private static void accessor(XmlOut out, String element, StAccessor accessor, Runnable interfaceAddData) {
        out.open(element);
        List<VarGroup> groups = List.of(new VarGroup("localVars", accessor.locals));
        if (interfaceAddData == null) {
            interfaceBlock(out, null, groups);
        } else {
            boolean hasVars = groups.stream().anyMatch(g -> !g.variables.isEmpty());
            out.open("interface");
            if (hasVars) varGroups(out, groups);
            interfaceAddData.run();
            out.close("interface");
        }
        body(out, accessor.body);
        out.empty("addData");
        out.close(element);
    }

    /** {@code <interface>}: optional leading content, then the non-empty variable groups. */
    private static void interfaceBlock(XmlOut out, Runnable leading, List<VarGroup> groups) {
        boolean hasVars = groups.stream().anyMatch(g -> !g.variables.isEmpty());
        if (leading == null && !hasVars) {
            out.empty("interface");
            return;
        }
        out.open("interface");
        if (leading != null) leading.run();
        varGroups(out, groups);
        out.close("interface");
    }

    private static void varGroups(XmlOut out, List<VarGroup> groups) {
        for (VarGroup g : groups) {
            if (g.variables.isEmpty()) continue;
            out.open(g.element, g.attrs);
            for (StVariable v : g.variables) {
                variable(out, v);
            }
            out.close(g.element);
        }
    }

    private static void variable(XmlOut out, StVariable v) {
        out.open("variable", "name", v.name);
        out.open("type");
        TypeElementRenderer.render(out, v.type);
        out.close("type");
        if (v.initialValue != null) {
            out.open("initialValue");
            out.empty("simpleValue", "value", v.initialValue);
            out.close("initialValue");
        }
        out.close("variable");
    }

    private static void body(XmlOut out, String text) {
        out.open("body");
        out.open("ST");
        out.text("xhtml", text, "xmlns", XHTML_NS);
        out.close("ST");
        out.close("body");
    }

    private static void projectStructure(XmlOut out, StFunctionBlock fb, String projectObjectId) {
        out.open("addData");
        out.open("data", "name", DATA_PROJECT_STRUCTURE, "handleUnknown", "discard");
        out.open("ProjectStructure");
        if (fb.methods.isEmpty() && fb.properties.isEmpty()) {
            out.empty("Object", "Name", fb.name, "ObjectId", projectObjectId);
        } else {
            out.open("Object", "Name", fb.name, "ObjectId", projectObjectId);
            for (StMethod m : fb.methods) {
                out.empty("Object", "Name", m.name, "ObjectId", m.objectId);
            }
            for (StProperty p : fb.properties) {
                out.empty("Object", "Name", p.name, "ObjectId", p.objectId);
            }
            out.close("Object");
        }
        out.close("ProjectStructure");
        out.close("data");
        out.close("addData");
    }

    private static final class VarGroup {
        final String element;
        final List<StVariable> variables;
        final String[] attrs;

        VarGroup(String element, Collection<StVariable> variables, String... attrs) {
            this.element = element;
            this.variables = List.copyOf(variables);
            this.attrs = attrs;
        }
    }
}
