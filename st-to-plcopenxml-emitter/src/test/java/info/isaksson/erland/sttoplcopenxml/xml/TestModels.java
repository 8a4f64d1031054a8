package info.isaksson.erland.sttoplcopenxml.xml;

import info.isaksson.erland.sttoplcopenxml.model.ObjectIdAllocator;
import info.isaksson.erland.sttoplcopenxml.model.StAccessor;
import info.isaksson.erland.sttoplcopenxml.model.StArrayDimension;
import info.isaksson.erland.sttoplcopenxml.model.StAttribute;
import info.isaksson.erland.sttoplcopenxml.model.StFunctionBlock;
import info.isaksson.erland.sttoplcopenxml.model.StMethod;
import info.isaksson.erland.sttoplcopenxml.model.StProperty;
import info.isaksson.erland.sttoplcopenxml.model.StTypeRef;
import info.isaksson.erland.sttoplcopenxml.model.StVariable;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Hand-built models and DOM helpers shared by the writer tests. */
final class TestModels {

    private TestModels() {}

    /** Logger with one constant, two variables, one method and one property with an attribute. */
    static StFunctionBlock logger(ObjectIdAllocator ids) {
        Map<String, StVariable> constants = new LinkedHashMap<>();
        constants.put("cArrSize", new StVariable("cArrSize", StTypeRef.named("INT"), "100"));

        Map<String, StVariable> variables = new LinkedHashMap<>();
        variables.put("values", new StVariable("values",
                StTypeRef.array("ARRAY [1..cArrSize] OF REAL",
                        List.of(StArrayDimension.bounded("1", "cArrSize")), StTypeRef.named("REAL"))));
        variables.put("count", new StVariable("count", StTypeRef.named("INT"), "0"));

        StMethod log = new StMethod(ids.next(), "Log", null,
                List.of(new StVariable("msg", StTypeRef.named("REAL"))),
                List.of(), List.of(),
                List.of(),
                "IF count < cArrSize THEN\n  count := count + 1;\n  values[count] := msg;\nEND_IF");
        StMethod reset = new StMethod(ids.next(), "Reset", null,
                List.of(), List.of(), List.of(), List.of(), "count := 0;");

        StProperty countProp = new StProperty(ids.next(), "Count", StTypeRef.named("INT"),
                new StAttribute("monitoring", "call"),
                new StAccessor(List.of(), "Count := count;"), null);

        return new StFunctionBlock("Logger", constants, variables, List.of(), List.of(), List.of(),
                List.of(log, reset), List.of(countProp), "");
    }

    static StFunctionBlock empty(String name) {
        return new StFunctionBlock(name, null, null, null, null, null, null, null, null);
    }

    static Document parse(String xml) throws Exception {
        DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
        dbf.setNamespaceAware(true);
        // secure defaults
        try { dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true); } catch (Exception ignored) {}
        try { dbf.setFeature("http://xml.org/sax/features/external-general-entities", false); } catch (Exception ignored) {}
        try { dbf.setFeature("http://xml.org/sax/features/external-parameter-entities", false); } catch (Exception ignored) {}
        return dbf.newDocumentBuilder().parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
    }

    static List<Element> elements(Document doc, String tag) {
        NodeList nodes = doc.getElementsByTagName(tag);
        List<Element> out = new ArrayList<>();
        for (int i = 0; i < nodes.getLength(); i++) {
            out.add((Element) nodes.item(i));
        }
        return out;
    }

    static List<Element> childElements(Element parent) {
        List<Element> out = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            if (nodes.item(i) instanceof Element) out.add((Element) nodes.item(i));
        }
        return out;
    }

    /** The {@code xhtml} text under the first {@code body} child of {@code owner}. */
    static String bodyText(Element owner) {
        for (Element child : childElements(owner)) {
            if (child.getTagName().equals("body")) {
                return child.getElementsByTagName("xhtml").item(0).getTextContent();
            }
        }
        throw new AssertionError("no body under " + owner.getTagName());
    }
}
