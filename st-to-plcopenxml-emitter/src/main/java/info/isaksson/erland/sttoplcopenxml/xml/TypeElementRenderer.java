package info.isaksson.erland.sttoplcopenxml.xml;

import info.isaksson.erland.sttoplcopenxml.model.StArrayDimension;
import info.isaksson.erland.sttoplcopenxml.model.StTypeRef;

import java.util.Locale;
import java.util.Map;

/**
 * Renders an {@link StTypeRef} as the content of a PLCopen {@code <type>} or {@code <baseType>}.
 */
final class TypeElementRenderer {

    /** Long IEC names whose PLCopen element uses the short form. */
    private static final Map<String, String> ELEMENT_ALIASES = Map.of(
            "TIME_OF_DAY", "TOD",
            "DATE_AND_TIME", "DT"
    );

    private TypeElementRenderer() {}

    static void render(XmlOut out, StTypeRef type) {
        switch (type.kind) {
            case ELEMENTARY:
                out.empty(ELEMENT_ALIASES.getOrDefault(type.name, type.name));
                break;
            case STRING: {
                String element = type.name.toLowerCase(Locale.ROOT);
                if (type.length != null) {
                    out.empty(element, "length", type.length);
                } else {
                    out.empty(element);
                }
                break;
            }
            case ARRAY:
                out.open("array");
                for (StArrayDimension d : type.dimensions) {
                    if (d.isBounded()) {
                        out.empty("dimension", "lower", d.lower, "upper", d.upper);
                    } else {
                        out.text("dimension", d.raw);
                    }
                }
                baseType(out, type.baseType);
                out.close("array");
                break;
            case POINTER:
            case REFERENCE:
                out.open("pointer");
                baseType(out, type.baseType);
                out.close("pointer");
                break;
            default:
                out.empty("derived", "name", type.name);
        }
    }

    private static void baseType(XmlOut out, StTypeRef base) {
        out.open("baseType");
        render(out, base);
        out.close("baseType");
    }
}
