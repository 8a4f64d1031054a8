package info.isaksson.erland.sttoplcopenxml.extract;

import info.isaksson.erland.sttoplcopenxml.model.ObjectIdAllocator;
import info.isaksson.erland.sttoplcopenxml.model.StAccessor;
import info.isaksson.erland.sttoplcopenxml.model.StAttribute;
import info.isaksson.erland.sttoplcopenxml.model.StFunctionBlock;
import info.isaksson.erland.sttoplcopenxml.model.StMethod;
import info.isaksson.erland.sttoplcopenxml.model.StProperty;
import info.isaksson.erland.sttoplcopenxml.model.StTypeRef;
import info.isaksson.erland.sttoplcopenxml.model.StVariable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds an {@link StFunctionBlock} from one Structured Text source.
 *
 * <p>One instance parses one text. Every recovery is recorded in the supplied
 * {@link ExtractionWarnings}; the parser itself never throws on malformed input.</p>
 */
final class StParser {

    private static final Logger log = LoggerFactory.getLogger(StParser.class);

    private static final Set<String> MODIFIERS = Set.of(
            "PUBLIC", "PRIVATE", "PROTECTED", "INTERNAL", "ABSTRACT", "FINAL");

    private static final Pattern ATTRIBUTE = Pattern.compile(
            "^\\{\\s*attribute\\s+(['\"])(.*?)\\1\\s*:=\\s*(['\"])(.*?)\\3\\s*}$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private final TokenStream ts;
    private final DeclarationParser decls;
    private final ExtractionWarnings warnings;
    private final ObjectIdAllocator allocator;

    private final Map<String, StVariable> constants = new LinkedHashMap<>();
    private final Map<String, StVariable> variables = new LinkedHashMap<>();
    private final List<StVariable> inputs = new ArrayList<>();
    private final List<StVariable> outputs = new ArrayList<>();
    private final List<StVariable> inOuts = new ArrayList<>();
    private final List<StMethod> methods = new ArrayList<>();
    private final List<StProperty> properties = new ArrayList<>();

    StParser(String text, ObjectIdAllocator allocator, ExtractionWarnings warnings) {
        this.ts = new TokenStream(text);
        this.warnings = warnings;
        this.allocator = allocator;
        this.decls = new DeclarationParser(ts, warnings);
    }

    StFunctionBlock parse() {
        String name = StFunctionBlock.DEFAULT_NAME;
        int headerEnd;
        int fbIndex = ts.indexOfKeyword(0, ts.eof(), "FUNCTION_BLOCK");
        if (fbIndex < 0) {
            warnings.warn(ExtractionWarning.NO_FUNCTION_BLOCK,
                    "No FUNCTION_BLOCK declaration found; using name " + StFunctionBlock.DEFAULT_NAME, 1);
            headerEnd = 0;
        } else {
            int i = skipModifiers(fbIndex + 1);
            if (decls.isIdentifier(i)) {
                name = ts.get(i).text;
                i++;
            } else {
                warnings.warn(ExtractionWarning.MISSING_FUNCTION_BLOCK_NAME,
                        "FUNCTION_BLOCK has no name; using " + StFunctionBlock.DEFAULT_NAME, ts.get(fbIndex).line);
            }
            if (ts.isKeyword(i, "EXTENDS")) {
                i = skipQualifiedName(i + 1);
            }
            if (ts.isKeyword(i, "IMPLEMENTS")) {
                i = skipQualifiedName(i + 1);
                while (ts.isSymbol(i, ",")) {
                    i = skipQualifiedName(i + 1);
                }
            }
            if (ts.isSymbol(i, ";")) i++;
            headerEnd = i;
        }
        log.debug("Function block '{}' (declaration at token {})", name, fbIndex);

        int boundary = nextBoundary(headerEnd);
        int headerOffset = headerEnd == 0 ? 0 : ts.get(headerEnd - 1).end;
        String body = scanDeclarationsAndBody(headerEnd, headerOffset, boundary, null, this::acceptFunctionBlockSection);

        int i = boundary;
        while (i < ts.eof()) {
            if (ts.isKeyword(i, "METHOD")) {
                int end = nextBoundary(i + 1);
                parseMethod(i, end);
                i = end;
            } else if (isPropertyDeclaration(i)) {
                int end = nextBoundary(i + 1);
                parseProperty(i, end);
                i = end;
            } else if (ts.isKeyword(i, "FUNCTION_BLOCK")) {
                warnings.warn(ExtractionWarning.MULTIPLE_FUNCTION_BLOCKS,
                        "Only the first FUNCTION_BLOCK is converted; the rest of the text is ignored", ts.get(i).line);
                break;
            } else {
                i++;
            }
        }

        return new StFunctionBlock(name, constants, variables, inputs, outputs, inOuts, methods, properties, body);
    }

    private void acceptFunctionBlockSection(DeclarationParser.SectionResult section) {
        switch (section.kind) {
            case CONSTANT:
                section.variables.forEach(v -> constants.put(v.name, v));
                break;
            case LOCAL:
                section.variables.forEach(v -> variables.put(v.name, v));
                break;
            case INPUT:
                inputs.addAll(section.variables);
                break;
            case OUTPUT:
                outputs.addAll(section.variables);
                break;
            case IN_OUT:
                inOuts.addAll(section.variables);
                break;
            case OTHER:
                // already reported while parsing the section
                break;
            default:
                warnings.warn(ExtractionWarning.UNSUPPORTED_SECTION,
                        "Section " + section.keyword + " is not supported on a function block and was skipped",
                        section.line, "section", section.keyword);
        }
    }

    private void parseMethod(int start, int end) {
        int i = skipModifiers(start + 1);
        if (!decls.isIdentifier(i) || i >= end) {
            warnings.warn(ExtractionWarning.METHOD_WITHOUT_NAME, "METHOD without a name was skipped", ts.get(start).line);
            return;
        }
        String name = ts.get(i).text;
        i++;

        StTypeRef returnType = null;
        if (ts.isSymbol(i, ":")) {
            DeclarationParser.TypeResult rt = decls.parseType(i + 1, end);
            if (rt != null) {
                returnType = rt.type;
                i = rt.next;
            } else {
                i++;
            }
        }
        if (ts.isSymbol(i, ";")) i++;

        List<StVariable> in = new ArrayList<>();
        List<StVariable> out = new ArrayList<>();
        List<StVariable> inOut = new ArrayList<>();
        List<StVariable> locals = new ArrayList<>();
        String body = scanDeclarationsAndBody(i, ts.get(i - 1).end, end, "END_METHOD", section -> {
            switch (section.kind) {
                case INPUT:
                    in.addAll(section.variables);
                    break;
                case OUTPUT:
                    out.addAll(section.variables);
                    break;
                case IN_OUT:
                    inOut.addAll(section.variables);
                    break;
                default:
                    locals.addAll(section.variables);
            }
        });

        String id = allocator.next();
        methods.add(new StMethod(id, name, returnType, in, out, inOut, locals, body));
        log.debug("Method {} ({} in, {} out, {} local)", name, in.size(), out.size(), locals.size());
    }

    private void parseProperty(int start, int end) {
        int i = skipModifiers(start + 1);
        int line = ts.get(start).line;
        if (!decls.isIdentifier(i) || i >= end) {
            warnings.warn(ExtractionWarning.PROPERTY_WITHOUT_NAME, "PROPERTY without a name was skipped", line);
            return;
        }
        String name = ts.get(i).text;
        i++;
        DeclarationParser.TypeResult type = ts.isSymbol(i, ":") ? decls.parseType(i + 1, end) : null;
        if (type == null) {
            warnings.warn(ExtractionWarning.PROPERTY_WITHOUT_TYPE,
                    "PROPERTY " + name + " has no type and was skipped", line, "property", name);
            return;
        }

        StAttribute attribute = findAttribute(start, end, name);

        List<Integer> accessorStarts = new ArrayList<>();
        for (int k = type.next; k < end; k++) {
            if (isAccessor(k)) accessorStarts.add(k);
        }

        StAccessor getter = null;
        StAccessor setter = null;
        for (int a = 0; a < accessorStarts.size(); a++) {
            int at = accessorStarts.get(a);
            int accessorEnd = a + 1 < accessorStarts.size() ? accessorStarts.get(a + 1) : end;
            boolean isGet = ts.isKeyword(at + 1, "GET");
            if ((isGet && getter != null) || (!isGet && setter != null)) {
                warnings.warn(ExtractionWarning.DUPLICATE_ACCESSOR,
                        "PROPERTY " + name + " declares " + ts.get(at + 1).upper() + " more than once; the first one is used",
                        ts.get(at).line, "property", name);
                continue;
            }
            List<StVariable> locals = new ArrayList<>();
            String body = scanDeclarationsAndBody(at + 2, ts.get(at + 1).end, accessorEnd, "END_PROPERTY",
                    section -> locals.addAll(section.variables));
            StAccessor accessor = new StAccessor(locals, body);
            if (isGet) {
                getter = accessor;
            } else {
                setter = accessor;
            }
        }

        String id = allocator.next();
        properties.add(new StProperty(id, name, type.type, attribute, getter, setter));
        log.debug("Property {} : {} (getter={}, setter={})", name, type.type.raw, getter != null, setter != null);
    }

    private StAttribute findAttribute(int from, int to, String property) {
        StAttribute found = null;
        for (int k = from; k < to; k++) {
            if (!ts.isKind(k, StTokenKind.PRAGMA)) continue;
            Matcher m = ATTRIBUTE.matcher(ts.get(k).text.trim());
            if (!m.matches()) continue;
            if (found == null) {
                found = new StAttribute(m.group(2), m.group(4));
            } else {
                warnings.warn(ExtractionWarning.DUPLICATE_ATTRIBUTE,
                        "PROPERTY " + property + " has more than one attribute pragma; only the first is kept",
                        ts.get(k).line, "property", property);
            }
        }
        return found;
    }

    /**
     * Walks {@code [from, limit)} collecting declaration sections into {@code sink} and returns the body.
     *
     * <p>With {@code endKeyword} set, the region is cut at the last occurrence of that keyword.
     * Text after {@code BEGIN} is the body when present. Otherwise the body is whatever text
     * remains once the declaration sections are removed, with pragma-only pieces dropped.</p>
     */
    private String scanDeclarationsAndBody(int from, int fromOffset, int limit, String endKeyword,
                                           Consumer<DeclarationParser.SectionResult> sink) {
        int stop = limit;
        if (endKeyword != null) {
            int last = ts.lastIndexOfKeyword(from, limit, endKeyword);
            if (last >= 0) stop = last;
        }
        int stopOffset = ts.get(stop).start;

        List<String> segments = new ArrayList<>();
        int segmentStart = from;
        int cursor = fromOffset;
        int i = from;
        while (i < stop) {
            if (decls.sectionAt(i) != null) {
                addSegment(segments, segmentStart, i, cursor, ts.get(i).start);
                DeclarationParser.SectionResult section = decls.parseSection(i, stop);
                sink.accept(section);
                i = section.next;
                segmentStart = i;
                cursor = ts.get(i - 1).end;
            } else if (ts.isKeyword(i, "BEGIN")) {
                return ts.slice(ts.get(i).end, stopOffset).strip();
            } else {
                i++;
            }
        }
        addSegment(segments, segmentStart, stop, cursor, stopOffset);
        return String.join("\n", segments);
    }

    private void addSegment(List<String> segments, int fromToken, int toToken, int fromOffset, int toOffset) {
        boolean hasCode = false;
        for (int k = fromToken; k < toToken; k++) {
            if (!ts.isKind(k, StTokenKind.PRAGMA)) {
                hasCode = true;
                break;
            }
        }
        if (!hasCode) return;
        String text = ts.slice(fromOffset, toOffset).strip();
        if (!text.isEmpty()) segments.add(text);
    }

    /** First member start, {@code END_FUNCTION_BLOCK} or further {@code FUNCTION_BLOCK} at or after {@code from}. */
    private int nextBoundary(int from) {
        for (int k = from; k < ts.eof(); k++) {
            if (ts.isKeyword(k, "METHOD") || isPropertyDeclaration(k)
                    || ts.isKeyword(k, "END_FUNCTION_BLOCK") || ts.isKeyword(k, "FUNCTION_BLOCK")) {
                return k;
            }
        }
        return ts.eof();
    }

    private boolean isPropertyDeclaration(int i) {
        return ts.isKeyword(i, "PROPERTY") && !isAccessor(i);
    }

    /** {@code PROPERTY GET} / {@code PROPERTY SET}, unless GET/SET is itself a property name. */
    private boolean isAccessor(int i) {
        return ts.isKeyword(i, "PROPERTY")
                && (ts.isKeyword(i + 1, "GET") || ts.isKeyword(i + 1, "SET"))
                && !ts.isSymbol(i + 2, ":");
    }

    /**
     * Skips access and inheritance modifiers. The name may follow on a new line, unless that line
     * reads as a statement, in which case the modifier word is itself the name.
     */
    private int skipModifiers(int i) {
        while (ts.isKind(i, StTokenKind.IDENT) && MODIFIERS.contains(ts.get(i).upper())
                && decls.isIdentifier(i + 1) && (!ts.startsLine(i + 1) || !startsStatement(i + 1))) {
            i++;
        }
        return i;
    }

    private boolean startsStatement(int i) {
        return ts.isSymbol(i + 1, ":=") || ts.isSymbol(i + 1, ".") || ts.isSymbol(i + 1, "[")
                || ts.isSymbol(i + 1, "(") || ts.isSymbol(i + 1, ";");
    }

    private int skipQualifiedName(int i) {
        if (!ts.isKind(i, StTokenKind.IDENT)) return i;
        i++;
        while (ts.isSymbol(i, ".") && ts.isKind(i + 1, StTokenKind.IDENT)) {
            i += 2;
        }
        return i;
    }
}
