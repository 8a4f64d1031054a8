package info.isaksson.erland.sttoplcopenxml.extract;

import info.isaksson.erland.sttoplcopenxml.model.StArrayDimension;
import info.isaksson.erland.sttoplcopenxml.model.StTypeRef;
import info.isaksson.erland.sttoplcopenxml.model.StVariable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Parses {@code VAR ... END_VAR} sections, the declarations inside them and type expressions.
 *
 * <p>Declarations are token based, so an {@code ARRAY [..] OF T} type wrapped over several lines
 * is still one declaration. When the terminating {@code ;} is missing, a declaration also ends
 * where a later line starts a new {@code name :} declaration.</p>
 */
final class DeclarationParser {

    private static final Logger log = LoggerFactory.getLogger(DeclarationParser.class);

    /** Words that can never be a variable, method, property or type name. */
    static final Set<String> RESERVED = Set.of(
            "FUNCTION_BLOCK", "END_FUNCTION_BLOCK", "METHOD", "END_METHOD", "PROPERTY", "END_PROPERTY",
            "VAR", "VAR_INPUT", "VAR_OUTPUT", "VAR_IN_OUT", "VAR_TEMP", "VAR_INST", "VAR_STAT",
            "VAR_EXTERNAL", "VAR_GLOBAL", "VAR_CONFIG", "VAR_ACCESS", "END_VAR",
            "BEGIN", "CONSTANT", "RETAIN", "PERSISTENT", "NON_RETAIN",
            "ARRAY", "OF", "AT", "EXTENDS", "IMPLEMENTS"
    );

    private static final Set<String> QUALIFIERS = Set.of("CONSTANT", "RETAIN", "PERSISTENT", "NON_RETAIN");

    enum Section {
        /** {@code VAR CONSTANT} */
        CONSTANT,
        /** {@code VAR}, also with {@code RETAIN}/{@code PERSISTENT} */
        LOCAL,
        INPUT,
        OUTPUT,
        IN_OUT,
        TEMP,
        INST,
        /** {@code VAR_STAT}, {@code VAR_EXTERNAL}, {@code VAR_GLOBAL}, {@code VAR_CONFIG}, {@code VAR_ACCESS}; skipped. */
        OTHER
    }

    static final class SectionResult {
        final Section kind;
        final String keyword;
        final List<StVariable> variables;
        /** Index of the first token after the section. */
        final int next;
        final int line;

        SectionResult(Section kind, String keyword, List<StVariable> variables, int next, int line) {
            this.kind = kind;
            this.keyword = keyword;
            this.variables = List.copyOf(variables);
            this.next = next;
            this.line = line;
        }
    }

    static final class TypeResult {
        final StTypeRef type;
        final int next;

        TypeResult(StTypeRef type, int next) {
            this.type = type;
            this.next = next;
        }
    }

    private final TokenStream ts;
    private final ExtractionWarnings warnings;

    DeclarationParser(TokenStream ts, ExtractionWarnings warnings) {
        this.ts = ts;
        this.warnings = warnings;
    }

    boolean isIdentifier(int i) {
        return ts.isKind(i, StTokenKind.IDENT) && i < ts.eof() && !RESERVED.contains(ts.get(i).upper());
    }

    /** Section kind starting at token {@code i}, or null when no section starts there. */
    Section sectionAt(int i) {
        if (!ts.isKind(i, StTokenKind.IDENT) || i >= ts.eof()) return null;
        String kw = ts.get(i).upper();
        switch (kw) {
            case "VAR": {
                int j = i + 1;
                while (isQualifier(j)) {
                    if (ts.isKeyword(j, "CONSTANT")) return Section.CONSTANT;
                    j++;
                }
                return Section.LOCAL;
            }
            case "VAR_INPUT":
                return Section.INPUT;
            case "VAR_OUTPUT":
                return Section.OUTPUT;
            case "VAR_IN_OUT":
                return Section.IN_OUT;
            case "VAR_TEMP":
                return Section.TEMP;
            case "VAR_INST":
                return Section.INST;
            case "VAR_STAT":
            case "VAR_EXTERNAL":
            case "VAR_GLOBAL":
            case "VAR_CONFIG":
            case "VAR_ACCESS":
                return Section.OTHER;
            default:
                return null;
        }
    }

    /**
     * Parse the section starting at {@code start}. The section ends at its {@code END_VAR}; when that
     * is missing, at the next section keyword, {@code BEGIN} or {@code stop}.
     */
    SectionResult parseSection(int start, int stop) {
        Section kind = sectionAt(start);
        String keyword = ts.get(start).text;
        int line = ts.get(start).line;

        int j = start + 1;
        while (isQualifier(j)) j++;

        int end = j;
        while (end < stop && !ts.isKeyword(end, "END_VAR") && sectionAt(end) == null && !ts.isKeyword(end, "BEGIN")) {
            end++;
        }
        int next;
        if (end < stop && ts.isKeyword(end, "END_VAR")) {
            next = end + 1;
        } else {
            warnings.warn(ExtractionWarning.MISSING_END_VAR,
                    "Section " + keyword + " is not closed by END_VAR", line, "section", keyword);
            next = end;
        }

        if (kind == Section.OTHER) {
            warnings.warn(ExtractionWarning.UNSUPPORTED_SECTION,
                    "Section " + keyword + " is not supported and was skipped", line, "section", keyword);
            return new SectionResult(kind, keyword, List.of(), next, line);
        }

        List<StVariable> vars = parseDeclarations(j, end);
        log.trace("Section {} at line {}: {} declaration(s)", keyword, line, vars.size());
        return new SectionResult(kind, keyword, vars, next, line);
    }

    List<StVariable> parseDeclarations(int from, int to) {
        List<StVariable> out = new ArrayList<>();
        int i = from;
        while (i < to) {
            StToken t = ts.get(i);
            if (t.kind == StTokenKind.PRAGMA || t.isSymbol(";")) {
                i++;
                continue;
            }
            int next = isIdentifier(i) ? parseDeclaration(i, to, out) : -1;
            if (next > i) {
                i = next;
                continue;
            }
            int skipTo = skipDeclaration(i, to);
            warnings.warn(ExtractionWarning.UNRECOGNIZED_DECLARATION,
                    "Skipped unrecognized declaration '" + abbreviate(ts.sliceTokens(i, skipTo)) + "'", t.line);
            i = skipTo;
        }
        return out;
    }

    /**
     * {@code name[, name] [AT %addr] : type [:= init] [;]}. Adds the variables to {@code out} and
     * returns the index after the declaration, or -1 when the tokens are not a declaration.
     */
    private int parseDeclaration(int start, int to, List<StVariable> out) {
        List<String> names = new ArrayList<>();
        int j = start;
        names.add(ts.get(j).text);
        j++;
        while (j + 1 < to && ts.isSymbol(j, ",") && isIdentifier(j + 1)) {
            names.add(ts.get(j + 1).text);
            j += 2;
        }
        if (ts.isKeyword(j, "AT")) {
            while (j < to && !ts.isSymbol(j, ":")) j++;
        }
        if (j >= to || !ts.isSymbol(j, ":")) return -1;

        TypeResult type = parseType(j + 1, to);
        if (type == null) return -1;
        j = type.next;

        String init = null;
        if (j < to && ts.isSymbol(j, ":=")) {
            int e = initializerEnd(j + 1, to);
            init = ts.sliceTokens(j + 1, e);
            j = e;
        } else if (j < to && !ts.isSymbol(j, ";") && !startsDeclarationOnNewLine(j)) {
            // Trailing arguments such as "fbTimer : TON(PT := T#1S);" are not modelled.
            int e = initializerEnd(j, to);
            log.trace("Ignoring '{}' after type {} at line {}", ts.sliceTokens(j, e), type.type.raw, ts.get(j).line);
            j = e;
        }
        if (j < to && ts.isSymbol(j, ";")) j++;

        for (String n : names) {
            out.add(new StVariable(n, type.type, init));
        }
        return j;
    }

    /** End (exclusive) of an initializer: {@code ;} at bracket depth 0, or a new declaration line. */
    private int initializerEnd(int from, int to) {
        int depth = 0;
        int k = from;
        while (k < to) {
            StToken t = ts.get(k);
            if (depth == 0 && (t.isSymbol(";") || (k > from && startsDeclarationOnNewLine(k)))) {
                break;
            }
            if (t.isSymbol("(") || t.isSymbol("[")) depth++;
            if (t.isSymbol(")") || t.isSymbol("]")) depth = Math.max(0, depth - 1);
            k++;
        }
        return k;
    }

    private int skipDeclaration(int from, int to) {
        int k = from + 1;
        while (k < to) {
            if (ts.isSymbol(k, ";")) return k + 1;
            if (startsDeclarationOnNewLine(k)) return k;
            k++;
        }
        return to;
    }

    private boolean startsDeclarationOnNewLine(int k) {
        return ts.startsLine(k) && isIdentifier(k)
                && (ts.isSymbol(k + 1, ":") || ts.isSymbol(k + 1, ",") || ts.isKeyword(k + 1, "AT"));
    }

    /** Parse a type expression starting at {@code start}; null when no type starts there. */
    TypeResult parseType(int start, int to) {
        if (start >= to || !ts.isKind(start, StTokenKind.IDENT)) return null;
        StToken t = ts.get(start);
        String kw = t.upper();

        if ("ARRAY".equals(kw)) {
            return parseArray(start, to);
        }
        if (("POINTER".equals(kw) || "REFERENCE".equals(kw)) && ts.isKeyword(start + 1, "TO")) {
            TypeResult base = parseType(start + 2, to);
            if (base == null) return null;
            String raw = raw(start, base.next);
            StTypeRef ref = "POINTER".equals(kw) ? StTypeRef.pointer(raw, base.type) : StTypeRef.reference(raw, base.type);
            return new TypeResult(ref, base.next);
        }
        if (RESERVED.contains(kw)) return null;

        if (StTypeRef.isStringName(kw) && (ts.isSymbol(start + 1, "(") || ts.isSymbol(start + 1, "["))) {
            int close = matching(start + 1, to);
            if (close > 0) {
                String length = ts.sliceTokens(start + 2, close).trim();
                return new TypeResult(StTypeRef.string(raw(start, close + 1), kw, length), close + 1);
            }
        }

        StringBuilder name = new StringBuilder(t.text);
        int k = start + 1;
        while (k + 1 < to && ts.isSymbol(k, ".") && ts.isKind(k + 1, StTokenKind.IDENT)) {
            name.append('.').append(ts.get(k + 1).text);
            k += 2;
        }
        return new TypeResult(StTypeRef.named(name.toString()), k);
    }

    private TypeResult parseArray(int start, int to) {
        int k = start + 1;
        List<StArrayDimension> dims = new ArrayList<>();
        if (ts.isSymbol(k, "[")) {
            int close = matching(k, to);
            if (close < 0) return null;
            dims = parseDimensions(k + 1, close);
            k = close + 1;
        }
        if (k < to && ts.isKeyword(k, "OF")) {
            TypeResult base = parseType(k + 1, to);
            if (base != null) {
                return new TypeResult(StTypeRef.array(raw(start, base.next), dims, base.type), base.next);
            }
        }
        String raw = raw(start, k);
        warnings.warn(ExtractionWarning.ARRAY_WITHOUT_ELEMENT_TYPE,
                "Array type without element type kept as named type '" + raw + "'", ts.get(start).line);
        return new TypeResult(StTypeRef.derived(raw), k);
    }

    private List<StArrayDimension> parseDimensions(int from, int to) {
        List<StArrayDimension> out = new ArrayList<>();
        int depth = 0;
        int segStart = from;
        for (int k = from; k <= to; k++) {
            boolean atEnd = k == to;
            if (!atEnd) {
                StToken t = ts.get(k);
                if (t.isSymbol("(") || t.isSymbol("[")) depth++;
                if (t.isSymbol(")") || t.isSymbol("]")) depth = Math.max(0, depth - 1);
                if (!(depth == 0 && t.isSymbol(","))) continue;
            }
            out.add(parseDimension(segStart, k));
            segStart = k + 1;
        }
        return out;
    }

    private StArrayDimension parseDimension(int from, int to) {
        int depth = 0;
        for (int k = from; k < to; k++) {
            StToken t = ts.get(k);
            if (t.isSymbol("(") || t.isSymbol("[")) depth++;
            if (t.isSymbol(")") || t.isSymbol("]")) depth = Math.max(0, depth - 1);
            if (depth == 0 && t.isSymbol("..") && k > from && k < to - 1) {
                return StArrayDimension.bounded(ts.sliceTokens(from, k), ts.sliceTokens(k + 1, to));
            }
        }
        String raw = ts.sliceTokens(from, to);
        warnings.warn(ExtractionWarning.UNBOUNDED_DIMENSION,
                "Array dimension '" + raw + "' has no lower..upper bounds; kept as written", ts.get(from).line,
                "dimension", raw);
        return StArrayDimension.unbounded(raw);
    }

    /** Index of the bracket closing the one at {@code open}, or -1 before {@code to}. */
    private int matching(int open, int to) {
        String o = ts.get(open).text;
        String c = "(".equals(o) ? ")" : "]";
        int depth = 0;
        for (int k = open; k < to; k++) {
            if (ts.isSymbol(k, o)) depth++;
            if (ts.isSymbol(k, c)) {
                depth--;
                if (depth == 0) return k;
            }
        }
        return -1;
    }

    private boolean isQualifier(int i) {
        return ts.isKind(i, StTokenKind.IDENT) && i < ts.eof() && QUALIFIERS.contains(ts.get(i).upper());
    }

    /** Type text with line breaks and runs of blanks collapsed. */
    private String raw(int from, int to) {
        return ts.sliceTokens(from, to).replaceAll("\\s+", " ").trim();
    }

    static String abbreviate(String s) {
        String oneLine = s == null ? "" : s.replaceAll("\\s+", " ").trim();
        return oneLine.length() > 60 ? oneLine.substring(0, 57) + "..." : oneLine;
    }
}
