package info.isaksson.erland.sttoplcopenxml.extract;

/** Lexical categories produced by {@link StLexer}. */
public enum StTokenKind {
    /** Identifier or keyword; keywords are not distinguished at the lexical level. */
    IDENT,
    NUMBER,
    /** Typed or based literal such as {@code T#5s}, {@code INT#-3} or {@code 16#FF}. */
    TYPED_LITERAL,
    STRING,
    /** A complete {@code {...}} pragma. */
    PRAGMA,
    SYMBOL,
    EOF
}
