package info.isaksson.erland.sttoplcopenxml.model;

/** Shape of a declared type expression. */
public enum StTypeKind {
    /** IEC elementary type such as {@code BOOL}, {@code INT} or {@code TIME}. */
    ELEMENTARY,
    /** {@code STRING} / {@code WSTRING}, optionally with a length. */
    STRING,
    /** Any other named type (structures, function blocks, library types). */
    DERIVED,
    ARRAY,
    POINTER,
    REFERENCE
}
