package io.tasklint.core.error;

/** Classification of a {@link FieldError}. */
public enum ErrorKind {
    /** A required field is absent or empty. */
    MISSING_REQUIRED_FIELD,
    /** Two fields that exclude each other are both populated. */
    MUTUALLY_EXCLUSIVE_FIELDS_SET,
    /** A name that must be unique appears twice. */
    DUPLICATE_NAME,
    /** Two mounts resolve to the same path. */
    PATH_CONFLICT,
    /** A type name is not one of the recognized values. */
    INVALID_ENUM_VALUE,
    /** A default value does not carry the declared type. */
    TYPE_MISMATCH,
    /** A placeholder names a variable that is not declared. */
    UNRESOLVED_VARIABLE_REFERENCE,
    /** An array variable is referenced where only a whole-token reference is allowed. */
    ILLEGAL_ARRAY_SPLICE,
    /** A name fails DNS label syntax. */
    INVALID_NAME_SYNTAX,
    /** Any other rejected value (reserved mount paths and names, metadata). */
    INVALID_VALUE
}
