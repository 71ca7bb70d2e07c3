package io.tasklint.core.model;

import java.util.Arrays;
import java.util.Optional;

/** Declared type of a task parameter. */
public enum ParamType {
    STRING("string"),
    ARRAY("array");

    private final String wireName;

    ParamType(String wireName) {
        this.wireName = wireName;
    }

    /** The spelling used in task documents. */
    public String wireName() {
        return wireName;
    }

    /** Looks up a type by its document spelling (case-sensitive). */
    public static Optional<ParamType> fromWireName(String name) {
        return Arrays.stream(values()).filter(t -> t.wireName.equals(name)).findFirst();
    }
}
