package io.tasklint.core.model;

/**
 * A declared task parameter.
 *
 * @param name         parameter name
 * @param type         declared type as written ({@code "string"} or {@code "array"} when valid)
 * @param description  free-form description, may be null
 * @param defaultValue default value, or null when the parameter is required
 */
public record ParamSpec(String name, String type, String description, ParamValue defaultValue) {

    public ParamSpec {
        name = name != null ? name : "";
        type = type != null ? type : "";
    }

    public static ParamSpec string(String name) {
        return new ParamSpec(name, ParamType.STRING.wireName(), null, null);
    }

    public static ParamSpec array(String name) {
        return new ParamSpec(name, ParamType.ARRAY.wireName(), null, null);
    }

    /** Returns {@code true} if the declared type is {@code array}. */
    public boolean isArray() {
        return ParamType.ARRAY.wireName().equals(type);
    }
}
