package io.tasklint.core.model;

import java.util.List;

/**
 * A parameter value tagged with its own type: either a string or an array of strings.
 *
 * @param type        {@code "string"} or {@code "array"}; kept as written so that mismatches can
 *                    be reported
 * @param stringValue the value when {@code type} is string, otherwise {@code ""}
 * @param arrayValue  the value when {@code type} is array, otherwise empty
 */
public record ParamValue(String type, String stringValue, List<String> arrayValue) {

    public ParamValue {
        type = type != null ? type : "";
        stringValue = stringValue != null ? stringValue : "";
        arrayValue = arrayValue != null ? List.copyOf(arrayValue) : List.of();
    }

    public static ParamValue ofString(String value) {
        return new ParamValue(ParamType.STRING.wireName(), value, List.of());
    }

    public static ParamValue ofArray(List<String> values) {
        return new ParamValue(ParamType.ARRAY.wireName(), "", values);
    }
}
