package io.tasklint.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FieldError")
class FieldErrorTest {

    @Test
    void factoriesProduceCanonicalMessages() {
        assertThat(FieldError.missingField("steps").message()).isEqualTo("missing field(s)");
        assertThat(FieldError.invalidValue(ErrorKind.DUPLICATE_NAME, "foo", "name").message())
                .isEqualTo("invalid value: foo");
        assertThat(FieldError.multipleOneOf(ErrorKind.MUTUALLY_EXCLUSIVE_FIELDS_SET, "a", "b").message())
                .isEqualTo("expected exactly one, got both");
    }

    @Test
    void viaFieldPrefixesEveryPath() {
        FieldError error = FieldError.multipleOneOf(ErrorKind.MUTUALLY_EXCLUSIVE_FIELDS_SET, "a", "b.c")
                .viaField("spec");

        assertThat(error.paths()).containsExactly("spec.a", "spec.b.c");
    }

    @Test
    void viaFieldTurnsCurrentFieldIntoPrefix() {
        FieldError error = FieldError.missingField(FieldError.CURRENT_FIELD).viaField("metadata");

        assertThat(error.paths()).containsExactly("metadata");
    }

    @Test
    void viaFieldKeepsKindAndDetails() {
        FieldError error = FieldError.of(ErrorKind.INVALID_NAME_SYNTAX, "bad", "name")
                .withDetails("hint")
                .viaField("steps");

        assertThat(error.kind()).isEqualTo(ErrorKind.INVALID_NAME_SYNTAX);
        assertThat(error.details()).isEqualTo("hint");
    }

    @Test
    void toStringJoinsPathsAndAppendsDetails() {
        FieldError plain = FieldError.multipleOneOf(ErrorKind.MUTUALLY_EXCLUSIVE_FIELDS_SET, "a", "b");
        FieldError detailed = FieldError.of(ErrorKind.INVALID_NAME_SYNTAX, "invalid value \"X\"", "name")
                .withDetails("use lower case");

        assertThat(plain).hasToString("expected exactly one, got both: a, b");
        assertThat(detailed).hasToString("invalid value \"X\": name\nuse lower case");
    }

    @Test
    void quoteEscapesSpecialCharacters() {
        assertThat(FieldError.quote("plain")).isEqualTo("\"plain\"");
        assertThat(FieldError.quote("a\"b\\c\nd\te")).isEqualTo("\"a\\\"b\\\\c\\nd\\te\"");
    }

    @Test
    void pathReturnsFirstPath() {
        assertThat(FieldError.of(ErrorKind.PATH_CONFLICT, "m", "x", "y").path()).isEqualTo("x");
    }
}
