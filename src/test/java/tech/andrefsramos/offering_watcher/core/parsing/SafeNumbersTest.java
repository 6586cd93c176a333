package tech.andrefsramos.offering_watcher.core.parsing;

import org.junit.jupiter.api.Test;

import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;

class SafeNumbersTest {

    @Test
    void parsesPlainAndSignedIntegers() {
        assertThat(SafeNumbers.tryParseInt("40")).hasValue(40);
        assertThat(SafeNumbers.tryParseInt(" 7 ")).hasValue(7);
        assertThat(SafeNumbers.tryParseInt("-3")).hasValue(-3);
        assertThat(SafeNumbers.tryParseInt("+12")).hasValue(12);
    }

    @Test
    void parsesPersianDigits() {
        assertThat(SafeNumbers.tryParseInt("۴۰")).hasValue(40);
    }

    @Test
    void invalidTextIsEmpty() {
        assertThat(SafeNumbers.tryParseInt("")).isEqualTo(OptionalInt.empty());
        assertThat(SafeNumbers.tryParseInt("-")).isEmpty();
        assertThat(SafeNumbers.tryParseInt("3a")).isEmpty();
        assertThat(SafeNumbers.tryParseInt(null)).isEmpty();
        assertThat(SafeNumbers.tryParseInt("99999999999")).isEmpty();
    }

    @Test
    void boundariesOfInt() {
        assertThat(SafeNumbers.tryParseInt("2147483647")).hasValue(Integer.MAX_VALUE);
        assertThat(SafeNumbers.tryParseInt("-2147483648")).hasValue(Integer.MIN_VALUE);
        assertThat(SafeNumbers.tryParseInt("2147483648")).isEmpty();
    }

    @Test
    void parseIntOrDefaultFallsBack() {
        assertThat(SafeNumbers.parseIntOrDefault("x", 0)).isZero();
        assertThat(SafeNumbers.parseIntOrDefault("5", 0)).isEqualTo(5);
    }

    @Test
    void nonNegativeIntegerAcceptsOnlyDigits() {
        assertThat(SafeNumbers.isNonNegativeInteger("12345")).isTrue();
        assertThat(SafeNumbers.isNonNegativeInteger("-1")).isFalse();
        assertThat(SafeNumbers.isNonNegativeInteger("کد درس")).isFalse();
        assertThat(SafeNumbers.isNonNegativeInteger("")).isFalse();
        assertThat(SafeNumbers.isNonNegativeInteger(null)).isFalse();
    }
}
