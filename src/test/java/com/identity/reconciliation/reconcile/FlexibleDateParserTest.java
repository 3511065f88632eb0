package com.identity.reconciliation.reconcile;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FlexibleDateParser Tests")
class FlexibleDateParserTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "2020-06-15T10:11:12Z, 2020-06-15",
            "2020-06-15 10:11:12, 2020-06-15",
            "2021-03-04T10:11:12.345Z, 2021-03-04",
            "2021-03-04T23:59:59.123456789Z, 2021-03-04",
            "2021-03-04 10:11:12.5, 2021-03-04",
            "2020-06-15 10:11, 2020-06-15",
            "2020-06-15 10, 2020-06-15",
            "2020-06-15, 2020-06-15",
            "2020-06, 2020-06-01",
            "2020, 2020-01-01",
            "'  2021-02-03  ', 2021-02-03"
    })
    @DisplayName("Should accept every supported format")
    void acceptedFormats(String input, String expected) {
        assertEquals(Optional.of(LocalDate.parse(expected)), FlexibleDateParser.parse(input));
    }

    @ParameterizedTest
    @ValueSource(strings = {"yesterday", "2020-13-01", "2021-02-30", "15/06/2020", "20200615", "2020-6-15", "2021-03-04 10:11.5"})
    @DisplayName("Should reject unsupported or invalid dates")
    void rejected(String input) {
        assertTrue(FlexibleDateParser.parse(input).isEmpty());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   "})
    @DisplayName("Should treat blank input as absent")
    void blank(String input) {
        assertTrue(FlexibleDateParser.parse(input).isEmpty());
        assertTrue(FlexibleDateParser.parse(null).isEmpty());
    }
}
