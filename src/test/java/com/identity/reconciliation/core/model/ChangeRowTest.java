package com.identity.reconciliation.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ChangeRow and DateRange Tests")
class ChangeRowTest {

    @Test
    @DisplayName("Absent columns should read as empty")
    void absentColumns() {
        ChangeRow row = ChangeRow.of(Map.of("identity_id", " 42 "));

        assertEquals(" 42 ", row.get("identity_id"));
        assertEquals("42", row.trimmed("identity_id"));
        assertEquals("", row.get("identity_name"));
        assertTrue(row.has("identity_id"));
        assertFalse(row.has("identity_name"));
    }

    @Test
    @DisplayName("Should keep column order and be immutable")
    void orderAndImmutability() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("b", "2");
        values.put("a", "1");
        ChangeRow row = new ChangeRow(3, values);
        values.put("c", "3");

        assertEquals(List.of("b", "a"), List.copyOf(row.values().keySet()));
        assertThrows(UnsupportedOperationException.class, () -> row.values().put("x", "y"));
        assertEquals("line 3 {b=2, a=1}", row.toString());
    }

    @Test
    @DisplayName("Missing range boundaries should become sentinels")
    void sentinels() {
        DateRange range = DateRange.of(LocalDate.of(2020, 6, 15), null);

        assertEquals(LocalDate.of(2020, 6, 15), range.start());
        assertEquals(DateRange.OPEN_END, range.end());
        assertEquals(new DateRange(DateRange.OPEN_START, DateRange.OPEN_END), DateRange.open());
        assertThrows(NullPointerException.class, () -> new DateRange(null, DateRange.OPEN_END));
    }
}
