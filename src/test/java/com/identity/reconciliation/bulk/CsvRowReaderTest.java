package com.identity.reconciliation.bulk;

import com.identity.reconciliation.core.model.ChangeRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CsvRowReader Tests")
class CsvRowReaderTest {

    private final CsvRowReader reader = new CsvRowReader();

    private List<ChangeRow> read(String csv) throws IOException {
        return reader.read(new StringReader(csv));
    }

    @Nested
    @DisplayName("Parsing")
    class ParsingTests {

        @Test
        @DisplayName("Should key values by header and keep line numbers")
        void headerKeyed() throws IOException {
            List<ChangeRow> rows = read("identity_id,identity_name\n42,Jane\n43,John\n");

            assertEquals(2, rows.size());
            assertEquals("42", rows.get(0).get("identity_id"));
            assertEquals("Jane", rows.get(0).get("identity_name"));
            assertEquals(2, rows.get(0).lineNumber());
            assertEquals(3, rows.get(1).lineNumber());
        }

        @Test
        @DisplayName("Should handle quotes, embedded commas and doubled quotes")
        void quotedFields() throws IOException {
            List<ChangeRow> rows = read("id,name\r\n1,\"Doe, Jane \"\"JD\"\"\"\r\n");

            assertEquals("Doe, Jane \"JD\"", rows.get(0).get("name"));
        }

        @Test
        @DisplayName("Should keep line breaks inside quoted fields")
        void multilineField() throws IOException {
            List<ChangeRow> rows = read("id,name\n1,\"two\nlines\"\n2,after\n");

            assertEquals("two\nlines", rows.get(0).get("name"));
            assertEquals(2, rows.get(0).lineNumber());
            assertEquals(4, rows.get(1).lineNumber());
        }

        @Test
        @DisplayName("Should fill missing trailing values and skip blank lines")
        void shortRecordsAndBlankLines() throws IOException {
            List<ChangeRow> rows = read("a,b,c\n1\n\n2,x,y");

            assertEquals(2, rows.size());
            assertEquals("", rows.get(0).get("b"));
            assertEquals("", rows.get(0).get("c"));
            assertTrue(rows.get(0).values().containsKey("c"));
            assertEquals(4, rows.get(1).lineNumber());
        }

        @Test
        @DisplayName("Should keep an explicitly quoted empty value")
        void quotedEmpty() throws IOException {
            List<ChangeRow> rows = read("a\n\"\"\n");

            assertEquals(1, rows.size());
            assertEquals("", rows.get(0).get("a"));
        }

        @Test
        @DisplayName("Should strip a byte order mark from the header")
        void byteOrderMark() throws IOException {
            List<ChangeRow> rows = read("\uFEFFidentity_id\n1\n");

            assertEquals("1", rows.get(0).get("identity_id"));
        }

        @Test
        @DisplayName("Empty input should yield no rows")
        void emptyInput() throws IOException {
            assertTrue(read("").isEmpty());
            assertTrue(read("a,b\n").isEmpty());
        }
    }

    @Nested
    @DisplayName("Malformed input")
    class MalformedTests {

        @Test
        @DisplayName("Should reject an unterminated quote")
        void unterminatedQuote() {
            CsvFormatException e = assertThrows(CsvFormatException.class, () -> read("a\n\"open\n"));
            assertEquals(2, e.getLineNumber());
        }

        @Test
        @DisplayName("Should reject a record wider than the header")
        void tooManyFields() {
            CsvFormatException e = assertThrows(CsvFormatException.class, () -> read("a,b\n1,2,3\n"));
            assertEquals(2, e.getLineNumber());
        }
    }

    @Test
    @DisplayName("Should read a UTF-8 file")
    void readFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("ui.csv");
        Files.writeString(file, "identity_id,identity_name\n1,Zoë\n", StandardCharsets.UTF_8);

        List<ChangeRow> rows = reader.read(file);

        assertEquals("Zoë", rows.get(0).get("identity_name"));
    }
}
