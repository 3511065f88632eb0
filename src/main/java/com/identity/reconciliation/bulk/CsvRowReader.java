package com.identity.reconciliation.bulk;

import com.identity.reconciliation.core.model.ChangeRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PushbackReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a change file into ordered {@link ChangeRow}s.
 *
 * <p>Expected CSV format:</p>
 * <pre>
 * identity_id,identity_name,user_email
 * 42,"Doe, Jane",admin@example.com
 * </pre>
 *
 * <p>The first record is the header and names the columns. Fields may be quoted; inside
 * quotes a doubled quote stands for one quote, and commas and line breaks are literal.
 * Missing trailing fields read as empty strings; blank lines are skipped. Each row keeps
 * the line number its record starts on.</p>
 */
public class CsvRowReader {
    private static final Logger log = LoggerFactory.getLogger(CsvRowReader.class);
    private static final char SEPARATOR = ',';
    private static final char QUOTE = '"';
    private static final char BOM = '\uFEFF';

    /**
     * Reads a UTF-8 file.
     */
    public List<ChangeRow> read(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            List<ChangeRow> rows = read(reader);
            log.info("csv.read file={} rows={}", path, rows.size());
            return rows;
        }
    }

    /**
     * Reads all records from the reader. The reader is not closed.
     *
     * @throws CsvFormatException if a quoted field is not terminated or a record has more
     *                            fields than the header
     */
    public List<ChangeRow> read(Reader reader) throws IOException {
        List<Record> records = parse(reader);
        if (records.isEmpty()) {
            return List.of();
        }
        List<String> header = new ArrayList<>(records.get(0).fields());
        if (!header.isEmpty() && !header.get(0).isEmpty() && header.get(0).charAt(0) == BOM) {
            header.set(0, header.get(0).substring(1));
        }
        log.debug("csv.header columns={}", header);

        List<ChangeRow> rows = new ArrayList<>(records.size() - 1);
        for (Record record : records.subList(1, records.size())) {
            List<String> fields = record.fields();
            if (fields.size() > header.size()) {
                throw new CsvFormatException("record has " + fields.size() + " fields but the header has "
                        + header.size(), record.line());
            }
            Map<String, String> values = new LinkedHashMap<>();
            for (int i = 0; i < header.size(); i++) {
                values.put(header.get(i), i < fields.size() ? fields.get(i) : "");
            }
            rows.add(new ChangeRow(record.line(), values));
        }
        return rows;
    }

    private List<Record> parse(Reader source) throws IOException {
        PushbackReader in = new PushbackReader(
                source instanceof BufferedReader b ? b : new BufferedReader(source), 1);
        List<Record> records = new ArrayList<>();
        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean inQuotes = false;
        boolean quoted = false;
        long line = 1;
        long recordLine = 1;
        long quoteLine = 1;

        int c;
        while ((c = in.read()) != -1) {
            char ch = (char) c;
            if (inQuotes) {
                if (ch == QUOTE) {
                    int next = in.read();
                    if (next == QUOTE) {
                        field.append(QUOTE);
                    } else {
                        inQuotes = false;
                        if (next != -1) {
                            in.unread(next);
                        }
                    }
                } else {
                    if (ch == '\n') {
                        line++;
                    }
                    field.append(ch);
                }
                continue;
            }
            switch (ch) {
                case QUOTE -> {
                    if (field.length() == 0 && !quoted) {
                        inQuotes = true;
                        quoted = true;
                        quoteLine = line;
                    } else {
                        field.append(ch);
                    }
                }
                case SEPARATOR -> {
                    fields.add(field.toString());
                    field.setLength(0);
                    quoted = false;
                }
                case '\r', '\n' -> {
                    if (ch == '\r') {
                        int next = in.read();
                        if (next != '\n' && next != -1) {
                            in.unread(next);
                        }
                    }
                    fields.add(field.toString());
                    field.setLength(0);
                    addRecord(records, recordLine, fields, quoted);
                    fields = new ArrayList<>();
                    quoted = false;
                    line++;
                    recordLine = line;
                }
                default -> field.append(ch);
            }
        }
        if (inQuotes) {
            throw new CsvFormatException("unterminated quoted field", quoteLine);
        }
        if (field.length() > 0 || !fields.isEmpty() || quoted) {
            fields.add(field.toString());
            addRecord(records, recordLine, fields, quoted);
        }
        return records;
    }

    private static void addRecord(List<Record> records, long line, List<String> fields, boolean quoted) {
        boolean blank = fields.size() == 1 && fields.get(0).isEmpty() && !quoted;
        if (!blank) {
            records.add(new Record(line, fields));
        }
    }

    private record Record(long line, List<String> fields) {
    }
}
