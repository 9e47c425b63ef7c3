package com.e2eq.datatable.util;

import org.apache.commons.lang3.StringUtils;
import org.supercsv.encoder.CsvEncoder;
import org.supercsv.io.CsvListWriter;
import org.supercsv.io.ICsvListWriter;
import org.supercsv.prefs.CsvPreference;
import org.supercsv.quote.AlwaysQuoteMode;
import org.supercsv.util.CsvContext;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

import static java.lang.String.format;

/**
 * Serializes header and row tuples into CSV text.
 * <p>
 * Every cell, header cells included, is wrapped in double quotes regardless of its content and embedded
 * quotes are doubled. Line breaks inside a cell are kept as they are. {@code null} cells become empty strings. Lines are separated by a single {@code \n}
 * and the last line carries no terminator, so the header row is always the first line of the result.
 * </p>
 */
public class CSVSerializer {

    public static final char QUOTE_CHAR = '"';
    public static final char FIELD_SEPARATOR = ',';
    public static final String LINE_SEPARATOR = "\n";

    private static final CSVSerializer instance = new CSVSerializer();

    private final CsvPreference preference;

    public CSVSerializer() {
        preference = new CsvPreference.Builder(QUOTE_CHAR, FIELD_SEPARATOR, LINE_SEPARATOR)
                .useQuoteMode(new AlwaysQuoteMode())
                .useEncoder(new QuoteDoublingEncoder())
                .build();
    }

    public static CSVSerializer instance() {
        return instance;
    }

    /**
     * @param headers the header row; its size is the arity every row must have
     * @param rows    the data rows, each holding one cell value per header
     * @return the CSV text, header first, without a trailing line separator
     * @throws IllegalArgumentException if a row does not have the same number of cells as the headers
     */
    public String serialize(List<String> headers, List<? extends List<?>> rows) {
        StringWriter out = new StringWriter();
        try {
            write(out, headers, rows);
        } catch (IOException e) {
            // StringWriter does not perform I/O
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    /**
     * Streams the CSV text for the given headers and rows to a writer. The writer is flushed but not closed.
     *
     * @param writer  destination of the CSV text
     * @param headers the header row
     * @param rows    the data rows
     * @throws IOException when the writer fails
     * @throws IllegalArgumentException if a row does not have the same number of cells as the headers
     */
    public void write(Writer writer, List<String> headers, List<? extends List<?>> rows) throws IOException {
        ValidateUtils.nonNullCheck(headers, "headers");
        List<? extends List<?>> data = rows == null ? List.of() : rows;
        checkArity(headers, data);

        if (headers.isEmpty()) {
            return;
        }

        StringWriter buffer = new StringWriter();
        ICsvListWriter listWriter = new CsvListWriter(buffer, preference);
        try {
            listWriter.write(toCells(headers));
            for (List<?> row : data) {
                listWriter.write(toCells(row));
            }
            listWriter.flush();
        } finally {
            listWriter.close();
        }

        String text = buffer.toString();
        if (text.endsWith(LINE_SEPARATOR)) {
            text = text.substring(0, text.length() - LINE_SEPARATOR.length());
        }
        writer.write(text);
        writer.flush();
    }

    private void checkArity(List<String> headers, List<? extends List<?>> rows) {
        for (int i = 0; i < rows.size(); i++) {
            List<?> row = rows.get(i);
            int size = row == null ? 0 : row.size();
            if (size != headers.size()) {
                throw new IllegalArgumentException(format("Row %d has %d cells but %d headers were supplied",
                        i + 1, size, headers.size()));
            }
        }
    }

    // Super CSV writes null columns unquoted, so nulls are turned into empty strings first
    private List<String> toCells(List<?> values) {
        List<String> cells = new ArrayList<>(values.size());
        for (Object value : values) {
            cells.add(value == null ? "" : String.valueOf(value));
        }
        return cells;
    }

    /**
     * Doubles the quote character and leaves every other character alone. Super CSV's default encoder also
     * normalizes line breaks inside a cell to the configured line separator, which would alter multi-line text.
     * Encoders are responsible for the surrounding quotes, so the quote mode is applied here.
     */
    static class QuoteDoublingEncoder implements CsvEncoder {

        @Override
        public String encode(String input, CsvContext context, CsvPreference preference) {
            String quote = String.valueOf(preference.getQuoteChar());
            String escaped = StringUtils.replace(input, quote, quote + quote);
            if (preference.getQuoteMode().quotesRequired(input, context, preference)) {
                return quote + escaped + quote;
            }
            return escaped;
        }
    }
}
