package com.e2eq.datatable.util;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CSVSerializerTest {

    private final CSVSerializer serializer = CSVSerializer.instance();

    @Test
    public void testQuotesEveryCellAndEscapesQuotes() {
        String csv = serializer.serialize(List.of("A", "B"),
                List.of(List.of("x", "y,z"), Arrays.asList(null, "a\"b")));

        assertEquals("\"A\",\"B\"\n\"x\",\"y,z\"\n\"\",\"a\"\"b\"", csv);
    }

    @Test
    public void testHeaderOnlyWhenNoRows() {
        assertEquals("\"Name\",\"Owner\"", serializer.serialize(List.of("Name", "Owner"), List.of()));
        assertEquals("\"Name\"", serializer.serialize(List.of("Name"), null));
    }

    @Test
    public void testNumbersAndMixedValues() {
        String csv = serializer.serialize(List.of("Name", "Age", "City"),
                List.<List<?>>of(Arrays.asList("John Doe", 30, "New York"),
                        Arrays.asList("Jane Smith", null, "London"),
                        Arrays.asList("Bob \"Builder\"", 40, "Paris")));

        String[] lines = csv.split("\n");
        assertEquals(4, lines.length);
        assertEquals("\"Name\",\"Age\",\"City\"", lines[0]);
        assertEquals("\"Jane Smith\",\"\",\"London\"", lines[2]);
        assertEquals("\"Bob \"\"Builder\"\"\",\"40\",\"Paris\"", lines[3]);
        assertFalse(csv.endsWith("\n"));
    }

    @Test
    public void testLineBreaksInsideCellsAreKept() {
        String csv = serializer.serialize(List.of("Notes"), List.of(List.of("a\r\nb"), List.of("c\rd"), List.of("e\nf")));

        assertEquals("\"Notes\"\n\"a\r\nb\"\n\"c\rd\"\n\"e\nf\"", csv);
    }

    @Test
    public void testEmptyAndPaddedCellsAreQuotedUnchanged() {
        assertEquals("\"A\",\"B\"\n\"\",\" x \"", serializer.serialize(List.of("A", "B"), List.of(List.of("", " x "))));
    }

    @Test
    public void testRowArityMismatchIsRejected() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> serializer.serialize(List.of("A", "B"), List.of(List.of("only-one"))));
        assertTrue(ex.getMessage().contains("Row 1"));
    }

    @Test
    public void testEmptyHeadersProduceEmptyText() {
        assertEquals("", serializer.serialize(List.of(), List.of()));
    }

    @Test
    public void testWriteStreamsSameContent() throws IOException {
        StringWriter writer = new StringWriter();
        serializer.write(writer, List.of("Quote"), List.of(List.of("He said \"Hello\"")));
        assertEquals("\"Quote\"\n\"He said \"\"Hello\"\"\"", writer.toString());
    }
}
