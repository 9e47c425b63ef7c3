package com.e2eq.datatable.controller;

import com.e2eq.datatable.exceptions.TableExportException;
import com.e2eq.datatable.model.CsvExportSpec;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CsvExporterTest {

    private final CsvExporter exporter = new CsvExporter();

    private CsvExportSpec<Account> spec() {
        return CsvExportSpec.<Account>builder()
                .enabled(true)
                .filename("accounts.csv")
                .headers(List.of("Name", "Role", "Email"))
                .rowData(a -> Arrays.asList(a.getName(), a.getRole(), a.getEmail()))
                .build();
    }

    @Test
    public void testExportsEveryRow() throws TableExportException {
        String csv = exporter.export(List.of(
                new Account("1", "Alice", "ADMIN", "alice@example.com"),
                new Account("2", "Bob \"B\"", "USER", null)), spec());

        assertEquals("\"Name\",\"Role\",\"Email\"\n"
                + "\"Alice\",\"ADMIN\",\"alice@example.com\"\n"
                + "\"Bob \"\"B\"\"\",\"USER\",\"\"", csv);
    }

    @Test
    public void testNoRowsExportsHeaderOnly() throws TableExportException {
        assertEquals("\"Name\",\"Role\",\"Email\"", exporter.export(List.of(), spec()));
    }

    @Test
    public void testFailingRowAbortsWithRowNumber() {
        CsvExportSpec<Account> failing = CsvExportSpec.<Account>builder()
                .enabled(true)
                .filename("accounts.csv")
                .headers(List.of("Name"))
                .rowData(a -> {
                    if ("2".equals(a.getId())) {
                        throw new IllegalStateException("cannot convert");
                    }
                    return List.of(a.getName());
                })
                .build();

        TableExportException ex = assertThrows(TableExportException.class, () -> exporter.export(List.of(
                new Account("1", "Alice", "ADMIN", null),
                new Account("2", "Bob", "USER", null)), failing));
        assertEquals(2, ex.getRowNumber());
        assertEquals("accounts.csv", ex.getFilename());
        assertTrue(ex.getCause() instanceof IllegalStateException);
    }

    @Test
    public void testArityMismatchAborts() {
        CsvExportSpec<Account> wrong = CsvExportSpec.<Account>builder()
                .enabled(true)
                .filename("accounts.csv")
                .headers(List.of("Name", "Role"))
                .rowData(a -> List.of(a.getName()))
                .build();

        TableExportException ex = assertThrows(TableExportException.class,
                () -> exporter.export(List.of(new Account("1", "Alice", "ADMIN", null)), wrong));
        assertEquals(-1, ex.getRowNumber());
        assertTrue(ex.getCause() instanceof IllegalArgumentException);
    }
}
