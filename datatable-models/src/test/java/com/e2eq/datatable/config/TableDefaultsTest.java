package com.e2eq.datatable.config;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TableDefaultsTest {

    @Test
    public void testConfiguredDefaults() {
        TableDefaults defaults = TableDefaults.fromConfig();

        assertEquals(20, defaults.getDefaultPageSize());
        assertEquals(List.of(10, 20, 50, 100), defaults.getPageSizeOptions());
        assertEquals("No data found", defaults.getEmptyMessage());
        assertEquals("No data matches your filters", defaults.getFilteredEmptyMessage());
        assertEquals("Loading...", defaults.getLoadingMessage());
        assertEquals("—", defaults.getPlaceholder());
        assertEquals("blue", defaults.getDefaultActionColor());
    }

    @Test
    public void testFromConfigIsCached() {
        assertSame(TableDefaults.fromConfig(), TableDefaults.fromConfig());
    }

    @Test
    public void testBuilderOverrides() {
        TableDefaults defaults = TableDefaults.builder()
                                   .defaultPageSize(50)
                                   .emptyMessage("No suppliers yet")
                                   .build();

        assertEquals(50, defaults.getDefaultPageSize());
        assertEquals("No suppliers yet", defaults.getEmptyMessage());
        assertEquals(TableDefaults.DEFAULT_PAGE_SIZE_OPTIONS, defaults.getPageSizeOptions());
        assertEquals("Try adjusting your filters or clear them to see all data", defaults.getFilteredEmptyHint());
    }
}
