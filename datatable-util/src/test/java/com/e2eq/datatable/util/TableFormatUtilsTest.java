package com.e2eq.datatable.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TableFormatUtilsTest {

    @Test
    public void testFormatBoolean() {
        assertEquals("Yes", TableFormatUtils.formatBoolean(true));
        assertEquals("No", TableFormatUtils.formatBoolean(false));
        assertEquals("No", TableFormatUtils.formatBoolean(null));
    }

    @Test
    public void testFormatEmptyValue() {
        assertEquals("hello", TableFormatUtils.formatEmptyValue("hello"));
        assertEquals("123", TableFormatUtils.formatEmptyValue(123));
        assertEquals("0", TableFormatUtils.formatEmptyValue(0));
        assertEquals(TableFormatUtils.NO_VALUE_PLACEHOLDER, TableFormatUtils.formatEmptyValue(""));
        assertEquals(TableFormatUtils.NO_VALUE_PLACEHOLDER, TableFormatUtils.formatEmptyValue(null));
        assertEquals("n/a", TableFormatUtils.formatEmptyValue(null, "n/a"));
    }

    @Test
    public void testBlankValue() {
        assertTrue(TableFormatUtils.isBlankValue(null));
        assertTrue(TableFormatUtils.isBlankValue(""));
        assertFalse(TableFormatUtils.isBlankValue(" "));
        assertFalse(TableFormatUtils.isBlankValue(Boolean.FALSE));
    }
}
