package com.e2eq.datatable.controller;

import com.e2eq.datatable.model.SortParameter;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SortDriverTest {

    private final SortDriver driver = new SortDriver();

    @Test
    public void testFirstRequestSortsAscending() {
        assertEquals(SortParameter.ascending("name"), driver.requestSort(null, "name"));
    }

    @Test
    public void testSameFieldFlipsDirection() {
        SortParameter desc = driver.requestSort(SortParameter.ascending("name"), "name");
        assertEquals(SortParameter.descending("name"), desc);
        assertEquals(SortParameter.ascending("name"), driver.requestSort(desc, "name"));
    }

    @Test
    public void testOtherFieldStartsAscending() {
        assertEquals(SortParameter.ascending("email"), driver.requestSort(SortParameter.descending("name"), "email"));
    }

    @Test
    public void testBlankFieldRejected() {
        assertThrows(IllegalArgumentException.class, () -> driver.requestSort(null, ""));
    }
}
