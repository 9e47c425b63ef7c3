package com.e2eq.datatable.controller;

import com.e2eq.datatable.model.view.SelectAllState;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

public class SelectionTrackerTest {

    private final SelectionTracker tracker = new SelectionTracker();
    private final Function<String, String> identity = Function.identity();

    @Test
    public void testTriState() {
        List<String> visible = List.of("a", "b", "c");
        assertEquals(SelectAllState.UNCHECKED, tracker.selectAllState(visible, identity, Set.of()));
        assertEquals(SelectAllState.INDETERMINATE, tracker.selectAllState(visible, identity, Set.of("b")));
        assertEquals(SelectAllState.CHECKED, tracker.selectAllState(visible, identity, Set.of("a", "b", "c")));
    }

    @Test
    public void testSelectionOutsideVisiblePageIsIgnored() {
        List<String> visible = List.of("a", "b");
        assertEquals(SelectAllState.CHECKED, tracker.selectAllState(visible, identity, Set.of("a", "b", "z")));
        assertEquals(SelectAllState.UNCHECKED, tracker.selectAllState(visible, identity, Set.of("z")));
    }

    @Test
    public void testEmptyPageIsUnchecked() {
        assertEquals(SelectAllState.UNCHECKED, tracker.selectAllState(List.of(), identity, Set.of("a")));
    }

    @Test
    public void testIsSelected() {
        assertTrue(tracker.isSelected("a", Set.of("a")));
        assertFalse(tracker.isSelected("b", Set.of("a")));
        assertFalse(tracker.isSelected("a", null));
    }
}
