package com.e2eq.datatable.screen;

import com.e2eq.datatable.config.TableDefaults;
import com.e2eq.datatable.controller.TableController;
import com.e2eq.datatable.controller.TableModel;
import com.e2eq.datatable.model.Column;
import com.e2eq.datatable.model.PaginationMode;
import com.e2eq.datatable.model.SortParameter;
import com.e2eq.datatable.model.view.SelectAllState;
import com.e2eq.datatable.model.view.TableView;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

public class TableScreenStateTest {

    private final TableController<String, String> controller = new TableController<>(TableDefaults.builder().build());
    private final List<Column<String>> columns =
            List.of(Column.<String>builder().key("value").header("Value").accessor(Function.identity()).build());

    private static List<String> items(int count) {
        return IntStream.rangeClosed(1, count).mapToObj(i -> "item-" + i).collect(Collectors.toList());
    }

    private TableScreenState<String, String> state(SelectAllScope scope) {
        return new TableScreenState<>(Function.identity(), scope, 10);
    }

    @Test
    public void testPagingRoundTripThroughController() {
        TableScreenState<String, String> state = state(SelectAllScope.VISIBLE_PAGE);
        TableModel<String, String> model = state.clientModel(items(25)).columns(columns).build();

        controller.nextPage(model);
        assertEquals(2, state.getPage());

        TableView<String> view = controller.render(state.clientModel(items(25)).columns(columns).build());
        assertEquals("item-11", view.getRows().get(0).getId());
        assertEquals("Showing 11 to 20 of 25 items", view.getPagination().getSummary());
    }

    @Test
    public void testFilterChangeResetsPageAndEmptyValueRemovesKey() {
        TableScreenState<String, String> state = state(SelectAllScope.VISIBLE_PAGE);
        state.onPageChange(3);

        state.onFilterChange("q", "item");
        assertEquals(1, state.getPage());
        assertEquals("item", state.getFilterValues().get("q"));

        state.onPageChange(2);
        state.onFilterChange("q", "");
        assertEquals(1, state.getPage());
        assertFalse(state.getFilterValues().containsKey("q"));

        state.onFilterChange("archived", false);
        assertEquals(Boolean.FALSE, state.getFilterValues().get("archived"));
        state.onClearFilters();
        assertTrue(state.getFilterValues().isEmpty());
    }

    @Test
    public void testPageSizeChangeResetsPage() {
        TableScreenState<String, String> state = state(SelectAllScope.VISIBLE_PAGE);
        state.onPageChange(4);
        state.onPageSizeChange(50);
        assertEquals(1, state.getPage());
        assertEquals(50, state.getPageSize());
    }

    @Test
    public void testShrinkingCollectionClampsPage() {
        TableScreenState<String, String> state = state(SelectAllScope.VISIBLE_PAGE);
        state.onPageChange(5);

        TableModel<String, String> model = state.clientModel(items(12)).columns(columns).build();
        assertEquals(2, state.getPage());
        assertEquals(2, model.getPagination().getPage());
    }

    @Test
    public void testServerModelKeepsReportedTotals() {
        TableScreenState<String, String> state = state(SelectAllScope.VISIBLE_PAGE);
        state.onPageChange(7);

        TableModel<String, String> model = state.serverModel(items(10), 45, 3).columns(columns).build();
        assertEquals(PaginationMode.SERVER, model.getPagination().getMode());
        assertEquals(7, model.getPagination().getPage());
        assertEquals(Integer.valueOf(45), model.getPagination().getTotal());
    }

    @Test
    public void testSortTogglesThroughHeaderClicks() {
        TableScreenState<String, String> state = state(SelectAllScope.VISIBLE_PAGE);

        controller.clickHeader(state.clientModel(items(3)).columns(columns).build(), "value");
        assertEquals(SortParameter.ascending("value"), state.getSort());

        controller.clickHeader(state.clientModel(items(3)).columns(columns).build(), "value");
        assertEquals(SortParameter.descending("value"), state.getSort());
    }

    @Test
    public void testSelectAllVisiblePage() {
        TableScreenState<String, String> state = state(SelectAllScope.VISIBLE_PAGE);
        TableModel<String, String> model = state.clientModel(items(25)).columns(columns).selectionEnabled(true)
                                                .build();

        controller.toggleSelectAll(model, true);
        assertEquals(10, state.getSelectedIds().size());
        assertTrue(state.getSelectedIds().contains("item-10"));
        assertFalse(state.getSelectedIds().contains("item-11"));

        TableView<String> view = controller.render(state.clientModel(items(25)).columns(columns)
                                                       .selectionEnabled(true).build());
        assertEquals(SelectAllState.CHECKED, view.getSelectAll());

        controller.toggleRow(state.clientModel(items(25)).columns(columns).selectionEnabled(true).build(),
                "item-3", false);
        view = controller.render(state.clientModel(items(25)).columns(columns).selectionEnabled(true).build());
        assertEquals(SelectAllState.INDETERMINATE, view.getSelectAll());

        state.onSelectAll(false);
        assertTrue(state.getSelectedIds().isEmpty());
    }

    @Test
    public void testSelectAllFilteredCollection() {
        TableScreenState<String, String> state = state(SelectAllScope.FILTERED_COLLECTION);
        state.clientModel(items(25));

        state.onSelectAll(true);
        assertEquals(25, state.getSelectedIds().size());

        state.onSelectRow("item-1", false);
        assertEquals(24, state.getSelectedIds().size());
        state.clearSelection();
        assertEquals(Set.of(), state.getSelectedIds());
    }

    @Test
    public void testInvalidConstructionRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new TableScreenState<String, String>(Function.identity(), SelectAllScope.VISIBLE_PAGE, 0));
        assertThrows(IllegalArgumentException.class,
                () -> new TableScreenState<String, String>(null, SelectAllScope.VISIBLE_PAGE, 10));
    }
}
