package com.e2eq.datatable.controller;

import com.e2eq.datatable.model.ActionDescriptor;
import com.e2eq.datatable.model.Column;
import com.e2eq.datatable.model.CsvExportSpec;
import com.e2eq.datatable.model.FilterDefinition;
import com.e2eq.datatable.model.PaginationState;
import com.e2eq.datatable.model.SortState;
import lombok.Builder;
import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Everything a list screen hands to the table for one render: its rows, its configuration, its current
 * filter, sort, pagination and selection state, and the callbacks through which the table requests changes.
 * The screen owns all of this state; the table only reads it.
 *
 * @param <T>  the row type
 * @param <ID> the row identifier type
 */
@Getter
@Builder(toBuilder = true)
public class TableModel<T, ID> {

   private final String title;

   /** the whole filtered collection in client mode, exactly the current page in server mode */
   @Builder.Default
   private final List<T> rows = Collections.emptyList();

   @Builder.Default
   private final List<Column<T>> columns = Collections.emptyList();

   private final boolean loading;

   /** generic empty message; the configured default applies when null */
   private final String emptyMessage;

   @Builder.Default
   private final List<FilterDefinition> filters = Collections.emptyList();

   @Builder.Default
   private final Map<String, Object> filterValues = Collections.emptyMap();

   private final BiConsumer<String, Object> onFilterChange;

   private final Runnable onClearFilters;

   @Builder.Default
   private final boolean showFiltersHeading = true;

   private final SortState sortState;

   private final boolean selectionEnabled;

   @Builder.Default
   private final Set<ID> selectedIds = Collections.emptySet();

   private final Consumer<Boolean> onSelectAll;

   private final BiConsumer<ID, Boolean> onSelectRow;

   /** must return an identifier that is stable and unique within one snapshot of rows */
   private final Function<T, ID> rowId;

   private final PaginationState pagination;

   @Builder.Default
   private final List<ActionDescriptor<T>> actions = Collections.emptyList();

   private final CsvExportSpec<T> csvExport;

   private final Consumer<T> onRowClick;

   private final Supplier<?> emptyStateRenderer;

   /** replaces the default cells of each row with its own output; receives the row and its page index */
   private final BiFunction<T, Integer, ?> rowRenderer;

   /** the size of the collection before filtering, when the screen knows it */
   private final Integer totalWithoutFilters;
}
