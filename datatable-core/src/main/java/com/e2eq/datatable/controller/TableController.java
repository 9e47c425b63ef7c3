package com.e2eq.datatable.controller;

import com.e2eq.datatable.config.TableDefaults;
import com.e2eq.datatable.exceptions.TableExportException;
import com.e2eq.datatable.model.ActionDescriptor;
import com.e2eq.datatable.model.Column;
import com.e2eq.datatable.model.CsvExportSpec;
import com.e2eq.datatable.model.PaginationState;
import com.e2eq.datatable.model.SortState;
import com.e2eq.datatable.model.view.ActionView;
import com.e2eq.datatable.model.view.BodyState;
import com.e2eq.datatable.model.view.CellView;
import com.e2eq.datatable.model.view.ColumnHeaderView;
import com.e2eq.datatable.model.view.EmptyStateKind;
import com.e2eq.datatable.model.view.EmptyStateView;
import com.e2eq.datatable.model.view.PaginationView;
import com.e2eq.datatable.model.view.RowView;
import com.e2eq.datatable.model.view.TableView;
import com.e2eq.datatable.util.ExceptionLoggingUtils;
import com.e2eq.datatable.util.JSONUtils;
import com.e2eq.datatable.util.ValidateUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Shared presentation logic of every list screen.
 * <p>
 * {@link #render(TableModel)} derives the complete {@link TableView} from the screen's current state and
 * keeps nothing between calls. The interaction methods translate one user gesture into the matching change
 * request on the screen's callbacks; each gesture fires only its own callback, so clicking a row checkbox
 * or an action button never also counts as a row click. The screen applies the change and renders again.
 * </p>
 *
 * @param <T>  the row type
 * @param <ID> the row identifier type
 */
public class TableController<T, ID> {
   private static final Logger LOG = Logger.getLogger(TableController.class);

   private final TableDefaults defaults;
   private final FilterEvaluator filterEvaluator;
   private final Paginator paginator;
   private final SelectionTracker selectionTracker;
   private final CellResolver cellResolver;
   private final CsvExporter csvExporter;

   public TableController() {
      this(TableDefaults.fromConfig());
   }

   public TableController(TableDefaults defaults) {
      this(defaults, new FilterEvaluator(), new Paginator(), new SelectionTracker(), new CsvExporter());
   }

   public TableController(TableDefaults defaults, FilterEvaluator filterEvaluator, Paginator paginator,
                          SelectionTracker selectionTracker, CsvExporter csvExporter) {
      ValidateUtils.nonNullCheck(defaults, "defaults");
      this.defaults = defaults;
      this.filterEvaluator = filterEvaluator;
      this.paginator = paginator;
      this.selectionTracker = selectionTracker;
      this.cellResolver = new CellResolver(defaults.getPlaceholder());
      this.csvExporter = csvExporter;
   }

   public TableView<ID> render(TableModel<T, ID> model) {
      ValidateUtils.nonNullCheck(model, "model");
      ValidateUtils.nonNullCheck(model.getRowId(), "rowId");

      int activeFilters = filterEvaluator.activeFilterCount(model.getFilters(), model.getFilterValues());
      boolean actionsColumn = !model.getActions().isEmpty();
      int columnSpan = model.getColumns().size() + (model.isSelectionEnabled() ? 1 : 0) + (actionsColumn ? 1 : 0);

      TableView.TableViewBuilder<ID> view = TableView.<ID>builder()
                .title(model.getTitle())
                .exportAvailable(isExportEnabled(model))
                .filterBar(filterEvaluator.describe(model.getFilters(), model.getFilterValues(),
                   model.isShowFiltersHeading()))
                .columns(headers(model))
                .selectionEnabled(model.isSelectionEnabled())
                .actionsColumn(actionsColumn)
                .columnSpan(columnSpan);

      if (model.isLoading()) {
         return view.bodyState(BodyState.LOADING)
                   .loadingMessage(defaults.getLoadingMessage())
                   .build();
      }

      List<T> visible = paginator.visibleRows(model.getRows(), model.getPagination());

      if (model.isSelectionEnabled()) {
         view.selectAll(selectionTracker.selectAllState(visible, model.getRowId(), model.getSelectedIds()));
      }

      if (visible.isEmpty()) {
         view.bodyState(BodyState.EMPTY)
             .emptyState(emptyState(model, activeFilters, columnSpan));
      } else {
         view.bodyState(BodyState.ROWS)
             .rows(rows(model, visible));
      }

      if (model.getPagination() != null) {
         view.pagination(paginator.describe(model.getRows(), model.getPagination(), defaults.getPageSizeOptions(),
            model.getTotalWithoutFilters(), activeFilters > 0));
      }
      return view.build();
   }

   /**
    * Renders the model and serializes the view for front ends that draw the table themselves.
    * Null properties are left out.
    */
   public String renderJson(TableModel<T, ID> model) throws JsonProcessingException {
      return JSONUtils.instance().toJson(render(model));
   }

   // ---- interactions

   /**
    * A header was clicked. Emits {@code onSort(key)} for sortable columns when the screen sorts at all.
    */
   public void clickHeader(TableModel<T, ID> model, String columnKey) {
      SortState sortState = model.getSortState();
      Optional<Column<T>> column = model.getColumns().stream()
                                      .filter(c -> c.getKey().equals(columnKey))
                                      .findFirst();
      if (sortState == null || sortState.getOnSort() == null || column.isEmpty() || !column.get().isSortable()) {
         LOG.debugf("Ignoring header click on %s, column is not sortable", columnKey);
         return;
      }
      sortState.getOnSort().accept(columnKey);
   }

   public void changeFilter(TableModel<T, ID> model, String key, Object value) {
      if (model.getOnFilterChange() != null) {
         model.getOnFilterChange().accept(key, value);
      }
   }

   /**
    * Removing a chip requests exactly what clearing the filter's control requests.
    */
   public void removeChip(TableModel<T, ID> model, String key) {
      changeFilter(model, key, "");
   }

   public void clearFilters(TableModel<T, ID> model) {
      if (model.getOnClearFilters() != null) {
         model.getOnClearFilters().run();
      }
   }

   public void previousPage(TableModel<T, ID> model) {
      PaginationView footer = footer(model);
      if (footer == null || !footer.isPreviousEnabled()) {
         LOG.debug("Ignoring previous page request at the first page");
         return;
      }
      model.getPagination().getOnPageChange().accept(footer.getPage() - 1);
   }

   public void nextPage(TableModel<T, ID> model) {
      PaginationView footer = footer(model);
      if (footer == null || !footer.isNextEnabled()) {
         LOG.debug("Ignoring next page request at the last page");
         return;
      }
      model.getPagination().getOnPageChange().accept(footer.getPage() + 1);
   }

   /**
    * The screen is expected to go back to page 1 when it applies the new size.
    */
   public void changePageSize(TableModel<T, ID> model, int pageSize) {
      PaginationState pagination = model.getPagination();
      if (pagination == null || pagination.getOnPageSizeChange() == null) {
         LOG.debugf("Ignoring page size %d, the screen offers no page size selector", pageSize);
         return;
      }
      ValidateUtils.positiveCheck(pageSize, "pageSize");
      pagination.getOnPageSizeChange().accept(pageSize);
   }

   /**
    * Forwards the header checkbox. Whether this covers the visible page or more is the screen's policy.
    */
   public void toggleSelectAll(TableModel<T, ID> model, boolean checked) {
      if (model.isSelectionEnabled() && model.getOnSelectAll() != null) {
         model.getOnSelectAll().accept(checked);
      }
   }

   public void toggleRow(TableModel<T, ID> model, ID id, boolean checked) {
      if (model.isSelectionEnabled() && model.getOnSelectRow() != null) {
         model.getOnSelectRow().accept(id, checked);
      }
   }

   public void clickRow(TableModel<T, ID> model, T row) {
      if (model.getOnRowClick() != null) {
         model.getOnRowClick().accept(row);
      }
   }

   /**
    * Runs an action button of a row. Hidden and disabled actions are not clickable and are ignored.
    */
   public void clickAction(TableModel<T, ID> model, T row, int actionIndex) {
      List<ActionDescriptor<T>> actions = model.getActions();
      if (actionIndex < 0 || actionIndex >= actions.size()) {
         throw new IndexOutOfBoundsException("No action at index " + actionIndex + ", " + actions.size()
                                                + " defined");
      }
      ActionDescriptor<T> action = actions.get(actionIndex);
      if (!action.isVisibleFor(row) || action.isDisabledFor(row)) {
         LOG.debugf("Ignoring click on unavailable action %s", action.getLabel());
         return;
      }
      action.getOnClick().accept(row);
   }

   /**
    * Exports every row of the model, not just the visible page, and hands the file to the sink.
    *
    * @return the exported CSV text
    * @throws TableExportException if a row cannot be converted or the sink fails; nothing is delivered and
    *                              the export callback does not run
    * @throws IllegalStateException if the screen has not enabled CSV export
    */
   public String exportCsv(TableModel<T, ID> model, CsvDownloadSink sink) throws TableExportException {
      if (!isExportEnabled(model)) {
         throw new IllegalStateException("CSV export is not enabled for this table");
      }
      ValidateUtils.nonNullCheck(sink, "sink");
      CsvExportSpec<T> spec = model.getCsvExport();

      String content;
      try {
         content = csvExporter.export(model.getRows(), spec);
         sink.deliver(spec.getFilename(), CsvDownloadSink.CSV_MEDIA_TYPE, content);
      } catch (TableExportException e) {
         ExceptionLoggingUtils.logError(LOG, e, "CSV export of %s aborted", spec.getFilename());
         throw e;
      } catch (IOException e) {
         ExceptionLoggingUtils.logError(LOG, e, "Delivering %s failed", spec.getFilename());
         throw new TableExportException("Delivering " + spec.getFilename() + " failed", spec.getFilename(), e);
      }

      LOG.infof("Exported %d rows to %s", model.getRows().size(), spec.getFilename());
      if (spec.getOnExport() != null) {
         spec.getOnExport().run();
      }
      return content;
   }

   // ---- derivation helpers

   private boolean isExportEnabled(TableModel<T, ID> model) {
      return model.getCsvExport() != null && model.getCsvExport().isEnabled();
   }

   private PaginationView footer(TableModel<T, ID> model) {
      if (model.getPagination() == null || model.isLoading()) {
         return null;
      }
      PaginationView footer = paginator.describe(model.getRows(), model.getPagination(),
         defaults.getPageSizeOptions(), null, false);
      return footer.isVisible() ? footer : null;
   }

   private List<ColumnHeaderView> headers(TableModel<T, ID> model) {
      SortState sortState = model.getSortState();
      List<ColumnHeaderView> headers = new ArrayList<>(model.getColumns().size());
      for (Column<T> column : model.getColumns()) {
         boolean sorted = sortState != null && sortState.isSortedBy(column.getKey());
         headers.add(ColumnHeaderView.builder()
                        .key(column.getKey())
                        .header(column.getHeader())
                        .sortable(column.isSortable())
                        .sorted(sorted)
                        .direction(sorted ? sortState.getCurrent().getDirection() : null)
                        .width(column.getWidth())
                        .minWidth(column.getMinWidth())
                        .sticky(column.isSticky())
                        .build());
      }
      return headers;
   }

   private List<RowView<ID>> rows(TableModel<T, ID> model, List<T> visible) {
      List<RowView<ID>> rows = new ArrayList<>(visible.size());
      for (int i = 0; i < visible.size(); i++) {
         T row = visible.get(i);
         ID id = model.getRowId().apply(row);

         RowView.RowViewBuilder<ID> rowView = RowView.<ID>builder()
                   .id(id)
                   .index(i)
                   .selected(model.isSelectionEnabled() && selectionTracker.isSelected(id, model.getSelectedIds()))
                   .clickable(model.getOnRowClick() != null);

         if (model.getRowRenderer() != null) {
            rowView.customContent(model.getRowRenderer().apply(row, i));
         } else {
            List<CellView> cells = new ArrayList<>(model.getColumns().size());
            for (Column<T> column : model.getColumns()) {
               cells.add(cellResolver.resolve(column, row));
            }
            rowView.cells(cells);
            rowView.actions(actions(model.getActions(), row));
         }
         rows.add(rowView.build());
      }
      return rows;
   }

   private List<ActionView> actions(List<ActionDescriptor<T>> descriptors, T row) {
      List<ActionView> actions = new ArrayList<>();
      for (int i = 0; i < descriptors.size(); i++) {
         ActionDescriptor<T> action = descriptors.get(i);
         if (!action.isVisibleFor(row)) {
            continue;
         }
         actions.add(ActionView.builder()
                        .index(i)
                        .label(action.getLabel())
                        .icon(action.getIcon())
                        .colorHint(action.getColorHint() != null ? action.getColorHint()
                                      : defaults.getDefaultActionColor())
                        .disabled(action.isDisabledFor(row))
                        .build());
      }
      return actions;
   }

   private EmptyStateView emptyState(TableModel<T, ID> model, int activeFilters, int columnSpan) {
      if (model.getEmptyStateRenderer() != null) {
         return EmptyStateView.builder()
                   .kind(EmptyStateKind.CUSTOM)
                   .content(model.getEmptyStateRenderer().get())
                   .columnSpan(columnSpan)
                   .build();
      }
      if (activeFilters > 0 && paginator.totalItems(model.getRows(), model.getPagination()) == 0) {
         return EmptyStateView.builder()
                   .kind(EmptyStateKind.FILTERED)
                   .message(defaults.getFilteredEmptyMessage())
                   .hint(defaults.getFilteredEmptyHint())
                   .clearFiltersAvailable(true)
                   .columnSpan(columnSpan)
                   .build();
      }
      return EmptyStateView.builder()
                .kind(EmptyStateKind.GENERIC)
                .message(model.getEmptyMessage() != null ? model.getEmptyMessage() : defaults.getEmptyMessage())
                .columnSpan(columnSpan)
                .build();
   }
}
