package com.e2eq.datatable.screen;

import com.e2eq.datatable.config.TableDefaults;
import com.e2eq.datatable.controller.FilterEvaluator;
import com.e2eq.datatable.controller.Paginator;
import com.e2eq.datatable.controller.SortDriver;
import com.e2eq.datatable.controller.TableModel;
import com.e2eq.datatable.model.PaginationMode;
import com.e2eq.datatable.model.PaginationState;
import com.e2eq.datatable.model.SortParameter;
import com.e2eq.datatable.model.SortState;
import com.e2eq.datatable.util.ValidateUtils;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Owns the view state of one list screen: filter values, sort, page, page size and selection.
 * <p>
 * A screen that does not want to keep this state itself creates one instance, applies its filters and sort
 * to its data source, and asks for a model per render with {@link #clientModel(List)} or
 * {@link #serverModel(List, int, int)}. The returned builders are already wired to the setters below, so a
 * gesture handled by the table controller lands here and is visible on the next render.
 * </p>
 * Changing a filter, clearing the filters or changing the page size goes back to page 1.
 *
 * @param <T>  the row type
 * @param <ID> the row identifier type
 */
public class TableScreenState<T, ID> {
   private static final Logger LOG = Logger.getLogger(TableScreenState.class);

   private final Function<T, ID> rowId;
   private final SelectAllScope selectAllScope;
   private final SortDriver sortDriver = new SortDriver();
   private final Paginator paginator = new Paginator();

   private final Map<String, Object> filterValues = new LinkedHashMap<>();
   private final Set<ID> selectedIds = new LinkedHashSet<>();
   private SortParameter sort;
   private int page = 1;
   private int pageSize;

   // rows and mode of the last model handed out; select-all works against them
   private List<T> currentRows = Collections.emptyList();
   private PaginationMode currentMode = PaginationMode.CLIENT;

   public TableScreenState(@NotNull Function<T, ID> rowId) {
      this(rowId, SelectAllScope.VISIBLE_PAGE, TableDefaults.fromConfig().getDefaultPageSize());
   }

   public TableScreenState(@NotNull Function<T, ID> rowId, @NotNull SelectAllScope selectAllScope, int pageSize) {
      ValidateUtils.nonNullCheck(rowId, "rowId");
      ValidateUtils.nonNullCheck(selectAllScope, "selectAllScope");
      ValidateUtils.positiveCheck(pageSize, "pageSize");
      this.rowId = rowId;
      this.selectAllScope = selectAllScope;
      this.pageSize = pageSize;
   }

   // ---- state transitions

   /**
    * Sets one filter. A null or empty value removes it.
    */
   public void onFilterChange(String key, @Nullable Object value) {
      if (FilterEvaluator.isActive(value)) {
         filterValues.put(key, value);
      } else {
         filterValues.remove(key);
      }
      page = 1;
   }

   public void onClearFilters() {
      filterValues.clear();
      page = 1;
   }

   public void onSort(String field) {
      sort = sortDriver.requestSort(sort, field);
      LOG.debugf("Sorting by %s", sort);
   }

   public void onPageChange(int newPage) {
      ValidateUtils.positiveCheck(newPage, "page");
      page = newPage;
   }

   public void onPageSizeChange(int newPageSize) {
      ValidateUtils.positiveCheck(newPageSize, "pageSize");
      pageSize = newPageSize;
      page = 1;
   }

   public void onSelectRow(ID id, boolean checked) {
      if (checked) {
         selectedIds.add(id);
      } else {
         selectedIds.remove(id);
      }
   }

   public void onSelectAll(boolean checked) {
      List<T> scope = selectAllScope == SelectAllScope.FILTERED_COLLECTION || currentMode == PaginationMode.SERVER
                         ? currentRows
                         : paginator.visibleRows(currentRows, paginationState(PaginationMode.CLIENT, null, null));
      for (T row : scope) {
         onSelectRow(rowId.apply(row), checked);
      }
   }

   public void clearSelection() {
      selectedIds.clear();
   }

   // ---- model assembly

   /**
    * @param filteredRows the whole collection after the screen applied {@link #getFilterValues()} and
    *                     {@link #getSort()}
    * @return a model builder with rows, filter, sort, selection and pagination state filled in; the page is
    * first brought back into range if the collection shrank
    */
   public TableModel.TableModelBuilder<T, ID> clientModel(List<T> filteredRows) {
      List<T> rows = filteredRows == null ? Collections.<T>emptyList() : filteredRows;
      int totalPages = paginator.totalPages(rows, paginationState(PaginationMode.CLIENT, null, null));
      int clamped = Paginator.clampPage(page, totalPages);
      if (clamped != page) {
         LOG.debugf("Page %d is out of range, moving to page %d of %d", page, clamped, totalPages);
         page = clamped;
      }
      currentRows = rows;
      currentMode = PaginationMode.CLIENT;
      return wired(rows, paginationState(PaginationMode.CLIENT, null, null));
   }

   /**
    * @param pageRows   exactly the rows of the current page as returned by the data source
    * @param total      the number of matching items reported by the data source
    * @param totalPages the number of pages reported by the data source
    * @return a model builder in server pagination mode; the reported totals are used as they are
    */
   public TableModel.TableModelBuilder<T, ID> serverModel(List<T> pageRows, int total, int totalPages) {
      List<T> rows = pageRows == null ? Collections.<T>emptyList() : pageRows;
      currentRows = rows;
      currentMode = PaginationMode.SERVER;
      return wired(rows, paginationState(PaginationMode.SERVER, total, totalPages));
   }

   private TableModel.TableModelBuilder<T, ID> wired(List<T> rows, PaginationState pagination) {
      return TableModel.<T, ID>builder()
                .rows(rows)
                .rowId(rowId)
                .filterValues(Collections.unmodifiableMap(new LinkedHashMap<>(filterValues)))
                .onFilterChange(this::onFilterChange)
                .onClearFilters(this::onClearFilters)
                .sortState(SortState.builder().current(sort).onSort(this::onSort).build())
                .selectedIds(Collections.unmodifiableSet(new LinkedHashSet<>(selectedIds)))
                .onSelectAll(this::onSelectAll)
                .onSelectRow(this::onSelectRow)
                .pagination(pagination);
   }

   private PaginationState paginationState(PaginationMode mode, Integer total, Integer totalPages) {
      return PaginationState.builder()
                .mode(mode)
                .page(page)
                .pageSize(pageSize)
                .total(total)
                .totalPages(totalPages)
                .onPageChange(this::onPageChange)
                .onPageSizeChange(this::onPageSizeChange)
                .build();
   }

   // ---- read access

   public Map<String, Object> getFilterValues() {
      return Collections.unmodifiableMap(filterValues);
   }

   public Set<ID> getSelectedIds() {
      return Collections.unmodifiableSet(selectedIds);
   }

   @Nullable
   public SortParameter getSort() {
      return sort;
   }

   public int getPage() {
      return page;
   }

   public int getPageSize() {
      return pageSize;
   }

   public SelectAllScope getSelectAllScope() {
      return selectAllScope;
   }
}
