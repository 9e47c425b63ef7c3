package com.e2eq.datatable.controller;

import com.e2eq.datatable.model.PaginationState;
import com.e2eq.datatable.model.view.PaginationView;
import com.e2eq.datatable.util.ValidateUtils;
import com.google.common.math.IntMath;
import com.google.common.primitives.Ints;

import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Computes the visible slice and the pagination footer.
 * <p>
 * Client mode slices the full collection locally. Server mode trusts the rows to be exactly the current
 * page and renders the caller's totals verbatim. In both modes an out of range page is left as it is;
 * only the previous and next affordances are disabled at the boundaries.
 * </p>
 */
public class Paginator {

   /**
    * @return the rows of the current page; the rows unchanged when there is no pagination or in server mode
    */
   public <T> List<T> visibleRows(List<T> rows, PaginationState state) {
      List<T> all = rows == null ? List.of() : rows;
      if (state == null || state.isServerMode()) {
         return all;
      }
      checkState(state);

      long from = (long) (state.getPage() - 1) * state.getPageSize();
      if (from >= all.size()) {
         return List.of();
      }
      int to = (int) Math.min(from + state.getPageSize(), all.size());
      return all.subList((int) from, to);
   }

   public int totalItems(List<?> rows, PaginationState state) {
      if (state != null && state.isServerMode()) {
         return state.getTotal() == null ? 0 : state.getTotal();
      }
      return rows == null ? 0 : rows.size();
   }

   /**
    * @return {@code max(1, ceil(n / pageSize))} in client mode, the supplied total (at least 1) in server mode
    */
   public int totalPages(List<?> rows, PaginationState state) {
      if (state == null) {
         return 1;
      }
      if (state.isServerMode()) {
         Integer totalPages = state.getTotalPages();
         return totalPages == null || totalPages < 1 ? 1 : totalPages;
      }
      checkState(state);
      int size = rows == null ? 0 : rows.size();
      return Math.max(1, IntMath.divide(size, state.getPageSize(), RoundingMode.CEILING));
   }

   /**
    * @param rows               the rows given to the table
    * @param state              the pagination input
    * @param defaultOptions     page size choices used when the state does not carry its own
    * @param totalWithoutFilters the unfiltered total known to the screen, may be null
    * @param filtersActive      whether at least one filter is active
    * @return the footer view; not visible when everything fits on one page
    */
   public PaginationView describe(List<?> rows, PaginationState state, List<Integer> defaultOptions,
                                  Integer totalWithoutFilters, boolean filtersActive) {
      checkState(state);
      int page = state.getPage();
      int pageSize = state.getPageSize();
      int totalItems = totalItems(rows, state);
      int totalPages = totalPages(rows, state);

      int showingFrom = Ints.saturatedCast((long) (page - 1) * pageSize + 1);
      int showingTo = Ints.saturatedCast(Math.min((long) page * pageSize, totalItems));

      boolean selector = state.getOnPageSizeChange() != null;
      List<Integer> options = new ArrayList<>();
      if (selector) {
         options.addAll(state.getPageSizeOptions() != null ? state.getPageSizeOptions() : defaultOptions);
      }

      String note = null;
      if (filtersActive && totalWithoutFilters != null) {
         note = "(" + totalWithoutFilters + " total without filters)";
      }

      return PaginationView.builder()
                .visible(totalPages > 1)
                .mode(state.getMode())
                .page(page)
                .pageSize(pageSize)
                .totalItems(totalItems)
                .totalPages(totalPages)
                .showingFrom(showingFrom)
                .showingTo(showingTo)
                .summary("Showing " + showingFrom + " to " + showingTo + " of " + totalItems + " items")
                .pageLabel("Page " + page + " of " + totalPages)
                .previousEnabled(page != 1)
                .nextEnabled(page < totalPages)
                .pageSizeSelectorAvailable(selector)
                .pageSizeOptions(options)
                .totalWithoutFiltersNote(note)
                .build();
   }

   /**
    * Brings a page number into {@code [1, totalPages]}. The table never calls this itself; it is offered to
    * state owners that want to correct the page after the collection shrank.
    */
   public static int clampPage(int page, int totalPages) {
      return Math.max(1, Math.min(page, Math.max(1, totalPages)));
   }

   private static void checkState(PaginationState state) {
      ValidateUtils.nonNullCheck(state, "pagination");
      ValidateUtils.positiveCheck(state.getPage(), "page");
      ValidateUtils.positiveCheck(state.getPageSize(), "pageSize");
   }
}
