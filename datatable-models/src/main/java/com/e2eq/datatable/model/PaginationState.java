package com.e2eq.datatable.model;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.function.IntConsumer;

/**
 * Pagination input of a table.
 * <p>
 * In {@link PaginationMode#CLIENT} mode {@code total} and {@code totalPages} are derived from the rows and
 * the fields here are ignored. In {@link PaginationMode#SERVER} mode they are taken as-is, typically from the
 * envelope of an API response. The owner of this state keeps {@code page} within range; the table does not
 * correct it.
 * </p>
 * Callers that supply {@link #onPageSizeChange} are expected to reset {@code page} to 1 when it fires.
 */
@Getter
@Builder(toBuilder = true)
@ToString(exclude = {"onPageChange", "onPageSizeChange"})
public class PaginationState {

   @NotNull
   private final PaginationMode mode;

   @Min(1)
   private final int page;

   @Min(1)
   private final int pageSize;

   @Min(0)
   private final Integer total;

   @Min(0)
   private final Integer totalPages;

   /** choices offered by the page size selector; configured defaults apply when null */
   private final List<Integer> pageSizeOptions;

   @NotNull
   private final IntConsumer onPageChange;

   private final IntConsumer onPageSizeChange;

   public boolean isServerMode() {
      return mode == PaginationMode.SERVER;
   }
}
