package com.e2eq.datatable.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.jetbrains.annotations.Nullable;

import java.util.function.Consumer;

/**
 * The active sort of a screen plus the request callback fired when a sortable header is clicked.
 * The table never reorders rows itself; the data source is expected to reflect {@link #current}.
 */
@Getter
@Builder
@ToString(of = "current")
public class SortState {

   /** null when nothing is sorted yet */
   @Nullable
   private final SortParameter current;

   private final Consumer<String> onSort;

   public boolean isSortedBy(String field) {
      return current != null && current.getFieldName() != null && current.getFieldName().equals(field);
   }
}
