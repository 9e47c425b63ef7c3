package com.e2eq.datatable.controller;

import com.e2eq.datatable.model.view.SelectAllState;

import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Reads the caller's selection set against the visible page. The set is never modified here.
 */
public class SelectionTracker {

   public <T, ID> SelectAllState selectAllState(List<T> visibleRows, Function<T, ID> rowId, Set<ID> selectedIds) {
      if (visibleRows == null || visibleRows.isEmpty() || selectedIds == null || selectedIds.isEmpty()) {
         return SelectAllState.UNCHECKED;
      }

      int selected = 0;
      for (T row : visibleRows) {
         if (selectedIds.contains(rowId.apply(row))) {
            selected++;
         }
      }

      if (selected == 0) {
         return SelectAllState.UNCHECKED;
      }
      return selected == visibleRows.size() ? SelectAllState.CHECKED : SelectAllState.INDETERMINATE;
   }

   public <ID> boolean isSelected(ID id, Set<ID> selectedIds) {
      return selectedIds != null && selectedIds.contains(id);
   }
}
