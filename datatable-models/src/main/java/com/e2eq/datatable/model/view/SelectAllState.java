package com.e2eq.datatable.model.view;

/**
 * Tri-state of the header "select all" checkbox, derived from the visible page only.
 */
public enum SelectAllState {
   /** every visible row is selected and the page is not empty */
   CHECKED(true, false),
   /** some, but not all, visible rows are selected */
   INDETERMINATE(false, true),
   /** no visible row is selected, including the empty page */
   UNCHECKED(false, false);

   private final boolean checked;
   private final boolean indeterminate;

   SelectAllState(boolean checked, boolean indeterminate) {
      this.checked = checked;
      this.indeterminate = indeterminate;
   }

   public boolean isChecked() {
      return checked;
   }

   public boolean isIndeterminate() {
      return indeterminate;
   }
}
