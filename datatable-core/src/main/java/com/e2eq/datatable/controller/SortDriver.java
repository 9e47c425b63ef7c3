package com.e2eq.datatable.controller;

import com.e2eq.datatable.model.SortParameter;
import com.e2eq.datatable.util.ValidateUtils;

/**
 * Sort state transitions. Re-selecting the sorted field flips its direction; selecting any other field,
 * or selecting a field while nothing is sorted, sorts that field ascending.
 * <p>
 * Only which field and direction are active is managed here. Ordering the rows is left to the data source,
 * which knows whether a column compares as text, number or date.
 * </p>
 */
public class SortDriver {

   /**
    * @param current the active sort, or null when nothing is sorted
    * @param field the field whose header was selected
    * @return the new sort
    */
   public SortParameter requestSort(SortParameter current, String field) {
      ValidateUtils.nonEmptyCheck(field, "field");
      if (current != null && field.equals(current.getFieldName())) {
         SortParameter.SortOrderEnum direction = current.getDirection() == null
                                                    ? SortParameter.SortOrderEnum.ASC
                                                    : current.getDirection().opposite();
         return new SortParameter(field, direction);
      }
      return SortParameter.ascending(field);
   }
}
