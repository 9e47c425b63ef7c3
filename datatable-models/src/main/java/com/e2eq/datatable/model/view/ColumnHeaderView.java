package com.e2eq.datatable.model.view;

import com.e2eq.datatable.model.SortParameter;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@RegisterForReflection
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ColumnHeaderView {
   protected String key;
   protected String header;
   protected boolean sortable;
   protected boolean sorted;
   /** only set on the sorted column */
   protected SortParameter.SortOrderEnum direction;
   protected String width;
   protected String minWidth;
   protected boolean sticky;
}
