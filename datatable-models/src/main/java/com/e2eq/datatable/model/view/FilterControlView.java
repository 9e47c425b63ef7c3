package com.e2eq.datatable.model.view;

import com.e2eq.datatable.model.FilterKind;
import com.e2eq.datatable.model.FilterOption;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@RegisterForReflection
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FilterControlView {
   protected String key;
   protected FilterKind kind;
   protected String label;
   protected String placeholder;
   /** current value as shown in a text or select control, empty when unset */
   protected String value;
   /** only set for boolean filters */
   protected Boolean checked;
   protected List<FilterOption> options;
}
