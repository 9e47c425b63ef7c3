package com.e2eq.datatable.model;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@RegisterForReflection
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FilterOption {
   protected String value;
   protected String label;

   public static FilterOption of(String value, String label) {
      return new FilterOption(value, label);
   }
}
