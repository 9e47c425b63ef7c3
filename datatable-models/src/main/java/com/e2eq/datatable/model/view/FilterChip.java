package com.e2eq.datatable.model.view;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Removable badge for one active filter. Removing it requests the same change as clearing the control:
 * the filter's key with an empty value.
 */
@RegisterForReflection
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FilterChip {
   protected String key;
   protected String displayLabel;
   protected String displayValue;
}
