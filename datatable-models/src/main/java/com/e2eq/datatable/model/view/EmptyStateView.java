package com.e2eq.datatable.model.view;

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
public class EmptyStateView {
   protected EmptyStateKind kind;
   protected String message;
   protected String hint;
   /** renderer output for {@link EmptyStateKind#CUSTOM} */
   protected Object content;
   protected boolean clearFiltersAvailable;
   protected int columnSpan;
}
