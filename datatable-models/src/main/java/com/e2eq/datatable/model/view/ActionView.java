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
public class ActionView {
   /** position of the descriptor in the screen's action list */
   protected int index;
   protected String label;
   protected String icon;
   protected String colorHint;
   protected boolean disabled;
}
