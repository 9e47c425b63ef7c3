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
public class CellView {
   protected String columnKey;
   /** what the column resolved to, or the placeholder when that was null or empty */
   protected Object content;
   protected String text;
   protected boolean empty;
}
