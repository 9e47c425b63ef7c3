package com.e2eq.datatable.model.view;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One rendered row of the visible page.
 *
 * @param <ID> the row identifier type
 */
@RegisterForReflection
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RowView<ID> {
   protected ID id;
   /** position within the visible page */
   protected int index;
   protected boolean selected;
   protected boolean clickable;

   @Builder.Default
   protected List<CellView> cells = new ArrayList<>();

   @Builder.Default
   protected List<ActionView> actions = new ArrayList<>();

   /** output of a screen supplied row renderer; when set the default cells are not rendered */
   protected Object customContent;
}
