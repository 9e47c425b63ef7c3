package com.e2eq.datatable.model.view;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything a list screen draws for one render pass. Derived from the screen's current state and
 * recomputed on every render; it holds no callbacks and can be serialized as-is.
 *
 * @param <ID> the row identifier type
 */
@RegisterForReflection
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableView<ID> {
   protected String title;
   protected boolean exportAvailable;
   protected FilterBarView filterBar;

   @Builder.Default
   protected List<ColumnHeaderView> columns = new ArrayList<>();

   protected boolean selectionEnabled;

   /** null while loading or when selection is disabled */
   protected SelectAllState selectAll;

   /** true when the screen defines row actions and an "Actions" column is drawn */
   protected boolean actionsColumn;

   /** number of drawn columns including the selection and action columns */
   protected int columnSpan;

   protected BodyState bodyState;

   protected String loadingMessage;

   @Builder.Default
   protected List<RowView<ID>> rows = new ArrayList<>();

   protected EmptyStateView emptyState;

   /** null when the screen is not paginated or while loading */
   protected PaginationView pagination;
}
