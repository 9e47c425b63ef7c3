package com.e2eq.datatable.model.view;

import com.e2eq.datatable.model.PaginationMode;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Pagination footer. When {@link #visible} is false the footer is not drawn at all, which is the case for
 * every collection that fits on a single page.
 */
@RegisterForReflection
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaginationView {
   protected boolean visible;
   protected PaginationMode mode;
   protected int page;
   protected int pageSize;
   protected int totalItems;
   protected int totalPages;
   protected int showingFrom;
   protected int showingTo;
   /** "Showing X to Y of N items" */
   protected String summary;
   /** "Page P of T" */
   protected String pageLabel;
   protected boolean previousEnabled;
   protected boolean nextEnabled;
   protected boolean pageSizeSelectorAvailable;

   @Builder.Default
   protected List<Integer> pageSizeOptions = new ArrayList<>();

   /** "(N total without filters)", only while filters are active and the screen knows the unfiltered total */
   protected String totalWithoutFiltersNote;
}
