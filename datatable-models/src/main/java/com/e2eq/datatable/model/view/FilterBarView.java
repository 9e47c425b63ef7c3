package com.e2eq.datatable.model.view;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * The filter panel above the table: controls, active count and chips.
 */
@RegisterForReflection
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FilterBarView {
   /** false when the screen defines no filters; nothing of the panel is drawn then */
   protected boolean visible;

   /** null when the heading is switched off */
   protected String heading;

   protected int activeCount;

   /** "N active", null when no filter is active */
   protected String activeBadge;

   protected boolean clearAllAvailable;

   @Builder.Default
   protected List<FilterControlView> controls = new ArrayList<>();

   @Builder.Default
   protected List<FilterChip> chips = new ArrayList<>();
}
