package com.e2eq.datatable.controller;

import com.e2eq.datatable.model.FilterDefinition;
import com.e2eq.datatable.model.FilterKind;
import com.e2eq.datatable.model.view.FilterBarView;
import com.e2eq.datatable.model.view.FilterChip;
import com.e2eq.datatable.model.view.FilterControlView;
import com.e2eq.datatable.util.TableFormatUtils;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Derives the active filter count, the chips and the filter panel from filter definitions and the
 * caller's current values. Holds no state.
 */
public class FilterEvaluator {

   public static final String FILTERS_HEADING = "Filters";
   public static final String DEFAULT_SEARCH_PLACEHOLDER = "Search...";

   /**
    * A filter is active when its value is neither null nor the empty string. {@code false} counts as active.
    *
    * @param value the current value of a filter
    * @return true if the value is active
    */
   public static boolean isActive(Object value) {
      return !TableFormatUtils.isBlankValue(value);
   }

   public int activeFilterCount(List<FilterDefinition> filters, Map<String, ?> values) {
      int count = 0;
      for (FilterDefinition filter : safe(filters)) {
         if (isActive(valueOf(values, filter.getKey()))) {
            count++;
         }
      }
      return count;
   }

   /**
    * @return one chip per active filter, in definition order
    */
   public List<FilterChip> chips(List<FilterDefinition> filters, Map<String, ?> values) {
      List<FilterChip> chips = new ArrayList<>();
      for (FilterDefinition filter : safe(filters)) {
         Object value = valueOf(values, filter.getKey());
         if (isActive(value)) {
            chips.add(new FilterChip(filter.getKey(), filter.displayLabel(), displayValue(filter, value)));
         }
      }
      return chips;
   }

   /**
    * Maps a raw filter value to the text shown on its chip. Select filters show the label of the matching
    * option and fall back to the raw value when no option matches.
    */
   public String displayValue(FilterDefinition filter, Object value) {
      if (value == null) {
         return "";
      }
      if (filter.getKind() == FilterKind.SELECT) {
         return filter.optionLabel(value).orElse(String.valueOf(value));
      }
      if (filter.getKind() == FilterKind.BOOLEAN && value instanceof Boolean) {
         return TableFormatUtils.formatBoolean((Boolean) value);
      }
      return String.valueOf(value);
   }

   public FilterBarView describe(List<FilterDefinition> filters, Map<String, ?> values, boolean showHeading) {
      List<FilterDefinition> defs = safe(filters);
      int activeCount = activeFilterCount(defs, values);

      List<FilterControlView> controls = new ArrayList<>(defs.size());
      for (FilterDefinition filter : defs) {
         controls.add(control(filter, valueOf(values, filter.getKey())));
      }

      return FilterBarView.builder()
                .visible(!defs.isEmpty())
                .heading(showHeading ? FILTERS_HEADING : null)
                .activeCount(activeCount)
                .activeBadge(activeCount > 0 ? activeCount + " active" : null)
                .clearAllAvailable(activeCount > 0)
                .controls(controls)
                .chips(chips(defs, values))
                .build();
   }

   private FilterControlView control(FilterDefinition filter, Object value) {
      FilterControlView.FilterControlViewBuilder control = FilterControlView.builder()
                .key(filter.getKey())
                .kind(filter.getKind())
                .label(filter.getLabel())
                .value(value == null ? "" : String.valueOf(value));

      switch (filter.getKind()) {
         case SEARCH:
            control.placeholder(StringUtils.defaultIfEmpty(filter.getPlaceholder(), DEFAULT_SEARCH_PLACEHOLDER));
            break;
         case SELECT:
            control.placeholder(StringUtils.defaultIfEmpty(filter.getPlaceholder(),
               "Filter by " + filter.displayLabel()));
            control.options(new ArrayList<>(filter.getOptions()));
            break;
         case BOOLEAN:
            control.placeholder(filter.getPlaceholder());
            control.checked(Boolean.TRUE.equals(value) || "true".equals(value));
            break;
         default:
            throw new IllegalStateException("Unhandled filter kind " + filter.getKind());
      }
      return control.build();
   }

   private static Object valueOf(Map<String, ?> values, String key) {
      return values == null ? null : values.get(key);
   }

   private static List<FilterDefinition> safe(List<FilterDefinition> filters) {
      return filters == null ? List.of() : filters;
   }
}
