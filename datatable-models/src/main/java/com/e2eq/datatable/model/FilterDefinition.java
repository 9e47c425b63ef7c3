package com.e2eq.datatable.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Declarative description of one filter control. The current value lives in the caller's filter value map
 * under {@link #key}; the definition itself holds no state.
 */
@Getter
@Builder
@ToString
public class FilterDefinition {

   @NotBlank
   private final String key;

   @NotNull
   private final FilterKind kind;

   private final String label;

   private final String placeholder;

   @Singular
   private final List<FilterOption> options;

   public String displayLabel() {
      return label != null && !label.isEmpty() ? label : key;
   }

   /**
    * @param value a raw filter value
    * @return the label of the option whose value equals the string form of {@code value}
    */
   public Optional<String> optionLabel(Object value) {
      if (value == null || options == null) {
         return Optional.empty();
      }
      String raw = String.valueOf(value);
      return options.stream()
                .filter(o -> Objects.equals(o.getValue(), raw))
                .map(FilterOption::getLabel)
                .filter(Objects::nonNull)
                .findFirst();
   }

   public static FilterDefinition search(String key) {
      return FilterDefinition.builder().key(key).kind(FilterKind.SEARCH).build();
   }
}
