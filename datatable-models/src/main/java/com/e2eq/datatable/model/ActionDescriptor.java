package com.e2eq.datatable.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * A per-row action button. Stateless; visibility and enablement are evaluated against each row when
 * the table is rendered.
 *
 * @param <T> the row type
 */
@Getter
@Builder
@ToString(of = {"label", "icon", "colorHint"})
public class ActionDescriptor<T> {

   private final String icon;

   @NotBlank
   private final String label;

   @NotNull
   private final Consumer<T> onClick;

   private final String colorHint;

   private final Predicate<T> disabledWhen;

   private final Predicate<T> visibleWhen;

   public boolean isVisibleFor(T row) {
      return visibleWhen == null || visibleWhen.test(row);
   }

   public boolean isDisabledFor(T row) {
      return disabledWhen != null && disabledWhen.test(row);
   }
}
