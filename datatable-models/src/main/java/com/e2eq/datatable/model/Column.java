package com.e2eq.datatable.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.function.Function;

/**
 * Describes one column of a list screen. A column is supplied once per screen and does not change afterwards.
 * <p>
 * Cell content is resolved from {@link #renderer}, then {@link #accessor}, then the row property named by
 * {@link #key}. Normally only one of the two functions is set.
 * </p>
 *
 * @param <T> the row type
 */
@Getter
@Builder
@ToString(of = {"key", "header", "sortable"})
public class Column<T> {

   /** Unique within the column set; also the field name emitted when the header is clicked for sorting. */
   @NotBlank
   private final String key;

   @NotNull
   private final String header;

   private final Function<T, ?> accessor;

   private final Function<T, ?> renderer;

   @Builder.Default
   private final boolean sortable = true;

   // layout hints, passed through to the header view untouched
   private final String width;
   private final String minWidth;
   private final boolean sticky;

   public static <T> Column<T> of(String key, String header) {
      return Column.<T>builder().key(key).header(header).build();
   }
}
