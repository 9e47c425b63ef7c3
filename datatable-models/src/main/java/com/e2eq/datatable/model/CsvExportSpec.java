package com.e2eq.datatable.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.function.Function;

/**
 * CSV export configuration of a list screen. {@link #rowData} maps one row to its cells, in header order.
 *
 * @param <T> the row type
 */
@Getter
@Builder
@ToString(of = {"enabled", "filename", "headers"})
public class CsvExportSpec<T> {

   private final boolean enabled;

   @NotBlank
   private final String filename;

   @NotNull
   private final List<String> headers;

   @NotNull
   private final Function<T, List<?>> rowData;

   /** runs after the file has been handed to the download sink */
   private final Runnable onExport;
}
