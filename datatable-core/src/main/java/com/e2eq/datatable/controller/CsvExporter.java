package com.e2eq.datatable.controller;

import com.e2eq.datatable.exceptions.TableExportException;
import com.e2eq.datatable.model.CsvExportSpec;
import com.e2eq.datatable.util.CSVSerializer;
import com.e2eq.datatable.util.ValidateUtils;

import java.util.ArrayList;
import java.util.List;

import static java.lang.String.format;

/**
 * Turns rows into CSV text using the screen's export configuration. Export is all or nothing: the first
 * row that cannot be converted aborts it.
 */
public class CsvExporter {

   private final CSVSerializer serializer;

   public CsvExporter() {
      this(CSVSerializer.instance());
   }

   public CsvExporter(CSVSerializer serializer) {
      this.serializer = serializer;
   }

   /**
    * @param rows every row to export, typically the whole filtered collection rather than the visible page
    * @param spec the export configuration
    * @return the CSV text
    * @throws TableExportException if a row cannot be converted or does not match the headers
    */
   public <T> String export(List<T> rows, CsvExportSpec<T> spec) throws TableExportException {
      ValidateUtils.nonNullCheck(spec, "csvExport");
      ValidateUtils.nonNullCheck(spec.getHeaders(), "csvExport.headers");
      ValidateUtils.nonNullCheck(spec.getRowData(), "csvExport.rowData");

      List<T> source = rows == null ? List.of() : rows;
      List<List<?>> data = new ArrayList<>(source.size());
      for (int i = 0; i < source.size(); i++) {
         try {
            data.add(spec.getRowData().apply(source.get(i)));
         } catch (RuntimeException e) {
            throw new TableExportException(format("Converting row %d of %d for %s failed", i + 1, source.size(),
               spec.getFilename()), spec.getFilename(), i + 1, e);
         }
      }

      try {
         return serializer.serialize(spec.getHeaders(), data);
      } catch (IllegalArgumentException e) {
         throw new TableExportException(e.getMessage(), spec.getFilename(), e);
      }
   }
}
