package com.e2eq.datatable.controller;

import com.e2eq.datatable.exceptions.TableRenderException;
import com.e2eq.datatable.model.Column;
import com.e2eq.datatable.model.view.CellView;
import com.e2eq.datatable.util.ExceptionLoggingUtils;
import com.e2eq.datatable.util.TableFormatUtils;
import org.apache.commons.beanutils.PropertyUtils;
import org.jboss.logging.Logger;

import java.lang.reflect.InvocationTargetException;

import static java.lang.String.format;

/**
 * Resolves the content of one cell by an ordered fallback: the column's renderer, then its accessor,
 * then the row property (or map entry) named by the column key. Null or empty results become the
 * placeholder so that an empty value does not look like a cell that has not loaded.
 * <p>
 * Exceptions thrown by a renderer or accessor reach the caller unchanged.
 * </p>
 */
public class CellResolver {
   private static final Logger LOG = Logger.getLogger(CellResolver.class);

   private final String placeholder;

   public CellResolver(String placeholder) {
      this.placeholder = placeholder == null ? TableFormatUtils.NO_VALUE_PLACEHOLDER : placeholder;
   }

   public <T> CellView resolve(Column<T> column, T row) {
      Object value;
      if (column.getRenderer() != null) {
         value = column.getRenderer().apply(row);
      } else if (column.getAccessor() != null) {
         value = column.getAccessor().apply(row);
      } else {
         value = readProperty(row, column.getKey());
      }

      if (TableFormatUtils.isBlankValue(value)) {
         return CellView.builder()
                   .columnKey(column.getKey())
                   .content(placeholder)
                   .text(placeholder)
                   .empty(true)
                   .build();
      }
      return CellView.builder()
                .columnKey(column.getKey())
                .content(value)
                .text(TableFormatUtils.formatEmptyValue(value, placeholder))
                .empty(false)
                .build();
   }

   /**
    * Reads {@code row[key]}. Works for beans (through their getters) and for maps. A key that names no
    * property reads as null.
    */
   Object readProperty(Object row, String key) {
      if (row == null || key == null) {
         return null;
      }
      try {
         return PropertyUtils.getProperty(row, key);
      } catch (NoSuchMethodException e) {
         ExceptionLoggingUtils.logIgnoredException(LOG, e, "reading " + key);
         return null;
      } catch (InvocationTargetException e) {
         Throwable cause = e.getCause() != null ? e.getCause() : e;
         throw new TableRenderException(format("Reading %s from %s failed", key, row.getClass().getName()),
            key, cause);
      } catch (IllegalAccessException e) {
         throw new TableRenderException(format("Property %s of %s is not accessible", key,
            row.getClass().getName()), key, e);
      }
   }
}
