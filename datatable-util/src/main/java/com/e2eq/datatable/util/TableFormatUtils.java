package com.e2eq.datatable.util;

import org.apache.commons.lang3.StringUtils;

/**
 * Display formatting for table cells and filter values.
 */
public class TableFormatUtils {

   /** Shown in place of a missing cell value so that "empty" reads differently from "not loaded". */
   public static final String NO_VALUE_PLACEHOLDER = "—";

   public static final String YES = "Yes";
   public static final String NO = "No";

   /**
    * @param value the value to test
    * @return true if the value is null or the empty string
    */
   public static boolean isBlankValue(Object value) {
      return value == null || (value instanceof CharSequence && StringUtils.isEmpty((CharSequence) value));
   }

   /**
    * Formats a boolean as "Yes" or "No"; null is treated as "No".
    *
    * @param value the value to format
    * @return "Yes" or "No"
    */
   public static String formatBoolean(Boolean value) {
      return Boolean.TRUE.equals(value) ? YES : NO;
   }

   public static String formatEmptyValue(Object value) {
      return formatEmptyValue(value, NO_VALUE_PLACEHOLDER);
   }

   /**
    * @param value the value to format
    * @param placeholder the text used for null or empty values
    * @return the placeholder for null or empty values, otherwise the string form of the value
    */
   public static String formatEmptyValue(Object value, String placeholder) {
      if (isBlankValue(value)) {
         return placeholder;
      }
      return String.valueOf(value);
   }
}
