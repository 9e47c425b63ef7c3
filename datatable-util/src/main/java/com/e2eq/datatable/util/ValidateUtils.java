package com.e2eq.datatable.util;

public class ValidateUtils {

   public static void nonNullCheck(Object value, String fieldName) {
      if (value == null) {
         throw new IllegalArgumentException(" " + fieldName + " cannot be null");
      }
   }

   public static void nonEmptyCheck(String value, String fieldName) {
      if (value == null || value.isEmpty()) {
         throw new IllegalArgumentException(" " + fieldName + " cannot be empty");
      }
   }

   public static void positiveCheck(int value, String fieldName) {
      if (value <= 0) {
         throw new IllegalArgumentException(" " + fieldName + " must be greater than 0 but was " + value);
      }
   }
}
