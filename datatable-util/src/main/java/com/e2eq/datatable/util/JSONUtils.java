package com.e2eq.datatable.util;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Renders view objects as JSON for front ends that draw the table themselves.
 */
public class JSONUtils {
   private static final JSONUtils instance = new JSONUtils();
   protected ObjectMapper mapper;

   private JSONUtils() {
      mapper = new ObjectMapper();
      mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
      mapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
   }

   public static JSONUtils instance() {
      return instance;
   }

   public ObjectMapper getMapper() {
      return mapper;
   }

   public String toJson(Object value) throws JsonProcessingException {
      return mapper.writeValueAsString(value);
   }

   public String toPrettyJson(Object value) throws JsonProcessingException {
      return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
   }
}
