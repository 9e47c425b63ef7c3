package com.e2eq.datatable.config;

import com.e2eq.datatable.util.ExceptionLoggingUtils;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Texts and pagination defaults shared by every table. Values come from MicroProfile Config under the
 * {@code datatable.} prefix; the module ships them in {@code META-INF/microprofile-config.properties}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableDefaults {
   private static final Logger LOG = Logger.getLogger(TableDefaults.class);

   public static final int DEFAULT_PAGE_SIZE = 20;
   public static final List<Integer> DEFAULT_PAGE_SIZE_OPTIONS = List.of(10, 20, 50, 100);

   @Builder.Default
   private int defaultPageSize = DEFAULT_PAGE_SIZE;

   @Builder.Default
   private List<Integer> pageSizeOptions = new ArrayList<>(DEFAULT_PAGE_SIZE_OPTIONS);

   @Builder.Default
   private String emptyMessage = "No data found";

   @Builder.Default
   private String filteredEmptyMessage = "No data matches your filters";

   @Builder.Default
   private String filteredEmptyHint = "Try adjusting your filters or clear them to see all data";

   @Builder.Default
   private String loadingMessage = "Loading...";

   @Builder.Default
   private String placeholder = "—";

   @Builder.Default
   private String defaultActionColor = "blue";

   private static volatile TableDefaults configured;

   /**
    * @return the defaults read from the current MicroProfile configuration, cached after the first call
    */
   public static TableDefaults fromConfig() {
      TableDefaults result = configured;
      if (result == null) {
         result = load();
         configured = result;
      }
      return result;
   }

   static TableDefaults load() {
      TableDefaults defaults = TableDefaults.builder().build();
      try {
         Config config = ConfigProvider.getConfig();
         defaults.setDefaultPageSize(config.getOptionalValue("datatable.pagination.default-page-size", Integer.class)
                                        .orElse(DEFAULT_PAGE_SIZE));
         defaults.setPageSizeOptions(config.getOptionalValues("datatable.pagination.page-size-options", Integer.class)
                                        .orElse(DEFAULT_PAGE_SIZE_OPTIONS));
         defaults.setEmptyMessage(config.getOptionalValue("datatable.empty.message", String.class)
                                     .orElse(defaults.getEmptyMessage()));
         defaults.setFilteredEmptyMessage(config.getOptionalValue("datatable.empty.filtered-message", String.class)
                                             .orElse(defaults.getFilteredEmptyMessage()));
         defaults.setFilteredEmptyHint(config.getOptionalValue("datatable.empty.filtered-hint", String.class)
                                          .orElse(defaults.getFilteredEmptyHint()));
         defaults.setLoadingMessage(config.getOptionalValue("datatable.loading.message", String.class)
                                       .orElse(defaults.getLoadingMessage()));
         defaults.setPlaceholder(config.getOptionalValue("datatable.cell.placeholder", String.class)
                                    .orElse(defaults.getPlaceholder()));
         defaults.setDefaultActionColor(config.getOptionalValue("datatable.action.default-color", String.class)
                                           .orElse(defaults.getDefaultActionColor()));
      } catch (IllegalStateException | IllegalArgumentException e) {
         // no config provider on the class path, or an unconvertible value
         ExceptionLoggingUtils.logWarn(LOG, e, "Falling back to built-in table defaults");
         return TableDefaults.builder().build();
      }

      if (defaults.getDefaultPageSize() <= 0) {
         LOG.warnf("Ignoring datatable.pagination.default-page-size=%d, using %d",
            defaults.getDefaultPageSize(), DEFAULT_PAGE_SIZE);
         defaults.setDefaultPageSize(DEFAULT_PAGE_SIZE);
      }
      return defaults;
   }
}
