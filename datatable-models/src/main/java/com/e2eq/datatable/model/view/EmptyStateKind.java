package com.e2eq.datatable.model.view;

/**
 * Variants of the empty table body, in priority order.
 */
public enum EmptyStateKind {
   /** output of the screen's own empty state renderer */
   CUSTOM,
   /** filters are active and nothing matches them */
   FILTERED,
   /** plain "no data" message */
   GENERIC
}
