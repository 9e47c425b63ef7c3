package com.e2eq.datatable.screen;

/**
 * What the header checkbox selects or clears.
 */
public enum SelectAllScope {
   /** only the rows on the page currently shown */
   VISIBLE_PAGE,
   /** every row that passes the current filters; in server mode only the fetched page is known */
   FILTERED_COLLECTION
}
