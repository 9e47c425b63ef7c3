package com.e2eq.datatable.model;

public enum PaginationMode {
   /** the table holds the whole filtered collection and slices it locally */
   CLIENT,
   /** the backend already paginated; rows are exactly the current page */
   SERVER
}
