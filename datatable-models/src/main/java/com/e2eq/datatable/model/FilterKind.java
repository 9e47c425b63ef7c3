package com.e2eq.datatable.model;

public enum FilterKind {
   /** free text search box */
   SEARCH,
   /** drop down over a fixed list of options */
   SELECT,
   /** on/off toggle */
   BOOLEAN
}
