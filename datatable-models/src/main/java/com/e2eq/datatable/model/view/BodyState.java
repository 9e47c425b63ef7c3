package com.e2eq.datatable.model.view;

public enum BodyState {
   LOADING,
   EMPTY,
   ROWS
}
