package com.e2eq.datatable.model;

import io.quarkus.runtime.annotations.RegisterForReflection;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@RegisterForReflection
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
public @Data class SortParameter {
    public enum SortOrderEnum
    {
        DESC,
        ASC;

        public SortOrderEnum opposite() {
            return this == ASC ? DESC : ASC;
        }
    }
    @NotNull
    protected String fieldName;
    @NotNull
    protected SortOrderEnum direction;

    public static SortParameter ascending(String fieldName) {
        return new SortParameter(fieldName, SortOrderEnum.ASC);
    }

    public static SortParameter descending(String fieldName) {
        return new SortParameter(fieldName, SortOrderEnum.DESC);
    }
}
