package com.pantrychef.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cached lookup response under {@code inginfo:<id>:<amount>:<unit>}. Failures are cached too
 * (with a short TTL) so a failing ingredient is not re-requested within the same burst.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IngredientLookupRecord {

    private boolean failed;

    private IngredientInformation information;

    private String error;

    public static IngredientLookupRecord success(IngredientInformation information) {
        return IngredientLookupRecord.builder().information(information).build();
    }

    public static IngredientLookupRecord failure(String error) {
        return IngredientLookupRecord.builder().failed(true).error(error).build();
    }
}
