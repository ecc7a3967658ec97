package com.pantrychef.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ingredient line decomposed by the lookup service into an identifier, amount and unit.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ParsedIngredient {

    private String id;

    private Double amount;

    private String unit;

    private String unitShort;

    private String unitString;

    private String name;

    /**
     * The ingredient line as it was submitted.
     */
    private String original;

    /**
     * Without an id and a positive amount there is nothing to look up.
     */
    @JsonIgnore
    public boolean isResolvable() {
        return id != null && !id.isBlank() && amount != null && amount > 0;
    }

    @JsonIgnore
    public String getEffectiveUnit() {
        if (unit != null && !unit.isBlank()) {
            return unit;
        }
        if (unitShort != null && !unitShort.isBlank()) {
            return unitShort;
        }
        if (unitString != null && !unitString.isBlank()) {
            return unitString;
        }
        return "unit";
    }
}
