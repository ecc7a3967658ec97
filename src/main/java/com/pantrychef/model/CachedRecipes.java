package com.pantrychef.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Recipe-list cache payload stored under {@code recipe:<digest>}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CachedRecipes {

    @Builder.Default
    private List<EnrichedRecipe> recipes = new ArrayList<>();

    private Instant createdAt;
}
