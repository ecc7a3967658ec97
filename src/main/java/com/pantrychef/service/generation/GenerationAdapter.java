package com.pantrychef.service.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pantrychef.config.PantryChefProperties;
import com.pantrychef.exception.GenerationFormatException;
import com.pantrychef.model.CandidateRecipe;
import com.pantrychef.model.EnrichmentRequest;
import com.pantrychef.model.Macros;
import com.pantrychef.model.RecipeIngredient;
import com.pantrychef.provider.GenerationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Drafts candidate recipes through the generation service and salvages them into
 * {@link CandidateRecipe}s.
 *
 * Output is untrusted: individual fields are defaulted to zero/empty when missing or malformed,
 * but output without any recoverable recipes array fails with {@link GenerationFormatException}
 * so it is never confused with "no recipes match".
 */
@Slf4j
@Service
public class GenerationAdapter {

    private static final Pattern LEADING_NUMBER = Pattern.compile("-?\\d+(?:\\.\\d+)?");
    private static final int RAW_PREVIEW_LENGTH = 200;

    private final GenerationService generationService;
    private final RecipeJsonExtractor extractor;
    private final ObjectMapper objectMapper;
    private final PantryChefProperties properties;

    public GenerationAdapter(
            GenerationService generationService,
            RecipeJsonExtractor extractor,
            ObjectMapper objectMapper,
            PantryChefProperties properties) {
        this.generationService = generationService;
        this.extractor = extractor;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * Generate candidate recipes for a request. Calls the generation service exactly once.
     *
     * @param request meal request
     * @return candidate recipes, possibly empty if the model returned an empty recipes array
     */
    public Mono<List<CandidateRecipe>> generate(EnrichmentRequest request) {
        return generationService.complete(systemPrompt(), userPrompt(request))
                .switchIfEmpty(Mono.error(() -> new GenerationFormatException("Generation returned no output", "")))
                .map(this::toRecipes);
    }

    String systemPrompt() {
        return "You are an expert chef and registered dietitian. Given pantry ingredients and user constraints, "
                + "respond ONLY with valid JSON.\n"
                + "Top-level: { \"recipes\": [ ... ] }\n"
                + "Each recipe must include: title, description, ingredients (array of {name,quantity}), "
                + "steps (array of strings), estimatedCalories (number), macros {protein,carbs,fat}.\n"
                + "Return up to " + properties.getGeneration().getMaxRecipes() + " recipes. No extra commentary.";
    }

    String userPrompt(EnrichmentRequest request) {
        String calorieTarget = request.getCalorieTarget() == null ? "none" : request.getCalorieTarget().toString();
        return "Ingredients: " + String.join(", ", request.getIngredients()) + "\n"
                + "Diet: " + request.getDiet() + "\n"
                + "Calorie target: " + calorieTarget + "\n"
                + "Servings: " + request.getEffectiveServings() + "\n"
                + "UserProfile: " + profileJson(request.getUserProfile());
    }

    List<CandidateRecipe> toRecipes(String text) {
        ExtractionResult extraction = extractor.extract(text);
        if (!extraction.isParsed()) {
            log.warn("Generation returned unparseable output: {}", preview(text));
            throw new GenerationFormatException("Generation output contains no parsable JSON", text);
        }

        JsonNode root = extraction.getNode();
        JsonNode recipesNode = root.isArray() ? root : root.path("recipes");
        if (!recipesNode.isArray()) {
            log.warn("Generation JSON has no recipes array: {}", preview(text));
            throw new GenerationFormatException("Generation output has no recipes array", text);
        }

        List<CandidateRecipe> recipes = new ArrayList<>();
        for (JsonNode recipeNode : recipesNode) {
            if (!recipeNode.isObject()) {
                log.debug("Skipping non-object recipe entry: {}", recipeNode.getNodeType());
                continue;
            }
            recipes.add(toRecipe(recipeNode));
        }

        log.info("Generation produced {} recipes ({} JSON)", recipes.size(), extraction.getKind());
        return recipes;
    }

    private CandidateRecipe toRecipe(JsonNode node) {
        double estimatedCalories = node.has("estimatedCalories")
                ? number(node.get("estimatedCalories"))
                : number(node.get("calories"));

        JsonNode macrosNode = node.path("macros");
        Macros macros = Macros.builder()
                .protein(number(macrosNode.get("protein")))
                .carbs(number(macrosNode.get("carbs")))
                .fat(number(macrosNode.get("fat")))
                .build();

        return CandidateRecipe.builder()
                .title(text(node.get("title")))
                .description(text(node.get("description")))
                .ingredients(ingredients(node.get("ingredients")))
                .steps(steps(node.get("steps")))
                .estimatedCalories(estimatedCalories)
                .macros(macros)
                .build();
    }

    private List<RecipeIngredient> ingredients(JsonNode node) {
        List<RecipeIngredient> ingredients = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return ingredients;
        }

        for (JsonNode item : node) {
            if (item.isObject()) {
                ingredients.add(new RecipeIngredient(text(item.get("name")), text(item.get("quantity"))));
            } else if (item.isTextual() && !item.asText().isBlank()) {
                ingredients.add(new RecipeIngredient(item.asText().trim(), ""));
            }
        }
        return ingredients;
    }

    private List<String> steps(JsonNode node) {
        List<String> steps = new ArrayList<>();
        if (node == null) {
            return steps;
        }

        if (node.isArray()) {
            for (JsonNode step : node) {
                String value = text(step);
                if (!value.isEmpty()) {
                    steps.add(value);
                }
            }
        } else if (node.isTextual() && !node.asText().isBlank()) {
            steps.add(node.asText().trim());
        }
        return steps;
    }

    private String text(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return "";
        }
        return node.asText().trim();
    }

    /**
     * Numbers may arrive as strings with units ("480 kcal"). Anything unreadable or negative is 0.
     */
    private double number(JsonNode node) {
        if (node == null || node.isNull()) {
            return 0;
        }

        double value = 0;
        if (node.isNumber()) {
            value = node.asDouble();
        } else if (node.isTextual()) {
            Matcher matcher = LEADING_NUMBER.matcher(node.asText());
            if (matcher.find()) {
                value = Double.parseDouble(matcher.group());
            }
        }

        return Double.isFinite(value) && value > 0 ? value : 0;
    }

    private String profileJson(Map<String, Object> profile) {
        try {
            return objectMapper.writeValueAsString(profile == null ? Map.of() : profile);
        } catch (JsonProcessingException e) {
            log.warn("Cannot serialize user profile, sending empty profile", e);
            return "{}";
        }
    }

    private String preview(String text) {
        if (text == null) {
            return "null";
        }
        return text.length() <= RAW_PREVIEW_LENGTH ? text : text.substring(0, RAW_PREVIEW_LENGTH) + "...";
    }
}
