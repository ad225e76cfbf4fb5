package com.recipick.recommendation.service;

import com.recipick.catalog.model.Recipe;
import com.recipick.matching.MatchScore;
import com.recipick.matching.MatchScorer;
import com.recipick.recommendation.dto.RecipeRecommendationResponse;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class RecommendationService {

    private static final Logger log = LoggerFactory.getLogger(RecommendationService.class);

    /**
     * Higher percentage first, then fewer missing materials, then catalog order.
     */
    private static final Comparator<RankedRecipe> RANKING = Comparator
        .comparingInt((RankedRecipe ranked) -> ranked.score().percentage()).reversed()
        .thenComparingInt(ranked -> ranked.score().missing().size())
        .thenComparingInt(RankedRecipe::catalogOrder);

    private final MatchScorer matchScorer;

    public RecommendationService(MatchScorer matchScorer) {
        this.matchScorer = matchScorer;
    }

    public List<RecipeRecommendationResponse> recommend(List<Recipe> recipes, Set<String> availableMaterials, int topN) {
        if (topN <= 0) {
            return List.of();
        }

        if (recipes == null || recipes.isEmpty()) {
            log.error("Recipe catalog is empty; no recommendations possible");
            return List.of();
        }

        Set<String> available = availableMaterials == null ? Set.of() : availableMaterials;
        List<RankedRecipe> ranked = new ArrayList<>();
        int order = 0;
        for (Recipe recipe : recipes) {
            order++;
            try {
                MatchScore score = matchScorer.score(recipe.requiredMaterials(), available);
                if (score.ratio() > 0.0) {
                    ranked.add(new RankedRecipe(recipe, score, order));
                }
            } catch (RuntimeException exception) {
                log.warn("Recipe '{}' skipped while scoring: {}", recipe.name(), exception.getMessage());
            }
        }

        ranked.sort(RANKING);
        return ranked.stream()
            .limit(topN)
            .map(this::toResponse)
            .toList();
    }

    private RecipeRecommendationResponse toResponse(RankedRecipe ranked) {
        Recipe recipe = ranked.recipe();
        MatchScore score = ranked.score();
        return new RecipeRecommendationResponse(
            recipe.name(),
            recipe.imageUrl(),
            score.percentage(),
            List.copyOf(score.matched()),
            List.copyOf(score.missing()),
            score.missing().size(),
            recipe.steps()
        );
    }

    private record RankedRecipe(Recipe recipe, MatchScore score, int catalogOrder) {
    }
}
