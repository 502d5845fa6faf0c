package io.reminor.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Ranking constants shared by the search strategies.
 *
 * <p>{@code semanticScale} multiplies cosine similarity so that vector hits land in the same
 * order of magnitude as lexical and direct-text scores.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RetrievalConfig(
    @JsonAlias({"similarity_floor"}) double similarityFloor,
    @JsonAlias({"semantic_scale"}) double semanticScale,
    @JsonAlias({"month_bonus"}) double monthBonus,
    @JsonAlias({"snippet_window"}) int snippetWindow,
    @JsonAlias({"snippet_lead"}) int snippetLead,
    @JsonAlias({"candidate_multiplier"}) int candidateMultiplier,
    @JsonAlias({"max_context_snippets"}) int maxContextSnippets,
    @JsonAlias({"domain_vocabulary"}) List<String> domainVocabulary
) {

    public static RetrievalConfig defaults() {
        return new RetrievalConfig(
            0.2,
            20.0,
            15.0,
            400,
            100,
            2,
            10,
            List.of(
                "pizza", "mare", "moto", "cena", "pranzo", "lavoro", "casa", "sardegna",
                "beach", "dinner", "lunch", "work", "home", "motorbike"
            )
        );
    }
}
