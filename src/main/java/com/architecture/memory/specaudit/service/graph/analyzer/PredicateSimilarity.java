package com.architecture.memory.specaudit.service.graph.analyzer;

import com.architecture.memory.specaudit.model.Predicate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Overlap score between two catalog predicates:
 * {@code 0.5 * name + 0.3 * description + 0.2 * sameCategory}.
 *
 * Name similarity is the token Jaccard of the hyphenated names, raised to 1.0 when both names
 * belong to one synonym group. A pair of catalog inverses scores 0 unless their descriptions
 * are themselves at least {@link #INVERSE_DESCRIPTION_EVIDENCE} similar.
 */
@Component
public class PredicateSimilarity {

    public static final double NAME_WEIGHT = 0.5;
    public static final double DESCRIPTION_WEIGHT = 0.3;
    public static final double CATEGORY_WEIGHT = 0.2;
    public static final double INVERSE_DESCRIPTION_EVIDENCE = 0.6;

    private static final List<Set<String>> SYNONYM_GROUPS = List.of(
            Set.of("uses", "depends-on", "requires", "consumes"),
            Set.of("contains", "composes", "aggregates", "includes", "has"),
            Set.of("references", "refers-to", "links-to", "points-to"),
            Set.of("realizes", "implements", "fulfills"),
            Set.of("serves", "provides", "supplies"),
            Set.of("triggers", "initiates", "starts"),
            Set.of("accesses", "reads", "reads-from"),
            Set.of("flows-to", "sends-to", "publishes-to"),
            Set.of("influence", "influences", "affects", "impacts"),
            Set.of("derives-from", "derived-from", "based-on"),
            Set.of("specializes", "extends", "inherits-from")
    );

    public double score(Predicate a, Predicate b) {
        double nameSimilarity = nameSimilarity(a.getName(), b.getName());
        double descriptionSimilarity = TextSimilarity.jaccard(a.getDescription(), b.getDescription());
        double categorySimilarity = a.getCategory() != null && Objects.equals(a.getCategory(), b.getCategory()) ? 1.0 : 0.0;

        if (a.isInverseOf(b) && descriptionSimilarity < INVERSE_DESCRIPTION_EVIDENCE) {
            return 0.0;
        }
        return TextSimilarity.round(NAME_WEIGHT * nameSimilarity
                + DESCRIPTION_WEIGHT * descriptionSimilarity
                + CATEGORY_WEIGHT * categorySimilarity);
    }

    public double nameSimilarity(String a, String b) {
        if (a.equals(b) || sameSynonymGroup(a, b)) {
            return 1.0;
        }
        return TextSimilarity.jaccard(Set.of(a.split("-")), Set.of(b.split("-")));
    }

    public boolean sameSynonymGroup(String a, String b) {
        return SYNONYM_GROUPS.stream().anyMatch(group -> group.contains(a) && group.contains(b));
    }
}
