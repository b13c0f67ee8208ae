package com.architecture.memory.specaudit.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A named relationship verb from the predicate catalog.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Predicate {
    private String name;
    private String inverse;
    private String category;
    private String description;

    @Builder.Default
    private PredicateSemantics semantics = new PredicateSemantics();

    public boolean isInverseOf(Predicate other) {
        if (other == null) return false;
        return name.equals(other.getInverse()) || other.getName().equals(inverse);
    }
}
