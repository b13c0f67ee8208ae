package com.architecture.memory.specaudit.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PredicateSemantics {
    private String directionality;   // unidirectional | bidirectional
    private boolean transitive;
    private boolean symmetric;
    private boolean reflexive;
}
