package com.recipick.matching;

import com.recipick.catalog.model.RequiredMaterials;
import java.util.LinkedHashSet;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class MatchScorer {

    public MatchScore score(RequiredMaterials required, Set<String> available) {
        Set<String> have = available == null ? Set.of() : available;
        Set<String> core = new LinkedHashSet<>(required.core());
        Set<String> optional = new LinkedHashSet<>(required.optional());

        if (core.isEmpty() && optional.isEmpty()) {
            return MatchScore.unqualified(Set.of());
        }

        // a recipe listing only optional materials needs all of them
        if (core.isEmpty()) {
            core = optional;
            optional = new LinkedHashSet<>();
        }

        Set<String> all = new LinkedHashSet<>(core);
        all.addAll(optional);

        Set<String> matched = new LinkedHashSet<>();
        Set<String> missing = new LinkedHashSet<>();
        for (String material : all) {
            if (have.contains(material)) {
                matched.add(material);
            } else {
                missing.add(material);
            }
        }

        if (!have.containsAll(core)) {
            return MatchScore.unqualified(missing);
        }
        return new MatchScore(true, matched, missing);
    }
}
