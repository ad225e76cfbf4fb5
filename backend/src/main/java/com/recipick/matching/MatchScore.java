package com.recipick.matching;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public record MatchScore(boolean qualified, Set<String> matched, Set<String> missing) {

    public MatchScore {
        matched = Collections.unmodifiableSet(new LinkedHashSet<>(matched));
        missing = Collections.unmodifiableSet(new LinkedHashSet<>(missing));
    }

    static MatchScore unqualified(Set<String> missing) {
        return new MatchScore(false, Set.of(), missing);
    }

    public double ratio() {
        if (!qualified) {
            return 0.0;
        }
        int total = matched.size() + missing.size();
        return total == 0 ? 0.0 : (double) matched.size() / total;
    }

    /**
     * Ratio as a whole percentage, rounded down.
     */
    public int percentage() {
        if (!qualified) {
            return 0;
        }
        int total = matched.size() + missing.size();
        return total == 0 ? 0 : matched.size() * 100 / total;
    }
}
