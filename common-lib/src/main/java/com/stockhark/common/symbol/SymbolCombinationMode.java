package com.stockhark.common.symbol;

import java.util.Set;
import java.util.TreeSet;

/**
 * Named ways of merging the symbol sets found by two extractors.
 * Each mode is a pure function of {@code (primary, secondary)} and returns a new sorted set.
 *
 * <pre>
 *   UNION             → primary ∪ secondary
 *   INTERSECTION      → primary ∩ secondary
 *   PRIORITY_OVERRIDE → secondary if it found anything, otherwise primary
 * </pre>
 */
public enum SymbolCombinationMode {

    UNION {
        @Override
        public Set<String> combine(Set<String> primary, Set<String> secondary) {
            Set<String> out = new TreeSet<>(primary);
            out.addAll(secondary);
            return out;
        }
    },

    INTERSECTION {
        @Override
        public Set<String> combine(Set<String> primary, Set<String> secondary) {
            Set<String> out = new TreeSet<>(primary);
            out.retainAll(secondary);
            return out;
        }
    },

    PRIORITY_OVERRIDE {
        @Override
        public Set<String> combine(Set<String> primary, Set<String> secondary) {
            return new TreeSet<>(secondary.isEmpty() ? primary : secondary);
        }
    };

    public abstract Set<String> combine(Set<String> primary, Set<String> secondary);
}
