package com.stockhark.common.symbol;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Runs two extractors over the same text and merges their output with a
 * {@link SymbolCombinationMode}. Output is sorted.
 */
public final class CombinedSymbolExtractor implements SymbolExtractor {

    private final SymbolExtractor primary;
    private final SymbolExtractor secondary;
    private final SymbolCombinationMode mode;

    public CombinedSymbolExtractor(SymbolExtractor primary, SymbolExtractor secondary,
                                   SymbolCombinationMode mode) {
        this.primary   = Objects.requireNonNull(primary, "primary");
        this.secondary = Objects.requireNonNull(secondary, "secondary");
        this.mode      = Objects.requireNonNull(mode, "mode");
    }

    @Override
    public List<String> extract(String text) {
        return List.copyOf(mode.combine(
            new LinkedHashSet<>(primary.extract(text)),
            new LinkedHashSet<>(secondary.extract(text))));
    }
}
