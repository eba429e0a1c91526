package com.stockhark.common.symbol;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Explicit cashtag extraction ({@code $AAPL}, {@code $tsla}).
 *
 * <p>A cashtag states intent, so the common-word filter is not applied; the symbol
 * must still be listed in the {@link TickerUniverse}.
 */
public final class CashtagSymbolExtractor implements SymbolExtractor {

    private static final Pattern CASHTAG = Pattern.compile("\\$([A-Za-z]{1,5})\\b");

    private final TickerUniverse universe;

    public CashtagSymbolExtractor(TickerUniverse universe) {
        this.universe = Objects.requireNonNull(universe, "universe");
    }

    @Override
    public List<String> extract(String text) {
        if (text == null || text.isEmpty()) return List.of();

        Set<String> symbols = new LinkedHashSet<>();
        Matcher m = CASHTAG.matcher(text);
        while (m.find()) {
            String symbol = m.group(1).toUpperCase(Locale.ROOT);
            if (universe.contains(symbol)) symbols.add(symbol);
        }
        return new ArrayList<>(symbols);
    }
}
