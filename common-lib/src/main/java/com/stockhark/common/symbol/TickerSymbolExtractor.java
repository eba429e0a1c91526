package com.stockhark.common.symbol;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Bare-word ticker extraction: every 1–5 letter word of the upper-cased text is a
 * candidate, kept only if it is not a known false positive and is listed in the
 * {@link TickerUniverse}. First-seen order, no duplicates, at most {@code maxSymbols}.
 */
public final class TickerSymbolExtractor implements SymbolExtractor {

    public static final int DEFAULT_MAX_SYMBOLS = 10;

    private static final Pattern CANDIDATE = Pattern.compile("\\b[A-Z]{1,5}\\b");

    /** Upper-case words that are far more often prose, slang or jargon than tickers. */
    static final Set<String> FALSE_POSITIVES = Set.of(
        // common English words
        "THE", "AND", "FOR", "ARE", "BUT", "NOT", "YOU", "ALL", "CAN", "HER",
        "WAS", "ONE", "OUR", "OUT", "DAY", "GET", "HAS", "HIM", "HIS", "HOW",
        "ITS", "MAY", "NEW", "NOW", "OLD", "SEE", "TWO", "WHO", "BOY", "DID",
        "ILL", "LET", "MAN", "PUT", "SAY", "SHE", "TOO", "USE", "WAY", "WIN",
        "YES", "YET", "BAD", "BIG", "BOX", "CUP", "END", "FAN", "FUN", "GOT",
        "HAD", "HIT", "HOT", "LOT", "MOM", "POP", "RUN", "SIT", "TOP", "TRY",
        "ZIP", "WILL", "WITH", "HAVE", "FROM", "BEEN", "MORE", "VERY", "WELL",
        // social media abbreviations
        "LOL", "OMG", "WTF", "TBH", "IMO", "YOLO", "WSB", "TLDR", "ELI",
        "AMA", "TIL", "DAE", "PSA", "LPT", "TIFU", "HODL",
        // trading jargon
        "BUY", "SELL", "HOLD", "LONG", "SHORT", "CALL", "MOON",
        "BEAR", "BULL", "FOMO", "ATH", "ATL", "RSI", "MACD",
        // days and months
        "MON", "TUE", "WED", "THU", "FRI", "SAT", "SUN",
        "JAN", "FEB", "MAR", "APR", "JUN", "JUL", "AUG", "SEP", "OCT", "NOV", "DEC"
    );

    private final TickerUniverse universe;
    private final int maxSymbols;

    public TickerSymbolExtractor(TickerUniverse universe, int maxSymbols) {
        this.universe   = Objects.requireNonNull(universe, "universe");
        this.maxSymbols = maxSymbols;
    }

    public TickerSymbolExtractor(TickerUniverse universe) {
        this(universe, DEFAULT_MAX_SYMBOLS);
    }

    @Override
    public List<String> extract(String text) {
        if (text == null || text.isEmpty()) return List.of();

        List<String> symbols = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Matcher m = CANDIDATE.matcher(text.toUpperCase(Locale.ROOT));

        while (m.find() && symbols.size() < maxSymbols) {
            String candidate = m.group();
            if (!seen.add(candidate)) continue;
            if (!FALSE_POSITIVES.contains(candidate) && universe.contains(candidate)) {
                symbols.add(candidate);
            }
        }
        return symbols;
    }
}
