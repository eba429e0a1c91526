package com.stockhark.common.symbol;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * The set of listed ticker symbols, keyed by exchange-agnostic upper-case symbol.
 *
 * <p>Loaded from JSON arrays of strings on the classpath. A missing or unreadable
 * resource is logged and skipped: the universe degrades to whatever loaded,
 * possibly nothing, rather than failing startup.
 */
public final class TickerUniverse {

    private static final Logger log = LoggerFactory.getLogger(TickerUniverse.class);

    public static final List<String> DEFAULT_RESOURCES = List.of(
        "tickers/nasdaq_tickers.json",
        "tickers/amex_tickers.json"
    );

    private static final TypeReference<List<String>> SYMBOL_LIST = new TypeReference<>() {};

    private final Set<String> symbols;

    private TickerUniverse(Set<String> symbols) {
        this.symbols = Set.copyOf(symbols);
    }

    public static TickerUniverse of(Collection<String> symbols) {
        Set<String> normalized = new HashSet<>();
        for (String s : symbols) {
            if (s != null && !s.isBlank()) normalized.add(s.trim().toUpperCase(Locale.ROOT));
        }
        return new TickerUniverse(normalized);
    }

    public static TickerUniverse loadDefault(ObjectMapper mapper) {
        return load(mapper, DEFAULT_RESOURCES);
    }

    public static TickerUniverse load(ObjectMapper mapper, List<String> resources) {
        Set<String> all = new HashSet<>();
        ClassLoader loader = TickerUniverse.class.getClassLoader();
        for (String resource : resources) {
            try (InputStream in = loader.getResourceAsStream(resource)) {
                if (in == null) {
                    log.warn("Ticker resource not found. resource={}", resource);
                    continue;
                }
                List<String> loaded = mapper.readValue(in, SYMBOL_LIST);
                all.addAll(loaded);
                log.info("Ticker resource loaded. resource={} symbols={}", resource, loaded.size());
            } catch (IOException e) {
                log.warn("Ticker resource unreadable. resource={} reason={}", resource, e.getMessage());
            }
        }
        return of(all);
    }

    public boolean contains(String symbol) {
        return symbol != null && symbols.contains(symbol.toUpperCase(Locale.ROOT));
    }

    public int size() {
        return symbols.size();
    }
}
