package com.stockhark.common.weight;

import com.stockhark.common.config.AggregationConfig;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reliability multiplier for the origin of an observation.
 *
 * <p>Lookup order, first hit wins:
 * <ol>
 *   <li>exact key, e.g. {@code reddit/r/wallstreetbets};</li>
 *   <li>same platform and community under a different spelling, e.g.
 *       {@code reddit/r/WallStreetBets} matches {@code reddit/r/wallstreetbets}
 *       (case-insensitive). A community on another platform never borrows its weight;</li>
 *   <li>generic platform weight: a key without {@code /} that prefixes the source,
 *       e.g. {@code reddit} for {@code reddit/r/options};</li>
 *   <li>the table's {@code default} entry.</li>
 * </ol>
 * Unknown or {@code null} sources never fail.
 */
public final class SourceReliabilityWeight {

    private static final Pattern COMMUNITY_SOURCE = Pattern.compile("^([^/]+)/r/([^/]+)$");

    private final Map<String, Double> weights;
    private final double defaultWeight;

    public SourceReliabilityWeight(Map<String, Double> weights) {
        this.weights       = Map.copyOf(weights);
        this.defaultWeight = weights.getOrDefault(AggregationConfig.DEFAULT_KEY, 1.0);
    }

    public double weight(String source) {
        if (source == null || source.isBlank()) {
            return defaultWeight;
        }

        Double exact = weights.get(source);
        if (exact != null) {
            return exact;
        }

        Matcher m = COMMUNITY_SOURCE.matcher(source);
        if (m.matches()) {
            String bestKey = null;
            for (String key : weights.keySet()) {
                Matcher k = COMMUNITY_SOURCE.matcher(key);
                if (k.matches()
                        && k.group(1).equalsIgnoreCase(m.group(1))
                        && k.group(2).toLowerCase(Locale.ROOT).equals(m.group(2).toLowerCase(Locale.ROOT))
                        && (bestKey == null || key.compareTo(bestKey) < 0)) {
                    bestKey = key;
                }
            }
            if (bestKey != null) {
                return weights.get(bestKey);
            }
        }

        String platformKey = null;
        for (String key : weights.keySet()) {
            if (!key.contains("/") && !AggregationConfig.DEFAULT_KEY.equals(key)
                    && source.startsWith(key)
                    && (platformKey == null || key.length() > platformKey.length())) {
                platformKey = key;
            }
        }
        if (platformKey != null) {
            return weights.get(platformKey);
        }

        return defaultWeight;
    }
}
