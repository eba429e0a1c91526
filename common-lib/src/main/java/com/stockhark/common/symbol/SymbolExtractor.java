package com.stockhark.common.symbol;

import java.util.List;

/**
 * Turns free text into a list of confirmed ticker symbols.
 *
 * <p>Implementations must be stateless after construction and never return
 * {@code null}; text without symbols yields an empty list.
 */
public interface SymbolExtractor {

    List<String> extract(String text);
}
