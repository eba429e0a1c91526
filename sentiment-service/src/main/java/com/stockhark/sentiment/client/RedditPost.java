package com.stockhark.sentiment.client;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * One post from a community listing, reduced to the fields the collector needs.
 *
 * @param createdUtc epoch seconds, as reported by the listing
 */
public record RedditPost(
    String id,
    String community,
    String title,
    String selfText,
    String permalink,
    long createdUtc,
    boolean stickied
) {
    public LocalDateTime createdAt() {
        return LocalDateTime.ofInstant(Instant.ofEpochSecond(createdUtc), ZoneOffset.UTC);
    }

    /** Title and body joined with a single space; either part may be missing. */
    public String fullText() {
        String t = title != null ? title : "";
        String b = selfText != null ? selfText : "";
        return (t + " " + b).trim();
    }
}
