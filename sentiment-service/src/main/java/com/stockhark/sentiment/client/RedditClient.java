package com.stockhark.sentiment.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Reads the public JSON listing of a community's hot posts.
 *
 * <p>Errors (rate limiting, network, malformed payloads) are logged and absorbed into an
 * empty {@link Flux} so that one unreachable community never fails a collection cycle.
 */
@Component
public class RedditClient {

    private static final Logger log = LoggerFactory.getLogger(RedditClient.class);

    private final WebClient redditWebClient;

    public RedditClient(WebClient redditWebClient) {
        this.redditWebClient = redditWebClient;
    }

    /**
     * @param community community name without the {@code r/} prefix
     * @param limit     maximum number of posts requested
     */
    public Flux<RedditPost> fetchHot(String community, int limit) {
        return redditWebClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/r/{community}/hot.json")
                .queryParam("limit", limit)
                .queryParam("raw_json", 1)
                .build(community))
            .retrieve()
            .bodyToMono(Listing.class)
            .flatMapMany(listing -> Flux.fromIterable(listing.children()))
            .filter(child -> child.data() != null && child.data().id() != null)
            .map(child -> child.data().toPost(community))
            .doOnComplete(() -> log.debug("Community listing fetched. community={}", community))
            .onErrorResume(e -> {
                log.warn("Community fetch failed. community={} reason={}", community, e.getMessage());
                return Flux.empty();
            });
    }

    // ── wire model ─────────────────────────────────────────────────────────

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Listing(@JsonProperty("data") ListingData data) {
        List<Child> children() {
            return data != null && data.children() != null ? data.children() : List.of();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ListingData(@JsonProperty("children") List<Child> children) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Child(@JsonProperty("data") PostData data) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PostData(
        @JsonProperty("id") String id,
        @JsonProperty("subreddit") String subreddit,
        @JsonProperty("title") String title,
        @JsonProperty("selftext") String selfText,
        @JsonProperty("permalink") String permalink,
        @JsonProperty("created_utc") double createdUtc,
        @JsonProperty("stickied") boolean stickied
    ) {
        RedditPost toPost(String requestedCommunity) {
            String community = subreddit != null && !subreddit.isBlank() ? subreddit : requestedCommunity;
            return new RedditPost(id, community, title, selfText, permalink, (long) createdUtc, stickied);
        }
    }
}
