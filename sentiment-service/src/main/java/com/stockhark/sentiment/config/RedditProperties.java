package com.stockhark.sentiment.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "stockhark.reddit")
public record RedditProperties(
    @DefaultValue("https://www.reddit.com") String baseUrl,
    @DefaultValue("stockhark-sentiment/1.0") String userAgent
) {}
