package com.stockhark.sentiment;

import com.stockhark.sentiment.config.AggregationProperties;
import com.stockhark.sentiment.config.CollectionProperties;
import com.stockhark.sentiment.config.RankingProperties;
import com.stockhark.sentiment.config.RedditProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
    AggregationProperties.class,
    CollectionProperties.class,
    RankingProperties.class,
    RedditProperties.class
})
public class SentimentServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(SentimentServiceApplication.class, args);
    }
}
