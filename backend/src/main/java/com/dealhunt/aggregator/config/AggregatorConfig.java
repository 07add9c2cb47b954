package com.dealhunt.aggregator.config;

import com.dealhunt.aggregator.search.cache.TtlCache;
import com.dealhunt.aggregator.search.http.MarketplaceHttpClient;
import com.dealhunt.aggregator.search.model.ProductResult;
import com.dealhunt.aggregator.search.model.SearchKey;
import com.dealhunt.aggregator.search.service.FailureTracker;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class AggregatorConfig {

    @Bean(name = "providerExecutor", destroyMethod = "shutdown")
    public ExecutorService providerExecutor(AggregatorProperties properties) {
        return Executors.newFixedThreadPool(properties.getSearch().getProviderConcurrency());
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(AggregatorProperties properties) {
        int size = Math.max(4, properties.getSearch().getProviderConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TtlCache<SearchKey, List<ProductResult>> searchResultCache(AggregatorProperties properties, Clock clock) {
        return new TtlCache<>(clock, Duration.ofSeconds(properties.getSearch().getCacheTtlSeconds()));
    }

    @Bean
    public FailureTracker failureTracker(AggregatorProperties properties, Clock clock) {
        return new FailureTracker(properties.getSearch().getMaxConsecutiveFailures(), clock);
    }

    @Bean(name = "aliexpressHttpClient")
    public MarketplaceHttpClient aliexpressHttpClient(
        AggregatorProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        AggregatorProperties.Aliexpress aliexpress = properties.getAliexpress();
        return new MarketplaceHttpClient(
            properties.getUserAgent(),
            Duration.ofSeconds(aliexpress.getConnectTimeoutSeconds()),
            Duration.ofSeconds(aliexpress.getReadTimeoutSeconds()),
            httpExecutor
        );
    }

    @Bean(name = "ebayHttpClient")
    public MarketplaceHttpClient ebayHttpClient(
        AggregatorProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        AggregatorProperties.Ebay ebay = properties.getEbay();
        return new MarketplaceHttpClient(
            properties.getUserAgent(),
            Duration.ofSeconds(ebay.getConnectTimeoutSeconds()),
            Duration.ofSeconds(ebay.getReadTimeoutSeconds()),
            httpExecutor
        );
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
