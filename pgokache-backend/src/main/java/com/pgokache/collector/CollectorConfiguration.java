package com.pgokache.collector;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CollectorConfiguration {

    @Bean
    public CollectorSettings collectorSettings(
            @Value("${pgokache.collector.interval-sec:60}") int intervalSec,
            @Value("${pgokache.collector.limit:200}") int limit,
            @Value("${pgokache.collector.min-calls:5}") long minCalls,
            @Value("${pgokache.collector.min-total-time-ms:50}") double minTotalTimeMs,
            @Value("${pgokache.collector.store-full-query-text:false}") boolean storeFullQueryText,
            @Value("${pgokache.collector.connection-timeout-ms:5000}") long connectionTimeoutMs,
            @Value("${pgokache.collector.statement-timeout-ms:30000}") long statementTimeoutMs
    ) {
        return CollectorSettings.builder()
                .intervalSec(intervalSec)
                .limit(limit)
                .minCalls(minCalls)
                .minTotalTimeMs(minTotalTimeMs)
                .storeFullQueryText(storeFullQueryText)
                .connectionTimeoutMs(connectionTimeoutMs)
                .statementTimeoutMs(statementTimeoutMs)
                .build();
    }
}
