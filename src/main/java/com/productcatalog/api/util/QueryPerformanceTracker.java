package com.productcatalog.api.util;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Times every catalog table call made by {@code DynamoDbCatalogTableClient}, from single-item
 * reads to batch writes. Each call feeds the {@code dynamodb.query.duration} timer, tagged with
 * the DynamoDB operation (index-qualified for Query and Scan) and its outcome. Calls slower
 * than 500 ms are logged at WARN.
 */
@Component
public class QueryPerformanceTracker {

    private static final Logger logger = LoggerFactory.getLogger(QueryPerformanceTracker.class);
    private static final long SLOW_QUERY_THRESHOLD_MS = 500L;

    private final MeterRegistry meterRegistry;

    @Autowired
    public QueryPerformanceTracker(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * @param operation e.g. {@code PutItem} or {@code Query-GSI-3}
     * @param table catalog table name
     * @param call the SDK call; its runtime exceptions are rethrown unchanged
     */
    public <T> T trackCall(String operation, String table, Supplier<T> call) {
        Timer.Sample sample = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();
        String outcome = "success";

        try {
            T result = call.get();
            long duration = System.currentTimeMillis() - startTime;

            if (duration > SLOW_QUERY_THRESHOLD_MS) {
                logger.warn("Slow DynamoDB call detected: operation={}, table={}, duration={}ms",
                    operation, table, duration);
            } else {
                logger.debug("DynamoDB call completed: operation={}, table={}, duration={}ms",
                    operation, table, duration);
            }

            return result;

        } catch (RuntimeException e) {
            outcome = e.getClass().getSimpleName();
            long duration = System.currentTimeMillis() - startTime;
            logger.debug("DynamoDB call ended with {}: operation={}, table={}, duration={}ms",
                outcome, operation, table, duration);
            throw e;

        } finally {
            sample.stop(Timer.builder("dynamodb.query.duration")
                .tag("operation", operation)
                .tag("table", table)
                .tag("outcome", outcome)
                .register(meterRegistry));
        }
    }
}
