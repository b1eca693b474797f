package com.bbthechange.retroboard.util;

import com.bbthechange.retroboard.exception.VersionConflictException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Times every DynamoDB round trip made by the card, reaction and board repositories.
 * Slow calls are logged at warn. Calls rejected by a condition expression are tagged
 * {@code outcome=conflict} apart from real failures, so retry pressure on busy boards is visible.
 */
@Component
public class QueryPerformanceTracker {

    private static final Logger logger = LoggerFactory.getLogger(QueryPerformanceTracker.class);
    private static final long SLOW_QUERY_THRESHOLD_MS = 500L;
    private static final String TIMER_NAME = "dynamodb.query.duration";

    private final MeterRegistry meterRegistry;

    @Autowired
    public QueryPerformanceTracker(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Run a store operation and record its latency.
     *
     * @param operation short operation name, used as a metric tag
     * @param table table the operation targets
     * @param queryOperation the call to execute
     * @return whatever the call returns
     */
    public <T> T trackQuery(String operation, String table, Supplier<T> queryOperation) {
        Timer.Sample sample = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();
        String outcome = "success";

        try {
            T result = queryOperation.get();
            long duration = System.currentTimeMillis() - startTime;

            if (duration > SLOW_QUERY_THRESHOLD_MS) {
                logger.warn("Slow DynamoDB call: operation={}, table={}, duration={}ms",
                    operation, table, duration);
            } else {
                logger.debug("DynamoDB call completed: operation={}, table={}, duration={}ms",
                    operation, table, duration);
            }
            return result;

        } catch (VersionConflictException e) {
            outcome = "conflict";
            logger.debug("DynamoDB condition rejected: operation={}, table={}", operation, table);
            throw e;

        } catch (RuntimeException e) {
            outcome = "error";
            logger.debug("DynamoDB call failed: operation={}, table={}, error={}",
                operation, table, e.getMessage());
            throw e;

        } finally {
            sample.stop(Timer.builder(TIMER_NAME)
                .tag("operation", operation)
                .tag("table", table)
                .tag("outcome", outcome)
                .register(meterRegistry));
        }
    }
}
