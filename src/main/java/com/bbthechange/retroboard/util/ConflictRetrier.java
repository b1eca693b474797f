package com.bbthechange.retroboard.util;

import com.bbthechange.retroboard.config.CardEngineProperties;
import com.bbthechange.retroboard.exception.TransactionFailedException;
import com.bbthechange.retroboard.exception.VersionConflictException;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Runs a read-validate-write attempt and repeats it when the write loses a race.
 * Each attempt must re-read everything it validates, so a retry sees the winner's state
 * and can fail with the right domain error instead of overwriting it.
 */
@Component
public class ConflictRetrier {

    private static final Logger logger = LoggerFactory.getLogger(ConflictRetrier.class);

    private final int maxRetries;
    private final MeterRegistry meterRegistry;

    @Autowired
    public ConflictRetrier(CardEngineProperties properties, MeterRegistry meterRegistry) {
        this.maxRetries = Math.max(1, properties.getMaxTransactionRetries());
        this.meterRegistry = meterRegistry;
    }

    public <T> T execute(String operation, Supplier<T> attempt) {
        for (int i = 1; i <= maxRetries; i++) {
            try {
                return attempt.get();
            } catch (VersionConflictException e) {
                meterRegistry.counter("retro_transaction_retries_total", "operation", operation).increment();
                if (i < maxRetries) {
                    logger.debug("Retrying {} after conflict (attempt {}/{})", operation, i, maxRetries);
                    continue;
                }
                logger.warn("Max retries exceeded for {} after {} attempts", operation, maxRetries);
                throw new TransactionFailedException(operation, maxRetries, e);
            }
        }
        throw new IllegalStateException("Unreachable retry state for " + operation);
    }

    public void run(String operation, Runnable attempt) {
        execute(operation, () -> {
            attempt.run();
            return null;
        });
    }
}
