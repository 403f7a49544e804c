package com.shelf.matching.scheduler;

import java.time.Duration;
import java.util.Objects;

/**
 * Limits applied by the {@link RollingWindowScheduler}.
 *
 * <ul>
 *   <li>{@code maxConcurrency} (C): executions in flight at any instant</li>
 *   <li>{@code admissionBatchSize} (B) and {@code admissionDelay} (D): during ramp-up,
 *       at most B executions are admitted, then admission pauses for D</li>
 *   <li>{@code itemTimeout}: time budget of a single execution</li>
 * </ul>
 */
public class SchedulerOptions {

    public static final int DEFAULT_MAX_CONCURRENCY = 50;
    public static final int MAX_CONCURRENCY_LIMIT = 500;
    public static final int DEFAULT_ADMISSION_BATCH_SIZE = 10;
    public static final Duration DEFAULT_ADMISSION_DELAY = Duration.ofSeconds(2);
    public static final Duration DEFAULT_ITEM_TIMEOUT = Duration.ofSeconds(60);

    private final int maxConcurrency;
    private final int admissionBatchSize;
    private final Duration admissionDelay;
    private final Duration itemTimeout;

    private SchedulerOptions(Builder builder) {
        this.maxConcurrency = builder.maxConcurrency;
        this.admissionBatchSize = builder.admissionBatchSize;
        this.admissionDelay = builder.admissionDelay;
        this.itemTimeout = builder.itemTimeout;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public int getAdmissionBatchSize() {
        return admissionBatchSize;
    }

    public Duration getAdmissionDelay() {
        return admissionDelay;
    }

    public Duration getItemTimeout() {
        return itemTimeout;
    }

    /**
     * Normalizes a caller-supplied concurrency: null falls back to the default,
     * and the result is clamped into [1, max].
     */
    public static int clampConcurrency(Integer requested, int defaultValue, int max) {
        int value = requested != null ? requested : defaultValue;
        return Math.max(1, Math.min(value, max));
    }

    public static SchedulerOptions defaults() {
        return builder().build();
    }

    /**
     * Options without admission throttling, for callers whose dependencies are not rate limited.
     */
    public static SchedulerOptions unthrottled(int maxConcurrency) {
        return builder()
                .maxConcurrency(maxConcurrency)
                .admissionBatchSize(MAX_CONCURRENCY_LIMIT)
                .admissionDelay(Duration.ZERO)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .maxConcurrency(maxConcurrency)
                .admissionBatchSize(admissionBatchSize)
                .admissionDelay(admissionDelay)
                .itemTimeout(itemTimeout);
    }

    public static class Builder {
        private int maxConcurrency = DEFAULT_MAX_CONCURRENCY;
        private int admissionBatchSize = DEFAULT_ADMISSION_BATCH_SIZE;
        private Duration admissionDelay = DEFAULT_ADMISSION_DELAY;
        private Duration itemTimeout = DEFAULT_ITEM_TIMEOUT;

        /**
         * Sets C. Values outside [1, {@value #MAX_CONCURRENCY_LIMIT}] are clamped.
         */
        public Builder maxConcurrency(int maxConcurrency) {
            this.maxConcurrency = clampConcurrency(maxConcurrency, DEFAULT_MAX_CONCURRENCY, MAX_CONCURRENCY_LIMIT);
            return this;
        }

        public Builder admissionBatchSize(int admissionBatchSize) {
            if (admissionBatchSize <= 0) {
                throw new IllegalArgumentException("admissionBatchSize must be positive");
            }
            this.admissionBatchSize = admissionBatchSize;
            return this;
        }

        public Builder admissionDelay(Duration admissionDelay) {
            Objects.requireNonNull(admissionDelay, "admissionDelay is required");
            if (admissionDelay.isNegative()) {
                throw new IllegalArgumentException("admissionDelay must not be negative");
            }
            this.admissionDelay = admissionDelay;
            return this;
        }

        public Builder itemTimeout(Duration itemTimeout) {
            Objects.requireNonNull(itemTimeout, "itemTimeout is required");
            if (itemTimeout.isZero() || itemTimeout.isNegative()) {
                throw new IllegalArgumentException("itemTimeout must be positive");
            }
            this.itemTimeout = itemTimeout;
            return this;
        }

        public SchedulerOptions build() {
            return new SchedulerOptions(this);
        }
    }

    @Override
    public String toString() {
        return "SchedulerOptions{" +
                "maxConcurrency=" + maxConcurrency +
                ", admissionBatchSize=" + admissionBatchSize +
                ", admissionDelay=" + admissionDelay +
                ", itemTimeout=" + itemTimeout +
                '}';
    }
}
