package com.sonarlink.service.retry;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetryPolicy {

    @Builder.Default
    private int maxAttempts = 3;

    @Builder.Default
    private Duration baseDelay = Duration.ofSeconds(1);

    @Builder.Default
    private Duration maxDelay = Duration.ofSeconds(30);

    /**
     * Upper bound of the random extra delay, as a fraction of the computed delay.
     */
    @Builder.Default
    private double jitterFraction = 0.1;

    @Builder.Default
    private Set<Integer> retryableStatusCodes = Set.of(429, 500, 502, 503, 504);

    /**
     * How long one attempt may wait for a rate-limit permit.
     */
    @Builder.Default
    private Duration acquireTimeout = Duration.ofSeconds(30);

    public static RetryPolicy defaults() {
        return RetryPolicy.builder().build();
    }
}
