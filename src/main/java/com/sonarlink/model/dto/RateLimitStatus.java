package com.sonarlink.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RateLimitStatus {

    private double available;

    private long capacity;

    private double utilizationPercent;

    private double refillRatePerSecond;

    /**
     * Remaining time, in milliseconds, during which refill is suspended after an upstream 429.
     */
    private long pausedForMillis;
}
