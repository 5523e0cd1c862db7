package com.fintech.metals.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One (time, value) point of a price series as served to dashboards.
 */
public record PricePoint(Instant time, BigDecimal value) {
}
