package com.sentinelplatform.oracle.price;

import java.math.BigDecimal;
import java.time.Instant;

public record PriceQuote(BigDecimal price, String source, Instant fetchedAt) {}
