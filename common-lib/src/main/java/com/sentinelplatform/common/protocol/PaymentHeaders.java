package com.sentinelplatform.common.protocol;

public final class PaymentHeaders {

    public static final String PROOF = "X-Payment-Proof";
    public static final String TOKEN = "X-Payment-Token";

    public static final String CHECK_PRICE_PATH = "/api/v1/check-price";

    private PaymentHeaders() {}
}
