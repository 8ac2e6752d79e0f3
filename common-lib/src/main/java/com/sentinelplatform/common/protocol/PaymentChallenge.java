package com.sentinelplatform.common.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sentinelplatform.common.model.NetworkType;
import com.sentinelplatform.common.model.PaymentToken;

import java.math.BigDecimal;
import java.util.List;

/**
 * Body of a {@code 402 Payment Required} answer. Never carries price data.
 * {@code error} is set only when the challenge is re-issued after a failed verification.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PaymentChallenge(
    @JsonProperty("amount")         BigDecimal amount,
    @JsonProperty("recipient")      String recipient,
    @JsonProperty("acceptedTokens") List<PaymentToken> acceptedTokens,
    @JsonProperty("network")        NetworkType network,
    @JsonProperty("message")        String message,
    @JsonProperty("error")          String error
) {
    public PaymentChallenge withError(String reason) {
        return new PaymentChallenge(amount, recipient, acceptedTokens, network, message, reason);
    }
}
