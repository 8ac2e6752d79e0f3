package com.sentinelplatform.common.network;

import com.sentinelplatform.common.model.NetworkType;
import com.sentinelplatform.common.model.PaymentToken;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Everything network-specific a payment needs: RPC endpoint, stablecoin mints and the
 * safety limits. Immutable; build through {@link NetworkProfiles}.
 */
public record NetworkProfile(
    NetworkType type,
    String displayName,
    String rpcUrl,
    String explorerBaseUrl,
    Map<PaymentToken, TokenSpec> tokens,
    BigDecimal maxSinglePayment,
    BigDecimal warningThreshold,
    boolean warningsEnabled
) {
    public NetworkProfile {
        tokens = Collections.unmodifiableMap(new EnumMap<>(tokens));
    }

    public boolean supports(PaymentToken token) {
        return token != null && tokens.containsKey(token);
    }

    /** @throws IllegalArgumentException when the token has no mint on this network */
    public TokenSpec tokenSpec(PaymentToken token) {
        TokenSpec spec = tokens.get(token);
        if (spec == null) {
            throw new IllegalArgumentException(token + " has no mint on " + type.wireValue());
        }
        return spec;
    }

    /** Tokens with a mint on this network, USDC first. */
    public List<PaymentToken> acceptedTokens() {
        return List.copyOf(tokens.keySet());
    }

    public boolean isMainnet() {
        return type == NetworkType.MAINNET;
    }

    public String explorerUrl(String signature) {
        String url = explorerBaseUrl + "/tx/" + signature;
        return isMainnet() ? url : url + "?cluster=devnet";
    }
}
