package com.sentinelplatform.common.network;

import com.sentinelplatform.common.model.NetworkType;
import com.sentinelplatform.common.model.PaymentToken;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

public final class NetworkProfiles {

    public static final String DEFAULT_DEVNET_RPC  = "https://api.devnet.solana.com";
    public static final String DEFAULT_MAINNET_RPC = "https://api.mainnet-beta.solana.com";
    public static final String EXPLORER            = "https://solscan.io";

    public static final String DEVNET_USDC_MINT  = "4zMMC9srt5Ri5X14GAgXhaHii3GnPAEERYPJgZJDncDU";
    public static final String MAINNET_USDC_MINT = "EPjFWdd5AufqSSqeM2qN1xzybapC8G4wEGGkZwyTDt1v";
    public static final String MAINNET_CASH_MINT = "CASHVDm2wsJXfhj6VWxb7GiMdoLc17Du7paH4bNr5woT";

    private NetworkProfiles() {}

    // Test tokens only, so the limits are loose and warnings stay quiet.
    public static NetworkProfile devnet(String rpcUrl) {
        Map<PaymentToken, TokenSpec> tokens = new EnumMap<>(PaymentToken.class);
        tokens.put(PaymentToken.USDC, new TokenSpec(DEVNET_USDC_MINT, 6));
        return new NetworkProfile(
            NetworkType.DEVNET, "Devnet", orDefault(rpcUrl, DEFAULT_DEVNET_RPC), EXPLORER, tokens,
            new BigDecimal("100"), new BigDecimal("10"), false);
    }

    public static NetworkProfile mainnet(String rpcUrl) {
        Map<PaymentToken, TokenSpec> tokens = new EnumMap<>(PaymentToken.class);
        tokens.put(PaymentToken.USDC, new TokenSpec(MAINNET_USDC_MINT, 6));
        tokens.put(PaymentToken.CASH, new TokenSpec(MAINNET_CASH_MINT, 6));
        return new NetworkProfile(
            NetworkType.MAINNET, "Mainnet", orDefault(rpcUrl, DEFAULT_MAINNET_RPC), EXPLORER, tokens,
            new BigDecimal("0.001"), new BigDecimal("0.0001"), true);
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
