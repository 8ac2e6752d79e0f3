package com.sentinelplatform.common.network;

import com.sentinelplatform.common.model.NetworkType;
import com.sentinelplatform.common.model.PaymentToken;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NetworkProfileResolverTest {

    @Test
    @DisplayName("unset network resolves to devnet with public RPC")
    void defaultsToDevnet() {
        NetworkProfile profile = new NetworkProfileResolver(null, "", null).resolveNetwork();

        assertEquals(NetworkType.DEVNET, profile.type());
        assertEquals(NetworkProfiles.DEFAULT_DEVNET_RPC, profile.rpcUrl());
        assertFalse(profile.warningsEnabled());
    }

    @Test
    @DisplayName("devnet accepts USDC only, mainnet USDC then CASH")
    void acceptedTokens() {
        NetworkProfileResolver resolver = NetworkProfileResolver.defaults();

        assertEquals(List.of(PaymentToken.USDC), resolver.profileFor(NetworkType.DEVNET).acceptedTokens());
        assertEquals(List.of(PaymentToken.USDC, PaymentToken.CASH),
                     resolver.profileFor(NetworkType.MAINNET).acceptedTokens());
        assertFalse(resolver.profileFor(NetworkType.DEVNET).supports(PaymentToken.CASH));
    }

    @Test
    @DisplayName("mainnet limits are tight and warnings on")
    void mainnetLimits() {
        NetworkProfile mainnet = new NetworkProfileResolver(NetworkType.MAINNET, null, "https://rpc.example")
            .resolveNetwork();

        assertEquals("https://rpc.example", mainnet.rpcUrl());
        assertEquals(0, mainnet.maxSinglePayment().compareTo(new BigDecimal("0.001")));
        assertEquals(0, mainnet.warningThreshold().compareTo(new BigDecimal("0.0001")));
        assertTrue(mainnet.warningsEnabled());
        assertEquals(NetworkProfiles.MAINNET_CASH_MINT, mainnet.tokenSpec(PaymentToken.CASH).mint());
    }

    @Test
    @DisplayName("explorer link carries the cluster suffix off mainnet")
    void explorerUrl() {
        NetworkProfileResolver resolver = NetworkProfileResolver.defaults();

        assertEquals("https://solscan.io/tx/abc?cluster=devnet",
                     resolver.profileFor(NetworkType.DEVNET).explorerUrl("abc"));
        assertEquals("https://solscan.io/tx/abc",
                     resolver.profileFor(NetworkType.MAINNET).explorerUrl("abc"));
    }

    @Test
    @DisplayName("fee converts to six-decimal base units")
    void baseUnits() {
        TokenSpec usdc = NetworkProfileResolver.defaults().profileFor(NetworkType.DEVNET).tokenSpec(PaymentToken.USDC);

        assertEquals(BigInteger.valueOf(100), usdc.toBaseUnits(new BigDecimal("0.0001")));
        assertEquals(0, usdc.fromBaseUnits(BigInteger.valueOf(100)).compareTo(new BigDecimal("0.0001")));
    }

    @Test
    @DisplayName("token without a mint on the network is rejected")
    void missingMint() {
        NetworkProfile devnet = NetworkProfileResolver.defaults().profileFor(NetworkType.DEVNET);
        assertThrows(IllegalArgumentException.class, () -> devnet.tokenSpec(PaymentToken.CASH));
    }
}
