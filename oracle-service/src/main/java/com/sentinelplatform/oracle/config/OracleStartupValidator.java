package com.sentinelplatform.oracle.config;

import com.sentinelplatform.common.network.NetworkProfile;
import com.sentinelplatform.common.network.NetworkProfileResolver;
import com.sentinelplatform.oracle.price.CoinMarketCapClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Logs a configuration summary once the oracle is up. Problems are reported, not fatal:
 * an oracle without a recipient still answers challenges but can never verify a payment.
 */
@Component
public class OracleStartupValidator {

    private static final Logger log = LoggerFactory.getLogger(OracleStartupValidator.class);

    static final String NO_RECIPIENT = "oracle.payment.recipient is not set; payments cannot be verified";

    private final NetworkProfileResolver resolver;
    private final CoinMarketCapClient coinMarketCap;

    @Value("${oracle.payment.recipient:}")
    private String recipient;

    @Value("${oracle.payment.fee:0.0001}")
    private BigDecimal fee;

    @Value("${oracle.price.simulated-fallback:false}")
    private boolean simulatedFallback;

    public OracleStartupValidator(NetworkProfileResolver resolver, CoinMarketCapClient coinMarketCap) {
        this.resolver      = resolver;
        this.coinMarketCap = coinMarketCap;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        List<String> problems = validate();
        NetworkProfile profile = resolver.resolveNetwork();
        log.info("Oracle configuration. network={} rpc={} recipientConfigured={} fee={} coinMarketCap={} simulatedFallback={}",
                 profile.type().wireValue(), profile.rpcUrl(), !problems.contains(NO_RECIPIENT), fee.toPlainString(),
                 coinMarketCap.isConfigured(), simulatedFallback);
        if (profile.isMainnet()) {
            log.warn("MAINNET MODE: payments move real funds");
        }
        problems.forEach(p -> log.error("Configuration problem: {}", p));
    }

    List<String> validate() {
        List<String> problems = new ArrayList<>();
        NetworkProfile profile = resolver.resolveNetwork();
        if (recipient == null || recipient.isBlank()) {
            problems.add(NO_RECIPIENT);
        }
        if (fee == null || fee.signum() <= 0) {
            problems.add("oracle.payment.fee must be greater than zero");
        } else if (fee.compareTo(profile.maxSinglePayment()) > 0) {
            problems.add("oracle.payment.fee " + fee.toPlainString() + " exceeds the "
                         + profile.displayName() + " single-payment ceiling; every payment will be refused");
        }
        if (!coinMarketCap.isConfigured()) {
            problems.add("oracle.price.coinmarketcap.api-key is not set; prices come from CoinGecko"
                         + (simulatedFallback ? " or simulation" : ""));
        }
        if (profile.isMainnet() && simulatedFallback) {
            problems.add("oracle.price.simulated-fallback is on for mainnet");
        }
        return problems;
    }
}
