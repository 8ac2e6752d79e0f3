package com.sentinelplatform.oracle.check;

import com.sentinelplatform.common.alert.AlertEvaluator;
import com.sentinelplatform.common.exception.PriceUnavailableException;
import com.sentinelplatform.common.exception.VerificationFailedException;
import com.sentinelplatform.common.model.PaymentToken;
import com.sentinelplatform.common.network.NetworkProfile;
import com.sentinelplatform.common.network.NetworkProfileResolver;
import com.sentinelplatform.common.notification.AlertEvent;
import com.sentinelplatform.common.notification.AlertEventPublisher;
import com.sentinelplatform.common.protocol.CheckRequest;
import com.sentinelplatform.common.protocol.PaymentChallenge;
import com.sentinelplatform.common.protocol.PaymentProof;
import com.sentinelplatform.common.protocol.SettledCheckResponse;
import com.sentinelplatform.oracle.payment.PaymentVerifier;
import com.sentinelplatform.oracle.price.PriceOracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Server half of the paid price check.
 *
 * <p>A request without proof only ever gets a {@link PaymentChallenge}. A request with proof is
 * verified first; only a verified payment reaches the price oracle. Alerts go out at most once
 * per settled check and only for active sentinels.
 */
@Service
public class PriceCheckService {

    private static final Logger log = LoggerFactory.getLogger(PriceCheckService.class);

    static final String ALERT_TITLE = "SOL Price Alert";

    private final PaymentVerifier verifier;
    private final PriceOracle priceOracle;
    private final AlertEventPublisher publisher;
    private final NetworkProfileResolver resolver;
    private final BigDecimal fee;
    private final String recipient;

    public PriceCheckService(PaymentVerifier verifier,
                             PriceOracle priceOracle,
                             AlertEventPublisher publisher,
                             NetworkProfileResolver resolver,
                             @Value("${oracle.payment.fee:0.0001}") BigDecimal fee,
                             @Value("${oracle.payment.recipient:}") String recipient) {
        this.verifier    = verifier;
        this.priceOracle = priceOracle;
        this.publisher   = publisher;
        this.resolver    = resolver;
        this.fee         = fee;
        this.recipient   = recipient;
    }

    public PaymentChallenge challenge(CheckRequest request) {
        NetworkProfile profile = resolver.profileFor(request.network());
        return new PaymentChallenge(
            fee,
            recipient,
            profile.acceptedTokens(),
            profile.type(),
            "Payment of " + fee.toPlainString() + " required for a SOL/USD price check",
            null);
    }

    /**
     * Verifies {@code signature} and, when it pays for this check, answers with the price.
     *
     * @throws VerificationFailedException (as error signal) carrying a fresh challenge
     * @throws PriceUnavailableException   (as error signal) when no price source answered
     */
    public Mono<SettledCheckResponse> settle(CheckRequest request, String signature, String tokenHeader) {
        PaymentChallenge challenge = challenge(request);

        PaymentToken token;
        try {
            token = tokenHeader == null || tokenHeader.isBlank()
                ? challenge.acceptedTokens().get(0)
                : PaymentToken.fromWire(tokenHeader);
        } catch (IllegalArgumentException e) {
            return Mono.error(new VerificationFailedException(
                challenge.withError("Unsupported payment token: " + tokenHeader), signature));
        }

        PaymentProof proof = new PaymentProof(signature, token, challenge.network(), recipient, fee,
                                              request.walletAddress());

        return verifier.verify(proof)
            .flatMap(result -> {
                if (!result.verified()) {
                    return Mono.error(new VerificationFailedException(challenge.withError(result.reason()), signature));
                }
                return priceOracle.getCurrentPrice()
                    .onErrorMap(e -> new PriceUnavailableException(
                        "Price source unavailable: " + e.getMessage(), signature))
                    .map(quote -> {
                        boolean triggered = AlertEvaluator.evaluate(quote.price(), request.threshold(), request.condition());
                        log.info("Check settled. sentinelId={} price={} source={} triggered={} signature={}",
                                 request.sentinelId(), quote.price(), quote.source(), triggered, signature);
                        Instant now = Instant.now();
                        if (triggered) {
                            notifyTrigger(request, quote.price(), now);
                        }
                        return new SettledCheckResponse(quote.price(), triggered, fee, token, signature, now);
                    });
            });
    }

    private void notifyTrigger(CheckRequest request, BigDecimal price, Instant at) {
        if (!request.active()) {
            log.info("Alert suppressed for inactive sentinel. sentinelId={}", request.sentinelId());
            return;
        }
        if (request.notificationTarget() == null || request.notificationTarget().isBlank()) {
            log.info("Alert triggered but no notification target. sentinelId={}", request.sentinelId());
            return;
        }
        publisher.publishAlert(new AlertEvent(request.sentinelId(), request.notificationTarget(),
                                              ALERT_TITLE, price, request.threshold(), at));
    }
}
