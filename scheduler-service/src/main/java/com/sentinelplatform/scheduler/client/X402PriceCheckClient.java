package com.sentinelplatform.scheduler.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentinelplatform.common.exception.NetworkUnavailableException;
import com.sentinelplatform.common.exception.PriceUnavailableException;
import com.sentinelplatform.common.exception.VerificationFailedException;
import com.sentinelplatform.common.model.PaymentToken;
import com.sentinelplatform.common.model.Sentinel;
import com.sentinelplatform.common.network.NetworkProfile;
import com.sentinelplatform.common.network.NetworkProfileResolver;
import com.sentinelplatform.common.protocol.CheckRequest;
import com.sentinelplatform.common.protocol.CheckState;
import com.sentinelplatform.common.protocol.PaymentChallenge;
import com.sentinelplatform.common.protocol.PaymentHeaders;
import com.sentinelplatform.common.protocol.SettledCheckResponse;
import com.sentinelplatform.scheduler.payment.PaymentExecutor;
import com.sentinelplatform.scheduler.payment.PaymentOrder;
import com.sentinelplatform.scheduler.payment.TransactionReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Client half of the paid price check against oracle-service.
 *
 * <pre>
 * INIT → REQUEST_SENT ─200→ SETTLED
 *             └─402→ CHALLENGED → PAYING → PAID_RETRY_SENT ─200→ SETTLED
 *                                                        └─402→ FAILED (verification)
 * </pre>
 * Any other answer or a transport failure ends in FAILED. A rejected paid retry is not
 * retried again; the fee stays spent and the next tick starts a fresh check.
 */
@Component
public class X402PriceCheckClient implements PriceCheckClient {

    private static final Logger log = LoggerFactory.getLogger(X402PriceCheckClient.class);

    private final WebClient oracleClient;
    private final PaymentExecutor paymentExecutor;
    private final NetworkProfileResolver resolver;
    private final ObjectMapper objectMapper;
    private final Duration protocolTimeout;

    public X402PriceCheckClient(@Qualifier("oracleClient") WebClient oracleClient,
                                PaymentExecutor paymentExecutor,
                                NetworkProfileResolver resolver,
                                ObjectMapper objectMapper,
                                @Value("${sentinel.timeouts.protocol:15s}") Duration protocolTimeout) {
        this.oracleClient    = oracleClient;
        this.paymentExecutor = paymentExecutor;
        this.resolver        = resolver;
        this.objectMapper    = objectMapper;
        this.protocolTimeout = protocolTimeout;
    }

    @Override
    public Mono<CheckResult> check(Sentinel sentinel) {
        CheckTracker tracker = new CheckTracker(sentinel.id());
        CheckRequest request = CheckRequest.from(sentinel);

        return Mono.defer(() -> {
            tracker.to(CheckState.REQUEST_SENT);
            return post(request, null, null, false);
        })
        .<CheckResult>flatMap(reply -> switch (reply.status()) {
            case 200 -> {
                tracker.to(CheckState.SETTLED);
                yield Mono.just(CheckResult.settled(reply.settled(), sentinel.preferredToken(), null));
            }
            case 402 -> {
                tracker.to(CheckState.CHALLENGED);
                yield payAndRetry(sentinel, request, reply.challenge(), tracker);
            }
            default -> Mono.just(fail(tracker, unexpected(reply, false), sentinel.preferredToken(), null));
        })
        .onErrorResume(e -> Mono.just(fail(tracker, e, sentinel.preferredToken(), null)));
    }

    // ── paid retry ────────────────────────────────────────────────────────────

    private Mono<CheckResult> payAndRetry(Sentinel sentinel, CheckRequest request,
                                          PaymentChallenge challenge, CheckTracker tracker) {
        NetworkProfile profile = resolver.profileFor(sentinel.network());
        PaymentToken token = chooseToken(challenge, sentinel, profile);
        if (challenge.network() != null && challenge.network() != profile.type()) {
            log.warn("Challenge network differs from sentinel network. sentinelId={} challenge={} sentinel={}",
                     sentinel.id(), challenge.network(), profile.type());
        }

        tracker.to(CheckState.PAYING);
        log.info("Paying for check. sentinelId={} amount={} token={} recipient={}",
                 sentinel.id(), challenge.amount(), token, challenge.recipient());

        PaymentOrder order = new PaymentOrder(sentinel.walletAddress(), challenge.recipient(),
                                              challenge.amount(), token, sentinel.network());

        // The retry branch handles its own errors, so anything reaching the last
        // onErrorResume came from the payment itself.
        return paymentExecutor.pay(order)
            .flatMap(payment -> {
                tracker.to(CheckState.PAID_RETRY_SENT);
                return post(request, payment.signature(), token, true)
                    .map(reply -> settleOrFail(reply, tracker, token, payment))
                    .onErrorResume(e -> Mono.just(fail(tracker, e, token, payment)));
            })
            .onErrorResume(e -> Mono.just(fail(tracker, e, token, null)));
    }

    private CheckResult settleOrFail(Reply reply, CheckTracker tracker, PaymentToken token, TransactionReference payment) {
        return switch (reply.status()) {
            case 200 -> {
                tracker.to(CheckState.SETTLED);
                yield CheckResult.settled(reply.settled(), token, payment);
            }
            case 402 -> fail(tracker, new VerificationFailedException(reply.challenge(), payment.signature()), token, payment);
            case 503 -> fail(tracker, new PriceUnavailableException(
                reply.error() != null ? reply.error() : "Oracle unavailable", payment.signature()), token, payment);
            default -> fail(tracker, unexpected(reply, true), token, payment);
        };
    }

    /** The agent's preference when the oracle accepts it on this network, else the first accepted token. */
    static PaymentToken chooseToken(PaymentChallenge challenge, Sentinel sentinel, NetworkProfile profile) {
        List<PaymentToken> accepted = challenge.acceptedTokens() == null
            ? profile.acceptedTokens()
            : challenge.acceptedTokens().stream().filter(profile::supports).toList();
        if (accepted.isEmpty()) {
            accepted = profile.acceptedTokens();
        }
        PaymentToken preferred = sentinel.preferredToken();
        return accepted.contains(preferred) ? preferred : accepted.get(0);
    }

    private CheckResult fail(CheckTracker tracker, Throwable cause, PaymentToken token, TransactionReference payment) {
        CheckState at = tracker.state();
        if (!at.isTerminal()) {
            tracker.to(CheckState.FAILED);
        }
        log.warn("Check failed. state={} reason={}", at, cause.getMessage());
        return CheckResult.failed(cause, token, payment);
    }

    // ── transport ─────────────────────────────────────────────────────────────

    private record Reply(int status, SettledCheckResponse settled, PaymentChallenge challenge, String error) {}

    private Mono<Reply> post(CheckRequest request, String proof, PaymentToken token, boolean paid) {
        WebClient.RequestBodySpec spec = oracleClient.post().uri(PaymentHeaders.CHECK_PRICE_PATH);
        if (proof != null) {
            spec = spec.header(PaymentHeaders.PROOF, proof).header(PaymentHeaders.TOKEN, token.wireValue());
        }
        return spec.bodyValue(request)
            .exchangeToMono(response -> response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> toReply(response.statusCode().value(), body)))
            .timeout(protocolTimeout)
            .onErrorMap(e -> !(e instanceof NetworkUnavailableException),
                        e -> new NetworkUnavailableException("Oracle unreachable: " + e.getMessage(), e, paid));
    }

    private Reply toReply(int status, String body) {
        try {
            if (status == HttpStatus.OK.value()) {
                return new Reply(status, objectMapper.readValue(body, SettledCheckResponse.class), null, null);
            }
            if (status == HttpStatus.PAYMENT_REQUIRED.value()) {
                return new Reply(status, null, objectMapper.readValue(body, PaymentChallenge.class), null);
            }
            JsonNode node = body.isBlank() ? null : objectMapper.readTree(body);
            return new Reply(status, null, null, node != null ? node.path("error").asText(null) : null);
        } catch (Exception e) {
            throw new IllegalStateException("Unreadable oracle response (status " + status + ")", e);
        }
    }

    private static RuntimeException unexpected(Reply reply, boolean paid) {
        String detail = "Oracle answered " + reply.status() + (reply.error() != null ? ": " + reply.error() : "");
        if (reply.status() >= 500) {
            return new NetworkUnavailableException(detail, null, paid);
        }
        return new IllegalStateException(detail);
    }
}
