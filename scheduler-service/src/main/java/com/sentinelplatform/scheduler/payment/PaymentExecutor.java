package com.sentinelplatform.scheduler.payment;

import com.sentinelplatform.common.exception.InsufficientFundsException;
import com.sentinelplatform.common.exception.NetworkUnavailableException;
import com.sentinelplatform.common.exception.PaymentCeilingExceededException;
import com.sentinelplatform.common.exception.PaymentFailedException;
import com.sentinelplatform.common.exception.UnsupportedTokenException;
import com.sentinelplatform.common.model.NetworkType;
import com.sentinelplatform.common.network.NetworkProfile;
import com.sentinelplatform.common.network.NetworkProfileResolver;
import com.sentinelplatform.common.network.TokenSpec;
import com.sentinelplatform.common.rpc.RpcErrorException;
import com.sentinelplatform.common.rpc.SignatureStatus;
import com.sentinelplatform.common.rpc.SolanaRpcClient;
import com.sentinelplatform.scheduler.balance.BalanceOracle;
import com.sentinelplatform.scheduler.custody.TransferInstruction;
import com.sentinelplatform.scheduler.custody.WalletCustody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Moves one stablecoin fee from an agent wallet to the oracle's recipient.
 *
 * <p>Checks run in a fixed order and each one fails before any network call that follows it:
 * token availability, positive amount, the network's single-payment ceiling, then a balance
 * pre-flight. Only then is a transfer signed by custody, submitted and polled until
 * {@code confirmed}. The ceiling is never clamped.
 *
 * <p>Cancelling the returned {@link Mono} abandons the confirmation wait; a transfer already
 * submitted may still land.
 */
@Component
public class PaymentExecutor {

    private static final Logger log = LoggerFactory.getLogger(PaymentExecutor.class);

    private final NetworkProfileResolver resolver;
    private final BalanceOracle balanceOracle;
    private final SolanaRpcClient rpc;
    private final WalletCustody custody;
    private final Scheduler scheduler;
    private final Duration confirmationTimeout;
    private final Duration pollInterval;

    public PaymentExecutor(NetworkProfileResolver resolver,
                           BalanceOracle balanceOracle,
                           SolanaRpcClient rpc,
                           WalletCustody custody,
                           @Qualifier("monitorScheduler") Scheduler scheduler,
                           @Value("${sentinel.timeouts.confirmation:60s}") Duration confirmationTimeout,
                           @Value("${sentinel.payment.poll-interval:500ms}") Duration pollInterval) {
        this.resolver            = resolver;
        this.balanceOracle       = balanceOracle;
        this.rpc                 = rpc;
        this.custody             = custody;
        this.scheduler           = scheduler;
        this.confirmationTimeout = confirmationTimeout;
        this.pollInterval        = pollInterval;
    }

    public Mono<TransactionReference> pay(PaymentOrder order) {
        return Mono.defer(() -> {
            NetworkProfile profile = resolver.profileFor(order.network());

            if (!profile.supports(order.token())) {
                return Mono.error(new UnsupportedTokenException(order.token(), profile.type()));
            }
            if (order.amount() == null || order.amount().signum() <= 0) {
                return Mono.error(new IllegalArgumentException("Payment amount must be greater than 0"));
            }
            if (order.amount().compareTo(profile.maxSinglePayment()) > 0) {
                log.error("Payment refused above ceiling. wallet={} amount={} ceiling={} network={}",
                          order.fromWallet(), order.amount(), profile.maxSinglePayment(), profile.type().wireValue());
                return Mono.error(new PaymentCeilingExceededException(
                    profile.type(), order.amount(), profile.maxSinglePayment()));
            }
            if (profile.warningsEnabled() && order.amount().compareTo(profile.warningThreshold()) > 0) {
                log.warn("Large payment on {}. wallet={} amount={} token={}",
                         profile.displayName(), order.fromWallet(), order.amount(), order.token());
            }

            long startedAt = scheduler.now(TimeUnit.MILLISECONDS);
            TokenSpec spec = profile.tokenSpec(order.token());

            return balanceOracle.getStablecoinBalance(order.fromWallet(), order.token(), order.network())
                .flatMap(balance -> {
                    if (balance.compareTo(order.amount()) < 0) {
                        log.warn("Insufficient funds. wallet={} token={} required={} available={}",
                                 order.fromWallet(), order.token(), order.amount(), balance);
                        return Mono.error(new InsufficientFundsException(order.token(), order.amount(), balance));
                    }
                    return submit(order, spec);
                })
                .flatMap(signature -> awaitConfirmation(order.network(), signature))
                .map(signature -> {
                    long elapsed = scheduler.now(TimeUnit.MILLISECONDS) - startedAt;
                    log.info("Payment confirmed. wallet={} token={} amount={} signature={} settlementMs={}",
                             order.fromWallet(), order.token(), order.amount(), signature, elapsed);
                    return new TransactionReference(signature, order.token(), order.amount(), order.network(),
                                                    elapsed, profile.explorerUrl(signature));
                });
        });
    }

    // ── submission ────────────────────────────────────────────────────────────

    private Mono<String> submit(PaymentOrder order, TokenSpec spec) {
        return rpc.getLatestBlockhash(order.network())
            .flatMap(blockhash -> custody.signerFor(order.fromWallet()).signTransfer(new TransferInstruction(
                order.fromWallet(), order.toAddress(), spec.mint(), spec.toBaseUnits(order.amount()),
                spec.decimals(), blockhash, order.network())))
            .flatMap(signed -> rpc.sendTransaction(order.network(), signed)
                .onErrorMap(RpcErrorException.class,
                            e -> new PaymentFailedException("Transfer rejected by node: " + e.getMessage(), null, e))
                .onErrorMap(e -> e instanceof NetworkUnavailableException && !(e instanceof RpcErrorException),
                            e -> new NetworkUnavailableException(e.getMessage(), e, true)))
            .doOnNext(signature -> log.info("Transfer submitted. wallet={} signature={}", order.fromWallet(), signature));
    }

    // ── confirmation ──────────────────────────────────────────────────────────

    /**
     * Polls the signature status until the cluster reports {@code confirmed} or {@code finalized}.
     * Transient RPC errors while polling count as "not seen yet".
     */
    private Mono<String> awaitConfirmation(NetworkType network, String signature) {
        return Flux.interval(Duration.ZERO, pollInterval, scheduler)
            .concatMap(tick -> rpc.getSignatureStatus(network, signature)
                .onErrorResume(NetworkUnavailableException.class, e -> Mono.just(SignatureStatus.notFound())))
            .filter(status -> status.isConfirmed() || status.failed())
            .next()
            .timeout(confirmationTimeout, scheduler)
            .onErrorMap(TimeoutException.class, e -> new PaymentFailedException(
                "Transfer not confirmed within " + confirmationTimeout.toSeconds() + "s", signature, e))
            .flatMap(status -> status.failed()
                ? Mono.error(new PaymentFailedException("Transfer failed on chain: " + status.error(), signature))
                : Mono.just(signature));
    }
}
