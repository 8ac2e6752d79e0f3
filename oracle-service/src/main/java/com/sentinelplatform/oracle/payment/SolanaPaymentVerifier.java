package com.sentinelplatform.oracle.payment;

import com.fasterxml.jackson.databind.JsonNode;
import com.sentinelplatform.common.network.NetworkProfile;
import com.sentinelplatform.common.network.NetworkProfileResolver;
import com.sentinelplatform.common.network.TokenSpec;
import com.sentinelplatform.common.protocol.PaymentProof;
import com.sentinelplatform.common.rpc.SolanaRpcClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Verifies a proof against the chain: the transaction must exist, have succeeded, be recent,
 * and have moved at least the fee from the paying agent's wallet into the recipient's account
 * for the expected mint.
 *
 * <p>Credit and debit are read from the pre/post token balances of the parsed transaction,
 * which covers both plain and checked SPL transfers.
 */
@Component
public class SolanaPaymentVerifier implements PaymentVerifier {

    private static final Logger log = LoggerFactory.getLogger(SolanaPaymentVerifier.class);

    private final SolanaRpcClient rpc;
    private final NetworkProfileResolver resolver;
    private final ProofLedger ledger;

    public SolanaPaymentVerifier(SolanaRpcClient rpc, NetworkProfileResolver resolver, ProofLedger ledger) {
        this.rpc      = rpc;
        this.resolver = resolver;
        this.ledger   = ledger;
    }

    @Override
    public Mono<VerificationResult> verify(PaymentProof proof) {
        NetworkProfile profile = resolver.profileFor(proof.network());
        if (!profile.supports(proof.token())) {
            return Mono.just(VerificationResult.rejected(
                proof.token() + " is not accepted on " + profile.type().wireValue()));
        }
        if (proof.recipient() == null || proof.recipient().isBlank()) {
            return Mono.just(VerificationResult.rejected("Oracle has no payment recipient configured"));
        }
        if (proof.payerWallet() == null || proof.payerWallet().isBlank()) {
            return Mono.just(VerificationResult.rejected("Payer wallet missing"));
        }
        if (!ledger.reserve(proof.signature())) {
            log.warn("Replayed payment proof rejected. signature={}", proof.signature());
            return Mono.just(VerificationResult.rejected("Payment proof already used"));
        }

        TokenSpec token = profile.tokenSpec(proof.token());
        return rpc.getTransaction(proof.network(), proof.signature())
            .map(tx -> inspect(tx, proof, token))
            .defaultIfEmpty(VerificationResult.rejected("Transaction not found"))
            .doOnNext(result -> {
                if (!result.verified()) {
                    ledger.release(proof.signature());
                    log.warn("Payment verification failed. signature={} reason={}", proof.signature(), result.reason());
                } else {
                    log.info("Payment verified. signature={} token={} amount={}",
                             proof.signature(), proof.token(), proof.amount());
                }
            })
            .doOnError(e -> ledger.release(proof.signature()));
    }

    private VerificationResult inspect(JsonNode tx, PaymentProof proof, TokenSpec token) {
        JsonNode meta = tx.path("meta");
        JsonNode err = meta.path("err");
        if (!err.isMissingNode() && !err.isNull()) {
            return VerificationResult.rejected("Transaction failed on chain");
        }

        long blockTime = tx.path("blockTime").asLong(0);
        if (blockTime > 0 && Instant.ofEpochSecond(blockTime).isBefore(Instant.now().minus(ledger.ttl()))) {
            return VerificationResult.rejected("Payment proof expired");
        }

        BigInteger credited = balanceOf(meta.path("postTokenBalances"), proof.recipient(), token.mint())
            .subtract(balanceOf(meta.path("preTokenBalances"), proof.recipient(), token.mint()));
        BigInteger required = token.toBaseUnits(proof.amount());

        if (credited.signum() <= 0) {
            return VerificationResult.rejected("No transfer of the expected token to the recipient");
        }
        if (credited.compareTo(required) < 0) {
            return VerificationResult.rejected("Payment amount too low: credited=" + token.fromBaseUnits(credited)
                                               + " required=" + proof.amount());
        }

        BigInteger debited = balanceOf(meta.path("preTokenBalances"), proof.payerWallet(), token.mint())
            .subtract(balanceOf(meta.path("postTokenBalances"), proof.payerWallet(), token.mint()));
        if (debited.compareTo(required) < 0) {
            return VerificationResult.rejected("Transfer was not paid from the requesting wallet");
        }
        return VerificationResult.ok();
    }

    private static BigInteger balanceOf(JsonNode balances, String owner, String mint) {
        BigInteger total = BigInteger.ZERO;
        for (JsonNode entry : balances) {
            if (owner.equals(entry.path("owner").asText()) && mint.equals(entry.path("mint").asText())) {
                total = total.add(new BigInteger(entry.path("uiTokenAmount").path("amount").asText("0")));
            }
        }
        return total;
    }
}
