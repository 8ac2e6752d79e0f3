package com.sentinelplatform.scheduler.custody;

import com.fasterxml.jackson.databind.JsonNode;
import com.sentinelplatform.common.exception.NetworkUnavailableException;
import com.sentinelplatform.common.exception.PaymentFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * {@link WalletCustody} backed by the custody service's signing endpoint
 * ({@code POST /api/v1/wallets/{address}/sign-transfer}).
 *
 * <p>A 4xx means custody refused to sign and is final for this cycle; anything else is
 * treated as the service being unreachable.
 */
@Component
public class RemoteCustodyClient implements WalletCustody {

    private static final Logger log = LoggerFactory.getLogger(RemoteCustodyClient.class);

    private final WebClient custodyClient;

    public RemoteCustodyClient(@Qualifier("custodyClient") WebClient custodyClient) {
        this.custodyClient = custodyClient;
    }

    @Override
    public WalletSigner signerFor(String walletAddress) {
        return new WalletSigner() {
            @Override
            public String walletAddress() {
                return walletAddress;
            }

            @Override
            public Mono<String> signTransfer(TransferInstruction instruction) {
                return sign(walletAddress, instruction);
            }
        };
    }

    private Mono<String> sign(String walletAddress, TransferInstruction instruction) {
        return custodyClient.post()
            .uri("/api/v1/wallets/{address}/sign-transfer", walletAddress)
            .bodyValue(instruction)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .map(body -> {
                String signed = body.path("signedTransaction").asText("");
                if (signed.isBlank()) {
                    throw new PaymentFailedException("Custody returned no signed transaction", null);
                }
                return signed;
            })
            .onErrorMap(WebClientResponseException.class, e -> e.getStatusCode().is4xxClientError()
                ? new PaymentFailedException("Custody refused to sign: " + e.getStatusCode(), null, e)
                : new NetworkUnavailableException("Custody service error: " + e.getStatusCode(), e))
            .onErrorMap(e -> !(e instanceof PaymentFailedException) && !(e instanceof NetworkUnavailableException),
                        e -> new NetworkUnavailableException("Custody service unreachable", e))
            .doOnError(e -> log.warn("Transfer signing failed. wallet={} reason={}", walletAddress, e.getMessage()));
    }
}
