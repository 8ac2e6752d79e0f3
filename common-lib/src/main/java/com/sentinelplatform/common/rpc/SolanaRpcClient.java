package com.sentinelplatform.common.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentinelplatform.common.exception.NetworkUnavailableException;
import com.sentinelplatform.common.model.NetworkType;
import com.sentinelplatform.common.network.NetworkProfileResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Minimal Solana JSON-RPC client over {@link WebClient}.
 *
 * <p>The endpoint is picked per call from the caller's {@link NetworkType}, so one instance
 * serves agents on both networks. Every call carries its own timeout. Transport failures,
 * timeouts and unparsable bodies surface as {@link NetworkUnavailableException}; an
 * explicit JSON-RPC error surfaces as {@link RpcErrorException}.
 */
public class SolanaRpcClient {

    private static final Logger log = LoggerFactory.getLogger(SolanaRpcClient.class);

    private static final BigDecimal LAMPORTS_PER_SOL = new BigDecimal("1000000000");

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final NetworkProfileResolver resolver;
    private final Duration timeout;
    private final AtomicLong requestIds = new AtomicLong();

    public SolanaRpcClient(WebClient webClient, ObjectMapper objectMapper,
                           NetworkProfileResolver resolver, Duration timeout) {
        this.webClient    = webClient;
        this.objectMapper = objectMapper;
        this.resolver     = resolver;
        this.timeout      = timeout;
    }

    // ── balances ──────────────────────────────────────────────────────────────

    /** Native balance in SOL. */
    public Mono<BigDecimal> getBalance(NetworkType network, String address) {
        return call(network, "getBalance", List.of(address, Map.of("commitment", "confirmed")))
            .map(result -> {
                BigInteger lamports = result.path("value").bigIntegerValue();
                return new BigDecimal(lamports).divide(LAMPORTS_PER_SOL);
            });
    }

    /**
     * Sum of every token account the owner holds for {@code mint}, in UI units.
     * An owner without a token account has a zero balance.
     */
    public Mono<BigDecimal> getTokenBalance(NetworkType network, String owner, String mint) {
        List<Object> params = List.of(
            owner,
            Map.of("mint", mint),
            Map.of("encoding", "jsonParsed", "commitment", "confirmed"));

        return call(network, "getTokenAccountsByOwner", params)
            .map(result -> {
                BigDecimal total = BigDecimal.ZERO;
                for (JsonNode account : result.path("value")) {
                    JsonNode amount = account.path("account").path("data")
                        .path("parsed").path("info").path("tokenAmount");
                    String ui = amount.path("uiAmountString").asText("0");
                    total = total.add(new BigDecimal(ui.isBlank() ? "0" : ui));
                }
                return total;
            });
    }

    // ── transactions ──────────────────────────────────────────────────────────

    public Mono<String> getLatestBlockhash(NetworkType network) {
        return call(network, "getLatestBlockhash", List.of(Map.of("commitment", "confirmed")))
            .map(result -> result.path("value").path("blockhash").asText());
    }

    /** Submits a signed, base64-encoded transaction and returns its signature. */
    public Mono<String> sendTransaction(NetworkType network, String signedTransactionBase64) {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("encoding", "base64");
        options.put("preflightCommitment", "confirmed");
        return call(network, "sendTransaction", List.of(signedTransactionBase64, options))
            .map(JsonNode::asText);
    }

    public Mono<SignatureStatus> getSignatureStatus(NetworkType network, String signature) {
        return call(network, "getSignatureStatuses",
                    List.of(List.of(signature), Map.of("searchTransactionHistory", true)))
            .map(result -> {
                JsonNode entry = result.path("value").path(0);
                if (entry.isMissingNode() || entry.isNull()) {
                    return SignatureStatus.notFound();
                }
                JsonNode err = entry.path("err");
                String error = err.isMissingNode() || err.isNull() ? null : err.toString();
                return new SignatureStatus(true, entry.path("confirmationStatus").asText(null), error);
            });
    }

    /** Parsed transaction, or empty when the cluster does not know the signature. */
    public Mono<JsonNode> getTransaction(NetworkType network, String signature) {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("encoding", "jsonParsed");
        options.put("commitment", "confirmed");
        options.put("maxSupportedTransactionVersion", 0);
        return call(network, "getTransaction", List.of(signature, options))
            .filter(result -> !result.isNull() && !result.isMissingNode());
    }

    // ── transport ─────────────────────────────────────────────────────────────

    private Mono<JsonNode> call(NetworkType network, String method, List<Object> params) {
        String rpcUrl = resolver.profileFor(network).rpcUrl();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("jsonrpc", "2.0");
        body.put("id", requestIds.incrementAndGet());
        body.put("method", method);
        body.put("params", params);

        return webClient.post()
            .uri(rpcUrl)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .retrieve()
            .bodyToMono(String.class)
            .timeout(timeout)
            .onErrorMap(e -> !(e instanceof NetworkUnavailableException),
                        e -> new NetworkUnavailableException(
                            "RPC " + method + " unreachable on " + network.wireValue() + ": " + e.getMessage(), e))
            .map(json -> parseResult(method, json))
            .doOnError(e -> log.debug("RPC call failed. method={} network={} reason={}",
                                      method, network.wireValue(), e.getMessage()));
    }

    private JsonNode parseResult(String method, String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (Exception e) {
            throw new NetworkUnavailableException("Unparsable RPC response for " + method, e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new RpcErrorException(method, error.path("code").asInt(), error.path("message").asText());
        }
        return root.path("result");
    }
}
