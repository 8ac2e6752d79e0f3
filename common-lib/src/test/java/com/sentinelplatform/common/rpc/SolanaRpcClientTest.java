package com.sentinelplatform.common.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentinelplatform.common.exception.NetworkUnavailableException;
import com.sentinelplatform.common.model.NetworkType;
import com.sentinelplatform.common.network.NetworkProfileResolver;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SolanaRpcClientTest {

    private MockWebServer server;
    private SolanaRpcClient client;
    private final ObjectMapper mapper = new ObjectMapper();

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        String url = server.url("/").toString();
        client = new SolanaRpcClient(WebClient.create(), mapper,
            new NetworkProfileResolver(NetworkType.DEVNET, url, url), Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private void enqueue(String body) {
        server.enqueue(new MockResponse().setHeader("Content-Type", "application/json").setBody(body));
    }

    @Test
    @DisplayName("getBalance converts lamports to SOL")
    void balanceInSol() throws Exception {
        enqueue("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{\"context\":{\"slot\":1},\"value\":1500000000}}");

        StepVerifier.create(client.getBalance(NetworkType.DEVNET, "Owner1"))
            .assertNext(sol -> assertEquals(0, sol.compareTo(new BigDecimal("1.5"))))
            .verifyComplete();

        RecordedRequest request = server.takeRequest();
        JsonNode body = mapper.readTree(request.getBody().readUtf8());
        assertEquals("getBalance", body.path("method").asText());
        assertEquals("Owner1", body.path("params").path(0).asText());
    }

    @Test
    @DisplayName("token balance sums every account and treats none as zero")
    void tokenBalance() {
        enqueue("""
            {"jsonrpc":"2.0","id":1,"result":{"value":[
              {"account":{"data":{"parsed":{"info":{"tokenAmount":{"uiAmountString":"1.25"}}}}}},
              {"account":{"data":{"parsed":{"info":{"tokenAmount":{"uiAmountString":"0.75"}}}}}}
            ]}}""");
        enqueue("{\"jsonrpc\":\"2.0\",\"id\":2,\"result\":{\"value\":[]}}");

        StepVerifier.create(client.getTokenBalance(NetworkType.DEVNET, "Owner1", "Mint1"))
            .assertNext(total -> assertEquals(0, total.compareTo(new BigDecimal("2.00"))))
            .verifyComplete();
        StepVerifier.create(client.getTokenBalance(NetworkType.DEVNET, "Owner1", "Mint1"))
            .assertNext(total -> assertEquals(0, total.signum()))
            .verifyComplete();
    }

    @Test
    @DisplayName("JSON-RPC error object → RpcErrorException")
    void rpcError() {
        enqueue("{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32002,\"message\":\"simulation failed\"}}");

        StepVerifier.create(client.sendTransaction(NetworkType.DEVNET, "AAAA"))
            .expectErrorSatisfies(e -> {
                assertInstanceOf(RpcErrorException.class, e);
                assertEquals(-32002, ((RpcErrorException) e).getCode());
            })
            .verify();
    }

    @Test
    @DisplayName("HTTP 500 → NetworkUnavailableException")
    void serverError() {
        server.enqueue(new MockResponse().setResponseCode(500));

        StepVerifier.create(client.getLatestBlockhash(NetworkType.DEVNET))
            .expectError(NetworkUnavailableException.class)
            .verify();
    }

    @Test
    @DisplayName("unknown signature status → notFound, failed status carries the error")
    void signatureStatuses() {
        enqueue("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{\"value\":[null]}}");
        enqueue("""
            {"jsonrpc":"2.0","id":2,"result":{"value":[
              {"slot":5,"confirmations":null,"err":{"InstructionError":[0,"Custom"]},"confirmationStatus":"confirmed"}
            ]}}""");
        enqueue("""
            {"jsonrpc":"2.0","id":3,"result":{"value":[
              {"slot":5,"confirmations":null,"err":null,"confirmationStatus":"finalized"}
            ]}}""");

        StepVerifier.create(client.getSignatureStatus(NetworkType.DEVNET, "sig"))
            .assertNext(s -> assertFalse(s.found()))
            .verifyComplete();
        StepVerifier.create(client.getSignatureStatus(NetworkType.DEVNET, "sig"))
            .assertNext(s -> {
                assertTrue(s.failed());
                assertFalse(s.isConfirmed());
            })
            .verifyComplete();
        StepVerifier.create(client.getSignatureStatus(NetworkType.DEVNET, "sig"))
            .assertNext(s -> assertTrue(s.isConfirmed()))
            .verifyComplete();
    }

    @Test
    @DisplayName("unknown transaction → empty")
    void missingTransaction() {
        enqueue("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":null}");

        StepVerifier.create(client.getTransaction(NetworkType.DEVNET, "sig"))
            .verifyComplete();
    }
}
