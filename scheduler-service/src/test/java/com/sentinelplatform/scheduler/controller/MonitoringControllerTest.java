package com.sentinelplatform.scheduler.controller;

import com.sentinelplatform.common.exception.NetworkUnavailableException;
import com.sentinelplatform.common.model.NetworkType;
import com.sentinelplatform.common.model.PaymentToken;
import com.sentinelplatform.common.network.NetworkProfileResolver;
import com.sentinelplatform.scheduler.balance.BalanceOracle;
import com.sentinelplatform.scheduler.balance.WalletBalances;
import com.sentinelplatform.scheduler.ledger.ActivityRecorder;
import com.sentinelplatform.scheduler.ledger.ActivityStats;
import com.sentinelplatform.scheduler.monitor.AgentLoopState;
import com.sentinelplatform.scheduler.monitor.AgentStatus;
import com.sentinelplatform.scheduler.monitor.ExclusivityMode;
import com.sentinelplatform.scheduler.monitor.MonitoringScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MonitoringControllerTest {

    @Mock MonitoringScheduler scheduler;
    @Mock ActivityRecorder recorder;
    @Mock BalanceOracle balances;

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        client = WebTestClient.bindToController(
            new MonitoringController(scheduler, recorder, balances, NetworkProfileResolver.defaults())).build();
    }

    private static AgentStatus running(String id) {
        return new AgentStatus(id, AgentLoopState.RUNNING, "run-1", Instant.EPOCH, 0, null);
    }

    @Test
    @DisplayName("start → 200 with loop status")
    void start() {
        when(scheduler.activate("s-1")).thenReturn(Mono.just(running("s-1")));

        client.post().uri("/api/v1/monitor/s-1/start").exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.sentinelId").isEqualTo("s-1")
            .jsonPath("$.state").isEqualTo("RUNNING");
    }

    @Test
    @DisplayName("start of an unknown agent → 404")
    void startUnknown() {
        when(scheduler.activate("nope")).thenReturn(Mono.error(new IllegalArgumentException("Unknown sentinel: nope")));

        client.post().uri("/api/v1/monitor/nope/start").exchange()
            .expectStatus().isNotFound()
            .expectBody().jsonPath("$.error").isEqualTo("Unknown sentinel: nope");
    }

    @Test
    @DisplayName("stop → 200 with whether a loop was running")
    void stop() {
        when(scheduler.deactivate("s-1")).thenReturn(Mono.just(true));

        client.post().uri("/api/v1/monitor/s-1/stop").exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$.wasRunning").isEqualTo(true);
    }

    @Test
    @DisplayName("status lists mode, running count and agents")
    void statuses() {
        when(scheduler.statuses()).thenReturn(List.of(running("s-1")));
        when(scheduler.runningCount()).thenReturn(1L);
        when(scheduler.mode()).thenReturn(ExclusivityMode.SINGLE);

        client.get().uri("/api/v1/monitor/status").exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.mode").isEqualTo("SINGLE")
            .jsonPath("$.running").isEqualTo(1)
            .jsonPath("$.agents[0].sentinelId").isEqualTo("s-1");
    }

    @Test
    @DisplayName("stats for an agent")
    void stats() {
        when(recorder.stats("s-1")).thenReturn(Mono.just(
            new ActivityStats("s-1", 4, new BigDecimal("0.0004"), 1, 0.75, new BigDecimal("0.0001"), null)));

        client.get().uri("/api/v1/sentinels/s-1/stats").exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.totalChecks").isEqualTo(4)
            .jsonPath("$.successRate").isEqualTo(0.75);
    }

    @Test
    @DisplayName("balances default to USDC on the configured network")
    void balancesDefaults() {
        when(balances.walletBalances("W1", PaymentToken.USDC, NetworkType.DEVNET)).thenReturn(Mono.just(
            new WalletBalances("W1", NetworkType.DEVNET, BigDecimal.ONE, PaymentToken.USDC, BigDecimal.TEN, true, 100_000)));

        client.get().uri("/api/v1/wallets/W1/balances").exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.token").isEqualTo("usdc")
            .jsonPath("$.network").isEqualTo("devnet")
            .jsonPath("$.funded").isEqualTo(true);
    }

    @Test
    @DisplayName("unknown token → 400 without touching the chain")
    void unknownToken() {
        client.get().uri("/api/v1/wallets/W1/balances?token=doge").exchange()
            .expectStatus().isBadRequest();
        verifyNoInteractions(balances);
    }

    @Test
    @DisplayName("RPC down → 503")
    void rpcDown() {
        when(balances.walletBalances(any(), any(), any()))
            .thenReturn(Mono.error(new NetworkUnavailableException("RPC down", null)));

        client.get().uri("/api/v1/wallets/W1/balances?token=usdc&network=mainnet").exchange()
            .expectStatus().isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    }
}
