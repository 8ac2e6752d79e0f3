package com.sentinelplatform.scheduler.controller;

import com.sentinelplatform.common.exception.NetworkUnavailableException;
import com.sentinelplatform.common.exception.UnsupportedTokenException;
import com.sentinelplatform.common.model.NetworkType;
import com.sentinelplatform.common.model.PaymentToken;
import com.sentinelplatform.common.network.NetworkProfileResolver;
import com.sentinelplatform.scheduler.balance.BalanceOracle;
import com.sentinelplatform.scheduler.ledger.ActivityRecorder;
import com.sentinelplatform.scheduler.monitor.AgentStatus;
import com.sentinelplatform.scheduler.monitor.MonitoringScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1")
public class MonitoringController {

    private static final Logger log = LoggerFactory.getLogger(MonitoringController.class);

    private final MonitoringScheduler scheduler;
    private final ActivityRecorder recorder;
    private final BalanceOracle balances;
    private final NetworkProfileResolver resolver;

    public MonitoringController(MonitoringScheduler scheduler, ActivityRecorder recorder,
                                BalanceOracle balances, NetworkProfileResolver resolver) {
        this.scheduler = scheduler;
        this.recorder  = recorder;
        this.balances  = balances;
        this.resolver  = resolver;
    }

    // ── agent lifecycle ───────────────────────────────────────────────────────

    @PostMapping("/monitor/{id}/start")
    public Mono<ResponseEntity<Object>> start(@PathVariable String id) {
        log.info("Start requested. sentinelId={}", id);
        return scheduler.activate(id)
            .<ResponseEntity<Object>>map(ResponseEntity::ok)
            .onErrorResume(IllegalArgumentException.class, e ->
                Mono.just(ResponseEntity.status(HttpStatus.NOT_FOUND).<Object>body(error(e.getMessage()))))
            .onErrorResume(e -> {
                log.error("Start failed. sentinelId={}", id, e);
                return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).<Object>body(error(e.getMessage())));
            });
    }

    @PostMapping("/monitor/{id}/stop")
    public Mono<ResponseEntity<Object>> stop(@PathVariable String id) {
        log.info("Stop requested. sentinelId={}", id);
        return scheduler.deactivate(id)
            .<ResponseEntity<Object>>map(wasRunning -> ResponseEntity.ok(Map.<String, Object>of("sentinelId", id, "wasRunning", wasRunning)))
            .onErrorResume(e -> {
                log.error("Stop failed to clear active flag. sentinelId={}", id, e);
                return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).<Object>body(error(e.getMessage())));
            });
    }

    @GetMapping("/monitor/status")
    public Mono<Map<String, Object>> statuses() {
        List<AgentStatus> all = scheduler.statuses();
        return Mono.just(Map.<String, Object>of(
            "mode",    scheduler.mode(),
            "running", scheduler.runningCount(),
            "agents",  all));
    }

    @GetMapping("/monitor/{id}/status")
    public Mono<AgentStatus> status(@PathVariable String id) {
        return Mono.just(scheduler.status(id));
    }

    // ── read-only views ───────────────────────────────────────────────────────

    @GetMapping("/sentinels/{id}/stats")
    public Mono<ResponseEntity<Object>> stats(@PathVariable String id) {
        return recorder.stats(id)
            .<ResponseEntity<Object>>map(ResponseEntity::ok)
            .onErrorResume(e -> {
                log.warn("Stats unavailable. sentinelId={} reason={}", id, e.getMessage());
                return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).<Object>body(error(e.getMessage())));
            });
    }

    @GetMapping("/wallets/{address}/balances")
    public Mono<ResponseEntity<Object>> balances(@PathVariable String address,
                                                 @RequestParam(value = "token", required = false) String token,
                                                 @RequestParam(value = "network", required = false) String network) {
        PaymentToken paymentToken;
        try {
            paymentToken = PaymentToken.fromWire(token);
        } catch (IllegalArgumentException e) {
            return Mono.just(ResponseEntity.badRequest().<Object>body(error(e.getMessage())));
        }
        if (paymentToken == null) {
            paymentToken = PaymentToken.USDC;
        }
        NetworkType networkType = network == null || network.isBlank()
            ? resolver.resolveNetwork().type()
            : NetworkType.fromWire(network);

        return balances.walletBalances(address, paymentToken, networkType)
            .<ResponseEntity<Object>>map(ResponseEntity::ok)
            .onErrorResume(UnsupportedTokenException.class, e ->
                Mono.just(ResponseEntity.badRequest().<Object>body(error(e.getMessage()))))
            .onErrorResume(NetworkUnavailableException.class, e ->
                Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).<Object>body(error(e.getMessage()))));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    private static Map<String, String> error(String message) {
        return Map.of("error", message == null ? "unknown" : message);
    }
}
