package com.sentinelplatform.oracle.check;

import com.sentinelplatform.common.exception.NetworkUnavailableException;
import com.sentinelplatform.common.exception.PriceUnavailableException;
import com.sentinelplatform.common.exception.VerificationFailedException;
import com.sentinelplatform.common.protocol.CheckRequest;
import com.sentinelplatform.common.protocol.PaymentHeaders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/v1")
public class PriceCheckController {

    private static final Logger log = LoggerFactory.getLogger(PriceCheckController.class);

    private final PriceCheckService service;

    public PriceCheckController(PriceCheckService service) {
        this.service = service;
    }

    @PostMapping("/check-price")
    public Mono<ResponseEntity<Object>> checkPrice(
            @RequestBody CheckRequest request,
            @RequestHeader(value = PaymentHeaders.PROOF, required = false) String proof,
            @RequestHeader(value = PaymentHeaders.TOKEN, required = false) String token) {

        String invalid = request.validationError();
        if (invalid != null) {
            return Mono.just(ResponseEntity.badRequest().<Object>body(error(invalid)));
        }

        if (proof == null || proof.isBlank()) {
            log.info("Payment required. sentinelId={} network={}", request.sentinelId(), request.network());
            return Mono.just(ResponseEntity.status(HttpStatus.PAYMENT_REQUIRED).<Object>body(service.challenge(request)));
        }

        return service.settle(request, proof.trim(), token)
            .<ResponseEntity<Object>>map(ResponseEntity::ok)
            .onErrorResume(VerificationFailedException.class, e ->
                Mono.just(ResponseEntity.status(HttpStatus.PAYMENT_REQUIRED).<Object>body(e.getChallenge())))
            .onErrorResume(PriceUnavailableException.class, e ->
                Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).<Object>body(error(e.getMessage()))))
            .onErrorResume(NetworkUnavailableException.class, e -> {
                log.warn("Payment verification unavailable. sentinelId={} reason={}", request.sentinelId(), e.getMessage());
                return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .<Object>body(error("Payment verification unavailable")));
            });
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, String>> malformed(ServerWebInputException e) {
        return ResponseEntity.badRequest().body(error("Malformed request: " + e.getReason()));
    }

    private static Map<String, String> error(String message) {
        return Map.of("error", message == null ? "unknown" : message);
    }
}
