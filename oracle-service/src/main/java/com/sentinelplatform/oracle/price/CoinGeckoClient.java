package com.sentinelplatform.oracle.price;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;

@Component
public class CoinGeckoClient implements PriceSource {

    private static final Logger log = LoggerFactory.getLogger(CoinGeckoClient.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public CoinGeckoClient(@Qualifier("coinGeckoWebClient") WebClient webClient, ObjectMapper objectMapper) {
        this.webClient    = webClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "coingecko";
    }

    @Override
    public Mono<PriceQuote> fetchPrice() {
        return webClient.get()
            .uri(uri -> uri.path("/api/v3/simple/price")
                .queryParam("ids", "solana")
                .queryParam("vs_currencies", "usd")
                .build())
            .retrieve()
            .bodyToMono(String.class)
            .switchIfEmpty(Mono.error(new IllegalStateException("Empty CoinGecko response")))
            .map(json -> {
                try {
                    JsonNode price = objectMapper.readTree(json).path("solana").path("usd");
                    if (!price.isNumber() || price.decimalValue().signum() <= 0) {
                        throw new IllegalStateException("Invalid price value from CoinGecko");
                    }
                    return new PriceQuote(price.decimalValue(), name(), Instant.now());
                } catch (IllegalStateException e) {
                    throw e;
                } catch (Exception e) {
                    throw new IllegalStateException("Unparsable CoinGecko response", e);
                }
            })
            .doOnNext(q -> log.info("Price fetched. source=coingecko price={}", q.price()));
    }
}
