package com.sentinelplatform.oracle.price;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;

@Component
public class CoinMarketCapClient implements PriceSource {

    private static final Logger log = LoggerFactory.getLogger(CoinMarketCapClient.class);

    static final String SOLANA_CMC_ID = "5426";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    @Value("${oracle.price.coinmarketcap.api-key:}")
    private String apiKey;

    public CoinMarketCapClient(@Qualifier("coinMarketCapWebClient") WebClient webClient,
                               ObjectMapper objectMapper) {
        this.webClient    = webClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "coinmarketcap";
    }

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public Mono<PriceQuote> fetchPrice() {
        if (!isConfigured()) {
            return Mono.error(new IllegalStateException("CoinMarketCap API key not configured"));
        }
        return webClient.get()
            .uri(uri -> uri.path("/v1/cryptocurrency/quotes/latest")
                .queryParam("id", SOLANA_CMC_ID)
                .queryParam("convert", "USD")
                .build())
            .header("X-CMC_PRO_API_KEY", apiKey)
            .retrieve()
            .bodyToMono(String.class)
            .switchIfEmpty(Mono.error(new IllegalStateException("Empty CoinMarketCap response")))
            .map(this::parse)
            .doOnNext(q -> log.info("Price fetched. source=coinmarketcap price={}", q.price()));
    }

    private PriceQuote parse(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (Exception e) {
            throw new IllegalStateException("Unparsable CoinMarketCap response", e);
        }
        int errorCode = root.path("status").path("error_code").asInt(0);
        if (errorCode != 0) {
            throw new IllegalStateException("CoinMarketCap error: " + root.path("status").path("error_message").asText());
        }
        JsonNode usd = root.path("data").path(SOLANA_CMC_ID).path("quote").path("USD").path("price");
        if (!usd.isNumber() || usd.decimalValue().signum() <= 0) {
            throw new IllegalStateException("Invalid price value from CoinMarketCap");
        }
        return new PriceQuote(usd.decimalValue(), name(), Instant.now());
    }

    void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }
}
