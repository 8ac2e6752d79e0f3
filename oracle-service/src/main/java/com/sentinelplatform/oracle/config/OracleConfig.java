package com.sentinelplatform.oracle.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentinelplatform.common.model.NetworkType;
import com.sentinelplatform.common.network.NetworkProfileResolver;
import com.sentinelplatform.common.notification.AlertEventPublisher;
import com.sentinelplatform.common.notification.RestAlertEventPublisher;
import com.sentinelplatform.common.rpc.SolanaRpcClient;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class OracleConfig {

    @Value("${sentinel.network:devnet}")
    private String network;

    @Value("${sentinel.rpc.devnet-url:}")
    private String devnetRpcUrl;

    @Value("${sentinel.rpc.mainnet-url:}")
    private String mainnetRpcUrl;

    @Value("${sentinel.timeouts.rpc:10s}")
    private Duration rpcTimeout;

    @Value("${oracle.price.coinmarketcap.base-url:https://pro-api.coinmarketcap.com}")
    private String coinMarketCapUrl;

    @Value("${oracle.price.coingecko.base-url:https://api.coingecko.com}")
    private String coinGeckoUrl;

    @Value("${services.notification.base-url}")
    private String notificationUrl;

    @Bean
    public NetworkProfileResolver networkProfileResolver() {
        return new NetworkProfileResolver(NetworkType.fromWire(network), devnetRpcUrl, mainnetRpcUrl);
    }

    @Bean
    public SolanaRpcClient solanaRpcClient(WebClient.Builder builder, ObjectMapper objectMapper,
                                           NetworkProfileResolver resolver) {
        WebClient rpc = builder.clone()
            .clientConnector(new ReactorClientHttpConnector(timedHttpClient(rpcTimeout)))
            .build();
        return new SolanaRpcClient(rpc, objectMapper, resolver, rpcTimeout);
    }

    // ── price sources ─────────────────────────────────────────────────────────

    @Bean
    public WebClient coinMarketCapWebClient(WebClient.Builder builder) {
        return priceClient(builder, coinMarketCapUrl);
    }

    @Bean
    public WebClient coinGeckoWebClient(WebClient.Builder builder) {
        return priceClient(builder, coinGeckoUrl);
    }

    // ── notifications ─────────────────────────────────────────────────────────

    @Bean
    public WebClient notificationClient(WebClient.Builder builder) {
        return builder.clone().baseUrl(notificationUrl).build();
    }

    @Bean
    public AlertEventPublisher alertEventPublisher(WebClient notificationClient) {
        return new RestAlertEventPublisher(notificationClient);
    }

    private WebClient priceClient(WebClient.Builder builder, String baseUrl) {
        return builder.clone()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(timedHttpClient(Duration.ofSeconds(5))))
            .filter(loggingFilter())
            .build();
    }

    private static HttpClient timedHttpClient(Duration timeout) {
        int seconds = (int) Math.max(1, timeout.toSeconds());
        return HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000)
            .responseTimeout(timeout)
            .doOnConnected(conn -> conn.addHandlerLast(new ReadTimeoutHandler(seconds, TimeUnit.SECONDS)));
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            LoggerFactory.getLogger(OracleConfig.class)
                .debug("Outbound request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
