package com.sentinelplatform.scheduler.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentinelplatform.common.model.NetworkType;
import com.sentinelplatform.common.network.NetworkProfileResolver;
import com.sentinelplatform.common.notification.AlertEventPublisher;
import com.sentinelplatform.common.notification.RestAlertEventPublisher;
import com.sentinelplatform.common.rpc.SolanaRpcClient;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class SchedulerConfig {

    @Value("${sentinel.network:devnet}")
    private String network;

    @Value("${sentinel.rpc.devnet-url:}")
    private String devnetRpcUrl;

    @Value("${sentinel.rpc.mainnet-url:}")
    private String mainnetRpcUrl;

    @Value("${sentinel.timeouts.rpc:10s}")
    private Duration rpcTimeout;

    @Value("${sentinel.timeouts.protocol:15s}")
    private Duration protocolTimeout;

    @Value("${services.oracle.base-url}")
    private String oracleUrl;

    @Value("${services.custody.base-url}")
    private String custodyUrl;

    @Value("${services.notification.base-url}")
    private String notificationUrl;

    @Value("${supabase.url}")
    private String supabaseUrl;

    @Value("${supabase.service-key:}")
    private String supabaseKey;

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

    /** Timer for all agent loops and confirmation polling. Swapped for virtual time in tests. */
    @Bean(destroyMethod = "dispose")
    public Scheduler monitorScheduler() {
        return Schedulers.newParallel("sentinel-monitor");
    }

    // ── downstream services ───────────────────────────────────────────────────

    @Bean
    public WebClient oracleClient(WebClient.Builder builder) {
        return builder.clone()
            .baseUrl(oracleUrl)
            .clientConnector(new ReactorClientHttpConnector(timedHttpClient(protocolTimeout)))
            .build();
    }

    @Bean
    public WebClient custodyClient(WebClient.Builder builder) {
        return builder.clone()
            .baseUrl(custodyUrl)
            .clientConnector(new ReactorClientHttpConnector(timedHttpClient(rpcTimeout)))
            .build();
    }

    @Bean
    public WebClient supabaseClient(WebClient.Builder builder) {
        return builder.clone()
            .baseUrl(supabaseUrl + "/rest/v1")
            .defaultHeader("apikey", supabaseKey)
            .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + supabaseKey)
            .clientConnector(new ReactorClientHttpConnector(timedHttpClient(rpcTimeout)))
            .build();
    }

    @Bean
    public WebClient notificationClient(WebClient.Builder builder) {
        return builder.clone().baseUrl(notificationUrl).build();
    }

    @Bean
    public AlertEventPublisher alertEventPublisher(@Qualifier("notificationClient") WebClient notificationClient) {
        return new RestAlertEventPublisher(notificationClient);
    }

    private static HttpClient timedHttpClient(Duration timeout) {
        int seconds = (int) Math.max(1, timeout.toSeconds());
        return HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000)
            .responseTimeout(timeout)
            .doOnConnected(conn -> conn.addHandlerLast(new ReadTimeoutHandler(seconds, TimeUnit.SECONDS)));
    }
}
