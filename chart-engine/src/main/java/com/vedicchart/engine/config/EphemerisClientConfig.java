package com.vedicchart.engine.config;

import com.vedicchart.engine.exception.EphemerisException;
import com.vedicchart.engine.provider.EphemerisProvider;
import com.vedicchart.engine.provider.RemoteEphemerisProvider;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
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
public class EphemerisClientConfig {

    private static final Logger log = LoggerFactory.getLogger(EphemerisClientConfig.class);

    @Value("${ephemeris.base-url:http://localhost:8090}")
    private String baseUrl;

    @Value("${ephemeris.enabled:false}")
    private boolean enabled;

    @Value("${ephemeris.timeout-seconds:10}")
    private int timeoutSeconds;

    @Bean
    public WebClient ephemerisWebClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutSeconds * 1_000)
            .responseTimeout(Duration.ofSeconds(timeoutSeconds))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
            );

        return builder
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(errorStatusFilter())
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public EphemerisProvider ephemerisProvider(WebClient ephemerisWebClient) {
        if (!enabled) {
            log.info("Ephemeris collaborator disabled; charts use request positions only");
            return EphemerisProvider.none();
        }
        log.info("Ephemeris collaborator enabled. baseUrl={} timeout={}s", baseUrl, timeoutSeconds);
        return new RemoteEphemerisProvider(ephemerisWebClient, Duration.ofSeconds(timeoutSeconds));
    }

    static ExchangeFilterFunction errorStatusFilter() {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().isError()) {
                return Mono.error(new EphemerisException("Ephemeris server error: " + clientResponse.statusCode()));
            }
            return Mono.just(clientResponse);
        });
    }

    private static ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("Outbound request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
