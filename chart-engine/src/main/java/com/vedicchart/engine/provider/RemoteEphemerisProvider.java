package com.vedicchart.engine.provider;

import com.vedicchart.engine.exception.EphemerisException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;

/**
 * Calls the ephemeris service: {@code GET /api/v1/ephemeris?timestamp=&latitude=&longitude=}.
 * Every failure, including a timeout or an empty body, surfaces as {@link EphemerisException}.
 */
public class RemoteEphemerisProvider implements EphemerisProvider {

    static final String PATH = "/api/v1/ephemeris";

    private static final Logger log = LoggerFactory.getLogger(RemoteEphemerisProvider.class);

    private final WebClient webClient;
    private final Duration timeout;

    public RemoteEphemerisProvider(WebClient ephemerisWebClient, Duration timeout) {
        this.webClient = ephemerisWebClient;
        this.timeout = timeout;
    }

    @Override
    public Mono<EphemerisSnapshot> fetch(Instant timestamp, double latitude, double longitude) {
        log.debug("Fetching ephemeris. timestamp={} lat={} lon={}", timestamp, latitude, longitude);
        return webClient.get()
            .uri(builder -> builder.path(PATH)
                .queryParam("timestamp", timestamp.toString())
                .queryParam("latitude", latitude)
                .queryParam("longitude", longitude)
                .build())
            .accept(MediaType.APPLICATION_JSON)
            .retrieve()
            .bodyToMono(EphemerisSnapshot.class)
            .timeout(timeout)
            .switchIfEmpty(Mono.error(new EphemerisException("Ephemeris returned no body for " + timestamp)))
            .onErrorMap(e -> !(e instanceof EphemerisException),
                e -> new EphemerisException("Ephemeris request failed: " + e.getMessage(), e));
    }
}
