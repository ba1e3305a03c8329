package com.vedicchart.engine.provider;

import com.vedicchart.common.catalog.Body;
import com.vedicchart.engine.exception.EphemerisException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RemoteEphemerisProviderTest {

    private static final Instant INSTANT = Instant.parse("2000-01-01T12:00:00Z");

    private static final String BODY = """
        {
          "positions": {
            "SUN":  {"longitude": 280.46, "latitude": 0.0,  "speed": 1.019},
            "RAHU": {"longitude": 125.04, "latitude": 0.0,  "speed": -0.053}
          },
          "ascendant": 118.85
        }
        """;

    private static RemoteEphemerisProvider provider(ExchangeFunction exchange, Duration timeout) {
        WebClient webClient = WebClient.builder()
            .baseUrl("http://ephemeris.test")
            .exchangeFunction(exchange)
            .build();
        return new RemoteEphemerisProvider(webClient, timeout);
    }

    private static Mono<ClientResponse> json(HttpStatus status, String body) {
        return Mono.just(ClientResponse.create(status)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(body)
            .build());
    }

    @Test
    @DisplayName("sends instant and location as query parameters and decodes the snapshot")
    void decodesSnapshot() {
        AtomicReference<ClientRequest> sent = new AtomicReference<>();
        RemoteEphemerisProvider provider = provider(request -> {
            sent.set(request);
            return json(HttpStatus.OK, BODY);
        }, Duration.ofSeconds(5));

        EphemerisSnapshot snapshot = provider.fetch(INSTANT, 28.6, 77.2).block();

        assertThat(sent.get().url().getPath()).isEqualTo(RemoteEphemerisProvider.PATH);
        assertThat(sent.get().url().getQuery())
            .contains("timestamp=2000-01-01T12:00:00Z")
            .contains("latitude=28.6")
            .contains("longitude=77.2");
        assertThat(snapshot.positions()).containsOnlyKeys(Body.SUN, Body.RAHU);
        assertThat(snapshot.positions().get(Body.RAHU).speed()).isCloseTo(-0.053, within(1e-9));
        assertThat(snapshot.ascendant()).isCloseTo(118.85, within(1e-9));
    }

    @Test
    @DisplayName("server error surfaces as EphemerisException")
    void serverError() {
        RemoteEphemerisProvider provider = provider(
            request -> json(HttpStatus.SERVICE_UNAVAILABLE, "{}"), Duration.ofSeconds(5));

        assertThatThrownBy(() -> provider.fetch(INSTANT, 0.0, 0.0).block())
            .isInstanceOf(EphemerisException.class)
            .hasMessageContaining("503");
    }

    @Test
    @DisplayName("slow collaborator times out as EphemerisException")
    void timeout() {
        RemoteEphemerisProvider provider = provider(request -> Mono.never(), Duration.ofMillis(50));

        assertThatThrownBy(() -> provider.fetch(INSTANT, 0.0, 0.0).block())
            .isInstanceOf(EphemerisException.class);
    }

    @Test
    @DisplayName("empty body is an error rather than an empty chart")
    void emptyBody() {
        RemoteEphemerisProvider provider = provider(
            request -> json(HttpStatus.OK, ""), Duration.ofSeconds(5));

        assertThatThrownBy(() -> provider.fetch(INSTANT, 0.0, 0.0).block())
            .isInstanceOf(EphemerisException.class);
    }

    @Test
    @DisplayName("disabled provider supplies nothing")
    void none() {
        EphemerisSnapshot snapshot = EphemerisProvider.none().fetch(INSTANT, 0.0, 0.0).block();

        assertThat(snapshot.positions()).isEmpty();
        assertThat(snapshot.ascendant()).isNull();
    }
}
