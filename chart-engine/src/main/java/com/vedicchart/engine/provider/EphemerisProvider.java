package com.vedicchart.engine.provider;

import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Strategy interface: a remote ephemeris service, or nothing beyond what the request carries.
 */
public interface EphemerisProvider {

    Mono<EphemerisSnapshot> fetch(Instant timestamp, double latitude, double longitude);

    /** Used when the remote collaborator is switched off; supplies no positions. */
    static EphemerisProvider none() {
        return (timestamp, latitude, longitude) -> Mono.just(EphemerisSnapshot.empty());
    }
}
