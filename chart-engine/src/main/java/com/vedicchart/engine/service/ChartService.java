package com.vedicchart.engine.service;

import com.vedicchart.common.aspect.AspectMode;
import com.vedicchart.common.catalog.Body;
import com.vedicchart.common.chart.ChartAnalysis;
import com.vedicchart.common.chart.ChartAnalyzer;
import com.vedicchart.common.chart.ChartAssembler;
import com.vedicchart.common.chart.ChartContext;
import com.vedicchart.common.chart.ChartInput;
import com.vedicchart.common.model.RawPosition;
import com.vedicchart.common.time.AyanamsaSystem;
import com.vedicchart.common.trace.TraceContextUtil;
import com.vedicchart.engine.config.ChartSettings;
import com.vedicchart.engine.exception.InvalidChartRequestException;
import com.vedicchart.engine.model.AspectMatrixResponse;
import com.vedicchart.engine.model.ChartRequest;
import com.vedicchart.engine.model.ChartResponse;
import com.vedicchart.engine.provider.EphemerisProvider;
import com.vedicchart.engine.provider.EphemerisSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.EnumMap;
import java.util.Map;

/**
 * Turns a {@link ChartRequest} into a computed chart.
 *
 * <p>Request positions win over the ephemeris collaborator's; the collaborator is asked only
 * for what the request leaves out. When it fails the chart is built from the request alone
 * and flagged incomplete. The failure propagates only when the request carried no
 * positions at all.
 */
@Service
public class ChartService {

    private static final Logger log = LoggerFactory.getLogger(ChartService.class);

    private final EphemerisProvider ephemerisProvider;
    private final ChartSettings settings;

    public ChartService(EphemerisProvider ephemerisProvider, ChartSettings settings) {
        this.ephemerisProvider = ephemerisProvider;
        this.settings = settings;
    }

    public Mono<ChartResponse> chart(ChartRequest request) {
        return Mono.deferContextual(ctx -> {
            String traceId = TraceContextUtil.getTraceId(ctx);
            return assemble(request, traceId)
                .flatMap(chart -> Mono.fromCallable(() -> ChartAnalyzer.analyze(chart))
                    .subscribeOn(Schedulers.boundedElastic()))
                .doOnSuccess(analysis -> logAnalysis(analysis, traceId))
                .map(analysis -> ChartResponse.from(analysis, traceId));
        });
    }

    public Mono<AspectMatrixResponse> aspects(ChartRequest request) {
        return Mono.deferContextual(ctx -> {
            String traceId = TraceContextUtil.getTraceId(ctx);
            return assemble(request, traceId)
                .flatMap(chart -> Mono.fromCallable(() -> AspectMatrixResponse.from(chart, traceId))
                    .subscribeOn(Schedulers.boundedElastic()));
        });
    }

    Mono<ChartContext> assemble(ChartRequest request, String traceId) {
        return Mono.fromCallable(() -> toInput(request))
            .flatMap(input -> withEphemeris(input, traceId))
            .flatMap(input -> Mono.fromCallable(() -> ChartAssembler.assemble(input))
                .subscribeOn(Schedulers.boundedElastic()));
    }

    // ── ephemeris merge ──────────────────────────────────────────────────────

    private Mono<ChartInput> withEphemeris(ChartInput input, String traceId) {
        if (!needsEphemeris(input)) {
            return Mono.just(input);
        }
        return ephemerisProvider.fetch(input.timestamp(), input.latitude(), input.longitude())
            .map(snapshot -> merge(input, snapshot))
            .onErrorResume(e -> !input.positions().isEmpty(), e -> {
                TraceContextUtil.withMdc(traceId, () ->
                    log.warn("Ephemeris unavailable, building chart from request positions only. reason={}",
                        e.getMessage()));
                return Mono.just(input);
            })
            .defaultIfEmpty(input);
    }

    private static boolean needsEphemeris(ChartInput input) {
        if (input.tropicalAscendant() == null) {
            return true;
        }
        for (Body body : Body.values()) {
            // Ketu is derived from Rahu when only Rahu is supplied
            if (body == Body.KETU && input.positions().containsKey(Body.RAHU)) {
                continue;
            }
            if (!input.positions().containsKey(body)) {
                return true;
            }
        }
        return false;
    }

    static ChartInput merge(ChartInput input, EphemerisSnapshot snapshot) {
        Map<Body, RawPosition> positions = new EnumMap<>(Body.class);
        positions.putAll(snapshot.positions());
        positions.putAll(input.positions());
        Double ascendant = input.tropicalAscendant() != null ? input.tropicalAscendant() : snapshot.ascendant();
        return new ChartInput(input.timestamp(), input.latitude(), input.longitude(), input.ayanamsa(),
            input.aspectMode(), positions, ascendant, input.conjunctionOrb(), input.ascendantFallbackEnabled());
    }

    // ── request mapping ──────────────────────────────────────────────────────

    ChartInput toInput(ChartRequest request) {
        if (request == null) {
            throw new InvalidChartRequestException("body", "Request body is required");
        }
        if (request.timestamp() == null) {
            throw new InvalidChartRequestException("timestamp", "timestamp is required");
        }
        if (request.latitude() == null || request.longitude() == null) {
            throw new InvalidChartRequestException("location", "latitude and longitude are required");
        }

        AyanamsaSystem ayanamsa = request.ayanamsa() == null
            ? settings.defaultAyanamsa()
            : AyanamsaSystem.fromName(request.ayanamsa());
        AspectMode aspectMode = request.aspectMode() == null
            ? settings.defaultAspectMode()
            : AspectMode.fromName(request.aspectMode());

        Map<Body, RawPosition> positions = new EnumMap<>(Body.class);
        request.positions().forEach((name, raw) -> positions.put(Body.fromName(name), raw));

        return new ChartInput(request.timestamp(), request.latitude(), request.longitude(), ayanamsa,
            aspectMode, positions, request.ascendant(), settings.conjunctionOrb(),
            settings.ascendantFallbackEnabled());
    }

    private static void logAnalysis(ChartAnalysis analysis, String traceId) {
        ChartContext chart = analysis.chart();
        TraceContextUtil.withMdc(traceId, () ->
            log.info("Chart computed. jd={} mode={} complete={} missing={} yogas={}",
                chart.julianDay(), chart.aspectMode().displayName(), chart.isComplete(),
                chart.missingBodies(), analysis.yogas().size()));
    }
}
