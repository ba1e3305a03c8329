package com.vedicchart.engine.controller;

import com.vedicchart.common.trace.TraceContextUtil;
import com.vedicchart.engine.model.AspectMatrixResponse;
import com.vedicchart.engine.model.ChartRequest;
import com.vedicchart.engine.model.ChartResponse;
import com.vedicchart.engine.service.ChartService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/chart")
public class ChartController {

    private final ChartService chartService;

    public ChartController(ChartService chartService) {
        this.chartService = chartService;
    }

    @PostMapping
    public Mono<ResponseEntity<ChartResponse>> chart(
            @RequestBody ChartRequest request,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        String traceId = TraceContextUtil.resolve(traceHeader);
        return TraceContextUtil.withTraceId(chartService.chart(request), traceId)
            .map(body -> ResponseEntity.ok().header(TraceContextUtil.TRACE_ID_HEADER, traceId).body(body));
    }

    @PostMapping("/aspects")
    public Mono<ResponseEntity<AspectMatrixResponse>> aspects(
            @RequestBody ChartRequest request,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        String traceId = TraceContextUtil.resolve(traceHeader);
        return TraceContextUtil.withTraceId(chartService.aspects(request), traceId)
            .map(body -> ResponseEntity.ok().header(TraceContextUtil.TRACE_ID_HEADER, traceId).body(body));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
