package com.vedicchart.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vedicchart.common.aspect.AspectMode;
import com.vedicchart.common.time.AyanamsaSystem;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ChartEngineConfig {

    @Value("${chart.default-ayanamsa:Lahiri}")
    private String defaultAyanamsa;

    @Value("${chart.default-aspect-mode:rasi}")
    private String defaultAspectMode;

    @Value("${chart.conjunction-orb:8.0}")
    private double conjunctionOrb;

    @Value("${chart.ascendant-fallback-enabled:true}")
    private boolean ascendantFallbackEnabled;

    // An unknown aspect mode fails startup; an unknown ayanamsa resolves to Lahiri.
    @Bean
    public ChartSettings chartSettings() {
        return new ChartSettings(
            AyanamsaSystem.fromName(defaultAyanamsa),
            AspectMode.fromName(defaultAspectMode),
            conjunctionOrb,
            ascendantFallbackEnabled);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
