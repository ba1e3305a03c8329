package com.vedicchart.engine.config;

import com.vedicchart.common.aspect.AspectMode;
import com.vedicchart.common.time.AyanamsaSystem;

/**
 * Defaults applied to a chart request that leaves them out.
 */
public record ChartSettings(
    AyanamsaSystem defaultAyanamsa,
    AspectMode defaultAspectMode,
    double conjunctionOrb,
    boolean ascendantFallbackEnabled
) {}
