package com.vedicchart.common.aspect;

/**
 * Resolves the engine for a mode.
 */
public final class AspectEngines {

    private AspectEngines() {}

    public static AspectEngine forMode(AspectMode mode) {
        return switch (mode) {
            case RASI   -> RasiAspectEngine.INSTANCE;
            case DEGREE -> DegreeAspectEngine.INSTANCE;
        };
    }
}
