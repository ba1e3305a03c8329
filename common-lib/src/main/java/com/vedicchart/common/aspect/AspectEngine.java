package com.vedicchart.common.aspect;

import com.vedicchart.common.model.BodyPosition;

/**
 * Computes one directed aspect. Implementations are stateless and safe to share.
 */
public interface AspectEngine {

    AspectMode mode();

    /**
     * A body never aspects itself; that pair yields a non-aspecting result.
     */
    AspectResult aspect(BodyPosition source, AspectTarget target);
}
