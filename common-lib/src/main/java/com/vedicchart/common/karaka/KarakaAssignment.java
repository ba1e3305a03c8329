package com.vedicchart.common.karaka;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vedicchart.common.catalog.Body;

/**
 * @param effectiveDegree degrees in sign used for ranking; reversed (30 − deg) for Rahu
 */
public record KarakaAssignment(
    @JsonProperty("karaka") CharaKaraka karaka,
    @JsonProperty("body") Body body,
    @JsonProperty("effectiveDegree") double effectiveDegree
) {}
