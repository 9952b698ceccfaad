package com.multifish.action.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record FanZonePatch(
        @JsonProperty("FailSafePercent") Double failSafePercent,
        @JsonProperty("MinThermalOutput") Double minThermalOutput
) {}
