package com.multifish.action.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PidControllerPatch(
        @JsonProperty("FFGainCoefficient") Double ffGainCoefficient,
        @JsonProperty("FFOffCoefficient") Double ffOffCoefficient,
        @JsonProperty("ICoefficient") Double iCoefficient,
        @JsonProperty("ILimitMax") Double iLimitMax,
        @JsonProperty("ILimitMin") Double iLimitMin,
        @JsonProperty("NegativeHysteresis") Double negativeHysteresis,
        @JsonProperty("OutLimitMax") Double outLimitMax,
        @JsonProperty("OutLimitMin") Double outLimitMin,
        @JsonProperty("PCoefficient") Double pCoefficient,
        @JsonProperty("PositiveHysteresis") Double positiveHysteresis,
        @JsonProperty("SetPoint") Double setPoint,
        @JsonProperty("SlewNeg") Double slewNeg,
        @JsonProperty("SlewPos") Double slewPos,
        @JsonProperty("Zones") List<OdataId> zones
) {}
