package com.tradeadmission.admission.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradeadmission.common.admission.AdmissionConfig;

public record ConfigResponse(
    @JsonProperty("profile") String profile,
    @JsonProperty("config")  AdmissionConfig config
) {}
