package com.tradeadmission.admission.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradeadmission.common.model.OpenPosition;

import java.util.List;

public record PortfolioResponse(
    @JsonProperty("capacity")  int capacity,
    @JsonProperty("openCount") int openCount,
    @JsonProperty("positions") List<OpenPosition> positions
) {}
