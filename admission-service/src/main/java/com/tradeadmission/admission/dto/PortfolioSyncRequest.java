package com.tradeadmission.admission.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradeadmission.common.model.OpenPosition;

import java.util.List;

/**
 * Request body for PUT /api/v1/admission/portfolio: the broker's view of open positions.
 */
public record PortfolioSyncRequest(
    @JsonProperty("positions") List<OpenPosition> positions
) {}
