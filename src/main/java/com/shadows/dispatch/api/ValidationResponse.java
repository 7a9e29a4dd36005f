package com.shadows.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.shadows.core.validation.ValidationResult;

public record ValidationResponse(
        @JsonProperty("validation") ValidationResult validation,
        @JsonProperty("summary") String summary,
        @JsonProperty("basically_winnable") boolean basicallyWinnable
) {}
