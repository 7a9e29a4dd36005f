package com.shadows.core.validation;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum IssueSeverity {
    @JsonProperty("error") ERROR,
    @JsonProperty("warning") WARNING
}
