package org.jstats.tipster_api.modules.history.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

public record ActualResultRequest(@NotBlank String actualWinner, @PositiveOrZero int actualMargin) {}
