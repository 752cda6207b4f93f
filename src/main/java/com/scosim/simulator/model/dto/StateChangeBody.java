package com.scosim.simulator.model.dto;

import lombok.Builder;
import lombok.Getter;
import lombok.experimental.SuperBuilder;

@Getter
@SuperBuilder
public class StateChangeBody extends EventBody {
    @Builder.Default
    private final String uiState = "staff_mode_on";
    @Builder.Default
    private final String reason = "simulation";
}
