package com.scosim.simulator.model.dto;

import lombok.Builder;
import lombok.Getter;
import lombok.experimental.SuperBuilder;

@Getter
@SuperBuilder
public class ScanCompletedBody extends EventBody {
    @Builder.Default
    private final int totalItems = 0;
}
