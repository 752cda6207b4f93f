package com.scosim.simulator.model.dto;

import lombok.Builder;
import lombok.Getter;
import lombok.experimental.SuperBuilder;

@Getter
@SuperBuilder
public class TransactionCompletedBody extends EventBody {
    @Builder.Default
    private final int totalItems = 0;
    @Builder.Default
    private final String status = "ended";
}
