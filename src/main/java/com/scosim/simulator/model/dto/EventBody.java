package com.scosim.simulator.model.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Getter;
import lombok.experimental.SuperBuilder;

/**
 * Fields every event body carries. Serialized in snake_case.
 */
@Getter
@SuperBuilder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public abstract class EventBody {
    private final String transactionId;
    @Builder.Default
    private final String transactionType = "pending";
    private final long timestamp;
    private final long serverTimestamp;
}
