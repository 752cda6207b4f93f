package com.scosim.simulator.model.dto;

import lombok.Builder;
import lombok.Getter;
import lombok.experimental.SuperBuilder;

/**
 * Scale reading disagrees with the expected item weight.
 */
@Getter
@SuperBuilder
public class WeighingMismatchBody extends EventBody {
    @Builder.Default
    private final String itemId = "aabb513";
    @Builder.Default
    private final String name = "default";
    @Builder.Default
    private final String barcode = "aabbabc";
    @Builder.Default
    private final double detectedWeight = 50.0;
    @Builder.Default
    private final double expectedWeight = 100.0;
}
