package com.scosim.simulator.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;
import lombok.experimental.SuperBuilder;

import java.util.UUID;

/**
 * Item scanned into the basket. Item details are fixed sample values.
 */
@Getter
@SuperBuilder
public class ItemAddedBody extends EventBody {
    @Builder.Default
    private final String itemId = UUID.randomUUID().toString();
    @Builder.Default
    private final String barcode = "1234567890123";
    @Builder.Default
    private final String name = "Apple";
    @Builder.Default
    private final int quantity = 1;
    @Builder.Default
    private final String addedMethod = "scanner";
    @Builder.Default
    @JsonProperty("is_kitchen_item")
    private final boolean kitchenItem = false;
    private final Double price;
    private final String currency;
}
