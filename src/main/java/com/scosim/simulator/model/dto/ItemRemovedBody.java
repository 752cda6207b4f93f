package com.scosim.simulator.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;
import lombok.experimental.SuperBuilder;

import java.util.UUID;

@Getter
@SuperBuilder
public class ItemRemovedBody extends EventBody {
    @Builder.Default
    private final String itemId = UUID.randomUUID().toString();
    @Builder.Default
    private final String barcode = "1234567890123";
    @Builder.Default
    private final String name = "Apple";
    @Builder.Default
    private final int quantity = 1;
    @Builder.Default
    private final String removedUser = "staff";
    @Builder.Default
    @JsonProperty("is_kitchen_item")
    private final boolean kitchenItem = false;
}
