package com.scosim.simulator.model.dto;

import lombok.experimental.SuperBuilder;

@SuperBuilder
public class ScanStartedBody extends EventBody {
}
