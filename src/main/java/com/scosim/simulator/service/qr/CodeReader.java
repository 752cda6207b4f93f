package com.scosim.simulator.service.qr;

import com.scosim.simulator.model.BgrImage;

import java.util.Optional;

/**
 * Optical code recognition on a code view. Most views carry no code; that is an empty result, not an error.
 */
@FunctionalInterface
public interface CodeReader {

    Optional<String> decode(BgrImage image);
}
