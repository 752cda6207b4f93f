package com.scosim.simulator.service.source;

@FunctionalInterface
public interface RawFrameReaderFactory {

    RawFrameReader open() throws FrameReadException;
}
