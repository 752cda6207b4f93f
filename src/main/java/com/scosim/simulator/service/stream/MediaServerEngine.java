package com.scosim.simulator.service.stream;

public interface MediaServerEngine {

    void start() throws Exception;

    void stop();

    String endpointUrl();
}
