package com.scosim.simulator.service.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Runs the simulator on the main thread until it is stopped. A stage failure fails the application.
 */
@Component
public class SimulatorRunner implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(SimulatorRunner.class);

    private final SimulatorLifecycle lifecycle;

    public SimulatorRunner(SimulatorLifecycle lifecycle) {
        this.lifecycle = lifecycle;
    }

    @Override
    public void run(ApplicationArguments args) throws InterruptedException {
        lifecycle.start();
        try {
            lifecycle.awaitStop();
        } finally {
            lifecycle.stop();
        }
        StopSignal signal = lifecycle.getStopSignal();
        if (signal.isFailure()) {
            throw new IllegalStateException("Simulator stopped on failure: " + signal.getReason());
        }
        logger.info("Simulator finished");
    }
}
