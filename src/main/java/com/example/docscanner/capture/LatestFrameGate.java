package com.example.docscanner.capture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Admits at most one analysis at a time. A frame that arrives while another is being analysed is
 * dropped rather than queued, so latency never grows behind a slow frame.
 */
public class LatestFrameGate {

    private static final Logger log = LoggerFactory.getLogger(LatestFrameGate.class);

    private final AtomicBoolean inFlight = new AtomicBoolean(false);
    private final AtomicLong droppedFrames = new AtomicLong();

    /**
     * Runs the task unless another one is in flight.
     *
     * @return the task's result, or empty when the frame was dropped or the task returned {@code null}
     */
    public <T> Optional<T> tryRun(Supplier<T> task) {
        Objects.requireNonNull(task, "Task must not be null");
        if (!inFlight.compareAndSet(false, true)) {
            long dropped = droppedFrames.incrementAndGet();
            log.debug("Analysis in flight, dropping frame ({} dropped so far)", dropped);
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(task.get());
        } finally {
            inFlight.set(false);
        }
    }

    public boolean isBusy() {
        return inFlight.get();
    }

    public long droppedFrames() {
        return droppedFrames.get();
    }
}
