package com.example.docscanner.detection;

import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Arena for the intermediate matrices of one call. Every {@link Mat} registered through
 * {@link #track(Mat)} is released when the arena closes, in reverse registration order, so
 * early returns never leak native memory.
 *
 * <p>Not thread-safe: an arena belongs to the call that opened it.
 */
public final class ScratchMats implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ScratchMats.class);

    private final Deque<Mat> owned = new ArrayDeque<>();
    private boolean closed;

    public ScratchMats() {
        OpenCvRuntime.ensureLoaded();
    }

    /**
     * Allocates an empty matrix owned by this arena.
     */
    public Mat mat() {
        return track(new Mat());
    }

    public <T extends Mat> T track(T mat) {
        if (closed) {
            throw new IllegalStateException("Scratch arena already closed");
        }
        owned.push(mat);
        return mat;
    }

    int size() {
        return owned.size();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        int released = owned.size();
        while (!owned.isEmpty()) {
            owned.pop().release();
        }
        log.trace("Released {} scratch matrices", released);
    }
}
