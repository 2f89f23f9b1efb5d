package com.example.docscanner.detection;

import nu.pattern.OpenCV;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the bundled OpenCV natives exactly once per class loader.
 */
public final class OpenCvRuntime {

    private static final Logger log = LoggerFactory.getLogger(OpenCvRuntime.class);

    static {
        OpenCV.loadLocally();
        log.info("Loaded OpenCV native libraries ({})", org.opencv.core.Core.VERSION);
    }

    private OpenCvRuntime() {
    }

    /**
     * Triggers the static initializer. Safe to call from any thread, any number of times.
     */
    public static void ensureLoaded() {
        // class initialization does the work
    }
}
