package com.project.graph.digitizer.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the OpenCV native library bundled with the openpnp distribution, once per JVM.
 */
final class OpenCvLoader {
    private static final Logger log = LoggerFactory.getLogger(OpenCvLoader.class);

    private static volatile boolean loaded;

    private OpenCvLoader() {}

    static void ensureLoaded() {
        if (loaded) return;
        synchronized (OpenCvLoader.class) {
            if (loaded) return;
            try {
                nu.pattern.OpenCV.loadLocally();
                loaded = true;
                log.info("OpenCV loaded successfully");
            } catch (RuntimeException | UnsatisfiedLinkError e) {
                log.error("Failed to load OpenCV", e);
                throw e;
            }
        }
    }
}
