package com.example.docscanner.model;

/**
 * Which stage of a detection call produced the reported rectangle.
 */
public enum DetectionPass {
    NONE,
    CANNY,
    ADAPTIVE_THRESHOLD,
    HINT_FALLBACK
}
