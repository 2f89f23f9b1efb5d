package com.example.docscanner.model;

public enum CoordinateSpace {

    /** Raw sensor buffer, before the frame's rotation hint is applied. */
    SENSOR,

    /** Upright detection image, the space {@link DetectionResult} reports in. */
    IMAGE,

    /** On-screen preview viewport. */
    VIEW,

    /** Any other bitmap, e.g. a full resolution still captured after preview detection. */
    BITMAP
}
