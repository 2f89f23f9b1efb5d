package com.example.docscanner.model;

/**
 * How an image is laid out inside a viewport of a different aspect ratio.
 */
public enum ScaleMode {

    /** Scale until the viewport is covered, cropping the overflow equally on both sides. */
    FILL,

    /** Scale until the image fits, padding equally on both sides. */
    FIT
}
