package com.example.docscanner.model;

/**
 * Reference space used when judging a rectangle.
 */
public enum QualitySpace {

    /** Absolute pixel margins, measured against the detection frame. */
    IMAGE,

    /** Resolution independent ratios, measured against the on-screen viewport. */
    VIEW
}
