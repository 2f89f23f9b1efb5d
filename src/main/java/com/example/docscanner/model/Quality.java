package com.example.docscanner.model;

/**
 * One-shot verdict on a single detected rectangle. It carries no history; temporal smoothing
 * belongs to the caller.
 */
public enum Quality {
    GOOD,
    BAD_ANGLE,
    TOO_FAR
}
