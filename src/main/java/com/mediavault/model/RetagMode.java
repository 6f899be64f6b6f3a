package com.mediavault.model;

/**
 * How a retag batch turns the requested date into one date per asset.
 */
public enum RetagMode {
    /** Every asset gets the requested date. */
    SAME,
    /** The offset between the requested date and the first selected asset's date is applied to all. */
    SHIFT,
    /** Assets ordered by current date get the requested date plus index times an interval. */
    SEQUENCE
}
