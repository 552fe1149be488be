package com.example.depositaccrual.entity;

/**
 * Day-count conventions supported for deposit positions
 */
public enum DayCountConvention {
    /** Calendar days, inclusive at both ends; year basis 365/366 or a weighted blend */
    ACTUAL_ACTUAL,
    /** Every month counts 30 days, year basis 360 */
    THIRTY_360
}
