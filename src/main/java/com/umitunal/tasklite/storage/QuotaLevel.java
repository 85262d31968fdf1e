package com.umitunal.tasklite.storage;

/**
 * Usage band relative to the configured warning and critical thresholds.
 */
public enum QuotaLevel {
    NORMAL,
    WARNING,
    CRITICAL
}
