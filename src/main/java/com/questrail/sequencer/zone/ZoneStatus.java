package com.questrail.sequencer.zone;

/**
 * Status of one zone.
 */
public enum ZoneStatus {
    INACTIVE,
    ACTIVE,
    EXECUTING,
    COMPLETED,
    ERROR
}
