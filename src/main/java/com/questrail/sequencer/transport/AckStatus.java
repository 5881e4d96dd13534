package com.questrail.sequencer.transport;

/**
 * How the device answered a command.
 */
public enum AckStatus {
    SUCCESS,
    ERROR_KEYWORD,
    TIMEOUT
}
