package com.questrail.sequencer.error;

import com.questrail.sequencer.api.ErrorCategory;

/**
 * Thrown when the device acknowledges a command with an error keyword.
 */
public class DeviceErrorException extends SequenceException {

    public DeviceErrorException(String command, String deviceResponse) {
        super(ErrorCategory.DEVICE,
                "device reported an error for '" + command + "': " + deviceResponse,
                command, deviceResponse, null);
    }
}
