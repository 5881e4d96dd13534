package com.questrail.sequencer.exec;

import com.questrail.sequencer.api.CommandResult;

/**
 * Receives each command result of a run as it is produced.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (result, current, total) -> { };

    void onCommand(CommandResult result, int current, int total);
}
