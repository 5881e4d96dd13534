package com.questrail.sequencer.exec.handler;

import com.questrail.sequencer.api.CommandKind;
import com.questrail.sequencer.exec.AcknowledgedSender;
import com.questrail.sequencer.exec.RunContext;
import com.questrail.sequencer.parse.Command;
import com.questrail.sequencer.transport.Acknowledgement;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Sends regular and tagged commands to the device as written and waits for
 * the acknowledgement.
 */
final class DeviceCommandHandler implements CommandHandler {

    private final AcknowledgedSender sender;
    private final Duration ackTimeout;

    DeviceCommandHandler(AcknowledgedSender sender, Duration ackTimeout) {
        this.sender = Objects.requireNonNull(sender, "sender");
        this.ackTimeout = Objects.requireNonNull(ackTimeout, "ackTimeout");
    }

    @Override
    public Set<CommandKind> kinds() {
        return EnumSet.of(CommandKind.REGULAR, CommandKind.TAGGED);
    }

    @Override
    public StepOutcome process(Command command, RunContext context) {
        Acknowledgement ack = sender.sendAndAwait(command.text(), ackTimeout, context.token());
        return new StepOutcome("acknowledged", ack.rawResponse());
    }
}
