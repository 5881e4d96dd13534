package com.questrail.sequencer.exec.handler;

import com.questrail.sequencer.api.CommandKind;
import com.questrail.sequencer.error.SequenceException;
import com.questrail.sequencer.exec.AcknowledgedSender;
import com.questrail.sequencer.exec.RunContext;
import com.questrail.sequencer.parse.Command;
import com.questrail.sequencer.transport.Acknowledgement;
import com.questrail.sequencer.zone.FanOutResult;
import com.questrail.sequencer.zone.ZoneFanOut;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * {@code og_multizone-<base>} fans out over the active zones;
 * {@code multizone <params>} is sent to the device like a regular command.
 */
final class MultizoneCommandHandler implements CommandHandler {

    private final ZoneFanOut fanOut;
    private final AcknowledgedSender sender;
    private final Duration ackTimeout;

    MultizoneCommandHandler(ZoneFanOut fanOut, AcknowledgedSender sender, Duration ackTimeout) {
        this.fanOut = Objects.requireNonNull(fanOut, "fanOut");
        this.sender = Objects.requireNonNull(sender, "sender");
        this.ackTimeout = Objects.requireNonNull(ackTimeout, "ackTimeout");
    }

    @Override
    public Set<CommandKind> kinds() {
        return EnumSet.of(CommandKind.MULTIZONE);
    }

    @Override
    public StepOutcome process(Command command, RunContext context) {
        if (!command.isFanOut()) {
            Acknowledgement ack = sender.sendAndAwait(command.text(), ackTimeout, context.token());
            return new StepOutcome("acknowledged", ack.rawResponse());
        }
        FanOutResult result = fanOut.execute(command.string(Command.BASE_COMMAND), context.token());
        if (!result.success()) {
            throw new SequenceException(result.category(), result.message(), result.failedCommand(),
                    result.deviceResponse(), null);
        }
        return StepOutcome.of(result.message());
    }
}
