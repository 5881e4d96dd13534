package com.questrail.sequencer.exec.handler;

import com.questrail.sequencer.api.CommandKind;
import com.questrail.sequencer.exec.AcknowledgedSender;
import com.questrail.sequencer.exec.ExecutionTimingPolicy;
import com.questrail.sequencer.time.MonotonicClock;
import com.questrail.sequencer.zone.ZoneFanOut;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps each {@link CommandKind} to the handler that executes it.
 * Populated once at construction and read-only afterwards.
 */
public final class CommandHandlerRegistry {

    private final Map<CommandKind, CommandHandler> handlers;

    private CommandHandlerRegistry(Map<CommandKind, CommandHandler> handlers) {
        this.handlers = Collections.unmodifiableMap(handlers);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * The handler set used by the engine.
     */
    public static CommandHandlerRegistry standard(AcknowledgedSender sender,
                                                  ZoneFanOut fanOut,
                                                  ExecutionTimingPolicy timing,
                                                  MonotonicClock clock) {
        return builder()
                .register(new DeviceCommandHandler(sender, timing.ackTimeout()))
                .register(new WaitCommandHandler(clock, timing.slice()))
                .register(new ConditionalCommandHandler())
                .register(new StopIfNotCommandHandler())
                .register(new MultizoneCommandHandler(fanOut, sender, timing.ackTimeout()))
                .register(new ReferenceCommandHandler())
                .build();
    }

    public Optional<CommandHandler> handlerFor(CommandKind kind) {
        return Optional.ofNullable(handlers.get(kind));
    }

    public boolean supports(CommandKind kind) {
        return handlers.containsKey(kind);
    }

    public static final class Builder {
        private final Map<CommandKind, CommandHandler> handlers = new EnumMap<>(CommandKind.class);

        /**
         * @throws IllegalStateException if one of the handler's kinds is already taken
         */
        public Builder register(CommandHandler handler) {
            Objects.requireNonNull(handler, "handler");
            for (CommandKind kind : handler.kinds()) {
                CommandHandler previous = handlers.putIfAbsent(kind, handler);
                if (previous != null) {
                    throw new IllegalStateException(kind + " is already handled by "
                            + previous.getClass().getSimpleName());
                }
            }
            return this;
        }

        public CommandHandlerRegistry build() {
            return new CommandHandlerRegistry(new EnumMap<>(handlers));
        }
    }
}
