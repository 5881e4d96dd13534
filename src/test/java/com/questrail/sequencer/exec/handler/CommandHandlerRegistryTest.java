package com.questrail.sequencer.exec.handler;

import com.questrail.sequencer.api.CommandKind;
import com.questrail.sequencer.time.SystemMonotonicClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CommandHandlerRegistryTest {

    @Test
    void everyExecutableKindHasOneHandler() {
        CommandHandlerRegistry registry = CommandHandlerRegistry.builder()
                .register(new WaitCommandHandler(SystemMonotonicClock.INSTANCE, Duration.ofMillis(10)))
                .register(new ConditionalCommandHandler())
                .register(new StopIfNotCommandHandler())
                .register(new ReferenceCommandHandler())
                .build();

        assertTrue(registry.supports(CommandKind.WAIT));
        assertTrue(registry.supports(CommandKind.ELSE));
        assertTrue(registry.supports(CommandKind.BUTTON_REF));
        assertFalse(registry.supports(CommandKind.REGULAR));
        assertFalse(registry.supports(CommandKind.UNKNOWN));
        assertTrue(registry.handlerFor(CommandKind.STOP_IF_NOT).orElseThrow() instanceof StopIfNotCommandHandler);
        assertTrue(registry.handlerFor(CommandKind.MULTIZONE).isEmpty());
    }

    @Test
    void overlappingRegistrationIsRejected() {
        CommandHandlerRegistry.Builder builder = CommandHandlerRegistry.builder()
                .register(new ConditionalCommandHandler());

        assertThrows(IllegalStateException.class, () -> builder.register(new ConditionalCommandHandler()));
    }
}
