package com.questrail.sequencer.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of SequenceObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jSequenceObservabilitySink implements SequenceObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jSequenceObservabilitySink.class);

    @Override
    public void onRunTransition(RunTransitionEvent event) {
        if (event.to().isTerminal()) {
            log.info("Run {}: {} -> {} ({})", event.runId(), event.from(), event.to(), event.message());
        }
        else {
            log.debug("Run {}: {} -> {}", event.runId(), event.from(), event.to());
        }
    }

    @Override
    public void onCommandExecuted(CommandExecutedEvent event) {
        var result = event.result();
        if (result.success()) {
            log.debug("Run {} [{}/{}] '{}': {}",
                event.runId(), event.current(), event.total(), result.command(), result.message());
        }
        else {
            log.warn("Run {} [{}/{}] '{}' failed ({}): {}",
                event.runId(), event.current(), event.total(), result.command(),
                result.category(), result.message());
        }
    }

    @Override
    public void onConditionEvaluated(ConditionEvaluatedEvent event) {
        log.debug("Condition '{}' = {}{}", event.condition(), event.value(), event.ignored() ? " (ignored)" : "");
    }

    @Override
    public void onZoneTransition(ZoneTransitionEvent event) {
        if (event.error() != null) {
            log.warn("Zone {}: {} -> {} ({})", event.zone(), event.from(), event.to(), event.error());
        }
        else {
            log.info("Zone {}: {} -> {}", event.zone(), event.from(), event.to());
        }
    }

    @Override
    public void onError(SequenceErrorEvent event) {
        log.error("Sequence error [{}]: {}", event.category(), event.message(), event.cause());
    }
}
