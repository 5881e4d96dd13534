package com.questrail.sequencer.parse;

import com.questrail.sequencer.api.CommandKind;
import com.questrail.sequencer.api.ValidationOutcome;
import com.questrail.sequencer.condition.ConditionExpression;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A classified command: raw text, kind and parsed payload.
 *
 * <p>Payload keys are the constants on this class.</p>
 */
public record Command(String raw, CommandKind kind, Map<String, Object> payload) {

    public static final String WAIT_TIME = "wait_time";
    public static final String CONDITION = "condition";
    public static final String EXPRESSION = "expression";
    public static final String PARAMS = "params";
    public static final String ZONE_MASK = "zone_mask";
    public static final String BASE_COMMAND = "base_command";
    public static final String FAN_OUT = "fan_out";
    public static final String SEQUENCE_NAME = "sequence_name";
    public static final String BUTTON_PARAMS = "button_params";
    public static final String TAG = "tag";
    public static final String TEXT = "command";

    public Command {
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(kind, "kind");
        payload = Map.copyOf(Objects.requireNonNull(payload, "payload"));
    }

    static Command from(String raw, ValidationOutcome outcome) {
        return new Command(raw, outcome.kind(), outcome.payload());
    }

    public String text() {
        return raw.strip();
    }

    public String string(String key) {
        Object v = payload.get(key);
        if (v == null) {
            throw new IllegalStateException(kind + " command has no '" + key + "' payload");
        }
        return v.toString();
    }

    public double waitSeconds() {
        return ((Number) payload.get(WAIT_TIME)).doubleValue();
    }

    public ConditionExpression expression() {
        return (ConditionExpression) payload.get(EXPRESSION);
    }

    public boolean isFanOut() {
        return Boolean.TRUE.equals(payload.get(FAN_OUT));
    }

    public Optional<Integer> zoneMask() {
        return Optional.ofNullable((Integer) payload.get(ZONE_MASK));
    }
}
