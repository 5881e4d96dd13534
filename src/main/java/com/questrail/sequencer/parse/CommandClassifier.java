package com.questrail.sequencer.parse;

import com.questrail.sequencer.api.CommandKind;
import com.questrail.sequencer.api.ErrorCategory;
import com.questrail.sequencer.api.ValidationOutcome;
import com.questrail.sequencer.cache.BoundedCache;
import com.questrail.sequencer.condition.ConditionExpression;
import com.questrail.sequencer.condition.ConditionParser;
import com.questrail.sequencer.condition.ConditionSyntaxException;
import com.questrail.sequencer.time.MonotonicClock;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * CommandClassifier
 * =============================================================================
 * Turns one line of the sequence language into a typed {@link ValidationOutcome}.
 *
 * <h2>Recognized forms</h2>
 * <pre>
 * wait &lt;seconds&gt;            WAIT         wait_time
 * if &lt;expr&gt;                 IF           condition, expression
 * else                      ELSE
 * endif                     END_IF
 * stop_if_not &lt;expr&gt;        STOP_IF_NOT  condition, expression
 * multizone &lt;params&gt;        MULTIZONE    params [, zone_mask]
 * og_multizone-&lt;base&gt;       MULTIZONE    base_command, fan_out
 * sequence &lt;name&gt;           SEQUENCE_REF sequence_name
 * button &lt;params&gt;           BUTTON_REF   button_params
 * tagged &lt;tag&gt;              TAGGED       tag
 * anything else             REGULAR      command
 * </pre>
 *
 * <p>Keywords are matched case-insensitively against the first
 * whitespace-delimited token only, so {@code waitress} is a regular command
 * while a bare {@code wait} is a malformed wait.</p>
 *
 * <h2>Bounded cost</h2>
 * <p>Input over {@link LanguageLimits#maxCommandLength()} is rejected before
 * any scanning. Scanning is a single forward pass charged to a
 * {@link ParseBudget}; when the budget runs out the command is reported as
 * invalid with {@link ErrorCategory#TIMEOUT}. No helper thread is involved.</p>
 *
 * <h2>Caching</h2>
 * <p>Classification is a pure function of the trimmed text, so results may be
 * kept in an optional {@link BoundedCache}.</p>
 */
public final class CommandClassifier {

    private static final String FAN_OUT_PREFIX = "og_multizone-";

    private final LanguageLimits limits;
    private final MonotonicClock clock;
    private final ConditionParser conditionParser;
    private final BoundedCache<String, ValidationOutcome> cache;

    public CommandClassifier(LanguageLimits limits, MonotonicClock clock) {
        this(limits, clock, null);
    }

    public CommandClassifier(LanguageLimits limits, MonotonicClock clock,
                             BoundedCache<String, ValidationOutcome> cache) {
        this.limits = Objects.requireNonNull(limits, "limits");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.conditionParser = new ConditionParser(limits.maxArgumentGroups());
        this.cache = cache;
    }

    public LanguageLimits limits() {
        return limits;
    }

    public ValidationOutcome classify(String command) {
        if (command == null) {
            return ValidationOutcome.invalid(CommandKind.UNKNOWN, "command is null", ErrorCategory.SYNTAX);
        }
        String text = command.strip();
        if (text.isEmpty()) {
            return ValidationOutcome.invalid(CommandKind.UNKNOWN, "command is empty", ErrorCategory.SYNTAX);
        }
        if (text.length() > limits.maxCommandLength()) {
            return ValidationOutcome.invalid(CommandKind.UNKNOWN,
                    "command is " + text.length() + " characters long; at most "
                            + limits.maxCommandLength() + " allowed",
                    ErrorCategory.RANGE);
        }

        if (cache != null) {
            var cached = cache.get(text);
            if (cached.isPresent()) {
                return cached.get();
            }
        }

        ValidationOutcome outcome;
        try {
            outcome = scan(text, ParseBudget.start(clock, limits.parseTimeBudget(), text.length()));
        }
        catch (ParseBudgetExceededException e) {
            outcome = ValidationOutcome.invalid(CommandKind.UNKNOWN, e.getMessage(), ErrorCategory.TIMEOUT);
        }

        // Budget failures depend on timing, not on the text, so they are not cached.
        if (cache != null && outcome.category() != ErrorCategory.TIMEOUT) {
            cache.put(text, outcome);
        }
        return outcome;
    }

    /**
     * Classifies and wraps the result as a {@link Command}.
     *
     * @throws IllegalArgumentException when the command is invalid
     */
    public Command parse(String command) {
        ValidationOutcome outcome = classify(command);
        if (!outcome.valid()) {
            throw new IllegalArgumentException(outcome.errorMessage());
        }
        return Command.from(command, outcome);
    }

    // -------------------------------------------------------------------------
    // Scanner
    // -------------------------------------------------------------------------

    private ValidationOutcome scan(String text, ParseBudget budget) {
        if (text.regionMatches(true, 0, FAN_OUT_PREFIX, 0, FAN_OUT_PREFIX.length())) {
            return scanFanOut(text.substring(FAN_OUT_PREFIX.length()).strip(), budget);
        }

        int keywordEnd = 0;
        while (keywordEnd < text.length() && !Character.isWhitespace(text.charAt(keywordEnd))) {
            budget.step();
            keywordEnd++;
        }
        String keyword = text.substring(0, keywordEnd).toLowerCase(Locale.ROOT);
        String rest = text.substring(keywordEnd).strip();

        return switch (keyword) {
            case "wait" -> scanWait(rest, budget);
            case "if" -> scanCondition(CommandKind.IF, "if", rest, budget);
            case "stop_if_not" -> scanCondition(CommandKind.STOP_IF_NOT, "stop_if_not", rest, budget);
            case "else" -> scanBare(CommandKind.ELSE, "else", rest);
            case "endif" -> scanBare(CommandKind.END_IF, "endif", rest);
            case "multizone" -> scanMultizone(rest, budget);
            case "sequence" -> scanName(CommandKind.SEQUENCE_REF, "sequence", Command.SEQUENCE_NAME, rest, budget);
            case "tagged" -> scanName(CommandKind.TAGGED, "tagged", Command.TAG, rest, budget);
            case "button" -> scanButton(rest, budget);
            default -> scanRegular(text, budget);
        };
    }

    private ValidationOutcome scanWait(String rest, ParseBudget budget) {
        if (rest.isEmpty()) {
            return ValidationOutcome.invalid(CommandKind.WAIT,
                    "wait requires a duration in seconds", ErrorCategory.SYNTAX);
        }
        boolean negative = rest.charAt(0) == '-';
        String digits = negative ? rest.substring(1) : rest;
        if (!isDecimal(digits, budget)) {
            return ValidationOutcome.invalid(CommandKind.WAIT,
                    "invalid wait time '" + rest + "'", ErrorCategory.SYNTAX);
        }
        if (negative) {
            return ValidationOutcome.invalid(CommandKind.WAIT,
                    "wait time must not be negative: " + rest, ErrorCategory.RANGE);
        }
        double seconds = Double.parseDouble(digits);
        if (seconds > limits.maxWaitSeconds()) {
            return ValidationOutcome.invalid(CommandKind.WAIT,
                    "wait time " + rest + " exceeds the maximum of " + formatSeconds(limits.maxWaitSeconds())
                            + " seconds",
                    ErrorCategory.RANGE);
        }
        return ValidationOutcome.valid(CommandKind.WAIT, Map.of(Command.WAIT_TIME, seconds));
    }

    /**
     * Accepts {@code digits [ '.' digits ]}.
     */
    private static boolean isDecimal(String s, ParseBudget budget) {
        int i = 0;
        int n = s.length();
        int intDigits = 0;
        while (i < n && isAsciiDigit(s.charAt(i))) {
            budget.step();
            i++;
            intDigits++;
        }
        if (intDigits == 0) {
            return false;
        }
        if (i == n) {
            return true;
        }
        if (s.charAt(i) != '.') {
            return false;
        }
        i++;
        int fracDigits = 0;
        while (i < n && isAsciiDigit(s.charAt(i))) {
            budget.step();
            i++;
            fracDigits++;
        }
        return fracDigits > 0 && i == n;
    }

    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private ValidationOutcome scanCondition(CommandKind kind, String keyword, String rest, ParseBudget budget) {
        if (rest.isEmpty()) {
            return ValidationOutcome.invalid(kind, keyword + " requires a condition", ErrorCategory.SYNTAX);
        }
        try {
            ConditionExpression expression = conditionParser.parse(rest, budget);
            return ValidationOutcome.valid(kind, Map.of(Command.CONDITION, rest, Command.EXPRESSION, expression));
        }
        catch (ConditionSyntaxException e) {
            return ValidationOutcome.invalid(kind, keyword + ": " + e.getMessage(), e.category());
        }
    }

    private static ValidationOutcome scanBare(CommandKind kind, String keyword, String rest) {
        if (!rest.isEmpty()) {
            return ValidationOutcome.invalid(kind, keyword + " takes no arguments", ErrorCategory.SYNTAX);
        }
        return ValidationOutcome.valid(kind, Map.of());
    }

    private ValidationOutcome scanFanOut(String base, ParseBudget budget) {
        if (base.isEmpty()) {
            return ValidationOutcome.invalid(CommandKind.MULTIZONE,
                    "og_multizone requires a base command", ErrorCategory.SYNTAX);
        }
        int groups = countTokens(base, budget);
        if (groups > limits.maxArgumentGroups() + 1) {
            return tooManyGroups(CommandKind.MULTIZONE, groups - 1);
        }
        return ValidationOutcome.valid(CommandKind.MULTIZONE,
                Map.of(Command.BASE_COMMAND, base, Command.FAN_OUT, Boolean.TRUE));
    }

    private ValidationOutcome scanMultizone(String params, ParseBudget budget) {
        if (params.isEmpty()) {
            return ValidationOutcome.invalid(CommandKind.MULTIZONE,
                    "multizone requires parameters", ErrorCategory.SYNTAX);
        }
        boolean binary = params.length() == 4;
        for (int i = 0; i < params.length(); i++) {
            budget.step();
            char c = params.charAt(i);
            if (!(Character.isLetterOrDigit(c) && c < 128) && c != ' ' && c != ',') {
                return ValidationOutcome.invalid(CommandKind.MULTIZONE,
                        "multizone parameters may only contain letters, digits, spaces and commas",
                        ErrorCategory.SYNTAX);
            }
            binary &= c == '0' || c == '1';
        }
        int groups = 0;
        boolean inGroup = false;
        for (int i = 0; i < params.length(); i++) {
            budget.step();
            boolean sep = params.charAt(i) == ' ' || params.charAt(i) == ',';
            if (!sep && !inGroup) {
                groups++;
            }
            inGroup = !sep;
        }
        if (groups > limits.maxArgumentGroups()) {
            return tooManyGroups(CommandKind.MULTIZONE, groups);
        }
        Map<String, Object> payload = new HashMap<>();
        payload.put(Command.PARAMS, params);
        if (binary) {
            payload.put(Command.ZONE_MASK, Integer.parseInt(params, 2));
        }
        return ValidationOutcome.valid(CommandKind.MULTIZONE, payload);
    }

    private ValidationOutcome scanName(CommandKind kind, String keyword, String key, String rest, ParseBudget budget) {
        if (rest.isEmpty()) {
            return ValidationOutcome.invalid(kind, keyword + " requires a name", ErrorCategory.SYNTAX);
        }
        for (int i = 0; i < rest.length(); i++) {
            budget.step();
            if (!isNameChar(rest.charAt(i))) {
                return ValidationOutcome.invalid(kind,
                        "invalid " + keyword + " name '" + rest
                                + "': only letters, digits, '_' and '-' are allowed",
                        ErrorCategory.SYNTAX);
            }
        }
        return ValidationOutcome.valid(kind, Map.of(key, rest));
    }

    private ValidationOutcome scanButton(String rest, ParseBudget budget) {
        if (rest.isEmpty()) {
            return ValidationOutcome.invalid(CommandKind.BUTTON_REF,
                    "button requires parameters", ErrorCategory.SYNTAX);
        }
        int groups = countTokens(rest, budget);
        if (groups > limits.maxArgumentGroups()) {
            return tooManyGroups(CommandKind.BUTTON_REF, groups);
        }
        return ValidationOutcome.valid(CommandKind.BUTTON_REF, Map.of(Command.BUTTON_PARAMS, rest));
    }

    private ValidationOutcome scanRegular(String text, ParseBudget budget) {
        int arguments = countTokens(text, budget) - 1;
        if (arguments > limits.maxArgumentGroups()) {
            return tooManyGroups(CommandKind.REGULAR, arguments);
        }
        return ValidationOutcome.valid(CommandKind.REGULAR, Map.of(Command.TEXT, text));
    }

    private ValidationOutcome tooManyGroups(CommandKind kind, int groups) {
        return ValidationOutcome.invalid(kind,
                "command has " + groups + " argument groups; at most " + limits.maxArgumentGroups() + " allowed",
                ErrorCategory.RANGE);
    }

    private static int countTokens(String s, ParseBudget budget) {
        int count = 0;
        boolean inToken = false;
        for (int i = 0; i < s.length(); i++) {
            budget.step();
            boolean ws = Character.isWhitespace(s.charAt(i));
            if (!ws && !inToken) {
                count++;
            }
            inToken = !ws;
        }
        return count;
    }

    static boolean isNameChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || isAsciiDigit(c) || c == '_' || c == '-';
    }

    private static String formatSeconds(double seconds) {
        return seconds == Math.rint(seconds) ? Long.toString((long) seconds) : Double.toString(seconds);
    }
}
