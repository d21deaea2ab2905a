package com.example.handparse.application.parser;

import com.example.handparse.domain.model.ActionKind;
import com.example.handparse.domain.model.Combo;
import com.example.handparse.domain.model.PlayerAction;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies a single line of a hand body into a {@link PlayerAction}.
 * <p>
 * Several line types share vocabulary (a win line and a player named after a verb both contain
 * {@code collected}), so rules are tried in a fixed priority order, most specific first, and the
 * first rule whose handler produces an action wins. Stateless and safe to share between threads.
 */
@Component
public class ActionClassifier {

    private static final String AMOUNT = "[$€£]?(?<amount>\\d+(?:\\.\\d+)?)";
    private static final Pattern UNCALLED_PATTERN =
            Pattern.compile("^Uncalled bet \\(" + AMOUNT + "\\) returned to\\s+(?<name>.+)$");
    private static final Pattern COLLECTED_PATTERN =
            Pattern.compile("^(?<name>.+?) collected " + AMOUNT + " from (?:side |main )?pot.*$");
    private static final Pattern MUCK_PATTERN =
            Pattern.compile("^(?<name>.+?): (?:doesn't show hand|mucks hand)");
    private static final Pattern JOIN_PATTERN =
            Pattern.compile("^(?<name>.+?) joins the table at seat #(?<seat>\\d+)$");
    private static final Pattern LEAVE_PATTERN = Pattern.compile("^(?<name>.+?) leaves the table");
    private static final Pattern TIMED_OUT_PATTERN = Pattern.compile("^(?<name>.+?) has timed out");
    private static final Pattern CONNECTED_PATTERN = Pattern.compile("^(?<name>.+?) is connected$");
    private static final Pattern DISCONNECTED_PATTERN = Pattern.compile("^(?<name>.+?) is disconnected$");
    private static final Pattern REMOVED_PATTERN = Pattern.compile("^(?<name>.+?) was removed from the table");
    private static final Pattern SHOW_PATTERN = Pattern.compile("^(?<name>.+?): shows \\[(?<cards>[^\\]]+)\\]");
    private static final Pattern PLAYER_ACTION_PATTERN =
            Pattern.compile("^(?<name>.+?):\\s+(?<verb>\\S+)(?<rest>.*)$");
    private static final Pattern FIRST_NUMBER_PATTERN = Pattern.compile(AMOUNT);
    private static final String ALL_IN_SUFFIX = "and is all-in";

    private final List<ActionRule> rules = List.of(
            new ActionRule(line -> line.startsWith("Uncalled bet"), this::parseUncalled),
            new ActionRule(line -> line.contains(" collected "), this::parseCollected),
            new ActionRule(line -> line.contains(" doesn't show hand") || line.contains("mucks hand"),
                    line -> named(MUCK_PATTERN, line, ActionKind.MUCK)),
            new ActionRule(line -> line.contains("joins the table"), this::parseJoin),
            new ActionRule(line -> line.contains("leaves the table"),
                    line -> named(LEAVE_PATTERN, line, ActionKind.LEAVE)),
            new ActionRule(line -> line.contains("has timed out"),
                    line -> named(TIMED_OUT_PATTERN, line, ActionKind.TIMED_OUT)),
            new ActionRule(line -> line.contains("is connected"),
                    line -> named(CONNECTED_PATTERN, line, ActionKind.CONNECTED)),
            new ActionRule(line -> line.contains("is disconnected"),
                    line -> named(DISCONNECTED_PATTERN, line, ActionKind.DISCONNECTED)),
            new ActionRule(line -> line.contains("was removed"),
                    line -> named(REMOVED_PATTERN, line, ActionKind.REMOVED)),
            new ActionRule(line -> line.contains(" shows "), this::parseShow),
            new ActionRule(line -> line.contains(": "), this::parsePlayerAction)
    );

    /**
     * Classifies one body line.
     *
     * @param rawLine line of hand text, surrounding whitespace is ignored
     * @return the action, or empty when no rule recognises the line
     * @throws com.example.handparse.domain.exception.InvalidComboException when a shows line
     *         reveals a duplicate card
     */
    public Optional<PlayerAction> classify(String rawLine) {
        if (rawLine == null || rawLine.isBlank()) {
            return Optional.empty();
        }
        String line = rawLine.strip();
        for (ActionRule rule : rules) {
            if (!rule.matches().test(line)) {
                continue;
            }
            Optional<PlayerAction> action = rule.handler().apply(line);
            if (action.isPresent()) {
                return action;
            }
        }
        return Optional.empty();
    }

    private Optional<PlayerAction> parseUncalled(String line) {
        Matcher matcher = UNCALLED_PATTERN.matcher(line);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(PlayerAction.of(matcher.group("name").strip(), ActionKind.RETURN,
                new BigDecimal(matcher.group("amount"))));
    }

    private Optional<PlayerAction> parseCollected(String line) {
        Matcher matcher = COLLECTED_PATTERN.matcher(line);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(PlayerAction.of(matcher.group("name"), ActionKind.WIN,
                new BigDecimal(matcher.group("amount"))));
    }

    private Optional<PlayerAction> parseJoin(String line) {
        Matcher matcher = JOIN_PATTERN.matcher(line);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(PlayerAction.join(matcher.group("name"), Integer.parseInt(matcher.group("seat"))));
    }

    private Optional<PlayerAction> parseShow(String line) {
        Matcher matcher = SHOW_PATTERN.matcher(line);
        if (!matcher.find()) {
            return Optional.empty();
        }
        List<String> tokens = List.of(matcher.group("cards").strip().split("\\s+"));
        // a partial show such as "shows [Kh]" has no combo
        if (tokens.size() != 2 && tokens.size() != 4) {
            return Optional.empty();
        }
        Combo combo = Combo.fromTokens(tokens);
        return Optional.of(PlayerAction.show(matcher.group("name"), combo));
    }

    private Optional<PlayerAction> parsePlayerAction(String line) {
        Matcher matcher = PLAYER_ACTION_PATTERN.matcher(line);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        ActionKind kind = ActionKind.fromVerb(matcher.group("verb"));
        if (kind == null) {
            return Optional.empty();
        }
        String rest = matcher.group("rest");
        Matcher amountMatcher = FIRST_NUMBER_PATTERN.matcher(rest);
        BigDecimal amount = amountMatcher.find() ? new BigDecimal(amountMatcher.group("amount")) : null;
        String name = matcher.group("name");
        if (rest.contains(ALL_IN_SUFFIX)) {
            return Optional.of(PlayerAction.allIn(name, kind, amount));
        }
        return Optional.of(PlayerAction.of(name, kind, amount));
    }

    private static Optional<PlayerAction> named(Pattern pattern, String line, ActionKind kind) {
        Matcher matcher = pattern.matcher(line);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(PlayerAction.of(matcher.group("name").strip(), kind));
    }

    /**
     * Anchor predicate plus the handler that extracts the action once the anchor is present.
     */
    private record ActionRule(Predicate<String> matches, Function<String, Optional<PlayerAction>> handler) {
    }
}
