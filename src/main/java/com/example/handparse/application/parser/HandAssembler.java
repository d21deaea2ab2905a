package com.example.handparse.application.parser;

import com.example.handparse.application.parser.HandSections.Section;
import com.example.handparse.domain.exception.InvalidCardException;
import com.example.handparse.domain.exception.InvalidComboException;
import com.example.handparse.domain.exception.MalformedHandException;
import com.example.handparse.domain.model.Card;
import com.example.handparse.domain.model.Combo;
import com.example.handparse.domain.model.Hand;
import com.example.handparse.domain.model.HandHeader;
import com.example.handparse.domain.model.PlayerAction;
import com.example.handparse.domain.model.Seat;
import com.example.handparse.domain.model.Street;
import com.example.handparse.domain.model.StreetName;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Builds the body of a {@link Hand} from an already parsed header and the split sections.
 * <p>
 * Steps run in a fixed order: table, seats, button, hero, preflop, flop, turn, river, showdown,
 * pot, board, winners. Card and combo failures inside the body are rethrown as
 * {@link MalformedHandException} so callers always learn which hand and which line broke.
 */
@Component
public class HandAssembler {

    private static final Pattern TABLE_PATTERN = Pattern.compile(
            "^Table '(?<name>.*)' (?<max>\\d+)-max (?:\\(Play Money\\) )?Seat #(?<button>\\d+) is the button.*$");
    private static final Pattern SEAT_PATTERN = Pattern.compile(
            "^Seat (?<seat>\\d+): (?<name>.+?) \\([$€£]?(?<stack>\\d+(?:\\.\\d+)?) in chips(?:,[^)]*)?\\)"
                    + "(?<out> is sitting out)?.*$");
    private static final Pattern HERO_PATTERN = Pattern.compile("^Dealt to (?<name>.+?) \\[(?<cards>[^\\]]+)\\]");
    private static final Pattern BRACKET_PATTERN = Pattern.compile("\\[([^\\]]*)\\]");
    private static final Pattern POT_PATTERN = Pattern.compile(
            "^Total pot [^\\d]*?(?<pot>\\d+(?:\\.\\d+)?) .*\\| Rake [^\\d]*?(?<rake>\\d+(?:\\.\\d+)?).*$");
    private static final Pattern BOARD_PATTERN = Pattern.compile("^Board \\[(?<cards>[^\\]]*)\\]");
    private static final Pattern SUMMARY_WINNER_PATTERN =
            Pattern.compile("^Seat \\d+: (?<name>.+?)\\s?(?:\\(.+?\\))? collected \\(");
    private static final Pattern ACTION_WINNER_PATTERN =
            Pattern.compile("^(?<name>.+?) collected [$€£]?\\d+(?:\\.\\d+)? from (?:side |main )?pot");
    private static final Pattern SHOWDOWN_WINNER_PATTERN =
            Pattern.compile("^Seat \\d+: (?<name>.+?)\\s?(?:\\(.+?\\))? showed \\[.+?\\] and won");
    private static final String TABLE_PREFIX = "Table '";
    private static final String HERO_PREFIX = "Dealt to ";

    private final ActionClassifier classifier;

    /**
     * Creates the assembler.
     *
     * @param classifier classifier used for every body line
     */
    public HandAssembler(ActionClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * Assembles the hand body.
     *
     * @param header      parsed header
     * @param sections    split hand text
     * @param diagnostics sink for lines no action rule recognised
     * @return fully populated hand
     * @throws MalformedHandException when the table line is missing, a seat lies outside the table,
     *                                or a card set in the body cannot be read or repeats a card
     */
    public Hand assemble(HandHeader header, HandSections sections, ParseDiagnostics diagnostics) {
        String handId = header.handId();

        Matcher table = matchTable(handId, sections.preambleLines());
        String tableName = table.group("name");
        int maxPlayers = Integer.parseInt(table.group("max"));
        List<Seat> seats = parseSeats(handId, sections.preambleLines(), maxPlayers);

        int buttonSeat = Integer.parseInt(table.group("button"));
        if (buttonSeat < 1 || buttonSeat > maxPlayers) {
            throw new MalformedHandException(handId, "Button seat outside the table", table.group());
        }

        Section holeCards = sections.get(SectionMarker.HOLE_CARDS);
        Seat hero = parseHero(header, holeCards, seats);
        Seat button = seats.get(buttonSeat - 1);

        List<PlayerAction> preflop = holeCards == null
                ? List.of()
                : parseActions(handId, holeCards, diagnostics, line -> line.startsWith(HERO_PREFIX));

        Street flop = parseStreet(handId, sections.get(SectionMarker.FLOP), StreetName.FLOP, diagnostics);
        Street turn = parseStreet(handId, sections.get(SectionMarker.TURN), StreetName.TURN, diagnostics);
        Street river = parseStreet(handId, sections.get(SectionMarker.RIVER), StreetName.RIVER, diagnostics);

        Section showDownSection = sections.get(SectionMarker.SHOW_DOWN);
        boolean showDown = showDownSection != null;
        List<PlayerAction> showDownActions = showDown
                ? parseActions(handId, showDownSection, diagnostics, line -> false)
                : null;

        Section summary = sections.get(SectionMarker.SUMMARY);
        BigDecimal totalPot = null;
        BigDecimal rake = null;
        List<Card> board = null;
        Set<String> winners = Collections.emptySet();
        if (summary != null) {
            Matcher pot = findPot(summary);
            if (pot != null) {
                totalPot = new BigDecimal(pot.group("pot"));
                rake = new BigDecimal(pot.group("rake"));
            }
            board = parseBoard(handId, summary);
            winners = parseWinners(summary, showDown);
        }

        return new Hand(header, tableName, maxPlayers, button, hero, List.copyOf(seats), preflop,
                flop, turn, river, showDown, showDownActions, totalPot, rake, board, winners);
    }

    private Matcher matchTable(String handId, List<String> preamble) {
        for (String line : preamble) {
            if (!line.startsWith(TABLE_PREFIX)) {
                continue;
            }
            Matcher matcher = TABLE_PATTERN.matcher(line);
            if (!matcher.matches()) {
                throw new MalformedHandException(handId, "Unreadable table line", line);
            }
            return matcher;
        }
        throw new MalformedHandException(handId, "Missing table line", (String) null);
    }

    /**
     * Fills one entry per table position, placeholders first, then the occupied seats.
     */
    private List<Seat> parseSeats(String handId, List<String> preamble, int maxPlayers) {
        List<Seat> seats = new ArrayList<>(maxPlayers);
        for (int seat = 1; seat <= maxPlayers; seat++) {
            seats.add(Seat.empty(seat));
        }
        for (String line : preamble) {
            Matcher matcher = SEAT_PATTERN.matcher(line);
            if (!matcher.matches()) {
                continue;
            }
            int seatNumber = Integer.parseInt(matcher.group("seat"));
            if (seatNumber < 1 || seatNumber > maxPlayers) {
                throw new MalformedHandException(handId,
                        "Seat " + seatNumber + " outside a " + maxPlayers + "-max table", line);
            }
            seats.set(seatNumber - 1, Seat.occupied(seatNumber, matcher.group("name"),
                    new BigDecimal(matcher.group("stack")), matcher.group("out") != null));
        }
        return seats;
    }

    /**
     * Finds the first {@code Dealt to} line and gives the hero seat its hole cards.
     * The seat list is updated in place so the button and player list share the same seat.
     */
    private Seat parseHero(HandHeader header, Section holeCards, List<Seat> seats) {
        if (holeCards == null) {
            return null;
        }
        for (String line : holeCards.lines()) {
            Matcher matcher = HERO_PATTERN.matcher(line);
            if (!matcher.find()) {
                continue;
            }
            String name = matcher.group("name");
            Combo combo;
            try {
                combo = Combo.of(matcher.group("cards"));
            } catch (InvalidCardException | InvalidComboException ex) {
                throw new MalformedHandException(header.handId(), line, ex);
            }
            int expected = header.game().getHoleCardCount();
            if (combo.size() != expected) {
                throw new MalformedHandException(header.handId(), line, new InvalidComboException(
                        combo.toString(), header.game() + " deals " + expected + " hole cards"));
            }
            for (int i = 0; i < seats.size(); i++) {
                Seat seat = seats.get(i);
                if (seat.occupied() && seat.name().equals(name)) {
                    Seat hero = seat.withHoleCards(combo);
                    seats.set(i, hero);
                    return hero;
                }
            }
            return null;
        }
        return null;
    }

    private Street parseStreet(String handId, Section section, StreetName name, ParseDiagnostics diagnostics) {
        if (section == null) {
            return null;
        }
        List<Card> cards = streetCards(handId, section);
        if (cards.size() != name.getDealtCards()) {
            throw new MalformedHandException(handId,
                    name + " must deal " + name.getDealtCards() + " card(s)", section.boardText());
        }
        return new Street(name, cards, parseActions(handId, section, diagnostics, line -> false));
    }

    /**
     * Street cards are the last bracket group of the marker line, e.g. {@code [8d]} in
     * {@code [3c 6s 9d] [8d]}.
     */
    private List<Card> streetCards(String handId, Section section) {
        String boardText = section.boardText();
        Matcher matcher = BRACKET_PATTERN.matcher(boardText == null ? "" : boardText);
        String last = null;
        while (matcher.find()) {
            last = matcher.group(1);
        }
        if (last == null) {
            throw new MalformedHandException(handId, "Missing street cards", boardText);
        }
        try {
            return requireDistinct(Card.listOf(last));
        } catch (InvalidCardException | InvalidComboException ex) {
            throw new MalformedHandException(handId, boardText, ex);
        }
    }

    private static List<Card> requireDistinct(List<Card> cards) {
        if (new HashSet<>(cards).size() != cards.size()) {
            throw new InvalidComboException(
                    cards.stream().map(String::valueOf).collect(Collectors.joining(" ")), "duplicate card");
        }
        return cards;
    }

    private List<PlayerAction> parseActions(String handId, Section section, ParseDiagnostics diagnostics,
                                            Predicate<String> skip) {
        List<PlayerAction> actions = new ArrayList<>();
        for (String line : section.lines()) {
            if (skip.test(line)) {
                continue;
            }
            Optional<PlayerAction> action;
            try {
                action = classifier.classify(line);
            } catch (InvalidCardException | InvalidComboException ex) {
                throw new MalformedHandException(handId, line, ex);
            }
            if (action.isPresent()) {
                actions.add(action.get());
            } else {
                diagnostics.unrecognizedLine(handId, section.marker().getLabel(), line);
            }
        }
        return List.copyOf(actions);
    }

    private Matcher findPot(Section summary) {
        for (String line : summary.lines()) {
            Matcher matcher = POT_PATTERN.matcher(line);
            if (matcher.matches()) {
                return matcher;
            }
        }
        return null;
    }

    private List<Card> parseBoard(String handId, Section summary) {
        for (String line : summary.lines()) {
            Matcher matcher = BOARD_PATTERN.matcher(line);
            if (!matcher.find()) {
                continue;
            }
            try {
                return List.copyOf(requireDistinct(Card.listOf(matcher.group("cards"))));
            } catch (InvalidCardException | InvalidComboException ex) {
                throw new MalformedHandException(handId, line, ex);
            }
        }
        return null;
    }

    /**
     * Without a showdown the winners are the players who collected a pot; with one, only the
     * players the summary lists as having shown and won.
     */
    private Set<String> parseWinners(Section summary, boolean showDown) {
        Set<String> winners = new LinkedHashSet<>();
        for (String line : summary.lines()) {
            if (showDown) {
                if (line.contains("won")) {
                    addMatch(winners, SHOWDOWN_WINNER_PATTERN, line);
                }
            } else if (line.contains("collected")) {
                if (!addMatch(winners, SUMMARY_WINNER_PATTERN, line)) {
                    addMatch(winners, ACTION_WINNER_PATTERN, line);
                }
            }
        }
        return Collections.unmodifiableSet(winners);
    }

    private static boolean addMatch(Set<String> winners, Pattern pattern, String line) {
        Matcher matcher = pattern.matcher(line);
        if (!matcher.find()) {
            return false;
        }
        winners.add(matcher.group("name"));
        return true;
    }
}
