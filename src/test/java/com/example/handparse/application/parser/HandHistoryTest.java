package com.example.handparse.application.parser;

import com.example.handparse.HandFixtures;
import com.example.handparse.domain.exception.HandNotParsedException;
import com.example.handparse.domain.exception.HandTextRequiredException;
import com.example.handparse.domain.exception.HeaderFormatException;
import com.example.handparse.domain.exception.InvalidComboException;
import com.example.handparse.domain.exception.MalformedHandException;
import com.example.handparse.domain.model.ActionKind;
import com.example.handparse.domain.model.Card;
import com.example.handparse.domain.model.Combo;
import com.example.handparse.domain.model.FlopTexture;
import com.example.handparse.domain.model.Hand;
import com.example.handparse.domain.model.HandHeader;
import com.example.handparse.domain.model.ParseState;
import com.example.handparse.domain.model.PlayerAction;
import com.example.handparse.domain.model.Seat;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Parses complete hand histories from the fixtures and checks the assembled hands.
 */
class HandHistoryTest {

    private static final String MINIMAL_PREAMBLE =
            "PokerStars Hand #1: Hold'em No Limit ($0.01/$0.02 USD) - 2013/11/14 20:03:10 ET\n"
                    + "Table 'T' 2-max Seat #1 is the button\n"
                    + "Seat 1: X ($2 in chips)\n"
                    + "Seat 2: Y ($2 in chips)\n";

    private final HandHistoryParser parser = HandFixtures.parser();

    private Hand parse(String fixture) {
        return parser.open(HandFixtures.load(fixture)).parse();
    }

    private static PlayerAction action(String name, ActionKind kind, String amount) {
        return PlayerAction.of(name, kind, amount == null ? null : new BigDecimal(amount));
    }

    @Test
    void flopOnlyHand() {
        Hand hand = parse(HandFixtures.FLOP_ONLY);

        assertThat(hand.handId()).isEqualTo("105024000105");
        assertThat(hand.tableName()).isEqualTo("797469411 15");
        assertThat(hand.maxPlayers()).isEqualTo(9);
        assertThat(hand.button().name()).isEqualTo("flettl2");
        assertThat(hand.button().stack()).isEqualByComparingTo("1500");
        assertThat(hand.hero().name()).isEqualTo("W2lkm2n");
        assertThat(hand.hero().seatNumber()).isEqualTo(5);
        assertThat(hand.hero().holeCards()).isEqualTo(Combo.of("AcJh"));
        assertThat(hand.players()).extracting(Seat::name).containsExactly("flettl2", "santy312", "flavio766",
                "strongi82", "W2lkm2n", "MISTRPerfect", "blak_douglas", "sinus91", "STBIJUJA");
        assertThat(hand.players().get(4).holeCards()).isEqualTo(Combo.of("AcJh"));
        assertThat(hand.preflopActions()).containsExactly(
                action("strongi82", ActionKind.FOLD, null),
                action("W2lkm2n", ActionKind.RAISE, "40"),
                action("MISTRPerfect", ActionKind.CALL, "60"),
                action("blak_douglas", ActionKind.FOLD, null),
                action("sinus91", ActionKind.FOLD, null),
                action("STBIJUJA", ActionKind.FOLD, null),
                action("flettl2", ActionKind.FOLD, null),
                action("santy312", ActionKind.FOLD, null),
                action("flavio766", ActionKind.FOLD, null));
        assertThat(hand.flop().cards()).containsExactly(Card.of("2s"), Card.of("6d"), Card.of("6h"));
        assertThat(hand.flopActions()).containsExactly(
                action("W2lkm2n", ActionKind.BET, "80"),
                action("MISTRPerfect", ActionKind.FOLD, null),
                action("W2lkm2n", ActionKind.RETURN, "80"),
                action("W2lkm2n", ActionKind.WIN, "150"),
                action("W2lkm2n", ActionKind.MUCK, null));
        assertThat(hand.flop().players()).containsExactly("W2lkm2n", "MISTRPerfect");
        assertThat(hand.turn()).isNull();
        assertThat(hand.river()).isNull();
        assertThat(hand.turnActions()).isNull();
        assertThat(hand.board()).containsExactly(Card.of("2s"), Card.of("6d"), Card.of("6h"));
        assertThat(hand.totalPot()).isEqualByComparingTo("150");
        assertThat(hand.rake()).isEqualByComparingTo("0");
        assertThat(hand.showDown()).isFalse();
        assertThat(hand.showDownActions()).isNull();
        assertThat(hand.winners()).containsExactly("W2lkm2n");
    }

    @Test
    void flopTextureOfParsedHand() {
        FlopTexture texture = parse(HandFixtures.FLOP_ONLY).flop().texture();

        assertThat(texture.rainbow()).isTrue();
        assertThat(texture.pair()).isTrue();
        assertThat(texture.straightDraw()).isFalse();
        assertThat(texture.gutshot()).isTrue();
        assertThat(texture.flushDraw()).isFalse();
    }

    /**
     * With a showdown only the players shown as winners in the summary count, not every collector.
     */
    @Test
    void allInPreflopShowdown() {
        Hand hand = parse(HandFixtures.ALLIN_PREFLOP);

        assertThat(hand.header().tournament().level()).isEqualTo("XI");
        assertThat(hand.header().smallBlind()).isEqualByComparingTo("400");
        assertThat(hand.button()).isEqualTo(hand.hero());
        assertThat(hand.button().holeCards()).isEqualTo(Combo.of("JdJs"));
        assertThat(hand.players()).extracting(Seat::name).contains("Lean Abadia");
        assertThat(hand.preflopActions()).hasSize(10);
        assertThat(hand.preflopActions().get(1).allIn()).isTrue();
        assertThat(hand.preflopActions().get(9)).isEqualTo(action("costamar", ActionKind.RETURN, "1255"));
        assertThat(hand.flop().cards()).containsExactly(Card.of("3c"), Card.of("6s"), Card.of("9d"));
        assertThat(hand.flopActions()).isEmpty();
        assertThat(hand.flop().texture().straightDraw()).isTrue();
        assertThat(hand.turnCard()).isEqualTo(Card.of("8d"));
        assertThat(hand.riverCard()).isEqualTo(Card.of("Ks"));
        assertThat(hand.board()).hasSize(5);
        assertThat(hand.showDown()).isTrue();
        assertThat(hand.showDownActions()).extracting(PlayerAction::kind)
                .containsExactly(ActionKind.SHOW, ActionKind.SHOW, ActionKind.SHOW, ActionKind.WIN, ActionKind.WIN);
        assertThat(hand.totalPot()).isEqualByComparingTo("26310");
        assertThat(hand.winners()).containsExactly("costamar");
    }

    @Test
    void emptySeatAndNoFlop() {
        Hand hand = parse(HandFixtures.NO_FLOP);

        Seat empty = hand.players().get(0);
        assertThat(empty.occupied()).isFalse();
        assertThat(empty.name()).isEqualTo("Empty Seat 1");
        assertThat(empty.stack()).isEqualByComparingTo("0");
        assertThat(hand.players()).hasSize(9);
        assertThat(hand.button()).isEqualTo(hand.hero());
        assertThat(hand.hero().holeCards()).isEqualTo(Combo.of("6d8d"));
        assertThat(hand.flop()).isNull();
        assertThat(hand.flopActions()).isNull();
        assertThat(hand.turn()).isNull();
        assertThat(hand.river()).isNull();
        assertThat(hand.board()).isNull();
        assertThat(hand.preflopActions()).endsWith(
                action("Theralion", ActionKind.RETURN, "600"),
                action("Theralion", ActionKind.WIN, "1900"),
                action("Theralion", ActionKind.MUCK, null));
        assertThat(hand.totalPot()).isEqualByComparingTo("1900");
        assertThat(hand.winners()).containsExactly("Theralion");
    }

    @Test
    void everyStreet() {
        Hand hand = parse(HandFixtures.EVERY_STREET);

        assertThat(hand.header().tournament().level()).isEqualTo("IV");
        assertThat(hand.button().name()).isEqualTo("W2lkm2n");
        assertThat(hand.button().holeCards()).isEqualTo(Combo.of("Jc5c"));
        assertThat(hand.flopActions()).containsExactly(
                action("blak_douglas", ActionKind.CHECK, null),
                action("flettl2", ActionKind.BET, "150"),
                action("blak_douglas", ActionKind.CALL, "150"));
        assertThat(hand.flop().players()).containsExactly("blak_douglas", "flettl2");
        assertThat(hand.flop().texture().flushDraw()).isTrue();
        assertThat(hand.flop().texture().rainbow()).isFalse();
        assertThat(hand.turnCard()).isEqualTo(Card.of("8c"));
        assertThat(hand.turnActions()).containsExactly(
                action("blak_douglas", ActionKind.CHECK, null),
                action("flettl2", ActionKind.BET, "250"),
                action("blak_douglas", ActionKind.CALL, "250"));
        assertThat(hand.riverCard()).isEqualTo(Card.of("Kd"));
        assertThat(hand.riverActions()).containsExactly(
                action("blak_douglas", ActionKind.CHECK, null),
                action("flettl2", ActionKind.BET, "1300"),
                action("blak_douglas", ActionKind.FOLD, null),
                action("flettl2", ActionKind.RETURN, "1300"),
                action("flettl2", ActionKind.WIN, "1300"),
                action("flettl2", ActionKind.MUCK, null));
        assertThat(hand.board()).containsExactly(
                Card.of("6s"), Card.of("4d"), Card.of("3s"), Card.of("8c"), Card.of("Kd"));
        assertThat(hand.winners()).containsExactly("flettl2");
    }

    @Test
    void potLimitOmahaShowdown() {
        Hand hand = parse(HandFixtures.PLO_SHOWDOWN);

        assertThat(hand.tableName()).isEqualTo("Aaltje II");
        assertThat(hand.maxPlayers()).isEqualTo(6);
        assertThat(hand.hero().holeCards()).isEqualTo(Combo.of("9h2cTd3s"));
        assertThat(hand.players().get(1).stack()).isEqualByComparingTo("87.36");
        assertThat(hand.showDownActions()).containsExactly(
                PlayerAction.show("IKermit", Combo.of("AcKd8s8c")),
                PlayerAction.show("krissu23", Combo.of("5s7s7cAs")),
                PlayerAction.of("Maytscha1", ActionKind.MUCK),
                action("krissu23", ActionKind.WIN, "130.45"));
        assertThat(hand.totalPot()).isEqualByComparingTo("133.45");
        assertThat(hand.rake()).isEqualByComparingTo("3");
        assertThat(hand.winners()).containsExactly("krissu23");
    }

    /**
     * Unknown lines such as chat are skipped and reported; the rest of the street still parses.
     */
    @Test
    void tableEventsAndUnrecognizedLines() {
        CollectingParseDiagnostics diagnostics = new CollectingParseDiagnostics();

        Hand hand = parser.open(HandFixtures.load(HandFixtures.TABLE_EVENTS)).parse(diagnostics);

        assertThat(hand.hero()).isNull();
        assertThat(hand.players().get(0).name()).isEqualTo("flett l2");
        assertThat(hand.players().get(1).name()).isEqualTo(".prestige.U$");
        assertThat(hand.players().get(1).stack()).isEqualByComparingTo("3000");
        assertThat(hand.players().get(4).sittingOut()).isTrue();
        assertThat(hand.preflopActions()).last().isEqualTo(PlayerAction.of("GenGen", ActionKind.REMOVED));
        assertThat(hand.flopActions()).startsWith(
                PlayerAction.of("flett l2", ActionKind.LEAVE),
                PlayerAction.join("Sin Richest", 5),
                PlayerAction.of("gara za2", ActionKind.TIMED_OUT),
                PlayerAction.of("ge na", ActionKind.DISCONNECTED),
                PlayerAction.of("ge na", ActionKind.CONNECTED));
        assertThat(hand.flopActions()).hasSize(12);
        assertThat(hand.flopActions()).last().isEqualTo(action(".prestige.U$", ActionKind.WIN, "500"));
        assertThat(diagnostics.getWarnings()).hasSize(1);
        assertThat(diagnostics.getWarnings().get(0).section()).isEqualTo("FLOP");
        assertThat(diagnostics.getWarnings().get(0).line()).startsWith(".prestige.U$ said,");
        assertThat(hand.winners()).containsExactly(".prestige.U$");
    }

    @Test
    void playMoneyCashTable() {
        Hand hand = parse(HandFixtures.PLAY_MONEY_LIMIT);

        assertThat(hand.tableName()).isEqualTo("Aase II");
        assertThat(hand.header().currency()).isNull();
        assertThat(hand.hero().name()).isEqualTo("pmPlayer2");
        assertThat(hand.players().get(1).occupied()).isTrue();
        assertThat(hand.players().get(0).occupied()).isFalse();
        assertThat(hand.winners()).containsExactly("pmPlayer2");
    }

    @Test
    void fullParseIsIdempotent() {
        HandHistory history = parser.open(HandFixtures.load(HandFixtures.EVERY_STREET));

        Hand first = history.parse();
        Hand second = history.parse();

        assertThat(second).isSameAs(first);
        assertThat(parse(HandFixtures.EVERY_STREET)).isEqualTo(first);
    }

    /**
     * Header-only parsing leaves the body untouched; the body accessor refuses until a full parse.
     */
    @Test
    void phasesAreGated() {
        HandHistory history = parser.open(HandFixtures.load(HandFixtures.FLOP_ONLY));

        assertThat(history.state()).isEqualTo(ParseState.UNPARSED);
        assertThrows(HandNotParsedException.class, history::header);

        HandHeader header = history.parseHeader();

        assertThat(history.state()).isEqualTo(ParseState.HEADER_PARSED);
        assertThat(history.header()).isSameAs(header);
        assertThat(history).hasToString("HandHistory #105024000105");
        assertThrows(HandNotParsedException.class, history::hand);

        Hand hand = history.parse();

        assertThat(history.state()).isEqualTo(ParseState.FULLY_PARSED);
        assertThat(history.hand()).isSameAs(hand);
        assertThat(hand.header()).isSameAs(header);
    }

    @Test
    void fullParseRunsHeaderPhaseFirst() {
        HandHistory history = parser.open(HandFixtures.load(HandFixtures.NO_FLOP));

        history.parse();

        assertThat(history.header().handId()).isEqualTo("105026771696");
    }

    @Test
    void blankTextIsRejected() {
        assertThrows(HandTextRequiredException.class, () -> parser.open("  \n"));
        assertThrows(HandTextRequiredException.class, () -> parser.open(null));
    }

    @Test
    void badHeaderFailsBothPhases() {
        HandHistory history = parser.open("Full Tilt Poker Game #1: nope\nTable 'x' 2-max Seat #1 is the button\n");

        assertThrows(HeaderFormatException.class, history::parseHeader);
        assertThrows(HeaderFormatException.class, history::parse);
        assertThat(history.state()).isEqualTo(ParseState.UNPARSED);
    }

    @Test
    void missingTableLineIsMalformed() {
        String text = HandFixtures.load(HandFixtures.FLOP_ONLY).replace("Table '797469411 15'", "Tisch '797469411 15'");

        MalformedHandException ex = assertThrows(MalformedHandException.class, () -> parser.open(text).parse());

        assertThat(ex.getHandId()).isEqualTo("105024000105");
    }

    @Test
    void seatBeyondTableSizeIsMalformed() {
        String text = HandFixtures.load(HandFixtures.PLO_SHOWDOWN)
                .replace("Seat 6: flaykogas", "Seat 7: flaykogas");

        MalformedHandException ex = assertThrows(MalformedHandException.class, () -> parser.open(text).parse());

        assertThat(ex.getOffendingLine()).startsWith("Seat 7: flaykogas");
    }

    /**
     * Card failures in the body carry the hand id and the line that held the cards.
     */
    @Test
    void duplicateShownCardsAreMalformed() {
        String text = HandFixtures.load(HandFixtures.PLO_SHOWDOWN)
                .replace("IKermit: shows [Ac Kd 8s 8c]", "IKermit: shows [Ac Ac 8s 8c]");

        MalformedHandException ex = assertThrows(MalformedHandException.class, () -> parser.open(text).parse());

        assertThat(ex.getHandId()).isEqualTo("138364355489");
        assertThat(ex.getOffendingLine()).startsWith("IKermit: shows");
        assertThat(ex.getCause()).isInstanceOf(InvalidComboException.class);
    }

    @Test
    void duplicateFlopCardIsMalformed() {
        String text = HandFixtures.load(HandFixtures.FLOP_ONLY)
                .replace("*** FLOP *** [2s 6d 6h]", "*** FLOP *** [6h 6d 6h]");

        MalformedHandException ex = assertThrows(MalformedHandException.class, () -> parser.open(text).parse());

        assertThat(ex.getHandId()).isEqualTo("105024000105");
        assertThat(ex.getOffendingLine()).isEqualTo("[6h 6d 6h]");
        assertThat(ex.getCause()).isInstanceOf(InvalidComboException.class);
    }

    @Test
    void duplicateBoardCardIsMalformed() {
        String text = HandFixtures.load(HandFixtures.FLOP_ONLY)
                .replace("Board [2s 6d 6h]", "Board [2s 6d 2s]");

        MalformedHandException ex = assertThrows(MalformedHandException.class, () -> parser.open(text).parse());

        assertThat(ex.getOffendingLine()).isEqualTo("Board [2s 6d 2s]");
        assertThat(ex.getCause()).isInstanceOf(InvalidComboException.class);
    }

    /**
     * A single shown card is not a combo; the line is reported and the hand still parses.
     */
    @Test
    void partialShowIsSkippedAndReported() {
        String text = HandFixtures.load(HandFixtures.FLOP_ONLY)
                .replace("W2lkm2n: doesn't show hand", "W2lkm2n: shows [Ac]");
        CollectingParseDiagnostics diagnostics = new CollectingParseDiagnostics();

        Hand hand = parser.open(text).parse(diagnostics);

        assertThat(hand.flopActions()).hasSize(4);
        assertThat(hand.flopActions()).last().isEqualTo(action("W2lkm2n", ActionKind.WIN, "150"));
        assertThat(diagnostics.getWarnings()).hasSize(1);
        assertThat(diagnostics.getWarnings().get(0).section()).isEqualTo("FLOP");
        assertThat(diagnostics.getWarnings().get(0).line()).isEqualTo("W2lkm2n: shows [Ac]");
        assertThat(hand.winners()).containsExactly("W2lkm2n");
    }

    @Test
    void heroCardCountMustMatchVariant() {
        String text = HandFixtures.load(HandFixtures.PLO_SHOWDOWN)
                .replace("Dealt to W2lkm2n [9h 2c Td 3s]", "Dealt to W2lkm2n [9h 2c]");

        MalformedHandException ex = assertThrows(MalformedHandException.class, () -> parser.open(text).parse());

        assertThat(ex.getCause()).isInstanceOf(InvalidComboException.class);
    }

    @Test
    void missingSummaryLeavesPotAndWinnersEmpty() {
        String text = HandFixtures.load(HandFixtures.NO_FLOP);
        text = text.substring(0, text.indexOf("*** SUMMARY ***"));

        Hand hand = parser.open(text).parse();

        assertThat(hand.totalPot()).isNull();
        assertThat(hand.rake()).isNull();
        assertThat(hand.board()).isNull();
        assertThat(hand.winners()).isEmpty();
    }

    /**
     * Without a showdown, a winner listed only in the action form of the summary still counts.
     */
    @Test
    void actionFormCollectedLineCountsAsWinner() {
        String text = HandFixtures.load(HandFixtures.NO_FLOP)
                .replace("Seat 6: Theralion collected (1900)", "Theralion collected 1900 from pot");

        assertThat(parser.open(text).parse().winners()).containsExactly("Theralion");
    }

    @Test
    void minimalHandWithoutShowdownUsesCollectedLines() {
        String text = MINIMAL_PREAMBLE + "*** SUMMARY ***\nX collected 150 from pot\n";

        Hand hand = parser.open(text).parse();

        assertThat(hand.showDown()).isFalse();
        assertThat(hand.winners()).containsExactly("X");
    }

    @Test
    void minimalHandWithShowdownUsesWonLines() {
        String text = MINIMAL_PREAMBLE + "*** SHOW DOWN ***\nX: shows [As Ks]\nX collected 150 from pot\n\n"
                + "*** SUMMARY ***\nSeat 1: X showed [As Ks] and won (150)\nSeat 2: Y collected (0)\n";

        Hand hand = parser.open(text).parse();

        assertThat(hand.showDown()).isTrue();
        assertThat(hand.showDownActions()).first().isEqualTo(PlayerAction.show("X", Combo.of("AsKs")));
        assertThat(hand.winners()).containsExactly("X");
    }

    @Test
    void winnersAreUnmodifiable() {
        Hand hand = parse(HandFixtures.FLOP_ONLY);

        assertThrows(UnsupportedOperationException.class, () -> hand.winners().add("someone"));
        assertThrows(UnsupportedOperationException.class, () -> hand.players().add(Seat.empty(10)));
        assertThat(List.copyOf(hand.winners())).containsExactly("W2lkm2n");
    }
}
