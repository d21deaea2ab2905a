package com.example.handparse.application.parser;

import com.example.handparse.config.HandParseProperties;
import com.example.handparse.domain.exception.HeaderFormatException;
import com.example.handparse.domain.model.Currency;
import com.example.handparse.domain.model.GameType;
import com.example.handparse.domain.model.GameVariant;
import com.example.handparse.domain.model.HandHeader;
import com.example.handparse.domain.model.LimitType;
import com.example.handparse.domain.model.MoneyType;
import com.example.handparse.domain.model.TournamentInfo;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the first line of a PokerStars hand history into a {@link HandHeader}.
 * <p>
 * One composite pattern covers cash and tournament hands, real money, play money, StarsCoin and
 * freerolls. The optional groups are then resolved into exactly one {@link GameBranch}; a line that
 * satisfies both the tournament and the cash branch is rejected instead of silently picking one.
 * Plain {@code 10/20} blinds look the same for tournaments and play-money cash tables, so the game
 * type comes from the tournament id alone, never from the blind notation.
 */
@Component
public class HeaderGrammar {

    private static final String DECIMAL = "\\d+(?:\\.\\d+)?";
    private static final String MONEY_SYMBOL = "[$€£]";
    private static final Pattern HEADER_PATTERN = Pattern.compile(
            "^PokerStars\\s+(?:Zoom\\s+)?Hand\\s+#(?<ident>\\d+):\\s+"
                    + "(?:Tournament\\s+#(?<tournamentIdent>\\d+),\\s+"
                    + "(?:(?<freeroll>Freeroll)|" + MONEY_SYMBOL + "?(?<buyin>" + DECIMAL + ")"
                    + "(?:\\+" + MONEY_SYMBOL + "?(?<rake>" + DECIMAL + "))?"
                    + "(?:\\s+(?<currency>[A-Z]+))?)\\s+)?"
                    + "(?<game>.+?)\\s+(?<limit>(?:Pot\\s+|No\\s+)?Limit)\\s+"
                    + "(?:-\\s+Level\\s+(?<tournamentLevel>\\S+)\\s+)?"
                    + "\\((?:(?<sb>" + DECIMAL + ")/(?<bb>" + DECIMAL + ")"
                    + "|" + MONEY_SYMBOL + "(?<cashSb>" + DECIMAL + ")/" + MONEY_SYMBOL + "(?<cashBb>" + DECIMAL + ")"
                    + "(?:\\s+(?<cashCurrency>[A-Z]+))?)\\)\\s+"
                    + "-\\s+(?<stamps>.+)$");
    private static final Pattern BRACKETED_STAMP_PATTERN = Pattern.compile("\\[(?<stamp>[^\\]]+)\\]");
    private static final Pattern STAMP_PATTERN =
            Pattern.compile("(?<date>\\d{4}/\\d{1,2}/\\d{1,2})\\s+(?<time>\\d{1,2}:\\d{2}:\\d{2})");
    private static final Pattern HAND_ID_PATTERN = Pattern.compile("Hand\\s+#(\\d+)");
    private static final DateTimeFormatter STAMP_FORMATTER = DateTimeFormatter.ofPattern("yyyy/M/d H:mm:ss");
    private static final String CANONICAL_ZONE_LABEL = "ET";
    private static final Currency FREEROLL_CURRENCY = Currency.USD;

    private final ZoneId referenceZone;

    /**
     * Creates the grammar with the reference zone from configuration.
     *
     * @param properties parser configuration
     */
    @Autowired
    public HeaderGrammar(HandParseProperties properties) {
        this(properties.referenceZoneId());
    }

    /**
     * Creates the grammar with an explicit reference zone.
     *
     * @param referenceZone zone in which the bracketed canonical timestamp is read
     */
    public HeaderGrammar(ZoneId referenceZone) {
        this.referenceZone = Objects.requireNonNull(referenceZone, "referenceZone");
    }

    /**
     * Parses a header line.
     *
     * @param headerLine first line of the hand
     * @return typed header
     * @throws HeaderFormatException when the line matches no branch, matches two exclusive
     *                               branches, or names an unknown game, limit or currency
     */
    public HandHeader parse(String headerLine) {
        if (headerLine == null || headerLine.isBlank()) {
            throw new HeaderFormatException("Missing hand history header", headerLine);
        }
        String line = headerLine.strip();
        Matcher matcher = HEADER_PATTERN.matcher(line);
        if (!matcher.matches()) {
            throw new HeaderFormatException(line);
        }

        GameBranch branch = resolveBranch(matcher, line);
        BigDecimal smallBlind = new BigDecimal(firstNonNull(matcher.group("sb"), matcher.group("cashSb")));
        BigDecimal bigBlind = new BigDecimal(firstNonNull(matcher.group("bb"), matcher.group("cashBb")));

        GameVariant game = GameVariant.fromLabel(matcher.group("game"));
        if (game == null) {
            throw new HeaderFormatException("Unsupported game '" + matcher.group("game") + "'", line);
        }
        LimitType limit = LimitType.fromLabel(matcher.group("limit"));
        if (limit == null) {
            throw new HeaderFormatException("Unsupported limit '" + matcher.group("limit") + "'", line);
        }
        ZonedDateTime date = parseDate(matcher.group("stamps"), line);

        if (branch instanceof TournamentBranch tournament) {
            Currency currency = resolveCurrency(tournament.currencyCode(), line);
            if (currency == null && tournament.freeroll()) {
                currency = FREEROLL_CURRENCY;
            }
            TournamentInfo info = new TournamentInfo(
                    tournament.tournamentId(),
                    tournament.level(),
                    tournament.buyIn(),
                    tournament.rake(),
                    tournament.freeroll()
            );
            return new HandHeader(matcher.group("ident"), GameType.TOURNAMENT, info, currency,
                    MoneyType.of(currency), smallBlind, bigBlind, limit, game, date);
        }
        CashBranch cash = (CashBranch) branch;
        Currency currency = resolveCurrency(cash.currencyCode(), line);
        return new HandHeader(matcher.group("ident"), GameType.CASH, null, currency,
                MoneyType.of(currency), smallBlind, bigBlind, limit, game, date);
    }

    /**
     * Best-effort hand id lookup for lines that may not parse, used to label failures.
     *
     * @param headerLine any line
     * @return the number after {@code Hand #}, or {@code null}
     */
    public static String peekHandId(String headerLine) {
        if (headerLine == null) {
            return null;
        }
        Matcher matcher = HAND_ID_PATTERN.matcher(headerLine);
        return matcher.find() ? matcher.group(1) : null;
    }

    /**
     * Turns the optional groups into exactly one branch.
     *
     * @param matcher successful header match
     * @param line    header line for error reporting
     * @return the tournament or the cash branch
     */
    private GameBranch resolveBranch(Matcher matcher, String line) {
        boolean tournament = matcher.group("tournamentIdent") != null;
        boolean plainBlinds = matcher.group("sb") != null;
        boolean currencyBlinds = matcher.group("cashSb") != null;
        if (plainBlinds == currencyBlinds) {
            throw new HeaderFormatException("Blinds must match exactly one notation", line);
        }
        if (tournament && currencyBlinds) {
            throw new HeaderFormatException("Tournament header carries cash-game blinds", line);
        }
        if (!tournament) {
            return new CashBranch(matcher.group("cashCurrency"));
        }
        boolean freeroll = matcher.group("freeroll") != null;
        return new TournamentBranch(
                matcher.group("tournamentIdent"),
                matcher.group("tournamentLevel"),
                freeroll,
                decimalOrZero(matcher.group("buyin")),
                decimalOrZero(matcher.group("rake")),
                matcher.group("currency")
        );
    }

    private Currency resolveCurrency(String code, String line) {
        if (code == null) {
            return null;
        }
        Currency currency = Currency.fromCode(code);
        if (currency == null) {
            throw new HeaderFormatException("Unsupported currency '" + code + "'", line);
        }
        return currency;
    }

    /**
     * Reads the canonical timestamp. The bracketed stamp wins over the localized one in front of
     * it; headers without brackets are accepted only when their single stamp is already canonical.
     */
    private ZonedDateTime parseDate(String stamps, String line) {
        String canonical = null;
        Matcher bracketed = BRACKETED_STAMP_PATTERN.matcher(stamps);
        if (bracketed.find()) {
            canonical = bracketed.group("stamp");
        } else if (stamps.strip().endsWith(" " + CANONICAL_ZONE_LABEL)) {
            canonical = stamps;
        }
        if (canonical == null) {
            throw new HeaderFormatException("Missing canonical timestamp", line);
        }
        Matcher matcher = STAMP_PATTERN.matcher(canonical.strip());
        if (!matcher.find()) {
            throw new HeaderFormatException("Unreadable timestamp '" + canonical + "'", line);
        }
        try {
            LocalDateTime local = LocalDateTime.parse(matcher.group("date") + " " + matcher.group("time"), STAMP_FORMATTER);
            return local.atZone(referenceZone);
        } catch (DateTimeParseException ex) {
            throw new HeaderFormatException("Unreadable timestamp '" + canonical + "'", line);
        }
    }

    private static BigDecimal decimalOrZero(String value) {
        return value == null ? BigDecimal.ZERO : new BigDecimal(value);
    }

    private static String firstNonNull(String first, String second) {
        return first != null ? first : second;
    }

    /**
     * Mutually exclusive interpretations of a header line.
     */
    interface GameBranch {
    }

    record TournamentBranch(String tournamentId, String level, boolean freeroll,
                            BigDecimal buyIn, BigDecimal rake, String currencyCode) implements GameBranch {
    }

    record CashBranch(String currencyCode) implements GameBranch {
    }
}
