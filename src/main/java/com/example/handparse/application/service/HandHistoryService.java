package com.example.handparse.application.service;

import com.example.handparse.application.exception.BatchLimitExceededException;
import com.example.handparse.application.exception.UseCaseValidationException;
import com.example.handparse.application.parser.CollectingParseDiagnostics;
import com.example.handparse.application.parser.HandHistory;
import com.example.handparse.application.parser.HandHistoryParser;
import com.example.handparse.application.parser.HeaderGrammar;
import com.example.handparse.application.parser.ParseDiagnostics;
import com.example.handparse.config.HandParseProperties;
import com.example.handparse.domain.exception.DomainException;
import com.example.handparse.domain.exception.HandTextRequiredException;
import com.example.handparse.domain.exception.HeaderFormatException;
import com.example.handparse.domain.exception.InvalidCardException;
import com.example.handparse.domain.exception.InvalidComboException;
import com.example.handparse.domain.exception.MalformedHandException;
import com.example.handparse.domain.model.BatchParseResult;
import com.example.handparse.domain.model.Hand;
import com.example.handparse.domain.model.HandFailure;
import com.example.handparse.domain.model.HandHeader;
import com.example.handparse.domain.model.HandParseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Application-layer service that runs hand history parsing use cases.
 * It validates inputs, delegates to the parser, collects skipped lines and, for batches, turns
 * per-hand failures into {@link HandFailure} entries instead of aborting the whole request.
 */
@Service
public class HandHistoryService {

    private static final Logger log = LoggerFactory.getLogger(HandHistoryService.class);

    static final String HEADER_FORMAT_ERROR = "HEADER_FORMAT_ERROR";
    static final String MALFORMED_HAND = "MALFORMED_HAND";
    static final String INVALID_CARDS = "INVALID_CARDS";
    static final String DOMAIN_ERROR = "DOMAIN_ERROR";

    private final HandHistoryParser parser;
    private final HandTextSplitter splitter;
    private final ParseDiagnostics logDiagnostics;
    private final HandParseProperties properties;

    /**
     * Creates the service.
     *
     * @param parser         factory for hand histories
     * @param splitter       splits multi-hand texts into single hands
     * @param logDiagnostics sink every skipped line is forwarded to, in addition to the response
     * @param properties     parser configuration
     */
    public HandHistoryService(HandHistoryParser parser, HandTextSplitter splitter,
                              ParseDiagnostics logDiagnostics, HandParseProperties properties) {
        this.parser = parser;
        this.splitter = splitter;
        this.logDiagnostics = logDiagnostics;
        this.properties = properties;
    }

    /**
     * Fully parses a single hand.
     *
     * @param text text of one hand
     * @return the hand and the lines that were skipped
     * @throws HandTextRequiredException when the text is blank
     * @throws DomainException           when the header or body cannot be parsed
     */
    public HandParseResult parse(String text) {
        requireText(text);
        return parseOne(parser.open(text));
    }

    /**
     * Parses only the header of a single hand.
     *
     * @param text text of one hand; only the first line is read
     * @return the header
     * @throws HandTextRequiredException when the text is blank
     * @throws HeaderFormatException     when the first line is not a known header
     */
    public HandHeader parseHeader(String text) {
        requireText(text);
        return parser.open(text).parseHeader();
    }

    /**
     * Parses every hand of a history file. A hand that fails is reported and skipped.
     *
     * @param text history file contents
     * @return parsed hands and failures, in file order
     * @throws HandTextRequiredException   when the text is blank
     * @throws UseCaseValidationException  when no hand header occurs in the text
     * @throws BatchLimitExceededException when there are more hands than allowed
     */
    public BatchParseResult parseBatch(String text) {
        requireText(text);
        List<String> handTexts = splitter.split(text);
        if (handTexts.isEmpty()) {
            throw new UseCaseValidationException("No PokerStars hand history was found in the submitted text.");
        }
        if (handTexts.size() > properties.getMaxHandsPerBatch()) {
            throw new BatchLimitExceededException(handTexts.size(), properties.getMaxHandsPerBatch());
        }

        List<HandParseResult> parsed = new ArrayList<>();
        List<HandFailure> failures = new ArrayList<>();
        for (int position = 0; position < handTexts.size(); position++) {
            String handText = handTexts.get(position);
            try {
                parsed.add(parseOne(parser.open(handText)));
            } catch (DomainException ex) {
                HandFailure failure = toFailure(position, handText, ex);
                log.warn("Skipping hand {} (#{}) of batch: {}", position, failure.handId(), ex.getMessage());
                failures.add(failure);
            }
        }
        log.info("Parsed batch of {} hands: {} parsed, {} failed", handTexts.size(), parsed.size(), failures.size());
        return new BatchParseResult(handTexts.size(), List.copyOf(parsed), List.copyOf(failures));
    }

    private HandParseResult parseOne(HandHistory history) {
        CollectingParseDiagnostics diagnostics = new CollectingParseDiagnostics(logDiagnostics);
        Hand hand = history.parse(diagnostics);
        log.debug("Parsed {} with {} skipped line(s)", history, diagnostics.getWarnings().size());
        return new HandParseResult(hand, diagnostics.getWarnings());
    }

    private static void requireText(String text) {
        if (text == null || text.isBlank()) {
            throw new HandTextRequiredException();
        }
    }

    private static HandFailure toFailure(int position, String handText, DomainException ex) {
        String firstLine = handText.lines().findFirst().orElse("");
        String handId = HeaderGrammar.peekHandId(firstLine);
        if (ex instanceof HeaderFormatException header) {
            return new HandFailure(position, handId, HEADER_FORMAT_ERROR, ex.getMessage(), header.getHeaderLine());
        }
        if (ex instanceof MalformedHandException malformed) {
            return new HandFailure(position, handId, MALFORMED_HAND, ex.getMessage(), malformed.getOffendingLine());
        }
        if (ex instanceof InvalidCardException || ex instanceof InvalidComboException) {
            return new HandFailure(position, handId, INVALID_CARDS, ex.getMessage(), null);
        }
        return new HandFailure(position, handId, DOMAIN_ERROR, ex.getMessage(), null);
    }
}
