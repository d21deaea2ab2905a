package com.example.handparse.application.parser;

import com.example.handparse.domain.exception.HandNotParsedException;
import com.example.handparse.domain.exception.HandTextRequiredException;
import com.example.handparse.domain.exception.HeaderFormatException;
import com.example.handparse.domain.model.Hand;
import com.example.handparse.domain.model.HandHeader;
import com.example.handparse.domain.model.ParseState;

/**
 * The text of one hand plus what has been parsed from it so far.
 * <p>
 * Parsing happens in two phases. {@link #parseHeader()} reads only the first line, which is all a
 * filtering caller needs; {@link #parse(ParseDiagnostics)} runs the header phase first when it has
 * not run yet and then assembles the body. Both phases are idempotent: calling them again returns
 * the cached result. Not thread-safe; create one instance per parse.
 */
public class HandHistory {

    private final String rawText;
    private final HeaderGrammar headerGrammar;
    private final SectionSplitter splitter;
    private final HandAssembler assembler;

    private ParseState state = ParseState.UNPARSED;
    private HandSections sections;
    private HandHeader header;
    private Hand hand;

    /**
     * Wraps the raw text of a single hand.
     *
     * @param rawText       hand text, must not be blank
     * @param headerGrammar header parser
     * @param splitter      section splitter
     * @param assembler     body assembler
     * @throws HandTextRequiredException when the text is null or blank
     */
    public HandHistory(String rawText, HeaderGrammar headerGrammar, SectionSplitter splitter, HandAssembler assembler) {
        if (rawText == null || rawText.isBlank()) {
            throw new HandTextRequiredException();
        }
        this.rawText = rawText;
        this.headerGrammar = headerGrammar;
        this.splitter = splitter;
        this.assembler = assembler;
    }

    public ParseState state() {
        return state;
    }

    public String rawText() {
        return rawText;
    }

    /**
     * Parses the header line only.
     *
     * @return the header
     * @throws HeaderFormatException when the first line is not a known header
     */
    public HandHeader parseHeader() {
        if (state.reached(ParseState.HEADER_PARSED)) {
            return header;
        }
        sections = splitter.split(rawText);
        header = headerGrammar.parse(sections.headerLine());
        state = ParseState.HEADER_PARSED;
        return header;
    }

    /**
     * Parses the whole hand, reporting skipped lines to {@code diagnostics}.
     *
     * @param diagnostics sink for unrecognized lines
     * @return the hand
     */
    public Hand parse(ParseDiagnostics diagnostics) {
        if (state == ParseState.FULLY_PARSED) {
            return hand;
        }
        parseHeader();
        hand = assembler.assemble(header, sections, diagnostics == null ? ParseDiagnostics.NONE : diagnostics);
        sections = null;
        state = ParseState.FULLY_PARSED;
        return hand;
    }

    /**
     * Parses the whole hand, dropping unrecognized lines silently.
     *
     * @return the hand
     */
    public Hand parse() {
        return parse(ParseDiagnostics.NONE);
    }

    /**
     * @return the parsed header
     * @throws HandNotParsedException before {@link #parseHeader()} has run
     */
    public HandHeader header() {
        require(ParseState.HEADER_PARSED);
        return header;
    }

    /**
     * @return the parsed hand
     * @throws HandNotParsedException before {@link #parse()} has run
     */
    public Hand hand() {
        require(ParseState.FULLY_PARSED);
        return hand;
    }

    private void require(ParseState required) {
        if (!state.reached(required)) {
            throw new HandNotParsedException(state, required);
        }
    }

    @Override
    public String toString() {
        if (header == null) {
            return "HandHistory (unparsed)";
        }
        return "HandHistory #" + header.handId();
    }
}
