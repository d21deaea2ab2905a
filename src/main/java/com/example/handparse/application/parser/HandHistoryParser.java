package com.example.handparse.application.parser;

import org.springframework.stereotype.Component;

/**
 * Entry point of the parser: wraps raw hand text in a {@link HandHistory} wired with the shared,
 * stateless grammar components.
 */
@Component
public class HandHistoryParser {

    private final HeaderGrammar headerGrammar;
    private final SectionSplitter splitter;
    private final HandAssembler assembler;

    public HandHistoryParser(HeaderGrammar headerGrammar, SectionSplitter splitter, HandAssembler assembler) {
        this.headerGrammar = headerGrammar;
        this.splitter = splitter;
        this.assembler = assembler;
    }

    /**
     * Opens an unparsed hand history.
     *
     * @param rawText complete text of one hand
     * @return hand history in {@link com.example.handparse.domain.model.ParseState#UNPARSED}
     */
    public HandHistory open(String rawText) {
        return new HandHistory(rawText, headerGrammar, splitter, assembler);
    }
}
