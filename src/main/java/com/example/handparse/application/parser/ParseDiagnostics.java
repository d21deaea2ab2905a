package com.example.handparse.application.parser;

/**
 * Sink for non-fatal parse events. A fresh sink is passed into every parse call so that
 * parallel parses never share state.
 */
public interface ParseDiagnostics {

    /**
     * Ignores every event.
     */
    ParseDiagnostics NONE = (handId, section, line) -> { };

    /**
     * Reports a body line that matched no action rule and was dropped.
     *
     * @param handId  hand being parsed
     * @param section section the line belongs to
     * @param line    the dropped line
     */
    void unrecognizedLine(String handId, String section, String line);
}
