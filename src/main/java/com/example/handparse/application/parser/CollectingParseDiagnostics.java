package com.example.handparse.application.parser;

import com.example.handparse.domain.model.ParseWarning;

import java.util.ArrayList;
import java.util.List;

/**
 * Diagnostics sink that keeps every event as a {@link ParseWarning} and optionally
 * forwards it to another sink. Meant for a single parse; not thread-safe.
 */
public class CollectingParseDiagnostics implements ParseDiagnostics {

    private final List<ParseWarning> warnings = new ArrayList<>();
    private final ParseDiagnostics delegate;

    public CollectingParseDiagnostics() {
        this(ParseDiagnostics.NONE);
    }

    public CollectingParseDiagnostics(ParseDiagnostics delegate) {
        this.delegate = delegate == null ? ParseDiagnostics.NONE : delegate;
    }

    @Override
    public void unrecognizedLine(String handId, String section, String line) {
        warnings.add(new ParseWarning(handId, section, line));
        delegate.unrecognizedLine(handId, section, line);
    }

    public List<ParseWarning> getWarnings() {
        return List.copyOf(warnings);
    }
}
