package com.example.handparse.domain.model;

import java.util.List;

/**
 * Domain DTO returned by the hand history service: the parsed hand plus the lines it skipped.
 */
public record HandParseResult(Hand hand, List<ParseWarning> warnings) {
}
