package com.example.handparse.domain.model;

import java.util.List;

/**
 * Outcome of parsing several hands from one text: every hand either parsed or failed.
 */
public record BatchParseResult(int handsFound, List<HandParseResult> hands, List<HandFailure> failures) {
}
