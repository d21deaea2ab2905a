package com.example.handparse.domain.model;

/**
 * A body line the parser skipped because no action rule recognised it.
 *
 * @param handId  hand being parsed
 * @param section section the line came from, e.g. {@code "HOLE CARDS"} or {@code "FLOP"}
 * @param line    the skipped line
 */
public record ParseWarning(String handId, String section, String line) {
}
