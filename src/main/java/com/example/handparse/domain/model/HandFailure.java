package com.example.handparse.domain.model;

/**
 * A hand of a batch that could not be parsed.
 *
 * @param position      zero-based position of the hand in the batch
 * @param handId        hand id when the header got far enough to expose it
 * @param error         stable error code
 * @param message       human readable reason
 * @param offendingText line that caused the failure, when known
 */
public record HandFailure(int position, String handId, String error, String message, String offendingText) {
}
