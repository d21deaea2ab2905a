package com.example.handparse.domain.exception;

/**
 * Raised when the body of a hand is structurally broken after the header parsed fine,
 * for example when the table line is missing or a card set on a street cannot be read.
 * Carries the hand id and the offending line so batch callers can log and skip the hand.
 */
public class MalformedHandException extends DomainException {

    private final String handId;
    private final String offendingLine;

	/**
	 * Creates the exception for a structural problem.
	 *
	 * @param handId        id of the hand being parsed
	 * @param message       what was expected
	 * @param offendingLine line that failed, may be {@code null} when the line is missing entirely
	 */
    public MalformedHandException(String handId, String message, String offendingLine) {
        super(describe(handId, message, offendingLine));
        this.handId = handId;
        this.offendingLine = offendingLine;
    }

	/**
	 * Creates the exception wrapping a card or combo failure.
	 *
	 * @param handId        id of the hand being parsed
	 * @param offendingLine line holding the bad cards
	 * @param cause         underlying domain failure
	 */
    public MalformedHandException(String handId, String offendingLine, DomainException cause) {
        super(describe(handId, cause.getMessage(), offendingLine), cause);
        this.handId = handId;
        this.offendingLine = offendingLine;
    }

    public String getHandId() {
        return handId;
    }

    public String getOffendingLine() {
        return offendingLine;
    }

    private static String describe(String handId, String message, String offendingLine) {
        String text = "Hand #" + handId + ": " + message;
        return offendingLine == null ? text : text + " (" + offendingLine + ")";
    }
}
