package com.example.handparse.domain.exception;

/**
 * Raised when the first line of a hand does not match any known header sub-grammar.
 * The hand cannot be parsed any further; no partial header is ever produced.
 */
public class HeaderFormatException extends DomainException {

    private final String headerLine;

	/**
	 * Creates the exception for a header line that matched no grammar branch.
	 *
	 * @param headerLine offending header line, may be {@code null} for empty input
	 */
    public HeaderFormatException(String headerLine) {
        this("Unrecognized hand history header", headerLine);
    }

	/**
	 * Creates the exception with a specific reason.
	 *
	 * @param reason     short description of the failed rule
	 * @param headerLine offending header line
	 */
    public HeaderFormatException(String reason, String headerLine) {
        super(reason + ": " + headerLine);
        this.headerLine = headerLine;
    }

    public String getHeaderLine() {
        return headerLine;
    }
}
