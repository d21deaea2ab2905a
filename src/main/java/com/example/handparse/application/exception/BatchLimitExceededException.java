package com.example.handparse.application.exception;

/**
 * Thrown when a batch request contains more hands than the configured limit.
 */
public class BatchLimitExceededException extends UseCaseValidationException {

    private final int handsFound;
    private final int limit;

	/**
	 * Creates the exception with the counted hands and the configured limit.
	 *
	 * @param handsFound hands detected in the submitted text
	 * @param limit      value of {@code handparse.max-hands-per-batch}
	 */
    public BatchLimitExceededException(int handsFound, int limit) {
        super("The batch contains " + handsFound + " hands but at most " + limit + " are accepted.");
        this.handsFound = handsFound;
        this.limit = limit;
    }

    public int getHandsFound() {
        return handsFound;
    }

    public int getLimit() {
        return limit;
    }
}
