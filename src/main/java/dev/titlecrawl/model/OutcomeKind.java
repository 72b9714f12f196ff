package dev.titlecrawl.model;

/** Classification of a single page attempt */
public enum OutcomeKind {
	SUCCESS,
	TRANSIENT_ERROR,
	RATE_LIMITED,
	FATAL_ERROR,
	PARSE_ERROR;

	/** Whether the scheduler may try the page again */
	public boolean isRetryable() {
		return this == TRANSIENT_ERROR || this == RATE_LIMITED || this == PARSE_ERROR;
	}
}
