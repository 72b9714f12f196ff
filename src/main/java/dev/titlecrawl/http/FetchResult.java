package dev.titlecrawl.http;

import dev.titlecrawl.model.OutcomeKind;
import java.time.Duration;

/**
 * Outcome of a single fetch.
 *
 * @param payload response body for successful fetches, otherwise whatever was received (may be null)
 * @param kind classification of the attempt
 * @param statusCode HTTP status, or 0 when no response was received
 * @param latency time spent on the request
 * @param retryAfter delay requested by the source, or null
 * @param detail short human readable reason for failures
 */
public record FetchResult(
		String payload, OutcomeKind kind, int statusCode, Duration latency, Duration retryAfter, String detail) {

	public static FetchResult success(String payload, int statusCode, Duration latency) {
		return new FetchResult(payload, OutcomeKind.SUCCESS, statusCode, latency, null, null);
	}

	public static FetchResult failure(OutcomeKind kind, int statusCode, Duration latency, String detail) {
		return new FetchResult(null, kind, statusCode, latency, null, detail);
	}

	public FetchResult withRetryAfter(Duration retryAfter) {
		return new FetchResult(payload, kind, statusCode, latency, retryAfter, detail);
	}

	public boolean isSuccess() {
		return kind == OutcomeKind.SUCCESS;
	}
}
