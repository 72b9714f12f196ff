package dev.titlecrawl.http;

import dev.titlecrawl.model.OutcomeKind;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Set;

/** Maps HTTP responses onto {@link OutcomeKind}s */
public final class HttpStatusClassifier {

	/** 4xx statuses that will not change by asking again */
	private static final Set<Integer> PERMANENT_CLIENT_ERRORS = Set.of(400, 401, 403, 404, 405, 410, 414, 451);

	private HttpStatusClassifier() {}

	public static OutcomeKind classify(int statusCode, String body, boolean hasRetryAfter) {
		if (statusCode >= 200 && statusCode < 300) {
			return looksComplete(body) ? OutcomeKind.SUCCESS : OutcomeKind.TRANSIENT_ERROR;
		}
		if (statusCode == 429 || (hasRetryAfter && statusCode >= 400)) {
			return OutcomeKind.RATE_LIMITED;
		}
		if (statusCode >= 400 && statusCode < 500) {
			return PERMANENT_CLIENT_ERRORS.contains(statusCode) ? OutcomeKind.FATAL_ERROR : OutcomeKind.TRANSIENT_ERROR;
		}
		return OutcomeKind.TRANSIENT_ERROR;
	}

	/**
	 * Minimal structural check on a response body: it must not be blank, and a JSON document must
	 * close the bracket it opens.
	 */
	public static boolean looksComplete(String body) {
		if (body == null) {
			return false;
		}
		String trimmed = body.strip();
		if (trimmed.isEmpty()) {
			return false;
		}
		char first = trimmed.charAt(0);
		char last = trimmed.charAt(trimmed.length() - 1);
		if (first == '{') {
			return last == '}';
		}
		if (first == '[') {
			return last == ']';
		}
		return true;
	}

	/**
	 * Parse a Retry-After header, either delay-seconds or an HTTP date.
	 *
	 * @return the requested delay, or null if the header is absent or unparseable
	 */
	public static Duration parseRetryAfter(String value, Instant now) {
		if (value == null || value.isBlank()) {
			return null;
		}
		String trimmed = value.trim();
		try {
			long seconds = Long.parseLong(trimmed);
			return seconds < 0 ? null : Duration.ofSeconds(seconds);
		} catch (NumberFormatException e) {
			// not delay-seconds, try the date form
		}
		try {
			Instant at = Instant.from(DateTimeFormatter.RFC_1123_DATE_TIME.parse(trimmed));
			Duration delay = Duration.between(now, at);
			return delay.isNegative() ? Duration.ZERO : delay;
		} catch (DateTimeParseException e) {
			return null;
		}
	}
}
