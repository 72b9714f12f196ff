package dev.titlecrawl.http;

import java.time.Duration;

/**
 * Connection settings for {@link HttpFetchClient}.
 *
 * @param maxInFlight cap on fetches running at the same time
 * @param poolCapacity number of pooled connections, should be at least {@code maxInFlight}
 * @param timeout connect and response timeout of a single request
 * @param userAgent value of the User-Agent header
 */
public record HttpSettings(int maxInFlight, int poolCapacity, Duration timeout, String userAgent) {

	public HttpSettings {
		if (maxInFlight < 1 || poolCapacity < 1) {
			throw new IllegalArgumentException("Connection limits must be positive");
		}
		if (timeout.isNegative() || timeout.isZero()) {
			throw new IllegalArgumentException("HTTP timeout must be positive: " + timeout);
		}
	}

	/** Whether fetches could end up waiting on the pool instead of the in-flight cap */
	public boolean isPoolUndersized() {
		return poolCapacity < maxInFlight;
	}
}
