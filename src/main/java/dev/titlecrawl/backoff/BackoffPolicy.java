package dev.titlecrawl.backoff;

import java.time.Duration;

/**
 * Tuning for {@link BackoffController}.
 *
 * @param floor lowest delay between fetches, also the delay a fresh process starts with
 * @param ceiling highest delay ever returned
 * @param multiplier growth factor applied on each failure
 * @param jitterRatio upper bound of the random extra added on growth, as a fraction of the floor
 * @param successDecay factor applied to the delay on a fast success, 0 resets straight to the floor
 * @param rateLimitFloor minimum delay once the source has signalled throttling
 * @param slowThreshold latency above which a success still counts as pressure from the source
 * @param slowStep amount the delay grows by after a slow success
 */
public record BackoffPolicy(
		Duration floor,
		Duration ceiling,
		double multiplier,
		double jitterRatio,
		double successDecay,
		Duration rateLimitFloor,
		Duration slowThreshold,
		Duration slowStep) {

	public BackoffPolicy {
		if (floor.isNegative() || ceiling.compareTo(floor) < 0) {
			throw new IllegalArgumentException("Backoff ceiling must be at or above a non-negative floor");
		}
		if (multiplier < 1.0) {
			throw new IllegalArgumentException("Backoff multiplier must be at least 1: " + multiplier);
		}
		if (successDecay < 0.0 || successDecay >= 1.0) {
			throw new IllegalArgumentException("Success decay must be in [0, 1): " + successDecay);
		}
		jitterRatio = Math.max(0.0, jitterRatio);
	}

	public static BackoffPolicy defaults() {
		return new BackoffPolicy(
				Duration.ofMillis(150),
				Duration.ofSeconds(30),
				2.0,
				0.2,
				0.0,
				Duration.ofSeconds(5),
				Duration.ofSeconds(2),
				Duration.ofMillis(200));
	}

	public BackoffPolicy withFloor(Duration floor) {
		return new BackoffPolicy(
				floor, ceiling, multiplier, jitterRatio, successDecay, rateLimitFloor, slowThreshold, slowStep);
	}

	public BackoffPolicy withCeiling(Duration ceiling) {
		return new BackoffPolicy(
				floor, ceiling, multiplier, jitterRatio, successDecay, rateLimitFloor, slowThreshold, slowStep);
	}

	public BackoffPolicy withRateLimitFloor(Duration rateLimitFloor) {
		return new BackoffPolicy(
				floor, ceiling, multiplier, jitterRatio, successDecay, rateLimitFloor, slowThreshold, slowStep);
	}

	public BackoffPolicy withSlowSuccess(Duration slowThreshold, Duration slowStep) {
		return new BackoffPolicy(
				floor, ceiling, multiplier, jitterRatio, successDecay, rateLimitFloor, slowThreshold, slowStep);
	}

	public BackoffPolicy withSuccessDecay(double successDecay) {
		return new BackoffPolicy(
				floor, ceiling, multiplier, jitterRatio, successDecay, rateLimitFloor, slowThreshold, slowStep);
	}
}
