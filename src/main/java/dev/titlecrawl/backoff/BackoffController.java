package dev.titlecrawl.backoff;

import dev.titlecrawl.model.OutcomeKind;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adaptive delay shared by all workers. Every worker asks for {@link #nextDelay()} before a fetch
 * and reports what happened through {@link #recordOutcome}. Failures grow the delay
 * multiplicatively with jitter, and throttling signals additionally enforce a floor of their own.
 * A success brings the delay back down, except that a slow success following other successes is
 * treated as pressure and nudges the delay up by a fixed step.
 *
 * <p>All state changes happen under the instance lock.
 */
public class BackoffController {
	private static final Logger logger = LoggerFactory.getLogger(BackoffController.class);

	// growth needs a non-zero base even when the floor is 0
	private static final long MIN_GROWTH_MILLIS = 50;

	private final BackoffPolicy policy;
	private final DoubleSupplier jitter;

	private int consecutiveFailures;
	private long currentDelayMillis;
	private OutcomeKind lastOutcomeKind;

	public BackoffController(BackoffPolicy policy) {
		this(policy, () -> ThreadLocalRandom.current().nextDouble());
	}

	/**
	 * @param policy the tuning to apply
	 * @param jitter source of values in [0, 1) scaling the random part of each growth step
	 */
	public BackoffController(BackoffPolicy policy, DoubleSupplier jitter) {
		this.policy = policy;
		this.jitter = jitter;
		this.currentDelayMillis = policy.floor().toMillis();
	}

	/** Delay a worker must wait before its next fetch */
	public synchronized Duration nextDelay() {
		return Duration.ofMillis(currentDelayMillis);
	}

	public void recordOutcome(OutcomeKind kind) {
		recordOutcome(kind, Duration.ZERO, null);
	}

	/**
	 * Fold one fetch outcome into the delay.
	 *
	 * @param kind what happened
	 * @param latency how long the request took, used to detect a struggling source
	 * @param retryAfter delay the source asked for, or null
	 */
	public synchronized void recordOutcome(OutcomeKind kind, Duration latency, Duration retryAfter) {
		lastOutcomeKind = kind;
		switch (kind) {
			case SUCCESS -> onSuccess(latency == null ? Duration.ZERO : latency);
			case TRANSIENT_ERROR, PARSE_ERROR -> onFailure(0);
			case RATE_LIMITED -> {
				long requested = retryAfter == null ? 0 : retryAfter.toMillis();
				onFailure(Math.max(policy.rateLimitFloor().toMillis(), requested));
			}
			case FATAL_ERROR -> logger.debug("Fatal outcome recorded, delay left at {} ms", currentDelayMillis);
		}
	}

	public synchronized int consecutiveFailures() {
		return consecutiveFailures;
	}

	public synchronized OutcomeKind lastOutcomeKind() {
		return lastOutcomeKind;
	}

	private void onSuccess(Duration latency) {
		boolean recovering = consecutiveFailures > 0;
		consecutiveFailures = 0;
		long threshold = policy.slowThreshold().toMillis();
		long latencyMillis = latency.toMillis();

		// the first success after failures always decays, however slow it was
		if (!recovering && threshold > 0 && latencyMillis > threshold) {
			currentDelayMillis = Math.min(
					policy.ceiling().toMillis(),
					currentDelayMillis + policy.slowStep().toMillis());
			logger.debug("Slow response ({} ms), delay raised to {} ms", latencyMillis, currentDelayMillis);
		} else {
			currentDelayMillis = Math.max(policy.floor().toMillis(), (long) (currentDelayMillis * policy.successDecay()));
		}
	}

	private void onFailure(long minimumMillis) {
		consecutiveFailures++;
		long floor = policy.floor().toMillis();
		long base = Math.max(floor, MIN_GROWTH_MILLIS);
		double extra = Math.max(0.0, Math.min(1.0, jitter.getAsDouble())) * policy.jitterRatio() * base;

		long grown = (long) (Math.max(currentDelayMillis * policy.multiplier(), base) + extra);
		grown = Math.max(grown, minimumMillis);
		currentDelayMillis = Math.max(currentDelayMillis, Math.min(policy.ceiling().toMillis(), grown));
		logger.debug(
				"{} consecutive failure(s) (last {}), delay now {} ms",
				consecutiveFailures,
				lastOutcomeKind,
				currentDelayMillis);
	}
}
