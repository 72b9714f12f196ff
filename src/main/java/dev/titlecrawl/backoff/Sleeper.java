package dev.titlecrawl.backoff;

import java.time.Duration;

/** Suspension point used before each fetch, replaceable in tests */
@FunctionalInterface
public interface Sleeper {
	void sleep(Duration duration) throws InterruptedException;
}
