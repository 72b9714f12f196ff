package dev.titlecrawl.backoff;

import java.time.Duration;

public final class ThreadSleeper implements Sleeper {
	public static final ThreadSleeper INSTANCE = new ThreadSleeper();

	private ThreadSleeper() {}

	@Override
	public void sleep(Duration duration) throws InterruptedException {
		long millis = Math.max(0, duration.toMillis());
		if (millis > 0) {
			Thread.sleep(millis);
		}
	}
}
