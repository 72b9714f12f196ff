package dev.titlecrawl.crawler;

import java.time.Duration;

/**
 * Configuration of a crawl run.
 *
 * @param baseUrl listing URL, optionally with {@code {page}}, {@code {perPage}} and {@code
 *     {offset}} placeholders
 * @param perPage records requested per page
 * @param maxPages highest page index to crawl, or {@link #UNLIMITED}
 * @param workerCount number of worker threads
 * @param maxAttempts attempts per page before it is given up on
 * @param resume whether to continue after the last committed page
 * @param shutdownGrace time in-flight pages get to finish after cancellation
 */
public record CrawlConfig(
		String baseUrl,
		int perPage,
		int maxPages,
		int workerCount,
		int maxAttempts,
		boolean resume,
		Duration shutdownGrace) {

	public static final int UNLIMITED = -1;
	public static final int MAX_PER_PAGE = 10_000;

	/** How far ahead of the lowest uncommitted page each worker may run */
	private static final int WINDOW_PER_WORKER = 4;

	public CrawlConfig {
		if (baseUrl == null || baseUrl.isBlank()) {
			throw new IllegalArgumentException("Base URL is required");
		}
		if (perPage < 1 || perPage > MAX_PER_PAGE) {
			throw new IllegalArgumentException("Page size must be between 1 and " + MAX_PER_PAGE + ": " + perPage);
		}
		if (maxPages < 1) {
			maxPages = UNLIMITED;
		}
		if (workerCount < 1) {
			throw new IllegalArgumentException("Worker count must be positive: " + workerCount);
		}
		if (maxAttempts < 1) {
			throw new IllegalArgumentException("Max attempts must be positive: " + maxAttempts);
		}
		if (shutdownGrace == null || shutdownGrace.isNegative()) {
			shutdownGrace = Duration.ZERO;
		}
	}

	public boolean isUnlimited() {
		return maxPages == UNLIMITED;
	}

	/** Highest page index that may be dispatched */
	public int lastPage() {
		return isUnlimited() ? Integer.MAX_VALUE : maxPages;
	}

	/** Number of pages beyond the lowest uncommitted one that may be dispatched */
	public int dispatchWindow() {
		return workerCount * WINDOW_PER_WORKER;
	}
}
