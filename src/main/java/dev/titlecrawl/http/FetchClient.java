package dev.titlecrawl.http;

/**
 * Channel to the remote listing source. Implementations are shared by all workers and must be
 * thread-safe. Failures are reported through {@link FetchResult#kind()}, never thrown.
 */
public interface FetchClient extends AutoCloseable {

	/**
	 * Fetch one page.
	 *
	 * @param url the page URL
	 * @return the payload and its classification
	 * @throws InterruptedException if the calling worker was interrupted while waiting
	 */
	FetchResult fetch(String url) throws InterruptedException;

	@Override
	default void close() {}
}
