package dev.titlecrawl.reporting;

/** Receiver of crawl progress events. Must be safe to call from any worker thread. */
@FunctionalInterface
public interface CrawlProgress {

	/** Discards every event */
	CrawlProgress NONE = event -> {};

	void report(ProgressEvent event);
}
