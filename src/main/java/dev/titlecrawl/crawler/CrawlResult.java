package dev.titlecrawl.crawler;

import java.time.Duration;
import java.util.List;

/** Result of a crawl run */
public record CrawlResult(
		Status status,
		int startPage,
		int pagesAttempted,
		int pagesCommitted,
		int lastCommittedPage,
		List<Integer> failedPages,
		long recordsWritten,
		int skippedItems,
		int retries,
		Duration duration,
		String error) {

	public enum Status {
		COMPLETED(0),
		COMPLETED_WITH_FAILURES(3),
		FATAL(1),
		CANCELLED(130);

		private final int exitCode;

		Status(int exitCode) {
			this.exitCode = exitCode;
		}

		public int exitCode() {
			return exitCode;
		}
	}

	public CrawlResult {
		failedPages = List.copyOf(failedPages);
	}

	/** A run that had nothing left to do */
	public static CrawlResult nothingToDo(int startPage) {
		return new CrawlResult(Status.COMPLETED, startPage, 0, 0, startPage - 1, List.of(), 0, 0, 0, Duration.ZERO, null);
	}

	public boolean success() {
		return status == Status.COMPLETED;
	}

	@Override
	public String toString() {
		String counts = "%d pages attempted, %d committed, %d failed, %d records written, %d items skipped, %d retries in %.1fs"
				.formatted(
						pagesAttempted,
						pagesCommitted,
						failedPages.size(),
						recordsWritten,
						skippedItems,
						retries,
						duration.toMillis() / 1000.0);
		return switch (status) {
			case COMPLETED -> "SUCCESS (%s)".formatted(counts);
			case COMPLETED_WITH_FAILURES -> "PARTIAL (%s; failed pages %s)".formatted(counts, failedPages);
			case FATAL -> "FAILED - %s (%s)".formatted(error != null ? error : "Unknown error", counts);
			case CANCELLED -> "CANCELLED (%s)".formatted(counts);
		};
	}
}
