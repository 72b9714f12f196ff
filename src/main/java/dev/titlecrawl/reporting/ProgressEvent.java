package dev.titlecrawl.reporting;

import java.time.Instant;

/** Represents a progress event from a crawl run */
public record ProgressEvent(
		String runId, EventType eventType, int page, String message, Instant timestamp, Throwable error) {
	public enum EventType {
		STARTED,
		PAGE_COMMITTED,
		PAGE_RETRY,
		PAGE_FAILED,
		COMPLETED,
		FAILED
	}

	public static ProgressEvent started(String runId, int startPage) {
		return new ProgressEvent(
				runId, EventType.STARTED, startPage, "Crawl started at page " + startPage, Instant.now(), null);
	}

	public static ProgressEvent committed(String runId, int page, int records, long totalRecords) {
		return new ProgressEvent(
				runId,
				EventType.PAGE_COMMITTED,
				page,
				"%d records (%d total)".formatted(records, totalRecords),
				Instant.now(),
				null);
	}

	public static ProgressEvent retry(String runId, int page, int attempt, String reason) {
		return new ProgressEvent(
				runId, EventType.PAGE_RETRY, page, "attempt %d failed: %s".formatted(attempt, reason), Instant.now(), null);
	}

	public static ProgressEvent pageFailed(String runId, int page, String reason) {
		return new ProgressEvent(runId, EventType.PAGE_FAILED, page, reason, Instant.now(), null);
	}

	public static ProgressEvent completed(String runId, String summary) {
		return new ProgressEvent(runId, EventType.COMPLETED, 0, summary, Instant.now(), null);
	}

	public static ProgressEvent failed(String runId, String message, Throwable error) {
		return new ProgressEvent(runId, EventType.FAILED, 0, message, Instant.now(), error);
	}

	@Override
	public String toString() {
		return page > 0
				? "[%s] %s: %s page %d - %s".formatted(timestamp, runId, eventType, page, message)
				: "[%s] %s: %s - %s".formatted(timestamp, runId, eventType, message);
	}
}
