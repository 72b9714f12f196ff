package dev.titlecrawl.reporting;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ProgressReporterTest {

	@Test
	void testQueuedEventsAreProcessedBeforeClose() {
		// Given
		ProgressReporter reporter = new ProgressReporter();
		reporter.start();

		// When
		reporter.report(ProgressEvent.started("run", 1));
		for (int page = 1; page <= 50; page++) {
			reporter.report(ProgressEvent.committed("run", page, 10, page * 10L));
		}
		reporter.report(ProgressEvent.retry("run", 51, 1, "http_503"));
		reporter.report(ProgressEvent.retry("run", 51, 2, "timeout"));
		reporter.report(ProgressEvent.pageFailed("run", 51, "gave up after 2 attempts"));
		reporter.report(ProgressEvent.failed("run", "boom", new IllegalStateException("boom")));
		reporter.close();

		// Then
		assertThat(reporter.getCommittedPages()).isEqualTo(50);
		assertThat(reporter.getRetries()).isEqualTo(2);
	}

	@Test
	void testProcessEventCountsWithoutThread() {
		ProgressReporter reporter = new ProgressReporter();

		reporter.processEvent(ProgressEvent.committed("run", 1, 5, 5));
		reporter.processEvent(ProgressEvent.completed("run", "done"));

		assertThat(reporter.getCommittedPages()).isEqualTo(1);
	}

	@Test
	void testCloseWithoutStartIsHarmless() {
		ProgressReporter reporter = new ProgressReporter();

		reporter.close();

		assertThat(reporter.getCommittedPages()).isZero();
	}

	@Test
	void testEventToString() {
		assertThat(ProgressEvent.committed("run-1", 4, 10, 40).toString())
				.contains("run-1")
				.contains("PAGE_COMMITTED page 4")
				.contains("10 records (40 total)");
		assertThat(ProgressEvent.completed("run-1", "ok").toString()).contains("COMPLETED - ok");
	}
}
