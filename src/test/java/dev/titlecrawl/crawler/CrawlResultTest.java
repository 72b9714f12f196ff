package dev.titlecrawl.crawler;

import static org.assertj.core.api.Assertions.*;

import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class CrawlResultTest {

	@Test
	void testExitCodes() {
		assertThat(CrawlResult.Status.COMPLETED.exitCode()).isZero();
		assertThat(CrawlResult.Status.FATAL.exitCode()).isEqualTo(1);
		assertThat(CrawlResult.Status.COMPLETED_WITH_FAILURES.exitCode()).isEqualTo(3);
		assertThat(CrawlResult.Status.CANCELLED.exitCode()).isEqualTo(130);
	}

	@Test
	void testToStringSummaries() {
		CrawlResult ok = new CrawlResult(
				CrawlResult.Status.COMPLETED, 1, 3, 3, 3, List.of(), 2437, 0, 2, Duration.ofSeconds(4), null);
		CrawlResult partial = new CrawlResult(
				CrawlResult.Status.COMPLETED_WITH_FAILURES, 1, 3, 2, 3, List.of(2), 20, 0, 4, Duration.ZERO, null);
		CrawlResult fatal = new CrawlResult(
				CrawlResult.Status.FATAL, 1, 5, 4, 4, List.of(), 40, 0, 0, Duration.ZERO, "Page 5: http_404");

		assertThat(ok.toString()).startsWith("SUCCESS").contains("2437 records written");
		assertThat(partial.toString()).startsWith("PARTIAL").contains("failed pages [2]");
		assertThat(fatal.toString()).startsWith("FAILED - Page 5: http_404");
		assertThat(ok.success()).isTrue();
		assertThat(partial.success()).isFalse();
	}

	@Test
	void testNothingToDo() {
		CrawlResult result = CrawlResult.nothingToDo(4);

		assertThat(result.status()).isEqualTo(CrawlResult.Status.COMPLETED);
		assertThat(result.lastCommittedPage()).isEqualTo(3);
		assertThat(result.pagesAttempted()).isZero();
	}
}
