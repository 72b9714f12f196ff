package dev.titlecrawl;

import static org.assertj.core.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.titlecrawl.output.GzipLines;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

@Timeout(60)
class CrawlCommandTest {

	private static final int TOTAL_RECORDS = 5;
	private static final ObjectMapper mapper = new ObjectMapper();

	@TempDir
	Path tempDir;

	private MockWebServer server;
	private Path checkpoint;
	private Path output;

	@BeforeEach
	void setUp() throws Exception {
		server = new MockWebServer();
		server.start();
		checkpoint = tempDir.resolve("state.json");
		output = tempDir.resolve("titles.jsonl.gz");
	}

	@AfterEach
	void tearDown() throws Exception {
		server.shutdown();
	}

	@Test
	void testCrawlWritesAllRecords() throws Exception {
		// Given
		server.setDispatcher(new ListingDispatcher(0));

		// When
		int exitCode = execute(crawlArgs());

		// Then
		assertThat(exitCode).isZero();
		assertThat(GzipLines.pages(output)).containsExactly(1, 1, 2, 2, 3);
		JsonNode state = mapper.readTree(checkpoint.toFile());
		assertThat(state.get("last_committed_page").asInt()).isEqualTo(3);
		assertThat(state.get("total_pages_planned").asInt()).isEqualTo(3);
		assertThat(state.get("records_written").asLong()).isEqualTo(TOTAL_RECORDS);
	}

	@Test
	void testCompletedCrawlResumesToNothing() throws Exception {
		// Given
		server.setDispatcher(new ListingDispatcher(0));
		assertThat(execute(crawlArgs())).isZero();
		int requestsAfterFirstRun = server.getRequestCount();

		// When
		int exitCode = execute(crawlArgs());

		// Then
		assertThat(exitCode).isZero();
		assertThat(server.getRequestCount()).isEqualTo(requestsAfterFirstRun);
	}

	@Test
	void testMissingListingIsFatal() throws Exception {
		// Given
		server.setDispatcher(new ListingDispatcher(1));

		// When
		int exitCode = execute(crawlArgs());

		// Then
		assertThat(exitCode).isEqualTo(1);
		assertThat(GzipLines.read(output)).isEmpty();
	}

	@Test
	void testInvalidPageSizeIsUsageError() {
		List<String> args = crawlArgs();
		args.add("--per-page");
		args.add("0");

		assertThat(execute(args)).isEqualTo(2);
		assertThat(server.getRequestCount()).isZero();
	}

	@Test
	void testMissingBaseUrlIsUsageError() {
		assertThat(execute(List.of("crawl", "--base-url=", "-c", checkpoint.toString()))).isEqualTo(2);
	}

	@Test
	void testNoSubcommandPrintsUsage() {
		assertThat(execute(List.of())).isEqualTo(2);
	}

	@Test
	void testStatusWithoutCheckpoint() {
		assertThat(execute(List.of("status", "-c", checkpoint.toString()))).isZero();
	}

	@Test
	void testStatusWithUnreadableCheckpoint() throws Exception {
		Files.writeString(checkpoint, "garbage");

		assertThat(execute(List.of("status", "-c", checkpoint.toString()))).isEqualTo(1);
	}

	@Test
	void testResetDeletesCheckpoint() throws Exception {
		// Given
		Files.writeString(checkpoint, "{\"last_committed_page\": 4}");

		// When dry run
		assertThat(execute(List.of("reset", "-c", checkpoint.toString(), "--dry-run"))).isZero();

		// Then
		assertThat(checkpoint).exists();

		// When
		assertThat(execute(List.of("reset", "-c", checkpoint.toString()))).isZero();

		// Then
		assertThat(checkpoint).doesNotExist();
	}

	private List<String> crawlArgs() {
		return new ArrayList<>(List.of(
				"crawl",
				"--base-url", server.url("/search").toString(),
				"--per-page", "2",
				"--workers", "2",
				"--max-attempts", "2",
				"--page-delay-ms", "0",
				"--http-timeout", "5",
				"--shutdown-grace", "1",
				"--resume", "true",
				"--max-pages", "all",
				"-o", tempDir.toString(),
				"--output-file", output.getFileName().toString(),
				"-c", checkpoint.toString(),
				"--s3-bucket="));
	}

	private static int execute(List<String> args) {
		return new CommandLine(new Main()).execute(args.toArray(new String[0]));
	}

	/** Serves a listing of {@link #TOTAL_RECORDS} titles, optionally answering one page with 404 */
	private static class ListingDispatcher extends Dispatcher {
		private final int missingPage;

		ListingDispatcher(int missingPage) {
			this.missingPage = missingPage;
		}

		@Override
		public MockResponse dispatch(RecordedRequest request) {
			int page = Integer.parseInt(request.getRequestUrl().queryParameter("page"));
			int perPage = Integer.parseInt(request.getRequestUrl().queryParameter("per_page"));
			if (page == missingPage) {
				return new MockResponse().setResponseCode(404);
			}

			int first = (page - 1) * perPage;
			int last = Math.min(TOTAL_RECORDS, first + perPage);
			StringBuilder items = new StringBuilder();
			for (int i = first; i < last; i++) {
				if (items.length() > 0) {
					items.append(',');
				}
				items.append("{\"title\": \"Title ").append(i).append("\", \"year\": \"2000\", \"rating\": \"6.5\"}");
			}
			String body = "{\"items\": [" + items + "], \"pageInfo\": {\"hasNextPage\": " + (last < TOTAL_RECORDS) + "}}";
			return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
		}
	}
}
