package dev.titlecrawl.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.ArrayList;
import java.util.List;

/**
 * Persisted crawl progress. {@code lastCommittedPage} is the highest page whose records are
 * durably written; every page at or below it is either committed or listed in {@code
 * failedPages}.
 */
@JsonPropertyOrder({
	"run_id",
	"run_started_at",
	"updated_at",
	"last_committed_page",
	"total_pages_planned",
	"records_written",
	"failed_pages"
})
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.ALWAYS)
public record Checkpoint(
		@JsonProperty("run_id") String runId,
		@JsonProperty("run_started_at") String runStartedAt,
		@JsonProperty("updated_at") String updatedAt,
		@JsonProperty("last_committed_page") int lastCommittedPage,
		@JsonProperty("total_pages_planned") Integer totalPagesPlanned,
		@JsonProperty("records_written") long recordsWritten,
		@JsonProperty("failed_pages") List<Integer> failedPages) {

	public Checkpoint {
		failedPages = failedPages == null ? List.of() : List.copyOf(failedPages);
	}

	public static Checkpoint empty() {
		return new Checkpoint(null, null, null, 0, null, 0, List.of());
	}

	public Checkpoint withRun(String runId, String runStartedAt) {
		return new Checkpoint(
				runId, runStartedAt, updatedAt, lastCommittedPage, totalPagesPlanned, 0, failedPages);
	}

	public Checkpoint withCommit(int page, long records, String now) {
		return new Checkpoint(runId, runStartedAt, now, page, totalPagesPlanned, records, failedPages);
	}

	public Checkpoint withTotalPages(int total, String now) {
		return new Checkpoint(runId, runStartedAt, now, lastCommittedPage, total, recordsWritten, failedPages);
	}

	public Checkpoint withFailedPage(int page, String now) {
		List<Integer> failed = new ArrayList<>(failedPages);
		if (!failed.contains(page)) {
			failed.add(page);
		}
		return new Checkpoint(
				runId, runStartedAt, now, lastCommittedPage, totalPagesPlanned, recordsWritten, failed);
	}
}
