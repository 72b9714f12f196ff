package dev.titlecrawl.checkpoint;

import static org.assertj.core.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.titlecrawl.model.Checkpoint;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileCheckpointStoreTest {

	@TempDir
	Path tempDir;

	private final Clock clock = Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC);

	@Test
	void testMissingFileLoadsAsZero() throws Exception {
		FileCheckpointStore store = new FileCheckpointStore(tempDir.resolve("state.json"), clock);

		assertThat(store.load()).isZero();
		assertThat(store.current()).isEmpty();
	}

	@Test
	void testCommitIsMonotonic() throws Exception {
		// Given
		FileCheckpointStore store = new FileCheckpointStore(tempDir.resolve("state.json"), clock);

		// When
		store.commit(3);
		store.commit(2);
		store.commit(3);

		// Then
		assertThat(store.load()).isEqualTo(3);
	}

	@Test
	void testProgressSurvivesNewInstance() throws Exception {
		// Given
		Path file = tempDir.resolve("nested/state.json");
		FileCheckpointStore store = new FileCheckpointStore(file, clock);
		store.beginRun("run-1", "2024-03-01T11:59:00Z");
		store.recordsWritten(2000);
		store.commit(2);

		// When
		FileCheckpointStore reopened = new FileCheckpointStore(file, clock);

		// Then
		assertThat(reopened.load()).isEqualTo(2);
		Checkpoint state = reopened.current().orElseThrow();
		assertThat(state.runId()).isEqualTo("run-1");
		assertThat(state.runStartedAt()).isEqualTo("2024-03-01T11:59:00Z");
		assertThat(state.updatedAt()).isEqualTo("2024-03-01T12:00:00Z");
		assertThat(state.recordsWritten()).isEqualTo(2000);
	}

	@Test
	void testNoTemporaryFilesLeftBehind() throws Exception {
		// Given
		FileCheckpointStore store = new FileCheckpointStore(tempDir.resolve("state.json"), clock);

		// When
		for (int page = 1; page <= 20; page++) {
			store.commit(page);
		}

		// Then
		try (Stream<Path> files = Files.list(tempDir)) {
			assertThat(files).extracting(p -> p.getFileName().toString()).containsExactly("state.json");
		}
	}

	@Test
	void testUnreadableFileFailsLoudly() throws Exception {
		// Given
		Path file = tempDir.resolve("state.json");
		Files.writeString(file, "{ not json");

		// When/Then
		FileCheckpointStore store = new FileCheckpointStore(file, clock);
		assertThatThrownBy(store::load)
				.isInstanceOf(CheckpointException.class)
				.hasMessageContaining("Unreadable checkpoint");
	}

	@Test
	void testPlannedTotalOnlyShrinks() throws Exception {
		FileCheckpointStore store = new FileCheckpointStore(tempDir.resolve("state.json"), clock);

		store.planTotal(5);
		store.planTotal(3);
		store.planTotal(4);

		assertThat(store.current().orElseThrow().totalPagesPlanned()).isEqualTo(3);
	}

	@Test
	void testFailedPagesAreRecordedOnce() throws Exception {
		FileCheckpointStore store = new FileCheckpointStore(tempDir.resolve("state.json"), clock);

		store.recordFailure(4);
		store.recordFailure(4);
		store.recordFailure(7);

		assertThat(new FileCheckpointStore(store.file()).current().orElseThrow().failedPages())
				.containsExactly(4, 7);
	}

	@Test
	void testResetRemovesProgress() throws Exception {
		// Given
		Path file = tempDir.resolve("state.json");
		FileCheckpointStore store = new FileCheckpointStore(file, clock);
		store.commit(9);

		// When
		store.reset();

		// Then
		assertThat(file).doesNotExist();
		assertThat(store.load()).isZero();
	}

	@Test
	void testFileUsesSnakeCaseKeys() throws Exception {
		// Given
		Path file = tempDir.resolve("state.json");
		FileCheckpointStore store = new FileCheckpointStore(file, clock);
		store.beginRun("run-1", "2024-03-01T11:59:00Z");
		store.commit(1);

		// When
		JsonNode json = new ObjectMapper().readTree(file.toFile());

		// Then
		assertThat(json.fieldNames())
				.toIterable()
				.containsExactly(
						"run_id",
						"run_started_at",
						"updated_at",
						"last_committed_page",
						"total_pages_planned",
						"records_written",
						"failed_pages");
		assertThat(json.get("last_committed_page").asInt()).isEqualTo(1);
		assertThat(json.get("total_pages_planned").isNull()).isTrue();
	}

	@Test
	void testBeginRunKeepsCommittedPage() throws Exception {
		FileCheckpointStore store = new FileCheckpointStore(tempDir.resolve("state.json"), clock);
		store.commit(4);

		store.beginRun("run-2", "2024-03-01T12:00:00Z");

		assertThat(store.load()).isEqualTo(4);
		assertThat(store.current().orElseThrow().runId()).isEqualTo("run-2");
	}

	@Test
	void testCommitSucceedsOnInterruptedThread() throws Exception {
		// Given
		Path file = tempDir.resolve("state.json");
		FileCheckpointStore store = new FileCheckpointStore(file, clock);

		// When
		Thread.currentThread().interrupt();
		try {
			store.commit(3);
		} finally {
			Thread.interrupted();
		}

		// Then
		assertThat(new FileCheckpointStore(file, clock).load()).isEqualTo(3);
	}
}
