package dev.titlecrawl.checkpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.titlecrawl.model.Checkpoint;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checkpoint kept in a small JSON file. Every change is written to a sibling temporary file,
 * forced to disk and then moved over the checkpoint, so readers only ever see a complete
 * document.
 */
public class FileCheckpointStore implements CheckpointStore {
	private static final Logger logger = LoggerFactory.getLogger(FileCheckpointStore.class);

	private static final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

	private final Path file;
	private final Clock clock;

	private Checkpoint state;
	private long pendingRecords;

	public FileCheckpointStore(Path file) {
		this(file, Clock.systemUTC());
	}

	public FileCheckpointStore(Path file, Clock clock) {
		this.file = file;
		this.clock = clock;
	}

	public Path file() {
		return file;
	}

	@Override
	public synchronized int load() throws CheckpointException {
		return state().lastCommittedPage();
	}

	@Override
	public synchronized void commit(int pageIndex) throws CheckpointException {
		Checkpoint current = state();
		if (pageIndex <= current.lastCommittedPage()) {
			logger.debug("Ignoring commit of page {} (already at {})", pageIndex, current.lastCommittedPage());
			return;
		}
		write(current.withCommit(pageIndex, pendingRecords, now()));
	}

	@Override
	public synchronized void beginRun(String runId, String startedAt) throws CheckpointException {
		pendingRecords = 0;
		write(state().withRun(runId, startedAt));
	}

	@Override
	public synchronized void planTotal(int totalPages) throws CheckpointException {
		Checkpoint current = state();
		if (current.totalPagesPlanned() != null && current.totalPagesPlanned() <= totalPages) {
			return;
		}
		write(current.withTotalPages(totalPages, now()));
	}

	@Override
	public synchronized void recordFailure(int pageIndex) throws CheckpointException {
		Checkpoint current = state();
		if (current.failedPages().contains(pageIndex)) {
			return;
		}
		write(current.withFailedPage(pageIndex, now()));
	}

	@Override
	public synchronized void recordsWritten(long count) {
		pendingRecords = count;
	}

	@Override
	public synchronized Optional<Checkpoint> current() throws CheckpointException {
		Checkpoint current = state();
		return Files.exists(file) ? Optional.of(current) : Optional.empty();
	}

	@Override
	public synchronized void reset() throws CheckpointException {
		try {
			if (Files.deleteIfExists(file)) {
				logger.info("Checkpoint cleared: {}", file);
			}
			state = Checkpoint.empty();
			pendingRecords = 0;
		} catch (IOException e) {
			throw new CheckpointException("Failed to delete checkpoint " + file, e);
		}
	}

	private Checkpoint state() throws CheckpointException {
		if (state == null) {
			state = read();
		}
		return state;
	}

	private Checkpoint read() throws CheckpointException {
		if (!Files.exists(file)) {
			return Checkpoint.empty();
		}
		try {
			Checkpoint loaded = mapper.readValue(file.toFile(), Checkpoint.class);
			logger.info(
					"Loaded checkpoint: last committed page {}, run {}",
					loaded.lastCommittedPage(),
					loaded.runId());
			return loaded;
		} catch (IOException e) {
			throw new CheckpointException("Unreadable checkpoint " + file + ": " + e.getMessage(), e);
		}
	}

	private void write(Checkpoint next) throws CheckpointException {
		byte[] bytes;
		try {
			bytes = mapper.writeValueAsBytes(next);
		} catch (JsonProcessingException e) {
			throw new CheckpointException("Failed to serialize checkpoint", e);
		}

		Path dir = file.toAbsolutePath().getParent();
		Path temp = null;
		try {
			Files.createDirectories(dir);
			temp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
			// not a FileChannel, interrupting the committing thread must not close the file
			try (FileOutputStream out = new FileOutputStream(temp.toFile())) {
				out.write(bytes);
				out.getFD().sync();
			}
			move(temp, file);
			temp = null;
			state = next;
		} catch (IOException e) {
			throw new CheckpointException("Failed to write checkpoint " + file, e);
		} finally {
			if (temp != null) {
				try {
					Files.deleteIfExists(temp);
				} catch (IOException e) {
					logger.warn("Could not remove temporary checkpoint {}: {}", temp, e.getMessage());
				}
			}
		}
	}

	private static void move(Path source, Path target) throws IOException {
		try {
			Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
		} catch (AtomicMoveNotSupportedException e) {
			logger.debug("Atomic move not supported for {}, falling back to replace", target);
			Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
		}
	}

	private String now() {
		return clock.instant().toString();
	}
}
