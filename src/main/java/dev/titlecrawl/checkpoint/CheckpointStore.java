package dev.titlecrawl.checkpoint;

import dev.titlecrawl.model.Checkpoint;
import java.util.Optional;

/**
 * Durable record of crawl progress. Implementations must be safe to call from several threads and
 * must never expose a partially written state.
 */
public interface CheckpointStore {

	/**
	 * Read the stored progress.
	 *
	 * @return the last committed page, or 0 when nothing has been stored
	 */
	int load() throws CheckpointException;

	/**
	 * Record that every page up to and including {@code pageIndex} is complete. Calls with a value
	 * at or below the current one are no-ops.
	 */
	void commit(int pageIndex) throws CheckpointException;

	/** Stamp the identity of the run that will write subsequent commits */
	void beginRun(String runId, String startedAt) throws CheckpointException;

	/** Remember the total page count once the source has signalled the end of results */
	void planTotal(int totalPages) throws CheckpointException;

	/** Remember a page that was given up on */
	void recordFailure(int pageIndex) throws CheckpointException;

	/** Record count to store alongside the next commit */
	void recordsWritten(long count);

	/** The current state, if any has been stored */
	Optional<Checkpoint> current() throws CheckpointException;

	/** Discard all stored progress */
	void reset() throws CheckpointException;
}
