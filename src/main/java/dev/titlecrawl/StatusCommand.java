package dev.titlecrawl;

import dev.titlecrawl.checkpoint.CheckpointException;
import dev.titlecrawl.checkpoint.FileCheckpointStore;
import dev.titlecrawl.model.Checkpoint;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/** Status command that shows the stored crawl progress */
@Command(name = "status", description = "Show the progress stored in the checkpoint", mixinStandardHelpOptions = true)
public class StatusCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Option(
			names = {"-c", "--checkpoint-file"},
			description = "Checkpoint file (CHECKPOINT_FILE, default: ${DEFAULT-VALUE})",
			defaultValue = "${env:CHECKPOINT_FILE:-.crawl_state.json}")
	private Path checkpointFile;

	@Override
	public Integer call() {
		Optional<Checkpoint> stored;
		try {
			stored = new FileCheckpointStore(checkpointFile).current();
		} catch (CheckpointException e) {
			logger.error("{}", e.getMessage());
			return 1;
		}

		if (stored.isEmpty()) {
			logger.info("No checkpoint at {}, the next crawl starts at page 1", checkpointFile.toAbsolutePath());
			return 0;
		}

		Checkpoint checkpoint = stored.get();
		logger.info("Checkpoint: {}", checkpointFile.toAbsolutePath());
		logger.info("  Run: {} (started {})", checkpoint.runId(), checkpoint.runStartedAt());
		logger.info("  Updated: {}", checkpoint.updatedAt());
		logger.info("  Last committed page: {}", checkpoint.lastCommittedPage());
		logger.info(
				"  Total pages: {}",
				checkpoint.totalPagesPlanned() != null ? checkpoint.totalPagesPlanned() : "unknown");
		logger.info("  Records written by last run: {}", checkpoint.recordsWritten());
		if (!checkpoint.failedPages().isEmpty()) {
			logger.info("  Failed pages: {}", checkpoint.failedPages());
		}
		if (checkpoint.totalPagesPlanned() != null
				&& checkpoint.lastCommittedPage() >= checkpoint.totalPagesPlanned()) {
			logger.info("  Crawl is complete, use crawl --from-start to start over");
		} else {
			logger.info("  Next crawl resumes at page {}", checkpoint.lastCommittedPage() + 1);
		}
		return 0;
	}
}
