package dev.titlecrawl;

import dev.titlecrawl.checkpoint.CheckpointException;
import dev.titlecrawl.checkpoint.FileCheckpointStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/** Reset command that discards the stored crawl progress */
@Command(
		name = "reset",
		description = "Delete the checkpoint so the next crawl starts at page 1",
		mixinStandardHelpOptions = true)
public class ResetCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Option(
			names = {"-c", "--checkpoint-file"},
			description = "Checkpoint file (CHECKPOINT_FILE, default: ${DEFAULT-VALUE})",
			defaultValue = "${env:CHECKPOINT_FILE:-.crawl_state.json}")
	private Path checkpointFile;

	@Option(
			names = {"--dry-run"},
			description = "Show what would be deleted without deleting it")
	private boolean dryRun;

	@Override
	public Integer call() {
		if (!Files.exists(checkpointFile)) {
			logger.info("No checkpoint at {}, nothing to reset", checkpointFile.toAbsolutePath());
			return 0;
		}
		if (dryRun) {
			logger.info("Would delete checkpoint {} (dry run)", checkpointFile.toAbsolutePath());
			return 0;
		}
		try {
			new FileCheckpointStore(checkpointFile).reset();
		} catch (CheckpointException e) {
			logger.error("{}", e.getMessage());
			return 1;
		}
		logger.info("Deleted checkpoint {}", checkpointFile.toAbsolutePath());
		return 0;
	}
}
