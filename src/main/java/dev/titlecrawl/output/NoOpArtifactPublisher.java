package dev.titlecrawl.output;

import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Keeps the artifact local only. Used when no bucket is configured. */
public class NoOpArtifactPublisher implements ArtifactPublisher {
	private static final Logger logger = LoggerFactory.getLogger(NoOpArtifactPublisher.class);

	@Override
	public Optional<String> publish(Path artifact, String runStamp) {
		logger.info("No bucket configured, keeping {} local only", artifact);
		return Optional.empty();
	}
}
