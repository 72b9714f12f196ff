package dev.titlecrawl.output;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/** Ships a finished run artifact to remote storage. Called once, after the sink is closed. */
public interface ArtifactPublisher {

	/**
	 * Publish the artifact.
	 *
	 * @param artifact the closed output file
	 * @param runStamp the run timestamp, see {@link OutputNaming#runStamp}
	 * @return the remote location, or empty when nothing was uploaded
	 */
	Optional<String> publish(Path artifact, String runStamp) throws IOException;
}
