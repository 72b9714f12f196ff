package dev.titlecrawl.output;

import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/** Naming of run artifacts */
public final class OutputNaming {
	private static final DateTimeFormatter RUN_STAMP =
			DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH-mm-ss").withZone(ZoneOffset.UTC);

	private OutputNaming() {}

	/** File-name-safe UTC timestamp identifying a run */
	public static String runStamp(Instant runStartedAt) {
		return RUN_STAMP.format(runStartedAt);
	}

	public static String fileName(Instant runStartedAt) {
		return "titles_" + runStamp(runStartedAt) + ".jsonl.gz";
	}

	/**
	 * Resolve the output file of a run.
	 *
	 * @param outputDir directory for generated names, and for relative explicit names
	 * @param explicitFile file name given by the user, or null to generate one
	 * @param runStartedAt start of the run
	 */
	public static Path outputFile(Path outputDir, String explicitFile, Instant runStartedAt) {
		if (explicitFile != null && !explicitFile.isBlank()) {
			return outputDir.resolve(explicitFile.trim());
		}
		return outputDir.resolve(fileName(runStartedAt));
	}
}
