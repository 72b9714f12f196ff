package dev.titlecrawl;

import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/** Main application class with CLI support */
@Command(
		name = "title-crawler",
		version = "1.0.0",
		description = "Crawls a paginated title listing into gzip-compressed JSON lines",
		mixinStandardHelpOptions = true,
		subcommands = {CrawlCommand.class, StatusCommand.class, ResetCommand.class})
public class Main implements Callable<Integer> {

	@Spec
	CommandSpec spec;

	@Override
	public Integer call() {
		spec.commandLine().usage(System.err);
		return spec.exitCodeOnInvalidInput();
	}

	public static void main(String[] args) {
		int exitCode = new CommandLine(new Main()).execute(args);
		System.exit(exitCode);
	}
}
