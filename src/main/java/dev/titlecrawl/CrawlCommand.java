package dev.titlecrawl;

import dev.titlecrawl.backoff.BackoffController;
import dev.titlecrawl.backoff.BackoffPolicy;
import dev.titlecrawl.backoff.ThreadSleeper;
import dev.titlecrawl.checkpoint.CheckpointException;
import dev.titlecrawl.checkpoint.FileCheckpointStore;
import dev.titlecrawl.crawler.CrawlConfig;
import dev.titlecrawl.crawler.CrawlResult;
import dev.titlecrawl.crawler.CrawlScheduler;
import dev.titlecrawl.http.HttpFetchClient;
import dev.titlecrawl.http.HttpSettings;
import dev.titlecrawl.output.ArtifactPublisher;
import dev.titlecrawl.output.JsonLinesGzipSink;
import dev.titlecrawl.output.MinioArtifactPublisher;
import dev.titlecrawl.output.NoOpArtifactPublisher;
import dev.titlecrawl.output.OutputNaming;
import dev.titlecrawl.parser.JsonListingParser;
import dev.titlecrawl.reporting.ProgressReporter;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/** Crawl command that walks the listing and writes one artifact per run */
@Command(
		name = "crawl",
		description = "Crawl the paginated listing into a gzip-compressed JSON lines file. "
				+ "Every option defaults to the environment variable named in its description.",
		mixinStandardHelpOptions = true)
public class CrawlCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	private static final Duration HOOK_EXTRA_WAIT = Duration.ofSeconds(10);

	@Spec
	CommandSpec spec;

	@Option(
			names = {"-u", "--base-url"},
			description = "Listing URL, may contain {page}, {perPage} and {offset} placeholders (BASE_URL)",
			defaultValue = "${env:BASE_URL}")
	private String baseUrl;

	@Option(
			names = {"--per-page"},
			description = "Records requested per page, 1 to 10000 (PER_PAGE, default: ${DEFAULT-VALUE})",
			defaultValue = "${env:PER_PAGE:-1000}")
	private int perPage;

	@Option(
			names = {"--max-pages"},
			description = "Highest page to crawl, or all/unlimited (MAX_PAGES, default: ${DEFAULT-VALUE})",
			converter = CliConverters.PageLimit.class,
			defaultValue = "${env:MAX_PAGES:-all}")
	private int maxPages;

	@Option(
			names = {"-w", "--workers"},
			description = "Number of worker threads (WORKER_COUNT, default: ${DEFAULT-VALUE})",
			defaultValue = "${env:WORKER_COUNT:-24}")
	private int workers;

	@Option(
			names = {"--resume"},
			arity = "1",
			description = "Continue after the last committed page (RESUME, default: ${DEFAULT-VALUE})",
			converter = CliConverters.BooleanFlag.class,
			defaultValue = "${env:RESUME:-true}")
	private boolean resume;

	@Option(
			names = {"--from-start"},
			description = "Discard the checkpoint and crawl from page 1")
	private boolean fromStart;

	@Option(
			names = {"--max-attempts"},
			description = "Attempts per page before giving up on it (MAX_ATTEMPTS, default: ${DEFAULT-VALUE})",
			defaultValue = "${env:MAX_ATTEMPTS:-5}")
	private int maxAttempts;

	@Option(
			names = {"--http-pool-connections"},
			description = "Maximum requests in flight (HTTP_POOL_CONNECTIONS, default: ${DEFAULT-VALUE})",
			defaultValue = "${env:HTTP_POOL_CONNECTIONS:-40}")
	private int poolConnections;

	@Option(
			names = {"--http-pool-maxsize"},
			description = "Pooled connections (HTTP_POOL_MAXSIZE, default: ${DEFAULT-VALUE})",
			defaultValue = "${env:HTTP_POOL_MAXSIZE:-100}")
	private int poolMaxSize;

	@Option(
			names = {"--http-timeout"},
			description = "Per request timeout in seconds (HTTP_TIMEOUT, default: ${DEFAULT-VALUE})",
			defaultValue = "${env:HTTP_TIMEOUT:-30}")
	private int httpTimeoutSeconds;

	@Option(
			names = {"--user-agent"},
			description = "User-Agent header (USER_AGENT, default: ${DEFAULT-VALUE})",
			defaultValue = "${env:USER_AGENT:-title-crawler/1.0}")
	private String userAgent;

	@Option(
			names = {"--page-delay-ms"},
			description = "Minimum delay before each fetch (PAGE_DELAY_MS, default: ${DEFAULT-VALUE})",
			defaultValue = "${env:PAGE_DELAY_MS:-150}")
	private long pageDelayMs;

	@Option(
			names = {"--backoff-max-ms"},
			description = "Maximum delay before a fetch (BACKOFF_MAX_MS, default: ${DEFAULT-VALUE})",
			defaultValue = "${env:BACKOFF_MAX_MS:-30000}")
	private long backoffMaxMs;

	@Option(
			names = {"--rate-limit-floor-ms"},
			description = "Minimum delay once throttled (RATE_LIMIT_FLOOR_MS, default: ${DEFAULT-VALUE})",
			defaultValue = "${env:RATE_LIMIT_FLOOR_MS:-5000}")
	private long rateLimitFloorMs;

	@Option(
			names = {"--backoff-threshold-ms"},
			description = "Response time above which the delay grows (BACKOFF_THRESHOLD_MS, default: ${DEFAULT-VALUE})",
			defaultValue = "${env:BACKOFF_THRESHOLD_MS:-2000}")
	private long backoffThresholdMs;

	@Option(
			names = {"--backoff-step-ms"},
			description = "Delay added after a slow response (BACKOFF_STEP_MS, default: ${DEFAULT-VALUE})",
			defaultValue = "${env:BACKOFF_STEP_MS:-200}")
	private long backoffStepMs;

	@Option(
			names = {"-o", "--output-dir"},
			description = "Directory for the output file (OUT_DIR, default: ${DEFAULT-VALUE})",
			defaultValue = "${env:OUT_DIR:-.}")
	private Path outputDir;

	@Option(
			names = {"--output-file"},
			description = "Output file name, generated from the run start if not given (OUT_JSONL)",
			defaultValue = "${env:OUT_JSONL}")
	private String outputFile;

	@Option(
			names = {"-c", "--checkpoint-file"},
			description = "Checkpoint file (CHECKPOINT_FILE, default: ${DEFAULT-VALUE})",
			defaultValue = "${env:CHECKPOINT_FILE:-.crawl_state.json}")
	private Path checkpointFile;

	@Option(
			names = {"--shutdown-grace"},
			description = "Seconds in-flight pages get to finish on cancellation (SHUTDOWN_GRACE_SECONDS, default: ${DEFAULT-VALUE})",
			defaultValue = "${env:SHUTDOWN_GRACE_SECONDS:-10}")
	private int shutdownGraceSeconds;

	@Option(
			names = {"--s3-bucket"},
			description = "Bucket to upload the output file to, no upload if not set (S3_BUCKET)",
			defaultValue = "${env:S3_BUCKET}")
	private String s3Bucket;

	@Option(
			names = {"--s3-prefix"},
			description = "Key prefix for uploads (S3_PREFIX, default: ${DEFAULT-VALUE})",
			defaultValue = "${env:S3_PREFIX:-titles/bronze/}")
	private String s3Prefix;

	@Option(
			names = {"--s3-endpoint"},
			description = "S3 compatible endpoint (S3_ENDPOINT, default: ${DEFAULT-VALUE})",
			defaultValue = "${env:S3_ENDPOINT:-https://s3.amazonaws.com}")
	private String s3Endpoint;

	@Option(
			names = {"--s3-region"},
			description = "Bucket region (S3_REGION, default: ${DEFAULT-VALUE})",
			defaultValue = "${env:S3_REGION:-us-east-1}")
	private String s3Region;

	@Option(
			names = {"--s3-access-key"},
			description = "Access key (AWS_ACCESS_KEY_ID)",
			defaultValue = "${env:AWS_ACCESS_KEY_ID}")
	private String s3AccessKey;

	@Option(
			names = {"--s3-secret-key"},
			description = "Secret key (AWS_SECRET_ACCESS_KEY)",
			defaultValue = "${env:AWS_SECRET_ACCESS_KEY}")
	private String s3SecretKey;

	@Override
	public Integer call() throws Exception {
		validate();

		Clock clock = Clock.systemUTC();
		Instant startedAt = clock.instant();
		String runStamp = OutputNaming.runStamp(startedAt);
		Path artifact = OutputNaming.outputFile(outputDir, outputFile, startedAt);
		boolean resumeRun = resume && !fromStart;

		CrawlConfig config = new CrawlConfig(
				baseUrl,
				perPage,
				maxPages,
				workers,
				maxAttempts,
				resumeRun,
				Duration.ofSeconds(shutdownGraceSeconds));
		BackoffPolicy policy = BackoffPolicy.defaults()
				.withFloor(Duration.ofMillis(pageDelayMs))
				.withCeiling(Duration.ofMillis(Math.max(backoffMaxMs, pageDelayMs)))
				.withRateLimitFloor(Duration.ofMillis(rateLimitFloorMs))
				.withSlowSuccess(Duration.ofMillis(backoffThresholdMs), Duration.ofMillis(backoffStepMs));
		HttpSettings httpSettings =
				new HttpSettings(poolConnections, poolMaxSize, Duration.ofSeconds(httpTimeoutSeconds), userAgent);

		System.out.println("Title Crawler - Crawl");
		System.out.println("=====================");
		System.out.println("Base URL: " + baseUrl);
		System.out.println("Output file: " + artifact.toAbsolutePath());
		System.out.println("Checkpoint: " + checkpointFile.toAbsolutePath() + (resumeRun ? " (resume)" : " (from start)"));
		System.out.println("Workers: " + workers + ", per page: " + perPage + ", max pages: "
				+ (config.isUnlimited() ? "all" : maxPages));
		System.out.println();

		CrawlResult result;
		try (var reporter = new ProgressReporter();
				var fetchClient = new HttpFetchClient(httpSettings, clock);
				var sink = new JsonLinesGzipSink(artifact)) {
			reporter.start();
			var scheduler = new CrawlScheduler(
					config,
					fetchClient,
					new JsonListingParser(),
					new BackoffController(policy),
					ThreadSleeper.INSTANCE,
					new FileCheckpointStore(checkpointFile, clock),
					sink,
					reporter,
					clock);

			Thread shutdownHook = new Thread(() -> cancelAndWait(scheduler, config), "crawl-shutdown");
			Runtime.getRuntime().addShutdownHook(shutdownHook);
			try {
				result = scheduler.run(runStamp);
			} finally {
				removeShutdownHook(shutdownHook);
			}
		} catch (CheckpointException e) {
			System.err.println("Error: " + e.getMessage());
			logger.debug("Checkpoint failure", e);
			return CrawlResult.Status.FATAL.exitCode();
		}

		printSummary(result, artifact);
		publish(result, artifact, runStamp);
		return result.status().exitCode();
	}

	private void validate() {
		if (baseUrl == null || baseUrl.isBlank()) {
			throw new ParameterException(spec.commandLine(), "A base URL is required (--base-url or BASE_URL)");
		}
		if (perPage < 1 || perPage > CrawlConfig.MAX_PER_PAGE) {
			throw new ParameterException(
					spec.commandLine(), "--per-page must be between 1 and " + CrawlConfig.MAX_PER_PAGE + ": " + perPage);
		}
		if (workers < 1 || maxAttempts < 1 || poolConnections < 1 || poolMaxSize < 1 || httpTimeoutSeconds < 1) {
			throw new ParameterException(
					spec.commandLine(), "Worker count, attempts, pool sizes and timeout must all be positive");
		}
		if (pageDelayMs < 0 || backoffMaxMs < 0 || rateLimitFloorMs < 0 || backoffThresholdMs < 0 || backoffStepMs < 0) {
			throw new ParameterException(spec.commandLine(), "Delays must not be negative");
		}
	}

	private static void cancelAndWait(CrawlScheduler scheduler, CrawlConfig config) {
		scheduler.cancel();
		try {
			if (!scheduler.awaitCompletion(config.shutdownGrace().plus(HOOK_EXTRA_WAIT))) {
				logger.warn("Crawl did not stop in time, exiting anyway");
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}

	private static void removeShutdownHook(Thread hook) {
		try {
			Runtime.getRuntime().removeShutdownHook(hook);
		} catch (IllegalStateException e) {
			logger.debug("JVM already shutting down, hook stays registered");
		}
	}

	private static void printSummary(CrawlResult result, Path artifact) {
		System.out.println();
		System.out.println("Crawl Summary");
		System.out.println("=============");
		System.out.println(result);
		System.out.println();
		System.out.println("Pages attempted: " + result.pagesAttempted());
		System.out.println("Pages committed: " + result.pagesCommitted());
		System.out.println("Pages failed: " + result.failedPages().size());
		System.out.println("Records written: " + result.recordsWritten());
		System.out.println("Last committed page: " + result.lastCommittedPage());
		System.out.println("Output file: " + artifact.toAbsolutePath());
		System.out.println();
		System.out.println("Crawl finished in " + result.duration().toMillis() / 1000.0 + " seconds");
	}

	private void publish(CrawlResult result, Path artifact, String runStamp) {
		if (result.status() == CrawlResult.Status.CANCELLED) {
			logger.info("Run was cancelled, not uploading {}", artifact.getFileName());
			return;
		}
		try {
			createPublisher()
					.publish(artifact, runStamp)
					.ifPresent(location -> System.out.println("Uploaded to: " + location));
		} catch (IOException | IllegalArgumentException e) {
			logger.error("Upload failed, output kept at {}: {}", artifact.toAbsolutePath(), e.getMessage());
		}
	}

	ArtifactPublisher createPublisher() {
		if (s3Bucket == null || s3Bucket.isBlank()) {
			return new NoOpArtifactPublisher();
		}
		return MinioArtifactPublisher.create(s3Endpoint, s3Region, s3AccessKey, s3SecretKey, s3Bucket, s3Prefix);
	}
}
