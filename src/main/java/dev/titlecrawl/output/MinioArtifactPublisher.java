package dev.titlecrawl.output;

import io.minio.MinioClient;
import io.minio.UploadObjectArgs;
import io.minio.errors.MinioException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Uploads run artifacts to an S3 compatible bucket under {@code <prefix>run=<stamp>/<file name>}.
 */
public class MinioArtifactPublisher implements ArtifactPublisher {
	private static final Logger logger = LoggerFactory.getLogger(MinioArtifactPublisher.class);

	private final MinioClient minioClient;
	private final String bucket;
	private final String prefix;

	public MinioArtifactPublisher(MinioClient minioClient, String bucket, String prefix) {
		if (bucket == null || bucket.isBlank()) {
			throw new IllegalArgumentException("Bucket name is required");
		}
		this.minioClient = minioClient;
		this.bucket = bucket;
		this.prefix = normalizePrefix(prefix);
	}

	/**
	 * Create a publisher talking to the given endpoint. Without an access key the client signs no
	 * requests.
	 */
	public static MinioArtifactPublisher create(
			String endpoint, String region, String accessKey, String secretKey, String bucket, String prefix) {
		MinioClient.Builder builder = MinioClient.builder().endpoint(endpoint);
		if (region != null && !region.isBlank()) {
			builder.region(region);
		}
		if (accessKey != null && !accessKey.isBlank()) {
			builder.credentials(accessKey, secretKey);
		}
		return new MinioArtifactPublisher(builder.build(), bucket, prefix);
	}

	@Override
	public Optional<String> publish(Path artifact, String runStamp) throws IOException {
		if (!Files.isRegularFile(artifact)) {
			throw new IOException("Nothing to upload, missing " + artifact);
		}
		String key = objectKey(prefix, runStamp, artifact.getFileName().toString());
		try {
			minioClient.uploadObject(UploadObjectArgs.builder()
					.bucket(bucket)
					.object(key)
					.filename(artifact.toString())
					.contentType("application/gzip")
					.build());
		} catch (MinioException | GeneralSecurityException e) {
			throw new IOException("Upload of " + artifact.getFileName() + " to " + bucket + " failed: " + e, e);
		}
		String location = "s3://" + bucket + "/" + key;
		logger.info("Uploaded {} to {}", artifact.getFileName(), location);
		return Optional.of(location);
	}

	public static String objectKey(String prefix, String runStamp, String fileName) {
		return normalizePrefix(prefix) + "run=" + runStamp + "/" + fileName;
	}

	static String normalizePrefix(String prefix) {
		if (prefix == null) {
			return "";
		}
		String trimmed = prefix.trim();
		while (trimmed.startsWith("/")) {
			trimmed = trimmed.substring(1);
		}
		if (trimmed.isEmpty()) {
			return "";
		}
		return trimmed.endsWith("/") ? trimmed : trimmed + "/";
	}
}
