package org.springaicommunity.metadata.sync;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Configuration properties for repository synchronization.
 *
 * <p>
 * Default values suit a single-user client. Properties can be set directly via setters or
 * passed to {@link MetadataSyncBuilder}.
 */
public class SyncProperties {

	/**
	 * Largest byte array the JVM can allocate, and so the largest entry that can be read.
	 */
	public static final long MAX_ENTRY_SIZE_LIMIT = Integer.MAX_VALUE - 8;

	/**
	 * Registry file holding repositories, available modules and download counts.
	 */
	private String registryFile = "registry.json";

	/**
	 * Directory receiving downloaded archives while a sync runs.
	 */
	private String downloadDirectory = Paths.get(System.getProperty("java.io.tmpdir"), "metadata-sync").toString();

	/**
	 * HTTP connect timeout in seconds.
	 */
	private int connectTimeoutSeconds = 30;

	/**
	 * Timeout in seconds for one change-token probe or archive download.
	 */
	private int requestTimeoutSeconds = 300;

	/**
	 * User-Agent header sent with every request.
	 */
	private String userAgent = "metadata-sync";

	/**
	 * Largest archive entry, in bytes, that is read into memory. Larger entries are
	 * skipped. The default is the largest byte array the JVM can allocate.
	 */
	private long maxEntrySizeBytes = MAX_ENTRY_SIZE_LIMIT;

	/**
	 * Newest metadata spec version this client understands.
	 */
	private String supportedSpecVersion = "v1.34";

	/**
	 * Name of the repository a new registry starts with.
	 */
	private String defaultRepositoryName = "default";

	/**
	 * Archive URI of the repository a new registry starts with.
	 */
	private String defaultRepositoryUri = "https://github.com/KSP-CKAN/CKAN-meta/archive/master.tar.gz";

	/**
	 * Enable verbose logging output.
	 */
	private boolean verbose = false;

	public String getRegistryFile() {
		return registryFile;
	}

	public void setRegistryFile(String registryFile) {
		this.registryFile = registryFile;
	}

	public Path getRegistryPath() {
		return Paths.get(registryFile);
	}

	public String getDownloadDirectory() {
		return downloadDirectory;
	}

	public void setDownloadDirectory(String downloadDirectory) {
		this.downloadDirectory = downloadDirectory;
	}

	public int getConnectTimeoutSeconds() {
		return connectTimeoutSeconds;
	}

	public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
		this.connectTimeoutSeconds = connectTimeoutSeconds;
	}

	public int getRequestTimeoutSeconds() {
		return requestTimeoutSeconds;
	}

	public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
		this.requestTimeoutSeconds = requestTimeoutSeconds;
	}

	public String getUserAgent() {
		return userAgent;
	}

	public void setUserAgent(String userAgent) {
		this.userAgent = userAgent;
	}

	public long getMaxEntrySizeBytes() {
		return maxEntrySizeBytes;
	}

	/**
	 * @param maxEntrySizeBytes entry size limit in bytes
	 * @throws IllegalArgumentException if the limit is negative or above
	 * {@link #MAX_ENTRY_SIZE_LIMIT}
	 */
	public void setMaxEntrySizeBytes(long maxEntrySizeBytes) {
		if (maxEntrySizeBytes < 0 || maxEntrySizeBytes > MAX_ENTRY_SIZE_LIMIT) {
			throw new IllegalArgumentException("Max entry size must be between 0 and " + MAX_ENTRY_SIZE_LIMIT
					+ " bytes: " + maxEntrySizeBytes);
		}
		this.maxEntrySizeBytes = maxEntrySizeBytes;
	}

	public String getSupportedSpecVersion() {
		return supportedSpecVersion;
	}

	public void setSupportedSpecVersion(String supportedSpecVersion) {
		this.supportedSpecVersion = supportedSpecVersion;
	}

	public String getDefaultRepositoryName() {
		return defaultRepositoryName;
	}

	public void setDefaultRepositoryName(String defaultRepositoryName) {
		this.defaultRepositoryName = defaultRepositoryName;
	}

	public String getDefaultRepositoryUri() {
		return defaultRepositoryUri;
	}

	public void setDefaultRepositoryUri(String defaultRepositoryUri) {
		this.defaultRepositoryUri = defaultRepositoryUri;
	}

	public boolean isVerbose() {
		return verbose;
	}

	public void setVerbose(boolean verbose) {
		this.verbose = verbose;
	}

}
