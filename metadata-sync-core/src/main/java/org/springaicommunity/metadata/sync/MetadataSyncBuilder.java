package org.springaicommunity.metadata.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.net.URI;
import java.net.http.HttpClient;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;

/**
 * Builder for creating a {@link MetadataSynchronizer} without Spring dependencies.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Defaults: registry.json in the working directory, HTTP transfers
 * MetadataSynchronizer synchronizer = MetadataSyncBuilder.create().build();
 *
 * // With custom configuration
 * SyncProperties props = new SyncProperties();
 * props.setRegistryFile("/var/lib/ckan/registry.json");
 *
 * MetadataSyncBuilder builder = MetadataSyncBuilder.create().properties(props);
 * FileSystemMetadataRegistry registry = builder.buildRegistry();
 * registry.addRepository(new RepositorySource("extra", URI.create("https://example.org/meta.zip"), null));
 * SyncResult result = builder.registry(registry).build().syncAll();
 *
 * // For testing with a stub transfer engine
 * MetadataSynchronizer testSynchronizer = MetadataSyncBuilder.create()
 *     .transferEngine(stubEngine)
 *     .changeTokenProbe(uri -> Optional.empty())
 *     .build();
 * }
 * </pre>
 */
public class MetadataSyncBuilder {

	private SyncProperties properties;

	private @Nullable ObjectMapper objectMapper;

	private @Nullable HttpClient httpClient;

	private @Nullable MetadataRegistry registry;

	private @Nullable ChangeTokenProbe changeTokenProbe;

	private @Nullable TransferEngine transferEngine;

	private @Nullable UserReporter userReporter;

	private @Nullable DescriptorParser descriptorParser;

	private MetadataSyncBuilder() {
		this.properties = new SyncProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new MetadataSyncBuilder
	 */
	public static MetadataSyncBuilder create() {
		return new MetadataSyncBuilder();
	}

	/**
	 * Set sync properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public MetadataSyncBuilder properties(@Nullable SyncProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public MetadataSyncBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set the HTTP client shared by the change-token probe and the transfer engine.
	 * @param httpClient JDK HTTP client (null to build one from the properties)
	 * @return this builder
	 */
	public MetadataSyncBuilder httpClient(@Nullable HttpClient httpClient) {
		this.httpClient = httpClient;
		return this;
	}

	/**
	 * Set a custom registry. Useful for testing with mocks or for alternative storage.
	 * @param registry registry implementation (null to load the configured registry file)
	 * @return this builder
	 */
	public MetadataSyncBuilder registry(@Nullable MetadataRegistry registry) {
		this.registry = registry;
		return this;
	}

	/**
	 * Set a custom change-token probe.
	 * @param changeTokenProbe probe implementation (null to use HTTP HEAD requests)
	 * @return this builder
	 */
	public MetadataSyncBuilder changeTokenProbe(@Nullable ChangeTokenProbe changeTokenProbe) {
		this.changeTokenProbe = changeTokenProbe;
		return this;
	}

	/**
	 * Set a custom transfer engine.
	 * @param transferEngine engine implementation (null to download over HTTP)
	 * @return this builder
	 */
	public MetadataSyncBuilder transferEngine(@Nullable TransferEngine transferEngine) {
		this.transferEngine = transferEngine;
		return this;
	}

	/**
	 * Set a custom user reporter.
	 * @param userReporter reporter implementation (null to report through the log)
	 * @return this builder
	 */
	public MetadataSyncBuilder userReporter(@Nullable UserReporter userReporter) {
		this.userReporter = userReporter;
		return this;
	}

	/**
	 * Set a custom descriptor parser.
	 * @param descriptorParser parser implementation (null to use Jackson)
	 * @return this builder
	 */
	public MetadataSyncBuilder descriptorParser(@Nullable DescriptorParser descriptorParser) {
		this.descriptorParser = descriptorParser;
		return this;
	}

	/**
	 * Load the registry file named by the properties. A missing file yields a registry
	 * holding only the default repository.
	 * @return the loaded registry
	 * @throws RegistryException if the file exists but cannot be read
	 */
	public FileSystemMetadataRegistry buildRegistry() {
		RepositorySource defaultRepository = new RepositorySource(properties.getDefaultRepositoryName(),
				URI.create(properties.getDefaultRepositoryUri()), null);
		return FileSystemMetadataRegistry.load(properties.getRegistryPath(), resolveObjectMapper(),
				List.of(defaultRepository));
	}

	/**
	 * Build a MetadataSynchronizer.
	 * @return configured MetadataSynchronizer
	 */
	public MetadataSynchronizer build() {
		ObjectMapper mapper = resolveObjectMapper();
		MetadataRegistry resolvedRegistry = this.registry != null ? this.registry : buildRegistry();
		UserReporter reporter = this.userReporter != null ? this.userReporter : new LoggingUserReporter();
		Duration requestTimeout = Duration.ofSeconds(properties.getRequestTimeoutSeconds());

		ChangeTokenProbe probe = this.changeTokenProbe != null ? this.changeTokenProbe
				: new HttpChangeTokenProbe(resolveHttpClient(), requestTimeout, properties.getUserAgent());
		TransferEngine engine = this.transferEngine != null ? this.transferEngine
				: new HttpTransferEngine(resolveHttpClient(), Paths.get(properties.getDownloadDirectory()),
						requestTimeout, properties.getUserAgent());
		DescriptorParser parser = this.descriptorParser != null ? this.descriptorParser
				: new JacksonDescriptorParser(mapper, SpecVersion.parse(properties.getSupportedSpecVersion()));

		ArchiveEntryReaderFactory readerFactory = new ArchiveEntryReaderFactory(new FormatDetector(),
				properties.getMaxEntrySizeBytes());
		RepositoryExtractor extractor = new RepositoryExtractor(readerFactory, new RecordClassifier(),
				new MetadataRecordParser(parser), mapper, reporter);

		return new MetadataSynchronizer(resolvedRegistry, new FreshnessGate(probe), engine, extractor, reporter);
	}

	private ObjectMapper resolveObjectMapper() {
		if (this.objectMapper == null) {
			this.objectMapper = ObjectMapperFactory.create();
		}
		return this.objectMapper;
	}

	private HttpClient resolveHttpClient() {
		if (this.httpClient == null) {
			this.httpClient = HttpClient.newBuilder()
				.connectTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()))
				.followRedirects(HttpClient.Redirect.NORMAL)
				.build();
		}
		return this.httpClient;
	}

}
