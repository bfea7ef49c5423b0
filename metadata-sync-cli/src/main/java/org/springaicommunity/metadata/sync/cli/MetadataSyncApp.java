package org.springaicommunity.metadata.sync.cli;

import org.springaicommunity.metadata.sync.*;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metadata Sync CLI Application
 *
 * Spring Boot command-line application wiring the synchronizer from
 * {@link MetadataSyncConfig}. Accepts the same options as {@link MetadataSyncCli}.
 *
 * Usage: java -cp metadata-sync-cli.jar
 * org.springaicommunity.metadata.sync.cli.MetadataSyncApp [OPTIONS]
 */
@SpringBootApplication
@Import(MetadataSyncConfig.class)
public class MetadataSyncApp implements CommandLineRunner, ExitCodeGenerator {

	private static final Logger logger = LoggerFactory.getLogger(MetadataSyncApp.class);

	private final ArgumentParser argumentParser;

	private final SyncProperties syncProperties;

	private final MetadataSyncBuilder builder;

	private int exitCode = 0;

	public MetadataSyncApp(ArgumentParser argumentParser, SyncProperties syncProperties,
			MetadataSyncBuilder builder) {
		this.argumentParser = argumentParser;
		this.syncProperties = syncProperties;
		this.builder = builder;
	}

	public static void main(String[] args) {
		// Configure Spring Boot to run as console application
		SpringApplication app = new SpringApplication(MetadataSyncApp.class);
		app.setWebApplicationType(WebApplicationType.NONE);
		System.exit(SpringApplication.exit(app.run(args)));
	}

	@Override
	public void run(String... args) {
		// Check for help request first
		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return;
		}

		ParsedConfiguration config = argumentParser.parseAndValidate(args);
		config.applyTo(syncProperties);

		logger.info("Configuration:");
		logger.info("  Registry: {}", config.registryFile);
		logger.info("  Download directory: {}", config.downloadDirectory);
		logger.info("  Added repositories: {}", config.repositories);

		try {
			FileSystemMetadataRegistry registry = builder.buildRegistry();
			if (!config.repositories.isEmpty()) {
				config.repositories.forEach(registry::addRepository);
				registry.save();
			}
			SyncResult result = builder.registry(registry).build().syncAll();
			logger.info("Sync finished: {} ({} modules from {} repositories)", result.outcome(),
					result.descriptorCount(), result.repositoryCount());
			exitCode = MetadataSyncCli.exitCode(result);
		}
		catch (RegistryException e) {
			logger.error("Registry error: {}", e.getMessage());
			exitCode = 1;
		}
	}

	@Override
	public int getExitCode() {
		return exitCode;
	}

}
