package org.springaicommunity.metadata.sync.cli;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.metadata.sync.*;

/**
 * Metadata Sync CLI Application
 *
 * Plain Java command-line application that refreshes the local registry from every
 * configured metadata repository. No Spring dependencies - uses MetadataSyncBuilder for
 * service wiring.
 *
 * Usage: java -jar metadata-sync-cli.jar [OPTIONS]
 *
 * Environment Variables: METADATA_SYNC_REGISTRY - registry file,
 * METADATA_SYNC_DOWNLOAD_DIR - download directory
 *
 * Examples: java -jar metadata-sync-cli.jar --registry ~/ckan/registry.json java -jar
 * metadata-sync-cli.jar --repo extra=https://example.org/meta.zip --verbose
 */
public class MetadataSyncCli {

	private static final Logger logger = LoggerFactory.getLogger(MetadataSyncCli.class);

	public static void main(String[] args) {
		try {
			int exitCode = run(args);
			if (exitCode != 0) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("Sync failed: {}", e.getMessage());
			System.exit(1);
		}
	}

	public static int run(String[] args) {
		SyncProperties properties = new SyncProperties();
		ArgumentParser argumentParser = new ArgumentParser(properties);

		// Check for help request first
		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return 0;
		}

		ParsedConfiguration config;
		try {
			config = argumentParser.parseAndValidate(args);
		}
		catch (IllegalArgumentException e) {
			logger.error("Invalid arguments: {}", e.getMessage());
			System.err.println(argumentParser.generateHelpText());
			return 1;
		}
		config.applyTo(properties);
		configureLogging(config.verbose);
		logConfiguration(config);

		MetadataSyncBuilder builder = MetadataSyncBuilder.create().properties(properties);
		SyncResult result;
		try {
			FileSystemMetadataRegistry registry = builder.buildRegistry();
			if (!config.repositories.isEmpty()) {
				config.repositories.forEach(registry::addRepository);
				registry.save();
			}
			result = builder.registry(registry).build().syncAll();
		}
		catch (RegistryException e) {
			logger.error("Registry error: {}", e.getMessage());
			if (config.verbose) {
				logger.error("Stack trace:", e);
			}
			return 1;
		}

		logResult(result, config.verbose);
		return exitCode(result);
	}

	static int exitCode(SyncResult result) {
		return result.outcome() == SyncOutcome.FAILED ? 1 : 0;
	}

	private static void logConfiguration(ParsedConfiguration config) {
		logger.info("Configuration:");
		logger.info("  Registry: {}", config.registryFile);
		logger.info("  Download directory: {}", config.downloadDirectory);
		logger.info("  Added repositories: {}", config.repositories);
		logger.info("  Verbose: {}", config.verbose);
	}

	private static void logResult(SyncResult result, boolean verbose) {
		switch (result.outcome()) {
			case UPDATED:
				logger.info("Registry updated: {} modules from {} repositories", result.descriptorCount(),
						result.repositoryCount());
				break;
			case NO_CHANGES:
				logger.info("Registry already up to date ({} repositories)", result.repositoryCount());
				break;
			default:
				Throwable failure = result.failure();
				logger.error("Sync failed: {}", failure != null ? failure.getMessage() : "unknown error");
				if (verbose && failure != null) {
					logger.error("Stack trace:", failure);
				}
				break;
		}
	}

	private static void configureLogging(boolean verbose) {
		if (!verbose) {
			return;
		}
		Logger syncLogger = LoggerFactory.getLogger("org.springaicommunity.metadata.sync");
		if (syncLogger instanceof ch.qos.logback.classic.Logger logbackLogger) {
			logbackLogger.setLevel(Level.DEBUG);
		}
	}

}
