package org.springaicommunity.metadata.sync;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Command-line argument parser for the metadata sync application. Pure Java
 * implementation with no Spring dependencies for maximum testability.
 *
 * <p>
 * Defaults come from {@link SyncProperties}, overridden by the
 * {@value EnvironmentSupport#REGISTRY_VARIABLE} and
 * {@value EnvironmentSupport#DOWNLOAD_DIR_VARIABLE} environment variables, overridden by
 * options.
 */
public class ArgumentParser {

	private final SyncProperties defaultProperties;

	public ArgumentParser(SyncProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);
		applyEnvironment(config);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-r", "--registry":
					config.registryFile = getRequiredValue(args, i, "registry");
					i++; // Skip next argument since we consumed it
					break;

				case "-d", "--download-dir":
					config.downloadDirectory = getRequiredValue(args, i, "download-dir");
					i++;
					break;

				case "--repo":
					config.repositories.add(parseRepository(getRequiredValue(args, i, "repo")));
					i++;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					throw new IllegalArgumentException("Unknown option: " + arg);
			}
		}

		validateConfiguration(config);
		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: metadata-sync [OPTIONS]\n");
		help.append("\n");
		help.append("Download every configured metadata repository and update the local registry.\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help                Show this help message\n");
		help.append("    -r, --registry FILE       Registry file (default: ")
			.append(defaultProperties.getRegistryFile())
			.append(")\n");
		help.append("    -d, --download-dir DIR    Directory for temporary downloads (default: ")
			.append(defaultProperties.getDownloadDirectory())
			.append(")\n");
		help.append("    --repo NAME=URI           Add a repository before syncing (repeatable)\n");
		help.append("    -v, --verbose             Enable verbose logging\n");
		help.append("\n");
		help.append("ENVIRONMENT:\n");
		help.append("    ").append(EnvironmentSupport.REGISTRY_VARIABLE).append("     Default registry file\n");
		help.append("    ").append(EnvironmentSupport.DOWNLOAD_DIR_VARIABLE).append(" Default download directory\n");
		help.append("\n");
		help.append("EXIT STATUS:\n");
		help.append("    0 when the registry was updated or nothing changed, 1 on failure\n");
		return help.toString();
	}

	private void applyEnvironment(ParsedConfiguration config) {
		String registry = EnvironmentSupport.get(EnvironmentSupport.REGISTRY_VARIABLE);
		if (registry != null && !registry.isBlank()) {
			config.registryFile = registry;
		}
		String downloadDir = EnvironmentSupport.get(EnvironmentSupport.DOWNLOAD_DIR_VARIABLE);
		if (downloadDir != null && !downloadDir.isBlank()) {
			config.downloadDirectory = downloadDir;
		}
	}

	static RepositorySource parseRepository(String value) {
		int separator = value.indexOf('=');
		if (separator <= 0 || separator == value.length() - 1) {
			throw new IllegalArgumentException("Invalid repository '" + value + "': must be NAME=URI");
		}
		String name = value.substring(0, separator).trim();
		String uriText = value.substring(separator + 1).trim();
		try {
			URI uri = new URI(uriText);
			if (!"http".equalsIgnoreCase(uri.getScheme()) && !"https".equalsIgnoreCase(uri.getScheme())) {
				throw new IllegalArgumentException("Invalid repository URI '" + uriText + "': must be http or https");
			}
			return new RepositorySource(name, uri, null);
		}
		catch (URISyntaxException e) {
			throw new IllegalArgumentException("Invalid repository URI '" + uriText + "': " + e.getReason());
		}
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private void validateConfiguration(ParsedConfiguration config) {
		if (config.registryFile == null || config.registryFile.isBlank()) {
			throw new IllegalArgumentException("Registry file must not be empty");
		}
		if (config.downloadDirectory == null || config.downloadDirectory.isBlank()) {
			throw new IllegalArgumentException("Download directory must not be empty");
		}
	}

}
