package org.springaicommunity.metadata.sync;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	public String registryFile;

	public String downloadDirectory;

	// Repositories to add to the registry before syncing
	public List<RepositorySource> repositories = new ArrayList<>();

	public boolean verbose = false;

	public boolean helpRequested = false;

	public ParsedConfiguration(SyncProperties defaultProperties) {
		this.registryFile = defaultProperties.getRegistryFile();
		this.downloadDirectory = defaultProperties.getDownloadDirectory();
		this.verbose = defaultProperties.isVerbose();
	}

	/**
	 * Copy the parsed values onto a properties object.
	 */
	public void applyTo(SyncProperties properties) {
		properties.setRegistryFile(registryFile);
		properties.setDownloadDirectory(downloadDirectory);
		properties.setVerbose(verbose);
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "registryFile='" + registryFile + '\'' + ", downloadDirectory='"
				+ downloadDirectory + '\'' + ", repositories=" + repositories + ", verbose=" + verbose
				+ ", helpRequested=" + helpRequested + '}';
	}

}
