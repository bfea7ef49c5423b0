package org.springaicommunity.metadata.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Decides whether any configured repository changed since the last sync.
 *
 * <p>
 * A repository is unchanged only if it has a cached change-token and the probe returns
 * the same token. A missing cached token, a missing current token or a failed probe all
 * count as changed. The gate never modifies cached tokens.
 */
public class FreshnessGate {

	private static final Logger logger = LoggerFactory.getLogger(FreshnessGate.class);

	private final ChangeTokenProbe probe;

	public FreshnessGate(ChangeTokenProbe probe) {
		this.probe = probe;
	}

	/**
	 * Check every repository, stopping at the first changed one.
	 * @param repositories repositories, already deduplicated by URI
	 * @return true if no repository changed
	 */
	public boolean allUnchanged(List<RepositorySource> repositories) {
		for (RepositorySource repository : repositories) {
			if (!isUnchanged(repository)) {
				logger.info("{} repository has changed since the last update", repository.name());
				return false;
			}
		}
		return true;
	}

	boolean isUnchanged(RepositorySource repository) {
		String cached = repository.lastServerEtag();
		if (cached == null || cached.isEmpty()) {
			return false;
		}
		try {
			Optional<String> current = probe.currentToken(repository.uri());
			return current.map(cached::equals).orElse(false);
		}
		catch (ChangeTokenProbeException e) {
			logger.debug("Treating {} as changed: {}", repository.uri(), e.getMessage());
			return false;
		}
	}

}
