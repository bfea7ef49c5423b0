package org.springaicommunity.metadata.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for the synchronizer and its collaborators.
 */
@Configuration
public class MetadataSyncConfig {

	@Bean
	public SyncProperties syncProperties() {
		return new SyncProperties();
	}

	@Bean
	public ObjectMapper objectMapper() {
		return ObjectMapperFactory.create();
	}

	@Bean
	public UserReporter userReporter() {
		return new LoggingUserReporter();
	}

	@Bean
	public ArgumentParser argumentParser(SyncProperties syncProperties) {
		return new ArgumentParser(syncProperties);
	}

	@Bean
	public MetadataSyncBuilder metadataSyncBuilder(SyncProperties syncProperties, ObjectMapper objectMapper,
			UserReporter userReporter) {
		return MetadataSyncBuilder.create()
			.properties(syncProperties)
			.objectMapper(objectMapper)
			.userReporter(userReporter);
	}

}
