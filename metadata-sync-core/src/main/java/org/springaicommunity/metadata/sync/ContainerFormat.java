package org.springaicommunity.metadata.sync;

/**
 * Archive container kinds recognized by {@link FormatDetector}.
 */
public enum ContainerFormat {

	TAR_GZ,

	ZIP,

	UNSUPPORTED

}
