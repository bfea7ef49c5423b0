package org.springaicommunity.metadata.sync;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Metadata format version, written as {@code v1.N} (or the bare integer {@code 1} for the
 * first format).
 *
 * @param major major version
 * @param minor minor version
 */
public record SpecVersion(int major, int minor) implements Comparable<SpecVersion> {

	private static final Pattern SPEC_VERSION_PATTERN = Pattern.compile("v?(\\d+)(?:\\.(\\d+))?");

	/**
	 * Parse a spec version.
	 * @param text {@code "v1.4"}, {@code "1.4"} or {@code "1"}
	 * @return the parsed version
	 * @throws BadMetadataException if the text is not a spec version
	 */
	public static SpecVersion parse(String text) {
		Matcher matcher = SPEC_VERSION_PATTERN.matcher(text.trim());
		if (!matcher.matches()) {
			throw new BadMetadataException("Invalid spec_version: " + text);
		}
		try {
			int major = Integer.parseInt(matcher.group(1));
			int minor = matcher.group(2) != null ? Integer.parseInt(matcher.group(2)) : 0;
			return new SpecVersion(major, minor);
		}
		catch (NumberFormatException e) {
			throw new BadMetadataException("Invalid spec_version: " + text, e);
		}
	}

	@Override
	public int compareTo(SpecVersion other) {
		if (major != other.major) {
			return Integer.compare(major, other.major);
		}
		return Integer.compare(minor, other.minor);
	}

	@Override
	public String toString() {
		return "v" + major + "." + minor;
	}

}
