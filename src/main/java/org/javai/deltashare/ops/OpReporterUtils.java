package org.javai.deltashare.ops;

/**
 * Shared utilities for failure reporting and diagnostic logging.
 */
public final class OpReporterUtils {

	static final int MAX_PRINTABLE_LENGTH = 256;

	private OpReporterUtils() {
		// Utility class
	}

	/**
	 * Makes caller-supplied text safe to embed in a single log line.
	 * Line breaks and tabs are escaped, other control characters become {@code ?},
	 * and the result is cut to {@value #MAX_PRINTABLE_LENGTH} characters.
	 */
	public static String printable(String s) {
		if (s == null) return "null";
		StringBuilder out = new StringBuilder(Math.min(s.length(), MAX_PRINTABLE_LENGTH) + 8);
		int i = 0;
		for (; i < s.length() && out.length() < MAX_PRINTABLE_LENGTH; i++) {
			char c = s.charAt(i);
			switch (c) {
				case '\n' -> out.append("\\n");
				case '\r' -> out.append("\\r");
				case '\t' -> out.append("\\t");
				default -> out.append(Character.isISOControl(c) ? '?' : c);
			}
		}
		if (i < s.length()) {
			out.append("...");
		}
		return out.toString();
	}
}
