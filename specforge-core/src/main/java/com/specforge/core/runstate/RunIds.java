package com.specforge.core.runstate;

import java.security.SecureRandom;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Run identifier generation: {@code yyyyMMdd-HHmmss-} plus six random base-36 characters.
 *
 * <p>The random suffix makes concurrent invocations within the same second collide with
 * negligible probability; the run directory is still created exclusively as a final guard.
 */
public final class RunIds {

    private static final DateTimeFormatter TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);
    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int SUFFIX_LENGTH = 6;
    private static final SecureRandom RANDOM = new SecureRandom();

    private RunIds() {
        // Utility class
    }

    /**
     * Generates a run id for the given instant.
     *
     * @param now current time
     * @return run id
     */
    public static String generate(Instant now) {
        StringBuilder id = new StringBuilder(TIMESTAMP.format(now)).append('-');
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            id.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
        }
        return id.toString();
    }
}
