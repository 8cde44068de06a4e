package tech.flowcatalyst.authz.api;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Request ID generation.
 *
 * Format: {@code req-<epoch millis in base 36>-<6 random base 36 chars>}
 */
public final class RequestIds {

    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int SUFFIX_LENGTH = 6;

    public static String generate() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder sb = new StringBuilder("req-")
            .append(Long.toString(System.currentTimeMillis(), 36))
            .append('-');
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }

    private RequestIds() {}
}
