package com.libragraph.vfs.core.doc;

import java.util.HexFormat;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Pattern;

/**
 * Revision tokens of the form {@code <generation>-<16 random hex bytes>}.
 * Callers compare them, never interpret them.
 */
final class Revisions {

    private static final HexFormat HEX = HexFormat.of();
    private static final Pattern FORMAT = Pattern.compile("\\d{1,18}-.+");

    private Revisions() {
    }

    static String first() {
        return 1 + "-" + randomSuffix();
    }

    static String next(String rev) {
        return (generation(rev) + 1) + "-" + randomSuffix();
    }

    /** True if {@code rev} could have been issued by a store: a generation, a dash, a suffix. */
    static boolean isWellFormed(String rev) {
        return rev != null && FORMAT.matcher(rev).matches();
    }

    static long generation(String rev) {
        if (!isWellFormed(rev)) {
            throw new IllegalArgumentException("Malformed revision: " + rev);
        }
        return Long.parseLong(rev.substring(0, rev.indexOf('-')));
    }

    private static String randomSuffix() {
        byte[] bytes = new byte[16];
        ThreadLocalRandom.current().nextBytes(bytes);
        return HEX.formatHex(bytes);
    }
}
