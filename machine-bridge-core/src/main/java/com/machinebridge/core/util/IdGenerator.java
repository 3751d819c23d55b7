package com.machinebridge.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Generates deterministic identifiers from their structural components.
 *
 * <p>The same components always produce the same id, so re-extracting unchanged source yields
 * the same node, edge and block ids.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * String id = IdGenerator.generate("machine.ts", "0", "node", "p2.p0");
 * }</pre>
 */
public final class IdGenerator {

    private static final String HASH_ALGORITHM = "SHA-256";
    private static final String SEPARATOR = "\u0000";
    private static final int ID_LENGTH = 16;

    private IdGenerator() {
        // Utility class - no instantiation
    }

    /**
     * Generates a 16-character hex id from the given components.
     *
     * @param components id components, at least one
     * @return deterministic id
     * @throws IllegalArgumentException if no components are given
     */
    public static String generate(String... components) {
        if (components == null || components.length == 0) {
            throw new IllegalArgumentException("At least one component required");
        }
        return generateFullHash(String.join(SEPARATOR, components)).substring(0, ID_LENGTH);
    }

    /**
     * Returns the full SHA-256 hex digest of the input.
     *
     * @param input text to hash
     * @return 64-character lowercase hex digest
     * @throws IllegalArgumentException if the input is null or blank
     */
    public static String generateFullHash(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("Input must not be null or blank");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance(HASH_ALGORITHM);
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(HASH_ALGORITHM + " not available", e);
        }
    }
}
