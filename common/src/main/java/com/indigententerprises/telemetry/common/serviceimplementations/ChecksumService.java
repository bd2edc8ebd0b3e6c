package com.indigententerprises.telemetry.common.serviceimplementations;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content digest of the supervised executable, as lowercase hex.
 */
public final class ChecksumService {

    public static final String ALGORITHM = "SHA-512/224";

    public String compute(final Path executable) throws IOException {
        final MessageDigest digest = newDigest();
        final byte[] buffer = new byte[8192];

        try (InputStream in = Files.newInputStream(executable)) {
            // mutable data
            int count;

            while ((count = in.read(buffer)) != -1) {
                digest.update(buffer, 0, count);
            }
        }

        return HexFormat.of().formatHex(digest.digest());
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " is not available", e);
        }
    }
}
