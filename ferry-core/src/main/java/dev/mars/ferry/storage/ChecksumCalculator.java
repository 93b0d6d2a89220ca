/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.ferry.storage;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Incremental SHA-256 over a byte stream that also counts the bytes fed to it.
 *
 * <p>The uploader feeds every buffer it writes to the connection into one calculator,
 * so {@link #getChecksum()} and {@link #getByteCount()} describe exactly the bytes
 * that went over the wire. Instances are not thread-safe and are single-use: after
 * {@link #getChecksum()} the calculator starts over.</p>
 */
public class ChecksumCalculator {
    public static final String ALGORITHM = "SHA-256";
    private static final int BUFFER_SIZE = 8192;

    private final MessageDigest digest;
    private long byteCount;

    public ChecksumCalculator() {
        this.digest = newDigest();
    }

    /**
     * Update the checksum with a portion of a buffer
     */
    public void update(byte[] data, int offset, int length) {
        digest.update(data, offset, length);
        byteCount += length;
    }

    /**
     * Number of bytes fed in since creation or the last {@link #getChecksum()}
     */
    public long getByteCount() {
        return byteCount;
    }

    /**
     * Lower-case hex digest of everything fed in so far. Resets the calculator.
     */
    public String getChecksum() {
        byteCount = 0;
        return bytesToHex(digest.digest());
    }

    /**
     * Digest of a whole file, read in the same buffer size the uploader uses.
     */
    public static String calculateFileChecksum(Path filePath) throws IOException {
        ChecksumCalculator calculator = new ChecksumCalculator();
        try (InputStream in = Files.newInputStream(filePath)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = in.read(buffer)) != -1) {
                calculator.update(buffer, 0, read);
            }
        }
        return calculator.getChecksum();
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // every JDK ships SHA-256
            throw new IllegalStateException("Unsupported checksum algorithm: " + ALGORITHM, e);
        }
    }

    private static String bytesToHex(byte[] bytes) {
        StringBuilder result = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            result.append(String.format("%02x", b));
        }
        return result.toString();
    }

    @Override
    public String toString() {
        return "ChecksumCalculator{algorithm='" + ALGORITHM + "', bytes=" + byteCount + "}";
    }
}
