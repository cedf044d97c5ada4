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
package dev.mars.arbor.storage;

import dev.mars.arbor.core.BlockIterator;
import dev.mars.arbor.core.exceptions.ArborException;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Incremental digest over node content. Fed block by block so a node is never
 * held in memory whole.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class ChecksumCalculator {
    public static final String DEFAULT_ALGORITHM = "SHA-256";

    private final MessageDigest digest;
    private final String algorithm;

    public ChecksumCalculator() {
        this(DEFAULT_ALGORITHM);
    }

    /**
     * @throws IllegalArgumentException if the JDK has no provider for {@code algorithm}
     */
    public ChecksumCalculator(String algorithm) {
        this.algorithm = algorithm;
        try {
            this.digest = MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalArgumentException("Unsupported checksum algorithm: " + algorithm, e);
        }
    }

    public void update(byte[] data) {
        digest.update(data);
    }

    public void update(byte[] data, int offset, int length) {
        digest.update(data, offset, length);
    }

    /**
     * Finishes the digest and returns it as lower-case hex. Resets the calculator.
     */
    public String getChecksum() {
        return bytesToHex(digest.digest());
    }

    /**
     * Drains {@code blocks} into a fresh digest. Does not close the iterator.
     */
    public static String calculate(BlockIterator blocks, String algorithm) throws ArborException {
        ChecksumCalculator calculator = new ChecksumCalculator(algorithm);
        while (blocks.hasNext()) {
            calculator.update(blocks.next());
        }
        return calculator.getChecksum();
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public static boolean isAlgorithmSupported(String algorithm) {
        try {
            MessageDigest.getInstance(algorithm);
            return true;
        } catch (NoSuchAlgorithmException e) {
            return false;
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
        return "ChecksumCalculator{algorithm='" + algorithm + "'}";
    }
}
