/*
 * Copyright 2024 Neil Madden.
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

package io.cryptokits.crypto;

import java.math.BigInteger;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * Byte-level helpers shared by the cipher, KDF and key codec layers.
 */
public final class CryptoUtils {
    private static final SecureRandom SECURE_RANDOM;

    static {
        SecureRandom random;
        try {
            random = SecureRandom.getInstance("NativePRNGNonBlocking");
        } catch (NoSuchAlgorithmException e) {
            random = new SecureRandom();
        }
        SECURE_RANDOM = random;
    }

    public static SecureRandom secureRandom() {
        return SECURE_RANDOM;
    }

    public static byte[] randomBytes(int numBytes) {
        byte[] bytes = new byte[numBytes];
        SECURE_RANDOM.nextBytes(bytes);
        return bytes;
    }

    public static void wipe(byte[]... data) {
        for (var datum : data) {
            if (datum != null) {
                Arrays.fill(datum, (byte) 0);
            }
        }
    }

    public static byte[] concat(byte[]... elements) {
        int totalSize = Arrays.stream(elements).mapToInt(b -> b.length).reduce(0, Math::addExact);
        byte[] result = new byte[totalSize];
        int offset = 0;
        for (var element : elements) {
            System.arraycopy(element, 0, result, offset, element.length);
            offset += element.length;
        }
        return result;
    }

    public static byte[] reverseInPlace(byte[] input) {
        int len = input.length;
        for (int i = 0; i < len / 2; ++i) {
            byte tmp = input[i];
            input[i] = input[len - i - 1];
            input[len - i - 1] = tmp;
        }
        return input;
    }

    /**
     * Encodes a non-negative integer as exactly {@code size} little-endian bytes, dropping any sign byte.
     */
    public static byte[] toUnsignedLittleEndian(BigInteger value, int size) {
        var bigEndian = value.toByteArray();
        var littleEndian = reverseInPlace(bigEndian);
        return Arrays.copyOf(littleEndian, size);
    }

    public static BigInteger fromUnsignedLittleEndian(byte[] littleEndian) {
        return new BigInteger(1, reverseInPlace(littleEndian.clone()));
    }

    private CryptoUtils() {}
}
