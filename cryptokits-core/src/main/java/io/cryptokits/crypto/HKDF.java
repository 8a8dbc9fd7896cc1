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

import io.cryptokits.RequestValidationException;

/**
 * HKDF (RFC 5869) over any {@link DigestAlgorithm}.
 */
final class HKDF {

    static DestroyableSecretKey extract(DigestAlgorithm digest, byte[] salt, byte[] inputKeyMaterial) {
        // An empty salt is equivalent to a string of HashLen zeroes once HMAC pads the key
        var saltBytes = salt.length == 0 ? new byte[digest.outputSizeBytes()] : salt;
        try (var key = new DestroyableSecretKey(saltBytes, digest.hmacAlgorithmName())) {
            var prk = digest.hmac(key, inputKeyMaterial);
            try {
                return new DestroyableSecretKey(prk, digest.hmacAlgorithmName());
            } finally {
                CryptoUtils.wipe(prk);
            }
        }
    }

    static byte[] expand(DigestAlgorithm digest, DestroyableSecretKey prk, byte[] context, int outputSizeBytes) {
        int blockSize = digest.outputSizeBytes();
        int rounds = (outputSizeBytes + blockSize - 1) / blockSize;
        if (rounds > 255) {
            throw new RequestValidationException("HKDF output size must be <= " + 255 * blockSize + " bytes");
        }
        byte[] lastBlock = new byte[0];
        byte[] counter = new byte[] { 1 };
        var out = new byte[outputSizeBytes];
        int offset = 0;
        while (offset < outputSizeBytes) {
            var previous = lastBlock;
            lastBlock = digest.hmac(prk, previous, context, counter);
            CryptoUtils.wipe(previous);
            System.arraycopy(lastBlock, 0, out, offset, Math.min(blockSize, outputSizeBytes - offset));
            offset += blockSize;
            counter[0]++;
        }
        CryptoUtils.wipe(lastBlock);
        return out;
    }

    static byte[] deriveBytes(DigestAlgorithm digest, byte[] inputKeyMaterial, byte[] salt, byte[] info,
                              int outputSizeBytes) {
        try (var prk = extract(digest, salt, inputKeyMaterial)) {
            return expand(digest, prk, info, outputSizeBytes);
        }
    }

    private HKDF() {}
}
