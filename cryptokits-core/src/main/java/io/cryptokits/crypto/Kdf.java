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

import static io.cryptokits.crypto.KdfConstants.PBKDF2_ITERATIONS;

import java.util.Objects;

import org.bouncycastle.crypto.agreement.kdf.ConcatenationKDFGenerator;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.generators.SCrypt;
import org.bouncycastle.crypto.params.KDFParameters;
import org.bouncycastle.crypto.params.KeyParameter;

import io.cryptokits.RedactedLogger;
import io.cryptokits.RequestValidationException;

/**
 * Key derivation functions. Every function is generic over the {@link DigestAlgorithm} (Scrypt ignores it) and
 * produces exactly the requested number of bytes in a single call, expanding internally where the output is longer
 * than one digest block.
 */
public enum Kdf {
    /**
     * HKDF extract-then-expand. Absent salt and info are treated as empty.
     */
    HKDF {
        @Override
        byte[] doDerive(DigestAlgorithm digest, byte[] ikm, byte[] salt, byte[] info, int outputLength,
                      int iterations) {
            return io.cryptokits.crypto.HKDF.deriveBytes(digest, ikm, orEmpty(salt), orEmpty(info), outputLength);
        }
    },
    /**
     * Single-step KDF from NIST SP 800-56A: Hash(counter || Z || OtherInfo), repeated. The info is the only context
     * input; there is no salt.
     */
    CONCATENATION {
        @Override
        byte[] doDerive(DigestAlgorithm digest, byte[] ikm, byte[] salt, byte[] info, int outputLength,
                      int iterations) {
            if (salt != null) {
                logger.debug("Concatenation KDF has no salt input, ignoring the supplied salt");
            }
            var generator = new ConcatenationKDFGenerator(digest.newDigest());
            generator.init(new KDFParameters(ikm, orEmpty(info)));
            var out = new byte[outputLength];
            generator.generateBytes(out, 0, outputLength);
            return out;
        }
    },
    /**
     * PBKDF2 with HMAC over the digest. Requires a salt.
     */
    PBKDF2 {
        @Override
        byte[] doDerive(DigestAlgorithm digest, byte[] ikm, byte[] salt, byte[] info, int outputLength,
                      int iterations) {
            requireSalt(salt);
            var generator = new PKCS5S2ParametersGenerator(digest.newDigest());
            generator.init(ikm, salt, iterations);
            var key = (KeyParameter) generator.generateDerivedParameters(outputLength * 8);
            return key.getKey();
        }
    },
    /**
     * Scrypt with the recommended cost parameters (N = 2^17, r = 8, p = 1). Requires a salt.
     */
    SCRYPT {
        @Override
        byte[] doDerive(DigestAlgorithm digest, byte[] ikm, byte[] salt, byte[] info, int outputLength,
                      int iterations) {
            requireSalt(salt);
            return SCrypt.generate(ikm, salt, 1 << KdfConstants.SCRYPT_LOG_N, KdfConstants.SCRYPT_R,
                    KdfConstants.SCRYPT_P, outputLength);
        }
    };

    private static final RedactedLogger logger = RedactedLogger.getLogger(Kdf.class);

    /**
     * Derives {@code outputLength} bytes from the input key material.
     *
     * @param digest the hash function to instantiate the KDF with.
     * @param ikm the input key material (a password for PBKDF2 and Scrypt).
     * @param salt the salt, or {@code null} if absent. Required by {@link #PBKDF2} and {@link #SCRYPT}.
     * @param info the context info, or {@code null} if absent. Ignored by PBKDF2 and Scrypt.
     * @param outputLength the number of bytes to produce.
     * @return the derived bytes. The caller owns the array and should wipe it after use.
     * @throws RequestValidationException if a required salt is missing or the output length is out of range.
     */
    public byte[] derive(DigestAlgorithm digest, byte[] ikm, byte[] salt, byte[] info, int outputLength) {
        return derive(digest, ikm, salt, info, outputLength, PBKDF2_ITERATIONS);
    }

    /**
     * Derives the key material for one ECIES message from an ECDH shared secret: {@link
     * KdfConstants#ECIES_KEY_SIZE} bytes of AES-256 key followed by a {@link KdfConstants#ECIES_NONCE_SIZE}-byte GCM
     * nonce. PBKDF2 runs with {@link KdfConstants#ECIES_PBKDF2_ITERATIONS} iterations on this path, and an absent
     * salt is replaced by {@link KdfConstants#eciesDefaultSalt()}.
     */
    public byte[] deriveEciesKeyMaterial(DigestAlgorithm digest, byte[] sharedSecret, byte[] salt, byte[] info) {
        var effectiveSalt = salt == null || salt.length == 0 ? KdfConstants.eciesDefaultSalt() : salt;
        return derive(digest, sharedSecret, effectiveSalt, info, KdfConstants.ECIES_OUTPUT_SIZE,
                KdfConstants.ECIES_PBKDF2_ITERATIONS);
    }

    /**
     * As {@link #derive(DigestAlgorithm, byte[], byte[], byte[], int)} but with an explicit PBKDF2 iteration count.
     */
    byte[] derive(DigestAlgorithm digest, byte[] ikm, byte[] salt, byte[] info, int outputLength, int iterations) {
        Objects.requireNonNull(digest, "digest");
        Objects.requireNonNull(ikm, "ikm");
        if (outputLength <= 0) {
            throw new RequestValidationException("KDF output length must be positive");
        }
        logger.debug("Deriving {} bytes with {} over {}", outputLength, this, digest);
        return doDerive(digest, ikm, salt, info, outputLength, iterations);
    }

    abstract byte[] doDerive(DigestAlgorithm digest, byte[] ikm, byte[] salt, byte[] info, int outputLength,
                           int iterations);

    private static byte[] orEmpty(byte[] value) {
        return value == null ? new byte[0] : value;
    }

    private static void requireSalt(byte[] salt) {
        if (salt == null || salt.length == 0) {
            throw new RequestValidationException("A salt is required for this key derivation function");
        }
    }
}
