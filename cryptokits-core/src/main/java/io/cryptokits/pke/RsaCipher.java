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

package io.cryptokits.pke;

import static java.util.Objects.requireNonNull;

import org.bouncycastle.crypto.AsymmetricBlockCipher;
import org.bouncycastle.crypto.DataLengthException;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.encodings.OAEPEncoding;
import org.bouncycastle.crypto.encodings.PKCS1Encoding;
import org.bouncycastle.crypto.engines.RSABlindedEngine;
import org.bouncycastle.crypto.params.ParametersWithRandom;

import io.cryptokits.DecryptionFailedException;
import io.cryptokits.RedactedLogger;
import io.cryptokits.RequestValidationException;
import io.cryptokits.UnsupportedAlgorithmException;
import io.cryptokits.crypto.CryptoUtils;
import io.cryptokits.crypto.DigestAlgorithm;
import io.cryptokits.keys.KeyFamily;
import io.cryptokits.keys.PrivateKeyHandle;
import io.cryptokits.keys.PublicKeyHandle;

/**
 * RSA encryption with PKCS#1 v1.5 or OAEP padding. The OAEP digest and MGF1 digest default to SHA-256.
 */
public final class RsaCipher {
    private static final RedactedLogger logger = RedactedLogger.getLogger(RsaCipher.class);

    public static byte[] encrypt(PublicKeyHandle key, RsaPadding padding, DigestAlgorithm digest,
                                 DigestAlgorithm mgfDigest, byte[] plaintext) {
        requireNonNull(plaintext, "plaintext");
        checkFamily(key.family());
        var cipher = newCipher(padding, digest, mgfDigest);
        cipher.init(true, new ParametersWithRandom(key.keyParameters(), CryptoUtils.secureRandom()));
        if (plaintext.length > cipher.getInputBlockSize()) {
            throw new RequestValidationException("Plaintext of " + plaintext.length + " bytes is too long for "
                    + padding + " with this key (maximum " + cipher.getInputBlockSize() + ")");
        }
        try {
            return cipher.processBlock(plaintext, 0, plaintext.length);
        } catch (InvalidCipherTextException e) {
            throw new IllegalStateException("RSA encryption failed", e);
        }
    }

    public static byte[] decrypt(PrivateKeyHandle key, RsaPadding padding, DigestAlgorithm digest,
                                 DigestAlgorithm mgfDigest, byte[] ciphertext) {
        requireNonNull(ciphertext, "ciphertext");
        checkFamily(key.family());
        var cipher = newCipher(padding, digest, mgfDigest);
        cipher.init(false, new ParametersWithRandom(key.keyParameters(), CryptoUtils.secureRandom()));
        try {
            return cipher.processBlock(ciphertext, 0, ciphertext.length);
        } catch (InvalidCipherTextException | DataLengthException e) {
            logger.debug("RSA {} decryption failed", padding);
            throw new DecryptionFailedException();
        }
    }

    private static AsymmetricBlockCipher newCipher(RsaPadding padding, DigestAlgorithm digest,
                                                   DigestAlgorithm mgfDigest) {
        logger.debug("RSA cipher with {} padding", padding);
        return switch (padding) {
            case PKCS1_V15 -> new PKCS1Encoding(new RSABlindedEngine());
            case OAEP -> {
                var hash = digest == null ? DigestAlgorithm.SHA256 : digest;
                var mgf = mgfDigest == null ? DigestAlgorithm.SHA256 : mgfDigest;
                yield new OAEPEncoding(new RSABlindedEngine(), hash.newDigest(), mgf.newDigest(), null);
            }
        };
    }

    private static void checkFamily(KeyFamily family) {
        if (family != KeyFamily.RSA) {
            throw new UnsupportedAlgorithmException("RSA encryption requires an RSA key, not " + family);
        }
    }

    private RsaCipher() {}
}
