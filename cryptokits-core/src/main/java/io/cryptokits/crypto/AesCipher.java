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

import java.security.GeneralSecurityException;
import java.security.NoSuchAlgorithmException;

import javax.crypto.Cipher;
import javax.crypto.NoSuchPaddingException;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.IvParameterSpec;

import io.cryptokits.DecryptionFailedException;
import io.cryptokits.RedactedLogger;
import io.cryptokits.RequestValidationException;
import io.cryptokits.UnsupportedAlgorithmException;

/**
 * AES in ECB, CBC or GCM mode. Stateless: every call validates its parameters, builds a fresh JCA cipher and
 * discards it.
 */
public final class AesCipher {
    private static final RedactedLogger logger = RedactedLogger.getLogger(AesCipher.class);

    public static final int BLOCK_SIZE = 16;
    public static final int GCM_TAG_BITS = 128;

    /**
     * Encrypts or decrypts {@code input}.
     *
     * @param mode the block cipher mode.
     * @param padding the padding scheme. Must be {@link Padding#NONE} for GCM.
     * @param key the AES key: 16 bytes for AES-128 or 32 bytes for AES-256.
     * @param iv the IV or nonce, exactly {@link BlockMode#ivSize()} bytes, or {@code null} for ECB.
     * @param aad associated data for GCM, or {@code null}.
     * @param input the plaintext or ciphertext. For GCM decryption the tag is the last 16 bytes.
     * @param forEncryption whether to encrypt or decrypt.
     * @return the output bytes.
     * @throws UnsupportedAlgorithmException if the key is not 16 or 32 bytes.
     * @throws RequestValidationException if the IV, AAD or padding does not suit the mode.
     * @throws DecryptionFailedException if authentication or unpadding fails during decryption.
     */
    public static byte[] cipher(BlockMode mode, Padding padding, byte[] key, byte[] iv, byte[] aad, byte[] input,
                                boolean forEncryption) {
        if (key == null || (key.length != 16 && key.length != 32)) {
            throw new UnsupportedAlgorithmException("AES key size " + (key == null ? 0 : key.length * 8) + " bits");
        }
        validate(mode, padding, iv, aad, input);
        if (!forEncryption && padding == Padding.PKCS7 && (input.length == 0 || input.length % BLOCK_SIZE != 0)) {
            // JCA unpads an empty input to an empty plaintext
            logger.debug("AES-{} ciphertext of {} bytes is not a whole number of blocks", mode, input.length);
            throw new DecryptionFailedException();
        }
        logger.debug("AES-{}-{} {} with {}, {} input bytes", key.length * 8, mode,
                forEncryption ? "encrypt" : "decrypt", padding, input.length);

        try (var secretKey = new DestroyableSecretKey(key, "AES")) {
            var cipher = newCipher(mode, padding);
            int opmode = forEncryption ? Cipher.ENCRYPT_MODE : Cipher.DECRYPT_MODE;
            switch (mode) {
                case ECB -> cipher.init(opmode, secretKey);
                case CBC -> cipher.init(opmode, secretKey, new IvParameterSpec(iv));
                case GCM -> {
                    cipher.init(opmode, secretKey, new GCMParameterSpec(GCM_TAG_BITS, iv));
                    if (aad != null) {
                        cipher.updateAAD(aad);
                    }
                }
            }
            return cipher.doFinal(input);
        } catch (GeneralSecurityException e) {
            if (!forEncryption) {
                logger.debug("AES-{} decryption failed", mode);
                throw new DecryptionFailedException();
            }
            throw new IllegalStateException("AES-" + mode + " encryption failed", e);
        }
    }

    /**
     * Generates a random AES key of 128 or 256 bits.
     */
    public static byte[] generateKey(int keySizeBits) {
        if (keySizeBits != 128 && keySizeBits != 256) {
            throw new UnsupportedAlgorithmException("AES key size " + keySizeBits + " bits");
        }
        return CryptoUtils.randomBytes(keySizeBits / 8);
    }

    private static void validate(BlockMode mode, Padding padding, byte[] iv, byte[] aad, byte[] input) {
        if (mode.ivSize() == 0 && iv != null) {
            throw new RequestValidationException(mode + " mode does not take an IV");
        }
        if (mode.ivSize() > 0 && (iv == null || iv.length != mode.ivSize())) {
            throw new RequestValidationException(mode + " mode requires a " + mode.ivSize() + "-byte IV");
        }
        if (!mode.isPadded() && padding != Padding.NONE) {
            throw new RequestValidationException(mode + " mode does not use padding");
        }
        if (mode != BlockMode.GCM && aad != null && aad.length > 0) {
            throw new RequestValidationException("Associated data is only supported in GCM mode");
        }
        if (mode.isPadded() && padding == Padding.NONE && input.length % BLOCK_SIZE != 0) {
            throw new RequestValidationException("Input must be a multiple of " + BLOCK_SIZE
                    + " bytes without padding");
        }
    }

    private static Cipher newCipher(BlockMode mode, Padding padding) {
        try {
            return Cipher.getInstance("AES/" + mode + "/" + padding.jcaName());
        } catch (NoSuchAlgorithmException | NoSuchPaddingException e) {
            throw new AssertionError("AES-" + mode + " not implemented by JVM", e);
        }
    }

    private AesCipher() {}
}
