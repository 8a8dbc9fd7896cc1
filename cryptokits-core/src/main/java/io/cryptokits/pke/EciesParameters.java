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

import io.cryptokits.crypto.DigestAlgorithm;
import io.cryptokits.crypto.Kdf;

/**
 * Key derivation and AEAD settings for one ECIES message. Encryption and decryption must use identical parameters.
 *
 * @param kdf the key derivation function applied to the ECDH shared secret.
 * @param digest the digest the KDF is instantiated with.
 * @param salt the KDF salt, or {@code null} for the built-in ECIES salt.
 * @param info the KDF context info, or {@code null} for none.
 * @param aead the payload cipher.
 * @param aad associated data authenticated with the payload, or {@code null} for none.
 */
public record EciesParameters(Kdf kdf, DigestAlgorithm digest, byte[] salt, byte[] info, EciesAead aead,
                              byte[] aad) {
    public EciesParameters {
        requireNonNull(kdf, "kdf");
        requireNonNull(digest, "digest");
        requireNonNull(aead, "aead");
    }

    public EciesParameters(Kdf kdf, DigestAlgorithm digest) {
        this(kdf, digest, null, null, EciesAead.AES_256_GCM, null);
    }

    /**
     * PBKDF2-HMAC-SHA512 with the built-in salt and AES-256-GCM.
     */
    public static EciesParameters defaults() {
        return new EciesParameters(Kdf.PBKDF2, DigestAlgorithm.SHA512);
    }
}
