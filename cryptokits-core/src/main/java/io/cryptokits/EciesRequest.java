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

package io.cryptokits;

import static java.util.Objects.requireNonNull;

import io.cryptokits.crypto.DigestAlgorithm;
import io.cryptokits.crypto.Kdf;
import io.cryptokits.keys.KeyFamily;
import io.cryptokits.keys.KeyFormat;

/**
 * @param family the curve of the key, or {@code null} to detect it from a Weierstrass curve key.
 * @param key the recipient public key for encryption, or the recipient private key for decryption.
 * @param format the format of the key.
 * @param kdf the KDF applied to the shared secret.
 * @param digest the digest the KDF is instantiated with.
 * @param salt the KDF salt, or {@code null} for the built-in one.
 * @param info the KDF context info, or {@code null}.
 * @param aad associated data authenticated with the payload, or {@code null}.
 * @param input the plaintext, or the envelope to decrypt.
 * @param forEncryption whether to encrypt or decrypt.
 * @param outputEncoding the text encoding of the result.
 */
public record EciesRequest(KeyFamily family, EncodedText key, KeyFormat format, Kdf kdf, DigestAlgorithm digest,
                           EncodedText salt, EncodedText info, EncodedText aad, EncodedText input,
                           boolean forEncryption, TextEncoding outputEncoding) {
    public EciesRequest {
        requireNonNull(key, "key");
        requireNonNull(format, "format");
        requireNonNull(kdf, "kdf");
        requireNonNull(digest, "digest");
        requireNonNull(input, "input");
        requireNonNull(outputEncoding, "outputEncoding");
    }
}
