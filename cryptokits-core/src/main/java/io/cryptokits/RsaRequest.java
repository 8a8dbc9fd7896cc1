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
import io.cryptokits.keys.KeyFormat;
import io.cryptokits.pke.RsaPadding;

/**
 * @param key a public key (SPKI or PKCS#1) for encryption or a private key (PKCS#8 or PKCS#1) for decryption.
 * @param format the format of the key.
 * @param padding the encryption padding.
 * @param digest the OAEP digest, or {@code null} for SHA-256. Ignored for PKCS#1 v1.5.
 * @param mgfDigest the MGF1 digest, or {@code null} for SHA-256. Ignored for PKCS#1 v1.5.
 * @param input the plaintext or ciphertext.
 * @param forEncryption whether to encrypt or decrypt.
 * @param outputEncoding the text encoding of the result.
 */
public record RsaRequest(EncodedText key, KeyFormat format, RsaPadding padding, DigestAlgorithm digest,
                         DigestAlgorithm mgfDigest, EncodedText input, boolean forEncryption,
                         TextEncoding outputEncoding) {
    public RsaRequest {
        requireNonNull(key, "key");
        requireNonNull(format, "format");
        requireNonNull(padding, "padding");
        requireNonNull(input, "input");
        requireNonNull(outputEncoding, "outputEncoding");
    }
}
