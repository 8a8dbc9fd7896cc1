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

import io.cryptokits.crypto.BlockMode;
import io.cryptokits.crypto.Padding;

/**
 * @param mode the block cipher mode.
 * @param padding the padding. GCM only accepts {@link Padding#NONE}.
 * @param key the AES-128 or AES-256 key.
 * @param iv the IV (CBC) or nonce (GCM), or {@code null} for ECB.
 * @param aad GCM associated data, or {@code null}.
 * @param input the plaintext or ciphertext.
 * @param forEncryption whether to encrypt or decrypt.
 * @param outputEncoding the text encoding of the result.
 */
public record AesRequest(BlockMode mode, Padding padding, EncodedText key, EncodedText iv, EncodedText aad,
                         EncodedText input, boolean forEncryption, TextEncoding outputEncoding) {
    public AesRequest {
        requireNonNull(mode, "mode");
        requireNonNull(padding, "padding");
        requireNonNull(key, "key");
        requireNonNull(input, "input");
        requireNonNull(outputEncoding, "outputEncoding");
    }
}
