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

import io.cryptokits.keys.KeyFamily;
import io.cryptokits.keys.KeyFormat;

/**
 * @param family the key family to generate.
 * @param rsaKeySize the modulus size for RSA keys (1024, 2048, 3072 or 4096). Ignored for other families.
 * @param format the private key format. The public key is written in its counterpart container.
 * @param outputEncoding the text encoding of both keys. Use UTF8 for PEM.
 */
public record KeyGenerationRequest(KeyFamily family, int rsaKeySize, KeyFormat format, TextEncoding outputEncoding) {
    public KeyGenerationRequest {
        requireNonNull(family, "family");
        requireNonNull(format, "format");
        requireNonNull(outputEncoding, "outputEncoding");
    }
}
