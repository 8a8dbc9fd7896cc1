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

public record DerivePublicKeyRequest(KeyFamily family, EncodedText privateKey, KeyFormat format,
                                     TextEncoding outputEncoding) {
    public DerivePublicKeyRequest {
        requireNonNull(family, "family");
        requireNonNull(privateKey, "privateKey");
        requireNonNull(format, "format");
        requireNonNull(outputEncoding, "outputEncoding");
    }
}
