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

package io.cryptokits.keys;

import java.util.OptionalInt;

/**
 * What {@link KeyParser} found out about a key blob.
 *
 * @param family the algorithm family, including the curve for EC keys.
 * @param format the container and serialization the key is written in.
 * @param isPublic whether the blob holds a public key.
 * @param rsaModulusBits the modulus size of an RSA key, or empty for other families.
 */
public record KeyInfo(KeyFamily family, KeyFormat format, boolean isPublic, OptionalInt rsaModulusBits) {
}
