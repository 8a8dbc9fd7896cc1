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

import java.util.Arrays;

/**
 * A freshly generated key pair in its requested encoding. Closing it wipes the private key bytes.
 */
public record EncodedKeyPair(KeyFormat privateFormat, byte[] privateKey, KeyFormat publicFormat, byte[] publicKey)
        implements AutoCloseable {

    @Override
    public void close() {
        Arrays.fill(privateKey, (byte) 0);
    }

    @Override
    public String toString() {
        return "EncodedKeyPair{privateFormat=" + privateFormat + ", publicFormat=" + publicFormat + "}";
    }
}
