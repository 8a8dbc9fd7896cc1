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

/**
 * Block cipher modes of operation, together with the IV each one needs.
 */
public enum BlockMode {
    /** Each block enciphered independently. Takes no IV. */
    ECB(0, true),
    /** Cipher block chaining with a 16-byte IV. */
    CBC(16, true),
    /** Galois/counter mode with a 12-byte nonce and a 16-byte tag appended to the ciphertext. */
    GCM(12, false);

    private final int ivSize;
    private final boolean padded;

    BlockMode(int ivSize, boolean padded) {
        this.ivSize = ivSize;
        this.padded = padded;
    }

    /**
     * The exact IV length in bytes, or 0 if the mode takes no IV.
     */
    public int ivSize() {
        return ivSize;
    }

    /**
     * Whether the mode operates on whole blocks and so needs a {@link Padding} scheme.
     */
    public boolean isPadded() {
        return padded;
    }
}
