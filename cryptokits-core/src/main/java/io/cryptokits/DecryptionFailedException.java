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

/**
 * Thrown when decryption fails for any reason: wrong key, corrupted or tampered ciphertext, or invalid padding. The
 * message is always the same and no cause is attached, so that callers cannot tell the reasons apart.
 */
public final class DecryptionFailedException extends CryptoKitsException {

    public DecryptionFailedException() {
        super("decryption failed");
    }
}
