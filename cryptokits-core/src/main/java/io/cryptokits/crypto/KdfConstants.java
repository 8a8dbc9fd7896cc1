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

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Fixed tuning values for key derivation. These are part of the interoperable format of ECIES envelopes and of the
 * standalone KDF output, so they are not configurable.
 */
public final class KdfConstants {
    /** PBKDF2 iterations for the standalone key derivation call. */
    public static final int PBKDF2_ITERATIONS = 600_000;

    /** PBKDF2 iterations used when ECIES stretches the ECDH shared secret. */
    public static final int ECIES_PBKDF2_ITERATIONS = 210_000;

    /** log2 of the Scrypt CPU/memory cost N. */
    public static final int SCRYPT_LOG_N = 17;
    public static final int SCRYPT_R = 8;
    public static final int SCRYPT_P = 1;

    /** Bytes derived per ECIES message: a 32-byte AES-256 key followed by a 12-byte GCM nonce. */
    public static final int ECIES_KEY_SIZE = 32;
    public static final int ECIES_NONCE_SIZE = 12;
    public static final int ECIES_OUTPUT_SIZE = ECIES_KEY_SIZE + ECIES_NONCE_SIZE;

    private static final byte[] ECIES_DEFAULT_SALT = "VSPDJrx1Pj1zqVGN".getBytes(UTF_8);

    /** Salt applied to the ECIES key derivation when the caller supplies none. */
    public static byte[] eciesDefaultSalt() {
        return ECIES_DEFAULT_SALT.clone();
    }

    private KdfConstants() {}
}
