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

import static java.util.Objects.requireNonNull;

import java.util.Arrays;

import javax.crypto.SecretKey;

/**
 * A {@link SecretKey} over a private copy of the key bytes that is zero-filled by {@link #destroy()}. AES keys and
 * HMAC keys (HKDF salts and pseudorandom keys) are wrapped in one of these for the duration of a single operation.
 */
public final class DestroyableSecretKey implements SecretKey, AutoCloseable {

    private final String algorithm;
    private final byte[] keyBytes;
    private volatile boolean destroyed;

    public DestroyableSecretKey(byte[] key, String algorithm) {
        this.algorithm = requireNonNull(algorithm, "algorithm");
        this.keyBytes = requireNonNull(key, "key").clone();
    }

    @Override
    public String getAlgorithm() {
        return algorithm;
    }

    @Override
    public String getFormat() {
        return "RAW";
    }

    @Override
    public byte[] getEncoded() {
        return getKeyBytes().clone();
    }

    /**
     * The live key bytes, for callers in this package that feed them straight into a primitive.
     */
    byte[] getKeyBytes() {
        if (destroyed) {
            throw new IllegalStateException("Key has been destroyed");
        }
        return keyBytes;
    }

    @Override
    public void destroy() {
        CryptoUtils.wipe(keyBytes);
        destroyed = true;
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public void close() {
        destroy();
    }

    @Override
    public String toString() {
        return algorithm + " key (" + keyBytes.length * 8 + " bits" + (destroyed ? ", destroyed)" : ")");
    }
}
