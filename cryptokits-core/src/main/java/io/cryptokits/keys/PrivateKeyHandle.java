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

import static java.util.Objects.requireNonNull;

import java.util.Arrays;

import javax.security.auth.Destroyable;

import org.bouncycastle.crypto.params.AsymmetricKeyParameter;

import io.cryptokits.UnsupportedAlgorithmException;

/**
 * An imported private key, held in canonical PKCS#8 DER form. The key bytes are wiped when the handle is destroyed,
 * so handles should be used in a try-with-resources block.
 */
public final class PrivateKeyHandle implements Destroyable, AutoCloseable {
    private final KeyFamily family;
    private final byte[] pkcs8;
    private volatile boolean destroyed;

    PrivateKeyHandle(KeyFamily family, byte[] pkcs8) {
        this.family = requireNonNull(family, "family");
        this.pkcs8 = requireNonNull(pkcs8, "pkcs8");
    }

    public KeyFamily family() {
        return family;
    }

    /**
     * Decodes an RSA or Weierstrass curve key into BouncyCastle lightweight parameters. The caller owns the returned
     * object. Curve25519 keys are not available in this form; use {@link #ed25519Seed()}.
     *
     * @throws UnsupportedAlgorithmException for {@link KeyFamily#CURVE25519} keys.
     */
    public AsymmetricKeyParameter keyParameters() {
        return family.codec().privateParameters(pkcs8());
    }

    /**
     * Returns a copy of the 32-byte Ed25519 seed of a Curve25519 key. The caller must wipe the returned array.
     *
     * @throws UnsupportedAlgorithmException if this is not a Curve25519 key.
     */
    public byte[] ed25519Seed() {
        if (family != KeyFamily.CURVE25519) {
            throw new UnsupportedAlgorithmException(family + " keys have no Ed25519 seed");
        }
        return Ed25519KeyCodec.seedFromPkcs8(pkcs8());
    }

    byte[] pkcs8() {
        if (destroyed) {
            throw new IllegalStateException("Key has been destroyed");
        }
        return pkcs8;
    }

    @Override
    public void destroy() {
        destroyed = true;
        Arrays.fill(pkcs8, (byte) 0);
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
        return "PrivateKeyHandle{family=" + family + (destroyed ? ", destroyed" : "") + "}";
    }
}
