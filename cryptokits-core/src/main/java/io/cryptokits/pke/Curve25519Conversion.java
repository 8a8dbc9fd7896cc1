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

package io.cryptokits.pke;

import java.math.BigInteger;
import java.util.Arrays;

import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;

import io.cryptokits.KeyFormatException;
import io.cryptokits.crypto.CryptoUtils;
import io.cryptokits.crypto.DigestAlgorithm;

/**
 * Maps Ed25519 keys onto the birationally equivalent X25519 keys, so that an Edwards signing key can also be used
 * for Montgomery Diffie-Hellman. Keys are exchanged as raw 32-byte little-endian arrays.
 */
final class Curve25519Conversion {
    private static final BigInteger P = BigInteger.TWO.pow(255).subtract(BigInteger.valueOf(19));
    static final int KEY_SIZE = 32;

    /**
     * u = (1 + y) / (1 - y) mod p, where y is the Edwards y-coordinate.
     */
    static byte[] toX25519(Ed25519PublicKeyParameters publicKey) {
        var encoded = publicKey.getEncoded();
        encoded[KEY_SIZE - 1] &= 0x7f;
        var y = CryptoUtils.fromUnsignedLittleEndian(encoded).mod(P);
        var denominator = BigInteger.ONE.subtract(y).mod(P);
        if (denominator.signum() == 0) {
            throw new KeyFormatException("Ed25519 public key has no Montgomery form");
        }
        var u = BigInteger.ONE.add(y).multiply(denominator.modInverse(P)).mod(P);
        return CryptoUtils.toUnsignedLittleEndian(u, KEY_SIZE);
    }

    /**
     * The X25519 scalar is the first half of SHA-512 of the Ed25519 seed. Clamping is applied by X25519 itself.
     * The caller wipes the returned scalar.
     */
    static byte[] toX25519Scalar(byte[] seed) {
        var hash = DigestAlgorithm.SHA512.hash(seed);
        try {
            return Arrays.copyOf(hash, KEY_SIZE);
        } finally {
            CryptoUtils.wipe(hash);
        }
    }

    private Curve25519Conversion() {}
}
