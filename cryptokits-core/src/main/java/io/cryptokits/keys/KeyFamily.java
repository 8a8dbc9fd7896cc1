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

import java.util.List;
import java.util.Optional;

/**
 * Algorithm family of an asymmetric key. The order of the elliptic curve constants is the order in which curves are
 * tried when sniffing a key of unknown curve.
 */
public enum KeyFamily {
    RSA(null),
    NIST_P256(EccCurve.NIST_P256),
    NIST_P384(EccCurve.NIST_P384),
    NIST_P521(EccCurve.NIST_P521),
    SECP256K1(EccCurve.SECP256K1),
    SM2(EccCurve.SM2),
    /** Curve25519 in its Edwards (Ed25519) signing form. */
    CURVE25519(null);

    private final EccCurve eccCurve;

    KeyFamily(EccCurve eccCurve) {
        this.eccCurve = eccCurve;
    }

    /**
     * The Weierstrass curve for elliptic curve families, or empty for RSA and Curve25519.
     */
    public Optional<EccCurve> eccCurve() {
        return Optional.ofNullable(eccCurve);
    }

    public static KeyFamily of(EccCurve curve) {
        return switch (curve) {
            case NIST_P256 -> NIST_P256;
            case NIST_P384 -> NIST_P384;
            case NIST_P521 -> NIST_P521;
            case SECP256K1 -> SECP256K1;
            case SM2 -> SM2;
        };
    }

    /**
     * The Weierstrass curve families, in sniffing priority order.
     */
    public static List<KeyFamily> ellipticCurves() {
        return List.of(NIST_P256, NIST_P384, NIST_P521, SECP256K1, SM2);
    }

    KeyFamilyCodec codec() {
        return switch (this) {
            case RSA -> RsaKeyCodec.INSTANCE;
            case NIST_P256, NIST_P384, NIST_P521, SECP256K1, SM2 -> EcKeyCodec.forCurve(eccCurve);
            case CURVE25519 -> Ed25519KeyCodec.INSTANCE;
        };
    }
}
