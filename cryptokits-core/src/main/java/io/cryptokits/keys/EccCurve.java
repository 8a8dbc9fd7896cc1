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

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Optional;

import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.gm.GMObjectIdentifiers;
import org.bouncycastle.asn1.sec.SECObjectIdentifiers;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.math.ec.ECPoint;

import io.cryptokits.KeyFormatException;

/**
 * The short Weierstrass curves supported for ECDH, ECIES and EC key encoding. Each constant supplies the
 * capabilities that the curve-generic code needs: domain parameters, the named-curve OID, the field element size and
 * point encoding and decoding.
 */
public enum EccCurve {
    NIST_P256("secp256r1", SECObjectIdentifiers.secp256r1),
    NIST_P384("secp384r1", SECObjectIdentifiers.secp384r1),
    NIST_P521("secp521r1", SECObjectIdentifiers.secp521r1),
    SECP256K1("secp256k1", SECObjectIdentifiers.secp256k1),
    SM2("sm2p256v1", GMObjectIdentifiers.sm2p256v1);

    private final String curveName;
    private final ASN1ObjectIdentifier oid;
    private final ECDomainParameters domain;

    EccCurve(String curveName, ASN1ObjectIdentifier oid) {
        this.curveName = curveName;
        this.oid = oid;
        X9ECParameters x9 = CustomNamedCurves.getByName(curveName);
        this.domain = new ECDomainParameters(x9.getCurve(), x9.getG(), x9.getN(), x9.getH(), x9.getSeed());
    }

    public String curveName() {
        return curveName;
    }

    public ASN1ObjectIdentifier oid() {
        return oid;
    }

    public ECDomainParameters domain() {
        return domain;
    }

    /**
     * Size in bytes of an encoded field element, which is also the size of a raw ECDH shared secret.
     */
    public int fieldSize() {
        return (domain.getCurve().getFieldSize() + 7) / 8;
    }

    public int orderBitLength() {
        return domain.getN().bitLength();
    }

    /**
     * Decodes a SEC1 point (compressed, uncompressed or hybrid) and checks that it lies on the curve and is not the
     * point at infinity.
     */
    public ECPoint decodePoint(byte[] encoded) {
        try {
            var point = domain.getCurve().decodePoint(encoded);
            if (point.isInfinity()) {
                throw new KeyFormatException("Point at infinity is not a valid " + this + " public key");
            }
            return point.normalize();
        } catch (IllegalArgumentException | ArrayIndexOutOfBoundsException e) {
            throw new KeyFormatException("Invalid " + this + " point encoding", e);
        }
    }

    public byte[] encodePoint(ECPoint point, boolean compressed) {
        return point.normalize().getEncoded(compressed);
    }

    /**
     * Computes the public point d·G for a private scalar.
     */
    public ECPoint publicPoint(BigInteger d) {
        return domain.getG().multiply(d).normalize();
    }

    /**
     * Checks that a private scalar lies in [1, n-1].
     */
    public BigInteger checkScalar(BigInteger d) {
        if (d.signum() <= 0 || d.compareTo(domain.getN()) >= 0) {
            throw new KeyFormatException("Private scalar out of range for " + this);
        }
        return d;
    }

    public static Optional<EccCurve> fromOid(ASN1ObjectIdentifier oid) {
        return Arrays.stream(values()).filter(curve -> curve.oid.equals(oid)).findFirst();
    }
}
