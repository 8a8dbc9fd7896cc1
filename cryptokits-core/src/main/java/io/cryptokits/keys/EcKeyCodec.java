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
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.DERBitString;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.asn1.sec.ECPrivateKey;
import org.bouncycastle.asn1.x509.AlgorithmIdentifier;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.asn1.x9.X9ObjectIdentifiers;
import org.bouncycastle.crypto.generators.ECKeyPairGenerator;
import org.bouncycastle.crypto.params.AsymmetricKeyParameter;
import org.bouncycastle.crypto.params.ECKeyGenerationParameters;
import org.bouncycastle.crypto.params.ECPrivateKeyParameters;
import org.bouncycastle.crypto.params.ECPublicKeyParameters;
import org.bouncycastle.math.ec.ECPoint;

import io.cryptokits.KeyFormatException;
import io.cryptokits.crypto.CryptoUtils;

/**
 * Key encoding for the short Weierstrass curves. PKCS#8 keys wrap a SEC1 ECPrivateKey that carries the public point
 * but no curve parameters, since those are in the algorithm identifier. SEC1 keys name the curve themselves. Public
 * keys in the SEC1 container are bare uncompressed points.
 */
final class EcKeyCodec implements KeyFamilyCodec {
    private static final Map<EccCurve, EcKeyCodec> CODECS = new EnumMap<>(EccCurve.class);

    static {
        for (var curve : EccCurve.values()) {
            CODECS.put(curve, new EcKeyCodec(curve));
        }
    }

    private final EccCurve curve;
    private final AlgorithmIdentifier algorithm;

    private EcKeyCodec(EccCurve curve) {
        this.curve = curve;
        this.algorithm = new AlgorithmIdentifier(X9ObjectIdentifiers.id_ecPublicKey, curve.oid());
    }

    static EcKeyCodec forCurve(EccCurve curve) {
        return CODECS.get(curve);
    }

    @Override
    public Set<KeyContainer> privateContainers() {
        return EnumSet.of(KeyContainer.PKCS8, KeyContainer.SEC1);
    }

    @Override
    public Set<KeyContainer> publicContainers() {
        return EnumSet.of(KeyContainer.SPKI, KeyContainer.SEC1);
    }

    @Override
    public byte[] privateToPkcs8(KeyContainer container, byte[] der) {
        var d = switch (container) {
            case PKCS8 -> scalarFromPkcs8(der);
            case SEC1 -> Der.parse("SEC1 EC private key", der, p -> scalarFrom(ECPrivateKey.getInstance(p)));
            default -> throw new IllegalArgumentException(container.toString());
        };
        return pkcs8(d);
    }

    @Override
    public byte[] privateFromPkcs8(byte[] pkcs8, KeyContainer container) {
        return switch (container) {
            case PKCS8 -> pkcs8.clone();
            case SEC1 -> Der.encode(ecPrivateKey(scalarFromPkcs8(pkcs8), curve.oid()));
            default -> throw new IllegalArgumentException(container.toString());
        };
    }

    @Override
    public byte[] publicToSpki(KeyContainer container, byte[] der) {
        var point = switch (container) {
            case SPKI -> pointFromSpki(der);
            case SEC1 -> curve.decodePoint(der);
            default -> throw new IllegalArgumentException(container.toString());
        };
        return spki(point);
    }

    @Override
    public byte[] publicFromSpki(byte[] spki, KeyContainer container) {
        return switch (container) {
            case SPKI -> spki.clone();
            case SEC1 -> curve.encodePoint(pointFromSpki(spki), false);
            default -> throw new IllegalArgumentException(container.toString());
        };
    }

    @Override
    public byte[] derivePublic(byte[] pkcs8) {
        return spki(curve.publicPoint(scalarFromPkcs8(pkcs8)));
    }

    @Override
    public byte[] generate(int keySize) {
        var generator = new ECKeyPairGenerator();
        generator.init(new ECKeyGenerationParameters(curve.domain(), CryptoUtils.secureRandom()));
        var privateKey = (ECPrivateKeyParameters) generator.generateKeyPair().getPrivate();
        return pkcs8(privateKey.getD());
    }

    @Override
    public AsymmetricKeyParameter privateParameters(byte[] pkcs8) {
        return new ECPrivateKeyParameters(scalarFromPkcs8(pkcs8), curve.domain());
    }

    @Override
    public AsymmetricKeyParameter publicParameters(byte[] spki) {
        return new ECPublicKeyParameters(pointFromSpki(spki), curve.domain());
    }

    private byte[] pkcs8(BigInteger d) {
        return Der.privateKeyInfo(algorithm, ecPrivateKey(d, null));
    }

    private ECPrivateKey ecPrivateKey(BigInteger d, ASN1Encodable parameters) {
        var publicKey = new DERBitString(curve.encodePoint(curve.publicPoint(curve.checkScalar(d)), false));
        return new ECPrivateKey(curve.orderBitLength(), d, publicKey, parameters);
    }

    private BigInteger scalarFromPkcs8(byte[] der) {
        var info = Der.parse("PKCS#8 private key", der, PrivateKeyInfo::getInstance);
        checkAlgorithm(info.getPrivateKeyAlgorithm());
        return Der.parseInner("EC private key", () -> scalarFrom(ECPrivateKey.getInstance(info.parsePrivateKey())));
    }

    private BigInteger scalarFrom(ECPrivateKey key) {
        var parameters = key.getParametersObject();
        if (parameters != null && !curve.oid().equals(parameters)) {
            throw new KeyFormatException("EC private key is on " + curveName(parameters) + ", not " + curve);
        }
        var d = curve.checkScalar(key.getKey());
        var embedded = key.getPublicKey();
        if (embedded != null && !curve.decodePoint(embedded.getOctets()).equals(curve.publicPoint(d))) {
            throw new KeyFormatException("EC private key does not match its embedded public key");
        }
        return d;
    }

    private ECPoint pointFromSpki(byte[] der) {
        var info = Der.parse("SubjectPublicKeyInfo", der, SubjectPublicKeyInfo::getInstance);
        checkAlgorithm(info.getAlgorithm());
        return curve.decodePoint(info.getPublicKeyData().getOctets());
    }

    private byte[] spki(ECPoint point) {
        return Der.subjectPublicKeyInfo(algorithm, curve.encodePoint(point, false));
    }

    private void checkAlgorithm(AlgorithmIdentifier keyAlgorithm) {
        if (!X9ObjectIdentifiers.id_ecPublicKey.equals(keyAlgorithm.getAlgorithm())) {
            throw new KeyFormatException("Not an EC key: " + keyAlgorithm.getAlgorithm());
        }
        if (!curve.oid().equals(keyAlgorithm.getParameters())) {
            throw new KeyFormatException("EC key is on " + curveName(keyAlgorithm.getParameters()) + ", not "
                    + curve);
        }
    }

    private static String curveName(ASN1Encodable parameters) {
        if (parameters instanceof ASN1ObjectIdentifier oid) {
            return "curve " + EccCurve.fromOid(oid).map(Enum::name).orElse(oid.getId());
        }
        return "an unnamed curve";
    }
}
