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
import java.util.EnumSet;
import java.util.Set;

import org.bouncycastle.asn1.DERNull;
import org.bouncycastle.asn1.pkcs.PKCSObjectIdentifiers;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.asn1.pkcs.RSAPrivateKey;
import org.bouncycastle.asn1.pkcs.RSAPublicKey;
import org.bouncycastle.asn1.x509.AlgorithmIdentifier;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.crypto.generators.RSAKeyPairGenerator;
import org.bouncycastle.crypto.params.AsymmetricKeyParameter;
import org.bouncycastle.crypto.params.RSAKeyGenerationParameters;
import org.bouncycastle.crypto.params.RSAKeyParameters;
import org.bouncycastle.crypto.params.RSAPrivateCrtKeyParameters;

import io.cryptokits.KeyFormatException;
import io.cryptokits.RedactedLogger;
import io.cryptokits.UnsupportedAlgorithmException;
import io.cryptokits.crypto.CryptoUtils;

final class RsaKeyCodec implements KeyFamilyCodec {
    private static final RedactedLogger logger = RedactedLogger.getLogger(RsaKeyCodec.class);

    static final RsaKeyCodec INSTANCE = new RsaKeyCodec();
    static final Set<Integer> KEY_SIZES = Set.of(1024, 2048, 3072, 4096);

    private static final AlgorithmIdentifier RSA_ENCRYPTION =
            new AlgorithmIdentifier(PKCSObjectIdentifiers.rsaEncryption, DERNull.INSTANCE);
    private static final BigInteger PUBLIC_EXPONENT = BigInteger.valueOf(65537);
    private static final int PRIME_CERTAINTY = 128;

    private RsaKeyCodec() {}

    @Override
    public Set<KeyContainer> privateContainers() {
        return EnumSet.of(KeyContainer.PKCS8, KeyContainer.PKCS1);
    }

    @Override
    public Set<KeyContainer> publicContainers() {
        return EnumSet.of(KeyContainer.SPKI, KeyContainer.PKCS1);
    }

    @Override
    public byte[] privateToPkcs8(KeyContainer container, byte[] der) {
        var key = switch (container) {
            case PKCS8 -> fromPkcs8(der);
            case PKCS1 -> Der.parse("PKCS#1 RSA private key", der, RSAPrivateKey::getInstance);
            default -> throw new IllegalArgumentException(container.toString());
        };
        return Der.privateKeyInfo(RSA_ENCRYPTION, checked(key));
    }

    @Override
    public byte[] privateFromPkcs8(byte[] pkcs8, KeyContainer container) {
        return switch (container) {
            case PKCS8 -> pkcs8.clone();
            case PKCS1 -> Der.encode(fromPkcs8(pkcs8));
            default -> throw new IllegalArgumentException(container.toString());
        };
    }

    @Override
    public byte[] publicToSpki(KeyContainer container, byte[] der) {
        var key = switch (container) {
            case SPKI -> fromSpki(der);
            case PKCS1 -> Der.parse("PKCS#1 RSA public key", der, RSAPublicKey::getInstance);
            default -> throw new IllegalArgumentException(container.toString());
        };
        return spki(key.getModulus(), key.getPublicExponent());
    }

    @Override
    public byte[] publicFromSpki(byte[] spki, KeyContainer container) {
        return switch (container) {
            case SPKI -> spki.clone();
            case PKCS1 -> Der.encode(fromSpki(spki));
            default -> throw new IllegalArgumentException(container.toString());
        };
    }

    @Override
    public byte[] derivePublic(byte[] pkcs8) {
        var key = fromPkcs8(pkcs8);
        return spki(key.getModulus(), key.getPublicExponent());
    }

    @Override
    public byte[] generate(int keySize) {
        if (!KEY_SIZES.contains(keySize)) {
            throw new UnsupportedAlgorithmException("Unsupported RSA key size: " + keySize);
        }
        logger.debug("Generating {}-bit RSA key", keySize);
        var generator = new RSAKeyPairGenerator();
        generator.init(new RSAKeyGenerationParameters(PUBLIC_EXPONENT, CryptoUtils.secureRandom(), keySize,
                PRIME_CERTAINTY));
        var k = (RSAPrivateCrtKeyParameters) generator.generateKeyPair().getPrivate();
        var key = new RSAPrivateKey(k.getModulus(), k.getPublicExponent(), k.getExponent(), k.getP(), k.getQ(),
                k.getDP(), k.getDQ(), k.getQInv());
        return Der.privateKeyInfo(RSA_ENCRYPTION, key);
    }

    @Override
    public AsymmetricKeyParameter privateParameters(byte[] pkcs8) {
        var k = fromPkcs8(pkcs8);
        return new RSAPrivateCrtKeyParameters(k.getModulus(), k.getPublicExponent(), k.getPrivateExponent(),
                k.getPrime1(), k.getPrime2(), k.getExponent1(), k.getExponent2(), k.getCoefficient());
    }

    @Override
    public AsymmetricKeyParameter publicParameters(byte[] spki) {
        var k = fromSpki(spki);
        return new RSAKeyParameters(false, k.getModulus(), k.getPublicExponent());
    }

    static RSAPrivateKey fromPkcs8(byte[] der) {
        var info = Der.parse("PKCS#8 private key", der, PrivateKeyInfo::getInstance);
        if (!PKCSObjectIdentifiers.rsaEncryption.equals(info.getPrivateKeyAlgorithm().getAlgorithm())) {
            throw new KeyFormatException("Not an RSA private key: " + info.getPrivateKeyAlgorithm().getAlgorithm());
        }
        return Der.parseInner("RSA private key", () -> RSAPrivateKey.getInstance(info.parsePrivateKey()));
    }

    static RSAPublicKey fromSpki(byte[] der) {
        var info = Der.parse("SubjectPublicKeyInfo", der, SubjectPublicKeyInfo::getInstance);
        if (!PKCSObjectIdentifiers.rsaEncryption.equals(info.getAlgorithm().getAlgorithm())) {
            throw new KeyFormatException("Not an RSA public key: " + info.getAlgorithm().getAlgorithm());
        }
        return Der.parseInner("RSA public key", () -> RSAPublicKey.getInstance(info.parsePublicKey()));
    }

    private static RSAPrivateKey checked(RSAPrivateKey key) {
        var n = key.getModulus();
        if (n.signum() <= 0 || !key.getPrime1().multiply(key.getPrime2()).equals(n)) {
            throw new KeyFormatException("Inconsistent RSA private key");
        }
        return key;
    }

    private static byte[] spki(BigInteger modulus, BigInteger exponent) {
        return Der.subjectPublicKeyInfo(RSA_ENCRYPTION, new RSAPublicKey(modulus, exponent));
    }
}
