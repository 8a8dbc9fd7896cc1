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

import java.util.EnumSet;
import java.util.Set;

import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.ASN1OctetString;
import org.bouncycastle.asn1.DEROctetString;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.asn1.x509.AlgorithmIdentifier;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.crypto.params.AsymmetricKeyParameter;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.math.ec.rfc8032.Ed25519;

import io.cryptokits.KeyFormatException;
import io.cryptokits.UnsupportedAlgorithmException;
import io.cryptokits.crypto.CryptoUtils;

/**
 * Curve25519 keys in Ed25519 form (RFC 8410). Private keys are 32-byte seeds and are written as version 1
 * OneAsymmetricKey structures without the optional public key. The seed only ever lives in plain arrays that are
 * wiped after use, never in BouncyCastle parameter objects.
 */
final class Ed25519KeyCodec implements KeyFamilyCodec {
    static final Ed25519KeyCodec INSTANCE = new Ed25519KeyCodec();

    private static final ASN1ObjectIdentifier ID_ED25519 = new ASN1ObjectIdentifier("1.3.101.112");
    private static final AlgorithmIdentifier ED25519 = new AlgorithmIdentifier(ID_ED25519);

    private Ed25519KeyCodec() {}

    @Override
    public Set<KeyContainer> privateContainers() {
        return EnumSet.of(KeyContainer.PKCS8);
    }

    @Override
    public Set<KeyContainer> publicContainers() {
        return EnumSet.of(KeyContainer.SPKI);
    }

    @Override
    public byte[] privateToPkcs8(KeyContainer container, byte[] der) {
        var seed = seedFromPkcs8(der);
        try {
            return pkcs8(seed);
        } finally {
            CryptoUtils.wipe(seed);
        }
    }

    @Override
    public byte[] privateFromPkcs8(byte[] pkcs8, KeyContainer container) {
        return pkcs8.clone();
    }

    @Override
    public byte[] publicToSpki(KeyContainer container, byte[] der) {
        return spki(publicKeyFromSpki(der));
    }

    @Override
    public byte[] publicFromSpki(byte[] spki, KeyContainer container) {
        return spki.clone();
    }

    @Override
    public byte[] derivePublic(byte[] pkcs8) {
        var seed = seedFromPkcs8(pkcs8);
        try {
            var publicKey = new byte[Ed25519.PUBLIC_KEY_SIZE];
            Ed25519.generatePublicKey(seed, 0, publicKey, 0);
            return Der.subjectPublicKeyInfo(ED25519, publicKey);
        } finally {
            CryptoUtils.wipe(seed);
        }
    }

    @Override
    public byte[] generate(int keySize) {
        var seed = new byte[Ed25519.SECRET_KEY_SIZE];
        Ed25519.generatePrivateKey(CryptoUtils.secureRandom(), seed);
        try {
            return pkcs8(seed);
        } finally {
            CryptoUtils.wipe(seed);
        }
    }

    @Override
    public AsymmetricKeyParameter privateParameters(byte[] pkcs8) {
        throw new UnsupportedAlgorithmException("Curve25519 private keys are only available as a seed");
    }

    @Override
    public AsymmetricKeyParameter publicParameters(byte[] spki) {
        return publicKeyFromSpki(spki);
    }

    /**
     * Returns a fresh copy of the 32-byte seed. The caller wipes it.
     */
    static byte[] seedFromPkcs8(byte[] der) {
        var info = Der.parse("PKCS#8 private key", der, PrivateKeyInfo::getInstance);
        if (!ID_ED25519.equals(info.getPrivateKeyAlgorithm().getAlgorithm())) {
            throw new KeyFormatException("Not an Ed25519 private key: "
                    + info.getPrivateKeyAlgorithm().getAlgorithm());
        }
        var seed = Der.parseInner("Ed25519 private key",
                () -> ASN1OctetString.getInstance(info.parsePrivateKey()).getOctets());
        if (seed.length != Ed25519.SECRET_KEY_SIZE) {
            CryptoUtils.wipe(seed);
            throw new KeyFormatException("Ed25519 private key must be " + Ed25519.SECRET_KEY_SIZE
                    + " bytes");
        }
        return seed;
    }

    private static Ed25519PublicKeyParameters publicKeyFromSpki(byte[] der) {
        var info = Der.parse("SubjectPublicKeyInfo", der, SubjectPublicKeyInfo::getInstance);
        if (!ID_ED25519.equals(info.getAlgorithm().getAlgorithm())) {
            throw new KeyFormatException("Not an Ed25519 public key: " + info.getAlgorithm().getAlgorithm());
        }
        var encoded = info.getPublicKeyData().getOctets();
        if (encoded.length != Ed25519PublicKeyParameters.KEY_SIZE) {
            throw new KeyFormatException("Ed25519 public key must be " + Ed25519PublicKeyParameters.KEY_SIZE
                    + " bytes");
        }
        try {
            return new Ed25519PublicKeyParameters(encoded, 0);
        } catch (IllegalArgumentException e) {
            throw new KeyFormatException("Invalid Ed25519 public key", e);
        }
    }

    private static byte[] pkcs8(byte[] seed) {
        return Der.privateKeyInfo(ED25519, new DEROctetString(seed));
    }

    private static byte[] spki(Ed25519PublicKeyParameters publicKey) {
        return Der.subjectPublicKeyInfo(ED25519, publicKey.getEncoded());
    }
}
