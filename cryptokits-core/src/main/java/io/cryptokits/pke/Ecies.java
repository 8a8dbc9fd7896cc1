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

import static java.util.Objects.requireNonNull;

import java.util.Arrays;
import java.util.function.Supplier;

import org.bouncycastle.crypto.agreement.ECDHBasicAgreement;
import org.bouncycastle.crypto.generators.ECKeyPairGenerator;
import org.bouncycastle.crypto.params.ECKeyGenerationParameters;
import org.bouncycastle.crypto.params.ECPrivateKeyParameters;
import org.bouncycastle.crypto.params.ECPublicKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.math.ec.rfc7748.X25519;
import org.bouncycastle.util.BigIntegers;

import io.cryptokits.CryptoKitsException;
import io.cryptokits.KeyFormatException;
import io.cryptokits.RedactedLogger;
import io.cryptokits.RequestValidationException;
import io.cryptokits.UnsupportedAlgorithmException;
import io.cryptokits.crypto.AesCipher;
import io.cryptokits.crypto.BlockMode;
import io.cryptokits.crypto.CryptoUtils;
import io.cryptokits.crypto.KdfConstants;
import io.cryptokits.crypto.Padding;
import io.cryptokits.keys.EccCurve;
import io.cryptokits.keys.PrivateKeyHandle;
import io.cryptokits.keys.PublicKeyHandle;

/**
 * Elliptic curve integrated encryption. Each message uses a fresh ephemeral key pair on the recipient's curve. The
 * ECDH shared secret is stretched by the selected KDF into an AES-256 key and a GCM nonce, and the message is written
 * as:
 * <pre>{@code
 *   len (1 byte) || ephemeral public key (len bytes) || AES-GCM ciphertext and tag
 * }</pre>
 * The ephemeral public key is a compressed SEC1 point on the Weierstrass curves, or the 32-byte X25519 u-coordinate
 * for Curve25519, whose Ed25519 keys are mapped to their Montgomery form for the key agreement.
 */
public final class Ecies {
    private static final RedactedLogger logger = RedactedLogger.getLogger(Ecies.class);

    private static final int X25519_KEY_SIZE = X25519.POINT_SIZE;

    private record Agreement(byte[] ephemeralPublicKey, byte[] sharedSecret) {}

    /**
     * Encrypts a message to the holder of the private key matching {@code recipient}.
     *
     * @param recipient the recipient's public key. RSA keys are not supported.
     * @param parameters the KDF and AEAD settings.
     * @param plaintext the message, which may be empty.
     * @return the ECIES envelope.
     */
    public static byte[] encrypt(PublicKeyHandle recipient, EciesParameters parameters, byte[] plaintext) {
        requireNonNull(plaintext, "plaintext");
        logger.info("ECIES encrypt to {} key with {} over {}", recipient.family(), parameters.kdf(),
                parameters.digest());
        var agreement = switch (recipient.family()) {
            case RSA -> throw new UnsupportedAlgorithmException("ECIES is not defined for RSA keys");
            case CURVE25519 -> x25519Agreement((Ed25519PublicKeyParameters) recipient.keyParameters());
            case NIST_P256, NIST_P384, NIST_P521, SECP256K1, SM2 ->
                    ecdhAgreement(recipient.family().eccCurve().orElseThrow(),
                            (ECPublicKeyParameters) recipient.keyParameters());
        };
        try {
            var ciphertext = aead(parameters, agreement.sharedSecret(), plaintext, true);
            var ephemeral = agreement.ephemeralPublicKey();
            var envelope = CryptoUtils.concat(new byte[] { (byte) ephemeral.length }, ephemeral, ciphertext);
            logger.debug("ECIES envelope: {}-byte ephemeral key, {}-byte ciphertext", ephemeral.length,
                    ciphertext.length);
            return envelope;
        } finally {
            CryptoUtils.wipe(agreement.sharedSecret());
        }
    }

    /**
     * Decrypts an ECIES envelope with the recipient's private key.
     *
     * @throws RequestValidationException if the envelope is empty, its length prefix overruns the buffer, or the
     * embedded ephemeral key is not a valid public key for the curve.
     * @throws io.cryptokits.DecryptionFailedException if authentication fails, for whatever reason.
     */
    public static byte[] decrypt(PrivateKeyHandle recipient, EciesParameters parameters, byte[] envelope) {
        requireNonNull(envelope, "envelope");
        logger.info("ECIES decrypt with {} key using {} over {}", recipient.family(), parameters.kdf(),
                parameters.digest());
        if (envelope.length == 0) {
            throw new RequestValidationException("Malformed ECIES envelope: empty input");
        }
        int ephemeralLength = Byte.toUnsignedInt(envelope[0]);
        if (ephemeralLength == 0 || 1 + ephemeralLength > envelope.length) {
            throw new RequestValidationException("Malformed ECIES envelope: ephemeral key length " + ephemeralLength
                    + " exceeds the " + (envelope.length - 1) + " remaining bytes");
        }
        var ephemeral = Arrays.copyOfRange(envelope, 1, 1 + ephemeralLength);
        var ciphertext = Arrays.copyOfRange(envelope, 1 + ephemeralLength, envelope.length);

        var sharedSecret = switch (recipient.family()) {
            case RSA -> throw new UnsupportedAlgorithmException("ECIES is not defined for RSA keys");
            case CURVE25519 -> x25519SharedSecret(recipient, ephemeral);
            case NIST_P256, NIST_P384, NIST_P521, SECP256K1, SM2 ->
                    ecdhSharedSecret(recipient.family().eccCurve().orElseThrow(),
                            (ECPrivateKeyParameters) recipient.keyParameters(), ephemeral);
        };
        try {
            return aead(parameters, sharedSecret, ciphertext, false);
        } finally {
            CryptoUtils.wipe(sharedSecret);
        }
    }

    private static byte[] aead(EciesParameters parameters, byte[] sharedSecret, byte[] input,
                               boolean forEncryption) {
        var keyMaterial = parameters.kdf().deriveEciesKeyMaterial(parameters.digest(), sharedSecret,
                parameters.salt(), parameters.info());
        var key = Arrays.copyOfRange(keyMaterial, 0, KdfConstants.ECIES_KEY_SIZE);
        var nonce = Arrays.copyOfRange(keyMaterial, KdfConstants.ECIES_KEY_SIZE, KdfConstants.ECIES_OUTPUT_SIZE);
        try {
            return switch (parameters.aead()) {
                case AES_256_GCM -> AesCipher.cipher(BlockMode.GCM, Padding.NONE, key, nonce, parameters.aad(), input,
                        forEncryption);
            };
        } finally {
            CryptoUtils.wipe(keyMaterial, key, nonce);
        }
    }

    private static Agreement ecdhAgreement(EccCurve curve, ECPublicKeyParameters recipient) {
        var generator = new ECKeyPairGenerator();
        generator.init(new ECKeyGenerationParameters(curve.domain(), CryptoUtils.secureRandom()));
        var ephemeral = generator.generateKeyPair();
        var ephemeralPublic = ((ECPublicKeyParameters) ephemeral.getPublic()).getQ();
        return new Agreement(curve.encodePoint(ephemeralPublic, true),
                ecdh(curve, (ECPrivateKeyParameters) ephemeral.getPrivate(), recipient));
    }

    private static byte[] ecdhSharedSecret(EccCurve curve, ECPrivateKeyParameters privateKey, byte[] ephemeral) {
        ECPublicKeyParameters ephemeralPublic;
        try {
            ephemeralPublic = new ECPublicKeyParameters(curve.decodePoint(ephemeral), curve.domain());
        } catch (KeyFormatException e) {
            throw new RequestValidationException("Malformed ECIES envelope: invalid ephemeral key", e);
        }
        return ecdh(curve, privateKey, ephemeralPublic);
    }

    /**
     * Raw ECDH: the x-coordinate of the shared point as a fixed-size field element.
     */
    private static byte[] ecdh(EccCurve curve, ECPrivateKeyParameters privateKey, ECPublicKeyParameters publicKey) {
        var agreement = new ECDHBasicAgreement();
        agreement.init(privateKey);
        return BigIntegers.asUnsignedByteArray(curve.fieldSize(), agreement.calculateAgreement(publicKey));
    }

    private static Agreement x25519Agreement(Ed25519PublicKeyParameters recipient) {
        var recipientPublic = Curve25519Conversion.toX25519(recipient);
        var ephemeral = new byte[X25519.SCALAR_SIZE];
        X25519.generatePrivateKey(CryptoUtils.secureRandom(), ephemeral);
        try {
            var ephemeralPublic = new byte[X25519_KEY_SIZE];
            X25519.generatePublicKey(ephemeral, 0, ephemeralPublic, 0);
            return new Agreement(ephemeralPublic, x25519(ephemeral, recipientPublic,
                    () -> new KeyFormatException("Recipient Curve25519 key is a low order point")));
        } finally {
            CryptoUtils.wipe(ephemeral);
        }
    }

    private static byte[] x25519SharedSecret(PrivateKeyHandle recipient, byte[] ephemeral) {
        if (ephemeral.length != X25519_KEY_SIZE) {
            throw new RequestValidationException("Malformed ECIES envelope: unsupported ephemeral key length "
                    + ephemeral.length);
        }
        var seed = recipient.ed25519Seed();
        var scalar = Curve25519Conversion.toX25519Scalar(seed);
        try {
            return x25519(scalar, ephemeral,
                    () -> new RequestValidationException("Malformed ECIES envelope: invalid ephemeral key"));
        } finally {
            CryptoUtils.wipe(seed, scalar);
        }
    }

    /**
     * X25519 on raw arrays. An all-zero result means the peer sent a low order point.
     */
    private static byte[] x25519(byte[] scalar, byte[] peerPublic, Supplier<CryptoKitsException> lowOrderPoint) {
        var sharedSecret = new byte[X25519.POINT_SIZE];
        if (!X25519.calculateAgreement(scalar, 0, peerPublic, 0, sharedSecret, 0)) {
            throw lowOrderPoint.get();
        }
        return sharedSecret;
    }

    private Ecies() {}
}
