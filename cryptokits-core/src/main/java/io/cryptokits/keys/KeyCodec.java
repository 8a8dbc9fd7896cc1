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

import io.cryptokits.CryptoKitsException;
import io.cryptokits.RedactedLogger;
import io.cryptokits.UnsupportedAlgorithmException;
import io.cryptokits.crypto.CryptoUtils;

/**
 * Imports, exports and converts asymmetric keys between containers and serializations. Imported keys are held in a
 * canonical form, so exporting a key to the container and serialization it was read from reproduces the same bytes
 * whenever the input was itself canonical.
 */
public final class KeyCodec {
    private static final RedactedLogger logger = RedactedLogger.getLogger(KeyCodec.class);

    public static PrivateKeyHandle importPrivateKey(byte[] input, KeyFamily family, KeyFormat format) {
        requireNonNull(input, "input");
        var codec = family.codec();
        var container = format.container();
        if (!codec.privateContainers().contains(container)) {
            throw new UnsupportedAlgorithmException(container + " container is not supported for " + family
                    + " private keys");
        }
        var der = switch (format.serialization()) {
            case DER -> input;
            case PEM -> Pem.decode(input, container.pemLabel(false).orElseThrow());
        };
        try {
            return new PrivateKeyHandle(family, codec.privateToPkcs8(container, der));
        } finally {
            if (der != input) {
                CryptoUtils.wipe(der);
            }
        }
    }

    public static PublicKeyHandle importPublicKey(byte[] input, KeyFamily family, KeyFormat format) {
        requireNonNull(input, "input");
        var codec = family.codec();
        var container = format.container().normalizeForPublic();
        if (!codec.publicContainers().contains(container)) {
            throw new UnsupportedAlgorithmException(container + " container is not supported for " + family
                    + " public keys");
        }
        var der = switch (format.serialization()) {
            case DER -> input;
            case PEM -> Pem.decode(input, container.pemLabel(true).orElseThrow(() ->
                    new UnsupportedAlgorithmException(container + " public keys have no PEM form")));
        };
        return new PublicKeyHandle(family, codec.publicToSpki(container, der));
    }

    public static byte[] exportPrivateKey(PrivateKeyHandle key, KeyFormat format) {
        var codec = key.family().codec();
        var container = format.container();
        if (!codec.privateContainers().contains(container)) {
            throw new UnsupportedAlgorithmException(container + " container is not supported for " + key.family()
                    + " private keys");
        }
        var der = codec.privateFromPkcs8(key.pkcs8(), container);
        return switch (format.serialization()) {
            case DER -> der;
            case PEM -> {
                try {
                    yield Pem.encode(container.pemLabel(false).orElseThrow(), der);
                } finally {
                    CryptoUtils.wipe(der);
                }
            }
        };
    }

    public static byte[] exportPublicKey(PublicKeyHandle key, KeyFormat format) {
        var codec = key.family().codec();
        var container = format.container().normalizeForPublic();
        if (!codec.publicContainers().contains(container)) {
            throw new UnsupportedAlgorithmException(container + " container is not supported for " + key.family()
                    + " public keys");
        }
        var der = codec.publicFromSpki(key.spki(), container);
        return switch (format.serialization()) {
            case DER -> der;
            case PEM -> Pem.encode(container.pemLabel(true).orElseThrow(() ->
                    new UnsupportedAlgorithmException(container + " public keys have no PEM form")), der);
        };
    }

    /**
     * Re-encodes a key from one container and serialization to another.
     */
    public static byte[] transcode(byte[] input, KeyFamily family, KeyFormat from, KeyFormat to, boolean isPublic) {
        logger.info("Transcoding {} {} key from {} to {}", family, isPublic ? "public" : "private", from, to);
        if (isPublic) {
            return exportPublicKey(importPublicKey(input, family, from), to);
        }
        try (var key = importPrivateKey(input, family, from)) {
            return exportPrivateKey(key, to);
        }
    }

    /**
     * Generates a key pair. The private key is written in the requested format and the public key in its
     * counterpart container with the same serialization. The key size is only used for RSA.
     */
    public static EncodedKeyPair generate(KeyFamily family, int keySize, KeyFormat format) {
        logger.info("Generating {} key pair as {}", family, format);
        var codec = family.codec();
        if (!codec.privateContainers().contains(format.container())) {
            throw new UnsupportedAlgorithmException(format.container() + " container is not supported for "
                    + family + " private keys");
        }
        try (var key = new PrivateKeyHandle(family, codec.generate(keySize))) {
            var publicFormat = format.publicCounterpart();
            var publicKey = new PublicKeyHandle(family, codec.derivePublic(key.pkcs8()));
            return new EncodedKeyPair(format, exportPrivateKey(key, format), publicFormat,
                    exportPublicKey(publicKey, publicFormat));
        }
    }

    public static PublicKeyHandle derivePublicKey(PrivateKeyHandle key) {
        return new PublicKeyHandle(key.family(), key.family().codec().derivePublic(key.pkcs8()));
    }

    /**
     * Computes the public key of an encoded private key, written in the counterpart container of the input.
     */
    public static byte[] derivePublicKey(byte[] privateKey, KeyFamily family, KeyFormat format) {
        logger.info("Deriving {} public key from {} private key", family, format);
        try (var key = importPrivateKey(privateKey, family, format)) {
            return exportPublicKey(derivePublicKey(key), format.publicCounterpart());
        }
    }

    /**
     * Determines which Weierstrass curve an EC key belongs to. Each curve's private key importer is tried first,
     * then each public key importer, and the first success wins.
     */
    public static KeyFamily sniffCurve(byte[] input, KeyFormat format) {
        for (var family : KeyFamily.ellipticCurves()) {
            if (importsAsPrivate(input, family, format)) {
                return family;
            }
        }
        for (var family : KeyFamily.ellipticCurves()) {
            if (importsAsPublic(input, family, format)) {
                return family;
            }
        }
        throw new UnsupportedAlgorithmException("Key does not belong to any supported curve");
    }

    private static boolean importsAsPrivate(byte[] input, KeyFamily family, KeyFormat format) {
        try (var ignored = importPrivateKey(input, family, format)) {
            return true;
        } catch (CryptoKitsException e) {
            logger.trace("Not a {} private key in {}: {}", family, format, e.getMessage());
            return false;
        }
    }

    private static boolean importsAsPublic(byte[] input, KeyFamily family, KeyFormat format) {
        try {
            importPublicKey(input, family, format);
            return true;
        } catch (CryptoKitsException e) {
            logger.trace("Not a {} public key in {}: {}", family, format, e.getMessage());
            return false;
        }
    }

    private KeyCodec() {}
}
