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

package io.cryptokits;

import static io.cryptokits.EncodedText.bytesOrNull;

import io.cryptokits.crypto.AesCipher;
import io.cryptokits.crypto.CryptoUtils;
import io.cryptokits.keys.KeyCodec;
import io.cryptokits.keys.KeyFamily;
import io.cryptokits.keys.KeyInfo;
import io.cryptokits.keys.KeyParser;
import io.cryptokits.pke.Ecies;
import io.cryptokits.pke.EciesAead;
import io.cryptokits.pke.EciesParameters;
import io.cryptokits.pke.RsaCipher;

/**
 * Entry point of the engine. Every operation is a stateless call that takes text-encoded inputs, works on raw bytes
 * and returns its result in the caller's chosen {@link TextEncoding}. Decoded secrets are wiped before returning.
 */
public final class CryptoKits {
    private static final RedactedLogger logger = RedactedLogger.getLogger(CryptoKits.class);

    public static KeyPairText generateKey(KeyGenerationRequest request) {
        try (var keyPair = KeyCodec.generate(request.family(), request.rsaKeySize(), request.format())) {
            return new KeyPairText(request.outputEncoding().encode(keyPair.privateKey()),
                    request.outputEncoding().encode(keyPair.publicKey()));
        }
    }

    public static String derivePublicKey(DerivePublicKeyRequest request) {
        var privateKey = request.privateKey().bytes();
        try {
            return request.outputEncoding().encode(
                    KeyCodec.derivePublicKey(privateKey, request.family(), request.format()));
        } finally {
            CryptoUtils.wipe(privateKey);
        }
    }

    public static String transcodeKey(TranscodeKeyRequest request) {
        var key = request.key().bytes();
        byte[] result = null;
        try {
            result = KeyCodec.transcode(key, request.family(), request.from(), request.to(), request.isPublic());
            return request.outputEncoding().encode(result);
        } finally {
            if (!request.isPublic()) {
                CryptoUtils.wipe(key, result);
            }
        }
    }

    public static KeyInfo parseKey(EncodedText key) {
        var bytes = key.bytes();
        try {
            var info = KeyParser.parse(bytes);
            logger.info("Parsed {} {} key in {}", info.family(), info.isPublic() ? "public" : "private",
                    info.format());
            return info;
        } finally {
            CryptoUtils.wipe(bytes);
        }
    }

    public static String aes(AesRequest request) {
        logger.info("AES {} {} with {} padding", request.mode(), request.forEncryption() ? "encrypt" : "decrypt",
                request.padding());
        var key = request.key().bytes();
        var input = request.input().bytes();
        byte[] output = null;
        try {
            output = AesCipher.cipher(request.mode(), request.padding(), key, bytesOrNull(request.iv()),
                    bytesOrNull(request.aad()), input, request.forEncryption());
            return request.outputEncoding().encode(output);
        } finally {
            CryptoUtils.wipe(key, request.forEncryption() ? input : output);
        }
    }

    public static String generateAesKey(int keySizeBits, TextEncoding outputEncoding) {
        logger.info("Generating AES-{} key", keySizeBits);
        var key = AesCipher.generateKey(keySizeBits);
        try {
            return outputEncoding.encode(key);
        } finally {
            CryptoUtils.wipe(key);
        }
    }

    public static String rsa(RsaRequest request) {
        logger.info("RSA {} with {} padding, {} key", request.forEncryption() ? "encrypt" : "decrypt",
                request.padding(), request.format());
        var key = request.key().bytes();
        var input = request.input().bytes();
        try {
            if (request.forEncryption()) {
                var publicKey = KeyCodec.importPublicKey(key, KeyFamily.RSA, request.format());
                return request.outputEncoding().encode(RsaCipher.encrypt(publicKey, request.padding(),
                        request.digest(), request.mgfDigest(), input));
            }
            try (var privateKey = KeyCodec.importPrivateKey(key, KeyFamily.RSA, request.format())) {
                var plaintext = RsaCipher.decrypt(privateKey, request.padding(), request.digest(),
                        request.mgfDigest(), input);
                try {
                    return request.outputEncoding().encode(plaintext);
                } finally {
                    CryptoUtils.wipe(plaintext);
                }
            }
        } finally {
            CryptoUtils.wipe(key);
        }
    }

    public static String ecies(EciesRequest request) {
        var key = request.key().bytes();
        var input = request.input().bytes();
        try {
            var family = request.family() != null ? request.family() : KeyCodec.sniffCurve(key, request.format());
            var parameters = new EciesParameters(request.kdf(), request.digest(), bytesOrNull(request.salt()),
                    bytesOrNull(request.info()), EciesAead.AES_256_GCM, bytesOrNull(request.aad()));
            if (request.forEncryption()) {
                var recipient = KeyCodec.importPublicKey(key, family, request.format());
                return request.outputEncoding().encode(Ecies.encrypt(recipient, parameters, input));
            }
            try (var privateKey = KeyCodec.importPrivateKey(key, family, request.format())) {
                var plaintext = Ecies.decrypt(privateKey, parameters, input);
                try {
                    return request.outputEncoding().encode(plaintext);
                } finally {
                    CryptoUtils.wipe(plaintext);
                }
            }
        } finally {
            CryptoUtils.wipe(key);
        }
    }

    public static String kdf(KdfRequest request) {
        logger.info("Deriving {} bytes with {} over {}", request.outputLength(), request.kdf(), request.digest());
        var ikm = request.input().bytes();
        byte[] output = null;
        try {
            output = request.kdf().derive(request.digest(), ikm, bytesOrNull(request.salt()),
                    bytesOrNull(request.info()), request.outputLength());
            return request.outputEncoding().encode(output);
        } finally {
            CryptoUtils.wipe(ikm, output);
        }
    }

    private CryptoKits() {}
}
