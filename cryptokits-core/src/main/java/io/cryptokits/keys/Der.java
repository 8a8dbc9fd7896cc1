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

import java.io.IOException;
import java.util.function.Function;

import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1Encoding;
import org.bouncycastle.asn1.ASN1Primitive;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.asn1.x509.AlgorithmIdentifier;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;

import io.cryptokits.CryptoKitsException;
import io.cryptokits.KeyFormatException;

/**
 * DER parsing and encoding helpers that report malformed input as {@link KeyFormatException}. BouncyCastle ASN.1
 * types may defer parsing until a field is read, so callers read every field they need inside the parser function.
 */
final class Der {

    static <T> T parse(String structure, byte[] der, Function<ASN1Primitive, T> parser) {
        if (der == null || der.length == 0) {
            throw new KeyFormatException("Empty " + structure);
        }
        try {
            var primitive = ASN1Primitive.fromByteArray(der);
            if (primitive == null) {
                throw new KeyFormatException("Empty " + structure);
            }
            var result = parser.apply(primitive);
            if (result == null) {
                throw new KeyFormatException("Malformed " + structure);
            }
            return result;
        } catch (CryptoKitsException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new KeyFormatException("Malformed " + structure, e);
        }
    }

    static byte[] encode(ASN1Encodable object) {
        try {
            return object.toASN1Primitive().getEncoded(ASN1Encoding.DER);
        } catch (IOException e) {
            throw new IllegalStateException("DER encoding failed", e);
        }
    }

    /**
     * Unwraps the algorithm-specific key structure inside a parsed PrivateKeyInfo or SubjectPublicKeyInfo.
     */
    static <T> T parseInner(String structure, Asn1Supplier<T> parser) {
        try {
            var result = parser.get();
            if (result == null) {
                throw new KeyFormatException("Malformed " + structure);
            }
            return result;
        } catch (CryptoKitsException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new KeyFormatException("Malformed " + structure, e);
        }
    }

    static byte[] privateKeyInfo(AlgorithmIdentifier algorithm, ASN1Encodable privateKey) {
        try {
            return encode(new PrivateKeyInfo(algorithm, privateKey));
        } catch (IOException e) {
            throw new IllegalStateException("DER encoding failed", e);
        }
    }

    static byte[] subjectPublicKeyInfo(AlgorithmIdentifier algorithm, byte[] publicKey) {
        return encode(new SubjectPublicKeyInfo(algorithm, publicKey));
    }

    static byte[] subjectPublicKeyInfo(AlgorithmIdentifier algorithm, ASN1Encodable publicKey) {
        return subjectPublicKeyInfo(algorithm, encode(publicKey));
    }

    @FunctionalInterface
    interface Asn1Supplier<T> {
        T get() throws IOException;
    }

    private Der() {}
}
