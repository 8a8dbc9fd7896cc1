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

import java.util.List;
import java.util.OptionalInt;

import org.bouncycastle.crypto.params.RSAKeyParameters;

import io.cryptokits.CryptoKitsException;
import io.cryptokits.RedactedLogger;
import io.cryptokits.UnsupportedAlgorithmException;

/**
 * Identifies an unknown key blob. PEM input is recognised by its BEGIN line and the container is taken from the PEM
 * label. DER input is tried against each container in turn. The family is then found by importing the key with each
 * family, RSA first and then the curves in sniffing order.
 */
public final class KeyParser {
    private static final RedactedLogger logger = RedactedLogger.getLogger(KeyParser.class);

    private record Candidate(KeyContainer container, boolean isPublic) {}

    private static final List<Candidate> DER_CANDIDATES = List.of(
            new Candidate(KeyContainer.PKCS8, false),
            new Candidate(KeyContainer.PKCS1, false),
            new Candidate(KeyContainer.SEC1, false),
            new Candidate(KeyContainer.SPKI, true),
            new Candidate(KeyContainer.PKCS1, true),
            new Candidate(KeyContainer.SEC1, true));

    public static KeyInfo parse(byte[] input) {
        requireNonNull(input, "input");
        if (Pem.looksLikePem(input)) {
            var candidate = fromLabel(Pem.read(input).getType());
            return identify(input, candidate, KeySerialization.PEM);
        }
        for (var candidate : DER_CANDIDATES) {
            try {
                return identify(input, candidate, KeySerialization.DER);
            } catch (UnsupportedAlgorithmException e) {
                logger.trace("Not a {} key: {}", candidate, e.getMessage());
            }
        }
        throw new UnsupportedAlgorithmException("Unrecognised key content");
    }

    private static Candidate fromLabel(String label) {
        return switch (label) {
            case "PRIVATE KEY" -> new Candidate(KeyContainer.PKCS8, false);
            case "RSA PRIVATE KEY" -> new Candidate(KeyContainer.PKCS1, false);
            case "RSA PUBLIC KEY" -> new Candidate(KeyContainer.PKCS1, true);
            case "EC PRIVATE KEY" -> new Candidate(KeyContainer.SEC1, false);
            case "PUBLIC KEY" -> new Candidate(KeyContainer.SPKI, true);
            default -> throw new UnsupportedAlgorithmException("Unsupported PEM label: " + label);
        };
    }

    private static KeyInfo identify(byte[] input, Candidate candidate, KeySerialization serialization) {
        var format = KeyFormat.of(candidate.container(), serialization);
        for (var family : KeyFamily.values()) {
            try {
                if (candidate.isPublic()) {
                    var key = KeyCodec.importPublicKey(input, family, format);
                    return new KeyInfo(family, format, true, modulusBits(key.keyParameters()));
                }
                try (var key = KeyCodec.importPrivateKey(input, family, format)) {
                    var bits = family == KeyFamily.RSA ? modulusBits(key.keyParameters()) : OptionalInt.empty();
                    return new KeyInfo(family, format, false, bits);
                }
            } catch (CryptoKitsException e) {
                logger.trace("Not a {} key in {}: {}", family, format, e.getMessage());
            }
        }
        throw new UnsupportedAlgorithmException("No supported key family matches " + format + " content");
    }

    private static OptionalInt modulusBits(Object keyParameters) {
        return keyParameters instanceof RSAKeyParameters rsa
                ? OptionalInt.of(rsa.getModulus().bitLength())
                : OptionalInt.empty();
    }

    private KeyParser() {}
}
