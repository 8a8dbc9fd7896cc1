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

import java.util.Optional;

/**
 * ASN.1 container structures for asymmetric keys.
 */
public enum KeyContainer {
    /** PKCS#8 PrivateKeyInfo. For a public key this names the SubjectPublicKeyInfo that PKCS#8 tooling emits. */
    PKCS8("PRIVATE KEY", "PUBLIC KEY"),
    /** PKCS#1 RSAPrivateKey or RSAPublicKey. */
    PKCS1("RSA PRIVATE KEY", "RSA PUBLIC KEY"),
    /** SEC1 ECPrivateKey, or a bare SEC1 point for a public key (which has no PEM form). */
    SEC1("EC PRIVATE KEY", null),
    /** X.509 SubjectPublicKeyInfo. Public keys only. */
    SPKI(null, "PUBLIC KEY");

    private final String privatePemLabel;
    private final String publicPemLabel;

    KeyContainer(String privatePemLabel, String publicPemLabel) {
        this.privatePemLabel = privatePemLabel;
        this.publicPemLabel = publicPemLabel;
    }

    public Optional<String> pemLabel(boolean isPublic) {
        return Optional.ofNullable(isPublic ? publicPemLabel : privatePemLabel);
    }

    /**
     * The container in which the public half of a private key in this container is written.
     */
    public KeyContainer publicCounterpart() {
        return switch (this) {
            case PKCS8, SEC1, SPKI -> SPKI;
            case PKCS1 -> PKCS1;
        };
    }

    KeyContainer normalizeForPublic() {
        return this == PKCS8 ? SPKI : this;
    }
}
