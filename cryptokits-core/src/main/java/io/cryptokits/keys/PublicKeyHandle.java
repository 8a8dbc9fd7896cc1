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

import java.util.Arrays;

import org.bouncycastle.crypto.params.AsymmetricKeyParameter;

/**
 * An imported public key, held in canonical SubjectPublicKeyInfo DER form.
 */
public final class PublicKeyHandle {
    private final KeyFamily family;
    private final byte[] spki;

    PublicKeyHandle(KeyFamily family, byte[] spki) {
        this.family = requireNonNull(family, "family");
        this.spki = requireNonNull(spki, "spki");
    }

    public KeyFamily family() {
        return family;
    }

    public AsymmetricKeyParameter keyParameters() {
        return family.codec().publicParameters(spki);
    }

    byte[] spki() {
        return spki;
    }

    @Override
    public boolean equals(Object that) {
        return this == that || that instanceof PublicKeyHandle other
                && family == other.family && Arrays.equals(spki, other.spki);
    }

    @Override
    public int hashCode() {
        return 31 * family.hashCode() + Arrays.hashCode(spki);
    }

    @Override
    public String toString() {
        return "PublicKeyHandle{family=" + family + "}";
    }
}
