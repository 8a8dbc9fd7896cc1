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

import java.util.Set;

import org.bouncycastle.crypto.params.AsymmetricKeyParameter;

/**
 * Converts the DER containers of one key family to and from the canonical forms held by key handles: PKCS#8 for
 * private keys and SubjectPublicKeyInfo for public keys. Each conversion parses the input completely and re-encodes
 * it, so a key that is accepted is also valid for the family.
 */
interface KeyFamilyCodec {
    Set<KeyContainer> privateContainers();

    Set<KeyContainer> publicContainers();

    byte[] privateToPkcs8(KeyContainer container, byte[] der);

    byte[] privateFromPkcs8(byte[] pkcs8, KeyContainer container);

    byte[] publicToSpki(KeyContainer container, byte[] der);

    byte[] publicFromSpki(byte[] spki, KeyContainer container);

    /**
     * Computes the SubjectPublicKeyInfo for a canonical private key.
     */
    byte[] derivePublic(byte[] pkcs8);

    /**
     * Generates a fresh private key in canonical form. The key size is only meaningful for RSA.
     */
    byte[] generate(int keySize);

    AsymmetricKeyParameter privateParameters(byte[] pkcs8);

    AsymmetricKeyParameter publicParameters(byte[] spki);
}
