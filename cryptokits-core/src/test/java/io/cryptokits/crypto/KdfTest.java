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

package io.cryptokits.crypto;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;

import org.bouncycastle.util.encoders.Hex;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import io.cryptokits.RequestValidationException;

public class KdfTest {
    private static final byte[] IKM = "input key material".getBytes(UTF_8);
    private static final byte[] SALT = "some salt".getBytes(UTF_8);
    private static final byte[] INFO = "context".getBytes(UTF_8);

    @DataProvider
    public Object[][] fastKdfsAndDigests() {
        return Arrays.stream(DigestAlgorithm.values())
                .flatMap(digest -> Arrays.stream(new Kdf[] { Kdf.HKDF, Kdf.CONCATENATION })
                        .map(kdf -> new Object[] { kdf, digest }))
                .toArray(Object[][]::new);
    }

    @Test(dataProvider = "fastKdfsAndDigests")
    public void shouldBeDeterministic(Kdf kdf, DigestAlgorithm digest) {
        var first = kdf.derive(digest, IKM, SALT, INFO, 100);
        var second = kdf.derive(digest, IKM, SALT, INFO, 100);
        assertThat(first).hasSize(100).isEqualTo(second);
    }

    @Test(dataProvider = "fastKdfsAndDigests")
    public void shouldDependOnInfo(Kdf kdf, DigestAlgorithm digest) {
        assertThat(kdf.derive(digest, IKM, SALT, INFO, 32))
                .isNotEqualTo(kdf.derive(digest, IKM, SALT, "other".getBytes(UTF_8), 32));
    }

    @Test(dataProvider = "fastKdfsAndDigests")
    public void shouldTreatAbsentSaltAndInfoAsEmpty(Kdf kdf, DigestAlgorithm digest) {
        assertThat(kdf.derive(digest, IKM, null, null, 32))
                .isEqualTo(kdf.derive(digest, IKM, new byte[0], new byte[0], 32));
    }

    @DataProvider
    public Object[][] prefixConsistentKdfs() {
        return new Object[][] {
                { Kdf.HKDF, DigestAlgorithm.SHA256 },
                { Kdf.CONCATENATION, DigestAlgorithm.SHA3_256 },
                { Kdf.PBKDF2, DigestAlgorithm.SHA512 },
        };
    }

    @Test(dataProvider = "prefixConsistentKdfs")
    public void shouldSplitEciesKeyMaterialIntoKeyAndNonce(Kdf kdf, DigestAlgorithm digest) {
        var keyMaterial = kdf.derive(digest, IKM, SALT, INFO, KdfConstants.ECIES_OUTPUT_SIZE);
        var key = kdf.derive(digest, IKM, SALT, INFO, KdfConstants.ECIES_KEY_SIZE);

        assertThat(keyMaterial).hasSize(44);
        assertThat(Arrays.copyOfRange(keyMaterial, 0, 32)).isEqualTo(key);
        assertThat(Arrays.copyOfRange(keyMaterial, 32, 44)).hasSize(KdfConstants.ECIES_NONCE_SIZE);
    }

    @Test
    public void concatenationKdfShouldHashCounterSecretAndInfo() {
        var expected = DigestAlgorithm.SHA256.hash(CryptoUtils.concat(new byte[] { 0, 0, 0, 1 }, IKM, INFO));
        assertThat(Kdf.CONCATENATION.derive(DigestAlgorithm.SHA256, IKM, null, INFO, 32)).isEqualTo(expected);
    }

    @Test
    public void concatenationKdfShouldIgnoreSalt() {
        assertThat(Kdf.CONCATENATION.derive(DigestAlgorithm.SHA256, IKM, SALT, INFO, 48))
                .isEqualTo(Kdf.CONCATENATION.derive(DigestAlgorithm.SHA256, IKM, null, INFO, 48));
    }

    @DataProvider
    public Object[][] rfc6070TestVectors() {
        return new Object[][] {
                { 1, "0c60c80f961f0e71f3a9b524af6012062fe037a6" },
                { 2, "ea6c014dc72d6f8ccd1ed92ace1d41f0d8de8957" },
                { 4096, "4b007901b765489abead49d926f721d065a429c1" },
        };
    }

    @Test(dataProvider = "rfc6070TestVectors")
    public void pbkdf2ShouldMatchRfc6070(int iterations, String expected) {
        var derived = Kdf.PBKDF2.derive(DigestAlgorithm.SHA1, "password".getBytes(UTF_8), "salt".getBytes(UTF_8),
                null, 20, iterations);
        assertThat(Hex.toHexString(derived)).isEqualTo(expected);
    }

    @Test
    public void pbkdf2ShouldUseTheStandaloneIterationCount() {
        var expected = Kdf.PBKDF2.derive(DigestAlgorithm.SHA256, IKM, SALT, null, 32,
                KdfConstants.PBKDF2_ITERATIONS);
        assertThat(Kdf.PBKDF2.derive(DigestAlgorithm.SHA256, IKM, SALT, null, 32)).isEqualTo(expected);
    }

    @Test
    public void eciesKeyMaterialShouldUseDefaultSaltAndReducedIterations() {
        var expected = Kdf.PBKDF2.derive(DigestAlgorithm.SHA512, IKM, KdfConstants.eciesDefaultSalt(), null,
                KdfConstants.ECIES_OUTPUT_SIZE, KdfConstants.ECIES_PBKDF2_ITERATIONS);
        assertThat(Kdf.PBKDF2.deriveEciesKeyMaterial(DigestAlgorithm.SHA512, IKM, null, null)).isEqualTo(expected);
    }

    @Test
    public void scryptShouldBeDeterministicAndSalted() {
        var first = Kdf.SCRYPT.derive(DigestAlgorithm.SHA256, IKM, SALT, null, 64);
        var second = Kdf.SCRYPT.derive(DigestAlgorithm.SHA256, IKM, SALT, null, 64);
        assertThat(first).hasSize(64).isEqualTo(second);
    }

    @DataProvider
    public Object[][] saltedKdfs() {
        return new Object[][] {
                { Kdf.PBKDF2, null },
                { Kdf.PBKDF2, new byte[0] },
                { Kdf.SCRYPT, null },
                { Kdf.SCRYPT, new byte[0] },
        };
    }

    @Test(dataProvider = "saltedKdfs")
    public void shouldRequireSalt(Kdf kdf, byte[] salt) {
        assertThatThrownBy(() -> kdf.derive(DigestAlgorithm.SHA256, IKM, salt, null, 32))
                .isInstanceOf(RequestValidationException.class);
    }

    @Test
    public void shouldRejectNonPositiveOutputLength() {
        assertThatThrownBy(() -> Kdf.HKDF.derive(DigestAlgorithm.SHA256, IKM, SALT, INFO, 0))
                .isInstanceOf(RequestValidationException.class);
    }
}
