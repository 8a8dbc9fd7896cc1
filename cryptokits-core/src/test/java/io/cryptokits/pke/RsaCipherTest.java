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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.security.KeyFactory;
import java.security.spec.MGF1ParameterSpec;
import java.security.spec.PKCS8EncodedKeySpec;

import javax.crypto.Cipher;
import javax.crypto.spec.OAEPParameterSpec;
import javax.crypto.spec.PSource;

import org.testng.annotations.AfterClass;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import io.cryptokits.DecryptionFailedException;
import io.cryptokits.RequestValidationException;
import io.cryptokits.UnsupportedAlgorithmException;
import io.cryptokits.crypto.DigestAlgorithm;
import io.cryptokits.keys.KeyCodec;
import io.cryptokits.keys.KeyContainer;
import io.cryptokits.keys.KeyFamily;
import io.cryptokits.keys.KeyFormat;
import io.cryptokits.keys.KeySerialization;
import io.cryptokits.keys.PrivateKeyHandle;
import io.cryptokits.keys.PublicKeyHandle;

public class RsaCipherTest {
    private static final KeyFormat PKCS8_DER = KeyFormat.of(KeyContainer.PKCS8, KeySerialization.DER);
    private static final KeyFormat SPKI_DER = KeyFormat.of(KeyContainer.SPKI, KeySerialization.DER);

    private byte[] pkcs8;
    private PrivateKeyHandle privateKey;
    private PublicKeyHandle publicKey;

    @BeforeClass
    public void generateKey() {
        try (var keyPair = KeyCodec.generate(KeyFamily.RSA, 2048, PKCS8_DER)) {
            pkcs8 = keyPair.privateKey().clone();
            privateKey = KeyCodec.importPrivateKey(keyPair.privateKey(), KeyFamily.RSA, PKCS8_DER);
            publicKey = KeyCodec.importPublicKey(keyPair.publicKey(), KeyFamily.RSA, SPKI_DER);
        }
    }

    @AfterClass
    public void destroyKey() {
        privateKey.close();
    }

    @DataProvider
    public Object[][] paddings() {
        return new Object[][] {
                { RsaPadding.PKCS1_V15, null, null },
                { RsaPadding.OAEP, null, null },
                { RsaPadding.OAEP, DigestAlgorithm.SHA1, DigestAlgorithm.SHA1 },
                { RsaPadding.OAEP, DigestAlgorithm.SHA384, DigestAlgorithm.SHA256 },
                { RsaPadding.OAEP, DigestAlgorithm.SHA3_512, DigestAlgorithm.SHA3_256 },
        };
    }

    @Test(dataProvider = "paddings")
    public void shouldRoundTrip(RsaPadding padding, DigestAlgorithm digest, DigestAlgorithm mgfDigest) {
        var ciphertext = RsaCipher.encrypt(publicKey, padding, digest, mgfDigest, "secret".getBytes(UTF_8));

        assertThat(ciphertext).hasSize(256);
        assertThat(RsaCipher.decrypt(privateKey, padding, digest, mgfDigest, ciphertext))
                .isEqualTo("secret".getBytes(UTF_8));
    }

    @Test
    public void shouldDefaultOaepToSha256Interoperably() throws Exception {
        var ciphertext = RsaCipher.encrypt(publicKey, RsaPadding.OAEP, null, null, "interop".getBytes(UTF_8));

        var jdkKey = KeyFactory.getInstance("RSA").generatePrivate(new PKCS8EncodedKeySpec(pkcs8));
        var cipher = Cipher.getInstance("RSA/ECB/OAEPPadding");
        cipher.init(Cipher.DECRYPT_MODE, jdkKey, new OAEPParameterSpec("SHA-256", "MGF1", MGF1ParameterSpec.SHA256,
                PSource.PSpecified.DEFAULT));

        assertThat(new String(cipher.doFinal(ciphertext), UTF_8)).isEqualTo("interop");
    }

    @Test
    public void shouldReportDigestMismatchAsDecryptionFailure() {
        var ciphertext = RsaCipher.encrypt(publicKey, RsaPadding.OAEP, DigestAlgorithm.SHA256, null, new byte[10]);

        assertThatThrownBy(() -> RsaCipher.decrypt(privateKey, RsaPadding.OAEP, DigestAlgorithm.SHA512, null,
                ciphertext))
                .isInstanceOf(DecryptionFailedException.class)
                .hasNoCause();
    }

    @Test
    public void shouldRejectOversizedPlaintext() {
        assertThatThrownBy(() -> RsaCipher.encrypt(publicKey, RsaPadding.PKCS1_V15, null, null, new byte[246]))
                .isInstanceOf(RequestValidationException.class);
    }

    @Test
    public void shouldRejectNonRsaKeys() {
        try (var keyPair = KeyCodec.generate(KeyFamily.NIST_P256, 0, PKCS8_DER)) {
            var ecKey = KeyCodec.importPublicKey(keyPair.publicKey(), KeyFamily.NIST_P256, SPKI_DER);
            assertThatThrownBy(() -> RsaCipher.encrypt(ecKey, RsaPadding.OAEP, null, null, new byte[1]))
                    .isInstanceOf(UnsupportedAlgorithmException.class);
        }
    }
}
