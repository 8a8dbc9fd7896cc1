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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.OptionalInt;

import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import io.cryptokits.KeyFormatException;
import io.cryptokits.UnsupportedAlgorithmException;

public class KeyParserTest {

    @DataProvider
    public Object[][] generatedKeys() {
        return new Object[][] {
                { KeyFamily.RSA, KeyFormat.of(KeyContainer.PKCS8, KeySerialization.DER) },
                { KeyFamily.RSA, KeyFormat.of(KeyContainer.PKCS1, KeySerialization.PEM) },
                { KeyFamily.RSA, KeyFormat.of(KeyContainer.PKCS1, KeySerialization.DER) },
                { KeyFamily.NIST_P256, KeyFormat.of(KeyContainer.PKCS8, KeySerialization.PEM) },
                { KeyFamily.NIST_P384, KeyFormat.of(KeyContainer.SEC1, KeySerialization.DER) },
                { KeyFamily.NIST_P521, KeyFormat.of(KeyContainer.SEC1, KeySerialization.PEM) },
                { KeyFamily.SECP256K1, KeyFormat.of(KeyContainer.PKCS8, KeySerialization.DER) },
                { KeyFamily.SM2, KeyFormat.of(KeyContainer.SEC1, KeySerialization.DER) },
                { KeyFamily.CURVE25519, KeyFormat.of(KeyContainer.PKCS8, KeySerialization.PEM) },
        };
    }

    @Test(dataProvider = "generatedKeys")
    public void shouldIdentifyPrivateAndPublicKeys(KeyFamily family, KeyFormat format) {
        try (var keyPair = KeyCodec.generate(family, 1024, format)) {
            var privateInfo = KeyParser.parse(keyPair.privateKey());
            var publicInfo = KeyParser.parse(keyPair.publicKey());

            assertThat(privateInfo.family()).isEqualTo(family);
            assertThat(privateInfo.format()).isEqualTo(format);
            assertThat(privateInfo.isPublic()).isFalse();
            assertThat(publicInfo.family()).isEqualTo(family);
            assertThat(publicInfo.format()).isEqualTo(format.publicCounterpart());
            assertThat(publicInfo.isPublic()).isTrue();

            var expectedBits = family == KeyFamily.RSA ? OptionalInt.of(1024) : OptionalInt.empty();
            assertThat(privateInfo.rsaModulusBits()).isEqualTo(expectedBits);
            assertThat(publicInfo.rsaModulusBits()).isEqualTo(expectedBits);
        }
    }

    @Test
    public void shouldIdentifyBareSec1Point() {
        try (var keyPair = KeyCodec.generate(KeyFamily.NIST_P384, 0,
                KeyFormat.of(KeyContainer.PKCS8, KeySerialization.DER))) {
            var point = KeyCodec.transcode(keyPair.publicKey(), KeyFamily.NIST_P384,
                    KeyFormat.of(KeyContainer.SPKI, KeySerialization.DER),
                    KeyFormat.of(KeyContainer.SEC1, KeySerialization.DER), true);

            var info = KeyParser.parse(point);

            assertThat(info.family()).isEqualTo(KeyFamily.NIST_P384);
            assertThat(info.format().container()).isEqualTo(KeyContainer.SEC1);
            assertThat(info.isPublic()).isTrue();
        }
    }

    @Test
    public void shouldRejectUnknownPemLabel() {
        var pem = Pem.encode("CERTIFICATE", new byte[] { 0x30, 0x00 });
        assertThatThrownBy(() -> KeyParser.parse(pem)).isInstanceOf(UnsupportedAlgorithmException.class);
    }

    @Test
    public void shouldRejectUnrecognisedDer() {
        assertThatThrownBy(() -> KeyParser.parse(new byte[] { 0x30, 0x03, 0x02, 0x01, 0x05 }))
                .isInstanceOf(UnsupportedAlgorithmException.class);
    }

    @Test
    public void shouldReportMalformedPem() {
        var pem = "-----BEGIN PUBLIC KEY-----\n!!!!\n-----END PUBLIC KEY-----\n".getBytes(UTF_8);
        assertThatThrownBy(() -> KeyParser.parse(pem)).isInstanceOf(KeyFormatException.class);
    }
}
