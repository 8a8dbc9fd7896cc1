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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.StringReader;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.bouncycastle.util.encoders.Base64;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemReader;

import io.cryptokits.KeyFormatException;

/**
 * RFC 7468 textual encoding. Output is canonical: LF line endings, 64 characters of Base64 per line and a trailing
 * newline after the END line.
 */
final class Pem {
    private static final int LINE_LENGTH = 64;
    private static final byte[] BEGIN_PREFIX = "-----BEGIN ".getBytes(StandardCharsets.US_ASCII);

    /**
     * Whether the input starts like a PEM document, ignoring leading whitespace.
     */
    static boolean looksLikePem(byte[] input) {
        int start = 0;
        while (start < input.length && Character.isWhitespace(input[start])) {
            start++;
        }
        return input.length - start >= BEGIN_PREFIX.length
                && Arrays.equals(input, start, start + BEGIN_PREFIX.length, BEGIN_PREFIX, 0, BEGIN_PREFIX.length);
    }

    static PemObject read(byte[] input) {
        var text = decodeUtf8(input);
        PemObject pem;
        try (var reader = new PemReader(new StringReader(text))) {
            pem = reader.readPemObject();
        } catch (IOException | RuntimeException e) {
            throw new KeyFormatException("Malformed PEM", e);
        }
        if (pem == null) {
            throw new KeyFormatException("No PEM block found");
        }
        return pem;
    }

    /**
     * Decodes a PEM document and checks that its label is the expected one.
     */
    static byte[] decode(byte[] input, String expectedLabel) {
        var pem = read(input);
        if (!pem.getType().equals(expectedLabel)) {
            throw new KeyFormatException("PEM label mismatch: expected '" + expectedLabel + "' but found '"
                    + pem.getType() + "'");
        }
        return pem.getContent();
    }

    static byte[] encode(String label, byte[] der) {
        var base64 = Base64.encode(der);
        var out = new ByteArrayOutputStream(base64.length + base64.length / LINE_LENGTH + 2 * label.length() + 40);
        try {
            writeAscii(out, "-----BEGIN " + label + "-----\n");
            for (int i = 0; i < base64.length; i += LINE_LENGTH) {
                out.write(base64, i, Math.min(LINE_LENGTH, base64.length - i));
                out.write('\n');
            }
            writeAscii(out, "-----END " + label + "-----\n");
            return out.toByteArray();
        } finally {
            Arrays.fill(base64, (byte) 0);
        }
    }

    private static void writeAscii(ByteArrayOutputStream out, String text) {
        out.writeBytes(text.getBytes(StandardCharsets.US_ASCII));
    }

    private static String decodeUtf8(byte[] input) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(input))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new KeyFormatException("PEM input is not valid UTF-8", e);
        }
    }

    private Pem() {}
}
