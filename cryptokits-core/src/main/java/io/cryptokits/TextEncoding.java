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

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

import org.bouncycastle.util.encoders.Base64;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

/**
 * How byte payloads are carried as text across the engine boundary.
 */
public enum TextEncoding {
    BASE64 {
        @Override
        public byte[] decode(String text) {
            try {
                return Base64.decode(text.strip());
            } catch (DecoderException e) {
                throw new RequestValidationException("Invalid Base64 input", e);
            }
        }

        @Override
        public String encode(byte[] data) {
            return Base64.toBase64String(data);
        }
    },
    HEX {
        @Override
        public byte[] decode(String text) {
            try {
                return Hex.decodeStrict(text.strip());
            } catch (DecoderException e) {
                throw new RequestValidationException("Invalid hex input", e);
            }
        }

        @Override
        public String encode(byte[] data) {
            return Hex.toHexString(data);
        }
    },
    UTF8 {
        @Override
        public byte[] decode(String text) {
            return text.getBytes(StandardCharsets.UTF_8);
        }

        @Override
        public String encode(byte[] data) {
            try {
                return StandardCharsets.UTF_8.newDecoder()
                        .onMalformedInput(CodingErrorAction.REPORT)
                        .onUnmappableCharacter(CodingErrorAction.REPORT)
                        .decode(ByteBuffer.wrap(data))
                        .toString();
            } catch (CharacterCodingException e) {
                throw new RequestValidationException("Output is not valid UTF-8, choose a binary encoding", e);
            }
        }
    };

    public abstract byte[] decode(String text);

    public abstract String encode(byte[] data);
}
