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

import static java.util.Objects.requireNonNull;

/**
 * A byte string carried as text, together with the encoding needed to recover the bytes.
 */
public record EncodedText(String text, TextEncoding encoding) {
    public EncodedText {
        requireNonNull(text, "text");
        requireNonNull(encoding, "encoding");
    }

    public static EncodedText base64(String text) {
        return new EncodedText(text, TextEncoding.BASE64);
    }

    public static EncodedText hex(String text) {
        return new EncodedText(text, TextEncoding.HEX);
    }

    public static EncodedText utf8(String text) {
        return new EncodedText(text, TextEncoding.UTF8);
    }

    public byte[] bytes() {
        return encoding.decode(text);
    }

    static byte[] bytesOrNull(EncodedText value) {
        return value == null ? null : value.bytes();
    }

    @Override
    public String toString() {
        return "EncodedText{encoding=" + encoding + ", length=" + text.length() + "}";
    }
}
