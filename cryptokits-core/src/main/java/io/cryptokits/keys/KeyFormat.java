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

/**
 * A container paired with the serialization it is written in.
 */
public record KeyFormat(KeyContainer container, KeySerialization serialization) {
    public KeyFormat {
        requireNonNull(container, "container");
        requireNonNull(serialization, "serialization");
    }

    public static KeyFormat of(KeyContainer container, KeySerialization serialization) {
        return new KeyFormat(container, serialization);
    }

    public KeyFormat publicCounterpart() {
        return new KeyFormat(container.publicCounterpart(), serialization);
    }

    @Override
    public String toString() {
        return container + "/" + serialization;
    }
}
