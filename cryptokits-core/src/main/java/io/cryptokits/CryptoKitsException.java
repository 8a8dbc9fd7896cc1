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

/**
 * Base class of every failure reported by the engine. Failures are never fatal to the process: callers catch the
 * specific subclass they can handle, or this class to handle them all.
 */
public abstract class CryptoKitsException extends RuntimeException {

    protected CryptoKitsException(String message) {
        super(message);
    }

    protected CryptoKitsException(String message, Throwable cause) {
        super(message, cause);
    }
}
