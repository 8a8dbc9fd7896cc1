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

import java.security.Key;
import java.util.Arrays;
import java.util.Objects;

import javax.security.auth.Destroyable;

import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A thin wrapper around an slf4j {@link Logger} that redacts key material passed as a log argument. Byte arrays and
 * {@link Key}s are reduced to their first and last three bytes (or removed entirely when short), and any other
 * {@link Destroyable} is replaced by its type name.
 */
public final class RedactedLogger {
    private final Logger realLogger;

    RedactedLogger(Logger realLogger) {
        this.realLogger = Objects.requireNonNull(realLogger);
    }

    public static RedactedLogger getLogger(Class<?> forClass) {
        return new RedactedLogger(LoggerFactory.getLogger(forClass));
    }

    public void trace(String format, Object... args) {
        if (realLogger.isTraceEnabled()) {
            realLogger.trace(format, redactAll(args));
        }
    }

    public void debug(String format, Object... args) {
        if (realLogger.isDebugEnabled()) {
            realLogger.debug(format, redactAll(args));
        }
    }

    public void info(String format, Object... args) {
        if (realLogger.isInfoEnabled()) {
            realLogger.info(format, redactAll(args));
        }
    }

    static Object redact(Object arg) {
        if (arg instanceof byte[] bytes) {
            return maskForLog(bytes);
        } else if (arg instanceof Key key) {
            return key instanceof Destroyable d && d.isDestroyed() ? "<destroyed>" : maskForLog(key.getEncoded());
        } else if (arg instanceof Destroyable) {
            return "<" + arg.getClass().getSimpleName() + ">";
        } else {
            return arg;
        }
    }

    private static Object[] redactAll(Object[] args) {
        // A trailing Throwable is passed through untouched so slf4j still prints the stack trace
        return Arrays.stream(args).map(RedactedLogger::redact).toArray();
    }

    private static String maskForLog(byte[] secret) {
        return secret == null
                ? "null"
                : secret.length < 16
                ? "<redacted>"
                : Hex.toHexString(secret, 0, 3) + "..." + Hex.toHexString(secret, secret.length - 3, 3);
    }
}
