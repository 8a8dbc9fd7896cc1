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

import java.util.function.Supplier;

import javax.crypto.SecretKey;

import org.bouncycastle.crypto.Digest;
import org.bouncycastle.crypto.digests.SHA1Digest;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.digests.SHA384Digest;
import org.bouncycastle.crypto.digests.SHA3Digest;
import org.bouncycastle.crypto.digests.SHA512Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * The hash functions that KDFs, OAEP and HMAC can be instantiated with.
 */
public enum DigestAlgorithm {
    SHA1("SHA-1", SHA1Digest::new),
    SHA256("SHA-256", SHA256Digest::new),
    SHA384("SHA-384", SHA384Digest::new),
    SHA512("SHA-512", SHA512Digest::new),
    SHA3_256("SHA3-256", () -> new SHA3Digest(256)),
    SHA3_384("SHA3-384", () -> new SHA3Digest(384)),
    SHA3_512("SHA3-512", () -> new SHA3Digest(512));

    private final String algorithmName;
    private final Supplier<Digest> factory;

    DigestAlgorithm(String algorithmName, Supplier<Digest> factory) {
        this.algorithmName = algorithmName;
        this.factory = factory;
    }

    public String algorithmName() {
        return algorithmName;
    }

    /**
     * A fresh, unshared digest instance. BouncyCastle digests are stateful, so every call gets its own.
     */
    public Digest newDigest() {
        return factory.get();
    }

    public int outputSizeBytes() {
        return newDigest().getDigestSize();
    }

    public byte[] hash(byte[] data) {
        var digest = newDigest();
        digest.update(data, 0, data.length);
        var out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return out;
    }

    /**
     * Computes HMAC over the concatenation of the given blocks, keyed with this hash function.
     */
    public byte[] hmac(SecretKey key, byte[]... data) {
        var mac = new HMac(newDigest());
        var keyBytes = key instanceof DestroyableSecretKey dsk ? dsk.getKeyBytes() : key.getEncoded();
        mac.init(new KeyParameter(keyBytes));
        for (byte[] block : data) {
            mac.update(block, 0, block.length);
        }
        var tag = new byte[mac.getMacSize()];
        mac.doFinal(tag, 0);
        return tag;
    }

    /**
     * The JCA name of HMAC over this digest: {@code HmacSHA256} for SHA-2 but {@code HmacSHA3-256} for SHA-3.
     */
    public String hmacAlgorithmName() {
        return name().startsWith("SHA3") ? "Hmac" + algorithmName : "Hmac" + algorithmName.replace("-", "");
    }
}
