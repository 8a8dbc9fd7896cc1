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

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigInteger;
import java.util.Arrays;

import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class CryptoUtilsTest {

    @DataProvider
    public Object[][] reverseTestCases() {
        return new Object[][] {
                { new byte[0], new byte[0] },
                { new byte[] { 42 }, new byte[] { 42 } },
                { new byte[] { 1, 2 }, new byte[] { 2, 1 } },
                { new byte[] { 1, 2, 3 }, new byte[] { 3, 2, 1 } },
        };
    }

    @Test(dataProvider = "reverseTestCases")
    public void testReverse(byte[] original, byte[] reversed) {
        assertThat(CryptoUtils.reverseInPlace(original.clone())).isEqualTo(reversed);
        assertThat(CryptoUtils.reverseInPlace(reversed.clone())).isEqualTo(original);
    }

    @DataProvider
    public Object[][] littleEndianTestCases() {
        var fortyTwo = new byte[32];
        fortyTwo[0] = 42;
        var allOnes = new byte[32];
        Arrays.fill(allOnes, (byte) -1);
        return new Object[][] {
                { BigInteger.ZERO, new byte[32] },
                { BigInteger.valueOf(42), fortyTwo },
                { BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE), allOnes },
        };
    }

    @Test(dataProvider = "littleEndianTestCases")
    public void testLittleEndianRoundTrip(BigInteger value, byte[] littleEndian) {
        assertThat(CryptoUtils.toUnsignedLittleEndian(value, 32)).isEqualTo(littleEndian);
        assertThat(CryptoUtils.fromUnsignedLittleEndian(littleEndian)).isEqualTo(value);
    }

    @Test
    public void fromLittleEndianShouldNotModifyInput() {
        var input = new byte[] { 1, 2, 3 };
        CryptoUtils.fromUnsignedLittleEndian(input);
        assertThat(input).containsExactly(1, 2, 3);
    }

    @DataProvider
    public Object[][] concatTestCases() {
        return new Object[][] {
                { new byte[0], new byte[0] },
                { new byte[0], new byte[0], new byte[0] },
                { new byte[] { 42 }, new byte[] { 42 }, new byte[0], new byte[0] },
                { new byte[] { 42 }, new byte[0], new byte[0], new byte[] { 42 } },
                { new byte[] { 1, 2, 3 }, new byte[] { 1 }, new byte[] { 2 }, new byte[] { 3 } },
                { new byte[] { 1, 2, 3 }, new byte[0], new byte[] { 1, 2 }, new byte[] { 3 } },
        };
    }

    @Test(dataProvider = "concatTestCases")
    public void testConcat(byte[] concatenation, byte[]... components) {
        assertThat(CryptoUtils.concat(components)).isEqualTo(concatenation);
    }

    @Test
    public void shouldWipeAllArraysAndSkipNulls() {
        var a = new byte[] { 1, 2, 3 };
        var b = new byte[] { 4 };
        CryptoUtils.wipe(a, null, b);
        assertThat(a).containsOnly(0);
        assertThat(b).containsOnly(0);
    }

    @Test
    public void shouldGenerateDistinctRandomBytes() {
        assertThat(CryptoUtils.randomBytes(32)).hasSize(32).isNotEqualTo(CryptoUtils.randomBytes(32));
    }
}
