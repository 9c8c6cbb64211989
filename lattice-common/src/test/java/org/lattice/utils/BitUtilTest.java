/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.lattice.utils;

import org.lattice.memory.Buffer;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/** {@link BitUtil} 的测试。 */
class BitUtilTest {

    @Test
    void testBitOrderIsLeastSignificantFirst() {
        Buffer bitmap = Buffer.allocate(2);
        BitUtil.setBit(bitmap, 0);
        BitUtil.setBit(bitmap, 9);

        assertThat(bitmap.get(0)).isEqualTo((byte) 0b0000_0001);
        assertThat(bitmap.get(1)).isEqualTo((byte) 0b0000_0010);
        assertThat(BitUtil.getBit(bitmap, 9)).isTrue();
        assertThat(BitUtil.getBit(bitmap, 8)).isFalse();

        BitUtil.clearBit(bitmap, 9);
        assertThat(BitUtil.getBit(bitmap, 9)).isFalse();
        BitUtil.setBitTo(bitmap, 15, true);
        assertThat(bitmap.get(1)).isEqualTo((byte) 0b1000_0000);
    }

    @Test
    void testCountSetBits() {
        Buffer bitmap = Buffer.wrap(new byte[] {(byte) 0xFF, 0x0F, (byte) 0xF0});

        assertThat(BitUtil.countSetBits(bitmap, 0, 24)).isEqualTo(16);
        assertThat(BitUtil.countSetBits(bitmap, 4, 8)).isEqualTo(8);
        assertThat(BitUtil.countSetBits(bitmap, 12, 8)).isEqualTo(0);
        assertThat(BitUtil.countSetBits(bitmap, 3, 0)).isEqualTo(0);
        assertThat(BitUtil.countSetBits(bitmap, 20, 4)).isEqualTo(4);
    }

    @Test
    void testBytesForBits() {
        assertThat(BitUtil.bytesForBits(0)).isEqualTo(0);
        assertThat(BitUtil.bytesForBits(1)).isEqualTo(1);
        assertThat(BitUtil.bytesForBits(8)).isEqualTo(1);
        assertThat(BitUtil.bytesForBits(9)).isEqualTo(2);
    }
}
