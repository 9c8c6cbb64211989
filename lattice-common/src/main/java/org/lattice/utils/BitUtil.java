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

/**
 * 按最低有效位优先 (LSB) 顺序访问压缩位图的工具方法。
 *
 * <p>第 {@code i} 位位于字节 {@code i / 8} 的第 {@code i % 8} 位。
 */
public class BitUtil {

    private static final int BYTE_INDEX_MASK = 0x00000007;

    /** 容纳 {@code bits} 个位所需的字节数。 */
    public static int bytesForBits(long bits) {
        return (int) ((bits + 7) >>> 3);
    }

    public static boolean getBit(Buffer bitmap, long index) {
        int byteIndex = (int) (index >>> 3);
        return (bitmap.get(byteIndex) & (1 << (index & BYTE_INDEX_MASK))) != 0;
    }

    public static void setBit(Buffer bitmap, long index) {
        int byteIndex = (int) (index >>> 3);
        byte current = bitmap.get(byteIndex);
        current |= (byte) (1 << (index & BYTE_INDEX_MASK));
        bitmap.put(byteIndex, current);
    }

    public static void clearBit(Buffer bitmap, long index) {
        int byteIndex = (int) (index >>> 3);
        byte current = bitmap.get(byteIndex);
        current &= (byte) ~(1 << (index & BYTE_INDEX_MASK));
        bitmap.put(byteIndex, current);
    }

    public static void setBitTo(Buffer bitmap, long index, boolean value) {
        if (value) {
            setBit(bitmap, index);
        } else {
            clearBit(bitmap, index);
        }
    }

    /**
     * 统计位图 {@code [bitOffset, bitOffset + length)} 范围内被置位的位数。
     *
     * <p>首尾不满一个字节的部分逐位统计,中间整字节使用 {@link Integer#bitCount}。
     */
    public static int countSetBits(Buffer bitmap, long bitOffset, int length) {
        long pos = bitOffset;
        long end = bitOffset + length;
        int count = 0;

        while (pos < end && (pos & BYTE_INDEX_MASK) != 0) {
            if (getBit(bitmap, pos)) {
                count++;
            }
            pos++;
        }
        while (end - pos >= 8) {
            count += Integer.bitCount(bitmap.get((int) (pos >>> 3)) & 0xFF);
            pos += 8;
        }
        while (pos < end) {
            if (getBit(bitmap, pos)) {
                count++;
            }
            pos++;
        }
        return count;
    }

    private BitUtil() {}
}
