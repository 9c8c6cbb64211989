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

import static org.lattice.utils.Preconditions.checkArgument;
import static org.lattice.utils.Preconditions.checkNotNull;

/**
 * 按 64 位字扫描压缩位图,返回连续的 {@link BitBlockCount} 块。
 *
 * <p>每次调用 {@link #nextWord()} 消费最多 64 位;{@link #nextFourWords()} 消费最多 256 位,
 * 适合预期大部分位都被置位的场景。所有块的长度之和恰好等于构造时的 {@code length},
 * 之后的调用返回长度为 0 的块。
 *
 * <p>起始位不是字节对齐时,每个块由相邻两个小端序字移位拼接得到。剩余位数不足以安全读取
 * 完整的字时,退化为逐字节统计的慢路径;慢路径在一次扫描中最多触发两次。
 *
 * <p>该类有状态,不是线程安全的;每次扫描创建一个新实例。
 */
public class BitBlockCounter {

    static final int WORD_BITS = 64;

    static final int FOUR_WORDS_BITS = WORD_BITS * 4;

    private final Buffer bitmap;

    /** 下一个待读取字在 {@link #bitmap} 中的字节位置。 */
    private int bytePosition;

    private long bitsRemaining;

    /** 起始位在字节内的偏移,取值 [0, 8)。 */
    private final int offset;

    /**
     * @param bitmap 位图缓冲区
     * @param startOffset 第一个待扫描位的绝对位索引
     * @param length 待扫描的位数
     */
    public BitBlockCounter(Buffer bitmap, long startOffset, long length) {
        checkNotNull(bitmap, "Bitmap must not be null.");
        checkArgument(startOffset >= 0, "Start offset must not be negative: %s", startOffset);
        checkArgument(length >= 0, "Length must not be negative: %s", length);
        this.bitmap = bitmap;
        this.bytePosition = (int) (startOffset >>> 3);
        this.bitsRemaining = length;
        this.offset = (int) (startOffset & 7);
    }

    /** 返回下一个最多 64 位的块。 */
    public BitBlockCount nextWord() {
        if (bitsRemaining == 0) {
            return new BitBlockCount(0, 0);
        }
        int popCount;
        if (offset == 0) {
            if (bitsRemaining < WORD_BITS) {
                return getBlockSlow(WORD_BITS);
            }
            popCount = Long.bitCount(loadWord(bytePosition));
        } else {
            // 移位拼接需要读取最后一个对齐字之后的下一个字
            if (bitsRemaining < 2 * WORD_BITS - offset) {
                return getBlockSlow(WORD_BITS);
            }
            popCount =
                    Long.bitCount(
                            shiftWord(loadWord(bytePosition), loadWord(bytePosition + 8), offset));
        }
        bytePosition += WORD_BITS / 8;
        bitsRemaining -= WORD_BITS;
        return new BitBlockCount(WORD_BITS, popCount);
    }

    /** 返回下一个最多 256 位的块。 */
    public BitBlockCount nextFourWords() {
        if (bitsRemaining == 0) {
            return new BitBlockCount(0, 0);
        }
        int totalPopCount = 0;
        if (offset == 0) {
            if (bitsRemaining < FOUR_WORDS_BITS) {
                return getBlockSlow(FOUR_WORDS_BITS);
            }
            for (int i = 0; i < 4; i++) {
                totalPopCount += Long.bitCount(loadWord(bytePosition + i * 8));
            }
        } else {
            if (bitsRemaining < 5 * WORD_BITS - offset) {
                return getBlockSlow(FOUR_WORDS_BITS);
            }
            long current = loadWord(bytePosition);
            for (int i = 1; i <= 4; i++) {
                long next = loadWord(bytePosition + i * 8);
                totalPopCount += Long.bitCount(shiftWord(current, next, offset));
                current = next;
            }
        }
        bytePosition += FOUR_WORDS_BITS / 8;
        bitsRemaining -= FOUR_WORDS_BITS;
        return new BitBlockCount(FOUR_WORDS_BITS, totalPopCount);
    }

    private BitBlockCount getBlockSlow(int blockSize) {
        int runLength = (int) Math.min(bitsRemaining, blockSize);
        int popCount = BitUtil.countSetBits(bitmap, (long) bytePosition * 8 + offset, runLength);
        bitsRemaining -= runLength;
        // 第一次进入慢路径时 runLength 必然是 8 的倍数
        bytePosition += runLength / 8;
        return new BitBlockCount(runLength, popCount);
    }

    private long loadWord(int index) {
        return bitmap.getLong(index);
    }

    private static long shiftWord(long current, long next, int shift) {
        return (current >>> shift) | (next << (WORD_BITS - shift));
    }
}
