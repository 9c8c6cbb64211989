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

import org.lattice.annotation.VisibleForTesting;
import org.lattice.memory.Buffer;

import javax.annotation.Nullable;

/**
 * 允许位图为 null 的 {@link BitBlockCounter}。
 *
 * <p>位图为 null 表示所有位都有效,此时直接返回整块有效的块,不读取任何内存。
 */
public class OptionalBitBlockCounter {

    @VisibleForTesting
    static final int MAX_BLOCK_SIZE = Short.MAX_VALUE;

    private final boolean hasBitmap;

    private long position;

    private final long length;

    @Nullable private final BitBlockCounter counter;

    public OptionalBitBlockCounter(@Nullable Buffer bitmap, long offset, long length) {
        this.hasBitmap = bitmap != null;
        this.position = 0;
        this.length = length;
        this.counter = bitmap == null ? null : new BitBlockCounter(bitmap, offset, length);
    }

    /**
     * 返回下一个块。没有位图时块长度最多为 {@link Short#MAX_VALUE},有位图时每次扫描最多四个 64 位字。
     */
    public BitBlockCount nextBlock() {
        if (hasBitmap) {
            return counter.nextFourWords();
        }
        int blockSize = (int) Math.min(MAX_BLOCK_SIZE, length - position);
        position += blockSize;
        return new BitBlockCount(blockSize, blockSize);
    }
}
