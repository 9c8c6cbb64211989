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

package org.lattice.data.visitor;

import org.lattice.annotation.Public;
import org.lattice.memory.Buffer;
import org.lattice.utils.BitBlockCount;
import org.lattice.utils.BitUtil;
import org.lattice.utils.IntConsumerWithException;
import org.lattice.utils.OptionalBitBlockCounter;
import org.lattice.utils.RunnableWithException;

import javax.annotation.Nullable;

import java.util.function.IntConsumer;

/**
 * 按有效位图的连续块驱动 not-null / null 回调。
 *
 * <p>位图被切分为若干块:整块有效时对每个位置调用 not-null 回调,整块为 null 时调用 null 回调,
 * 两者混合时逐位判断。回调总共调用 {@code length} 次,按位置 {@code 0 .. length - 1} 依次进行。
 * 传给 not-null 回调的位置相对于 {@code offset},不含偏移。位图为 null 时所有位置都有效。
 *
 * <p>{@code visit*} 形式的回调不会失败,遍历总是执行到底;{@code tryVisit*} 形式中回调抛出的
 * 第一个异常原样传播给调用方,之后的位置不再访问。
 */
@Public
public final class BitBlockVisitors {

    /**
     * 遍历位图,回调不会失败。
     *
     * @param bitmap 有效位图,为 null 表示全部有效
     * @param offset 第一个位置在位图中的位索引
     * @param length 位置个数
     * @param visitNotNull 有效位置的回调,参数为位置
     * @param visitNull null 位置的回调
     */
    public static void visitBitBlocks(
            @Nullable Buffer bitmap,
            int offset,
            int length,
            IntConsumer visitNotNull,
            Runnable visitNull) {
        OptionalBitBlockCounter counter = new OptionalBitBlockCounter(bitmap, offset, length);
        int position = 0;
        while (position < length) {
            BitBlockCount block = counter.nextBlock();
            if (block.isAllSet()) {
                for (int i = 0; i < block.length(); ++i, ++position) {
                    visitNotNull.accept(position);
                }
            } else if (block.isNoneSet()) {
                for (int i = 0; i < block.length(); ++i, ++position) {
                    visitNull.run();
                }
            } else {
                for (int i = 0; i < block.length(); ++i, ++position) {
                    if (BitUtil.getBit(bitmap, (long) offset + position)) {
                        visitNotNull.accept(position);
                    } else {
                        visitNull.run();
                    }
                }
            }
        }
    }

    /**
     * 遍历位图,任一回调抛出异常时立即停止。
     *
     * @throws E 第一个回调抛出的异常,不做包装
     */
    public static <E extends Throwable> void tryVisitBitBlocks(
            @Nullable Buffer bitmap,
            int offset,
            int length,
            IntConsumerWithException<E> visitNotNull,
            RunnableWithException<E> visitNull)
            throws E {
        OptionalBitBlockCounter counter = new OptionalBitBlockCounter(bitmap, offset, length);
        int position = 0;
        while (position < length) {
            BitBlockCount block = counter.nextBlock();
            if (block.isAllSet()) {
                for (int i = 0; i < block.length(); ++i, ++position) {
                    visitNotNull.accept(position);
                }
            } else if (block.isNoneSet()) {
                for (int i = 0; i < block.length(); ++i, ++position) {
                    visitNull.run();
                }
            } else {
                for (int i = 0; i < block.length(); ++i, ++position) {
                    if (BitUtil.getBit(bitmap, (long) offset + position)) {
                        visitNotNull.accept(position);
                    } else {
                        visitNull.run();
                    }
                }
            }
        }
    }

    private BitBlockVisitors() {}
}
