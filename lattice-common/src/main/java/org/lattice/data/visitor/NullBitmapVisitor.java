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
import org.lattice.data.ArrayData;
import org.lattice.memory.Buffer;
import org.lattice.types.LayoutCategory;
import org.lattice.utils.BitBlockCount;
import org.lattice.utils.BitUtil;
import org.lattice.utils.BooleanConsumer;
import org.lattice.utils.BooleanConsumerWithException;
import org.lattice.utils.OptionalBitBlockCounter;

import javax.annotation.Nullable;

/**
 * 逐位置报告有效性的遍历器。
 *
 * <p>块结构与 {@link BitBlockVisitors} 相同:整块有效时报告 {@code true},整块为 null 时报告
 * {@code false},混合块逐位判断。每个位置恰好报告一次,按位置顺序进行。
 *
 * <p>{@code nullCount} 不参与遍历:即使 null 计数为 0 也总是扫描位图。NA 类型的数组没有位图,
 * 其每个位置都报告为 {@code false}。
 */
@Public
public final class NullBitmapVisitor {

    public static void visit(
            @Nullable Buffer validBits,
            int validBitsOffset,
            int numValues,
            int nullCount,
            BooleanConsumer visitValidity) {
        OptionalBitBlockCounter counter =
                new OptionalBitBlockCounter(validBits, validBitsOffset, numValues);
        int position = 0;
        while (position < numValues) {
            BitBlockCount block = counter.nextBlock();
            if (block.isAllSet()) {
                for (int i = 0; i < block.length(); ++i, ++position) {
                    visitValidity.accept(true);
                }
            } else if (block.isNoneSet()) {
                for (int i = 0; i < block.length(); ++i, ++position) {
                    visitValidity.accept(false);
                }
            } else {
                for (int i = 0; i < block.length(); ++i, ++position) {
                    visitValidity.accept(
                            BitUtil.getBit(validBits, (long) validBitsOffset + position));
                }
            }
        }
    }

    /**
     * 与 {@link #visit(Buffer, int, int, int, BooleanConsumer)} 相同,但回调抛出的第一个异常会立即
     * 原样传播,之后的位置不再访问。
     */
    public static <E extends Throwable> void tryVisit(
            @Nullable Buffer validBits,
            int validBitsOffset,
            int numValues,
            int nullCount,
            BooleanConsumerWithException<E> visitValidity)
            throws E {
        OptionalBitBlockCounter counter =
                new OptionalBitBlockCounter(validBits, validBitsOffset, numValues);
        int position = 0;
        while (position < numValues) {
            BitBlockCount block = counter.nextBlock();
            if (block.isAllSet()) {
                for (int i = 0; i < block.length(); ++i, ++position) {
                    visitValidity.accept(true);
                }
            } else if (block.isNoneSet()) {
                for (int i = 0; i < block.length(); ++i, ++position) {
                    visitValidity.accept(false);
                }
            } else {
                for (int i = 0; i < block.length(); ++i, ++position) {
                    visitValidity.accept(
                            BitUtil.getBit(validBits, (long) validBitsOffset + position));
                }
            }
        }
    }

    /** 遍历数组数据的有效位图。 */
    public static void visit(ArrayData data, BooleanConsumer visitValidity) {
        if (data.getType().getLayout() == LayoutCategory.NULL) {
            for (int i = 0; i < data.getLength(); ++i) {
                visitValidity.accept(false);
            }
            return;
        }
        visit(
                data.getValidityBuffer(),
                data.getOffset(),
                data.getLength(),
                data.getStoredNullCount(),
                visitValidity);
    }

    public static <E extends Throwable> void tryVisit(
            ArrayData data, BooleanConsumerWithException<E> visitValidity) throws E {
        if (data.getType().getLayout() == LayoutCategory.NULL) {
            for (int i = 0; i < data.getLength(); ++i) {
                visitValidity.accept(false);
            }
            return;
        }
        tryVisit(
                data.getValidityBuffer(),
                data.getOffset(),
                data.getLength(),
                data.getStoredNullCount(),
                visitValidity);
    }

    private NullBitmapVisitor() {}
}
