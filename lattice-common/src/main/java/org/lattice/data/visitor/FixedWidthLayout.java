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
import org.lattice.data.DayTimeInterval;
import org.lattice.memory.Buffer;

/**
 * 定宽数值布局: 第 {@code i} 个值位于值缓冲区的 {@code (offset + i) * byteWidth} 处。
 *
 * <p>返回的是缓冲区中存储的原始值。无符号整数按同宽度的有符号 Java 类型返回,
 * 半精度浮点数返回原始的 16 位。
 *
 * @param <V> 值的类型
 */
@Public
public final class FixedWidthLayout<V> implements PhysicalLayout<V> {

    /** int8、uint8。 */
    public static final FixedWidthLayout<Byte> BYTE =
            new FixedWidthLayout<>("BYTE", 1, Buffer::get);

    /** int16、uint16、half float。 */
    public static final FixedWidthLayout<Short> SHORT =
            new FixedWidthLayout<>("SHORT", 2, Buffer::getShort);

    /** int32、uint32、date32、time32、月区间。 */
    public static final FixedWidthLayout<Integer> INT =
            new FixedWidthLayout<>("INT", 4, Buffer::getInt);

    /** int64、uint64、date64、timestamp、time64、duration。 */
    public static final FixedWidthLayout<Long> LONG =
            new FixedWidthLayout<>("LONG", 8, Buffer::getLong);

    public static final FixedWidthLayout<Float> FLOAT =
            new FixedWidthLayout<>("FLOAT", 4, Buffer::getFloat);

    public static final FixedWidthLayout<Double> DOUBLE =
            new FixedWidthLayout<>("DOUBLE", 8, Buffer::getDouble);

    /** 天加毫秒区间,两个 int32 连续存储。 */
    public static final FixedWidthLayout<DayTimeInterval> DAY_TIME =
            new FixedWidthLayout<>(
                    "DAY_TIME",
                    8,
                    (buffer, index) ->
                            new DayTimeInterval(buffer.getInt(index), buffer.getInt(index + 4)));

    private final String name;

    private final int byteWidth;

    private final ValueReader<V> reader;

    private FixedWidthLayout(String name, int byteWidth, ValueReader<V> reader) {
        this.name = name;
        this.byteWidth = byteWidth;
        this.reader = reader;
    }

    public int byteWidth() {
        return byteWidth;
    }

    @Override
    public ValueAdapter<V> bind(ArrayData data) {
        Buffer values = data.getBuffer(1);
        int offset = data.getOffset();
        return position -> reader.read(values, (offset + position) * byteWidth);
    }

    @Override
    public String toString() {
        return "FixedWidthLayout(" + name + ")";
    }

    /** 从缓冲区的字节位置读取一个值。 */
    @FunctionalInterface
    private interface ValueReader<V> {
        V read(Buffer buffer, int index);
    }
}
