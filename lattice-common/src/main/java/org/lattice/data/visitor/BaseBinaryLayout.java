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
import org.lattice.memory.BinaryView;
import org.lattice.memory.Buffer;

/**
 * 变长二进制与字符串布局。
 *
 * <p>偏移量缓冲区按 offset 寻址,第 {@code i} 个值是值缓冲区中
 * {@code [offsets[offset + i], offsets[offset + i + 1])} 这段字节。值缓冲区本身从不按 offset 平移,
 * 缺失时视为空。
 *
 * <p>返回的 {@link BinaryView} 借用自值缓冲区,不复制数据,不应在回调返回后保留。
 */
@Public
public final class BaseBinaryLayout implements PhysicalLayout<BinaryView> {

    /** int32 偏移量,用于 binary 与 string。 */
    public static final BaseBinaryLayout BINARY = new BaseBinaryLayout(false);

    /** int64 偏移量,用于 large binary 与 large string。 */
    public static final BaseBinaryLayout LARGE_BINARY = new BaseBinaryLayout(true);

    private static final Buffer EMPTY = Buffer.allocate(0);

    private final boolean large;

    private BaseBinaryLayout(boolean large) {
        this.large = large;
    }

    public boolean isLarge() {
        return large;
    }

    @Override
    public ValueAdapter<BinaryView> bind(ArrayData data) {
        Buffer offsets = data.getBuffer(1);
        Buffer values = data.getBuffer(2);
        Buffer bytes = values == null ? EMPTY : values;
        int offset = data.getOffset();
        if (large) {
            return position -> {
                int index = (offset + position) * 8;
                int start = (int) offsets.getLong(index);
                int end = (int) offsets.getLong(index + 8);
                return new BinaryView(bytes, start, end - start);
            };
        }
        return position -> {
            int index = (offset + position) * 4;
            int start = offsets.getInt(index);
            return new BinaryView(bytes, start, offsets.getInt(index + 4) - start);
        };
    }

    @Override
    public String toString() {
        return large ? "BaseBinaryLayout(LARGE)" : "BaseBinaryLayout";
    }
}
