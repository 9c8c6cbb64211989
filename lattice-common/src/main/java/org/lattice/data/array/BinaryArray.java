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

package org.lattice.data.array;

import org.lattice.annotation.Public;
import org.lattice.data.ArrayData;
import org.lattice.memory.BinaryView;
import org.lattice.memory.Buffer;
import org.lattice.types.BaseBinaryType;

/**
 * 变长二进制与字符串数组,包括 int64 偏移量的 large 变体。
 *
 * <p>偏移量按 offset 寻址,值缓冲区按偏移量中的绝对位置寻址。
 */
@Public
public class BinaryArray extends Array {

    private static final Buffer EMPTY = Buffer.allocate(0);

    private final boolean large;

    public BinaryArray(ArrayData data) {
        super(data);
        this.large = ((BaseBinaryType) data.getType()).isLarge();
    }

    public boolean isLarge() {
        return large;
    }

    /** 位置 {@code i} 的值在值缓冲区中的起始位置。 */
    public long valueOffset(int i) {
        Buffer offsets = data.getBuffer(1);
        int index = data.getOffset() + i;
        return large ? offsets.getLong(index * 8) : offsets.getInt(index * 4);
    }

    public int valueLength(int i) {
        return (int) (valueOffset(i + 1) - valueOffset(i));
    }

    /** 返回借用自值缓冲区的视图,不复制数据。 */
    public BinaryView getView(int i) {
        Buffer values = data.getBuffer(2);
        return new BinaryView(
                values == null ? EMPTY : values, (int) valueOffset(i), valueLength(i));
    }

    public byte[] getBytes(int i) {
        return getView(i).toBytes();
    }

    public String getString(int i) {
        return getView(i).toUtf8String();
    }
}
