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
import org.lattice.memory.Buffer;
import org.lattice.types.TypeId;

/**
 * 变长列表数组,包括 int64 偏移量的 large list。
 *
 * <p>第 {@code i} 个列表是子数组 {@link #values()} 中 {@code [valueOffset(i), valueOffset(i + 1))}
 * 这一段。
 */
@Public
public class ListArray extends Array {

    private final boolean large;

    public ListArray(ArrayData data) {
        super(data);
        this.large = data.getType().is(TypeId.LARGE_LIST);
    }

    public boolean isLarge() {
        return large;
    }

    public long valueOffset(int i) {
        Buffer offsets = data.getBuffer(1);
        int index = data.getOffset() + i;
        return large ? offsets.getLong(index * 8) : offsets.getInt(index * 4);
    }

    public int valueLength(int i) {
        return (int) (valueOffset(i + 1) - valueOffset(i));
    }

    /** 所有列表元素组成的子数组,不按当前数组的 offset 切片。 */
    public Array values() {
        return Array.make(data.getChild(0));
    }

    /** 第 {@code i} 个列表的元素视图。 */
    public Array getList(int i) {
        return Array.make(data.getChild(0).slice((int) valueOffset(i), valueLength(i)));
    }
}
