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
import org.lattice.types.UnionType;

/**
 * 稀疏与稠密联合数组。
 *
 * <p>缓冲区为 {@code [null, typeIds, offsets?]},没有有效位图。稀疏联合的第 {@code i} 个值位于
 * 对应子数组的 {@code offset + i};稠密联合的位置由 int32 偏移量缓冲区给出。
 */
@Public
public class UnionArray extends Array {

    private final UnionType unionType;

    public UnionArray(ArrayData data) {
        super(data);
        this.unionType = (UnionType) data.getType();
    }

    public UnionType.Mode mode() {
        return unionType.getMode();
    }

    public byte typeCode(int i) {
        return data.getBuffer(1).get(data.getOffset() + i);
    }

    public int childId(int i) {
        return unionType.getChildId(typeCode(i));
    }

    /** 第 {@code i} 个值在其子数组中的位置。 */
    public int valueOffset(int i) {
        if (mode() == UnionType.Mode.DENSE) {
            return data.getBuffer(2).getInt((data.getOffset() + i) * 4);
        }
        return data.getOffset() + i;
    }

    public Array field(int childId) {
        return Array.make(data.getChild(childId));
    }

    @Override
    public boolean isNull(int i) {
        return field(childId(i)).isNull(valueOffset(i));
    }
}
