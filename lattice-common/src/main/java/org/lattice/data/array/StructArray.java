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
import org.lattice.types.StructType;

import javax.annotation.Nullable;

/** 结构体数组,每个字段是一个与父数组对齐的子数组。 */
@Public
public class StructArray extends Array {

    public StructArray(ArrayData data) {
        super(data);
    }

    public int numFields() {
        return data.getChildren().size();
    }

    /** 第 {@code i} 个字段,按父数组的 offset 与 length 切片。 */
    public Array field(int i) {
        return Array.make(data.getChild(i).slice(data.getOffset(), data.getLength()));
    }

    /**
     * 按名称查找字段。
     *
     * @return 字段视图,不存在时返回 null
     */
    @Nullable
    public Array field(String name) {
        int index = ((StructType) type()).getFieldIndex(name);
        return index < 0 ? null : field(index);
    }
}
