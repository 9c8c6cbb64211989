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
import org.lattice.types.FixedSizeListType;

/** 定长列表数组,第 {@code i} 个列表从子数组的 {@code (offset + i) * listSize} 开始。 */
@Public
public class FixedSizeListArray extends Array {

    private final int listSize;

    public FixedSizeListArray(ArrayData data) {
        super(data);
        this.listSize = ((FixedSizeListType) data.getType()).getListSize();
    }

    public int listSize() {
        return listSize;
    }

    public int valueOffset(int i) {
        return (data.getOffset() + i) * listSize;
    }

    public Array values() {
        return Array.make(data.getChild(0));
    }

    public Array getList(int i) {
        return Array.make(data.getChild(0).slice(valueOffset(i), listSize));
    }
}
