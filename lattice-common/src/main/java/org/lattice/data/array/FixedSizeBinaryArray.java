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
import org.lattice.types.FixedWidthType;

/** 定长二进制数组,第 {@code i} 个值从 {@code (offset + i) * byteWidth} 开始。 */
@Public
public class FixedSizeBinaryArray extends Array {

    private final int byteWidth;

    public FixedSizeBinaryArray(ArrayData data) {
        super(data);
        this.byteWidth = ((FixedWidthType) data.getType()).byteWidth();
    }

    public int byteWidth() {
        return byteWidth;
    }

    public BinaryView getView(int i) {
        return new BinaryView(data.getBuffer(1), (data.getOffset() + i) * byteWidth, byteWidth);
    }

    public byte[] getBytes(int i) {
        return getView(i).toBytes();
    }
}
