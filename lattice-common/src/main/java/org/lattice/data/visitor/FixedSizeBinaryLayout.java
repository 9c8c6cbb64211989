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
import org.lattice.types.FixedWidthType;

/**
 * 定长二进制布局,也用于 decimal128。
 *
 * <p>宽度取自绑定数据的类型;第 {@code i} 个值从 {@code (offset + i) * byteWidth} 开始,
 * 长度为 {@code byteWidth}。
 */
@Public
public final class FixedSizeBinaryLayout implements PhysicalLayout<BinaryView> {

    public static final FixedSizeBinaryLayout INSTANCE = new FixedSizeBinaryLayout();

    private FixedSizeBinaryLayout() {}

    @Override
    public ValueAdapter<BinaryView> bind(ArrayData data) {
        Buffer records = data.getBuffer(1);
        int byteWidth = ((FixedWidthType) data.getType()).byteWidth();
        int base = data.getOffset() * byteWidth;
        return position -> new BinaryView(records, base + position * byteWidth, byteWidth);
    }

    @Override
    public String toString() {
        return "FixedSizeBinaryLayout";
    }
}
