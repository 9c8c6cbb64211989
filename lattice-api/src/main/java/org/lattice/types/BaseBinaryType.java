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

package org.lattice.types;

import org.lattice.annotation.Public;

/**
 * 变长二进制与字符串类型的基类。
 *
 * <p>数组布局为 {@code [有效位图, 偏移量, 值字节]}。偏移量数组包含 {@code length + 1} 个单调不减的
 * 元素,宽度由 {@link #isLarge()} 决定(32 位或 64 位)。值字节缓冲区按偏移量绝对寻址,
 * 数组切片时只移动偏移量数组的起点,值字节缓冲区保持不变。
 */
@Public
public abstract class BaseBinaryType extends DataType {

    private static final long serialVersionUID = 1L;

    protected BaseBinaryType(TypeId typeId) {
        super(typeId);
    }

    /** 偏移量是否为 64 位。 */
    public abstract boolean isLarge();

    /** 值是否为 UTF-8 文本。 */
    public abstract boolean isUtf8();

    /** 偏移量的字节宽度。 */
    public int offsetByteWidth() {
        return isLarge() ? 8 : 4;
    }
}
