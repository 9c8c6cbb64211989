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
 * 定宽类型的基类,每个值在值缓冲区中占用固定的位数。
 *
 * <p>包括布尔类型(1 位)、所有数值与时间类型,以及宽度由参数决定的定长二进制类型。
 * 第 {@code i} 个逻辑位置的值位于 {@code (offset + i) * byteWidth()} 字节处(布尔类型按位寻址)。
 */
@Public
public abstract class FixedWidthType extends DataType {

    private static final long serialVersionUID = 1L;

    protected FixedWidthType(TypeId typeId) {
        super(typeId);
    }

    /** 每个值占用的位数。 */
    public int bitWidth() {
        return getTypeId().bitWidth();
    }

    /** 每个值占用的字节数,布尔类型返回 0。 */
    public int byteWidth() {
        return bitWidth() / 8;
    }
}
