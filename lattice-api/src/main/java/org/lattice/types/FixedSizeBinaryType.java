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

import java.util.Objects;

import static org.lattice.utils.Preconditions.checkArgument;

/**
 * 定长二进制类型,每个值占用 {@code byteWidth} 字节。
 *
 * <p>数组布局为 {@code [有效位图, 定长记录]},第 {@code i} 个逻辑位置的记录起始于
 * {@code (offset + i) * byteWidth} 字节处,长度为 {@code byteWidth}。
 */
@Public
public class FixedSizeBinaryType extends FixedWidthType {

    private static final long serialVersionUID = 1L;

    private static final String FORMAT = "FIXED_SIZE_BINARY(%d)";

    private final int byteWidth;

    public FixedSizeBinaryType(int byteWidth) {
        this(TypeId.FIXED_SIZE_BINARY, byteWidth);
    }

    protected FixedSizeBinaryType(TypeId typeId, int byteWidth) {
        super(typeId);
        checkArgument(byteWidth >= 0, "Byte width must be non-negative, but is %s.", byteWidth);
        this.byteWidth = byteWidth;
    }

    @Override
    public int bitWidth() {
        return byteWidth * 8;
    }

    @Override
    public int byteWidth() {
        return byteWidth;
    }

    @Override
    public String asSQLString() {
        return String.format(FORMAT, byteWidth);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        if (!super.equals(o)) {
            return false;
        }
        FixedSizeBinaryType that = (FixedSizeBinaryType) o;
        return byteWidth == that.byteWidth;
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), byteWidth);
    }
}
