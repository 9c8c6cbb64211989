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

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import static org.lattice.types.LayoutCategory.BOOLEAN;
import static org.lattice.types.LayoutCategory.DELEGATED;
import static org.lattice.types.LayoutCategory.FIXED_WIDTH;
import static org.lattice.types.LayoutCategory.NESTED;
import static org.lattice.types.LayoutCategory.NULL;
import static org.lattice.types.LayoutCategory.VARIABLE_BINARY;

/**
 * 类型标签的封闭枚举,标识一种物理加逻辑编码。
 *
 * <p>每个 {@link DataType} 实例恰好对应一个类型标签。类型标签携带静态信息:
 * <ul>
 *   <li>{@link #layout()} - 物理布局类别,该映射固定不变
 *   <li>{@link #bitWidth()} - 定宽类型的位宽,其他类型为 0
 *   <li>{@link #families()} - 所属的类型族
 *   <li>{@link #isReserved()} - 是否为前向兼容保留的标签
 * </ul>
 *
 * <p>实现者注意事项:
 * <ul>
 *   <li>对类型标签做 switch 分发时,应按本枚举的定义顺序排列分支
 *   <li>分发器必须覆盖所有非保留成员;保留成员没有具体类型类和访问者方法,
 *       所有分发器都将其视为未识别的标签并抛出 {@link org.lattice.exceptions.NotImplementedException}
 * </ul>
 */
@Public
public enum TypeId {
    /** 空类型,所有值都是 null,不占用缓冲区。 */
    NA(NULL, 0),

    /** 布尔类型,按位压缩存储。 */
    BOOL(BOOLEAN, 1),

    UINT8(FIXED_WIDTH, 8, TypeFamily.NUMERIC, TypeFamily.INTEGER),

    INT8(FIXED_WIDTH, 8, TypeFamily.NUMERIC, TypeFamily.INTEGER),

    UINT16(FIXED_WIDTH, 16, TypeFamily.NUMERIC, TypeFamily.INTEGER),

    INT16(FIXED_WIDTH, 16, TypeFamily.NUMERIC, TypeFamily.INTEGER),

    UINT32(FIXED_WIDTH, 32, TypeFamily.NUMERIC, TypeFamily.INTEGER),

    INT32(FIXED_WIDTH, 32, TypeFamily.NUMERIC, TypeFamily.INTEGER),

    UINT64(FIXED_WIDTH, 64, TypeFamily.NUMERIC, TypeFamily.INTEGER),

    INT64(FIXED_WIDTH, 64, TypeFamily.NUMERIC, TypeFamily.INTEGER),

    /** IEEE 754 半精度浮点数,以原始 16 位存储。 */
    HALF_FLOAT(FIXED_WIDTH, 16, TypeFamily.NUMERIC, TypeFamily.FLOATING_POINT),

    FLOAT(FIXED_WIDTH, 32, TypeFamily.NUMERIC, TypeFamily.FLOATING_POINT),

    DOUBLE(FIXED_WIDTH, 64, TypeFamily.NUMERIC, TypeFamily.FLOATING_POINT),

    /** UTF-8 字符串,32 位偏移量。 */
    STRING(VARIABLE_BINARY, 0, TypeFamily.BINARY_LIKE),

    /** 变长二进制,32 位偏移量。 */
    BINARY(VARIABLE_BINARY, 0, TypeFamily.BINARY_LIKE),

    /** UTF-8 字符串,64 位偏移量。 */
    LARGE_STRING(VARIABLE_BINARY, 0, TypeFamily.BINARY_LIKE),

    /** 变长二进制,64 位偏移量。 */
    LARGE_BINARY(VARIABLE_BINARY, 0, TypeFamily.BINARY_LIKE),

    /** 定长二进制,宽度由类型参数决定。 */
    FIXED_SIZE_BINARY(LayoutCategory.FIXED_SIZE_BINARY, 0, TypeFamily.BINARY_LIKE),

    /** 距 UNIX 纪元的天数(int32)。 */
    DATE32(FIXED_WIDTH, 32, TypeFamily.TEMPORAL),

    /** 距 UNIX 纪元的毫秒数(int64)。 */
    DATE64(FIXED_WIDTH, 64, TypeFamily.TEMPORAL),

    TIMESTAMP(FIXED_WIDTH, 64, TypeFamily.TEMPORAL),

    TIME32(FIXED_WIDTH, 32, TypeFamily.TEMPORAL),

    TIME64(FIXED_WIDTH, 64, TypeFamily.TEMPORAL),

    /** 以月为单位的区间(int32)。 */
    INTERVAL_MONTHS(FIXED_WIDTH, 32, TypeFamily.INTERVAL),

    /** 天加毫秒的区间,两个 int32 连续存储。 */
    INTERVAL_DAY_TIME(FIXED_WIDTH, 64, TypeFamily.INTERVAL),

    /** 128 位十进制数,按 16 字节定长二进制存储。 */
    DECIMAL128(LayoutCategory.FIXED_SIZE_BINARY, 128, TypeFamily.DECIMAL),

    DURATION(FIXED_WIDTH, 64, TypeFamily.TEMPORAL),

    LIST(NESTED, 0, TypeFamily.NESTED),

    LARGE_LIST(NESTED, 0, TypeFamily.NESTED),

    FIXED_SIZE_LIST(NESTED, 0, TypeFamily.NESTED),

    MAP(NESTED, 0, TypeFamily.NESTED),

    STRUCT(NESTED, 0, TypeFamily.NESTED),

    SPARSE_UNION(NESTED, 0, TypeFamily.NESTED, TypeFamily.UNION),

    DENSE_UNION(NESTED, 0, TypeFamily.NESTED, TypeFamily.UNION),

    /** 字典编码,值布局与索引类型相同。 */
    DICTIONARY(DELEGATED, 0),

    /** 扩展类型,值布局与存储类型相同。 */
    EXTENSION(DELEGATED, 0, TypeFamily.EXTENSION),

    /** 保留:256 位十进制数。 */
    DECIMAL256(true, LayoutCategory.FIXED_SIZE_BINARY, 256, TypeFamily.DECIMAL),

    /** 保留:月、天、纳秒三元组区间。 */
    INTERVAL_MONTH_DAY_NANO(true, FIXED_WIDTH, 128, TypeFamily.INTERVAL);

    private final boolean reserved;

    private final LayoutCategory layout;

    private final int bitWidth;

    private final Set<TypeFamily> families;

    TypeId(LayoutCategory layout, int bitWidth, TypeFamily... families) {
        this(false, layout, bitWidth, families);
    }

    TypeId(boolean reserved, LayoutCategory layout, int bitWidth, TypeFamily... families) {
        this.reserved = reserved;
        this.layout = layout;
        this.bitWidth = bitWidth;
        EnumSet<TypeFamily> set = EnumSet.noneOf(TypeFamily.class);
        Collections.addAll(set, families);
        this.families = Collections.unmodifiableSet(set);
    }

    /** 物理布局类别。 */
    public LayoutCategory layout() {
        return layout;
    }

    /**
     * 定宽编码的位宽。
     *
     * <p>布尔类型为 1;变长、嵌套与委托类型为 0;{@link #FIXED_SIZE_BINARY} 的宽度由类型参数
     * 决定,这里同样为 0。
     */
    public int bitWidth() {
        return bitWidth;
    }

    public Set<TypeFamily> families() {
        return families;
    }

    /** 是否为前向兼容保留、尚无具体类型与访问者方法的标签。 */
    public boolean isReserved() {
        return reserved;
    }
}
