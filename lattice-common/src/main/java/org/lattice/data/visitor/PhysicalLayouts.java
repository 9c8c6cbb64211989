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
import org.lattice.data.DayTimeInterval;
import org.lattice.exceptions.NotImplementedException;
import org.lattice.memory.BinaryView;
import org.lattice.types.DataType;
import org.lattice.types.DictionaryType;
import org.lattice.types.ExtensionType;

/**
 * 类型标签到物理布局的固定映射。
 *
 * <p>静态常量为每个叶子类型提供带具体值类型的布局,调用方在编译期就能确定值的 Java 类型:
 *
 * <pre>{@code
 * ArrayDataInlineVisitor.of(PhysicalLayouts.INT32)
 *         .visit(data, value -> sum[0] += value.orElse(0));
 * }</pre>
 *
 * <p>运行期只有 {@link DataType} 时使用 {@link #forType(DataType)}。字典类型使用索引类型的布局,
 * 扩展类型使用存储类型的布局。
 */
@Public
public final class PhysicalLayouts {

    public static final PhysicalLayout<Boolean> BOOL = BooleanLayout.INSTANCE;

    public static final PhysicalLayout<Byte> INT8 = FixedWidthLayout.BYTE;
    public static final PhysicalLayout<Byte> UINT8 = FixedWidthLayout.BYTE;
    public static final PhysicalLayout<Short> INT16 = FixedWidthLayout.SHORT;
    public static final PhysicalLayout<Short> UINT16 = FixedWidthLayout.SHORT;
    public static final PhysicalLayout<Integer> INT32 = FixedWidthLayout.INT;
    public static final PhysicalLayout<Integer> UINT32 = FixedWidthLayout.INT;
    public static final PhysicalLayout<Long> INT64 = FixedWidthLayout.LONG;
    public static final PhysicalLayout<Long> UINT64 = FixedWidthLayout.LONG;

    /** 原始 16 位半精度浮点数。 */
    public static final PhysicalLayout<Short> HALF_FLOAT = FixedWidthLayout.SHORT;

    public static final PhysicalLayout<Float> FLOAT = FixedWidthLayout.FLOAT;
    public static final PhysicalLayout<Double> DOUBLE = FixedWidthLayout.DOUBLE;

    public static final PhysicalLayout<Integer> DATE32 = FixedWidthLayout.INT;
    public static final PhysicalLayout<Long> DATE64 = FixedWidthLayout.LONG;
    public static final PhysicalLayout<Long> TIMESTAMP = FixedWidthLayout.LONG;
    public static final PhysicalLayout<Integer> TIME32 = FixedWidthLayout.INT;
    public static final PhysicalLayout<Long> TIME64 = FixedWidthLayout.LONG;
    public static final PhysicalLayout<Long> DURATION = FixedWidthLayout.LONG;
    public static final PhysicalLayout<Integer> INTERVAL_MONTHS = FixedWidthLayout.INT;
    public static final PhysicalLayout<DayTimeInterval> INTERVAL_DAY_TIME =
            FixedWidthLayout.DAY_TIME;

    public static final PhysicalLayout<BinaryView> BINARY = BaseBinaryLayout.BINARY;
    public static final PhysicalLayout<BinaryView> UTF8 = BaseBinaryLayout.BINARY;
    public static final PhysicalLayout<BinaryView> LARGE_BINARY = BaseBinaryLayout.LARGE_BINARY;
    public static final PhysicalLayout<BinaryView> LARGE_UTF8 = BaseBinaryLayout.LARGE_BINARY;

    public static final PhysicalLayout<BinaryView> FIXED_SIZE_BINARY =
            FixedSizeBinaryLayout.INSTANCE;
    public static final PhysicalLayout<BinaryView> DECIMAL128 = FixedSizeBinaryLayout.INSTANCE;

    /**
     * 返回给定类型的物理布局。
     *
     * @throws NotImplementedException 如果类型是 null 类型、嵌套类型,或类型标签是保留的
     */
    public static PhysicalLayout<?> forType(DataType type) {
        switch (type.getTypeId()) {
            case BOOL:
                return BOOL;
            case UINT8:
            case INT8:
                return FixedWidthLayout.BYTE;
            case UINT16:
            case INT16:
            case HALF_FLOAT:
                return FixedWidthLayout.SHORT;
            case UINT32:
            case INT32:
            case DATE32:
            case TIME32:
            case INTERVAL_MONTHS:
                return FixedWidthLayout.INT;
            case UINT64:
            case INT64:
            case DATE64:
            case TIMESTAMP:
            case TIME64:
            case DURATION:
                return FixedWidthLayout.LONG;
            case FLOAT:
                return FixedWidthLayout.FLOAT;
            case DOUBLE:
                return FixedWidthLayout.DOUBLE;
            case INTERVAL_DAY_TIME:
                return FixedWidthLayout.DAY_TIME;
            case STRING:
            case BINARY:
                return BaseBinaryLayout.BINARY;
            case LARGE_STRING:
            case LARGE_BINARY:
                return BaseBinaryLayout.LARGE_BINARY;
            case FIXED_SIZE_BINARY:
            case DECIMAL128:
                return FixedSizeBinaryLayout.INSTANCE;
            case DICTIONARY:
                return forType(((DictionaryType) type).getIndexType());
            case EXTENSION:
                return storageLayout((ExtensionType) type);
            default:
                throw new NotImplementedException(
                        "Physical layout not implemented for type: " + type);
        }
    }

    private static <V> PhysicalLayout<V> storageLayout(ExtensionType type) {
        DataType storageType = type.getStorageType();
        @SuppressWarnings("unchecked")
        PhysicalLayout<V> storage = (PhysicalLayout<V>) forType(storageType);
        return data -> storage.bind(data.withType(storageType));
    }

    private PhysicalLayouts() {}
}
