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

import org.lattice.data.ArrayData;
import org.lattice.data.ArrayTestUtils;
import org.lattice.exceptions.NotImplementedException;
import org.lattice.memory.BinaryView;
import org.lattice.memory.Buffer;
import org.lattice.types.DataType;
import org.lattice.types.DataTypes;
import org.lattice.types.TimeUnit;
import org.lattice.types.TypeId;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.math.BigInteger;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** {@link PhysicalLayouts} 的测试。 */
class PhysicalLayoutsTest {

    @Test
    void testFixedWidthTypesShareLayouts() {
        assertThat(PhysicalLayouts.forType(DataTypes.INT8())).isSameAs(PhysicalLayouts.INT8);
        assertThat(PhysicalLayouts.forType(DataTypes.UINT8())).isSameAs(PhysicalLayouts.INT8);
        assertThat(PhysicalLayouts.forType(DataTypes.HALF_FLOAT()))
                .isSameAs(PhysicalLayouts.INT16);
        assertThat(PhysicalLayouts.forType(DataTypes.DATE32())).isSameAs(PhysicalLayouts.INT32);
        assertThat(PhysicalLayouts.forType(DataTypes.TIME32(TimeUnit.MILLISECOND)))
                .isSameAs(PhysicalLayouts.INT32);
        assertThat(PhysicalLayouts.forType(DataTypes.INTERVAL_MONTHS()))
                .isSameAs(PhysicalLayouts.INT32);
        assertThat(PhysicalLayouts.forType(DataTypes.TIMESTAMP(TimeUnit.NANOSECOND)))
                .isSameAs(PhysicalLayouts.INT64);
        assertThat(PhysicalLayouts.forType(DataTypes.DURATION(TimeUnit.SECOND)))
                .isSameAs(PhysicalLayouts.INT64);
        assertThat(PhysicalLayouts.forType(DataTypes.FLOAT())).isSameAs(PhysicalLayouts.FLOAT);
        assertThat(PhysicalLayouts.forType(DataTypes.DOUBLE())).isSameAs(PhysicalLayouts.DOUBLE);
        assertThat(PhysicalLayouts.forType(DataTypes.INTERVAL_DAY_TIME()))
                .isSameAs(PhysicalLayouts.INTERVAL_DAY_TIME);
    }

    @Test
    void testBinaryTypesShareLayouts() {
        assertThat(PhysicalLayouts.forType(DataTypes.BOOLEAN())).isSameAs(PhysicalLayouts.BOOL);
        assertThat(PhysicalLayouts.forType(DataTypes.STRING())).isSameAs(PhysicalLayouts.UTF8);
        assertThat(PhysicalLayouts.forType(DataTypes.BINARY())).isSameAs(PhysicalLayouts.BINARY);
        assertThat(PhysicalLayouts.forType(DataTypes.LARGE_STRING()))
                .isSameAs(PhysicalLayouts.LARGE_UTF8);
        assertThat(PhysicalLayouts.forType(DataTypes.FIXED_SIZE_BINARY(4)))
                .isSameAs(PhysicalLayouts.FIXED_SIZE_BINARY);
        assertThat(PhysicalLayouts.forType(DataTypes.DECIMAL128(10, 2)))
                .isSameAs(PhysicalLayouts.DECIMAL128);
    }

    @Test
    void testDictionaryUsesIndexLayout() {
        assertThat(
                        PhysicalLayouts.forType(
                                DataTypes.DICTIONARY(DataTypes.INT16(), DataTypes.STRING())))
                .isSameAs(PhysicalLayouts.INT16);
    }

    @Test
    void testExtensionBindsStorageType() {
        byte[] uuid = new byte[16];
        uuid[0] = 42;
        ArrayData data =
                ArrayTestUtils.fixedSizeBinaryArray(DataTypes.FIXED_SIZE_BINARY(16), null, uuid)
                        .withType(new ArrayTestUtils.UuidType());

        Object value = PhysicalLayouts.forType(data.getType()).bind(data).valueAt(0);

        assertThat(value).isInstanceOf(BinaryView.class);
        assertThat(((BinaryView) value).toBytes()).isEqualTo(uuid);
    }

    @Test
    void testFixedWidthValuesRespectOffset() {
        Buffer values = Buffer.allocate(24);
        values.putLong(0, 1L);
        values.putLong(8, Long.MIN_VALUE);
        values.putLong(16, Long.MAX_VALUE);
        ArrayData data = ArrayData.of(DataTypes.UINT64(), 3, 0, null, values).slice(1, 2);

        ValueAdapter<Long> adapter = PhysicalLayouts.UINT64.bind(data);

        assertThat(adapter.valueAt(0)).isEqualTo(Long.MIN_VALUE);
        assertThat(adapter.valueAt(1)).isEqualTo(Long.MAX_VALUE);
        // 无符号类型按位读取
        assertThat(new BigInteger(Long.toUnsignedString(adapter.valueAt(0))))
                .isEqualTo(BigInteger.ONE.shiftLeft(63));
    }

    @ParameterizedTest
    @EnumSource(
            value = TypeId.class,
            names = {"NA", "LIST", "LARGE_LIST", "FIXED_SIZE_LIST", "MAP", "STRUCT"})
    void testTypesWithoutLayout(TypeId typeId) {
        DataType type = nestedOrNull(typeId);

        assertThatThrownBy(() -> PhysicalLayouts.forType(type))
                .isInstanceOf(NotImplementedException.class)
                .hasMessage("Physical layout not implemented for type: " + type);
    }

    @Test
    void testUnionsAndReservedTypesWithoutLayout() {
        Stream.of(
                        DataTypes.SPARSE_UNION(DataTypes.FIELD("a", DataTypes.INT32())),
                        DataTypes.DENSE_UNION(DataTypes.FIELD("a", DataTypes.INT32())),
                        new ArrayTestUtils.ReservedType(TypeId.DECIMAL256),
                        new ArrayTestUtils.ReservedType(TypeId.INTERVAL_MONTH_DAY_NANO))
                .forEach(
                        type ->
                                assertThatThrownBy(() -> PhysicalLayouts.forType(type))
                                        .isInstanceOf(NotImplementedException.class)
                                        .hasMessageStartingWith(
                                                "Physical layout not implemented for type: "));
    }

    private static DataType nestedOrNull(TypeId typeId) {
        switch (typeId) {
            case NA:
                return DataTypes.NULL();
            case LIST:
                return DataTypes.LIST(DataTypes.INT32());
            case LARGE_LIST:
                return DataTypes.LARGE_LIST(DataTypes.INT32());
            case FIXED_SIZE_LIST:
                return DataTypes.FIXED_SIZE_LIST(DataTypes.INT32(), 2);
            case MAP:
                return DataTypes.MAP(DataTypes.STRING(), DataTypes.INT32());
            case STRUCT:
                return DataTypes.STRUCT(DataTypes.FIELD("a", DataTypes.INT32()));
            default:
                throw new IllegalArgumentException(typeId.name());
        }
    }
}
