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

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** {@link DataTypes} 与各具体类型的测试。 */
class DataTypesTest {

    @Test
    void testSqlStrings() {
        assertThat(DataTypes.INT8().asSQLString()).isEqualTo("INT8");
        assertThat(DataTypes.UINT64().asSQLString()).isEqualTo("UINT64");
        assertThat(DataTypes.HALF_FLOAT().asSQLString()).isEqualTo("FLOAT16");
        assertThat(DataTypes.FIXED_SIZE_BINARY(16).asSQLString())
                .isEqualTo("FIXED_SIZE_BINARY(16)");
        assertThat(DataTypes.DECIMAL128(38, 10).asSQLString()).isEqualTo("DECIMAL128(38, 10)");
        assertThat(DataTypes.TIMESTAMP(TimeUnit.MILLISECOND).asSQLString())
                .isEqualTo("TIMESTAMP(MILLISECOND)");
        assertThat(DataTypes.TIMESTAMP(TimeUnit.SECOND, "UTC").asSQLString())
                .isEqualTo("TIMESTAMP(SECOND, UTC)");
        assertThat(DataTypes.LIST(DataTypes.STRING()).asSQLString()).isEqualTo("LIST<STRING>");
        assertThat(DataTypes.FIXED_SIZE_LIST(DataTypes.INT16(), 2).asSQLString())
                .isEqualTo("FIXED_SIZE_LIST<INT16>[2]");
        assertThat(
                        DataTypes.STRUCT(
                                        DataTypes.FIELD("a", DataTypes.INT32()),
                                        DataTypes.FIELD("b", DataTypes.STRING(), false))
                                .asSQLString())
                .isEqualTo("STRUCT<a INT32, b STRING NOT NULL>");
    }

    @Test
    void testEquality() {
        assertThat(DataTypes.INT32()).isEqualTo(DataTypes.INT32());
        assertThat(DataTypes.INT32()).isNotEqualTo(DataTypes.UINT32());
        assertThat(DataTypes.FIXED_SIZE_BINARY(4)).isNotEqualTo(DataTypes.FIXED_SIZE_BINARY(8));
        assertThat(DataTypes.DECIMAL128(10, 2)).isEqualTo(DataTypes.DECIMAL128(10, 2));
        assertThat(DataTypes.DECIMAL128(10, 2)).isNotEqualTo(DataTypes.FIXED_SIZE_BINARY(16));
        assertThat(DataTypes.LIST(DataTypes.INT8()))
                .isEqualTo(DataTypes.LIST(DataTypes.INT8()))
                .isNotEqualTo(DataTypes.LARGE_LIST(DataTypes.INT8()));
        assertThat(DataTypes.TIMESTAMP(TimeUnit.SECOND, "UTC"))
                .isNotEqualTo(DataTypes.TIMESTAMP(TimeUnit.SECOND));
    }

    @Test
    void testLayoutCategories() {
        assertThat(DataTypes.NULL().getLayout()).isEqualTo(LayoutCategory.NULL);
        assertThat(DataTypes.BOOLEAN().getLayout()).isEqualTo(LayoutCategory.BOOLEAN);
        assertThat(DataTypes.INTERVAL_DAY_TIME().getLayout())
                .isEqualTo(LayoutCategory.FIXED_WIDTH);
        assertThat(DataTypes.LARGE_STRING().getLayout())
                .isEqualTo(LayoutCategory.VARIABLE_BINARY);
        assertThat(DataTypes.DECIMAL128(5, 0).getLayout())
                .isEqualTo(LayoutCategory.FIXED_SIZE_BINARY);
        assertThat(DataTypes.MAP(DataTypes.INT8(), DataTypes.INT8()).getLayout())
                .isEqualTo(LayoutCategory.NESTED);
        assertThat(DataTypes.DICTIONARY(DataTypes.INT8(), DataTypes.STRING()).getLayout())
                .isEqualTo(LayoutCategory.DELEGATED);
    }

    @Test
    void testWidths() {
        assertThat(DataTypes.INT16().byteWidth()).isEqualTo(2);
        assertThat(DataTypes.DATE64().byteWidth()).isEqualTo(8);
        assertThat(DataTypes.INTERVAL_DAY_TIME().byteWidth()).isEqualTo(8);
        assertThat(DataTypes.BOOLEAN().bitWidth()).isEqualTo(1);
        assertThat(DataTypes.FIXED_SIZE_BINARY(5).byteWidth()).isEqualTo(5);
        assertThat(DataTypes.DECIMAL128(20, 4).byteWidth()).isEqualTo(16);
        assertThat(DataTypes.STRING().offsetByteWidth()).isEqualTo(4);
        assertThat(DataTypes.LARGE_BINARY().offsetByteWidth()).isEqualTo(8);
    }

    @Test
    void testFamilies() {
        assertThat(DataTypes.UINT8().is(TypeFamily.INTEGER)).isTrue();
        assertThat(DataTypes.DOUBLE().is(TypeFamily.FLOATING_POINT)).isTrue();
        assertThat(DataTypes.DOUBLE().is(TypeFamily.INTEGER)).isFalse();
        DataType union = DataTypes.DENSE_UNION(DataTypes.FIELD("a", DataTypes.INT8()));
        assertThat(union.is(TypeFamily.UNION)).isTrue();
        assertThat(DataTypes.INT64().isAnyOf(TypeId.INT32, TypeId.INT64)).isTrue();
    }

    @Test
    void testFixedSizeBinaryTagLayouts() {
        assertThat(TypeId.FIXED_SIZE_BINARY.layout()).isEqualTo(LayoutCategory.FIXED_SIZE_BINARY);
        assertThat(TypeId.FIXED_SIZE_BINARY.bitWidth()).isEqualTo(0);
        assertThat(TypeId.DECIMAL128.layout()).isEqualTo(LayoutCategory.FIXED_SIZE_BINARY);
        assertThat(TypeId.DECIMAL128.bitWidth()).isEqualTo(128);
        assertThat(TypeId.DECIMAL256.layout()).isEqualTo(LayoutCategory.FIXED_SIZE_BINARY);
        assertThat(TypeId.DECIMAL256.families()).containsExactly(TypeFamily.DECIMAL);
    }

    @Test
    void testReservedTags() {
        assertThat(TypeId.DECIMAL256.isReserved()).isTrue();
        assertThat(TypeId.INTERVAL_MONTH_DAY_NANO.isReserved()).isTrue();
        assertThat(Arrays.stream(TypeId.values()).filter(id -> !id.isReserved()).count())
                .isEqualTo(36);
    }

    @Test
    void testMapEntries() {
        MapType map = DataTypes.MAP(DataTypes.STRING(), DataTypes.INT64());
        assertThat(map.getKeyType()).isEqualTo(DataTypes.STRING());
        assertThat(map.getItemType()).isEqualTo(DataTypes.INT64());
        assertThat(map.getEntriesType().getField(0).isNullable()).isFalse();
        assertThat(map.getEntriesType().getFieldIndex("value")).isEqualTo(1);
    }

    @Test
    void testUnionTypeCodes() {
        SparseUnionType union =
                new SparseUnionType(
                        Arrays.asList(
                                DataTypes.FIELD("i", DataTypes.INT32()),
                                DataTypes.FIELD("s", DataTypes.STRING())),
                        new byte[] {5, 2});
        assertThat(union.getChildId((byte) 5)).isEqualTo(0);
        assertThat(union.getChildId((byte) 2)).isEqualTo(1);
        assertThat(union.getChildId((byte) 3)).isEqualTo(-1);
        assertThat(union.getMode()).isEqualTo(UnionType.Mode.SPARSE);

        assertThatThrownBy(
                        () ->
                                new DenseUnionType(
                                        Arrays.asList(
                                                DataTypes.FIELD("a", DataTypes.INT8()),
                                                DataTypes.FIELD("b", DataTypes.INT8())),
                                        new byte[] {1, 1}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate type code");
    }

    @Test
    void testInvalidParameters() {
        assertThatThrownBy(() -> DataTypes.DECIMAL128(39, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DataTypes.DECIMAL128(5, 6))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DataTypes.TIME32(TimeUnit.NANOSECOND))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("TIME32");
        assertThatThrownBy(() -> DataTypes.TIME64(TimeUnit.SECOND))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DataTypes.FIXED_SIZE_BINARY(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
