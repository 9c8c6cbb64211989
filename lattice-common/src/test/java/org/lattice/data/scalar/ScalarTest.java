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

package org.lattice.data.scalar;

import org.lattice.data.ArrayTestUtils;
import org.lattice.data.DayTimeInterval;
import org.lattice.types.DataTypes;
import org.lattice.types.DictionaryType;
import org.lattice.types.StructType;
import org.lattice.types.TimeUnit;
import org.lattice.types.UnionType;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** 各类标量的测试。 */
class ScalarTest {

    @Test
    void testPrimitiveScalars() {
        PrimitiveScalar int8 = PrimitiveScalar.of(DataTypes.INT8(), -2);
        assertThat(int8.getByte()).isEqualTo((byte) -2);
        assertThat(int8.toString()).isEqualTo("INT8:-2");

        PrimitiveScalar timestamp = PrimitiveScalar.of(DataTypes.TIMESTAMP(TimeUnit.SECOND), 60L);
        assertThat(timestamp.getLong()).isEqualTo(60L);

        assertThat(PrimitiveScalar.ofFloat(-0.25f).getFloat()).isEqualTo(-0.25f);
        assertThat(PrimitiveScalar.ofDouble(Math.PI).getDouble()).isEqualTo(Math.PI);

        PrimitiveScalar dayTime = PrimitiveScalar.ofDayTime(new DayTimeInterval(-1, 1500));
        assertThat(dayTime.getDayTimeInterval()).isEqualTo(new DayTimeInterval(-1, 1500));
        assertThat(dayTime.getBits()).isEqualTo((1500L << 32) | 0xFFFFFFFFL);
    }

    @Test
    void testPrimitiveScalarRejectsOtherLayouts() {
        assertThatThrownBy(() -> PrimitiveScalar.of(DataTypes.STRING(), 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Type STRING is not a primitive type.");
        assertThatThrownBy(() -> PrimitiveScalar.nullOf(DataTypes.BOOLEAN()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testNullScalars() {
        assertThat(new NullScalar().isValid()).isFalse();
        assertThat(new NullScalar().toString()).isEqualTo("NULL:null");
        assertThat(BooleanScalar.nullValue().isValid()).isFalse();
        assertThat(PrimitiveScalar.nullOf(DataTypes.INT32()))
                .isEqualTo(PrimitiveScalar.nullOf(DataTypes.INT32()))
                .isNotEqualTo(PrimitiveScalar.of(DataTypes.INT32(), 0));
        assertThat(new BinaryScalar(DataTypes.BINARY(), null).isValid()).isFalse();
    }

    @Test
    void testBinaryScalars() {
        BinaryScalar string = BinaryScalar.ofString("héllo");

        assertThat(string.type()).isEqualTo(DataTypes.STRING());
        assertThat(string.getString()).isEqualTo("héllo");
        assertThat(string.getView().length()).isEqualTo(6);
        assertThat(string).isEqualTo(BinaryScalar.ofString("héllo"));
        assertThat(string.toString()).isEqualTo("STRING:héllo");

        FixedSizeBinaryScalar fixed =
                new FixedSizeBinaryScalar(DataTypes.FIXED_SIZE_BINARY(2), new byte[] {1, 2});
        assertThat(fixed.getBytes()).containsExactly(1, 2);
        assertThatThrownBy(
                        () ->
                                new FixedSizeBinaryScalar(
                                        DataTypes.FIXED_SIZE_BINARY(2), new byte[3]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testDecimal128Scalar() {
        Decimal128Scalar decimal =
                new Decimal128Scalar(DataTypes.DECIMAL128(5, 2), new BigDecimal("-123.45"));

        assertThat(decimal.getValue()).isEqualTo(new BigDecimal("-123.45"));
        assertThat(decimal.toString()).isEqualTo("DECIMAL128(5, 2):-123.45");
        assertThatThrownBy(
                        () ->
                                new Decimal128Scalar(
                                        DataTypes.DECIMAL128(5, 2), new BigDecimal("1.5")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Scale");
        assertThatThrownBy(
                        () ->
                                new Decimal128Scalar(
                                        DataTypes.DECIMAL128(3, 2), new BigDecimal("12.34")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Precision");
    }

    @Test
    void testNestedScalars() {
        StructType struct =
                DataTypes.STRUCT(
                        DataTypes.FIELD("a", DataTypes.INT32()),
                        DataTypes.FIELD("b", DataTypes.BOOLEAN()));
        StructScalar row =
                new StructScalar(
                        struct,
                        Arrays.<Scalar>asList(
                                PrimitiveScalar.of(DataTypes.INT32(), 3), new BooleanScalar(true)));
        assertThat(row.field(1)).isEqualTo(new BooleanScalar(true));
        assertThatThrownBy(
                        () ->
                                new StructScalar(
                                        struct,
                                        Arrays.<Scalar>asList(new BooleanScalar(true))))
                .isInstanceOf(IllegalArgumentException.class);

        ListScalar list =
                new ListScalar(
                        DataTypes.LIST(DataTypes.INT32()), ArrayTestUtils.int32Array(null, 1, 2));
        assertThat(list.getValue().getLength()).isEqualTo(2);
        assertThatThrownBy(() -> new ListScalar(DataTypes.INT32(), null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testUnionScalar() {
        UnionType union =
                DataTypes.DENSE_UNION(
                        DataTypes.FIELD("i", DataTypes.INT32()),
                        DataTypes.FIELD("s", DataTypes.STRING()));

        UnionScalar value = new UnionScalar(union, (byte) 1, BinaryScalar.ofString("x"));

        assertThat(value.getTypeCode()).isEqualTo((byte) 1);
        assertThat(value.getChildId()).isEqualTo(1);
        assertThat(value.getValue()).isEqualTo(BinaryScalar.ofString("x"));
        assertThatThrownBy(() -> new UnionScalar(union, (byte) 5, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testDelegatedScalars() {
        DictionaryType type = DataTypes.DICTIONARY(DataTypes.INT8(), DataTypes.STRING());
        DictionaryScalar valid =
                new DictionaryScalar(
                        type,
                        PrimitiveScalar.of(DataTypes.INT8(), 1),
                        ArrayTestUtils.stringArray("a", "b"));
        DictionaryScalar nullIndex =
                new DictionaryScalar(
                        type,
                        PrimitiveScalar.nullOf(DataTypes.INT8()),
                        ArrayTestUtils.stringArray("a", "b"));
        assertThat(valid.isValid()).isTrue();
        assertThat(valid.getIndex().getByte()).isEqualTo((byte) 1);
        assertThat(nullIndex.isValid()).isFalse();

        ExtensionScalar extension =
                new ExtensionScalar(
                        new ArrayTestUtils.UuidType(),
                        new FixedSizeBinaryScalar(DataTypes.FIXED_SIZE_BINARY(16), null));
        assertThat(extension.isValid()).isFalse();
        assertThat(extension.getStorage().type()).isEqualTo(DataTypes.FIXED_SIZE_BINARY(16));
    }
}
