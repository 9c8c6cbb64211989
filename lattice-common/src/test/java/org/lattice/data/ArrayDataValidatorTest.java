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

package org.lattice.data;

import org.lattice.memory.Buffer;
import org.lattice.types.DataType;
import org.lattice.types.DataTypes;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.lattice.data.ArrayTestUtils.bitmap;
import static org.lattice.data.ArrayTestUtils.bytes;
import static org.lattice.data.ArrayTestUtils.int32Array;
import static org.lattice.data.ArrayTestUtils.int32Buffer;
import static org.lattice.data.ArrayTestUtils.listArray;
import static org.lattice.data.ArrayTestUtils.stringArray;
import static org.lattice.data.ArrayTestUtils.structArray;
import static org.lattice.data.ArrayTestUtils.utf8;

/** {@link ArrayDataValidator} 的测试。 */
class ArrayDataValidatorTest {

    @Test
    void testValidArrays() {
        assertThatCode(() -> ArrayDataValidator.validate(int32Array("10110", 1, 0, 3, 4, 0)))
                .doesNotThrowAnyException();
        assertThatCode(() -> ArrayDataValidator.validate(stringArray("abc", null, "defg")))
                .doesNotThrowAnyException();
        ArrayData sliced = stringArray("abc", "", "defg").slice(1, 2);
        assertThatCode(() -> ArrayDataValidator.validate(sliced)).doesNotThrowAnyException();
        assertThatCode(
                        () ->
                                ArrayDataValidator.validate(
                                        ArrayData.of(DataTypes.NULL(), 3, 3)))
                .doesNotThrowAnyException();
    }

    @Test
    void testNonMonotonicOffsets() {
        ArrayData data =
                ArrayData.of(
                        DataTypes.STRING(), 3, 0, null, int32Buffer(0, 3, 2, 7), utf8("abcdefg"));

        assertThatThrownBy(() -> ArrayDataValidator.validate(data))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not monotonic");
    }

    @Test
    void testLastOffsetBeyondValues() {
        ArrayData data =
                ArrayData.of(DataTypes.BINARY(), 2, 0, null, int32Buffer(0, 3, 9), utf8("abc"));

        assertThatThrownBy(() -> ArrayDataValidator.validate(data))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("beyond the value range");
    }

    @Test
    void testValuesBufferTooSmall() {
        ArrayData data = ArrayData.of(DataTypes.INT64(), 2, 0, null, int32Buffer(1, 2));

        assertThatThrownBy(() -> ArrayDataValidator.validate(data))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("values buffer");
    }

    @Test
    void testWrongBufferCount() {
        ArrayData data = ArrayData.of(DataTypes.INT32(), 1, 0, int32Buffer(1));

        assertThatThrownBy(() -> ArrayDataValidator.validate(data))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Expected 2 buffers");
    }

    @Test
    void testNullCountMismatch() {
        ArrayData data =
                ArrayData.of(DataTypes.INT32(), 3, 0, bitmap("101"), int32Buffer(1, 2, 3));

        assertThatThrownBy(() -> ArrayDataValidator.validate(data))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("does not match validity bitmap");
    }

    @Test
    void testValidityBitmapTooSmall() {
        ArrayData data =
                ArrayData.of(
                        DataTypes.INT32(),
                        9,
                        ArrayData.UNKNOWN_NULL_COUNT,
                        Buffer.allocate(1),
                        int32Buffer(1, 2, 3, 4, 5, 6, 7, 8, 9));

        assertThatThrownBy(() -> ArrayDataValidator.validate(data))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Validity bitmap");
    }

    @Test
    void testNestedArrays() {
        DataType listType = DataTypes.LIST(DataTypes.INT32());
        ArrayData values = int32Array(null, 1, 2, 3);
        ArrayData lists = listArray(listType, null, values, 0, 2, 3);
        assertThatCode(() -> ArrayDataValidator.validate(lists)).doesNotThrowAnyException();
        assertThatThrownBy(
                        () ->
                                ArrayDataValidator.validate(
                                        listArray(listType, null, values, 0, 2, 4)))
                .isInstanceOf(IllegalArgumentException.class);

        DataType structType =
                DataTypes.STRUCT(
                        DataTypes.FIELD("a", DataTypes.INT32()),
                        DataTypes.FIELD("b", DataTypes.STRING()));
        assertThatThrownBy(
                        () ->
                                ArrayDataValidator.validate(
                                        structArray(structType, null, 3, values)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Expected 2 children");
    }

    @Test
    void testDictionaryRequiresDictionary() {
        ArrayData data =
                new ArrayData(
                        DataTypes.DICTIONARY(DataTypes.INT8(), DataTypes.STRING()),
                        2,
                        0,
                        0,
                        Arrays.asList(null, Buffer.wrap(bytes(0, 1))),
                        Collections.emptyList(),
                        null);

        assertThatThrownBy(() -> ArrayDataValidator.validate(data))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("without dictionary");
    }
}
