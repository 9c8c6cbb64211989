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

import org.lattice.types.DataTypes;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.lattice.data.ArrayTestUtils.bitmap;
import static org.lattice.data.ArrayTestUtils.int32Array;
import static org.lattice.data.ArrayTestUtils.int32Buffer;

/** {@link ArrayData} 的测试。 */
class ArrayDataTest {

    @Test
    void testNullCountComputedFromBitmap() {
        ArrayData data =
                ArrayData.of(
                        DataTypes.INT32(),
                        5,
                        ArrayData.UNKNOWN_NULL_COUNT,
                        bitmap("10110"),
                        int32Buffer(1, 0, 3, 4, 0));

        assertThat(data.getNullCount()).isEqualTo(2);
        assertThat(data.getStoredNullCount()).isEqualTo(ArrayData.UNKNOWN_NULL_COUNT);
    }

    @Test
    void testAbsentBitmapMeansNoNulls() {
        ArrayData data = int32Array(null, 1, 2, 3);

        assertThat(data.getValidityBuffer()).isNull();
        assertThat(data.getNullCount()).isZero();
    }

    @Test
    void testNullTypeIsAllNull() {
        ArrayData data = ArrayData.of(DataTypes.NULL(), 4, ArrayData.UNKNOWN_NULL_COUNT);

        assertThat(data.getNullCount()).isEqualTo(4);
        assertThat(data.getBufferCount()).isZero();
        assertThat(data.getBuffer(1)).isNull();
    }

    @Test
    void testSliceSharesBuffers() {
        ArrayData data = int32Array("10110", 1, 0, 3, 4, 0);
        ArrayData slice = data.slice(1, 3);

        assertThat(slice.getOffset()).isEqualTo(1);
        assertThat(slice.getLength()).isEqualTo(3);
        assertThat(slice.getBuffers()).isEqualTo(data.getBuffers());
        assertThat(slice.getStoredNullCount()).isEqualTo(ArrayData.UNKNOWN_NULL_COUNT);
        assertThat(slice.getNullCount()).isEqualTo(1);

        ArrayData nested = slice.slice(1, 2);
        assertThat(nested.getOffset()).isEqualTo(2);
        assertThat(nested.getNullCount()).isZero();
    }

    @Test
    void testSliceKeepsKnownZeroNullCount() {
        ArrayData data = int32Array(null, 1, 2, 3, 4);

        assertThat(data.slice(2, 2).getStoredNullCount()).isZero();
        assertThatThrownBy(() -> data.slice(3, 2)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testInvalidConstruction() {
        assertThatThrownBy(() -> ArrayData.of(DataTypes.INT32(), -1, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ArrayData.of(DataTypes.INT32(), 2, 3))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("null count");
        assertThatThrownBy(() -> int32Array(null, 1).getChild(0))
                .isInstanceOf(IndexOutOfBoundsException.class);
    }
}
