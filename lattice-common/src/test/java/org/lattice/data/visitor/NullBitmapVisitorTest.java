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
import org.lattice.memory.Buffer;
import org.lattice.types.DataTypes;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.lattice.data.ArrayTestUtils.bitmap;
import static org.lattice.data.ArrayTestUtils.int32Array;

/** {@link NullBitmapVisitor} 的测试。 */
class NullBitmapVisitorTest {

    @Test
    void testVisitValidity() {
        List<Boolean> validity = new ArrayList<>();

        NullBitmapVisitor.visit(bitmap("0011010"), 1, 5, 2, validity::add);

        assertThat(validity).containsExactly(false, true, true, false, true);
    }

    @Test
    void testAbsentBitmapIsAllValid() {
        List<Boolean> validity = new ArrayList<>();

        NullBitmapVisitor.visit(null, 0, 3, 0, validity::add);

        assertThat(validity).containsExactly(true, true, true);
    }

    @Test
    void testNullCountDoesNotShortCut() {
        List<Boolean> validity = new ArrayList<>();

        // 传入的 null 个数与位图不符,仍以位图为准
        NullBitmapVisitor.visit(bitmap("101"), 0, 3, 0, validity::add);

        assertThat(validity).containsExactly(true, false, true);
    }

    @Test
    void testVisitArrayData() {
        ArrayData data = int32Array("11100111", 1, 2, 3, 4, 5, 6, 7, 8).slice(2, 4);
        List<Boolean> validity = new ArrayList<>();

        NullBitmapVisitor.visit(data, validity::add);

        assertThat(validity).containsExactly(true, false, false, true);
    }

    @Test
    void testNullTypeReportsEveryPositionNull() {
        ArrayData data = ArrayData.of(DataTypes.NULL(), 3, ArrayData.UNKNOWN_NULL_COUNT);
        List<Boolean> validity = new ArrayList<>();

        NullBitmapVisitor.visit(data, validity::add);

        assertThat(validity).containsExactly(false, false, false);
    }

    @Test
    void testTryVisitNullTypeStopsAtFirstFailure() {
        IOException failure = new IOException("null slot");
        List<Boolean> validity = new ArrayList<>();

        assertThatThrownBy(
                        () ->
                                NullBitmapVisitor.tryVisit(
                                        ArrayData.of(DataTypes.NULL(), 4, 4),
                                        valid -> {
                                            validity.add(valid);
                                            if (validity.size() == 2) {
                                                throw failure;
                                            }
                                        }))
                .isSameAs(failure);
        assertThat(validity).containsExactly(false, false);
    }

    @Test
    void testLongBitmapMatchesBits() {
        StringBuilder bits = new StringBuilder();
        for (int i = 0; i < 200; i++) {
            bits.append(i % 3 == 0 || i > 150 ? '1' : '0');
        }
        Buffer bitmap = bitmap(bits.toString());
        List<Boolean> validity = new ArrayList<>();

        NullBitmapVisitor.visit(bitmap, 0, 200, -1, validity::add);

        assertThat(validity).hasSize(200);
        for (int i = 0; i < 200; i++) {
            assertThat(validity.get(i)).as("bit %s", i).isEqualTo(bits.charAt(i) == '1');
        }
    }

    @Test
    void testTryVisitShortCircuits() {
        IOException failure = new IOException("second null");
        List<Boolean> validity = new ArrayList<>();
        int[] nulls = {0};

        assertThatThrownBy(
                        () ->
                                NullBitmapVisitor.tryVisit(
                                        int32Array("10101", 1, 2, 3, 4, 5),
                                        valid -> {
                                            validity.add(valid);
                                            if (!valid && ++nulls[0] == 2) {
                                                throw failure;
                                            }
                                        }))
                .isSameAs(failure);
        assertThat(validity).containsExactly(true, false, true, false);
    }
}
