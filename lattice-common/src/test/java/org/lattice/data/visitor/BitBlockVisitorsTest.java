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

import org.lattice.memory.Buffer;
import org.lattice.utils.BitUtil;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.lattice.data.ArrayTestUtils.bitmap;

/** {@link BitBlockVisitors} 的测试。 */
class BitBlockVisitorsTest {

    /** 有效位置记为其下标,null 位置记为 -1。 */
    private static List<Integer> visit(Buffer bitmap, int offset, int length) {
        List<Integer> events = new ArrayList<>();
        BitBlockVisitors.visitBitBlocks(bitmap, offset, length, events::add, () -> events.add(-1));
        return events;
    }

    private static List<Integer> reference(Buffer bitmap, int offset, int length) {
        List<Integer> events = new ArrayList<>();
        for (int i = 0; i < length; i++) {
            events.add(BitUtil.getBit(bitmap, offset + i) ? i : -1);
        }
        return events;
    }

    @Test
    void testSmallBitmap() {
        assertThat(visit(bitmap("10110"), 0, 5)).containsExactly(0, -1, 2, 3, -1);
        assertThat(visit(bitmap("10110"), 1, 3)).containsExactly(-1, 1, 2);
    }

    @Test
    void testAbsentBitmap() {
        List<Integer> events = new ArrayList<>();
        BitBlockVisitors.visitBitBlocks(null, 13, 70000, events::add, () -> events.add(-1));

        assertThat(events).hasSize(70000);
        for (int i = 0; i < events.size(); i++) {
            assertThat(events.get(i)).isEqualTo(i);
        }
    }

    @Test
    void testEmptyRange() {
        assertThat(visit(bitmap("1"), 1, 0)).isEmpty();
        assertThat(visit(null, 0, 0)).isEmpty();
    }

    @Test
    void testWordBoundary() {
        StringBuilder bits = new StringBuilder();
        for (int i = 0; i < 130; i++) {
            bits.append(i == 63 || i == 64 ? '0' : '1');
        }
        Buffer bitmap = bitmap(bits.toString());

        List<Integer> events = visit(bitmap, 0, 130);

        assertThat(events).isEqualTo(reference(bitmap, 0, 130));
        assertThat(events.get(62)).isEqualTo(62);
        assertThat(events.get(63)).isEqualTo(-1);
        assertThat(events.get(64)).isEqualTo(-1);
        assertThat(events.get(65)).isEqualTo(65);
    }

    @Test
    void testAllNullAndAllValidBlocks() {
        StringBuilder bits = new StringBuilder();
        for (int i = 0; i < 256; i++) {
            bits.append(i < 128 ? '0' : '1');
        }
        Buffer bitmap = bitmap(bits.toString());

        List<Integer> events = visit(bitmap, 5, 240);

        assertThat(events).isEqualTo(reference(bitmap, 5, 240));
        assertThat(events.subList(0, 123)).containsOnly(-1);
        assertThat(events.get(123)).isEqualTo(123);
    }

    @ParameterizedTest
    @CsvSource({"0, 1000", "1, 999", "7, 64", "63, 65", "64, 500", "100, 3"})
    void testRandomBitmapsMatchReference(int offset, int length) {
        Random random = new Random(31L * offset + length);
        byte[] bytes = new byte[BitUtil.bytesForBits(offset + length)];
        random.nextBytes(bytes);
        Buffer bitmap = Buffer.wrap(bytes);

        assertThat(visit(bitmap, offset, length)).isEqualTo(reference(bitmap, offset, length));
    }

    @Test
    void testTryVisitStopsAtFirstFailure() {
        Buffer bitmap = bitmap("1101101");
        List<Integer> events = new ArrayList<>();
        Exception failure = new Exception("stop");

        assertThatThrownBy(
                        () ->
                                BitBlockVisitors.tryVisitBitBlocks(
                                        bitmap,
                                        0,
                                        7,
                                        position -> {
                                            events.add(position);
                                            if (position == 3) {
                                                throw failure;
                                            }
                                        },
                                        () -> events.add(-1)))
                .isSameAs(failure);
        assertThat(events).containsExactly(0, 1, -1, 3);
    }

    @Test
    void testTryVisitWithoutFailureVisitsEverything() {
        Buffer bitmap = bitmap("0110");
        List<Integer> events = new ArrayList<>();

        BitBlockVisitors.<RuntimeException>tryVisitBitBlocks(
                bitmap, 0, 4, events::add, () -> events.add(-1));

        assertThat(events).containsExactly(-1, 1, 2, -1);
    }
}
