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

package org.lattice.memory;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/** {@link BinaryView} 的测试。 */
class BinaryViewTest {

    @Test
    void testViewIsBorrowed() {
        byte[] bytes = "abcdefg".getBytes(StandardCharsets.UTF_8);
        Buffer buffer = Buffer.wrap(bytes);
        BinaryView view = new BinaryView(buffer, 3, 4);

        assertThat(view.toUtf8String()).isEqualTo("defg");
        assertThat(view.byteAt(0)).isEqualTo((byte) 'd');

        bytes[3] = 'D';
        assertThat(view.toUtf8String()).isEqualTo("Defg");
        assertThat(view.buffer()).isSameAs(buffer);
    }

    @Test
    void testEqualsAcrossBuffers() {
        Buffer buffer = Buffer.wrap("xxabc".getBytes(StandardCharsets.UTF_8));
        BinaryView left = new BinaryView(buffer, 2, 3);
        BinaryView right = BinaryView.ofUtf8("abc");

        assertThat(left).isEqualTo(right);
        assertThat(left.hashCode()).isEqualTo(right.hashCode());
        assertThat(left).isNotEqualTo(BinaryView.ofUtf8("abd"));
    }

    @Test
    void testUnsignedLexicographicOrder() {
        BinaryView high = BinaryView.of(new byte[] {(byte) 0x80});
        BinaryView low = BinaryView.of(new byte[] {0x7F});

        assertThat(high.compareTo(low)).isPositive();
        assertThat(BinaryView.ofUtf8("ab").compareTo(BinaryView.ofUtf8("abc"))).isNegative();
        assertThat(BinaryView.ofUtf8("").compareTo(BinaryView.ofUtf8(""))).isZero();
    }

    @Test
    void testEmptyView() {
        BinaryView empty = new BinaryView(Buffer.allocate(0), 0, 0);

        assertThat(empty.isEmpty()).isTrue();
        assertThat(empty.toBytes()).isEmpty();
        assertThat(empty.toUtf8String()).isEmpty();
    }
}
