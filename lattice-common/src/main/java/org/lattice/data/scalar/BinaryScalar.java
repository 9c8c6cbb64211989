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

import org.lattice.annotation.Public;
import org.lattice.memory.BinaryView;
import org.lattice.types.BaseBinaryType;
import org.lattice.types.DataTypes;

import javax.annotation.Nullable;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/** 变长二进制与字符串标量,包括 large 变体。 */
@Public
public class BinaryScalar extends Scalar {

    @Nullable private final byte[] value;

    /**
     * @param type 二进制或字符串类型
     * @param value 字节内容,为 null 表示 null 值
     */
    public BinaryScalar(BaseBinaryType type, @Nullable byte[] value) {
        super(type, value != null);
        this.value = value;
    }

    public static BinaryScalar ofString(String value) {
        return new BinaryScalar(DataTypes.STRING(), value.getBytes(StandardCharsets.UTF_8));
    }

    @Nullable
    public byte[] getBytes() {
        return value;
    }

    public BinaryView getView() {
        return BinaryView.of(value);
    }

    public String getString() {
        return new String(value, StandardCharsets.UTF_8);
    }

    @Override
    protected String valueToString() {
        return ((BaseBinaryType) type).isUtf8() ? getString() : Arrays.toString(value);
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && Arrays.equals(value, ((BinaryScalar) o).value);
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + Arrays.hashCode(value);
    }
}
