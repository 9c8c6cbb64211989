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
import org.lattice.types.FixedSizeBinaryType;

import javax.annotation.Nullable;

import java.util.Arrays;

import static org.lattice.utils.Preconditions.checkArgument;

/** 定长二进制标量。 */
@Public
public class FixedSizeBinaryScalar extends Scalar {

    @Nullable private final byte[] value;

    public FixedSizeBinaryScalar(FixedSizeBinaryType type, @Nullable byte[] value) {
        super(type, value != null);
        checkArgument(
                value == null || value.length == type.byteWidth(),
                "Expected %s bytes for %s",
                type.byteWidth(),
                type);
        this.value = value;
    }

    @Nullable
    public byte[] getBytes() {
        return value;
    }

    public BinaryView getView() {
        return BinaryView.of(value);
    }

    @Override
    protected String valueToString() {
        return Arrays.toString(value);
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && Arrays.equals(value, ((FixedSizeBinaryScalar) o).value);
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + Arrays.hashCode(value);
    }
}
