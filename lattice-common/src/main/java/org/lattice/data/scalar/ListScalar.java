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
import org.lattice.data.ArrayData;
import org.lattice.types.DataType;
import org.lattice.types.TypeId;

import javax.annotation.Nullable;

import static org.lattice.utils.Preconditions.checkArgument;

/** 列表类标量,用于 list、large list、fixed size list 与 map,值是一段元素数组。 */
@Public
public class ListScalar extends Scalar {

    @Nullable private final ArrayData value;

    public ListScalar(DataType type, @Nullable ArrayData value) {
        super(type, value != null);
        checkArgument(
                type.isAnyOf(TypeId.LIST, TypeId.LARGE_LIST, TypeId.FIXED_SIZE_LIST, TypeId.MAP),
                "Type %s is not a list type.",
                type);
        this.value = value;
    }

    @Nullable
    public ArrayData getValue() {
        return value;
    }

    @Override
    protected String valueToString() {
        return "[" + value.getLength() + " elements]";
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && value == ((ListScalar) o).value;
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + System.identityHashCode(value);
    }
}
