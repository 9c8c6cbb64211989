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
import org.lattice.types.UnionType;

import javax.annotation.Nullable;

import java.util.Objects;

import static org.lattice.utils.Preconditions.checkArgument;

/** 联合标量: 一个类型码加对应分支的值。 */
@Public
public class UnionScalar extends Scalar {

    private final byte typeCode;

    @Nullable private final Scalar value;

    public UnionScalar(UnionType type, byte typeCode, @Nullable Scalar value) {
        super(type, value != null);
        checkArgument(
                type.getChildId(typeCode) >= 0, "Unknown type code %s for %s", typeCode, type);
        this.typeCode = typeCode;
        this.value = value;
    }

    public byte getTypeCode() {
        return typeCode;
    }

    public int getChildId() {
        return ((UnionType) type).getChildId(typeCode);
    }

    @Nullable
    public Scalar getValue() {
        return value;
    }

    @Override
    protected String valueToString() {
        return typeCode + "=" + value;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        UnionScalar that = (UnionScalar) o;
        return typeCode == that.typeCode && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), typeCode, value);
    }
}
