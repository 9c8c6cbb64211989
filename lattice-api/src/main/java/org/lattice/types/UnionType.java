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

package org.lattice.types;

import org.lattice.annotation.Public;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static org.lattice.utils.Preconditions.checkArgument;
import static org.lattice.utils.Preconditions.checkNotNull;

/**
 * 联合类型的基类。
 *
 * <p>每个位置的值来自某一个子字段,由 {@code buffers[1]} 中的 int8 类型码决定;
 * 类型码到子字段下标的映射由 {@link #getTypeCodes()} 给出。稀疏与稠密两种模式的区别见
 * {@link SparseUnionType} 与 {@link DenseUnionType}。
 */
@Public
public abstract class UnionType extends NestedType {

    private static final long serialVersionUID = 1L;

    /** 联合模式。 */
    public enum Mode {
        SPARSE,
        DENSE
    }

    private final List<DataField> fields;

    private final byte[] typeCodes;

    /** 类型码到子字段下标,未使用的类型码为 -1。 */
    private final int[] childIds;

    protected UnionType(TypeId typeId, List<DataField> fields, byte[] typeCodes) {
        super(typeId);
        checkNotNull(fields, "Fields must not be null.");
        checkNotNull(typeCodes, "Type codes must not be null.");
        checkArgument(
                fields.size() == typeCodes.length,
                "Union has %s fields but %s type codes.",
                fields.size(),
                typeCodes.length);
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
        this.typeCodes = typeCodes.clone();
        this.childIds = new int[Byte.MAX_VALUE + 1];
        Arrays.fill(childIds, -1);
        for (int i = 0; i < typeCodes.length; i++) {
            checkArgument(typeCodes[i] >= 0, "Type code must be non-negative: %s", typeCodes[i]);
            checkArgument(childIds[typeCodes[i]] == -1, "Duplicate type code: %s", typeCodes[i]);
            childIds[typeCodes[i]] = i;
        }
    }

    public abstract Mode getMode();

    @Override
    public List<DataField> getFields() {
        return fields;
    }

    public byte[] getTypeCodes() {
        return typeCodes.clone();
    }

    /**
     * 返回类型码对应的子字段下标。
     *
     * @return 子字段下标,类型码未使用时返回 -1
     */
    public int getChildId(byte typeCode) {
        return typeCode < 0 ? -1 : childIds[typeCode];
    }

    @Override
    public String asSQLString() {
        StringBuilder builder = new StringBuilder();
        builder.append(getMode() == Mode.SPARSE ? "SPARSE_UNION<" : "DENSE_UNION<");
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) {
                builder.append(", ");
            }
            builder.append(fields.get(i).asSQLString()).append('=').append(typeCodes[i]);
        }
        return builder.append('>').toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        if (!super.equals(o)) {
            return false;
        }
        UnionType that = (UnionType) o;
        return fields.equals(that.fields) && Arrays.equals(typeCodes, that.typeCodes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), fields, Arrays.hashCode(typeCodes));
    }
}
