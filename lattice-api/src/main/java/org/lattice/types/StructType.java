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
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import static org.lattice.utils.Preconditions.checkNotNull;

/**
 * 结构体类型,由一组有序的命名字段组成。
 *
 * <p>数组布局只有有效位图,每个字段对应一个长度相同的子数组。
 */
@Public
public class StructType extends NestedType {

    private static final long serialVersionUID = 1L;

    private final List<DataField> fields;

    public StructType(List<DataField> fields) {
        super(TypeId.STRUCT);
        this.fields = Collections.unmodifiableList(new ArrayList<>(checkNotNull(fields)));
    }

    @Override
    public List<DataField> getFields() {
        return fields;
    }

    /**
     * 按名称查找字段下标。
     *
     * @return 字段下标,不存在时返回 -1
     */
    public int getFieldIndex(String name) {
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).getName().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public String asSQLString() {
        return fields.stream()
                .map(DataField::asSQLString)
                .collect(Collectors.joining(", ", "STRUCT<", ">"));
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
        StructType that = (StructType) o;
        return fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), fields);
    }
}
