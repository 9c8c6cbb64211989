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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 映射类型,物理上等价于 {@code LIST<STRUCT<key NOT NULL, value>>}。
 *
 * <p>数组布局与 {@link ListType} 相同:32 位偏移量加一个名为 {@code entries} 的结构体子数组,
 * 该结构体的第一个字段为键,第二个字段为值。
 */
@Public
public class MapType extends NestedType {

    private static final long serialVersionUID = 1L;

    private final DataField entriesField;

    private final boolean keysSorted;

    public MapType(DataType keyType, DataType itemType, boolean keysSorted) {
        super(TypeId.MAP);
        StructType entries =
                new StructType(
                        Arrays.asList(
                                new DataField("key", keyType, false),
                                new DataField("value", itemType)));
        this.entriesField = new DataField("entries", entries, false);
        this.keysSorted = keysSorted;
    }

    public MapType(DataType keyType, DataType itemType) {
        this(keyType, itemType, false);
    }

    public DataType getKeyType() {
        return getEntriesType().getField(0).getType();
    }

    public DataType getItemType() {
        return getEntriesType().getField(1).getType();
    }

    public StructType getEntriesType() {
        return (StructType) entriesField.getType();
    }

    public boolean isKeysSorted() {
        return keysSorted;
    }

    @Override
    public List<DataField> getFields() {
        return Collections.singletonList(entriesField);
    }

    @Override
    public String asSQLString() {
        return "MAP<"
                + getKeyType().asSQLString()
                + ", "
                + getItemType().asSQLString()
                + (keysSorted ? ", keys_sorted" : "")
                + ">";
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
        MapType that = (MapType) o;
        return keysSorted == that.keysSorted && entriesField.equals(that.entriesField);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), entriesField, keysSorted);
    }
}
