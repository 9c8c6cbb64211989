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

import java.io.Serializable;
import java.util.Objects;

import static org.lattice.utils.Preconditions.checkNotNull;

/**
 * 嵌套类型中的一个命名字段。
 *
 * <p>可空性属于字段而不属于类型:同一个 {@link DataType} 可以出现在可空和不可空的字段中。
 */
@Public
public final class DataField implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;

    private final DataType type;

    private final boolean nullable;

    public DataField(String name, DataType type, boolean nullable) {
        this.name = checkNotNull(name, "Field name must not be null.");
        this.type = checkNotNull(type, "Field type must not be null.");
        this.nullable = nullable;
    }

    public DataField(String name, DataType type) {
        this(name, type, true);
    }

    public String getName() {
        return name;
    }

    public DataType getType() {
        return type;
    }

    public boolean isNullable() {
        return nullable;
    }

    public String asSQLString() {
        return name + " " + type.asSQLString() + (nullable ? "" : " NOT NULL");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DataField that = (DataField) o;
        return nullable == that.nullable && name.equals(that.name) && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, nullable);
    }

    @Override
    public String toString() {
        return asSQLString();
    }
}
