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
import org.lattice.types.StructType;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static org.lattice.utils.Preconditions.checkArgument;

/** 结构体标量,每个字段一个子标量。 */
@Public
public class StructScalar extends Scalar {

    @Nullable private final List<Scalar> values;

    public StructScalar(StructType type, @Nullable List<Scalar> values) {
        super(type, values != null);
        checkArgument(
                values == null || values.size() == type.getFieldCount(),
                "Expected %s field values for %s",
                type.getFieldCount(),
                type);
        this.values = values == null ? null : Collections.unmodifiableList(new ArrayList<>(values));
    }

    @Nullable
    public List<Scalar> getValues() {
        return values;
    }

    public Scalar field(int i) {
        return values.get(i);
    }

    @Override
    protected String valueToString() {
        return values.toString();
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && Objects.equals(values, ((StructScalar) o).values);
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + Objects.hashCode(values);
    }
}
