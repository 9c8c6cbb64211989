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
import org.lattice.types.DataTypes;

/** 布尔标量。 */
@Public
public class BooleanScalar extends Scalar {

    private final boolean value;

    public BooleanScalar(boolean value) {
        super(DataTypes.BOOLEAN(), true);
        this.value = value;
    }

    private BooleanScalar() {
        super(DataTypes.BOOLEAN(), false);
        this.value = false;
    }

    public static BooleanScalar nullValue() {
        return new BooleanScalar();
    }

    public boolean getValue() {
        return value;
    }

    @Override
    protected String valueToString() {
        return String.valueOf(value);
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && value == ((BooleanScalar) o).value;
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + Boolean.hashCode(value);
    }
}
