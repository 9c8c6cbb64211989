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

import java.util.Objects;

import static org.lattice.utils.Preconditions.checkNotNull;

/** 时间长度类型,以 {@link TimeUnit} 计数(int64)存储。 */
@Public
public class DurationType extends FixedWidthType {

    private static final long serialVersionUID = 1L;

    private final TimeUnit unit;

    public DurationType(TimeUnit unit) {
        super(TypeId.DURATION);
        this.unit = checkNotNull(unit, "Time unit must not be null.");
    }

    public TimeUnit getUnit() {
        return unit;
    }

    @Override
    public String asSQLString() {
        return String.format("DURATION(%s)", unit);
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
        DurationType that = (DurationType) o;
        return unit == that.unit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), unit);
    }
}
