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

import static org.lattice.utils.Preconditions.checkArgument;
import static org.lattice.utils.Preconditions.checkNotNull;

/** 自午夜起的时间,以 int64 存储,单位只能是微秒或纳秒。 */
@Public
public class Time64Type extends FixedWidthType {

    private static final long serialVersionUID = 1L;

    private final TimeUnit unit;

    public Time64Type(TimeUnit unit) {
        super(TypeId.TIME64);
        checkNotNull(unit, "Time unit must not be null.");
        checkArgument(
                unit == TimeUnit.MICROSECOND || unit == TimeUnit.NANOSECOND,
                "TIME64 only supports units MICROSECOND and NANOSECOND, but is %s.",
                unit);
        this.unit = unit;
    }

    public TimeUnit getUnit() {
        return unit;
    }

    @Override
    public String asSQLString() {
        return String.format("TIME64(%s)", unit);
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
        Time64Type that = (Time64Type) o;
        return unit == that.unit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), unit);
    }
}
