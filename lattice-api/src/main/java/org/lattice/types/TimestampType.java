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

import javax.annotation.Nullable;

import java.util.Objects;

import static org.lattice.utils.Preconditions.checkNotNull;

/**
 * 时间戳类型,以距 UNIX 纪元的 {@link TimeUnit} 计数(int64)存储。
 *
 * <p>时区为可选参数:为 null 时表示本地时间语义(不含时区),否则值按 UTC 存储,
 * 展示时转换到该时区。
 */
@Public
public class TimestampType extends FixedWidthType {

    private static final long serialVersionUID = 1L;

    private final TimeUnit unit;

    @Nullable private final String timezone;

    public TimestampType(TimeUnit unit, @Nullable String timezone) {
        super(TypeId.TIMESTAMP);
        this.unit = checkNotNull(unit, "Time unit must not be null.");
        this.timezone = timezone;
    }

    public TimestampType(TimeUnit unit) {
        this(unit, null);
    }

    public TimeUnit getUnit() {
        return unit;
    }

    @Nullable
    public String getTimezone() {
        return timezone;
    }

    @Override
    public String asSQLString() {
        if (timezone == null) {
            return String.format("TIMESTAMP(%s)", unit);
        }
        return String.format("TIMESTAMP(%s, %s)", unit, timezone);
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
        TimestampType that = (TimestampType) o;
        return unit == that.unit && Objects.equals(timezone, that.timezone);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), unit, timezone);
    }
}
