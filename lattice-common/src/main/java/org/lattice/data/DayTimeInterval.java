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

package org.lattice.data;

import org.lattice.annotation.Public;

/** INTERVAL_DAY_TIME 类型的值:天数和毫秒数,各为一个 int32。 */
@Public
public final class DayTimeInterval {

    private final int days;

    private final int milliseconds;

    public DayTimeInterval(int days, int milliseconds) {
        this.days = days;
        this.milliseconds = milliseconds;
    }

    public int getDays() {
        return days;
    }

    public int getMilliseconds() {
        return milliseconds;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DayTimeInterval that = (DayTimeInterval) o;
        return days == that.days && milliseconds == that.milliseconds;
    }

    @Override
    public int hashCode() {
        return 31 * days + milliseconds;
    }

    @Override
    public String toString() {
        return days + "d" + milliseconds + "ms";
    }
}
