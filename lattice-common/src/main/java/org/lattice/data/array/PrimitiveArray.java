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

package org.lattice.data.array;

import org.lattice.annotation.Public;
import org.lattice.data.ArrayData;
import org.lattice.data.DayTimeInterval;
import org.lattice.exceptions.NotImplementedException;
import org.lattice.memory.Buffer;
import org.lattice.types.FixedWidthType;

/**
 * 定宽数值与时间类型的数组。
 *
 * <p>getter 必须与类型的宽度匹配,例如 INT32、DATE32 使用 {@link #getInt(int)},
 * INT64、TIMESTAMP 使用 {@link #getLong(int)}。无符号类型返回同宽度的有符号值。
 */
@Public
public class PrimitiveArray extends Array {

    private final int byteWidth;

    public PrimitiveArray(ArrayData data) {
        super(data);
        this.byteWidth = ((FixedWidthType) data.getType()).byteWidth();
    }

    public int byteWidth() {
        return byteWidth;
    }

    private Buffer values() {
        return data.getBuffer(1);
    }

    private int index(int i) {
        return (data.getOffset() + i) * byteWidth;
    }

    public byte getByte(int i) {
        return values().get(index(i));
    }

    public short getShort(int i) {
        return values().getShort(index(i));
    }

    public int getInt(int i) {
        return values().getInt(index(i));
    }

    public long getLong(int i) {
        return values().getLong(index(i));
    }

    public float getFloat(int i) {
        return values().getFloat(index(i));
    }

    public double getDouble(int i) {
        return values().getDouble(index(i));
    }

    public DayTimeInterval getDayTimeInterval(int i) {
        int index = index(i);
        return new DayTimeInterval(values().getInt(index), values().getInt(index + 4));
    }

    /** 按宽度读取为 long,有符号扩展。用于整数、日期、时间与区间类型。 */
    public long getAsLong(int i) {
        switch (byteWidth) {
            case 1:
                return getByte(i);
            case 2:
                return getShort(i);
            case 4:
                return getInt(i);
            case 8:
                return getLong(i);
            default:
                throw new NotImplementedException("Cannot read " + type() + " as long.");
        }
    }
}
