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
import org.lattice.data.DayTimeInterval;
import org.lattice.types.DataType;
import org.lattice.types.DataTypes;
import org.lattice.types.LayoutCategory;
import org.lattice.types.TypeId;

import static org.lattice.utils.Preconditions.checkArgument;

/**
 * 定宽数值与时间类型的标量,值以原始位的形式保存在一个 long 中。
 *
 * <p>整数按有符号扩展保存,浮点数保存 IEEE 754 位模式,天加毫秒区间的天数在低 32 位、
 * 毫秒数在高 32 位,与内存中的小端布局一致。
 */
@Public
public class PrimitiveScalar extends Scalar {

    private final long bits;

    private PrimitiveScalar(DataType type, long bits, boolean valid) {
        super(type, valid);
        checkArgument(
                type.getLayout() == LayoutCategory.FIXED_WIDTH,
                "Type %s is not a primitive type.",
                type);
        this.bits = bits;
    }

    /** 以原始位创建标量。 */
    public static PrimitiveScalar of(DataType type, long bits) {
        return new PrimitiveScalar(type, bits, true);
    }

    public static PrimitiveScalar ofFloat(float value) {
        return new PrimitiveScalar(DataTypes.FLOAT(), Float.floatToRawIntBits(value), true);
    }

    public static PrimitiveScalar ofDouble(double value) {
        return new PrimitiveScalar(
                DataTypes.DOUBLE(), Double.doubleToRawLongBits(value), true);
    }

    public static PrimitiveScalar ofDayTime(DayTimeInterval value) {
        long bits = (value.getDays() & 0xFFFFFFFFL) | ((long) value.getMilliseconds() << 32);
        return new PrimitiveScalar(DataTypes.INTERVAL_DAY_TIME(), bits, true);
    }

    public static PrimitiveScalar nullOf(DataType type) {
        return new PrimitiveScalar(type, 0L, false);
    }

    public long getBits() {
        return bits;
    }

    public byte getByte() {
        return (byte) bits;
    }

    public short getShort() {
        return (short) bits;
    }

    public int getInt() {
        return (int) bits;
    }

    public long getLong() {
        return bits;
    }

    public float getFloat() {
        return Float.intBitsToFloat((int) bits);
    }

    public double getDouble() {
        return Double.longBitsToDouble(bits);
    }

    public DayTimeInterval getDayTimeInterval() {
        return new DayTimeInterval((int) bits, (int) (bits >>> 32));
    }

    @Override
    protected String valueToString() {
        TypeId typeId = getTypeId();
        switch (typeId) {
            case FLOAT:
                return String.valueOf(getFloat());
            case DOUBLE:
                return String.valueOf(getDouble());
            case INTERVAL_DAY_TIME:
                return getDayTimeInterval().toString();
            default:
                return String.valueOf(bits);
        }
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && bits == ((PrimitiveScalar) o).bits;
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + Long.hashCode(bits);
    }
}
