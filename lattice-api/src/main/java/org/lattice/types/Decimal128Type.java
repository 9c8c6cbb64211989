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

/**
 * 128 位定点数类型,例如 {@code DECIMAL128(10, 2)}。
 *
 * <p>物理上按 16 字节定长二进制存储,每个值是一个小端序的二进制补码整数,
 * 实际数值为 {@code unscaled * 10^-scale}。
 *
 * <p><b>精度范围:</b> 1-38。
 */
@Public
public class Decimal128Type extends FixedSizeBinaryType {

    private static final long serialVersionUID = 1L;

    public static final int MIN_PRECISION = 1;

    public static final int MAX_PRECISION = 38;

    public static final int BYTE_WIDTH = 16;

    private static final String FORMAT = "DECIMAL128(%d, %d)";

    private final int precision;

    private final int scale;

    public Decimal128Type(int precision, int scale) {
        super(TypeId.DECIMAL128, BYTE_WIDTH);
        checkArgument(
                precision >= MIN_PRECISION && precision <= MAX_PRECISION,
                "Decimal precision must be between %s and %s (both inclusive), but is %s.",
                MIN_PRECISION,
                MAX_PRECISION,
                precision);
        checkArgument(
                scale >= 0 && scale <= precision,
                "Decimal scale must be between 0 and the precision %s (both inclusive), but is %s.",
                precision,
                scale);
        this.precision = precision;
        this.scale = scale;
    }

    public int getPrecision() {
        return precision;
    }

    public int getScale() {
        return scale;
    }

    @Override
    public String asSQLString() {
        return String.format(FORMAT, precision, scale);
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
        Decimal128Type that = (Decimal128Type) o;
        return precision == that.precision && scale == that.scale;
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), precision, scale);
    }
}
