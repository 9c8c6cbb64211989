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
import org.lattice.types.Decimal128Type;

import javax.annotation.Nullable;

import java.math.BigDecimal;
import java.util.Objects;

import static org.lattice.utils.Preconditions.checkArgument;

/** decimal128 标量,值的 scale 必须与类型一致,精度不能超过类型的精度。 */
@Public
public class Decimal128Scalar extends Scalar {

    @Nullable private final BigDecimal value;

    public Decimal128Scalar(Decimal128Type type, @Nullable BigDecimal value) {
        super(type, value != null);
        if (value != null) {
            checkArgument(
                    value.scale() == type.getScale(),
                    "Scale of %s does not match %s",
                    value,
                    type);
            checkArgument(
                    value.precision() <= type.getPrecision(),
                    "Precision of %s exceeds %s",
                    value,
                    type);
        }
        this.value = value;
    }

    @Nullable
    public BigDecimal getValue() {
        return value;
    }

    @Override
    protected String valueToString() {
        return value.toPlainString();
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && Objects.equals(value, ((Decimal128Scalar) o).value);
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + Objects.hashCode(value);
    }
}
