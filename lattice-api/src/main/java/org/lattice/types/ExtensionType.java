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

/**
 * 用户自定义扩展类型的基类。
 *
 * <p>扩展类型在一个已有的存储类型之上附加语义,例如以 {@code FIXED_SIZE_BINARY(16)} 存储的 UUID。
 * 物理布局与存储类型完全相同。
 *
 * <p>实现类需要提供扩展名与相等性判断:
 * <pre>{@code
 * class UuidType extends ExtensionType {
 *     UuidType() {
 *         super(new FixedSizeBinaryType(16));
 *     }
 *
 *     public String extensionName() {
 *         return "uuid";
 *     }
 *
 *     protected boolean extensionEquals(ExtensionType other) {
 *         return other instanceof UuidType;
 *     }
 * }
 * }</pre>
 */
@Public
public abstract class ExtensionType extends DataType {

    private static final long serialVersionUID = 1L;

    private final DataType storageType;

    protected ExtensionType(DataType storageType) {
        super(TypeId.EXTENSION);
        this.storageType = checkNotNull(storageType, "Storage type must not be null.");
    }

    public DataType getStorageType() {
        return storageType;
    }

    /** 扩展类型的唯一名称。 */
    public abstract String extensionName();

    /** 判断两个扩展类型在扩展语义上是否相等,存储类型已由调用方比较过。 */
    protected abstract boolean extensionEquals(ExtensionType other);

    @Override
    public String asSQLString() {
        return "EXTENSION<" + extensionName() + ", " + storageType.asSQLString() + ">";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ExtensionType)) {
            return false;
        }
        ExtensionType that = (ExtensionType) o;
        return storageType.equals(that.storageType)
                && extensionName().equals(that.extensionName())
                && extensionEquals(that);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), extensionName(), storageType);
    }
}
