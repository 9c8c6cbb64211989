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
import org.lattice.types.ExtensionType;

import javax.annotation.Nullable;

import java.util.Objects;

/** 扩展类型标量,值是存储类型的标量。 */
@Public
public class ExtensionScalar extends Scalar {

    @Nullable private final Scalar storage;

    public ExtensionScalar(ExtensionType type, @Nullable Scalar storage) {
        super(type, storage != null && storage.isValid());
        this.storage = storage;
    }

    @Nullable
    public Scalar getStorage() {
        return storage;
    }

    @Override
    protected String valueToString() {
        return String.valueOf(storage);
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && Objects.equals(storage, ((ExtensionScalar) o).storage);
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + Objects.hashCode(storage);
    }
}
