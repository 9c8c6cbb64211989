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
import org.lattice.types.ExtensionType;

/** 扩展类型数组,数据按存储类型布局。 */
@Public
public class ExtensionArray extends Array {

    public ExtensionArray(ArrayData data) {
        super(data);
    }

    public ExtensionType extensionType() {
        return (ExtensionType) type();
    }

    public Array storage() {
        return Array.make(data.withType(extensionType().getStorageType()));
    }
}
