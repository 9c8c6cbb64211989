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

import java.util.List;

/**
 * 嵌套类型的基类,值存放在子数组中。
 *
 * <p>分发器对嵌套类型与其他类型一视同仁地分发,但不会递归进入子类型;
 * 如需遍历子数组,由访问者在各自的 visit 方法中再次调用分发器。
 */
@Public
public abstract class NestedType extends DataType {

    private static final long serialVersionUID = 1L;

    protected NestedType(TypeId typeId) {
        super(typeId);
    }

    /** 子字段列表,顺序与子数组一致。 */
    public abstract List<DataField> getFields();

    public int getFieldCount() {
        return getFields().size();
    }

    public DataField getField(int i) {
        return getFields().get(i);
    }
}
