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

package org.lattice.data.visitor;

import org.lattice.annotation.Public;
import org.lattice.data.ArrayData;

/**
 * 以 {@link ValueVisitor} 的两个方法遍历数组元素。
 *
 * <p>顺序、完整性与失败即停的行为与 {@link ArrayDataInlineVisitor#tryVisit} 完全相同:
 * 访问方法抛出的第一个异常原样传播,之后的位置不再访问。
 */
@Public
public final class ArrayDataVisitor {

    public static <V, E extends Throwable> void visit(
            ArrayData data, PhysicalLayout<V> layout, ValueVisitor<V, E> visitor) throws E {
        ArrayDataInlineVisitor.of(layout).tryVisit(data, visitor::visitValue, visitor::visitNull);
    }

    private ArrayDataVisitor() {}
}
