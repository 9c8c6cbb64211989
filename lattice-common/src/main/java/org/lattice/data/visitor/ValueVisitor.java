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

/**
 * 以两个方法接收数组元素的访问者,与 {@link ArrayDataInlineVisitor} 的 {@code Optional}
 * 回调等价。
 *
 * @param <V> 值的类型
 * @param <E> 访问方法可能抛出的异常类型
 */
@Public
public interface ValueVisitor<V, E extends Throwable> {

    /** 访问一个 null 位置。 */
    void visitNull() throws E;

    /** 访问一个有效位置的值。 */
    void visitValue(V value) throws E;
}
