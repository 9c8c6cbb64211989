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
import org.lattice.utils.ConsumerWithException;
import org.lattice.utils.RunnableWithException;

import java.util.Optional;
import java.util.function.Consumer;

import static org.lattice.utils.Preconditions.checkNotNull;

/**
 * 结合物理布局与有效位图的内联值遍历器。
 *
 * <p>遍历按 {@link BitBlockVisitors} 的块结构进行,值只在有效位置的回调内部按需读取,
 * null 位置完全不访问值缓冲区。每个位置恰好回调一次,按位置顺序进行。
 *
 * <p>提供两种回调形式:
 * <ul>
 *   <li>单回调: 接收 {@link Optional},有效位置为 {@code Optional.of(value)},null 位置为
 *       {@code Optional.empty()}
 *   <li>双回调: 有效位置调用值回调,null 位置调用无参的 null 回调
 * </ul>
 *
 * <p>{@code visit} 形式的回调不会失败;{@code tryVisit} 形式中回调抛出的第一个异常原样传播,
 * 之后的位置不再访问。
 *
 * <p>二进制类型的值是借用视图,只在回调内部有效。
 *
 * @param <V> 值的类型
 */
@Public
public final class ArrayDataInlineVisitor<V> {

    private final PhysicalLayout<V> layout;

    private ArrayDataInlineVisitor(PhysicalLayout<V> layout) {
        this.layout = checkNotNull(layout, "Layout must not be null.");
    }

    public static <V> ArrayDataInlineVisitor<V> of(PhysicalLayout<V> layout) {
        return new ArrayDataInlineVisitor<>(layout);
    }

    public PhysicalLayout<V> layout() {
        return layout;
    }

    public void visit(ArrayData data, Consumer<Optional<V>> visitor) {
        ValueAdapter<V> adapter = layout.bind(data);
        BitBlockVisitors.visitBitBlocks(
                data.getValidityBuffer(),
                data.getOffset(),
                data.getLength(),
                position -> visitor.accept(Optional.of(adapter.valueAt(position))),
                () -> visitor.accept(Optional.empty()));
    }

    public void visit(ArrayData data, Consumer<V> validFunc, Runnable nullFunc) {
        ValueAdapter<V> adapter = layout.bind(data);
        BitBlockVisitors.visitBitBlocks(
                data.getValidityBuffer(),
                data.getOffset(),
                data.getLength(),
                position -> validFunc.accept(adapter.valueAt(position)),
                nullFunc);
    }

    public <E extends Throwable> void tryVisit(
            ArrayData data, ConsumerWithException<Optional<V>, E> visitor) throws E {
        ValueAdapter<V> adapter = layout.bind(data);
        BitBlockVisitors.tryVisitBitBlocks(
                data.getValidityBuffer(),
                data.getOffset(),
                data.getLength(),
                position -> visitor.accept(Optional.of(adapter.valueAt(position))),
                () -> visitor.accept(Optional.empty()));
    }

    public <E extends Throwable> void tryVisit(
            ArrayData data,
            ConsumerWithException<V, E> validFunc,
            RunnableWithException<E> nullFunc)
            throws E {
        ValueAdapter<V> adapter = layout.bind(data);
        BitBlockVisitors.tryVisitBitBlocks(
                data.getValidityBuffer(),
                data.getOffset(),
                data.getLength(),
                position -> validFunc.accept(adapter.valueAt(position)),
                nullFunc);
    }
}
