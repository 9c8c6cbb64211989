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

import java.io.Serializable;
import java.util.Arrays;
import java.util.Objects;

import static org.lattice.utils.Preconditions.checkNotNull;

/**
 * 描述一列数据的逻辑类型与物理编码。
 *
 * <p>DataType 是类型系统的核心抽象类,每个实例都携带唯一的类型标签 {@link TypeId}。
 * 类型标签决定了:
 * <ul>
 *     <li>物理布局: 值在缓冲区中的排布方式,见 {@link LayoutCategory}</li>
 *     <li>分发目标: {@link TypeDispatcher} 根据类型标签选择 {@link TypeVisitor} 的具体方法</li>
 *     <li>类型族: 用于分类判断,见 {@link TypeFamily}</li>
 * </ul>
 *
 * <p>设计特点:
 * <ul>
 *     <li>不可变性: 所有类型实例都是不可变的,可以在线程间自由共享</li>
 *     <li>可序列化: 支持 Java 序列化</li>
 *     <li>可空性不属于类型,而属于字段,见 {@link DataField}</li>
 * </ul>
 *
 * <p>使用示例:
 * <pre>{@code
 * DataType intType = DataTypes.INT32();
 * DataType listType = DataTypes.LIST(DataTypes.STRING());
 *
 * String name = TypeDispatcher.visit(listType, new TypeDefaultVisitor<String>() {
 *     protected String defaultMethod(DataType type) {
 *         return type.asSQLString();
 *     }
 * });
 * }</pre>
 *
 * @see DataTypes 用于创建各种数据类型的工厂类
 * @see TypeDispatcher 类型分发器
 */
@Public
public abstract class DataType implements Serializable {

    private static final long serialVersionUID = 1L;

    /** 该类型的标签。 */
    private final TypeId typeId;

    /**
     * 构造一个数据类型实例。
     *
     * @param typeId 该类型的标签
     */
    protected DataType(TypeId typeId) {
        this.typeId = checkNotNull(typeId, "Type id must not be null.");
    }

    /** 返回该类型的标签。 */
    public TypeId getTypeId() {
        return typeId;
    }

    /**
     * 返回该类型的物理布局类别。
     *
     * @return 由类型标签固定决定的布局类别
     */
    public LayoutCategory getLayout() {
        return typeId.layout();
    }

    /**
     * 判断该类型的标签是否等于指定的 {@code typeId}。
     *
     * @param typeId 要检查的目标类型标签
     * @return 如果类型标签相等则返回 true
     */
    public boolean is(TypeId typeId) {
        return this.typeId == typeId;
    }

    /**
     * 判断该类型是否属于指定的类型族。
     *
     * @param family 要检查的目标类型族
     * @return 如果类型属于该族则返回 true
     */
    public boolean is(TypeFamily family) {
        return typeId.families().contains(family);
    }

    /**
     * 判断该类型的标签是否等于给定的任意一个 {@code typeIds}。
     *
     * @param typeIds 要检查的目标类型标签
     * @return 如果类型标签匹配任意一个则返回 true
     */
    public boolean isAnyOf(TypeId... typeIds) {
        return Arrays.stream(typeIds).anyMatch(id -> this.typeId == id);
    }

    /**
     * 返回该类型的字符串表示形式,例如 {@code INT32}、{@code TIMESTAMP(MILLISECOND, UTC)}、
     * {@code LIST<STRING>}。
     */
    public abstract String asSQLString();

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DataType that = (DataType) o;
        return typeId == that.typeId;
    }

    @Override
    public int hashCode() {
        return Objects.hash(typeId);
    }

    @Override
    public String toString() {
        return asSQLString();
    }
}
