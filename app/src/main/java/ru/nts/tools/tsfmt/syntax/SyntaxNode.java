/*
 * Copyright 2025 Aristo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ru.nts.tools.tsfmt.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Узел синтаксического дерева, скопированный из tree-sitter.
 *
 * <p>В отличие от {@code TSNode} узел изменяем в одном отношении: порядок дочерних узлов
 * можно переставить ({@link #reorder(List)}). Исходный порядок сохраняется, чтобы принтер
 * мог взять промежутки между детьми (пробелы, разделители) из исходных позиций.
 * Смещения {@link #start()}/{@link #end()} - индексы в Java-строке исходника, а не байты.
 */
public final class SyntaxNode {

    private final String type;
    private final String field;
    private final boolean named;
    private final int start;
    private final int end;
    private List<SyntaxNode> originalChildren;
    private List<SyntaxNode> children;
    private SyntaxNode parent;
    private boolean blockLayout;

    public SyntaxNode(String type, boolean named, int start, int end) {
        this(type, null, named, start, end);
    }

    /**
     * @param field имя поля грамматики, под которым узел висит у родителя ({@code name},
     *              {@code parameters}, {@code source}...), или null
     */
    public SyntaxNode(String type, String field, boolean named, int start, int end) {
        this.type = type;
        this.field = field;
        this.named = named;
        this.start = start;
        this.end = end;
        this.originalChildren = new ArrayList<>();
        this.children = originalChildren;
    }

    public String type() {
        return type;
    }

    public String field() {
        return field;
    }

    public boolean isNamed() {
        return named;
    }

    public int start() {
        return start;
    }

    public int end() {
        return end;
    }

    public SyntaxNode parent() {
        return parent;
    }

    public boolean is(String nodeType) {
        return type.equals(nodeType);
    }

    public boolean isComment() {
        return "comment".equals(type);
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /**
     * Дочерние узлы в текущем (возможно переставленном) порядке.
     */
    public List<SyntaxNode> children() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Дочерние узлы в порядке исходного текста.
     */
    public List<SyntaxNode> originalChildren() {
        return Collections.unmodifiableList(originalChildren);
    }

    public int childCount() {
        return children.size();
    }

    public SyntaxNode child(int index) {
        return children.get(index);
    }

    /**
     * Именованные дочерние узлы без комментариев, в текущем порядке.
     */
    public List<SyntaxNode> namedChildren() {
        List<SyntaxNode> result = new ArrayList<>();
        for (SyntaxNode child : children) {
            if (child.named && !child.isComment()) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * Первый дочерний узел одного из указанных типов или null.
     */
    public SyntaxNode firstChild(String... types) {
        for (SyntaxNode child : children) {
            for (String t : types) {
                if (child.type.equals(t)) {
                    return child;
                }
            }
        }
        return null;
    }

    /**
     * Дочерний узел по имени поля грамматики или null.
     */
    public SyntaxNode childByField(String fieldName) {
        for (SyntaxNode child : children) {
            if (fieldName.equals(child.field)) {
                return child;
            }
        }
        return null;
    }

    public boolean hasChild(String nodeType) {
        return firstChild(nodeType) != null;
    }

    /**
     * Следующий узел-сосед в текущем порядке родителя или null.
     */
    public SyntaxNode nextSibling() {
        if (parent == null) return null;
        int idx = parent.children.indexOf(this);
        return idx >= 0 && idx + 1 < parent.children.size() ? parent.children.get(idx + 1) : null;
    }

    public String text(String source) {
        return source.substring(start, end);
    }

    void addChild(SyntaxNode child) {
        child.parent = this;
        originalChildren.add(child);
    }

    /**
     * Заменяет детей при построении дерева (до любых перестановок).
     */
    void replaceChildren(List<SyntaxNode> nodes) {
        originalChildren = new ArrayList<>();
        children = originalChildren;
        nodes.forEach(this::addChild);
    }

    /**
     * Переставляет дочерние узлы. Новый список должен быть перестановкой текущего.
     *
     * @throws IllegalArgumentException если список не является перестановкой
     */
    public void reorder(List<SyntaxNode> newOrder) {
        if (newOrder.size() != children.size() || !newOrder.containsAll(children)) {
            throw new IllegalArgumentException("Reorder of '" + type + "' must be a permutation of its children");
        }
        children = new ArrayList<>(newOrder);
    }

    public boolean isReordered() {
        return children != originalChildren && !children.equals(originalChildren);
    }

    /**
     * Заменяет поддерево детей плоским списком узлов-потомков (например, вложенные
     * {@code union_type} превращаются в один список членов и разделителей {@code |}).
     * Узлы сортируются по исходной позиции и становятся новым исходным порядком.
     */
    public void flatten(List<SyntaxNode> descendants) {
        List<SyntaxNode> sorted = new ArrayList<>(descendants);
        sorted.sort((a, b) -> Integer.compare(a.start, b.start));
        for (SyntaxNode node : sorted) {
            node.parent = this;
        }
        originalChildren = sorted;
        children = originalChildren;
    }

    /**
     * Помечает узел для блочной раскладки (тело программы, тело класса).
     */
    public void markBlockLayout() {
        this.blockLayout = true;
    }

    public boolean isBlockLayout() {
        return blockLayout;
    }

    @Override
    public String toString() {
        return type + "[" + start + ".." + end + "]";
    }
}
