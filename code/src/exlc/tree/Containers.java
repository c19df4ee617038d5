/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */

package exlc.tree;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exlc.common.util.Pair;

/**
 * Container literal nodes: lists, tuples, maps, keyword lists, structs
 */
public class Containers {

  /**
   * Common base for list and tuple, which only differ in kind
   */
  public static abstract class Sequence extends Node {
    protected final ImmutableList<Node> elements;

    protected Sequence(List<Node> elements, NodeMeta meta) {
      super(meta);
      this.elements = ImmutableList.copyOf(elements);
    }

    public ImmutableList<Node> elements() {
      return elements;
    }

    @Override
    public List<Node> children() {
      return elements;
    }

    @Override
    public Node mapChildren(Rewriter rewriter) {
      ImmutableList<Node> newElements = mapList(elements, rewriter);
      return newElements == elements ? this : withElements(newElements);
    }

    public abstract Sequence withElements(List<Node> newElements);

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Sequence && ((Sequence)obj).kind() == kind() &&
          ((Sequence)obj).elements.equals(elements);
    }

    @Override
    public int hashCode() {
      return kind().hashCode() * 31 + elements.hashCode();
    }
  }

  public static class ListLit extends Sequence {
    public ListLit(List<Node> elements, NodeMeta meta) {
      super(elements, meta);
    }

    @Override
    public Kind kind() {
      return Kind.LIST;
    }

    @Override
    public ListLit withElements(List<Node> newElements) {
      return new ListLit(newElements, meta);
    }

    @Override
    public ListLit withMeta(NodeMeta newMeta) {
      return new ListLit(elements, newMeta);
    }
  }

  public static class TupleLit extends Sequence {
    public TupleLit(List<Node> elements, NodeMeta meta) {
      super(elements, meta);
    }

    @Override
    public Kind kind() {
      return Kind.TUPLE;
    }

    @Override
    public TupleLit withElements(List<Node> newElements) {
      return new TupleLit(newElements, meta);
    }

    @Override
    public TupleLit withMeta(NodeMeta newMeta) {
      return new TupleLit(elements, newMeta);
    }
  }

  /**
   * Map literal: %{k1 => v1, k2 => v2}.  Keys are evaluated, in order,
   * interleaved with values.
   */
  public static class MapLit extends Node {
    private final ImmutableList<Pair<Node, Node>> entries;

    public MapLit(List<Pair<Node, Node>> entries, NodeMeta meta) {
      super(meta);
      this.entries = ImmutableList.copyOf(entries);
    }

    public ImmutableList<Pair<Node, Node>> entries() {
      return entries;
    }

    @Override
    public Kind kind() {
      return Kind.MAP;
    }

    @Override
    public List<Node> children() {
      List<Node> result = new ArrayList<Node>(entries.size() * 2);
      for (Pair<Node, Node> e: entries) {
        result.add(e.val1);
        result.add(e.val2);
      }
      return result;
    }

    @Override
    public Node mapChildren(Rewriter rewriter) {
      boolean changed = false;
      List<Pair<Node, Node>> newEntries =
                new ArrayList<Pair<Node, Node>>(entries.size());
      for (Pair<Node, Node> e: entries) {
        Node key = rewriter.rewrite(e.val1);
        Node val = rewriter.rewrite(e.val2);
        if (key != e.val1 || val != e.val2) {
          changed = true;
          newEntries.add(Pair.create(key, val));
        } else {
          newEntries.add(e);
        }
      }
      return changed ? new MapLit(newEntries, meta) : this;
    }

    @Override
    public MapLit withMeta(NodeMeta newMeta) {
      return new MapLit(entries, newMeta);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof MapLit && ((MapLit)obj).entries.equals(entries);
    }

    @Override
    public int hashCode() {
      return entries.hashCode() + 3;
    }
  }

  /**
   * Keyword list: [a: 1, b: 2].  Keys are atoms, not evaluated.
   */
  public static class KeywordList extends Node {
    private final ImmutableList<Pair<String, Node>> entries;

    public KeywordList(List<Pair<String, Node>> entries, NodeMeta meta) {
      super(meta);
      this.entries = ImmutableList.copyOf(entries);
    }

    public ImmutableList<Pair<String, Node>> entries() {
      return entries;
    }

    @Override
    public Kind kind() {
      return Kind.KEYWORD_LIST;
    }

    @Override
    public List<Node> children() {
      return Pair.extract2(entries);
    }

    @Override
    public Node mapChildren(Rewriter rewriter) {
      List<Pair<String, Node>> newEntries = mapNamed(entries, rewriter);
      return newEntries == null ? this : new KeywordList(newEntries, meta);
    }

    @Override
    public KeywordList withMeta(NodeMeta newMeta) {
      return new KeywordList(entries, newMeta);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof KeywordList &&
          ((KeywordList)obj).entries.equals(entries);
    }

    @Override
    public int hashCode() {
      return entries.hashCode() + 5;
    }
  }

  /**
   * Struct literal: %Module{field: value}
   */
  public static class StructLit extends Node {
    private final String module;
    private final ImmutableList<Pair<String, Node>> fields;

    public StructLit(String module, List<Pair<String, Node>> fields,
                     NodeMeta meta) {
      super(meta);
      this.module = module;
      this.fields = ImmutableList.copyOf(fields);
    }

    public String module() {
      return module;
    }

    public ImmutableList<Pair<String, Node>> fields() {
      return fields;
    }

    @Override
    public Kind kind() {
      return Kind.STRUCT;
    }

    @Override
    public List<Node> children() {
      return Pair.extract2(fields);
    }

    @Override
    public Node mapChildren(Rewriter rewriter) {
      List<Pair<String, Node>> newFields = mapNamed(fields, rewriter);
      return newFields == null ? this : new StructLit(module, newFields, meta);
    }

    @Override
    public StructLit withMeta(NodeMeta newMeta) {
      return new StructLit(module, fields, newMeta);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof StructLit)) {
        return false;
      }
      StructLit other = (StructLit)obj;
      return module.equals(other.module) && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
      return module.hashCode() * 31 + fields.hashCode();
    }
  }

  /**
   * @return null if no value changed
   */
  private static List<Pair<String, Node>> mapNamed(
          List<Pair<String, Node>> entries, Node.Rewriter rewriter) {
    boolean changed = false;
    List<Pair<String, Node>> result =
            new ArrayList<Pair<String, Node>>(entries.size());
    for (Pair<String, Node> e: entries) {
      Node val = rewriter.rewrite(e.val2);
      changed = changed || val != e.val2;
      result.add(e.withSecond(val));
    }
    return changed ? result : null;
  }
}
