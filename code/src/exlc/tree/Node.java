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

/**
 * Base class of all tree nodes.
 *
 * Nodes are immutable: a pass that changes a node builds a new one.
 * Every variant must declare its child slots through {@link #children()}
 * and {@link #mapChildren(Rewriter)}; patterns are a separate category
 * and are not child nodes.
 *
 * Equality is structural and ignores metadata.
 */
public abstract class Node {

  public static enum Kind {
    INTEGER,
    FLOAT,
    STRING,
    ATOM,
    BOOLEAN,
    NIL,
    LIST,
    TUPLE,
    MAP,
    KEYWORD_LIST,
    STRUCT,
    VAR,
    FIELD_ACCESS,
    INDEX_ACCESS,
    BINARY,
    UNARY,
    CALL,
    APPLY,
    FN,
    IF,
    COND,
    MATCH,
    CASE,
    BLOCK,
    PAREN,
    INTERPOLATION,
    RAW,
    MODULE,
    FUNCTION_DEF,
    MODULE_ATTRIBUTE,
    ;

    public boolean isLiteral() {
      switch (this) {
        case INTEGER:
        case FLOAT:
        case STRING:
        case ATOM:
        case BOOLEAN:
        case NIL:
          return true;
        default:
          return false;
      }
    }
  }

  /**
   * Function from node to node, used for rewriting children
   */
  public static interface Rewriter {
    public Node rewrite(Node node);
  }

  protected final NodeMeta meta;

  protected Node(NodeMeta meta) {
    this.meta = meta == null ? NodeMeta.EMPTY : meta;
  }

  public abstract Kind kind();

  public NodeMeta meta() {
    return meta;
  }

  /**
   * @return child nodes in value positions, in evaluation order
   */
  public abstract List<Node> children();

  /**
   * Rebuild this node with each child replaced by the result of the
   * rewriter.  Must return this node itself if no child changed.
   */
  public abstract Node mapChildren(Rewriter rewriter);

  /**
   * @return copy of this node with different metadata
   */
  public abstract Node withMeta(NodeMeta newMeta);

  public boolean isLiteral() {
    return kind().isLiteral();
  }

  /**
   * Trivial nodes need no legalization in any expression slot
   */
  public boolean isTrivial() {
    return isLiteral() || kind() == Kind.VAR;
  }

  @Override
  public abstract boolean equals(Object obj);

  @Override
  public abstract int hashCode();

  @Override
  public String toString() {
    return TreeFormat.format(this);
  }

  /**
   * Apply rewriter to each element
   * @return the original list if no element changed
   */
  protected static ImmutableList<Node> mapList(ImmutableList<Node> nodes,
                                               Rewriter rewriter) {
    List<Node> result = null;
    for (int i = 0; i < nodes.size(); i++) {
      Node orig = nodes.get(i);
      Node updated = rewriter.rewrite(orig);
      if (updated != orig && result == null) {
        result = new ArrayList<Node>(nodes.size());
        result.addAll(nodes.subList(0, i));
      }
      if (result != null) {
        result.add(updated);
      }
    }
    return result == null ? nodes : ImmutableList.copyOf(result);
  }

  /**
   * Apply rewriter to a nullable slot
   */
  protected static Node mapNullable(Node node, Rewriter rewriter) {
    return node == null ? null : rewriter.rewrite(node);
  }

  protected static boolean eq(Object a, Object b) {
    return a == null ? b == null : a.equals(b);
  }
}
