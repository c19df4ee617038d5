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

import java.util.Collections;
import java.util.List;

/**
 * Literal leaf nodes
 */
public class Literals {

  private static abstract class Literal extends Node {
    protected Literal(NodeMeta meta) {
      super(meta);
    }

    @Override
    public List<Node> children() {
      return Collections.emptyList();
    }

    @Override
    public Node mapChildren(Rewriter rewriter) {
      return this;
    }
  }

  public static class IntLit extends Literal {
    private final long value;

    public IntLit(long value, NodeMeta meta) {
      super(meta);
      this.value = value;
    }

    public long value() {
      return value;
    }

    @Override
    public Kind kind() {
      return Kind.INTEGER;
    }

    @Override
    public IntLit withMeta(NodeMeta newMeta) {
      return new IntLit(value, newMeta);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof IntLit && ((IntLit)obj).value == value;
    }

    @Override
    public int hashCode() {
      return Long.valueOf(value).hashCode();
    }
  }

  public static class FloatLit extends Literal {
    private final double value;

    public FloatLit(double value, NodeMeta meta) {
      super(meta);
      this.value = value;
    }

    public double value() {
      return value;
    }

    @Override
    public Kind kind() {
      return Kind.FLOAT;
    }

    @Override
    public FloatLit withMeta(NodeMeta newMeta) {
      return new FloatLit(value, newMeta);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof FloatLit &&
          Double.compare(((FloatLit)obj).value, value) == 0;
    }

    @Override
    public int hashCode() {
      return Double.valueOf(value).hashCode();
    }
  }

  /**
   * String literal.  The text is the decoded string value;
   * #{...} sequences in it are interpolation slots of the target.
   */
  public static class StringLit extends Literal {
    private final String value;

    public StringLit(String value, NodeMeta meta) {
      super(meta);
      assert(value != null);
      this.value = value;
    }

    public String value() {
      return value;
    }

    @Override
    public Kind kind() {
      return Kind.STRING;
    }

    @Override
    public StringLit withMeta(NodeMeta newMeta) {
      return new StringLit(value, newMeta);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof StringLit && ((StringLit)obj).value.equals(value);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }
  }

  /**
   * Atom, stored without the leading colon
   */
  public static class AtomLit extends Literal {
    private final String name;

    public AtomLit(String name, NodeMeta meta) {
      super(meta);
      assert(name != null);
      this.name = name;
    }

    public String name() {
      return name;
    }

    @Override
    public Kind kind() {
      return Kind.ATOM;
    }

    @Override
    public AtomLit withMeta(NodeMeta newMeta) {
      return new AtomLit(name, newMeta);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof AtomLit && ((AtomLit)obj).name.equals(name);
    }

    @Override
    public int hashCode() {
      return 7 * name.hashCode() + 1;
    }
  }

  public static class BoolLit extends Literal {
    private final boolean value;

    public BoolLit(boolean value, NodeMeta meta) {
      super(meta);
      this.value = value;
    }

    public boolean value() {
      return value;
    }

    @Override
    public Kind kind() {
      return Kind.BOOLEAN;
    }

    @Override
    public BoolLit withMeta(NodeMeta newMeta) {
      return new BoolLit(value, newMeta);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof BoolLit && ((BoolLit)obj).value == value;
    }

    @Override
    public int hashCode() {
      return value ? 1231 : 1237;
    }
  }

  public static class NilLit extends Literal {
    public NilLit(NodeMeta meta) {
      super(meta);
    }

    @Override
    public Kind kind() {
      return Kind.NIL;
    }

    @Override
    public NilLit withMeta(NodeMeta newMeta) {
      return new NilLit(newMeta);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof NilLit;
    }

    @Override
    public int hashCode() {
      return 17;
    }
  }

  /**
   * Truthiness of a literal in the target: only nil and false are falsy.
   * @return null if node is not a literal
   */
  public static Boolean truthiness(Node node) {
    switch (node.kind()) {
      case NIL:
        return false;
      case BOOLEAN:
        return ((BoolLit)node).value();
      case INTEGER:
      case FLOAT:
      case STRING:
      case ATOM:
        return true;
      default:
        return null;
    }
  }
}
