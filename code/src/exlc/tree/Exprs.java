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
import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exlc.tree.Operators.BinaryOperator;
import exlc.tree.Operators.UnaryOperator;

/**
 * Expression nodes: variables, access, operators, calls, text
 */
public class Exprs {

  /**
   * Variable reference in a value position.  Module references are
   * represented as variables with capitalized or dotted names.
   */
  public static class Var extends Node {
    private final String name;

    public Var(String name, NodeMeta meta) {
      super(meta);
      assert(name != null && name.length() > 0);
      this.name = name;
    }

    public String name() {
      return name;
    }

    public Var rename(String newName) {
      return new Var(newName, meta);
    }

    @Override
    public Kind kind() {
      return Kind.VAR;
    }

    @Override
    public List<Node> children() {
      return Collections.emptyList();
    }

    @Override
    public Node mapChildren(Rewriter rewriter) {
      return this;
    }

    @Override
    public Var withMeta(NodeMeta newMeta) {
      return new Var(name, newMeta);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Var && ((Var)obj).name.equals(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }
  }

  /**
   * target.field
   */
  public static class FieldAccess extends Node {
    private final Node target;
    private final String field;

    public FieldAccess(Node target, String field, NodeMeta meta) {
      super(meta);
      this.target = target;
      this.field = field;
    }

    public Node target() {
      return target;
    }

    public String field() {
      return field;
    }

    @Override
    public Kind kind() {
      return Kind.FIELD_ACCESS;
    }

    @Override
    public List<Node> children() {
      return Collections.singletonList(target);
    }

    @Override
    public Node mapChildren(Rewriter rewriter) {
      Node newTarget = rewriter.rewrite(target);
      return newTarget == target ? this :
                    new FieldAccess(newTarget, field, meta);
    }

    @Override
    public FieldAccess withMeta(NodeMeta newMeta) {
      return new FieldAccess(target, field, newMeta);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof FieldAccess)) {
        return false;
      }
      FieldAccess other = (FieldAccess)obj;
      return target.equals(other.target) && field.equals(other.field);
    }

    @Override
    public int hashCode() {
      return target.hashCode() * 31 + field.hashCode();
    }
  }

  /**
   * target[index]
   */
  public static class IndexAccess extends Node {
    private final Node target;
    private final Node index;

    public IndexAccess(Node target, Node index, NodeMeta meta) {
      super(meta);
      this.target = target;
      this.index = index;
    }

    public Node target() {
      return target;
    }

    public Node index() {
      return index;
    }

    @Override
    public Kind kind() {
      return Kind.INDEX_ACCESS;
    }

    @Override
    public List<Node> children() {
      return ImmutableList.of(target, index);
    }

    @Override
    public Node mapChildren(Rewriter rewriter) {
      Node newTarget = rewriter.rewrite(target);
      Node newIndex = rewriter.rewrite(index);
      if (newTarget == target && newIndex == index) {
        return this;
      }
      return new IndexAccess(newTarget, newIndex, meta);
    }

    @Override
    public IndexAccess withMeta(NodeMeta newMeta) {
      return new IndexAccess(target, index, newMeta);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof IndexAccess)) {
        return false;
      }
      IndexAccess other = (IndexAccess)obj;
      return target.equals(other.target) && index.equals(other.index);
    }

    @Override
    public int hashCode() {
      return target.hashCode() * 37 + index.hashCode();
    }
  }

  public static class BinaryOp extends Node {
    private final BinaryOperator op;
    private final Node left;
    private final Node right;

    public BinaryOp(BinaryOperator op, Node left, Node right, NodeMeta meta) {
      super(meta);
      this.op = op;
      this.left = left;
      this.right = right;
    }

    public BinaryOperator op() {
      return op;
    }

    public Node left() {
      return left;
    }

    public Node right() {
      return right;
    }

    public BinaryOp withOperands(Node newLeft, Node newRight) {
      if (newLeft == left && newRight == right) {
        return this;
      }
      return new BinaryOp(op, newLeft, newRight, meta);
    }

    @Override
    public Kind kind() {
      return Kind.BINARY;
    }

    @Override
    public List<Node> children() {
      return ImmutableList.of(left, right);
    }

    @Override
    public Node mapChildren(Rewriter rewriter) {
      return withOperands(rewriter.rewrite(left), rewriter.rewrite(right));
    }

    @Override
    public BinaryOp withMeta(NodeMeta newMeta) {
      return new BinaryOp(op, left, right, newMeta);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof BinaryOp)) {
        return false;
      }
      BinaryOp other = (BinaryOp)obj;
      return op == other.op && left.equals(other.left) &&
             right.equals(other.right);
    }

    @Override
    public int hashCode() {
      return (op.hashCode() * 31 + left.hashCode()) * 31 + right.hashCode();
    }
  }

  public static class UnaryOp extends Node {
    private final UnaryOperator op;
    private final Node operand;

    public UnaryOp(UnaryOperator op, Node operand, NodeMeta meta) {
      super(meta);
      this.op = op;
      this.operand = operand;
    }

    public UnaryOperator op() {
      return op;
    }

    public Node operand() {
      return operand;
    }

    public UnaryOp withOperand(Node newOperand) {
      return newOperand == operand ? this :
                      new UnaryOp(op, newOperand, meta);
    }

    @Override
    public Kind kind() {
      return Kind.UNARY;
    }

    @Override
    public List<Node> children() {
      return Collections.singletonList(operand);
    }

    @Override
    public Node mapChildren(Rewriter rewriter) {
      return withOperand(rewriter.rewrite(operand));
    }

    @Override
    public UnaryOp withMeta(NodeMeta newMeta) {
      return new UnaryOp(op, operand, newMeta);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof UnaryOp)) {
        return false;
      }
      UnaryOp other = (UnaryOp)obj;
      return op == other.op && operand.equals(other.operand);
    }

    @Override
    public int hashCode() {
      return op.hashCode() * 31 + operand.hashCode();
    }
  }

  /**
   * Named function call, either local (no qualifier) or
   * qualified, e.g. Enum.map(xs, f) or :erlang.phash2(x)
   */
  public static class Call extends Node {
    /** Module or expression the function is looked up in, may be null */
    private final Node qualifier;
    private final String function;
    private final ImmutableList<Node> args;

    public Call(Node qualifier, String function, List<Node> args,
                NodeMeta meta) {
      super(meta);
      this.qualifier = qualifier;
      this.function = function;
      this.args = ImmutableList.copyOf(args);
    }

    public Node qualifier() {
      return qualifier;
    }

    public String function() {
      return function;
    }

    public ImmutableList<Node> args() {
      return args;
    }

    public Call withArgs(List<Node> newArgs) {
      return new Call(qualifier, function, newArgs, meta);
    }

    @Override
    public Kind kind() {
      return Kind.CALL;
    }

    @Override
    public List<Node> children() {
      if (qualifier == null) {
        return args;
      }
      List<Node> result = new ArrayList<Node>(args.size() + 1);
      result.add(qualifier);
      result.addAll(args);
      return result;
    }

    @Override
    public Node mapChildren(Rewriter rewriter) {
      Node newQualifier = mapNullable(qualifier, rewriter);
      ImmutableList<Node> newArgs = mapList(args, rewriter);
      if (newQualifier == qualifier && newArgs == args) {
        return this;
      }
      return new Call(newQualifier, function, newArgs, meta);
    }

    @Override
    public Call withMeta(NodeMeta newMeta) {
      return new Call(qualifier, function, args, newMeta);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Call)) {
        return false;
      }
      Call other = (Call)obj;
      return eq(qualifier, other.qualifier) &&
          function.equals(other.function) && args.equals(other.args);
    }

    @Override
    public int hashCode() {
      return ((qualifier == null ? 0 : qualifier.hashCode()) * 31 +
                function.hashCode()) * 31 + args.hashCode();
    }
  }

  /**
   * Application of a function value: f.(a, b)
   */
  public static class Apply extends Node {
    private final Node function;
    private final ImmutableList<Node> args;

    public Apply(Node function, List<Node> args, NodeMeta meta) {
      super(meta);
      this.function = function;
      this.args = ImmutableList.copyOf(args);
    }

    public Node function() {
      return function;
    }

    public ImmutableList<Node> args() {
      return args;
    }

    public Apply withArgs(List<Node> newArgs) {
      return new Apply(function, newArgs, meta);
    }

    @Override
    public Kind kind() {
      return Kind.APPLY;
    }

    @Override
    public List<Node> children() {
      List<Node> result = new ArrayList<Node>(args.size() + 1);
      result.add(function);
      result.addAll(args);
      return result;
    }

    @Override
    public Node mapChildren(Rewriter rewriter) {
      Node newFunction = rewriter.rewrite(function);
      ImmutableList<Node> newArgs = mapList(args, rewriter);
      if (newFunction == function && newArgs == args) {
        return this;
      }
      return new Apply(newFunction, newArgs, meta);
    }

    @Override
    public Apply withMeta(NodeMeta newMeta) {
      return new Apply(function, args, newMeta);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Apply)) {
        return false;
      }
      Apply other = (Apply)obj;
      return function.equals(other.function) && args.equals(other.args);
    }

    @Override
    public int hashCode() {
      return function.hashCode() * 31 + args.hashCode();
    }
  }

  /**
   * Explicit parenthesization of an expression or statement sequence
   */
  public static class Paren extends Node {
    private final Node inner;

    public Paren(Node inner, NodeMeta meta) {
      super(meta);
      this.inner = inner;
    }

    public Node inner() {
      return inner;
    }

    @Override
    public Kind kind() {
      return Kind.PAREN;
    }

    @Override
    public List<Node> children() {
      return Collections.singletonList(inner);
    }

    @Override
    public Node mapChildren(Rewriter rewriter) {
      Node newInner = rewriter.rewrite(inner);
      return newInner == inner ? this : new Paren(newInner, meta);
    }

    @Override
    public Paren withMeta(NodeMeta newMeta) {
      return new Paren(inner, newMeta);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Paren && ((Paren)obj).inner.equals(inner);
    }

    @Override
    public int hashCode() {
      return inner.hashCode() * 13 + 11;
    }
  }

  /**
   * String interpolation "text #{expr} text".  String literal parts are
   * literal text, any other part is an interpolated expression.
   */
  public static class Interpolation extends Node {
    private final ImmutableList<Node> parts;

    public Interpolation(List<Node> parts, NodeMeta meta) {
      super(meta);
      this.parts = ImmutableList.copyOf(parts);
    }

    public ImmutableList<Node> parts() {
      return parts;
    }

    @Override
    public Kind kind() {
      return Kind.INTERPOLATION;
    }

    @Override
    public List<Node> children() {
      return parts;
    }

    @Override
    public Node mapChildren(Rewriter rewriter) {
      ImmutableList<Node> newParts = mapList(parts, rewriter);
      return newParts == parts ? this : new Interpolation(newParts, meta);
    }

    @Override
    public Interpolation withMeta(NodeMeta newMeta) {
      return new Interpolation(parts, newMeta);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Interpolation &&
          ((Interpolation)obj).parts.equals(parts);
    }

    @Override
    public int hashCode() {
      return parts.hashCode() + 19;
    }
  }

  /**
   * Opaque target text that the tree does not model.  Passes cannot
   * see inside; analyses only scan it for identifier tokens.
   */
  public static class Raw extends Node {
    private final String text;

    public Raw(String text, NodeMeta meta) {
      super(meta);
      this.text = text;
    }

    public String text() {
      return text;
    }

    @Override
    public Kind kind() {
      return Kind.RAW;
    }

    @Override
    public List<Node> children() {
      return Collections.emptyList();
    }

    @Override
    public Node mapChildren(Rewriter rewriter) {
      return this;
    }

    @Override
    public Raw withMeta(NodeMeta newMeta) {
      return new Raw(text, newMeta);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Raw && ((Raw)obj).text.equals(text);
    }

    @Override
    public int hashCode() {
      return text.hashCode() + 23;
    }
  }
}
