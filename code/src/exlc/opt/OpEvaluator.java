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

package exlc.opt;

import java.util.ArrayList;
import java.util.List;

import exlc.tree.Containers.ListLit;
import exlc.tree.Literals;
import exlc.tree.Literals.AtomLit;
import exlc.tree.Literals.BoolLit;
import exlc.tree.Literals.FloatLit;
import exlc.tree.Literals.IntLit;
import exlc.tree.Literals.StringLit;
import exlc.tree.Node;
import exlc.tree.NodeMeta;
import exlc.tree.Operators.BinaryOperator;
import exlc.tree.Operators.UnaryOperator;
import exlc.tree.Trees;

/**
 * Compile time evaluation of operators on literals
 */
public class OpEvaluator {

  /**
   * Try to do compile-time evaluation of a binary operator
   *
   * @return replacement for the operation if it could be evaluated at
   *         compile-time, null otherwise.  Operations that would fail at
   *         runtime (division by zero, overflow, bad operand types) are
   *         never evaluated.
   */
  public static Node eval(BinaryOperator op, Node left, Node right) {
    if (op.isShortCircuit()) {
      return evalShortCircuit(op, left, right);
    }
    if (op == BinaryOperator.LIST_CONCAT) {
      return evalListConcat(left, right);
    }
    if (!left.isLiteral() || !right.isLiteral()) {
      return null;
    }
    Node.Kind lk = left.kind();
    Node.Kind rk = right.kind();
    if (lk == Node.Kind.INTEGER && rk == Node.Kind.INTEGER) {
      return evalIntOp(op, ((IntLit)left).value(), ((IntLit)right).value());
    } else if (isNumeric(lk) && isNumeric(rk)) {
      return evalFloatOp(op, left, right);
    } else if (lk == Node.Kind.STRING && rk == Node.Kind.STRING) {
      return evalStringOp(op, ((StringLit)left).value(),
                              ((StringLit)right).value());
    } else {
      return evalOtherOp(op, left, right);
    }
  }

  /**
   * Try to do compile-time evaluation of a unary operator
   * @return literal result, or null
   */
  public static Node eval(UnaryOperator op, Node operand) {
    switch (op) {
      case NOT:
        if (operand.kind() == Node.Kind.BOOLEAN) {
          return Trees.bool(!((BoolLit)operand).value());
        }
        return null;
      case BANG: {
        Boolean truthy = Literals.truthiness(operand);
        return truthy == null ? null : Trees.bool(!truthy);
      }
      case NEGATE:
        if (operand.kind() == Node.Kind.INTEGER) {
          long v = ((IntLit)operand).value();
          if (v == Long.MIN_VALUE) {
            // Handle at runtime
            return null;
          }
          return Trees.intLit(-v);
        } else if (operand.kind() == Node.Kind.FLOAT) {
          return Trees.floatLit(-((FloatLit)operand).value());
        }
        return null;
      case PLUS:
        return isNumeric(operand.kind()) ? operand : null;
      default:
        return null;
    }
  }

  /**
   * Fold an interpolation whose parts are all literals
   * @return string literal, or null
   */
  public static StringLit evalInterpolation(List<Node> parts) {
    StringBuilder sb = new StringBuilder();
    for (Node part: parts) {
      String text = toText(part);
      if (text == null) {
        return null;
      }
      sb.append(text);
    }
    String result = sb.toString();
    if (result.contains("#{")) {
      // Would read as an interpolation slot
      return null;
    }
    return Trees.str(result);
  }

  /**
   * Text of a literal as interpolated by the target
   * @return null if not known at compile time
   */
  private static String toText(Node literal) {
    switch (literal.kind()) {
      case STRING:
        return ((StringLit)literal).value();
      case INTEGER:
        return Long.toString(((IntLit)literal).value());
      case ATOM:
        return ((AtomLit)literal).name();
      case BOOLEAN:
        return Boolean.toString(((BoolLit)literal).value());
      case NIL:
        return "";
      default:
        // Float formatting is left to the runtime
        return null;
    }
  }

  /**
   * Constant folding for short-circuiting operators, where only the
   * left operand needs to be known
   */
  private static Node evalShortCircuit(BinaryOperator op, Node left,
                                       Node right) {
    switch (op) {
      case AND:
      case OR: {
        if (left.kind() != Node.Kind.BOOLEAN) {
          // Non-boolean is a runtime error for strict operators
          return null;
        }
        boolean l = ((BoolLit)left).value();
        if (op == BinaryOperator.AND) {
          return l ? right : left;
        } else {
          return l ? left : right;
        }
      }
      case BOOL_AND:
      case BOOL_OR: {
        Boolean truthy = Literals.truthiness(left);
        if (truthy == null) {
          return null;
        }
        if (op == BinaryOperator.BOOL_AND) {
          return truthy ? right : left;
        } else {
          return truthy ? left : right;
        }
      }
      default:
        return null;
    }
  }

  private static Node evalIntOp(BinaryOperator op, long l, long r) {
    try {
      switch (op) {
        case PLUS:
          return Trees.intLit(Math.addExact(l, r));
        case MINUS:
          return Trees.intLit(Math.subtractExact(l, r));
        case MULT:
          return Trees.intLit(Math.multiplyExact(l, r));
        case DIV:
          if (r == 0 || (l == Long.MIN_VALUE && r == -1)) {
            return null;
          }
          return Trees.intLit(Math.floorDiv(l, r));
        case INT_DIV:
          if (r == 0 || (l == Long.MIN_VALUE && r == -1)) {
            return null;
          }
          return Trees.intLit(l / r);
        case REM:
          if (r == 0) {
            return null;
          }
          return Trees.intLit(l % r);
        case EQ:
        case STRICT_EQ:
          return Trees.bool(l == r);
        case NEQ:
        case STRICT_NEQ:
          return Trees.bool(l != r);
        case LT:
          return Trees.bool(l < r);
        case LTE:
          return Trees.bool(l <= r);
        case GT:
          return Trees.bool(l > r);
        case GTE:
          return Trees.bool(l >= r);
        default:
          return null;
      }
    } catch (ArithmeticException ex) {
      // Handle at runtime
      return null;
    }
  }

  private static Node evalFloatOp(BinaryOperator op, Node left, Node right) {
    double l = numericValue(left);
    double r = numericValue(right);
    boolean sameType = left.kind() == right.kind();
    double result;
    switch (op) {
      case PLUS:
        result = l + r;
        break;
      case MINUS:
        result = l - r;
        break;
      case MULT:
        result = l * r;
        break;
      case DIV:
        if (r == 0.0) {
          return null;
        }
        result = l / r;
        break;
      case EQ:
        return Trees.bool(l == r);
      case NEQ:
        return Trees.bool(l != r);
      case STRICT_EQ:
        return Trees.bool(sameType && l == r);
      case STRICT_NEQ:
        return Trees.bool(!sameType || l != r);
      case LT:
        return Trees.bool(l < r);
      case LTE:
        return Trees.bool(l <= r);
      case GT:
        return Trees.bool(l > r);
      case GTE:
        return Trees.bool(l >= r);
      default:
        return null;
    }
    if (Double.isNaN(result) || Double.isInfinite(result)) {
      return null;
    }
    return Trees.floatLit(result);
  }

  private static Node evalStringOp(BinaryOperator op, String l, String r) {
    switch (op) {
      case CONCAT: {
        String result = l + r;
        if (result.contains("#{") && !l.contains("#{") && !r.contains("#{")) {
          // Concatenation would create a new interpolation slot
          return null;
        }
        return Trees.str(result);
      }
      case EQ:
      case STRICT_EQ:
        return Trees.bool(l.equals(r));
      case NEQ:
      case STRICT_NEQ:
        return Trees.bool(!l.equals(r));
      default:
        return null;
    }
  }

  /**
   * Equality between literals of different kinds, where booleans and
   * nil are the atoms of the same name
   */
  private static Node evalOtherOp(BinaryOperator op, Node left, Node right) {
    String l = atomName(left);
    String r = atomName(right);
    boolean equal;
    if (l != null && r != null) {
      equal = l.equals(r);
    } else {
      // Different types of term are never equal
      equal = false;
    }
    switch (op) {
      case EQ:
      case STRICT_EQ:
        return Trees.bool(equal);
      case NEQ:
      case STRICT_NEQ:
        return Trees.bool(!equal);
      default:
        return null;
    }
  }

  private static Node evalListConcat(Node left, Node right) {
    if (left.kind() != Node.Kind.LIST || right.kind() != Node.Kind.LIST) {
      return null;
    }
    List<Node> elements = new ArrayList<Node>();
    elements.addAll(((ListLit)left).elements());
    elements.addAll(((ListLit)right).elements());
    return new ListLit(elements, NodeMeta.EMPTY);
  }

  private static String atomName(Node literal) {
    switch (literal.kind()) {
      case ATOM:
        return ((AtomLit)literal).name();
      case BOOLEAN:
        return Boolean.toString(((BoolLit)literal).value());
      case NIL:
        return "nil";
      default:
        return null;
    }
  }

  private static boolean isNumeric(Node.Kind kind) {
    return kind == Node.Kind.INTEGER || kind == Node.Kind.FLOAT;
  }

  private static double numericValue(Node literal) {
    if (literal.kind() == Node.Kind.INTEGER) {
      return ((IntLit)literal).value();
    }
    return ((FloatLit)literal).value();
  }
}
