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

/**
 * Operators of the target language
 */
public class Operators {

  public static enum BinaryOperator {
    PLUS("+"),
    MINUS("-"),
    MULT("*"),
    DIV("/"),
    INT_DIV("div", true),
    REM("rem", true),
    EQ("=="),
    NEQ("!="),
    STRICT_EQ("==="),
    STRICT_NEQ("!=="),
    LT("<"),
    LTE("<="),
    GT(">"),
    GTE(">="),
    AND("and"),
    OR("or"),
    BOOL_AND("&&"),
    BOOL_OR("||"),
    CONCAT("<>"),
    LIST_CONCAT("++"),
    LIST_SUBTRACT("--"),
    PIPE("|>"),
    IN("in"),
    ;

    private final String symbol;
    private final boolean functionStyle;

    private BinaryOperator(String symbol) {
      this(symbol, false);
    }

    private BinaryOperator(String symbol, boolean functionStyle) {
      this.symbol = symbol;
      this.functionStyle = functionStyle;
    }

    public String symbol() {
      return symbol;
    }

    /**
     * @return true if written as a call, e.g. div(a, b)
     */
    public boolean isFunctionStyle() {
      return functionStyle;
    }

    /**
     * @return true if the right operand is not always evaluated
     */
    public boolean isShortCircuit() {
      return this == AND || this == OR || this == BOOL_AND || this == BOOL_OR;
    }

    public boolean isComparison() {
      switch (this) {
        case EQ:
        case NEQ:
        case STRICT_EQ:
        case STRICT_NEQ:
        case LT:
        case LTE:
        case GT:
        case GTE:
          return true;
        default:
          return false;
      }
    }

    public static BinaryOperator fromSymbol(String symbol) {
      for (BinaryOperator op: values()) {
        if (op.symbol.equals(symbol)) {
          return op;
        }
      }
      return null;
    }
  }

  public static enum UnaryOperator {
    NEGATE("-"),
    PLUS("+"),
    /** Strict boolean negation */
    NOT("not"),
    /** Truthiness negation */
    BANG("!"),
    ;

    private final String symbol;

    private UnaryOperator(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }
  }
}
