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
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import exlc.tree.Clause;
import exlc.tree.Node;
import exlc.tree.Operators.BinaryOperator;
import exlc.tree.Operators.UnaryOperator;
import exlc.tree.Trees;

/**
 * Seeded generator of well-typed programs in the sub-language
 * understood by {@link ReferenceInterpreter}.  Division is never
 * generated.  Statement sequences in expression slots never bind.
 * Every name is bound once, apart from rebinding of existing names
 * that carry no underscore prefix, so renames never capture.
 *
 * With stray reads on, some closure and case clause bodies end by
 * reading a name that nothing binds: either a common payload name or
 * a closure parameter spelled without its underscores.  Such programs
 * cannot be evaluated.
 */
public class RandomTrees {
  private static final List<String> STRAY_NAMES =
                      Arrays.asList("value", "result", "item", "reason");

  private final Random random;
  private final boolean strayReads;
  private int counter = 0;

  public RandomTrees(long seed) {
    this(seed, false);
  }

  public RandomTrees(long seed, boolean strayReads) {
    this.random = new Random(seed);
    this.strayReads = strayReads;
  }

  private static class Scope {
    final List<String> ints;
    final List<String> bools;
    /** Names bound to one-argument closures returning integers */
    final List<String> fns;

    Scope(Scope parent) {
      ints = parent == null ? new ArrayList<String>()
                            : new ArrayList<String>(parent.ints);
      bools = parent == null ? new ArrayList<String>()
                             : new ArrayList<String>(parent.bools);
      fns = parent == null ? new ArrayList<String>()
                           : new ArrayList<String>(parent.fns);
    }
  }

  /**
   * @return a block of statements ending in an integer expression
   */
  public Node program() {
    Scope scope = new Scope(null);
    List<Node> stmts = new ArrayList<Node>();
    int n = 2 + random.nextInt(5);
    for (int i = 0; i < n; i++) {
      stmts.addAll(statements(scope, 2));
    }
    stmts.add(intExpr(scope, 3));
    return Trees.block(stmts);
  }

  private String fresh(String prefix) {
    return prefix + (counter++);
  }

  private List<Node> statements(Scope scope, int depth) {
    List<Node> result = new ArrayList<Node>();
    switch (random.nextInt(11)) {
      case 0: {
        Node value = intExpr(scope, 2);
        String name = fresh("v");
        result.add(Trees.match(Trees.pvar(name), value));
        scope.ints.add(name);
        break;
      }
      case 1: {
        Node value = boolExpr(scope, 2);
        String name = fresh("b");
        result.add(Trees.match(Trees.pvar(name), value));
        scope.bools.add(name);
        break;
      }
      case 2: {
        List<String> rebindable = new ArrayList<String>();
        for (String name: scope.ints) {
          if (!name.startsWith("_")) {
            rebindable.add(name);
          }
        }
        if (rebindable.isEmpty()) {
          return statements(scope, depth);
        }
        String name = pick(rebindable);
        result.add(Trees.match(Trees.pvar(name), intExpr(scope, 2)));
        break;
      }
      case 3: {
        Node value = intExpr(scope, 2);
        String outer = fresh("v");
        String inner = fresh("w");
        result.add(Trees.match(Trees.pvar(outer),
                      Trees.paren(Trees.match(Trees.pvar(inner), value))));
        scope.ints.add(outer);
        if (random.nextBoolean()) {
          scope.ints.add(inner);
        }
        break;
      }
      case 4: {
        Node value = intExpr(scope, 2);
        String temp = fresh("t");
        String name = fresh("v");
        result.add(Trees.match(Trees.pvar(temp), value));
        result.add(Trees.match(Trees.pvar(name), Trees.var(temp)));
        scope.ints.add(name);
        break;
      }
      case 5: {
        Node value = intExpr(scope, 2);
        String name = fresh("_u");
        result.add(Trees.match(Trees.pvar(name), value));
        scope.ints.add(name);
        break;
      }
      case 6: {
        if (depth == 0) {
          return statements(scope, depth);
        }
        List<Node> inner = new ArrayList<Node>();
        int n = 1 + random.nextInt(2);
        for (int i = 0; i < n; i++) {
          inner.addAll(statements(scope, depth - 1));
        }
        result.add(Trees.block(inner));
        break;
      }
      case 7: {
        if (depth == 0) {
          return statements(scope, depth);
        }
        Node condition = boolExpr(scope, 2);
        result.add(Trees.ifNode(condition, body(scope, depth - 1),
                                body(scope, depth - 1)));
        break;
      }
      case 8: {
        if (depth == 0) {
          return statements(scope, depth);
        }
        String name = fresh("f");
        result.add(Trees.match(Trees.pvar(name), closure(scope, depth - 1)));
        scope.fns.add(name);
        break;
      }
      case 9:
        result.add(Trees.call(ReferenceInterpreter.EMIT, intExpr(scope, 2)));
        break;
      default:
        result.add(intExpr(scope, 2));
        break;
    }
    return result;
  }

  /**
   * Body of a branch or closure: statements, then an integer expression
   * or a binding of one
   */
  private Node body(Scope parent, int depth) {
    Scope scope = new Scope(parent);
    List<Node> stmts = new ArrayList<Node>();
    int n = random.nextInt(3);
    for (int i = 0; i < n; i++) {
      stmts.addAll(statements(scope, depth));
    }
    Node last = intExpr(scope, 2);
    if (random.nextInt(4) == 0) {
      last = Trees.match(Trees.pvar(fresh("v")), last);
    }
    stmts.add(last);
    return Trees.block(stmts);
  }

  /**
   * fn param -> body end, where the parameter may carry underscores
   */
  private Node closure(Scope parent, int depth) {
    String param;
    switch (random.nextInt(3)) {
      case 0:
        param = fresh("_p");
        break;
      case 1:
        param = fresh("x_");
        break;
      default:
        param = fresh("p");
        break;
    }
    Scope scope = new Scope(parent);
    scope.ints.add(param);
    Node body = body(scope, depth);
    if (strayReads && param.startsWith("x_") && random.nextBoolean()) {
      // Reads the parameter without its underscore
      body = Trees.block(body, Trees.var(param.replace("_", "")));
    }
    return Trees.fn(Trees.clause(Trees.params(Trees.pvar(param)), null,
                                 body));
  }

  /**
   * case {tag, payload} do {:ok, p} -> ...; {:error, q} -> ... end
   */
  private Node caseExpr(Scope scope, int depth) {
    String tag = random.nextBoolean() ? "ok" : "error";
    Node scrutinee = Trees.tuple(Trees.atom(tag), intExpr(scope, depth));
    return Trees.caseOf(scrutinee,
        tagClause(scope, "ok", fresh("p"), depth),
        tagClause(scope, "error", fresh("q"), depth));
  }

  private Clause tagClause(Scope parent, String tag,
                                     String payload, int depth) {
    Scope scope = new Scope(parent);
    scope.ints.add(payload);
    List<Node> stmts = new ArrayList<Node>();
    if (random.nextBoolean()) {
      String name = fresh(random.nextInt(3) == 0 ? "_u" : "v");
      stmts.add(Trees.match(Trees.pvar(name), intExpr(scope, depth)));
      scope.ints.add(name);
    }
    stmts.add(intExpr(scope, depth));
    if (strayReads && random.nextInt(3) == 0) {
      String stray = random.nextBoolean() ? pick(STRAY_NAMES) : fresh("s");
      stmts.add(Trees.var(stray));
    }
    Node body = stmts.size() == 1 ? stmts.get(0) : Trees.block(stmts);
    return Trees.caseClause(Trees.ptuple(Trees.plit(Trees.atom(tag)),
                                         Trees.pvar(payload)), body);
  }

  private Node intExpr(Scope scope, int depth) {
    if (depth == 0 || random.nextInt(4) == 0) {
      if (!scope.ints.isEmpty() && random.nextBoolean()) {
        return Trees.var(pick(scope.ints));
      }
      return Trees.intLit(random.nextInt(10));
    }
    switch (random.nextInt(10)) {
      case 0:
      case 1: {
        BinaryOperator[] ops = {BinaryOperator.PLUS, BinaryOperator.MINUS,
                                BinaryOperator.MULT};
        return Trees.binary(ops[random.nextInt(ops.length)],
                  intExpr(scope, depth - 1), intExpr(scope, depth - 1));
      }
      case 2:
        return Trees.paren(intExpr(scope, depth - 1));
      case 3:
        return Trees.unary(UnaryOperator.NEGATE, intExpr(scope, depth - 1));
      case 4:
        return Trees.ifNode(boolExpr(scope, depth - 1),
                  intExpr(scope, depth - 1), intExpr(scope, depth - 1));
      case 5:
        // Statement sequence in an expression slot
        return Trees.paren(Trees.block(intExpr(scope, depth - 1),
                                       intExpr(scope, depth - 1)));
      case 6:
        return Trees.cond(
            Trees.branch(boolExpr(scope, depth - 1), intExpr(scope, depth - 1)),
            Trees.branch(Trees.bool(true), intExpr(scope, depth - 1)));
      case 7:
        return Trees.call(ReferenceInterpreter.EMIT, intExpr(scope, depth - 1));
      case 8:
        if (scope.fns.isEmpty()) {
          return intExpr(scope, depth - 1);
        }
        return Trees.apply(Trees.var(pick(scope.fns)),
                           intExpr(scope, depth - 1));
      default:
        return caseExpr(scope, depth - 1);
    }
  }

  private Node boolExpr(Scope scope, int depth) {
    if (depth == 0 || random.nextInt(4) == 0) {
      if (!scope.bools.isEmpty() && random.nextBoolean()) {
        return Trees.var(pick(scope.bools));
      }
      return Trees.bool(random.nextBoolean());
    }
    switch (random.nextInt(5)) {
      case 0:
        return Trees.binary(BinaryOperator.LT, intExpr(scope, depth - 1),
                            intExpr(scope, depth - 1));
      case 1:
        return Trees.binary(BinaryOperator.EQ, intExpr(scope, depth - 1),
                            intExpr(scope, depth - 1));
      case 2:
        return Trees.binary(BinaryOperator.AND, boolExpr(scope, depth - 1),
                            boolExpr(scope, depth - 1));
      case 3:
        return Trees.unary(UnaryOperator.NOT, boolExpr(scope, depth - 1));
      default:
        return Trees.binary(BinaryOperator.BOOL_OR,
                  boolExpr(scope, depth - 1), boolExpr(scope, depth - 1));
    }
  }

  private String pick(List<String> names) {
    return names.get(random.nextInt(names.size()));
  }
}
