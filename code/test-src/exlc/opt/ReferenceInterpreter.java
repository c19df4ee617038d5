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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import exlc.tree.Clause;
import exlc.tree.Containers.TupleLit;
import exlc.tree.Control.Block;
import exlc.tree.Control.Case;
import exlc.tree.Control.Cond;
import exlc.tree.Control.Fn;
import exlc.tree.Control.If;
import exlc.tree.Control.Match;
import exlc.tree.Exprs.Apply;
import exlc.tree.Exprs.BinaryOp;
import exlc.tree.Exprs.Call;
import exlc.tree.Exprs.Paren;
import exlc.tree.Exprs.UnaryOp;
import exlc.tree.Exprs.Var;
import exlc.tree.Literals.AtomLit;
import exlc.tree.Literals.BoolLit;
import exlc.tree.Literals.IntLit;
import exlc.tree.Literals.StringLit;
import exlc.tree.Node;
import exlc.tree.Pattern;
import exlc.tree.Pattern.PLiteral;
import exlc.tree.Pattern.PPin;
import exlc.tree.Pattern.PTuple;
import exlc.tree.Pattern.PVar;

/**
 * Evaluator for the pure part of the target language: integers,
 * booleans, atoms, tuples, nil, arithmetic, comparisons, conditionals,
 * blocks, matches, closures and case expressions.  The one call it
 * knows is emit(x), which records x as an effect and returns it.
 *
 * Blocks share their environment with the enclosing code; conditional
 * branches, case clauses and closure bodies get a copy.  A closure
 * captures a copy of the environment it was created in.
 */
public class ReferenceInterpreter {
  public static final Object NIL = new Object() {
    @Override
    public String toString() {
      return "nil";
    }
  };

  public static final String EMIT = "emit";

  private final List<Object> effects = new ArrayList<Object>();

  public static Object run(Node tree) {
    return new ReferenceInterpreter().evaluate(tree);
  }

  public Object evaluate(Node tree) {
    return eval(tree, new HashMap<String, Object>());
  }

  /**
   * @return values passed to emit, in order
   */
  public List<Object> effects() {
    return effects;
  }

  private static final class Atom {
    final String name;

    Atom(String name) {
      this.name = name;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Atom && ((Atom)obj).name.equals(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public String toString() {
      return ":" + name;
    }
  }

  private static final class Closure {
    final List<Clause> clauses;
    final Map<String, Object> env;

    Closure(List<Clause> clauses, Map<String, Object> env) {
      this.clauses = clauses;
      this.env = env;
    }
  }

  private Object eval(Node node, Map<String, Object> env) {
    switch (node.kind()) {
      case INTEGER:
        return ((IntLit)node).value();
      case BOOLEAN:
        return ((BoolLit)node).value();
      case STRING:
        return ((StringLit)node).value();
      case ATOM:
        return new Atom(((AtomLit)node).name());
      case NIL:
        return NIL;
      case TUPLE: {
        List<Object> values = new ArrayList<Object>();
        for (Node elem: ((TupleLit)node).elements()) {
          values.add(eval(elem, env));
        }
        return values;
      }
      case VAR: {
        String name = ((Var)node).name();
        if (!env.containsKey(name)) {
          throw new IllegalStateException("Unbound variable " + name);
        }
        return env.get(name);
      }
      case PAREN:
        return eval(((Paren)node).inner(), env);
      case BLOCK: {
        Object result = NIL;
        for (Node stmt: ((Block)node).statements()) {
          result = eval(stmt, env);
        }
        return result;
      }
      case MATCH: {
        Match m = (Match)node;
        Object value = eval(m.value(), env);
        if (!bind(m.pattern(), value, env)) {
          throw new IllegalStateException("No match of " + m.pattern() +
                                          " with " + value);
        }
        return value;
      }
      case BINARY:
        return evalBinary((BinaryOp)node, env);
      case UNARY:
        return evalUnary((UnaryOp)node, env);
      case IF: {
        If i = (If)node;
        if (truthy(eval(i.condition(), env))) {
          return eval(i.thenBranch(), copy(env));
        } else if (i.elseBranch() != null) {
          return eval(i.elseBranch(), copy(env));
        }
        return NIL;
      }
      case COND: {
        for (Cond.Branch b: ((Cond)node).branches()) {
          Map<String, Object> branchEnv = copy(env);
          if (truthy(eval(b.condition, branchEnv))) {
            return eval(b.body, branchEnv);
          }
        }
        throw new IllegalStateException("No cond branch matched");
      }
      case CASE: {
        Case c = (Case)node;
        Object value = eval(c.scrutinee(), env);
        for (Clause clause: c.clauses()) {
          Map<String, Object> clauseEnv = copy(env);
          if (clause.guard() == null &&
              bind(clause.pattern(), value, clauseEnv)) {
            return eval(clause.body(), clauseEnv);
          }
        }
        throw new IllegalStateException("No case clause matched " + value);
      }
      case FN:
        return new Closure(((Fn)node).clauses(), copy(env));
      case APPLY: {
        Apply a = (Apply)node;
        Object callee = eval(a.function(), env);
        if (!(callee instanceof Closure)) {
          throw new IllegalStateException("Not a function: " + callee);
        }
        List<Object> args = new ArrayList<Object>();
        for (Node arg: a.args()) {
          args.add(eval(arg, env));
        }
        return applyClosure((Closure)callee, args);
      }
      case CALL: {
        Call call = (Call)node;
        if (call.qualifier() != null || !call.function().equals(EMIT) ||
            call.args().size() != 1) {
          throw new UnsupportedOperationException(node.toString());
        }
        Object value = eval(call.args().get(0), env);
        effects.add(value);
        return value;
      }
      default:
        throw new UnsupportedOperationException(node.kind().toString());
    }
  }

  private Object applyClosure(Closure closure, List<Object> args) {
    for (Clause clause: closure.clauses) {
      if (clause.patterns().size() != args.size() || clause.guard() != null) {
        continue;
      }
      Map<String, Object> env = copy(closure.env);
      boolean matched = true;
      for (int i = 0; i < args.size() && matched; i++) {
        matched = bind(clause.patterns().get(i), args.get(i), env);
      }
      if (matched) {
        return eval(clause.body(), env);
      }
    }
    throw new IllegalStateException("No clause matched " + args);
  }

  /**
   * @return false if the value does not match
   */
  private boolean bind(Pattern pattern, Object value,
                       Map<String, Object> env) {
    switch (pattern.kind()) {
      case WILDCARD:
        return true;
      case VAR:
        env.put(((PVar)pattern).name(), value);
        return true;
      case PIN:
        return value.equals(env.get(((PPin)pattern).name()));
      case LITERAL:
        return value.equals(eval(((PLiteral)pattern).literal(), env));
      case TUPLE: {
        List<Pattern> elements = ((PTuple)pattern).elements();
        if (!(value instanceof List) ||
            ((List<?>)value).size() != elements.size()) {
          return false;
        }
        for (int i = 0; i < elements.size(); i++) {
          if (!bind(elements.get(i), ((List<?>)value).get(i), env)) {
            return false;
          }
        }
        return true;
      }
      default:
        throw new UnsupportedOperationException(pattern.toString());
    }
  }

  private Object evalBinary(BinaryOp b, Map<String, Object> env) {
    Object left = eval(b.left(), env);
    switch (b.op()) {
      case AND:
        return (Boolean)left ? eval(b.right(), env) : left;
      case OR:
        return (Boolean)left ? left : eval(b.right(), env);
      case BOOL_AND:
        return truthy(left) ? eval(b.right(), env) : left;
      case BOOL_OR:
        return truthy(left) ? left : eval(b.right(), env);
      default:
        break;
    }
    Object right = eval(b.right(), env);
    switch (b.op()) {
      case PLUS:
        return (Long)left + (Long)right;
      case MINUS:
        return (Long)left - (Long)right;
      case MULT:
        return (Long)left * (Long)right;
      case LT:
        return (Long)left < (Long)right;
      case GT:
        return (Long)left > (Long)right;
      case EQ:
        return left.equals(right);
      case NEQ:
        return !left.equals(right);
      default:
        throw new UnsupportedOperationException(b.op().toString());
    }
  }

  private Object evalUnary(UnaryOp u, Map<String, Object> env) {
    Object operand = eval(u.operand(), env);
    switch (u.op()) {
      case NOT:
        return !(Boolean)operand;
      case BANG:
        return !truthy(operand);
      case NEGATE:
        return -(Long)operand;
      default:
        throw new UnsupportedOperationException(u.op().toString());
    }
  }

  private static boolean truthy(Object value) {
    return value != NIL && !Boolean.FALSE.equals(value);
  }

  private static Map<String, Object> copy(Map<String, Object> env) {
    return new HashMap<String, Object>(env);
  }
}
