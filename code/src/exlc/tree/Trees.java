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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import exlc.common.util.Pair;
import exlc.tree.Containers.KeywordList;
import exlc.tree.Containers.ListLit;
import exlc.tree.Containers.MapLit;
import exlc.tree.Containers.StructLit;
import exlc.tree.Containers.TupleLit;
import exlc.tree.Control.Block;
import exlc.tree.Control.Case;
import exlc.tree.Control.Cond;
import exlc.tree.Control.Fn;
import exlc.tree.Control.If;
import exlc.tree.Control.Match;
import exlc.tree.Decls.FunctionDef;
import exlc.tree.Decls.ModuleAttribute;
import exlc.tree.Decls.ModuleDecl;
import exlc.tree.Exprs.Apply;
import exlc.tree.Exprs.BinaryOp;
import exlc.tree.Exprs.Call;
import exlc.tree.Exprs.FieldAccess;
import exlc.tree.Exprs.IndexAccess;
import exlc.tree.Exprs.Interpolation;
import exlc.tree.Exprs.Paren;
import exlc.tree.Exprs.Raw;
import exlc.tree.Exprs.UnaryOp;
import exlc.tree.Exprs.Var;
import exlc.tree.Literals.AtomLit;
import exlc.tree.Literals.BoolLit;
import exlc.tree.Literals.FloatLit;
import exlc.tree.Literals.IntLit;
import exlc.tree.Literals.NilLit;
import exlc.tree.Literals.StringLit;
import exlc.tree.Operators.BinaryOperator;
import exlc.tree.Operators.UnaryOperator;
import exlc.tree.Pattern.PAlias;
import exlc.tree.Pattern.PCons;
import exlc.tree.Pattern.PList;
import exlc.tree.Pattern.PLiteral;
import exlc.tree.Pattern.PMap;
import exlc.tree.Pattern.PPin;
import exlc.tree.Pattern.PStruct;
import exlc.tree.Pattern.PTuple;
import exlc.tree.Pattern.PVar;
import exlc.tree.Pattern.Wildcard;

/**
 * Static builders for tree nodes with empty metadata, plus small
 * structural helpers shared by passes
 */
public class Trees {

  public static IntLit intLit(long v) {
    return new IntLit(v, NodeMeta.EMPTY);
  }

  public static FloatLit floatLit(double v) {
    return new FloatLit(v, NodeMeta.EMPTY);
  }

  public static StringLit str(String v) {
    return new StringLit(v, NodeMeta.EMPTY);
  }

  public static AtomLit atom(String name) {
    return new AtomLit(name, NodeMeta.EMPTY);
  }

  public static BoolLit bool(boolean v) {
    return new BoolLit(v, NodeMeta.EMPTY);
  }

  public static NilLit nil() {
    return new NilLit(NodeMeta.EMPTY);
  }

  public static ListLit list(Node... elements) {
    return new ListLit(Arrays.asList(elements), NodeMeta.EMPTY);
  }

  public static TupleLit tuple(Node... elements) {
    return new TupleLit(Arrays.asList(elements), NodeMeta.EMPTY);
  }

  public static MapLit map(List<Pair<Node, Node>> entries) {
    return new MapLit(entries, NodeMeta.EMPTY);
  }

  public static KeywordList keywords(List<Pair<String, Node>> entries) {
    return new KeywordList(entries, NodeMeta.EMPTY);
  }

  public static StructLit struct(String module,
                                 List<Pair<String, Node>> fields) {
    return new StructLit(module, fields, NodeMeta.EMPTY);
  }

  public static Var var(String name) {
    return new Var(name, NodeMeta.EMPTY);
  }

  public static FieldAccess field(Node target, String field) {
    return new FieldAccess(target, field, NodeMeta.EMPTY);
  }

  public static IndexAccess index(Node target, Node index) {
    return new IndexAccess(target, index, NodeMeta.EMPTY);
  }

  public static BinaryOp binary(BinaryOperator op, Node left, Node right) {
    return new BinaryOp(op, left, right, NodeMeta.EMPTY);
  }

  public static UnaryOp unary(UnaryOperator op, Node operand) {
    return new UnaryOp(op, operand, NodeMeta.EMPTY);
  }

  public static Call call(String function, Node... args) {
    return new Call(null, function, Arrays.asList(args), NodeMeta.EMPTY);
  }

  public static Call remoteCall(Node qualifier, String function,
                                Node... args) {
    return new Call(qualifier, function, Arrays.asList(args),
                    NodeMeta.EMPTY);
  }

  public static Apply apply(Node function, Node... args) {
    return new Apply(function, Arrays.asList(args), NodeMeta.EMPTY);
  }

  public static Clause clause(List<Pattern> patterns, Node guard,
                              Node body) {
    return new Clause(patterns, guard, body);
  }

  public static Clause caseClause(Pattern pattern, Node body) {
    return new Clause(Collections.singletonList(pattern), null, body);
  }

  public static Clause caseClause(Pattern pattern, Node guard, Node body) {
    return new Clause(Collections.singletonList(pattern), guard, body);
  }

  public static Fn fn(Clause... clauses) {
    return new Fn(Arrays.asList(clauses), NodeMeta.EMPTY);
  }

  public static If ifNode(Node condition, Node thenBranch, Node elseBranch) {
    return new If(condition, thenBranch, elseBranch, NodeMeta.EMPTY);
  }

  public static Cond cond(Cond.Branch... branches) {
    return new Cond(Arrays.asList(branches), NodeMeta.EMPTY);
  }

  public static Cond.Branch branch(Node condition, Node body) {
    return new Cond.Branch(condition, body);
  }

  public static Match match(Pattern pattern, Node value) {
    return new Match(pattern, value, NodeMeta.EMPTY);
  }

  public static Case caseOf(Node scrutinee, Clause... clauses) {
    return new Case(scrutinee, Arrays.asList(clauses), NodeMeta.EMPTY);
  }

  public static Block block(Node... statements) {
    return new Block(Arrays.asList(statements), NodeMeta.EMPTY);
  }

  public static Block block(List<Node> statements) {
    return new Block(statements, NodeMeta.EMPTY);
  }

  public static Paren paren(Node inner) {
    return new Paren(inner, NodeMeta.EMPTY);
  }

  public static Interpolation interpolation(Node... parts) {
    return new Interpolation(Arrays.asList(parts), NodeMeta.EMPTY);
  }

  public static Raw raw(String text) {
    return new Raw(text, NodeMeta.EMPTY);
  }

  public static ModuleDecl module(String name, Node... body) {
    return new ModuleDecl(name, Arrays.asList(body), NodeMeta.EMPTY);
  }

  public static FunctionDef def(String name, List<Pattern> params,
                                Node body) {
    return new FunctionDef(name, false, params, null, body, NodeMeta.EMPTY);
  }

  public static FunctionDef defp(String name, List<Pattern> params,
                                 Node body) {
    return new FunctionDef(name, true, params, null, body, NodeMeta.EMPTY);
  }

  public static ModuleAttribute attribute(String name, Node value) {
    return new ModuleAttribute(name, value, NodeMeta.EMPTY);
  }

  public static PVar pvar(String name) {
    return new PVar(name);
  }

  public static Wildcard wildcard() {
    return Wildcard.INSTANCE;
  }

  public static PLiteral plit(Node literal) {
    return new PLiteral(literal);
  }

  public static PTuple ptuple(Pattern... elements) {
    return new PTuple(Arrays.asList(elements));
  }

  public static PList plist(Pattern... elements) {
    return new PList(Arrays.asList(elements));
  }

  public static PCons pcons(List<Pattern> heads, Pattern tail) {
    return new PCons(heads, tail);
  }

  public static PMap pmap(List<Pair<Node, Pattern>> entries) {
    return new PMap(entries);
  }

  public static PStruct pstruct(String module,
                                List<Pair<String, Pattern>> fields) {
    return new PStruct(module, fields);
  }

  public static PAlias palias(Pattern inner, String name) {
    return new PAlias(inner, name);
  }

  public static PPin pin(String name) {
    return new PPin(name);
  }

  public static List<Pattern> params(Pattern... params) {
    return Arrays.asList(params);
  }

  /**
   * (fn -> body end).() : evaluates body in place, in any expression
   * position, yielding its final value
   */
  public static Apply iife(Node body) {
    Clause clause = new Clause(Collections.<Pattern>emptyList(), null, body);
    Fn fn = new Fn(Collections.singletonList(clause),
                   NodeMeta.of(NodeMeta.Flag.LEGALIZED_IIFE));
    return new Apply(fn, Collections.<Node>emptyList(),
                     NodeMeta.of(NodeMeta.Flag.LEGALIZED_IIFE));
  }

  /**
   * Carry metadata of a replaced node over to its replacement
   */
  public static Node replace(Node replaced, Node replacement) {
    if (replaced == replacement || replaced.meta().isEmpty()) {
      return replacement;
    }
    return replacement.withMeta(replacement.meta().mergeFrom(replaced.meta()));
  }

  /**
   * @return the statements of a block, or the node alone otherwise
   */
  public static List<Node> statements(Node node) {
    if (node.kind() == Node.Kind.BLOCK) {
      return ((Block)node).statements();
    }
    return Collections.singletonList(node);
  }

  /**
   * Strip any number of enclosing parentheses
   */
  public static Node unparen(Node node) {
    while (node.kind() == Node.Kind.PAREN) {
      node = ((Paren)node).inner();
    }
    return node;
  }
}
