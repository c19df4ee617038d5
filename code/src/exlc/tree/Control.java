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
 * Control flow and binding nodes: closures, conditionals, matches,
 * case expressions and statement blocks
 */
public class Control {

  private static void addClauseChildren(List<Node> result,
                                        List<Clause> clauses) {
    for (Clause c: clauses) {
      if (c.guard() != null) {
        result.add(c.guard());
      }
      result.add(c.body());
    }
  }

  /**
   * Anonymous function: fn p1, p2 when g -> body; ... end
   */
  public static class Fn extends Node {
    private final ImmutableList<Clause> clauses;

    public Fn(List<Clause> clauses, NodeMeta meta) {
      super(meta);
      this.clauses = ImmutableList.copyOf(clauses);
    }

    public ImmutableList<Clause> clauses() {
      return clauses;
    }

    public Fn withClauses(List<Clause> newClauses) {
      return new Fn(newClauses, meta);
    }

    @Override
    public Kind kind() {
      return Kind.FN;
    }

    @Override
    public List<Node> children() {
      List<Node> result = new ArrayList<Node>();
      addClauseChildren(result, clauses);
      return result;
    }

    @Override
    public Node mapChildren(Rewriter rewriter) {
      ImmutableList<Clause> newClauses = Clause.mapClauses(clauses, rewriter);
      return newClauses == null ? this : new Fn(newClauses, meta);
    }

    @Override
    public Fn withMeta(NodeMeta newMeta) {
      return new Fn(clauses, newMeta);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Fn && ((Fn)obj).clauses.equals(clauses);
    }

    @Override
    public int hashCode() {
      return clauses.hashCode() + 29;
    }
  }

  /**
   * if condition do then else otherwise end.  The else branch may
   * be absent, in which case the value is nil when the condition fails.
   */
  public static class If extends Node {
    private final Node condition;
    private final Node thenBranch;
    private final Node elseBranch;

    public If(Node condition, Node thenBranch, Node elseBranch,
              NodeMeta meta) {
      super(meta);
      this.condition = condition;
      this.thenBranch = thenBranch;
      this.elseBranch = elseBranch;
    }

    public Node condition() {
      return condition;
    }

    public Node thenBranch() {
      return thenBranch;
    }

    /**
     * @return else branch, or null if absent
     */
    public Node elseBranch() {
      return elseBranch;
    }

    public If withBranches(Node newThen, Node newElse) {
      if (newThen == thenBranch && newElse == elseBranch) {
        return this;
      }
      return new If(condition, newThen, newElse, meta);
    }

    @Override
    public Kind kind() {
      return Kind.IF;
    }

    @Override
    public List<Node> children() {
      if (elseBranch == null) {
        return ImmutableList.of(condition, thenBranch);
      }
      return ImmutableList.of(condition, thenBranch, elseBranch);
    }

    @Override
    public Node mapChildren(Rewriter rewriter) {
      Node newCondition = rewriter.rewrite(condition);
      Node newThen = rewriter.rewrite(thenBranch);
      Node newElse = mapNullable(elseBranch, rewriter);
      if (newCondition == condition && newThen == thenBranch &&
          newElse == elseBranch) {
        return this;
      }
      return new If(newCondition, newThen, newElse, meta);
    }

    @Override
    public If withMeta(NodeMeta newMeta) {
      return new If(condition, thenBranch, elseBranch, newMeta);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof If)) {
        return false;
      }
      If other = (If)obj;
      return condition.equals(other.condition) &&
          thenBranch.equals(other.thenBranch) &&
          eq(elseBranch, other.elseBranch);
    }

    @Override
    public int hashCode() {
      return (condition.hashCode() * 31 + thenBranch.hashCode()) * 31 +
              (elseBranch == null ? 0 : elseBranch.hashCode());
    }
  }

  /**
   * cond do c1 -> b1; c2 -> b2 end: first truthy condition wins
   */
  public static class Cond extends Node {
    public static class Branch {
      public final Node condition;
      public final Node body;

      public Branch(Node condition, Node body) {
        this.condition = condition;
        this.body = body;
      }

      public Branch withBody(Node newBody) {
        return newBody == body ? this : new Branch(condition, newBody);
      }

      @Override
      public boolean equals(Object obj) {
        if (!(obj instanceof Branch)) {
          return false;
        }
        Branch other = (Branch)obj;
        return condition.equals(other.condition) && body.equals(other.body);
      }

      @Override
      public int hashCode() {
        return condition.hashCode() * 31 + body.hashCode();
      }
    }

    private final ImmutableList<Branch> branches;

    public Cond(List<Branch> branches, NodeMeta meta) {
      super(meta);
      this.branches = ImmutableList.copyOf(branches);
    }

    public ImmutableList<Branch> branches() {
      return branches;
    }

    public Cond withBranches(List<Branch> newBranches) {
      return new Cond(newBranches, meta);
    }

    @Override
    public Kind kind() {
      return Kind.COND;
    }

    @Override
    public List<Node> children() {
      List<Node> result = new ArrayList<Node>(branches.size() * 2);
      for (Branch b: branches) {
        result.add(b.condition);
        result.add(b.body);
      }
      return result;
    }

    @Override
    public Node mapChildren(Rewriter rewriter) {
      boolean changed = false;
      List<Branch> newBranches = new ArrayList<Branch>(branches.size());
      for (Branch b: branches) {
        Node c = rewriter.rewrite(b.condition);
        Node body = rewriter.rewrite(b.body);
        if (c != b.condition || body != b.body) {
          changed = true;
          newBranches.add(new Branch(c, body));
        } else {
          newBranches.add(b);
        }
      }
      return changed ? new Cond(newBranches, meta) : this;
    }

    @Override
    public Cond withMeta(NodeMeta newMeta) {
      return new Cond(branches, newMeta);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Cond && ((Cond)obj).branches.equals(branches);
    }

    @Override
    public int hashCode() {
      return branches.hashCode() + 31;
    }
  }

  /**
   * pattern = value.  Evaluates to value.
   */
  public static class Match extends Node {
    private final Pattern pattern;
    private final Node value;

    public Match(Pattern pattern, Node value, NodeMeta meta) {
      super(meta);
      this.pattern = pattern;
      this.value = value;
    }

    public Pattern pattern() {
      return pattern;
    }

    public Node value() {
      return value;
    }

    public Match withPattern(Pattern newPattern) {
      return newPattern == pattern ? this : new Match(newPattern, value, meta);
    }

    public Match withValue(Node newValue) {
      return newValue == value ? this : new Match(pattern, newValue, meta);
    }

    @Override
    public Kind kind() {
      return Kind.MATCH;
    }

    @Override
    public List<Node> children() {
      return ImmutableList.of(value);
    }

    @Override
    public Node mapChildren(Rewriter rewriter) {
      return withValue(rewriter.rewrite(value));
    }

    @Override
    public Match withMeta(NodeMeta newMeta) {
      return new Match(pattern, value, newMeta);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Match)) {
        return false;
      }
      Match other = (Match)obj;
      return pattern.equals(other.pattern) && value.equals(other.value);
    }

    @Override
    public int hashCode() {
      return pattern.hashCode() * 31 + value.hashCode();
    }
  }

  /**
   * case scrutinee do clauses end
   */
  public static class Case extends Node {
    private final Node scrutinee;
    private final ImmutableList<Clause> clauses;

    public Case(Node scrutinee, List<Clause> clauses, NodeMeta meta) {
      super(meta);
      this.scrutinee = scrutinee;
      this.clauses = ImmutableList.copyOf(clauses);
    }

    public Node scrutinee() {
      return scrutinee;
    }

    public ImmutableList<Clause> clauses() {
      return clauses;
    }

    public Case withClauses(List<Clause> newClauses) {
      return new Case(scrutinee, newClauses, meta);
    }

    @Override
    public Kind kind() {
      return Kind.CASE;
    }

    @Override
    public List<Node> children() {
      List<Node> result = new ArrayList<Node>();
      result.add(scrutinee);
      addClauseChildren(result, clauses);
      return result;
    }

    @Override
    public Node mapChildren(Rewriter rewriter) {
      Node newScrutinee = rewriter.rewrite(scrutinee);
      ImmutableList<Clause> newClauses = Clause.mapClauses(clauses, rewriter);
      if (newScrutinee == scrutinee && newClauses == null) {
        return this;
      }
      return new Case(newScrutinee,
                      newClauses == null ? clauses : newClauses, meta);
    }

    @Override
    public Case withMeta(NodeMeta newMeta) {
      return new Case(scrutinee, clauses, newMeta);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Case)) {
        return false;
      }
      Case other = (Case)obj;
      return scrutinee.equals(other.scrutinee) &&
             clauses.equals(other.clauses);
    }

    @Override
    public int hashCode() {
      return scrutinee.hashCode() * 31 + clauses.hashCode();
    }
  }

  /**
   * Ordered statements.  The value of the block is the value of the
   * last statement; an empty block has value nil.  Blocks do not
   * introduce a scope: bindings remain visible after the block.
   */
  public static class Block extends Node {
    private final ImmutableList<Node> statements;

    public Block(List<Node> statements, NodeMeta meta) {
      super(meta);
      this.statements = ImmutableList.copyOf(statements);
    }

    public ImmutableList<Node> statements() {
      return statements;
    }

    public Block withStatements(List<Node> newStatements) {
      return new Block(newStatements, meta);
    }

    @Override
    public Kind kind() {
      return Kind.BLOCK;
    }

    @Override
    public List<Node> children() {
      return statements;
    }

    @Override
    public Node mapChildren(Rewriter rewriter) {
      ImmutableList<Node> newStatements = mapList(statements, rewriter);
      return newStatements == statements ? this :
                        new Block(newStatements, meta);
    }

    @Override
    public Block withMeta(NodeMeta newMeta) {
      return new Block(statements, newMeta);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Block &&
            ((Block)obj).statements.equals(statements);
    }

    @Override
    public int hashCode() {
      return statements.hashCode() + 37;
    }
  }
}
