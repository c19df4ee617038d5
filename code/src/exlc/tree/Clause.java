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

import java.util.List;

import com.google.common.collect.ImmutableList;

import exlc.common.exceptions.LegalizerRuntimeError;

/**
 * Pattern(s) + optional guard + body.  Case clauses have exactly one
 * pattern; closure clauses have one pattern per parameter.
 */
public class Clause {
  private final ImmutableList<Pattern> patterns;
  /** May be null */
  private final Node guard;
  private final Node body;

  public Clause(List<Pattern> patterns, Node guard, Node body) {
    this.patterns = ImmutableList.copyOf(patterns);
    this.guard = guard;
    this.body = body;
  }

  public ImmutableList<Pattern> patterns() {
    return patterns;
  }

  /**
   * @return the single pattern of a case clause
   */
  public Pattern pattern() {
    if (patterns.size() != 1) {
      throw new LegalizerRuntimeError("Expected a single pattern: " +
                                      patterns);
    }
    return patterns.get(0);
  }

  public Node guard() {
    return guard;
  }

  public Node body() {
    return body;
  }

  public Clause withPatterns(List<Pattern> newPatterns) {
    return new Clause(newPatterns, guard, body);
  }

  public Clause withBody(Node newBody) {
    return newBody == body ? this : new Clause(patterns, guard, newBody);
  }

  /**
   * Rewrite guard and body.  Patterns are left alone.
   * @return this clause if nothing changed
   */
  public Clause mapNodes(Node.Rewriter rewriter) {
    Node newGuard = guard == null ? null : rewriter.rewrite(guard);
    Node newBody = rewriter.rewrite(body);
    if (newGuard == guard && newBody == body) {
      return this;
    }
    return new Clause(patterns, newGuard, newBody);
  }

  /**
   * @return null if no clause changed
   */
  static ImmutableList<Clause> mapClauses(List<Clause> clauses,
                                          Node.Rewriter rewriter) {
    boolean changed = false;
    ImmutableList.Builder<Clause> result = ImmutableList.builder();
    for (Clause c: clauses) {
      Clause updated = c.mapNodes(rewriter);
      changed = changed || updated != c;
      result.add(updated);
    }
    return changed ? result.build() : null;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Clause)) {
      return false;
    }
    Clause other = (Clause)obj;
    return patterns.equals(other.patterns) && body.equals(other.body) &&
        (guard == null ? other.guard == null : guard.equals(other.guard));
  }

  @Override
  public int hashCode() {
    return (patterns.hashCode() * 31 +
        (guard == null ? 0 : guard.hashCode())) * 31 + body.hashCode();
  }

  @Override
  public String toString() {
    return TreeFormat.format(this);
  }
}
