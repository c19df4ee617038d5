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

package exlc.analysis;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import exlc.tree.Clause;
import exlc.tree.Node;
import exlc.tree.Pattern;

/**
 * One lexical scope of the target: head patterns, optional guard
 * and body of a named function clause, closure clause or case clause.
 * Names bound in nested units belong to those units.
 */
public class ScopeUnit {
  public static enum UnitKind {
    FUNCTION,
    CLOSURE,
    CASE_CLAUSE,
  }

  private final UnitKind unitKind;
  private final Clause clause;

  private Set<String> headBinders = null;
  private Set<String> bodyBinders = null;
  private Set<String> referenced = null;

  public ScopeUnit(UnitKind unitKind, Clause clause) {
    this.unitKind = unitKind;
    this.clause = clause;
  }

  public UnitKind unitKind() {
    return unitKind;
  }

  public Clause clause() {
    return clause;
  }

  public List<Pattern> patterns() {
    return clause.patterns();
  }

  public Node body() {
    return clause.body();
  }

  public ScopeUnit withClause(Clause newClause) {
    return newClause == clause ? this : new ScopeUnit(unitKind, newClause);
  }

  /**
   * @return names bound by the head patterns
   */
  public Set<String> headBinders() {
    if (headBinders == null) {
      headBinders = UsageAnalysis.patternBinders(clause.patterns());
    }
    return headBinders;
  }

  /**
   * @return names bound by matches in guard or body, outside nested units
   */
  public Set<String> bodyBinders() {
    if (bodyBinders == null) {
      bodyBinders = new LinkedHashSet<String>();
      if (clause.guard() != null) {
        bodyBinders.addAll(UsageAnalysis.declaredLocal(clause.guard()));
      }
      bodyBinders.addAll(UsageAnalysis.declaredLocal(clause.body()));
    }
    return bodyBinders;
  }

  public Set<String> declared() {
    Set<String> result = new LinkedHashSet<String>(headBinders());
    result.addAll(bodyBinders());
    return result;
  }

  /**
   * @return names read in the unit, not counting reads of names bound
   *        by a nested unit
   */
  public Set<String> referenced() {
    if (referenced == null) {
      referenced = UsageAnalysis.referencedClosureAware(clause);
    }
    return referenced;
  }

  /**
   * @return names read in the unit that nothing in the unit binds,
   *         in traversal order
   */
  public Set<String> undeclaredReferences() {
    return UsageAnalysis.freeVariables(clause);
  }

  @Override
  public String toString() {
    return unitKind + " " + clause;
  }
}
