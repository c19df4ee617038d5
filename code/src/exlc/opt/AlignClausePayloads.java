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
import java.util.Collections;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import exlc.analysis.Names;
import exlc.analysis.Renamer;
import exlc.analysis.ScopeUnit;
import exlc.analysis.ScopeUnit.UnitKind;
import exlc.tree.Pattern;
import exlc.tree.Pattern.PTuple;
import exlc.tree.Pattern.PVar;

/**
 * For a case clause on a tagged pair {tag, payload} whose body reads a
 * name that nothing declares, while the payload binder itself goes
 * unread, rename the payload binder to that name.
 *
 * When the body reads several undeclared names, a name from a short
 * list of common payload roles wins, otherwise the first one read.
 */
public class AlignClausePayloads extends ScopeUnitPass {
  public static final List<String> PREFERRED_NAMES = Collections.unmodifiableList(
      Arrays.asList("value", "result", "data", "item", "reason", "error"));

  @Override
  public String getPassName() {
    return "align-clause-payloads";
  }

  @Override
  public String getDescription() {
    return "Rename unread payload binders of tagged case clauses to the " +
           "undeclared name the clause body reads";
  }

  @Override
  public List<TreeCondition> getPostconditions() {
    List<TreeCondition> result = new ArrayList<TreeCondition>();
    result.add(Conditions.stableUnder(this));
    return result;
  }

  @Override
  protected ScopeUnit processUnit(Logger logger, ScopeUnit unit,
                                  Set<String> enclosing) {
    if (unit.unitKind() != UnitKind.CASE_CLAUSE) {
      return unit;
    }
    String payload = payloadBinder(unit.clause().pattern());
    if (payload == null || unit.referenced().contains(payload)) {
      return unit;
    }
    List<String> candidates = new ArrayList<String>();
    for (String name: unit.undeclaredReferences()) {
      if (!enclosing.contains(name) && Names.isIdentifier(name)) {
        candidates.add(name);
      }
    }
    if (candidates.isEmpty()) {
      return unit;
    }
    String chosen = choose(candidates);
    if (logger.isDebugEnabled()) {
      logger.debug("Aligning payload binder " + payload + " with " + chosen +
                   " in clause " + unit.clause().pattern());
    }
    Pattern aligned = Renamer.renameBinders(unit.clause().pattern(),
                                            payload, chosen);
    return unit.withClause(unit.clause().withPatterns(
                                Collections.singletonList(aligned)));
  }

  /**
   * @return name bound by the second element of {literal, name}, or null
   */
  private static String payloadBinder(Pattern pattern) {
    if (pattern.kind() != Pattern.Kind.TUPLE) {
      return null;
    }
    List<Pattern> elements = ((PTuple)pattern).elements();
    if (elements.size() != 2 ||
        elements.get(0).kind() != Pattern.Kind.LITERAL ||
        elements.get(1).kind() != Pattern.Kind.VAR) {
      return null;
    }
    String name = ((PVar)elements.get(1)).name();
    return Names.isTracked(name) ? name : null;
  }

  static String choose(List<String> candidates) {
    for (String preferred: PREFERRED_NAMES) {
      if (candidates.contains(preferred)) {
        return preferred;
      }
    }
    return candidates.get(0);
  }
}
