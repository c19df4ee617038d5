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

import exlc.common.util.Pair;

/**
 * Patterns appear on the left of a match, in case clause heads and in
 * function/closure parameter lists.  They form a separate category
 * from nodes: the generic rewrite engine does not visit them.
 */
public abstract class Pattern {

  public static enum Kind {
    VAR,
    WILDCARD,
    LITERAL,
    TUPLE,
    LIST,
    CONS,
    MAP,
    STRUCT,
    ALIAS,
    PIN,
  }

  public static interface Rewriter {
    public Pattern rewrite(Pattern pattern);
  }

  public abstract Kind kind();

  /**
   * @return directly nested patterns, left to right
   */
  public abstract List<Pattern> subPatterns();

  /**
   * Rebuild with each direct sub-pattern rewritten.  Must return this
   * pattern if nothing changed.
   */
  public abstract Pattern mapSubPatterns(Rewriter rewriter);

  @Override
  public abstract boolean equals(Object obj);

  @Override
  public abstract int hashCode();

  @Override
  public String toString() {
    return TreeFormat.format(this);
  }

  private static ImmutableList<Pattern> mapList(ImmutableList<Pattern> pats,
                                                Rewriter rewriter) {
    List<Pattern> result = null;
    for (int i = 0; i < pats.size(); i++) {
      Pattern orig = pats.get(i);
      Pattern updated = rewriter.rewrite(orig);
      if (updated != orig && result == null) {
        result = new ArrayList<Pattern>(pats.size());
        result.addAll(pats.subList(0, i));
      }
      if (result != null) {
        result.add(updated);
      }
    }
    return result == null ? pats : ImmutableList.copyOf(result);
  }

  private static abstract class Leaf extends Pattern {
    @Override
    public List<Pattern> subPatterns() {
      return Collections.emptyList();
    }

    @Override
    public Pattern mapSubPatterns(Rewriter rewriter) {
      return this;
    }
  }

  /**
   * Binds a name
   */
  public static class PVar extends Leaf {
    private final String name;

    public PVar(String name) {
      assert(name != null && name.length() > 0);
      this.name = name;
    }

    public String name() {
      return name;
    }

    @Override
    public Kind kind() {
      return Kind.VAR;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof PVar && ((PVar)obj).name.equals(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode() + 1;
    }
  }

  /**
   * The bare underscore
   */
  public static class Wildcard extends Leaf {
    public static final Wildcard INSTANCE = new Wildcard();

    private Wildcard() {
    }

    @Override
    public Kind kind() {
      return Kind.WILDCARD;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Wildcard;
    }

    @Override
    public int hashCode() {
      return 97;
    }
  }

  /**
   * Matches a literal value.  The node is always a literal.
   */
  public static class PLiteral extends Leaf {
    private final Node literal;

    public PLiteral(Node literal) {
      assert(literal.isLiteral());
      this.literal = literal;
    }

    public Node literal() {
      return literal;
    }

    @Override
    public Kind kind() {
      return Kind.LITERAL;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof PLiteral && ((PLiteral)obj).literal.equals(literal);
    }

    @Override
    public int hashCode() {
      return literal.hashCode() + 3;
    }
  }

  /**
   * ^name: matches the current value of an existing variable
   */
  public static class PPin extends Leaf {
    private final String name;

    public PPin(String name) {
      this.name = name;
    }

    public String name() {
      return name;
    }

    @Override
    public Kind kind() {
      return Kind.PIN;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof PPin && ((PPin)obj).name.equals(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode() + 5;
    }
  }

  public static class PTuple extends Pattern {
    private final ImmutableList<Pattern> elements;

    public PTuple(List<Pattern> elements) {
      this.elements = ImmutableList.copyOf(elements);
    }

    public ImmutableList<Pattern> elements() {
      return elements;
    }

    @Override
    public Kind kind() {
      return Kind.TUPLE;
    }

    @Override
    public List<Pattern> subPatterns() {
      return elements;
    }

    @Override
    public Pattern mapSubPatterns(Rewriter rewriter) {
      ImmutableList<Pattern> newElements = mapList(elements, rewriter);
      return newElements == elements ? this : new PTuple(newElements);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof PTuple && ((PTuple)obj).elements.equals(elements);
    }

    @Override
    public int hashCode() {
      return elements.hashCode() + 7;
    }
  }

  public static class PList extends Pattern {
    private final ImmutableList<Pattern> elements;

    public PList(List<Pattern> elements) {
      this.elements = ImmutableList.copyOf(elements);
    }

    public ImmutableList<Pattern> elements() {
      return elements;
    }

    @Override
    public Kind kind() {
      return Kind.LIST;
    }

    @Override
    public List<Pattern> subPatterns() {
      return elements;
    }

    @Override
    public Pattern mapSubPatterns(Rewriter rewriter) {
      ImmutableList<Pattern> newElements = mapList(elements, rewriter);
      return newElements == elements ? this : new PList(newElements);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof PList && ((PList)obj).elements.equals(elements);
    }

    @Override
    public int hashCode() {
      return elements.hashCode() + 11;
    }
  }

  /**
   * [h1, h2 | tail]
   */
  public static class PCons extends Pattern {
    private final ImmutableList<Pattern> heads;
    private final Pattern tail;

    public PCons(List<Pattern> heads, Pattern tail) {
      assert(!heads.isEmpty());
      this.heads = ImmutableList.copyOf(heads);
      this.tail = tail;
    }

    public ImmutableList<Pattern> heads() {
      return heads;
    }

    public Pattern tail() {
      return tail;
    }

    @Override
    public Kind kind() {
      return Kind.CONS;
    }

    @Override
    public List<Pattern> subPatterns() {
      return ImmutableList.<Pattern>builder().addAll(heads).add(tail).build();
    }

    @Override
    public Pattern mapSubPatterns(Rewriter rewriter) {
      ImmutableList<Pattern> newHeads = mapList(heads, rewriter);
      Pattern newTail = rewriter.rewrite(tail);
      if (newHeads == heads && newTail == tail) {
        return this;
      }
      return new PCons(newHeads, newTail);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof PCons)) {
        return false;
      }
      PCons other = (PCons)obj;
      return heads.equals(other.heads) && tail.equals(other.tail);
    }

    @Override
    public int hashCode() {
      return heads.hashCode() * 31 + tail.hashCode();
    }
  }

  /**
   * %{key => pattern}.  Keys are literal nodes.
   */
  public static class PMap extends Pattern {
    private final ImmutableList<Pair<Node, Pattern>> entries;

    public PMap(List<Pair<Node, Pattern>> entries) {
      this.entries = ImmutableList.copyOf(entries);
    }

    public ImmutableList<Pair<Node, Pattern>> entries() {
      return entries;
    }

    @Override
    public Kind kind() {
      return Kind.MAP;
    }

    @Override
    public List<Pattern> subPatterns() {
      return Pair.extract2(entries);
    }

    @Override
    public Pattern mapSubPatterns(Rewriter rewriter) {
      boolean changed = false;
      List<Pair<Node, Pattern>> newEntries =
              new ArrayList<Pair<Node, Pattern>>(entries.size());
      for (Pair<Node, Pattern> e: entries) {
        Pattern p = rewriter.rewrite(e.val2);
        changed = changed || p != e.val2;
        newEntries.add(e.withSecond(p));
      }
      return changed ? new PMap(newEntries) : this;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof PMap && ((PMap)obj).entries.equals(entries);
    }

    @Override
    public int hashCode() {
      return entries.hashCode() + 13;
    }
  }

  /**
   * %Module{field: pattern}
   */
  public static class PStruct extends Pattern {
    private final String module;
    private final ImmutableList<Pair<String, Pattern>> fields;

    public PStruct(String module, List<Pair<String, Pattern>> fields) {
      this.module = module;
      this.fields = ImmutableList.copyOf(fields);
    }

    public String module() {
      return module;
    }

    public ImmutableList<Pair<String, Pattern>> fields() {
      return fields;
    }

    @Override
    public Kind kind() {
      return Kind.STRUCT;
    }

    @Override
    public List<Pattern> subPatterns() {
      return Pair.extract2(fields);
    }

    @Override
    public Pattern mapSubPatterns(Rewriter rewriter) {
      boolean changed = false;
      List<Pair<String, Pattern>> newFields =
              new ArrayList<Pair<String, Pattern>>(fields.size());
      for (Pair<String, Pattern> f: fields) {
        Pattern p = rewriter.rewrite(f.val2);
        changed = changed || p != f.val2;
        newFields.add(f.withSecond(p));
      }
      return changed ? new PStruct(module, newFields) : this;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof PStruct)) {
        return false;
      }
      PStruct other = (PStruct)obj;
      return module.equals(other.module) && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
      return module.hashCode() * 31 + fields.hashCode();
    }
  }

  /**
   * pattern = name: binds the whole matched value as well
   */
  public static class PAlias extends Pattern {
    private final Pattern inner;
    private final String name;

    public PAlias(Pattern inner, String name) {
      this.inner = inner;
      this.name = name;
    }

    public Pattern inner() {
      return inner;
    }

    public String name() {
      return name;
    }

    public PAlias rename(String newName) {
      return new PAlias(inner, newName);
    }

    @Override
    public Kind kind() {
      return Kind.ALIAS;
    }

    @Override
    public List<Pattern> subPatterns() {
      return Collections.singletonList(inner);
    }

    @Override
    public Pattern mapSubPatterns(Rewriter rewriter) {
      Pattern newInner = rewriter.rewrite(inner);
      return newInner == inner ? this : new PAlias(newInner, name);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof PAlias)) {
        return false;
      }
      PAlias other = (PAlias)obj;
      return inner.equals(other.inner) && name.equals(other.name);
    }

    @Override
    public int hashCode() {
      return inner.hashCode() * 31 + name.hashCode();
    }
  }
}
