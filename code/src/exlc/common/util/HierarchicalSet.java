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

package exlc.common.util;

import java.util.AbstractSet;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.NoSuchElementException;
import java.util.Set;

import exlc.common.exceptions.LegalizerRuntimeError;

/**
 * A set that allows cheap creation of child sets, used to track the
 * names visible in nested lexical scopes.  Lookups fall through to the
 * parent; additions only affect the current level.  Elements in the
 * parent are never removed through a child.
 */
public class HierarchicalSet<T> extends AbstractSet<T> {
  private final HierarchicalSet<T> parent;
  private final Set<T> set;

  private HierarchicalSet(HierarchicalSet<T> parent, Set<T> set) {
    this.parent = parent;
    if (set == null) {
      this.set = new LinkedHashSet<T>();
    } else {
      this.set = set;
    }
  }

  public HierarchicalSet() {
    this(null, null);
  }

  /**
   * Make a new hierarchical set with this as the parent
   */
  public HierarchicalSet<T> makeChild() {
    return new HierarchicalSet<T>(this, null);
  }

  /**
   * Make a new hierarchical set with this as the parent, initially
   * holding the given elements
   */
  public HierarchicalSet<T> makeChild(Collection<? extends T> initial) {
    HierarchicalSet<T> child = makeChild();
    child.addAll(initial);
    return child;
  }

  public HierarchicalSet<T> getParent() {
    return parent;
  }

  /**
   * @return true if the element was added at this level of the hierarchy
   */
  public boolean containsLocal(Object o) {
    return set.contains(o);
  }

  /**
   * Add at this level.  Redeclaring an element visible from a parent
   * still records it locally, so that containsLocal reflects shadowing.
   * @return true if the element was not visible before
   */
  @Override
  public boolean add(T e) {
    boolean visible = contains(e);
    set.add(e);
    return !visible;
  }

  @Override
  public boolean contains(Object o) {
    HierarchicalSet<T> curr = this;
    while (curr != null) {
      if (curr.set.contains(o)) {
        return true;
      }
      curr = curr.parent;
    }
    return false;
  }

  @Override
  public boolean remove(Object o) {
    throw new LegalizerRuntimeError("Cannot remove from hierarchical set");
  }

  @Override
  public void clear() {
    throw new LegalizerRuntimeError("Cannot clear hierarchical set");
  }

  @Override
  public int size() {
    int n = 0;
    Iterator<T> it = iterator();
    while (it.hasNext()) {
      it.next();
      n++;
    }
    return n;
  }

  /**
   * Iterate over distinct elements, innermost level first
   */
  @Override
  public Iterator<T> iterator() {
    return new HSIt();
  }

  private final class HSIt implements Iterator<T> {
    private HierarchicalSet<T> curr = HierarchicalSet.this;
    private Iterator<T> currIt = curr.set.iterator();
    private T next = null;
    private boolean hasNext = false;

    @Override
    public boolean hasNext() {
      if (hasNext) {
        return true;
      }
      while (curr != null) {
        while (currIt.hasNext()) {
          T candidate = currIt.next();
          if (!shadowedBelow(candidate)) {
            next = candidate;
            hasNext = true;
            return true;
          }
        }
        curr = curr.parent;
        if (curr != null) {
          currIt = curr.set.iterator();
        }
      }
      return false;
    }

    /**
     * Check whether an element was already returned from a lower level
     */
    private boolean shadowedBelow(T candidate) {
      HierarchicalSet<T> level = HierarchicalSet.this;
      while (level != curr) {
        if (level.set.contains(candidate)) {
          return true;
        }
        level = level.parent;
      }
      return false;
    }

    @Override
    public T next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      hasNext = false;
      return next;
    }

    @Override
    public void remove() {
      throw new UnsupportedOperationException();
    }
  }
}
