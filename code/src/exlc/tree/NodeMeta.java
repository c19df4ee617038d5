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

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Metadata attached to a tree node.  Immutable: passes that need to
 * change metadata construct a new instance and a new node.
 */
public class NodeMeta {

  public static enum Flag {
    /** Immediately-invoked closure created by expression legalization */
    LEGALIZED_IIFE,
    /** Binder names under this node must not be changed by hygiene passes */
    PRESERVE_NAMES,
  }

  public static final NodeMeta EMPTY = new NodeMeta(null,
                                          EnumSet.noneOf(Flag.class));

  private final FilePosition position;
  private final Set<Flag> flags;

  private NodeMeta(FilePosition position, EnumSet<Flag> flags) {
    this.position = position;
    this.flags = Collections.unmodifiableSet(flags);
  }

  public static NodeMeta at(FilePosition position) {
    return new NodeMeta(position, EnumSet.noneOf(Flag.class));
  }

  public static NodeMeta of(Flag flag, Flag... rest) {
    return new NodeMeta(null, EnumSet.of(flag, rest));
  }

  /**
   * @return position, or null if unknown
   */
  public FilePosition getPosition() {
    return position;
  }

  public boolean hasFlag(Flag flag) {
    return flags.contains(flag);
  }

  public Set<Flag> getFlags() {
    return flags;
  }

  public boolean isEmpty() {
    return position == null && flags.isEmpty();
  }

  public NodeMeta withFlag(Flag flag) {
    if (flags.contains(flag)) {
      return this;
    }
    EnumSet<Flag> newFlags = EnumSet.of(flag);
    newFlags.addAll(flags);
    return new NodeMeta(position, newFlags);
  }

  public NodeMeta withPosition(FilePosition newPosition) {
    EnumSet<Flag> newFlags = EnumSet.noneOf(Flag.class);
    newFlags.addAll(flags);
    return new NodeMeta(newPosition, newFlags);
  }

  /**
   * Combine metadata of a replaced node into the metadata of its
   * replacement: keep the replacement's position if it has one,
   * and the union of flags.
   */
  public NodeMeta mergeFrom(NodeMeta replaced) {
    if (replaced.isEmpty()) {
      return this;
    }
    EnumSet<Flag> newFlags = EnumSet.noneOf(Flag.class);
    newFlags.addAll(replaced.flags);
    newFlags.addAll(flags);
    return new NodeMeta(position != null ? position : replaced.position,
                        newFlags);
  }

  @Override
  public String toString() {
    return "{pos=" + position + ", flags=" + flags + "}";
  }
}
