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
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import exlc.opt.LegalizationPass.RewritePass;
import exlc.tree.Control.Block;
import exlc.tree.Exprs.Paren;
import exlc.tree.Node;
import exlc.tree.Trees;

/**
 * Legalize statement sequences that sit in a single-expression slot.
 *
 * A compound slot value, i.e. a non-empty block or a parenthesized
 * block, is replaced by an immediately applied zero-argument closure
 * whose body is the block: (fn -> a = f(); g(a) end).()
 * The closure is applied where the block stood, so evaluation order is
 * unchanged and the slot receives the block's final value.
 *
 * One instance handles one family of slots, since each family lives in
 * different container nodes.
 */
public class WrapCompoundSlots extends RewritePass {

  public static enum SlotKind {
    ARGUMENT("wrap-compound-arguments",
             "Wrap statement sequences in call arguments in closures",
             Node.Kind.CALL, Node.Kind.APPLY),
    OPERAND("wrap-compound-operands",
            "Wrap statement sequences in operator operands in closures",
            Node.Kind.BINARY, Node.Kind.UNARY, Node.Kind.FIELD_ACCESS,
            Node.Kind.INDEX_ACCESS),
    INTERPOLATION("wrap-compound-interpolations",
             "Wrap statement sequences in interpolation slots in closures",
             Node.Kind.INTERPOLATION),
    ELEMENT("wrap-compound-elements",
            "Wrap statement sequences in container elements in closures",
            Node.Kind.LIST, Node.Kind.TUPLE, Node.Kind.MAP,
            Node.Kind.KEYWORD_LIST, Node.Kind.STRUCT),
    ;

    private final String passName;
    private final String description;
    private final Set<Node.Kind> containers;

    private SlotKind(String passName, String description,
                     Node.Kind first, Node.Kind... rest) {
      this.passName = passName;
      this.description = description;
      this.containers = Collections.unmodifiableSet(EnumSet.of(first, rest));
    }

    public String passName() {
      return passName;
    }

    /**
     * @return true if children of node are slots of this kind
     */
    public boolean holdsSlots(Node node) {
      return containers.contains(node.kind());
    }

    /**
     * @return slot values held by node, empty if none
     */
    public List<Node> slots(Node node) {
      if (!holdsSlots(node)) {
        return Collections.emptyList();
      }
      return node.children();
    }
  }

  private final SlotKind slotKind;

  private WrapCompoundSlots(SlotKind slotKind) {
    this.slotKind = slotKind;
  }

  public static WrapCompoundSlots arguments() {
    return new WrapCompoundSlots(SlotKind.ARGUMENT);
  }

  public static WrapCompoundSlots operands() {
    return new WrapCompoundSlots(SlotKind.OPERAND);
  }

  public static WrapCompoundSlots interpolations() {
    return new WrapCompoundSlots(SlotKind.INTERPOLATION);
  }

  public static WrapCompoundSlots elements() {
    return new WrapCompoundSlots(SlotKind.ELEMENT);
  }

  public SlotKind getSlotKind() {
    return slotKind;
  }

  @Override
  public String getPassName() {
    return slotKind.passName;
  }

  @Override
  public String getDescription() {
    return slotKind.description;
  }

  @Override
  public List<TreeCondition> getPostconditions() {
    List<TreeCondition> result = new ArrayList<TreeCondition>();
    result.add(Conditions.noCompoundSlots(slotKind));
    return result;
  }

  @Override
  protected Node rewrite(final Logger logger, Node node) {
    if (!slotKind.holdsSlots(node)) {
      return node;
    }
    return node.mapChildren(new Node.Rewriter() {
      @Override
      public Node rewrite(Node slot) {
        if (!isCompound(slot)) {
          return slot;
        }
        if (logger.isTraceEnabled()) {
          logger.trace(getPassName() + ": wrapping " + slot);
        }
        return wrap(slot);
      }
    });
  }

  /**
   * A compound is a non-empty block, or a parenthesized one
   */
  public static boolean isCompound(Node node) {
    if (node.kind() == Node.Kind.PAREN) {
      node = ((Paren)node).inner();
    }
    return node.kind() == Node.Kind.BLOCK &&
           !((Block)node).statements().isEmpty();
  }

  /**
   * Replace a compound with an applied closure over it
   */
  public static Node wrap(Node compound) {
    Node body = compound;
    if (body.kind() == Node.Kind.PAREN) {
      body = ((Paren)body).inner();
    }
    return Trees.replace(compound, Trees.iife(body));
  }
}
