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

/**
 * Declarations: modules, named functions and module attributes
 */
public class Decls {

  /**
   * defmodule Name do body end
   */
  public static class ModuleDecl extends Node {
    private final String name;
    private final ImmutableList<Node> body;

    public ModuleDecl(String name, List<Node> body, NodeMeta meta) {
      super(meta);
      this.name = name;
      this.body = ImmutableList.copyOf(body);
    }

    public String name() {
      return name;
    }

    public ImmutableList<Node> body() {
      return body;
    }

    @Override
    public Kind kind() {
      return Kind.MODULE;
    }

    @Override
    public List<Node> children() {
      return body;
    }

    @Override
    public Node mapChildren(Rewriter rewriter) {
      ImmutableList<Node> newBody = mapList(body, rewriter);
      return newBody == body ? this : new ModuleDecl(name, newBody, meta);
    }

    @Override
    public ModuleDecl withMeta(NodeMeta newMeta) {
      return new ModuleDecl(name, body, newMeta);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof ModuleDecl)) {
        return false;
      }
      ModuleDecl other = (ModuleDecl)obj;
      return name.equals(other.name) && body.equals(other.body);
    }

    @Override
    public int hashCode() {
      return name.hashCode() * 31 + body.hashCode();
    }
  }

  /**
   * def/defp name(params) when guard do body end.  Each clause of a
   * multi-clause function is a separate definition.
   */
  public static class FunctionDef extends Node {
    private final String name;
    private final boolean isPrivate;
    private final ImmutableList<Pattern> params;
    private final Node guard;
    private final Node body;

    public FunctionDef(String name, boolean isPrivate, List<Pattern> params,
                       Node guard, Node body, NodeMeta meta) {
      super(meta);
      this.name = name;
      this.isPrivate = isPrivate;
      this.params = ImmutableList.copyOf(params);
      this.guard = guard;
      this.body = body;
    }

    public String name() {
      return name;
    }

    public boolean isPrivate() {
      return isPrivate;
    }

    public ImmutableList<Pattern> params() {
      return params;
    }

    /**
     * @return guard, or null if none
     */
    public Node guard() {
      return guard;
    }

    public Node body() {
      return body;
    }

    public FunctionDef withParams(List<Pattern> newParams) {
      return new FunctionDef(name, isPrivate, newParams, guard, body, meta);
    }

    public FunctionDef withBody(Node newBody) {
      if (newBody == body) {
        return this;
      }
      return new FunctionDef(name, isPrivate, params, guard, newBody, meta);
    }

    public FunctionDef withClause(Clause clause) {
      return new FunctionDef(name, isPrivate, clause.patterns(),
                             clause.guard(), clause.body(), meta);
    }

    /**
     * View parameters, guard and body as a clause
     */
    public Clause asClause() {
      return new Clause(params, guard, body);
    }

    @Override
    public Kind kind() {
      return Kind.FUNCTION_DEF;
    }

    @Override
    public List<Node> children() {
      if (guard == null) {
        return ImmutableList.of(body);
      }
      return ImmutableList.of(guard, body);
    }

    @Override
    public Node mapChildren(Rewriter rewriter) {
      Node newGuard = mapNullable(guard, rewriter);
      Node newBody = rewriter.rewrite(body);
      if (newGuard == guard && newBody == body) {
        return this;
      }
      return new FunctionDef(name, isPrivate, params, newGuard, newBody, meta);
    }

    @Override
    public FunctionDef withMeta(NodeMeta newMeta) {
      return new FunctionDef(name, isPrivate, params, guard, body, newMeta);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof FunctionDef)) {
        return false;
      }
      FunctionDef other = (FunctionDef)obj;
      return name.equals(other.name) && isPrivate == other.isPrivate &&
          params.equals(other.params) && eq(guard, other.guard) &&
          body.equals(other.body);
    }

    @Override
    public int hashCode() {
      return ((name.hashCode() * 31 + params.hashCode()) * 31 +
             (guard == null ? 0 : guard.hashCode())) * 31 + body.hashCode();
    }
  }

  /**
   * @name value
   */
  public static class ModuleAttribute extends Node {
    private final String name;
    private final Node value;

    public ModuleAttribute(String name, Node value, NodeMeta meta) {
      super(meta);
      this.name = name;
      this.value = value;
    }

    public String name() {
      return name;
    }

    public Node value() {
      return value;
    }

    @Override
    public Kind kind() {
      return Kind.MODULE_ATTRIBUTE;
    }

    @Override
    public List<Node> children() {
      return ImmutableList.of(value);
    }

    @Override
    public Node mapChildren(Rewriter rewriter) {
      Node newValue = rewriter.rewrite(value);
      return newValue == value ? this :
                  new ModuleAttribute(name, newValue, meta);
    }

    @Override
    public ModuleAttribute withMeta(NodeMeta newMeta) {
      return new ModuleAttribute(name, value, newMeta);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof ModuleAttribute)) {
        return false;
      }
      ModuleAttribute other = (ModuleAttribute)obj;
      return name.equals(other.name) && value.equals(other.value);
    }

    @Override
    public int hashCode() {
      return name.hashCode() * 31 + value.hashCode();
    }
  }
}
