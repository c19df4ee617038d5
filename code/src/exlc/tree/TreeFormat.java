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

import exlc.common.exceptions.LegalizerRuntimeError;
import exlc.common.util.Pair;
import exlc.common.util.StringUtil;
import exlc.tree.Containers.KeywordList;
import exlc.tree.Containers.MapLit;
import exlc.tree.Containers.Sequence;
import exlc.tree.Containers.StructLit;
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
import exlc.tree.Literals.StringLit;
import exlc.tree.Pattern.PAlias;
import exlc.tree.Pattern.PCons;
import exlc.tree.Pattern.PList;
import exlc.tree.Pattern.PLiteral;
import exlc.tree.Pattern.PMap;
import exlc.tree.Pattern.PPin;
import exlc.tree.Pattern.PStruct;
import exlc.tree.Pattern.PTuple;
import exlc.tree.Pattern.PVar;

/**
 * Render trees in target-like syntax for logs and IR dumps.
 * Output is for humans: operators are fully parenthesized and
 * no attempt is made to produce compilable text.
 */
public class TreeFormat {
  private static final int INDENT = 2;

  public static String format(Node node) {
    StringBuilder sb = new StringBuilder();
    formatBody(sb, node, 0);
    return sb.toString();
  }

  public static String format(Pattern pattern) {
    StringBuilder sb = new StringBuilder();
    formatPattern(sb, pattern);
    return sb.toString();
  }

  public static String format(Clause clause) {
    StringBuilder sb = new StringBuilder();
    formatClause(sb, clause, 0);
    return sb.toString();
  }

  /**
   * Write node as a sequence of lines at the given indentation
   */
  private static void formatBody(StringBuilder sb, Node node, int indent) {
    List<Node> stmts = Trees.statements(node);
    for (int i = 0; i < stmts.size(); i++) {
      if (i > 0) {
        sb.append('\n');
      }
      StringUtil.spaces(sb, indent);
      formatExpr(sb, stmts.get(i), indent);
    }
  }

  private static void formatExpr(StringBuilder sb, Node node, int indent) {
    switch (node.kind()) {
      case INTEGER:
        sb.append(((IntLit)node).value());
        break;
      case FLOAT:
        sb.append(((FloatLit)node).value());
        break;
      case STRING:
        sb.append('"');
        StringUtil.escape(sb, ((StringLit)node).value());
        sb.append('"');
        break;
      case ATOM:
        sb.append(':').append(((AtomLit)node).name());
        break;
      case BOOLEAN:
        sb.append(((BoolLit)node).value());
        break;
      case NIL:
        sb.append("nil");
        break;
      case LIST:
        sb.append('[');
        formatList(sb, ((Sequence)node).elements(), indent);
        sb.append(']');
        break;
      case TUPLE:
        sb.append('{');
        formatList(sb, ((Sequence)node).elements(), indent);
        sb.append('}');
        break;
      case MAP: {
        sb.append("%{");
        boolean first = true;
        for (Pair<Node, Node> e: ((MapLit)node).entries()) {
          if (!first) {
            sb.append(", ");
          }
          first = false;
          formatExpr(sb, e.val1, indent);
          sb.append(" => ");
          formatExpr(sb, e.val2, indent);
        }
        sb.append('}');
        break;
      }
      case KEYWORD_LIST:
        sb.append('[');
        formatNamed(sb, ((KeywordList)node).entries(), indent);
        sb.append(']');
        break;
      case STRUCT: {
        StructLit s = (StructLit)node;
        sb.append('%').append(s.module()).append('{');
        formatNamed(sb, s.fields(), indent);
        sb.append('}');
        break;
      }
      case VAR:
        sb.append(((Var)node).name());
        break;
      case FIELD_ACCESS: {
        FieldAccess f = (FieldAccess)node;
        formatExpr(sb, f.target(), indent);
        sb.append('.').append(f.field());
        break;
      }
      case INDEX_ACCESS: {
        IndexAccess ia = (IndexAccess)node;
        formatExpr(sb, ia.target(), indent);
        sb.append('[');
        formatExpr(sb, ia.index(), indent);
        sb.append(']');
        break;
      }
      case BINARY: {
        BinaryOp b = (BinaryOp)node;
        if (b.op().isFunctionStyle()) {
          sb.append(b.op().symbol()).append('(');
          formatExpr(sb, b.left(), indent);
          sb.append(", ");
          formatExpr(sb, b.right(), indent);
          sb.append(')');
        } else {
          sb.append('(');
          formatExpr(sb, b.left(), indent);
          sb.append(' ').append(b.op().symbol()).append(' ');
          formatExpr(sb, b.right(), indent);
          sb.append(')');
        }
        break;
      }
      case UNARY: {
        UnaryOp u = (UnaryOp)node;
        sb.append(u.op().symbol());
        if (Character.isLetter(u.op().symbol().charAt(0))) {
          sb.append(' ');
        }
        formatExpr(sb, u.operand(), indent);
        break;
      }
      case CALL: {
        Call c = (Call)node;
        if (c.qualifier() != null) {
          formatExpr(sb, c.qualifier(), indent);
          sb.append('.');
        }
        sb.append(c.function()).append('(');
        formatList(sb, c.args(), indent);
        sb.append(')');
        break;
      }
      case APPLY: {
        Apply a = (Apply)node;
        boolean wrap = a.function().kind() == Node.Kind.FN;
        if (wrap) {
          sb.append('(');
        }
        formatExpr(sb, a.function(), indent);
        if (wrap) {
          sb.append(')');
        }
        sb.append(".(");
        formatList(sb, a.args(), indent);
        sb.append(')');
        break;
      }
      case FN: {
        sb.append("fn");
        List<Clause> clauses = ((Fn)node).clauses();
        if (clauses.size() == 1 && !isMultiLine(clauses.get(0).body())) {
          sb.append(' ');
          formatClauseHead(sb, clauses.get(0));
          sb.append(" -> ");
          formatExpr(sb, clauses.get(0).body(), indent);
          sb.append(" end");
        } else {
          for (Clause c: clauses) {
            sb.append('\n');
            formatClause(sb, c, indent + INDENT);
          }
          sb.append('\n');
          StringUtil.spaces(sb, indent);
          sb.append("end");
        }
        break;
      }
      case IF: {
        If i = (If)node;
        sb.append("if ");
        formatExpr(sb, i.condition(), indent);
        sb.append(" do\n");
        formatBody(sb, i.thenBranch(), indent + INDENT);
        if (i.elseBranch() != null) {
          sb.append('\n');
          StringUtil.spaces(sb, indent);
          sb.append("else\n");
          formatBody(sb, i.elseBranch(), indent + INDENT);
        }
        sb.append('\n');
        StringUtil.spaces(sb, indent);
        sb.append("end");
        break;
      }
      case COND: {
        sb.append("cond do");
        for (Cond.Branch b: ((Cond)node).branches()) {
          sb.append('\n');
          StringUtil.spaces(sb, indent + INDENT);
          formatExpr(sb, b.condition, indent + INDENT);
          sb.append(" ->\n");
          formatBody(sb, b.body, indent + 2 * INDENT);
        }
        sb.append('\n');
        StringUtil.spaces(sb, indent);
        sb.append("end");
        break;
      }
      case MATCH: {
        Match m = (Match)node;
        formatPattern(sb, m.pattern());
        sb.append(" = ");
        formatExpr(sb, m.value(), indent);
        break;
      }
      case CASE: {
        Case c = (Case)node;
        sb.append("case ");
        formatExpr(sb, c.scrutinee(), indent);
        sb.append(" do");
        for (Clause clause: c.clauses()) {
          sb.append('\n');
          formatClause(sb, clause, indent + INDENT);
        }
        sb.append('\n');
        StringUtil.spaces(sb, indent);
        sb.append("end");
        break;
      }
      case BLOCK: {
        List<Node> stmts = ((Block)node).statements();
        sb.append('(');
        for (int i = 0; i < stmts.size(); i++) {
          if (i > 0) {
            sb.append("; ");
          }
          formatExpr(sb, stmts.get(i), indent);
        }
        sb.append(')');
        break;
      }
      case PAREN:
        sb.append('(');
        formatExpr(sb, ((Paren)node).inner(), indent);
        sb.append(')');
        break;
      case INTERPOLATION:
        sb.append('"');
        for (Node part: ((Interpolation)node).parts()) {
          if (part.kind() == Node.Kind.STRING) {
            StringUtil.escape(sb, ((StringLit)part).value());
          } else {
            sb.append("#{");
            formatExpr(sb, part, indent);
            sb.append('}');
          }
        }
        sb.append('"');
        break;
      case RAW:
        sb.append(((Raw)node).text());
        break;
      case MODULE: {
        ModuleDecl m = (ModuleDecl)node;
        sb.append("defmodule ").append(m.name()).append(" do");
        for (Node stmt: m.body()) {
          sb.append('\n');
          StringUtil.spaces(sb, indent + INDENT);
          formatExpr(sb, stmt, indent + INDENT);
        }
        sb.append('\n');
        StringUtil.spaces(sb, indent);
        sb.append("end");
        break;
      }
      case FUNCTION_DEF: {
        FunctionDef d = (FunctionDef)node;
        sb.append(d.isPrivate() ? "defp " : "def ");
        sb.append(d.name()).append('(');
        formatPatterns(sb, d.params());
        sb.append(')');
        if (d.guard() != null) {
          sb.append(" when ");
          formatExpr(sb, d.guard(), indent);
        }
        sb.append(" do\n");
        formatBody(sb, d.body(), indent + INDENT);
        sb.append('\n');
        StringUtil.spaces(sb, indent);
        sb.append("end");
        break;
      }
      case MODULE_ATTRIBUTE: {
        ModuleAttribute a = (ModuleAttribute)node;
        sb.append('@').append(a.name()).append(' ');
        formatExpr(sb, a.value(), indent);
        break;
      }
      default:
        throw new LegalizerRuntimeError("Unknown node kind " + node.kind());
    }
  }

  private static boolean isMultiLine(Node body) {
    return body.kind() == Node.Kind.BLOCK;
  }

  private static void formatClause(StringBuilder sb, Clause clause,
                                   int indent) {
    StringUtil.spaces(sb, indent);
    formatClauseHead(sb, clause);
    sb.append(" ->\n");
    formatBody(sb, clause.body(), indent + INDENT);
  }

  private static void formatClauseHead(StringBuilder sb, Clause clause) {
    formatPatterns(sb, clause.patterns());
    if (clause.guard() != null) {
      sb.append(" when ");
      formatExpr(sb, clause.guard(), 0);
    }
  }

  private static void formatList(StringBuilder sb, List<Node> nodes,
                                 int indent) {
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      formatExpr(sb, nodes.get(i), indent);
    }
  }

  private static void formatNamed(StringBuilder sb,
                    List<Pair<String, Node>> entries, int indent) {
    for (int i = 0; i < entries.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(entries.get(i).val1).append(": ");
      formatExpr(sb, entries.get(i).val2, indent);
    }
  }

  private static void formatPatterns(StringBuilder sb,
                                     List<Pattern> patterns) {
    for (int i = 0; i < patterns.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      formatPattern(sb, patterns.get(i));
    }
  }

  private static void formatPattern(StringBuilder sb, Pattern pattern) {
    switch (pattern.kind()) {
      case VAR:
        sb.append(((PVar)pattern).name());
        break;
      case WILDCARD:
        sb.append('_');
        break;
      case LITERAL:
        formatExpr(sb, ((PLiteral)pattern).literal(), 0);
        break;
      case PIN:
        sb.append('^').append(((PPin)pattern).name());
        break;
      case TUPLE:
        sb.append('{');
        formatPatterns(sb, ((PTuple)pattern).elements());
        sb.append('}');
        break;
      case LIST:
        sb.append('[');
        formatPatterns(sb, ((PList)pattern).elements());
        sb.append(']');
        break;
      case CONS: {
        PCons cons = (PCons)pattern;
        sb.append('[');
        formatPatterns(sb, cons.heads());
        sb.append(" | ");
        formatPattern(sb, cons.tail());
        sb.append(']');
        break;
      }
      case MAP: {
        sb.append("%{");
        boolean first = true;
        for (Pair<Node, Pattern> e: ((PMap)pattern).entries()) {
          if (!first) {
            sb.append(", ");
          }
          first = false;
          formatExpr(sb, e.val1, 0);
          sb.append(" => ");
          formatPattern(sb, e.val2);
        }
        sb.append('}');
        break;
      }
      case STRUCT: {
        PStruct s = (PStruct)pattern;
        sb.append('%').append(s.module()).append('{');
        boolean first = true;
        for (Pair<String, Pattern> f: s.fields()) {
          if (!first) {
            sb.append(", ");
          }
          first = false;
          sb.append(f.val1).append(": ");
          formatPattern(sb, f.val2);
        }
        sb.append('}');
        break;
      }
      case ALIAS: {
        PAlias a = (PAlias)pattern;
        formatPattern(sb, a.inner());
        sb.append(" = ").append(a.name());
        break;
      }
      default:
        throw new LegalizerRuntimeError("Unknown pattern kind "
                                        + pattern.kind());
    }
  }
}
