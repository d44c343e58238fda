/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.lambda.print;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.lambda.util.Escapes.escapeString;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import net.hydromatic.lambda.ast.FunctionAttribute;
import net.hydromatic.lambda.ast.Lambda;
import net.hydromatic.lambda.ast.ValueKind;
import net.hydromatic.lambda.util.BoxWriter;

/**
 * Prints lambda expressions.
 *
 * <p>Each compound expression is printed as a parenthesized list whose head
 * is a keyword (see {@link net.hydromatic.lambda.ast.Op#keyword}). A
 * compound expression opens a box that is indented by 2 (by 1 for switches),
 * so that if the expression does not fit on one line, its continuation lines
 * are indented relative to its opening parenthesis.
 *
 * <p>A chain of {@link Lambda.Let} expressions prints as one {@code let}
 * with several bindings, and a tree of {@link Lambda.Sequence} expressions
 * prints as one {@code seq} whose elements are in evaluation order.
 */
class LambdaPrinter {
  private final BoxWriter w;

  LambdaPrinter(BoxWriter w) {
    this.w = requireNonNull(w);
  }

  /** Prints an expression. */
  BoxWriter print(Lambda.Exp exp) {
    switch (exp.op) {
    case VAR:
      return w.append(((Lambda.Var) exp).id.toString());

    case CONST:
      return ConstantPrinter.print(w, ((Lambda.Const) exp).constant);

    case APPLY:
      final Lambda.Apply apply = (Lambda.Apply) exp;
      open(exp).space();
      print(apply.fn);
      args(apply.args);
      return w.append(apply.tailCall ? " @tailcall" : "")
          .append(Descriptors.applyInlined(apply.inlined))
          .append(Descriptors.applySpecialised(apply.specialised))
          .append(")")
          .close();

    case FUNCTION:
      return function((Lambda.Function) exp);

    case LET:
      return let((Lambda.Let) exp);

    case LETREC:
      final Lambda.LetRec letRec = (Lambda.LetRec) exp;
      open(exp).space().hvBox(0);
      for (int i = 0; i < letRec.bindings.size(); i++) {
        final Lambda.Binding binding = letRec.bindings.get(i);
        if (i > 0) {
          w.space();
        }
        w.append("(").box(2).append(binding.id.toString()).space();
        print(binding.exp);
        w.close().append(")");
      }
      w.close().space();
      print(letRec.body);
      return w.append(")").close();

    case PRIM:
      final Lambda.PrimCall primCall = (Lambda.PrimCall) exp;
      w.box(2).append("(");
      PrimitivePrinter.print(w, primCall.primitive);
      args(primCall.args);
      return w.append(")").close();

    case SWITCH:
      return switch_((Lambda.Switch) exp);

    case STRING_SWITCH:
      return stringSwitch((Lambda.StringSwitch) exp);

    case STATIC_RAISE:
      final Lambda.StaticRaise staticRaise = (Lambda.StaticRaise) exp;
      open(exp).space().append(staticRaise.label);
      args(staticRaise.args);
      return w.append(")").close();

    case STATIC_CATCH:
      final Lambda.StaticCatch staticCatch = (Lambda.StaticCatch) exp;
      open(exp).space();
      print(staticCatch.body);
      w.brk(1, -1).append("with (").append(staticCatch.label);
      for (Lambda.Param var : staticCatch.vars) {
        w.append(" ").append(param(var));
      }
      w.append(")").space();
      print(staticCatch.handler);
      return w.append(")").close();

    case TRY_WITH:
      final Lambda.TryWith tryWith = (Lambda.TryWith) exp;
      open(exp).space();
      print(tryWith.body);
      w.brk(1, -1).append("with ").append(tryWith.id.toString()).space();
      print(tryWith.handler);
      return w.append(")").close();

    case IF_THEN_ELSE:
      final Lambda.IfThenElse ifThenElse = (Lambda.IfThenElse) exp;
      open(exp).space();
      print(ifThenElse.condition);
      w.append(Descriptors.matchInfo(ifThenElse.info)).space();
      print(ifThenElse.ifTrue);
      w.space();
      print(ifThenElse.ifFalse);
      return w.append(")").close();

    case SEQUENCE:
      open(exp);
      for (Lambda.Exp e : flattenSequence((Lambda.Sequence) exp)) {
        w.space();
        print(e);
      }
      return w.append(")").close();

    case WHILE:
      final Lambda.While while_ = (Lambda.While) exp;
      open(exp).space();
      print(while_.condition);
      w.space();
      print(while_.body);
      return w.append(")").close();

    case FOR:
      final Lambda.For for_ = (Lambda.For) exp;
      open(exp).append(" ").append(for_.id.toString()).space();
      print(for_.lo);
      w.space().append(Descriptors.direction(for_.direction)).space();
      print(for_.hi);
      w.space();
      print(for_.body);
      return w.append(")").close();

    case ASSIGN:
      final Lambda.Assign assign = (Lambda.Assign) exp;
      open(exp).space()
          .append(assign.id.toString()).space();
      print(assign.exp);
      return w.append(")").close();

    case SEND:
      final Lambda.Send send = (Lambda.Send) exp;
      open(exp)
          .append(Descriptors.methKind(send.kind))
          .space();
      print(send.obj);
      w.space();
      print(send.method);
      args(send.args);
      return w.append(")").close();

    case EVENT:
      final Lambda.Event event = (Lambda.Event) exp;
      w.box(2).append("(")
          .append(Descriptors.eventKind(event.kind))
          .append(" ")
          .append(event.location.toString())
          .space();
      print(event.exp);
      return w.append(")").close();

    case IF_USED:
      final Lambda.IfUsed ifUsed = (Lambda.IfUsed) exp;
      open(exp).space()
          .append(ifUsed.id.toString()).space();
      print(ifUsed.exp);
      return w.append(")").close();

    default:
      throw new AssertionError("unknown op " + exp.op);
    }
  }

  /** Opens a box and prints the opening parenthesis and keyword of an
   * expression. */
  private BoxWriter open(Lambda.Exp exp) {
    return w.box(2).append("(").append(exp.op.keyword());
  }

  /** Prints a list of arguments, each preceded by a break. */
  private void args(List<Lambda.Exp> args) {
    for (Lambda.Exp arg : args) {
      w.space();
      print(arg);
    }
  }

  private static String param(Lambda.Param param) {
    return param.id + Descriptors.valueKind(param.kind);
  }

  private BoxWriter function(Lambda.Function function) {
    open(function);
    switch (function.kind) {
    case CURRIED:
      for (Lambda.Param param : function.params) {
        w.space().append(param(param));
      }
      break;
    case TUPLED:
      w.append(" (");
      for (int i = 0; i < function.params.size(); i++) {
        if (i > 0) {
          w.append(",").space();
        }
        w.append(param(function.params.get(i)));
      }
      w.append(")");
      break;
    default:
      throw new AssertionError("unknown function kind " + function.kind);
    }
    w.space();
    attributes(function.attribute);
    returnKind(function.returnKind);
    print(function.body);
    return w.append(")").close();
  }

  /** Prints the attributes of a function, each followed by a break. */
  private void attributes(FunctionAttribute attribute) {
    if (attribute.isAFunctor) {
      w.append("is_a_functor").space();
    }
    if (attribute.stub) {
      w.append("stub").space();
    }
    token(Descriptors.functionInline(attribute.inline));
    token(Descriptors.functionSpecialise(attribute.specialise));
    token(Descriptors.functionLocal(attribute.local));
  }

  private void returnKind(ValueKind kind) {
    token(Descriptors.returnKind(kind));
  }

  /** Prints a token followed by a break, unless the token is empty. */
  private void token(String s) {
    if (!s.isEmpty()) {
      w.append(s).space();
    }
  }

  /** Prints a let and the lets that are its body, its body's body, and so
   * on, as one {@code let} with several bindings. */
  private BoxWriter let(Lambda.Let let) {
    open(let).space().hvBox(0);
    Lambda.Exp exp = let;
    for (int i = 0; exp instanceof Lambda.Let; i++) {
      final Lambda.Let let1 = (Lambda.Let) exp;
      if (i > 0) {
        w.space();
      }
      w.append("(")
          .box(2)
          .append(let1.id.toString())
          .append(" =")
          .append(Descriptors.letKind(let1.letKind))
          .append(Descriptors.valueKind(let1.valueKind))
          .space();
      print(let1.arg);
      w.close().append(")");
      exp = let1.body;
    }
    w.close().space();
    print(exp);
    return w.append(")").close();
  }

  /** Returns the leaves of a tree of sequences, in evaluation order.
   *
   * <p>Uses an explicit stack, so that a long chain of sequences does not
   * overflow the Java stack. */
  static List<Lambda.Exp> flattenSequence(Lambda.Sequence sequence) {
    final List<Lambda.Exp> list = new ArrayList<>();
    final Deque<Lambda.Exp> stack = new ArrayDeque<>();
    stack.push(sequence);
    while (!stack.isEmpty()) {
      final Lambda.Exp exp = stack.pop();
      if (exp instanceof Lambda.Sequence) {
        stack.push(((Lambda.Sequence) exp).second);
        stack.push(((Lambda.Sequence) exp).first);
      } else {
        list.add(exp);
      }
    }
    return list;
  }

  private BoxWriter switch_(Lambda.Switch sw) {
    w.box(1)
        .append("(")
        .append(sw.op.keyword())
        .append(sw.failAction == null ? "* " : " ");
    print(sw.arg);
    w.space().vBox(0);
    boolean first = true;
    for (Lambda.IntCase c : sw.consts) {
      first = arm(first, "case int " + c.key + ":", c.exp);
    }
    for (Lambda.IntCase c : sw.blocks) {
      first = arm(first, "case tag " + c.key + ":", c.exp);
    }
    if (sw.failAction != null) {
      arm(first, "default:", sw.failAction);
    }
    return w.close().append(")").close();
  }

  private BoxWriter stringSwitch(Lambda.StringSwitch sw) {
    w.box(1).append("(").append(sw.op.keyword()).append(" ");
    print(sw.arg);
    w.space().vBox(0);
    boolean first = true;
    for (Lambda.StringCase c : sw.cases) {
      first = arm(first, "case \"" + escapeString(c.key) + "\":", c.exp);
    }
    if (sw.defaultExp != null) {
      arm(first, "default:", sw.defaultExp);
    }
    return w.close().append(")").close();
  }

  /** Prints an arm of a switch, preceded by a break if it is not the first
   * arm. Returns false, the value of "first" for the next arm. */
  private boolean arm(boolean first, String label, Lambda.Exp exp) {
    if (!first) {
      w.space();
    }
    w.hvBox(1).append(label).space();
    print(exp);
    w.close();
    return false;
  }
}

// End LambdaPrinter.java
