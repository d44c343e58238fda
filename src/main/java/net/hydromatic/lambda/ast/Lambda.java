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
package net.hydromatic.lambda.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import net.hydromatic.lambda.ast.Info.MatchInfo;
import net.hydromatic.lambda.ast.Kinds.Direction;
import net.hydromatic.lambda.ast.Kinds.FunctionKind;
import net.hydromatic.lambda.ast.Kinds.LetKind;
import net.hydromatic.lambda.ast.Kinds.MethKind;
import net.hydromatic.lambda.ast.Kinds.SpecialiseAttribute;
import net.hydromatic.lambda.print.Printers;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Lambda expressions.
 *
 * <p>The intermediate representation between the typed tree and
 * closure-converted code. This class functions as a namespace, so that we can
 * keep the class names short.
 *
 * <p>Expressions are immutable, and list-valued fields keep the order in which
 * they were supplied to {@link LambdaBuilder}. That order is the evaluation
 * or declaration order in the source program.
 */
public class Lambda {
  private Lambda() {}

  /** Base class of lambda expressions. */
  public abstract static class Exp {
    public final Op op;

    Exp(Op op) {
      this.op = requireNonNull(op);
    }

    /**
     * Converts this expression into text.
     *
     * <p>The purpose of this string is debugging. Lines are not wrapped. If
     * you want output that fits a given width, use
     * {@link Printers#lambda(net.hydromatic.lambda.util.BoxWriter, Exp)}.
     */
    @Override public final String toString() {
      return Printers.lambda(this);
    }
  }

  /** Reference to a variable. */
  public static class Var extends Exp {
    public final Ident id;

    Var(Ident id) {
      super(Op.VAR);
      this.id = requireNonNull(id);
    }
  }

  /** Structured constant. */
  public static class Const extends Exp {
    public final Constant constant;

    Const(Constant constant) {
      super(Op.CONST);
      this.constant = requireNonNull(constant);
    }
  }

  /** Function application.
   *
   * <p>For example, "(apply f x y)". The attributes are requests that the
   * user made at the call site, and are printed after the arguments. */
  public static class Apply extends Exp {
    public final Exp fn;
    public final List<Exp> args;
    /** Whether the user asked for this call to be a tail call. */
    public final boolean tailCall;
    public final FunctionAttribute.Inline inlined;
    public final SpecialiseAttribute specialised;

    Apply(Exp fn, ImmutableList<Exp> args, boolean tailCall,
        FunctionAttribute.Inline inlined, SpecialiseAttribute specialised) {
      super(Op.APPLY);
      this.fn = requireNonNull(fn);
      this.args = requireNonNull(args);
      this.tailCall = tailCall;
      this.inlined = requireNonNull(inlined);
      this.specialised = requireNonNull(specialised);
    }
  }

  /** Parameter of a function, or variable bound by a
   * {@link StaticCatch}, with the kind of value it holds. */
  public static class Param {
    public final Ident id;
    public final ValueKind kind;

    Param(Ident id, ValueKind kind) {
      this.id = requireNonNull(id);
      this.kind = requireNonNull(kind);
    }

    @Override public int hashCode() {
      return Objects.hash(id, kind);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Param
          && id.equals(((Param) o).id)
          && kind == ((Param) o).kind;
    }
  }

  /** Function definition. */
  public static class Function extends Exp {
    public final FunctionKind kind;
    public final List<Param> params;
    public final ValueKind returnKind;
    public final Exp body;
    public final FunctionAttribute attribute;

    Function(FunctionKind kind, ImmutableList<Param> params,
        ValueKind returnKind, Exp body, FunctionAttribute attribute) {
      super(Op.FUNCTION);
      this.kind = requireNonNull(kind);
      this.params = requireNonNull(params);
      this.returnKind = requireNonNull(returnKind);
      this.body = requireNonNull(body);
      this.attribute = requireNonNull(attribute);
    }
  }

  /** Non-recursive binding, "let id = arg in body". */
  public static class Let extends Exp {
    public final LetKind letKind;
    public final ValueKind valueKind;
    public final Ident id;
    public final Exp arg;
    public final Exp body;

    Let(LetKind letKind, ValueKind valueKind, Ident id, Exp arg, Exp body) {
      super(Op.LET);
      this.letKind = requireNonNull(letKind);
      this.valueKind = requireNonNull(valueKind);
      this.id = requireNonNull(id);
      this.arg = requireNonNull(arg);
      this.body = requireNonNull(body);
    }
  }

  /** Binding within a {@link LetRec}. */
  public static class Binding {
    public final Ident id;
    public final Exp exp;

    Binding(Ident id, Exp exp) {
      this.id = requireNonNull(id);
      this.exp = requireNonNull(exp);
    }
  }

  /** Group of mutually recursive bindings. */
  public static class LetRec extends Exp {
    public final List<Binding> bindings;
    public final Exp body;

    LetRec(ImmutableList<Binding> bindings, Exp body) {
      super(Op.LETREC);
      this.bindings = requireNonNull(bindings);
      this.body = requireNonNull(body);
      checkArgument(!bindings.isEmpty(), "empty letrec");
    }
  }

  /** Call to a primitive operation. */
  public static class PrimCall extends Exp {
    public final Primitive primitive;
    public final List<Exp> args;

    PrimCall(Primitive primitive, ImmutableList<Exp> args) {
      super(Op.PRIM);
      this.primitive = requireNonNull(primitive);
      this.args = requireNonNull(args);
    }
  }

  /** Arm of a {@link Switch}, selected by an integer or a block tag. */
  public static class IntCase {
    public final int key;
    public final Exp exp;

    IntCase(int key, Exp exp) {
      this.key = key;
      this.exp = requireNonNull(exp);
    }
  }

  /** Dispatch on an immediate integer or the tag of a block.
   *
   * <p>Integer arms apply if the argument is an immediate, block arms if it
   * is a block. If no arm applies, the failure action is evaluated; if there
   * is no failure action, the arms are known to be exhaustive. */
  public static class Switch extends Exp {
    public final Exp arg;
    /** Number of immediate values that the argument may have. */
    public final int numConsts;
    public final List<IntCase> consts;
    /** Number of block tags that the argument may have. */
    public final int numBlocks;
    public final List<IntCase> blocks;
    public final @Nullable Exp failAction;

    Switch(Exp arg, int numConsts, ImmutableList<IntCase> consts,
        int numBlocks, ImmutableList<IntCase> blocks,
        @Nullable Exp failAction) {
      super(Op.SWITCH);
      this.arg = requireNonNull(arg);
      this.numConsts = numConsts;
      this.consts = requireNonNull(consts);
      this.numBlocks = numBlocks;
      this.blocks = requireNonNull(blocks);
      this.failAction = failAction;
    }
  }

  /** Arm of a {@link StringSwitch}. */
  public static class StringCase {
    public final String key;
    public final Exp exp;

    StringCase(String key, Exp exp) {
      this.key = requireNonNull(key);
      this.exp = requireNonNull(exp);
    }
  }

  /** Dispatch on the value of a string. */
  public static class StringSwitch extends Exp {
    public final Exp arg;
    public final List<StringCase> cases;
    public final @Nullable Exp defaultExp;

    StringSwitch(Exp arg, ImmutableList<StringCase> cases,
        @Nullable Exp defaultExp) {
      super(Op.STRING_SWITCH);
      this.arg = requireNonNull(arg);
      this.cases = requireNonNull(cases);
      this.defaultExp = defaultExp;
    }
  }

  /** Jump to the handler of the enclosing {@link StaticCatch} with a given
   * label, passing arguments. */
  public static class StaticRaise extends Exp {
    public final int label;
    public final List<Exp> args;

    StaticRaise(int label, ImmutableList<Exp> args) {
      super(Op.STATIC_RAISE);
      this.label = label;
      this.args = requireNonNull(args);
    }
  }

  /** Evaluates a body; if the body jumps to {@link #label}, binds the
   * arguments of the jump to {@link #vars} and evaluates the handler. */
  public static class StaticCatch extends Exp {
    public final Exp body;
    public final int label;
    public final List<Param> vars;
    public final Exp handler;

    StaticCatch(Exp body, int label, ImmutableList<Param> vars,
        Exp handler) {
      super(Op.STATIC_CATCH);
      this.body = requireNonNull(body);
      this.label = label;
      this.vars = requireNonNull(vars);
      this.handler = requireNonNull(handler);
    }
  }

  /** Exception handler, "try body with id -> handler". */
  public static class TryWith extends Exp {
    public final Exp body;
    public final Ident id;
    public final Exp handler;

    TryWith(Exp body, Ident id, Exp handler) {
      super(Op.TRY_WITH);
      this.body = requireNonNull(body);
      this.id = requireNonNull(id);
      this.handler = requireNonNull(handler);
    }
  }

  /** Conditional. */
  public static class IfThenElse extends Exp {
    public final Exp condition;
    public final Exp ifTrue;
    public final Exp ifFalse;
    /** Pattern that the condition tests for; for display only. */
    public final MatchInfo info;

    IfThenElse(Exp condition, Exp ifTrue, Exp ifFalse, MatchInfo info) {
      super(Op.IF_THEN_ELSE);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
      this.info = requireNonNull(info);
    }
  }

  /** Evaluates two expressions in order; the value is that of the second. */
  public static class Sequence extends Exp {
    public final Exp first;
    public final Exp second;

    Sequence(Exp first, Exp second) {
      super(Op.SEQUENCE);
      this.first = requireNonNull(first);
      this.second = requireNonNull(second);
    }
  }

  /** While loop. */
  public static class While extends Exp {
    public final Exp condition;
    public final Exp body;

    While(Exp condition, Exp body) {
      super(Op.WHILE);
      this.condition = requireNonNull(condition);
      this.body = requireNonNull(body);
    }
  }

  /** Counted loop; both bounds are inclusive. */
  public static class For extends Exp {
    public final Ident id;
    public final Exp lo;
    public final Exp hi;
    public final Direction direction;
    public final Exp body;

    For(Ident id, Exp lo, Exp hi, Direction direction, Exp body) {
      super(Op.FOR);
      this.id = requireNonNull(id);
      this.lo = requireNonNull(lo);
      this.hi = requireNonNull(hi);
      this.direction = requireNonNull(direction);
      this.body = requireNonNull(body);
    }
  }

  /** Assignment to a variable bound by a {@link Let} of kind
   * {@link LetKind#VARIABLE}. */
  public static class Assign extends Exp {
    public final Ident id;
    public final Exp exp;

    Assign(Ident id, Exp exp) {
      super(Op.ASSIGN);
      this.id = requireNonNull(id);
      this.exp = requireNonNull(exp);
    }
  }

  /** Method call on an object. */
  public static class Send extends Exp {
    public final MethKind kind;
    /** Method selector. */
    public final Exp method;
    /** Receiver. */
    public final Exp obj;
    public final List<Exp> args;

    Send(MethKind kind, Exp method, Exp obj, ImmutableList<Exp> args) {
      super(Op.SEND);
      this.kind = requireNonNull(kind);
      this.method = requireNonNull(method);
      this.obj = requireNonNull(obj);
      this.args = requireNonNull(args);
    }
  }

  /** Kind of a debug {@link Event}. */
  public static class EventKind {
    /** Before a call. */
    public static final EventKind BEFORE = new EventKind(Flavor.BEFORE, null);
    /** After a call. */
    public static final EventKind AFTER = new EventKind(Flavor.AFTER, null);
    /** Start of the body of a function. */
    public static final EventKind FUNCTION =
        new EventKind(Flavor.FUNCTION, null);
    public static final EventKind PSEUDO = new EventKind(Flavor.PSEUDO, null);

    public final Flavor flavor;
    /** Module being defined, if {@link Flavor#MODULE_DEFINITION}. */
    public final @Nullable Ident module;

    private EventKind(Flavor flavor, @Nullable Ident module) {
      this.flavor = requireNonNull(flavor);
      this.module = module;
    }

    /** Creates the kind of event that marks the definition of a module. */
    public static EventKind moduleDefinition(Ident module) {
      return new EventKind(Flavor.MODULE_DEFINITION, requireNonNull(module));
    }

    /** Sub-types of {@link EventKind}. */
    public enum Flavor {
      BEFORE,
      AFTER,
      FUNCTION,
      PSEUDO,
      MODULE_DEFINITION
    }
  }

  /** Expression wrapped in a debug event. */
  public static class Event extends Exp {
    public final Exp exp;
    public final EventKind kind;
    public final Location location;

    Event(Exp exp, EventKind kind, Location location) {
      super(Op.EVENT);
      this.exp = requireNonNull(exp);
      this.kind = requireNonNull(kind);
      this.location = requireNonNull(location);
    }
  }

  /** Expression that is only needed if a variable is used. */
  public static class IfUsed extends Exp {
    public final Ident id;
    public final Exp exp;

    IfUsed(Ident id, Exp exp) {
      super(Op.IF_USED);
      this.id = requireNonNull(id);
      this.exp = requireNonNull(exp);
    }
  }

  /** Compiled compilation unit. */
  public static class Program {
    public final Ident compilationUnit;
    /** Number of fields in the block that holds the unit's globals. */
    public final int mainModuleBlockSize;
    /** Compilation units that must be initialized before this one. */
    public final SortedSet<Ident> requiredGlobals;
    public final Exp code;

    Program(Ident compilationUnit, int mainModuleBlockSize,
        ImmutableSortedSet<Ident> requiredGlobals, Exp code) {
      this.compilationUnit = requireNonNull(compilationUnit);
      this.mainModuleBlockSize = mainModuleBlockSize;
      this.requiredGlobals = requireNonNull(requiredGlobals);
      this.code = requireNonNull(code);
      checkArgument(mainModuleBlockSize >= 0, "negative block size %s",
          mainModuleBlockSize);
    }

    /** Converts this program into text; the same as the text of its
     * code. */
    @Override public String toString() {
      return Printers.program(this);
    }
  }
}

// End Lambda.java
