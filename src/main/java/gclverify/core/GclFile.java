// Copyright 2020 The GCL Verifier Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package gclverify.core;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * <p>
 * The untyped abstract syntax tree of a Guarded Command Language program, as
 * produced by the parser. Every item carries the source location it was parsed
 * from. Trees are treated as read-only input by the elaborator, which produces
 * a corresponding {@link TypedFile} tree.
 * </p>
 * <p>
 * Binary operator applications are curried, so <code>x + 1</code> is
 * represented as <code>App(App(Op(+), x), 1)</code>. Comparisons may be
 * chained (e.g. <code>0 ≤ i &lt; N</code>) and are represented using
 * {@link Chain}.
 * </p>
 */
public class GclFile {

	// =========================================================================
	// Top-Level Item
	// =========================================================================

	public interface Item {
		/**
		 * Get the source location of this item.
		 *
		 * @return
		 */
		public Loc getLoc();
	}

	public static class AbstractItem implements Item {
		private final Loc loc;

		public AbstractItem(Loc loc) {
			this.loc = loc == null ? Loc.NONE : loc;
		}

		@Override
		public Loc getLoc() {
			return loc;
		}
	}

	/**
	 * A complete program, consisting of definitions (datatypes and functions),
	 * declarations (constants and variables), global properties and the
	 * statements of the main body.
	 */
	public static class Program extends AbstractItem {
		private final List<Definition> definitions;
		private final List<Declaration> declarations;
		private final List<Expr> properties;
		private final List<Stmt> statements;

		public Program(List<Definition> definitions, List<Declaration> declarations, List<Expr> properties,
				List<Stmt> statements, Loc loc) {
			super(loc);
			this.definitions = definitions;
			this.declarations = declarations;
			this.properties = properties;
			this.statements = statements;
		}

		public List<Definition> getDefinitions() {
			return definitions;
		}

		public List<Declaration> getDeclarations() {
			return declarations;
		}

		public List<Expr> getProperties() {
			return properties;
		}

		public List<Stmt> getStatements() {
			return statements;
		}
	}

	// =========================================================================
	// Definitions
	// =========================================================================

	public interface Definition extends Item {

		/**
		 * An algebraic datatype, such as
		 * <code>data List a = Nil | Cons a (List a)</code>.
		 */
		public static class TypeDefn extends AbstractItem implements Definition {
			private final Name name;
			private final List<Name> parameters;
			private final List<TypeDefnCtor> constructors;

			public TypeDefn(Name name, List<Name> parameters, List<TypeDefnCtor> constructors, Loc loc) {
				super(loc);
				this.name = name;
				this.parameters = parameters;
				this.constructors = constructors;
			}

			public Name getName() {
				return name;
			}

			public List<Name> getParameters() {
				return parameters;
			}

			public List<TypeDefnCtor> getConstructors() {
				return constructors;
			}
		}

		/**
		 * An explicit type signature for a function, with an optional property.
		 */
		public static class FuncDefnSig extends AbstractItem implements Definition {
			private final Name name;
			private final Type type;
			private final Expr property;

			public FuncDefnSig(Name name, Type type, Expr property, Loc loc) {
				super(loc);
				this.name = name;
				this.type = type;
				this.property = property;
			}

			public Name getName() {
				return name;
			}

			public Type getType() {
				return type;
			}

			/**
			 * Get the property of this signature, or <code>null</code> if none was given.
			 *
			 * @return
			 */
			public Expr getProperty() {
				return property;
			}
		}

		public static class FuncDefn extends AbstractItem implements Definition {
			private final Name name;
			private final Expr body;

			public FuncDefn(Name name, Expr body) {
				super(name.getLoc().join(body.getLoc()));
				this.name = name;
				this.body = body;
			}

			public Name getName() {
				return name;
			}

			public Expr getBody() {
				return body;
			}
		}
	}

	/**
	 * A single constructor of a datatype, e.g. <code>Cons a (List a)</code>.
	 */
	public static class TypeDefnCtor extends AbstractItem {
		private final Name name;
		private final List<Type> arguments;

		public TypeDefnCtor(Name name, List<Type> arguments) {
			super(name.getLoc());
			this.name = name;
			this.arguments = arguments;
		}

		public Name getName() {
			return name;
		}

		public List<Type> getArguments() {
			return arguments;
		}
	}

	// =========================================================================
	// Declarations
	// =========================================================================

	public static abstract class Declaration extends AbstractItem {
		private final List<Name> names;
		private final Type type;
		private final Expr property;

		public Declaration(List<Name> names, Type type, Expr property, Loc loc) {
			super(loc);
			this.names = names;
			this.type = type;
			this.property = property;
		}

		public List<Name> getNames() {
			return names;
		}

		public Type getType() {
			return type;
		}

		/**
		 * Get the property of this declaration, or <code>null</code> if none was given.
		 *
		 * @return
		 */
		public Expr getProperty() {
			return property;
		}

		public static class ConstDecl extends Declaration {
			public ConstDecl(List<Name> names, Type type, Expr property, Loc loc) {
				super(names, type, property, loc);
			}
		}

		public static class VarDecl extends Declaration {
			public VarDecl(List<Name> names, Type type, Expr property, Loc loc) {
				super(names, type, property, loc);
			}
		}
	}

	// =========================================================================
	// Statements
	// =========================================================================

	public interface Stmt extends Item {

		public static class Skip extends AbstractItem implements Stmt {
			public Skip(Loc loc) {
				super(loc);
			}
		}

		public static class Abort extends AbstractItem implements Stmt {
			public Abort(Loc loc) {
				super(loc);
			}
		}

		/**
		 * A simultaneous assignment, such as <code>x, y := y, x</code>.
		 */
		public static class Assign extends AbstractItem implements Stmt {
			private final List<Name> names;
			private final List<Expr> exprs;

			public Assign(List<Name> names, List<Expr> exprs, Loc loc) {
				super(loc);
				this.names = names;
				this.exprs = exprs;
			}

			public List<Name> getNames() {
				return names;
			}

			public List<Expr> getExprs() {
				return exprs;
			}
		}

		/**
		 * An array element assignment, such as <code>a[i] := e</code>.
		 */
		public static class AAssign extends AbstractItem implements Stmt {
			private final Expr array;
			private final Expr index;
			private final Expr value;

			public AAssign(Expr array, Expr index, Expr value, Loc loc) {
				super(loc);
				this.array = array;
				this.index = index;
				this.value = value;
			}

			public Expr getArray() {
				return array;
			}

			public Expr getIndex() {
				return index;
			}

			public Expr getValue() {
				return value;
			}
		}

		public static class Assert extends AbstractItem implements Stmt {
			private final Expr condition;

			public Assert(Expr condition, Loc loc) {
				super(loc);
				this.condition = condition;
			}

			public Expr getCondition() {
				return condition;
			}
		}

		/**
		 * A loop invariant with an optional bound, e.g.
		 * <code>{ 0 ≤ i ≤ N , bnd: N - i }</code>. This must immediately precede a
		 * loop.
		 */
		public static class LoopInvariant extends AbstractItem implements Stmt {
			private final Expr invariant;
			private final Expr bound;

			public LoopInvariant(Expr invariant, Expr bound, Loc loc) {
				super(loc);
				this.invariant = invariant;
				this.bound = bound;
			}

			public Expr getInvariant() {
				return invariant;
			}

			/**
			 * Get the bound of this invariant, or <code>null</code> if none was given.
			 *
			 * @return
			 */
			public Expr getBound() {
				return bound;
			}
		}

		public static class Do extends AbstractItem implements Stmt {
			private final List<GdCmd> commands;

			public Do(List<GdCmd> commands, Loc loc) {
				super(loc);
				this.commands = commands;
			}

			public List<GdCmd> getCommands() {
				return commands;
			}
		}

		public static class If extends AbstractItem implements Stmt {
			private final List<GdCmd> commands;

			public If(List<GdCmd> commands, Loc loc) {
				super(loc);
				this.commands = commands;
			}

			public List<GdCmd> getCommands() {
				return commands;
			}
		}

		/**
		 * A specification hole <code>[! ... !]</code> marking code yet to be written.
		 */
		public static class Spec extends AbstractItem implements Stmt {
			private final String text;

			public Spec(String text, Loc range) {
				super(range);
				this.text = text;
			}

			public String getText() {
				return text;
			}
		}

		/**
		 * An embedded proof block. This has no effect on the program.
		 */
		public static class Proof extends AbstractItem implements Stmt {
			private final String anchor;
			private final String contents;

			public Proof(String anchor, String contents, Loc range) {
				super(range);
				this.anchor = anchor;
				this.contents = contents;
			}

			public String getAnchor() {
				return anchor;
			}

			public String getContents() {
				return contents;
			}
		}

		/**
		 * Heap allocation <code>x := new (e0, e1, ...)</code>.
		 */
		public static class Alloc extends AbstractItem implements Stmt {
			private final Name variable;
			private final List<Expr> exprs;

			public Alloc(Name variable, List<Expr> exprs, Loc loc) {
				super(loc);
				this.variable = variable;
				this.exprs = exprs;
			}

			public Name getVariable() {
				return variable;
			}

			public List<Expr> getExprs() {
				return exprs;
			}
		}

		/**
		 * Heap read <code>x := *e</code>.
		 */
		public static class HLookup extends AbstractItem implements Stmt {
			private final Name variable;
			private final Expr expr;

			public HLookup(Name variable, Expr expr, Loc loc) {
				super(loc);
				this.variable = variable;
				this.expr = expr;
			}

			public Name getVariable() {
				return variable;
			}

			public Expr getExpr() {
				return expr;
			}
		}

		/**
		 * Heap write <code>*e1 := e2</code>.
		 */
		public static class HMutate extends AbstractItem implements Stmt {
			private final Expr left;
			private final Expr right;

			public HMutate(Expr left, Expr right, Loc loc) {
				super(loc);
				this.left = left;
				this.right = right;
			}

			public Expr getLeft() {
				return left;
			}

			public Expr getRight() {
				return right;
			}
		}

		public static class Dispose extends AbstractItem implements Stmt {
			private final Expr expr;

			public Dispose(Expr expr, Loc loc) {
				super(loc);
				this.expr = expr;
			}

			public Expr getExpr() {
				return expr;
			}
		}

		/**
		 * A nested block with its own local declarations.
		 */
		public static class Block extends AbstractItem implements Stmt {
			private final Program program;

			public Block(Program program, Loc loc) {
				super(loc);
				this.program = program;
			}

			public Program getProgram() {
				return program;
			}
		}
	}

	/**
	 * A guarded command <code>g → S</code>, as found in <code>if</code> and
	 * <code>do</code> statements.
	 */
	public static class GdCmd extends AbstractItem {
		private final Expr guard;
		private final List<Stmt> body;

		public GdCmd(Expr guard, List<Stmt> body, Loc loc) {
			super(loc);
			this.guard = guard;
			this.body = body;
		}

		public Expr getGuard() {
			return guard;
		}

		public List<Stmt> getBody() {
			return body;
		}
	}

	// =========================================================================
	// Expressions
	// =========================================================================

	public interface Expr extends Item {

		public static class Lit extends AbstractItem implements Expr {
			private final gclverify.core.Lit value;

			public Lit(gclverify.core.Lit value, Loc loc) {
				super(loc);
				this.value = value;
			}

			public gclverify.core.Lit getValue() {
				return value;
			}
		}

		/**
		 * A reference to a variable (written in lower case).
		 */
		public static class Var extends AbstractItem implements Expr {
			private final Name name;

			public Var(Name name) {
				super(name.getLoc());
				this.name = name;
			}

			public Name getName() {
				return name;
			}
		}

		/**
		 * A reference to a constant, function or constructor.
		 */
		public static class Const extends AbstractItem implements Expr {
			private final Name name;

			public Const(Name name) {
				super(name.getLoc());
				this.name = name;
			}

			public Name getName() {
				return name;
			}
		}

		public static class Op extends AbstractItem implements Expr {
			private final Operator operator;

			public Op(Operator operator) {
				super(operator.getLoc());
				this.operator = operator;
			}

			public Operator getOperator() {
				return operator;
			}
		}

		public static class Chain extends AbstractItem implements Expr {
			private final GclFile.Chain chain;

			public Chain(GclFile.Chain chain) {
				super(chain.getLoc());
				this.chain = chain;
			}

			public GclFile.Chain getChain() {
				return chain;
			}
		}

		public static class App extends AbstractItem implements Expr {
			private final Expr function;
			private final Expr argument;

			public App(Expr function, Expr argument, Loc loc) {
				super(loc);
				this.function = function;
				this.argument = argument;
			}

			public Expr getFunction() {
				return function;
			}

			public Expr getArgument() {
				return argument;
			}
		}

		public static class Lam extends AbstractItem implements Expr {
			private final Name parameter;
			private final Expr body;

			public Lam(Name parameter, Expr body, Loc loc) {
				super(loc);
				this.parameter = parameter;
				this.body = body;
			}

			public Name getParameter() {
				return parameter;
			}

			public Expr getBody() {
				return body;
			}
		}

		/**
		 * A quantified expression <code>⟨⊕ i : R : B⟩</code>, where the quantifier
		 * <code>⊕</code> is an operator (e.g. <code>∧</code>, <code>+</code> or
		 * <code>#</code>) or a user-defined function.
		 */
		public static class Quant extends AbstractItem implements Expr {
			private final Expr quantifier;
			private final List<Name> bound;
			private final Expr range;
			private final Expr body;

			public Quant(Expr quantifier, List<Name> bound, Expr range, Expr body, Loc loc) {
				super(loc);
				this.quantifier = quantifier;
				this.bound = bound;
				this.range = range;
				this.body = body;
			}

			public Expr getQuantifier() {
				return quantifier;
			}

			public List<Name> getBound() {
				return bound;
			}

			public Expr getRange() {
				return range;
			}

			public Expr getBody() {
				return body;
			}
		}

		public static class ArrIdx extends AbstractItem implements Expr {
			private final Expr array;
			private final Expr index;

			public ArrIdx(Expr array, Expr index, Loc loc) {
				super(loc);
				this.array = array;
				this.index = index;
			}

			public Expr getArray() {
				return array;
			}

			public Expr getIndex() {
				return index;
			}
		}

		/**
		 * A functional array update <code>(a : i ↦ e)</code>.
		 */
		public static class ArrUpd extends AbstractItem implements Expr {
			private final Expr array;
			private final Expr index;
			private final Expr value;

			public ArrUpd(Expr array, Expr index, Expr value, Loc loc) {
				super(loc);
				this.array = array;
				this.index = index;
				this.value = value;
			}

			public Expr getArray() {
				return array;
			}

			public Expr getIndex() {
				return index;
			}

			public Expr getValue() {
				return value;
			}
		}

		/**
		 * A tuple expression. Tuples are parsed but not yet supported by the
		 * elaborator.
		 */
		public static class Tuple extends AbstractItem implements Expr {
			private final List<Expr> elements;

			public Tuple(List<Expr> elements, Loc loc) {
				super(loc);
				this.elements = elements;
			}

			public List<Expr> getElements() {
				return elements;
			}
		}

		/**
		 * A function defined by several clauses. Not yet supported by the
		 * elaborator.
		 */
		public static class Func extends AbstractItem implements Expr {
			private final Name name;
			private final List<Expr> clauses;

			public Func(Name name, List<Expr> clauses, Loc loc) {
				super(loc);
				this.name = name;
				this.clauses = clauses;
			}

			public Name getName() {
				return name;
			}

			public List<Expr> getClauses() {
				return clauses;
			}
		}

		/**
		 * A pattern match. Not yet supported by the elaborator.
		 */
		public static class Case extends AbstractItem implements Expr {
			private final Expr scrutinee;
			private final List<Expr> clauses;

			public Case(Expr scrutinee, List<Expr> clauses, Loc loc) {
				super(loc);
				this.scrutinee = scrutinee;
				this.clauses = clauses;
			}

			public Expr getScrutinee() {
				return scrutinee;
			}

			public List<Expr> getClauses() {
				return clauses;
			}
		}
	}

	// =========================================================================
	// Chains
	// =========================================================================

	public interface Chain extends Item {

		public static class Pure extends AbstractItem implements Chain {
			private final Expr expr;

			public Pure(Expr expr) {
				super(expr.getLoc());
				this.expr = expr;
			}

			public Expr getExpr() {
				return expr;
			}
		}

		public static class More extends AbstractItem implements Chain {
			private final Chain chain;
			private final Operator operator;
			private final Expr expr;

			public More(Chain chain, Operator operator, Expr expr, Loc loc) {
				super(loc);
				this.chain = chain;
				this.operator = operator;
				this.expr = expr;
			}

			public Chain getChain() {
				return chain;
			}

			public Operator getOperator() {
				return operator;
			}

			public Expr getExpr() {
				return expr;
			}
		}
	}

	// =========================================================================
	// Constructors
	// =========================================================================

	public static Program PROGRAM(List<Stmt> stmts) {
		return new Program(Collections.emptyList(), Collections.emptyList(), Collections.emptyList(), stmts,
				Loc.NONE);
	}

	public static Program PROGRAM(List<Declaration> decls, List<Stmt> stmts) {
		return new Program(Collections.emptyList(), decls, Collections.emptyList(), stmts, Loc.NONE);
	}

	public static Declaration.VarDecl VAR(Type type, String... names) {
		return new Declaration.VarDecl(NAMES(names), type, null, Loc.NONE);
	}

	public static Declaration.ConstDecl CONST(Type type, String... names) {
		return new Declaration.ConstDecl(NAMES(names), type, null, Loc.NONE);
	}

	public static List<Name> NAMES(String... names) {
		Name[] ns = new Name[names.length];
		for (int i = 0; i != names.length; ++i) {
			ns[i] = new Name(names[i]);
		}
		return Arrays.asList(ns);
	}

	public static Expr NUMBER(int n) {
		return new Expr.Lit(gclverify.core.Lit.num(n), Loc.NONE);
	}

	public static Expr BOOL(boolean b) {
		return new Expr.Lit(gclverify.core.Lit.bool(b), Loc.NONE);
	}

	public static Expr VAR(String name) {
		return new Expr.Var(new Name(name));
	}

	public static Expr CONST(String name) {
		return new Expr.Const(new Name(name));
	}

	public static Expr OP(Operator.Symbol symbol) {
		return new Expr.Op(new Operator(symbol));
	}

	public static Expr APP(Expr function, Expr... arguments) {
		Expr r = function;
		for (int i = 0; i != arguments.length; ++i) {
			r = new Expr.App(r, arguments[i], Loc.NONE);
		}
		return r;
	}

	/**
	 * Construct a binary operator application <code>lhs op rhs</code>.
	 *
	 * @param symbol
	 * @param lhs
	 * @param rhs
	 * @return
	 */
	public static Expr BINOP(Operator.Symbol symbol, Expr lhs, Expr rhs) {
		return APP(OP(symbol), lhs, rhs);
	}

	/**
	 * Construct a comparison chain from alternating operands and operators, e.g.
	 * <code>CHAIN(a, LT, b, LTE, c)</code>.
	 *
	 * @param items
	 * @return
	 */
	public static Expr CHAIN(Object... items) {
		Chain chain = new Chain.Pure((Expr) items[0]);
		for (int i = 1; i < items.length; i += 2) {
			Operator op = new Operator((Operator.Symbol) items[i]);
			chain = new Chain.More(chain, op, (Expr) items[i + 1], Loc.NONE);
		}
		return new Expr.Chain(chain);
	}
}
