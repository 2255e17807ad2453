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
import java.util.List;

import gclverify.io.GclFilePrinter;

/**
 * The typed abstract syntax tree produced by elaboration. This has the same
 * shape as {@link GclFile}, except that every expression additionally carries
 * its resolved type. A typed tree is constructed once per elaboration and is
 * never mutated afterwards. The weakest precondition engine builds new
 * predicates using the constructors at the bottom of this class.
 */
public class TypedFile {

	public static class Program extends GclFile.AbstractItem {
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

	public interface Definition extends GclFile.Item {

		public static class TypeDefn extends GclFile.AbstractItem implements Definition {
			private final Name name;
			private final List<Name> parameters;
			private final List<GclFile.TypeDefnCtor> constructors;

			public TypeDefn(Name name, List<Name> parameters, List<GclFile.TypeDefnCtor> constructors, Loc loc) {
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

			public List<GclFile.TypeDefnCtor> getConstructors() {
				return constructors;
			}
		}

		public static class FuncDefnSig extends GclFile.AbstractItem implements Definition {
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

			public Expr getProperty() {
				return property;
			}
		}

		public static class FuncDefn extends GclFile.AbstractItem implements Definition {
			private final Name name;
			private final Expr body;

			public FuncDefn(Name name, Expr body, Loc loc) {
				super(loc);
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

	// =========================================================================
	// Declarations
	// =========================================================================

	public static class Declaration extends GclFile.AbstractItem {
		private final boolean constant;
		private final List<Name> names;
		private final Type type;
		private final Expr property;

		public Declaration(boolean constant, List<Name> names, Type type, Expr property, Loc loc) {
			super(loc);
			this.constant = constant;
			this.names = names;
			this.type = type;
			this.property = property;
		}

		public boolean isConstant() {
			return constant;
		}

		public List<Name> getNames() {
			return names;
		}

		public Type getType() {
			return type;
		}

		public Expr getProperty() {
			return property;
		}
	}

	// =========================================================================
	// Statements
	// =========================================================================

	public interface Stmt extends GclFile.Item {

		public static class Skip extends GclFile.AbstractItem implements Stmt {
			public Skip(Loc loc) {
				super(loc);
			}
		}

		public static class Abort extends GclFile.AbstractItem implements Stmt {
			public Abort(Loc loc) {
				super(loc);
			}
		}

		public static class Assign extends GclFile.AbstractItem implements Stmt {
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

		public static class AAssign extends GclFile.AbstractItem implements Stmt {
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

		public static class Assert extends GclFile.AbstractItem implements Stmt {
			private final Expr condition;

			public Assert(Expr condition, Loc loc) {
				super(loc);
				this.condition = condition;
			}

			public Expr getCondition() {
				return condition;
			}
		}

		public static class LoopInvariant extends GclFile.AbstractItem implements Stmt {
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
			 * Get the bound, or <code>null</code> if none was given.
			 *
			 * @return
			 */
			public Expr getBound() {
				return bound;
			}
		}

		public static class Do extends GclFile.AbstractItem implements Stmt {
			private final List<GdCmd> commands;

			public Do(List<GdCmd> commands, Loc loc) {
				super(loc);
				this.commands = commands;
			}

			public List<GdCmd> getCommands() {
				return commands;
			}
		}

		public static class If extends GclFile.AbstractItem implements Stmt {
			private final List<GdCmd> commands;

			public If(List<GdCmd> commands, Loc loc) {
				super(loc);
				this.commands = commands;
			}

			public List<GdCmd> getCommands() {
				return commands;
			}
		}

		public static class Spec extends GclFile.AbstractItem implements Stmt {
			private final String text;

			public Spec(String text, Loc range) {
				super(range);
				this.text = text;
			}

			public String getText() {
				return text;
			}
		}

		public static class Proof extends GclFile.AbstractItem implements Stmt {
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

		public static class Alloc extends GclFile.AbstractItem implements Stmt {
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

		public static class HLookup extends GclFile.AbstractItem implements Stmt {
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

		public static class HMutate extends GclFile.AbstractItem implements Stmt {
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

		public static class Dispose extends GclFile.AbstractItem implements Stmt {
			private final Expr expr;

			public Dispose(Expr expr, Loc loc) {
				super(loc);
				this.expr = expr;
			}

			public Expr getExpr() {
				return expr;
			}
		}

		public static class Block extends GclFile.AbstractItem implements Stmt {
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

	public static class GdCmd extends GclFile.AbstractItem {
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

	public interface Expr extends GclFile.Item {
		/**
		 * Get the resolved type of this expression.
		 *
		 * @return
		 */
		public Type getType();

		public static abstract class AbstractExpr extends GclFile.AbstractItem implements Expr {
			private final Type type;

			public AbstractExpr(Type type, Loc loc) {
				super(loc);
				this.type = type;
			}

			@Override
			public Type getType() {
				return type;
			}

			@Override
			public String toString() {
				return GclFilePrinter.toString(this);
			}
		}

		public static class Lit extends AbstractExpr {
			private final gclverify.core.Lit value;

			public Lit(gclverify.core.Lit value, Type type, Loc loc) {
				super(type, loc);
				this.value = value;
			}

			public gclverify.core.Lit getValue() {
				return value;
			}
		}

		public static class Var extends AbstractExpr {
			private final Name name;

			public Var(Name name, Type type, Loc loc) {
				super(type, loc);
				this.name = name;
			}

			public Name getName() {
				return name;
			}
		}

		public static class Const extends AbstractExpr {
			private final Name name;

			public Const(Name name, Type type, Loc loc) {
				super(type, loc);
				this.name = name;
			}

			public Name getName() {
				return name;
			}
		}

		public static class Op extends AbstractExpr {
			private final Operator operator;

			public Op(Operator operator, Type type) {
				super(type, operator.getLoc());
				this.operator = operator;
			}

			public Operator getOperator() {
				return operator;
			}
		}

		public static class Chain extends AbstractExpr {
			private final TypedFile.Chain chain;

			public Chain(TypedFile.Chain chain, Type type) {
				super(type, chain.getLoc());
				this.chain = chain;
			}

			public TypedFile.Chain getChain() {
				return chain;
			}
		}

		public static class App extends AbstractExpr {
			private final Expr function;
			private final Expr argument;

			public App(Expr function, Expr argument, Type type, Loc loc) {
				super(type, loc);
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

		public static class Lam extends AbstractExpr {
			private final Name parameter;
			private final Type parameterType;
			private final Expr body;

			public Lam(Name parameter, Type parameterType, Expr body, Type type, Loc loc) {
				super(type, loc);
				this.parameter = parameter;
				this.parameterType = parameterType;
				this.body = body;
			}

			public Name getParameter() {
				return parameter;
			}

			public Type getParameterType() {
				return parameterType;
			}

			public Expr getBody() {
				return body;
			}
		}

		public static class Quant extends AbstractExpr {
			private final Expr quantifier;
			private final List<Name> bound;
			private final Expr range;
			private final Expr body;

			public Quant(Expr quantifier, List<Name> bound, Expr range, Expr body, Type type, Loc loc) {
				super(type, loc);
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

		public static class ArrIdx extends AbstractExpr {
			private final Expr array;
			private final Expr index;

			public ArrIdx(Expr array, Expr index, Type type, Loc loc) {
				super(type, loc);
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

		public static class ArrUpd extends AbstractExpr {
			private final Expr array;
			private final Expr index;
			private final Expr value;

			public ArrUpd(Expr array, Expr index, Expr value, Type type, Loc loc) {
				super(type, loc);
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
	}

	// =========================================================================
	// Chains
	// =========================================================================

	public interface Chain extends GclFile.Item {

		public static class Pure extends GclFile.AbstractItem implements Chain {
			private final Expr expr;

			public Pure(Expr expr) {
				super(expr.getLoc());
				this.expr = expr;
			}

			public Expr getExpr() {
				return expr;
			}
		}

		public static class More extends GclFile.AbstractItem implements Chain {
			private final Chain chain;
			private final Expr.Op operator;
			private final Expr expr;

			public More(Chain chain, Expr.Op operator, Expr expr, Loc loc) {
				super(loc);
				this.chain = chain;
				this.operator = operator;
				this.expr = expr;
			}

			public Chain getChain() {
				return chain;
			}

			public Expr.Op getOperator() {
				return operator;
			}

			public Expr getExpr() {
				return expr;
			}
		}

		/**
		 * Get the right-most operand of a chain.
		 *
		 * @param chain
		 * @return
		 */
		public static Expr last(Chain chain) {
			if (chain instanceof Pure) {
				return ((Pure) chain).getExpr();
			} else {
				return ((More) chain).getExpr();
			}
		}
	}

	// =========================================================================
	// Constructors
	// =========================================================================

	private static final Type BOOL_OP = Type.FUNC(Type.BOOL, Type.BOOL, Type.BOOL);
	private static final Type INT_OP = Type.FUNC(Type.INT, Type.INT, Type.INT);
	private static final Type INT_REL = Type.FUNC(Type.INT, Type.INT, Type.BOOL);

	public static final Expr.Lit TRUE = new Expr.Lit(gclverify.core.Lit.TRUE, Type.BOOL, Loc.NONE);
	public static final Expr.Lit FALSE = new Expr.Lit(gclverify.core.Lit.FALSE, Type.BOOL, Loc.NONE);

	public static Expr.Lit NUMBER(int n) {
		return new Expr.Lit(gclverify.core.Lit.num(n), Type.INT, Loc.NONE);
	}

	public static Expr.Var VAR(String name, Type type) {
		return new Expr.Var(new Name(name), type, Loc.NONE);
	}

	public static Expr.Var VAR(Name name, Type type) {
		return new Expr.Var(name, type, Loc.NONE);
	}

	public static Expr.Op OP(Operator.Symbol symbol, Type type) {
		return new Expr.Op(new Operator(symbol), type);
	}

	/**
	 * Construct the application of a binary operator with the given type, i.e.
	 * <code>App(App(Op, lhs), rhs)</code>.
	 *
	 * @param symbol
	 * @param type
	 * @param lhs
	 * @param rhs
	 * @return
	 */
	public static Expr BINOP(Operator.Symbol symbol, Type type, Expr lhs, Expr rhs) {
		Type partial = Type.codomain(type);
		Expr left = new Expr.App(OP(symbol, type), lhs, partial, lhs.getLoc());
		return new Expr.App(left, rhs, Type.codomain(partial), lhs.getLoc().join(rhs.getLoc()));
	}

	public static Expr CONJ(Expr lhs, Expr rhs) {
		return BINOP(Operator.Symbol.CONJ, BOOL_OP, lhs, rhs);
	}

	public static Expr DISJ(Expr lhs, Expr rhs) {
		return BINOP(Operator.Symbol.DISJ, BOOL_OP, lhs, rhs);
	}

	public static Expr IMPLIES(Expr lhs, Expr rhs) {
		return BINOP(Operator.Symbol.IMPLIES, BOOL_OP, lhs, rhs);
	}

	public static Expr SCONJ(Expr lhs, Expr rhs) {
		return BINOP(Operator.Symbol.SCONJ, BOOL_OP, lhs, rhs);
	}

	public static Expr SIMP(Expr lhs, Expr rhs) {
		return BINOP(Operator.Symbol.SIMP, BOOL_OP, lhs, rhs);
	}

	public static Expr POINTS_TO(Expr lhs, Expr rhs) {
		return BINOP(Operator.Symbol.POINTS_TO, INT_REL, lhs, rhs);
	}

	public static Expr ADD(Expr lhs, Expr rhs) {
		return BINOP(Operator.Symbol.ADD, INT_OP, lhs, rhs);
	}

	public static Expr LT(Expr lhs, Expr rhs) {
		return BINOP(Operator.Symbol.LT, INT_REL, lhs, rhs);
	}

	public static Expr GTE(Expr lhs, Expr rhs) {
		return BINOP(Operator.Symbol.GTE, INT_REL, lhs, rhs);
	}

	public static Expr EQ(Expr lhs, Expr rhs) {
		Type t = lhs.getType();
		return BINOP(Operator.Symbol.EQ, Type.FUNC(t, t, Type.BOOL), lhs, rhs);
	}

	public static Expr NEG(Expr operand) {
		Expr.Op op = OP(Operator.Symbol.NEG, Type.FUNC(Type.BOOL, Type.BOOL));
		return new Expr.App(op, operand, Type.BOOL, operand.getLoc());
	}

	/**
	 * Construct the conjunction of zero or more predicates. The empty conjunction
	 * is <code>true</code>.
	 *
	 * @param operands
	 * @return
	 */
	public static Expr CONJUNCT(List<Expr> operands) {
		return fold(Operator.Symbol.CONJ, operands, TRUE);
	}

	/**
	 * Construct the disjunction of zero or more predicates. The empty disjunction
	 * is <code>false</code>.
	 *
	 * @param operands
	 * @return
	 */
	public static Expr DISJUNCT(List<Expr> operands) {
		return fold(Operator.Symbol.DISJ, operands, FALSE);
	}

	/**
	 * Construct the separating conjunction of one or more heap predicates.
	 *
	 * @param operands
	 * @return
	 */
	public static Expr SCONJUNCT(List<Expr> operands) {
		return fold(Operator.Symbol.SCONJ, operands, new Expr.Lit(gclverify.core.Lit.EMP, Type.BOOL, Loc.NONE));
	}

	public static Expr FORALL(List<Name> bound, Expr range, Expr body) {
		return new Expr.Quant(OP(Operator.Symbol.CONJ, BOOL_OP), bound, range, body, Type.BOOL, body.getLoc());
	}

	public static Expr EXISTS(List<Name> bound, Expr range, Expr body) {
		return new Expr.Quant(OP(Operator.Symbol.DISJ, BOOL_OP), bound, range, body, Type.BOOL, body.getLoc());
	}

	public static Expr FORALL(Name bound, Expr body) {
		return FORALL(Arrays.asList(bound), TRUE, body);
	}

	public static Expr EXISTS(Name bound, Expr body) {
		return EXISTS(Arrays.asList(bound), TRUE, body);
	}

	private static Expr fold(Operator.Symbol symbol, List<Expr> operands, Expr empty) {
		if (operands.isEmpty()) {
			return empty;
		}
		Expr r = operands.get(0);
		for (int i = 1; i < operands.size(); ++i) {
			r = BINOP(symbol, BOOL_OP, r, operands.get(i));
		}
		return r;
	}
}
