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
package gclverify.types;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gclverify.core.GclFile;
import gclverify.core.Kind;
import gclverify.core.Loc;
import gclverify.core.Name;
import gclverify.core.Operator;
import gclverify.core.Type;
import gclverify.core.TypedFile;
import gclverify.core.UnsupportedConstruct;
import gclverify.util.FreshNames;
import gclverify.util.Util;

/**
 * <p>
 * Responsible for turning a <code>GclFile</code> into a <code>TypedFile</code>
 * by inferring a type for every expression. Inference follows Algorithm W:
 * each expression is elaborated to a type together with a substitution, and
 * substitutions are composed as elaboration proceeds left to right.
 * </p>
 * <p>
 * Type variables come in two flavours. A <code>Var</code> is a unification
 * variable which stands for some unknown (but fixed) type. A
 * <code>MetaVar</code> appears in the type of a polymorphic definition and is
 * replaced with a fresh <code>Var</code> on every use of that definition.
 * </p>
 * <p>
 * An elaborator carries the state of a single elaboration (fresh names, the
 * kind context and the type environment) and should not be reused across
 * programs.
 * </p>
 */
public class Elaborator {
	private static final Logger LOGGER = LoggerFactory.getLogger(Elaborator.class);

	private static final Type.MetaVar ALPHA = new Type.MetaVar(new Name("a"));

	private final FreshNames fresh;
	private final KindInference kinds;
	private TypeEnvironment environment;

	public Elaborator() {
		this(new FreshNames());
	}

	public Elaborator(FreshNames fresh) {
		this.fresh = fresh;
		this.kinds = new KindInference(fresh);
		this.environment = TypeEnvironment.EMPTY;
	}

	/**
	 * Get the environment of all top-level names. This is only populated once a
	 * program has been elaborated.
	 *
	 * @return
	 */
	public TypeEnvironment getEnvironment() {
		return environment;
	}

	/**
	 * Get the kinds inferred for each datatype.
	 *
	 * @return
	 */
	public Map<Name, Kind> getKinds() {
		return kinds.getKinds();
	}

	public FreshNames getFreshNames() {
		return fresh;
	}

	// =========================================================================
	// Program
	// =========================================================================

	public TypedFile.Program elaborate(GclFile.Program program) throws TypeError, UnsupportedConstruct {
		environment = collectIds(program.getDefinitions(), program.getDeclarations(), environment);
		LOGGER.debug("collected {} identifiers", environment.size());
		TypeEnvironment env = environment;
		ArrayList<TypedFile.Definition> defns = new ArrayList<>();
		for (GclFile.Definition d : program.getDefinitions()) {
			defns.add(elaborateDefinition(d, env));
		}
		ArrayList<TypedFile.Declaration> decls = new ArrayList<>();
		for (GclFile.Declaration d : program.getDeclarations()) {
			TypedFile.Expr property = d.getProperty() == null ? null : check(d.getProperty(), env, Type.BOOL);
			decls.add(new TypedFile.Declaration(d instanceof GclFile.Declaration.ConstDecl, d.getNames(), d.getType(),
					property, d.getLoc()));
		}
		ArrayList<TypedFile.Expr> properties = new ArrayList<>();
		for (GclFile.Expr e : program.getProperties()) {
			properties.add(check(e, env, Type.BOOL));
		}
		List<TypedFile.Stmt> stmts = elaborateStatements(program.getStatements(), env);
		return new TypedFile.Program(defns, decls, properties, stmts, program.getLoc());
	}

	/**
	 * Populate the type environment with every top-level name before anything is
	 * type checked, so that names can be used before they are defined.
	 * Definitions of functions are elaborated together so they may be mutually
	 * recursive, and then generalised.
	 *
	 * @param definitions
	 * @param declarations
	 * @param env
	 * @return
	 * @throws TypeError
	 * @throws UnsupportedConstruct
	 */
	public TypeEnvironment collectIds(List<GclFile.Definition> definitions, List<GclFile.Declaration> declarations,
			TypeEnvironment env) throws TypeError, UnsupportedConstruct {
		ArrayList<Name> declared = new ArrayList<>();
		for (GclFile.Declaration d : declarations) {
			declared.addAll(d.getNames());
		}
		checkDuplicates(declared);
		for (GclFile.Declaration d : declarations) {
			for (Name n : d.getNames()) {
				if (d instanceof GclFile.Declaration.ConstDecl) {
					env = env.extend(n, new TypeInfo.Const(d.getType()));
				} else {
					env = env.extend(n, new TypeInfo.Var(d.getType()));
				}
			}
		}
		// Split definitions by sort
		ArrayList<GclFile.Definition.TypeDefn> types = new ArrayList<>();
		ArrayList<GclFile.Definition.FuncDefnSig> sigs = new ArrayList<>();
		ArrayList<GclFile.Definition.FuncDefn> funcs = new ArrayList<>();
		for (GclFile.Definition d : definitions) {
			if (d instanceof GclFile.Definition.TypeDefn) {
				types.add((GclFile.Definition.TypeDefn) d);
			} else if (d instanceof GclFile.Definition.FuncDefnSig) {
				sigs.add((GclFile.Definition.FuncDefnSig) d);
			} else {
				funcs.add((GclFile.Definition.FuncDefn) d);
			}
		}
		ArrayList<Name> ctorNames = new ArrayList<>();
		ArrayList<Name> typeNames = new ArrayList<>();
		for (GclFile.Definition.TypeDefn t : types) {
			typeNames.add(t.getName());
			for (GclFile.TypeDefnCtor c : t.getConstructors()) {
				ctorNames.add(c.getName());
			}
		}
		ArrayList<Name> sigNames = new ArrayList<>(ctorNames);
		for (GclFile.Definition.FuncDefnSig s : sigs) {
			sigNames.add(s.getName());
		}
		ArrayList<Name> funcNames = new ArrayList<>(ctorNames);
		for (GclFile.Definition.FuncDefn f : funcs) {
			funcNames.add(f.getName());
		}
		checkDuplicates(typeNames);
		checkDuplicates(sigNames);
		checkDuplicates(funcNames);
		// Datatypes come first, since signatures may refer to them
		if (!types.isEmpty()) {
			Map<Name, Type> ctors = kinds.inferDataTypes(types);
			for (Map.Entry<Name, Type> e : ctors.entrySet()) {
				env = env.extend(e.getKey(), new TypeInfo.TypeDefnCtor(e.getValue()));
			}
		}
		for (GclFile.Declaration d : declarations) {
			kinds.checkStar(d.getType());
		}
		LinkedHashMap<Name, Type> signatures = new LinkedHashMap<>();
		for (GclFile.Definition.FuncDefnSig s : sigs) {
			kinds.checkStar(s.getType());
			signatures.put(s.getName(), s.getType());
			env = env.extend(s.getName(), new TypeInfo.Const(s.getType()));
		}
		if (funcs.isEmpty()) {
			return env;
		}
		final TypeEnvironment ambient = env;
		ArrayList<Type> placeholders = new ArrayList<>();
		for (GclFile.Definition.FuncDefn f : funcs) {
			Type.Var v = freshVar(f.getName().getLoc());
			placeholders.add(v);
			env = env.extend(f.getName(), new TypeInfo.Const(v));
		}
		// Elaborate bodies left to right, threading the substitution through
		ArrayList<Type> inferred = new ArrayList<>();
		for (int i = 0; i != funcs.size(); ++i) {
			GclFile.Definition.FuncDefn f = funcs.get(i);
			Elaborated<TypedFile.Expr> e = elaborate(f.getBody(), env);
			Substitution s = e.getSubstitution();
			Type placeholder = s.apply(env.lookup(f.getName()).getType());
			s = Unifier.unify(placeholder, e.getType(), f.getName().getLoc()).compose(s);
			Type type = s.apply(e.getType());
			Type sig = signatures.get(f.getName());
			if (sig != null) {
				s = Unifier.unify(type, sig, f.getName().getLoc()).compose(s);
				type = sig;
			} else {
				type = s.apply(type);
			}
			env = env.apply(s);
			for (int j = 0; j != inferred.size(); ++j) {
				inferred.set(j, s.apply(inferred.get(j)));
			}
			inferred.add(type);
		}
		env = ambient;
		for (int i = 0; i != funcs.size(); ++i) {
			Type type = generalize(inferred.get(i), ambient);
			LOGGER.debug("inferred {} : {}", funcs.get(i).getName(), type);
			env = env.extend(funcs.get(i).getName(), new TypeInfo.Const(type));
		}
		return env;
	}

	private TypedFile.Definition elaborateDefinition(GclFile.Definition d, TypeEnvironment env)
			throws TypeError, UnsupportedConstruct {
		if (d instanceof GclFile.Definition.TypeDefn) {
			GclFile.Definition.TypeDefn t = (GclFile.Definition.TypeDefn) d;
			Set<Name> params = new HashSet<>(t.getParameters());
			for (GclFile.TypeDefnCtor c : t.getConstructors()) {
				for (Type arg : c.getArguments()) {
					for (Name n : Type.freeVars(arg)) {
						if (!params.contains(n)) {
							throw new TypeError.NotInScope(n);
						}
					}
				}
			}
			return new TypedFile.Definition.TypeDefn(t.getName(), t.getParameters(), t.getConstructors(), t.getLoc());
		} else if (d instanceof GclFile.Definition.FuncDefnSig) {
			GclFile.Definition.FuncDefnSig s = (GclFile.Definition.FuncDefnSig) d;
			TypedFile.Expr property = s.getProperty() == null ? null : check(s.getProperty(), env, Type.BOOL);
			return new TypedFile.Definition.FuncDefnSig(s.getName(), s.getType(), property, s.getLoc());
		} else {
			GclFile.Definition.FuncDefn f = (GclFile.Definition.FuncDefn) d;
			TypedFile.Expr body = elaborate(f.getBody(), env).getNode();
			return new TypedFile.Definition.FuncDefn(f.getName(), body, f.getLoc());
		}
	}

	// =========================================================================
	// Statements
	// =========================================================================

	public List<TypedFile.Stmt> elaborateStatements(List<GclFile.Stmt> stmts, TypeEnvironment env)
			throws TypeError, UnsupportedConstruct {
		ArrayList<TypedFile.Stmt> typed = new ArrayList<>();
		for (GclFile.Stmt s : stmts) {
			typed.add(elaborateStatement(s, env));
		}
		return typed;
	}

	public TypedFile.Stmt elaborateStatement(GclFile.Stmt stmt, TypeEnvironment env)
			throws TypeError, UnsupportedConstruct {
		if (stmt instanceof GclFile.Stmt.Skip) {
			return new TypedFile.Stmt.Skip(stmt.getLoc());
		} else if (stmt instanceof GclFile.Stmt.Abort) {
			return new TypedFile.Stmt.Abort(stmt.getLoc());
		} else if (stmt instanceof GclFile.Stmt.Assign) {
			return elaborateAssign((GclFile.Stmt.Assign) stmt, env);
		} else if (stmt instanceof GclFile.Stmt.AAssign) {
			GclFile.Stmt.AAssign s = (GclFile.Stmt.AAssign) stmt;
			GclFile.Expr upd = new GclFile.Expr.ArrUpd(s.getArray(), s.getIndex(), s.getValue(), s.getLoc());
			TypedFile.Expr.ArrUpd e = (TypedFile.Expr.ArrUpd) elaborate(upd, env).getNode();
			return new TypedFile.Stmt.AAssign(e.getArray(), e.getIndex(), e.getValue(), s.getLoc());
		} else if (stmt instanceof GclFile.Stmt.Assert) {
			GclFile.Stmt.Assert s = (GclFile.Stmt.Assert) stmt;
			return new TypedFile.Stmt.Assert(check(s.getCondition(), env, Type.BOOL), s.getLoc());
		} else if (stmt instanceof GclFile.Stmt.LoopInvariant) {
			GclFile.Stmt.LoopInvariant s = (GclFile.Stmt.LoopInvariant) stmt;
			TypedFile.Expr inv = check(s.getInvariant(), env, Type.BOOL);
			TypedFile.Expr bnd = s.getBound() == null ? null : check(s.getBound(), env, Type.INT);
			return new TypedFile.Stmt.LoopInvariant(inv, bnd, s.getLoc());
		} else if (stmt instanceof GclFile.Stmt.Do) {
			GclFile.Stmt.Do s = (GclFile.Stmt.Do) stmt;
			return new TypedFile.Stmt.Do(elaborateGdCmds(s.getCommands(), env), s.getLoc());
		} else if (stmt instanceof GclFile.Stmt.If) {
			GclFile.Stmt.If s = (GclFile.Stmt.If) stmt;
			return new TypedFile.Stmt.If(elaborateGdCmds(s.getCommands(), env), s.getLoc());
		} else if (stmt instanceof GclFile.Stmt.Spec) {
			GclFile.Stmt.Spec s = (GclFile.Stmt.Spec) stmt;
			return new TypedFile.Stmt.Spec(s.getText(), s.getLoc());
		} else if (stmt instanceof GclFile.Stmt.Proof) {
			GclFile.Stmt.Proof s = (GclFile.Stmt.Proof) stmt;
			return new TypedFile.Stmt.Proof(s.getAnchor(), s.getContents(), s.getLoc());
		} else if (stmt instanceof GclFile.Stmt.Alloc) {
			GclFile.Stmt.Alloc s = (GclFile.Stmt.Alloc) stmt;
			checkPointer(s.getVariable(), env);
			ArrayList<TypedFile.Expr> exprs = new ArrayList<>();
			for (GclFile.Expr e : s.getExprs()) {
				exprs.add(check(e, env, Type.INT));
			}
			return new TypedFile.Stmt.Alloc(s.getVariable(), exprs, s.getLoc());
		} else if (stmt instanceof GclFile.Stmt.HLookup) {
			GclFile.Stmt.HLookup s = (GclFile.Stmt.HLookup) stmt;
			checkPointer(s.getVariable(), env);
			return new TypedFile.Stmt.HLookup(s.getVariable(), check(s.getExpr(), env, Type.INT), s.getLoc());
		} else if (stmt instanceof GclFile.Stmt.HMutate) {
			GclFile.Stmt.HMutate s = (GclFile.Stmt.HMutate) stmt;
			TypedFile.Expr left = check(s.getLeft(), env, Type.INT);
			TypedFile.Expr right = check(s.getRight(), env, Type.INT);
			return new TypedFile.Stmt.HMutate(left, right, s.getLoc());
		} else if (stmt instanceof GclFile.Stmt.Dispose) {
			GclFile.Stmt.Dispose s = (GclFile.Stmt.Dispose) stmt;
			return new TypedFile.Stmt.Dispose(check(s.getExpr(), env, Type.INT), s.getLoc());
		} else if (stmt instanceof GclFile.Stmt.Block) {
			throw new UnsupportedConstruct("block", stmt.getLoc());
		} else {
			throw new IllegalArgumentException("unknown statement encountered (" + stmt.getClass().getName() + ")");
		}
	}

	private TypedFile.Stmt elaborateAssign(GclFile.Stmt.Assign stmt, TypeEnvironment env)
			throws TypeError, UnsupportedConstruct {
		List<Name> names = stmt.getNames();
		List<GclFile.Expr> exprs = stmt.getExprs();
		checkDuplicates(names);
		if (exprs.size() > names.size()) {
			throw new TypeError.RedundantExprs(exprs.subList(names.size(), exprs.size()));
		} else if (names.size() > exprs.size()) {
			throw new TypeError.RedundantNames(names.subList(exprs.size(), names.size()));
		}
		ArrayList<Type> types = new ArrayList<>();
		for (Name n : names) {
			types.add(checkAssign(n, env));
		}
		ArrayList<TypedFile.Expr> typed = new ArrayList<>();
		for (int i = 0; i != exprs.size(); ++i) {
			typed.add(check(exprs.get(i), env, types.get(i)));
		}
		return new TypedFile.Stmt.Assign(names, typed, stmt.getLoc());
	}

	private List<TypedFile.GdCmd> elaborateGdCmds(List<GclFile.GdCmd> cmds, TypeEnvironment env)
			throws TypeError, UnsupportedConstruct {
		ArrayList<TypedFile.GdCmd> typed = new ArrayList<>();
		for (GclFile.GdCmd c : cmds) {
			TypedFile.Expr guard = check(c.getGuard(), env, Type.BOOL);
			typed.add(new TypedFile.GdCmd(guard, elaborateStatements(c.getBody(), env), c.getLoc()));
		}
		return typed;
	}

	/**
	 * Determine the type of a name which is the target of an assignment. Only
	 * variables can be assigned.
	 *
	 * @param name
	 * @param env
	 * @return
	 * @throws TypeError
	 */
	private Type checkAssign(Name name, TypeEnvironment env) throws TypeError {
		TypeInfo info = env.lookup(name);
		if (info == null) {
			throw new TypeError.NotInScope(name);
		} else if (!(info instanceof TypeInfo.Var)) {
			throw new TypeError.AssignToConst(name);
		}
		return info.getType();
	}

	private void checkPointer(Name name, TypeEnvironment env) throws TypeError {
		Unifier.unify(checkAssign(name, env), Type.INT, name.getLoc());
	}

	// =========================================================================
	// Expressions
	// =========================================================================

	/**
	 * Elaborate an expression and require its type to unify with a given type.
	 *
	 * @param expr
	 * @param env
	 * @param expected
	 * @return
	 * @throws TypeError
	 * @throws UnsupportedConstruct
	 */
	public TypedFile.Expr check(GclFile.Expr expr, TypeEnvironment env, Type expected)
			throws TypeError, UnsupportedConstruct {
		Elaborated<TypedFile.Expr> e = elaborate(expr, env);
		Substitution s = Unifier.unify(e.getType(), e.getSubstitution().apply(expected), expr.getLoc());
		return s.apply(e.getNode());
	}

	public Elaborated<TypedFile.Expr> elaborate(GclFile.Expr expr, TypeEnvironment env)
			throws TypeError, UnsupportedConstruct {
		if (expr instanceof GclFile.Expr.Lit) {
			GclFile.Expr.Lit e = (GclFile.Expr.Lit) expr;
			Type type = new Type.Base(e.getValue().getTag(), e.getLoc());
			return new Elaborated<>(type, new TypedFile.Expr.Lit(e.getValue(), type, e.getLoc()), Substitution.EMPTY);
		} else if (expr instanceof GclFile.Expr.Var) {
			Name n = ((GclFile.Expr.Var) expr).getName();
			Type type = instantiate(lookup(n, env));
			return new Elaborated<>(type, new TypedFile.Expr.Var(n, type, expr.getLoc()), Substitution.EMPTY);
		} else if (expr instanceof GclFile.Expr.Const) {
			Name n = ((GclFile.Expr.Const) expr).getName();
			Type type = instantiate(lookup(n, env));
			return new Elaborated<>(type, new TypedFile.Expr.Const(n, type, expr.getLoc()), Substitution.EMPTY);
		} else if (expr instanceof GclFile.Expr.Op) {
			Operator op = ((GclFile.Expr.Op) expr).getOperator();
			Type type = instantiate(typeOf(op));
			return new Elaborated<>(type, new TypedFile.Expr.Op(op, type), Substitution.EMPTY);
		} else if (expr instanceof GclFile.Expr.Chain) {
			return elaborateChain(((GclFile.Expr.Chain) expr).getChain(), env);
		} else if (expr instanceof GclFile.Expr.App) {
			return elaborateApp((GclFile.Expr.App) expr, env);
		} else if (expr instanceof GclFile.Expr.Lam) {
			return elaborateLam((GclFile.Expr.Lam) expr, env);
		} else if (expr instanceof GclFile.Expr.Quant) {
			return elaborateQuant((GclFile.Expr.Quant) expr, env);
		} else if (expr instanceof GclFile.Expr.ArrIdx) {
			return elaborateArrIdx((GclFile.Expr.ArrIdx) expr, env);
		} else if (expr instanceof GclFile.Expr.ArrUpd) {
			return elaborateArrUpd((GclFile.Expr.ArrUpd) expr, env);
		} else if (expr instanceof GclFile.Expr.Tuple) {
			throw new UnsupportedConstruct("tuple", expr.getLoc());
		} else if (expr instanceof GclFile.Expr.Func) {
			throw new UnsupportedConstruct("function definition by cases", expr.getLoc());
		} else if (expr instanceof GclFile.Expr.Case) {
			throw new UnsupportedConstruct("case expression", expr.getLoc());
		} else {
			throw new IllegalArgumentException("unknown expression encountered (" + expr.getClass().getName() + ")");
		}
	}

	private Elaborated<TypedFile.Expr> elaborateApp(GclFile.Expr.App expr, TypeEnvironment env)
			throws TypeError, UnsupportedConstruct {
		Elaborated<TypedFile.Expr> fn = elaborate(expr.getFunction(), env);
		Substitution s1 = fn.getSubstitution();
		Elaborated<TypedFile.Expr> arg = elaborate(expr.getArgument(), env.apply(s1));
		Substitution s2 = arg.getSubstitution();
		Type.Var b = freshVar(expr.getLoc());
		Substitution s3 = Unifier.unify(s2.apply(fn.getType()), Type.FUNC(arg.getType(), b), expr.getLoc());
		Substitution s = s3.compose(s2).compose(s1);
		Type type = s3.apply(b);
		TypedFile.Expr node = new TypedFile.Expr.App(fn.getNode(), arg.getNode(), type, expr.getLoc());
		return new Elaborated<>(type, s.apply(node), s);
	}

	private Elaborated<TypedFile.Expr> elaborateLam(GclFile.Expr.Lam expr, TypeEnvironment env)
			throws TypeError, UnsupportedConstruct {
		Type.Var a = freshVar(expr.getParameter().getLoc());
		Elaborated<TypedFile.Expr> body = elaborate(expr.getBody(),
				env.extend(expr.getParameter(), new TypeInfo.Var(a)));
		Substitution s = body.getSubstitution();
		Type param = s.apply(a);
		Type type = Type.FUNC(param, body.getType());
		TypedFile.Expr node = new TypedFile.Expr.Lam(expr.getParameter(), param, body.getNode(), type, expr.getLoc());
		return new Elaborated<>(type, node, s);
	}

	private Elaborated<TypedFile.Expr> elaborateQuant(GclFile.Expr.Quant expr, TypeEnvironment env)
			throws TypeError, UnsupportedConstruct {
		List<Name> bound = expr.getBound();
		checkDuplicates(bound);
		GclFile.Expr quantifier = expr.getQuantifier();
		boolean counting = quantifier instanceof GclFile.Expr.Op
				&& ((GclFile.Expr.Op) quantifier).getOperator().is(Operator.Symbol.HASH);
		Elaborated<TypedFile.Expr> q = elaborate(quantifier, env);
		Substitution s = q.getSubstitution();
		Type.Var a = freshVar(expr.getLoc());
		if (!counting) {
			s = Unifier.unify(q.getType(), Type.FUNC(a, a, a), quantifier.getLoc()).compose(s);
		}
		ArrayList<Type> vars = new ArrayList<>();
		for (Name n : bound) {
			vars.add(freshVar(n.getLoc()));
		}
		TypeEnvironment inner = env.apply(s).extend(bound, vars);
		// Restriction
		Elaborated<TypedFile.Expr> range = elaborate(expr.getRange(), inner);
		s = range.getSubstitution().compose(s);
		s = Unifier.unify(range.getType(), Type.BOOL, expr.getRange().getLoc()).compose(s);
		// Body
		Elaborated<TypedFile.Expr> body = elaborate(expr.getBody(), inner.apply(s));
		s = body.getSubstitution().compose(s);
		Type expected = counting ? Type.BOOL : s.apply(a);
		s = Unifier.unify(body.getType(), expected, expr.getBody().getLoc()).compose(s);
		Type type = counting ? new Type.Base(Type.Base.Tag.INT, expr.getLoc()) : s.apply(a);
		TypedFile.Expr node = new TypedFile.Expr.Quant(q.getNode(), bound, range.getNode(), body.getNode(), type,
				expr.getLoc());
		return new Elaborated<>(type, s.apply(node), s);
	}

	private Elaborated<TypedFile.Expr> elaborateChain(GclFile.Chain chain, TypeEnvironment env)
			throws TypeError, UnsupportedConstruct {
		if (chain instanceof GclFile.Chain.Pure) {
			throw new UnsupportedConstruct("chain of length one", chain.getLoc());
		}
		GclFile.Chain.More more = (GclFile.Chain.More) chain;
		TypedFile.Chain left;
		Type leftType;
		Substitution s1;
		if (more.getChain() instanceof GclFile.Chain.Pure) {
			Elaborated<TypedFile.Expr> e = elaborate(((GclFile.Chain.Pure) more.getChain()).getExpr(), env);
			left = new TypedFile.Chain.Pure(e.getNode());
			leftType = e.getType();
			s1 = e.getSubstitution();
		} else {
			Elaborated<TypedFile.Expr> e = elaborateChain(more.getChain(), env);
			left = ((TypedFile.Expr.Chain) e.getNode()).getChain();
			leftType = TypedFile.Chain.last(left).getType();
			s1 = e.getSubstitution();
		}
		Elaborated<TypedFile.Expr> right = elaborate(more.getExpr(), env.apply(s1));
		Substitution s2 = right.getSubstitution();
		Type opType = instantiate(typeOf(more.getOperator()));
		Type.Var b = freshVar(more.getLoc());
		Substitution s3 = Unifier.unify(Type.FUNC(s2.apply(leftType), right.getType(), b), opType, more.getLoc());
		Substitution s = s3.compose(s2).compose(s1);
		Type type = s3.apply(b);
		TypedFile.Expr.Op op = new TypedFile.Expr.Op(more.getOperator(), opType);
		TypedFile.Chain node = new TypedFile.Chain.More(left, op, right.getNode(), more.getLoc());
		return new Elaborated<>(type, s.apply(new TypedFile.Expr.Chain(node, type)), s);
	}

	private Elaborated<TypedFile.Expr> elaborateArrIdx(GclFile.Expr.ArrIdx expr, TypeEnvironment env)
			throws TypeError, UnsupportedConstruct {
		Elaborated<TypedFile.Expr> arr = elaborate(expr.getArray(), env);
		Substitution s = arr.getSubstitution();
		Elaborated<TypedFile.Expr> index = elaborate(expr.getIndex(), env.apply(s));
		s = index.getSubstitution().compose(s);
		s = Unifier.unify(index.getType(), Type.INT, expr.getIndex().getLoc()).compose(s);
		Type.Var b = freshVar(expr.getLoc());
		s = Unifier.unify(s.apply(arr.getType()), Type.FUNC(Type.INT, b), expr.getLoc()).compose(s);
		Type type = s.apply(b);
		TypedFile.Expr node = new TypedFile.Expr.ArrIdx(arr.getNode(), index.getNode(), type, expr.getLoc());
		return new Elaborated<>(type, s.apply(node), s);
	}

	private Elaborated<TypedFile.Expr> elaborateArrUpd(GclFile.Expr.ArrUpd expr, TypeEnvironment env)
			throws TypeError, UnsupportedConstruct {
		Elaborated<TypedFile.Expr> arr = elaborate(expr.getArray(), env);
		Substitution s = arr.getSubstitution();
		Elaborated<TypedFile.Expr> index = elaborate(expr.getIndex(), env.apply(s));
		s = index.getSubstitution().compose(s);
		s = Unifier.unify(index.getType(), Type.INT, expr.getIndex().getLoc()).compose(s);
		Type.Var b = freshVar(expr.getLoc());
		s = Unifier.unify(s.apply(arr.getType()), Type.FUNC(Type.INT, b), expr.getArray().getLoc()).compose(s);
		Elaborated<TypedFile.Expr> value = elaborate(expr.getValue(), env.apply(s));
		s = value.getSubstitution().compose(s);
		s = Unifier.unify(value.getType(), s.apply(b), expr.getValue().getLoc()).compose(s);
		Type type = s.apply(arr.getType());
		TypedFile.Expr node = new TypedFile.Expr.ArrUpd(arr.getNode(), index.getNode(), value.getNode(), type,
				expr.getLoc());
		return new Elaborated<>(type, s.apply(node), s);
	}

	/**
	 * Determine the (possibly polymorphic) type of an operator.
	 *
	 * @param op
	 * @return
	 */
	public static Type typeOf(Operator op) {
		switch (op.getSymbol()) {
		case EQ:
		case NEQ:
		case NEQ_U:
			return Type.FUNC(ALPHA, ALPHA, Type.BOOL);
		case EQ_PROP:
		case EQ_PROP_U:
		case IMPLIES:
		case IMPLIES_U:
		case CONJ:
		case CONJ_U:
		case DISJ:
		case DISJ_U:
		case SCONJ:
		case SIMP:
			return Type.FUNC(Type.BOOL, Type.BOOL, Type.BOOL);
		case LTE:
		case LTE_U:
		case GTE:
		case GTE_U:
		case LT:
		case GT:
		case POINTS_TO:
			return Type.FUNC(Type.INT, Type.INT, Type.BOOL);
		case NEG:
		case NEG_U:
			return Type.FUNC(Type.BOOL, Type.BOOL);
		case NEG_NUM:
			return Type.FUNC(Type.INT, Type.INT);
		case HASH:
			return Type.FUNC(Type.BOOL, Type.INT);
		default:
			return Type.FUNC(Type.INT, Type.INT, Type.INT);
		}
	}

	// =========================================================================
	// Helpers
	// =========================================================================

	private Type lookup(Name name, TypeEnvironment env) throws TypeError {
		TypeInfo info = env.lookup(name);
		if (info == null) {
			throw new TypeError.NotInScope(name);
		}
		return info.getType();
	}

	/**
	 * Replace every metavariable in a type with a fresh unification variable.
	 *
	 * @param type
	 * @return
	 */
	public Type instantiate(Type type) {
		Set<Name> metas = Type.freeMetaVars(type);
		if (metas.isEmpty()) {
			return type;
		}
		LinkedHashMap<Name, Type> mapping = new LinkedHashMap<>();
		for (Name n : metas) {
			mapping.put(n, freshVar(n.getLoc()));
		}
		return Substitution.of(mapping).apply(type);
	}

	/**
	 * Replace every unification variable in a type which is not free in a given
	 * environment with a fresh metavariable.
	 *
	 * @param type
	 * @param env
	 * @return
	 */
	public Type generalize(Type type, TypeEnvironment env) {
		Set<Name> free = Type.freeVars(type);
		free.removeAll(env.freeVars());
		if (free.isEmpty()) {
			return type;
		}
		LinkedHashMap<Name, Type> mapping = new LinkedHashMap<>();
		for (Name n : free) {
			mapping.put(n, new Type.MetaVar(fresh.fresh("m", n.getLoc())));
		}
		return Substitution.of(mapping).apply(type);
	}

	private Type.Var freshVar(Loc loc) {
		return new Type.Var(fresh.fresh("t", loc));
	}

	private static void checkDuplicates(List<Name> names) throws TypeError {
		List<Name> dups = Util.duplicates(names);
		if (!dups.isEmpty()) {
			throw new TypeError.DuplicatedIdentifiers(dups);
		}
	}
}
