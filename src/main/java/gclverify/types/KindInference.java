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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gclverify.core.GclFile;
import gclverify.core.Kind;
import gclverify.core.Name;
import gclverify.core.Type;
import gclverify.util.FreshNames;

/**
 * Infers the kinds of types and of (possibly mutually recursive) datatype
 * definitions. This follows the algorithm of "Kind Inference for Datatypes"
 * by Xie, Eisenberg and Oliveira, operating over an ordered
 * {@link KindContext}.
 */
public class KindInference {
	private static final Logger LOGGER = LoggerFactory.getLogger(KindInference.class);

	private final FreshNames fresh;
	private final KindContext context;
	/**
	 * The kinds determined for each datatype processed so far.
	 */
	private final Map<Name, Kind> kinds = new LinkedHashMap<>();

	public KindInference(FreshNames fresh) {
		this(fresh, new KindContext());
	}

	public KindInference(FreshNames fresh, KindContext context) {
		this.fresh = fresh;
		this.context = context;
	}

	public KindContext getContext() {
		return context;
	}

	public Map<Name, Kind> getKinds() {
		return kinds;
	}

	/**
	 * Infer the kind of a given type. Named types must have been annotated in
	 * the context already.
	 *
	 * @param type
	 * @return
	 * @throws TypeError
	 */
	public Kind inferKind(Type type) throws TypeError {
		if (type instanceof Type.Base) {
			return new Kind.Star(type.getLoc());
		} else if (type instanceof Type.Array) {
			Type element = ((Type.Array) type).getElement();
			unifyKind(context.resolve(inferKind(element)), new Kind.Star(element.getLoc()));
			return new Kind.Star(type.getLoc());
		} else if (type instanceof Type.Tuple) {
			return fromArity(((Type.Tuple) type).getArity(), type);
		} else if (type instanceof Type.Arrow) {
			return fromArity(2, type);
		} else if (type instanceof Type.Named) {
			Name name = ((Type.Named) type).getName();
			Kind k = context.lookup(name);
			if (k == null) {
				throw new TypeError.UndefinedType(name);
			}
			return k;
		} else if (type instanceof Type.App) {
			Type.App t = (Type.App) type;
			Kind k1 = inferKind(t.getLeft());
			Kind k2 = inferKind(t.getRight());
			return inferKApp(context.resolve(k1), context.resolve(k2));
		} else {
			throw new IllegalArgumentException("unknown type encountered (" + type.getClass().getName() + ")");
		}
	}

	/**
	 * Check that a type given for a variable or a function has kind
	 * <code>*</code>. Type variables are taken to range over types of kind
	 * <code>*</code>.
	 *
	 * @param type
	 * @throws TypeError
	 */
	public void checkStar(Type type) throws TypeError {
		ArrayList<Name> annotated = new ArrayList<>();
		for (Name v : Type.freeVars(type)) {
			if (context.lookup(v) == null) {
				context.annotate(v, new Kind.Star(v.getLoc()));
				annotated.add(v);
			}
		}
		try {
			Kind k = inferKind(type);
			unifyKind(context.resolve(k), new Kind.Star(type.getLoc()));
		} finally {
			for (Name v : annotated) {
				context.remove(v);
			}
		}
	}

	/**
	 * Determine the kind resulting from applying a type of kind <code>k1</code>
	 * to one of kind <code>k2</code>.
	 *
	 * @param k1
	 * @param k2
	 * @return
	 * @throws TypeError
	 */
	public Kind inferKApp(Kind k1, Kind k2) throws TypeError {
		if (k1 instanceof Kind.Func) {
			Kind.Func f = (Kind.Func) k1;
			unifyKind(f.getFrom(), k2);
			return f.getTo();
		} else if (k1 instanceof Kind.MetaVar && context.isUnsolved(((Kind.MetaVar) k1).getName())) {
			Name a = ((Kind.MetaVar) k1).getName();
			Name a1 = fresh.fresh("k", a.getLoc());
			Name a2 = fresh.fresh("k", a.getLoc());
			int index = context.indexOfUnsolved(a);
			context.insertUnsolved(index, a1);
			context.insertUnsolved(index + 1, a2);
			context.solve(a, new Kind.Func(new Kind.MetaVar(a1), new Kind.MetaVar(a2)));
			unifyKind(new Kind.MetaVar(a1), k2);
			return new Kind.MetaVar(a2);
		} else {
			Kind expected = new Kind.Func(k2, new Kind.MetaVar(fresh.fresh("k")), k2.getLoc());
			throw new TypeError.KindUnifyFailed(k1, expected, k1.getLoc());
		}
	}

	/**
	 * Unify two kinds, solving metavariables in the context as necessary.
	 *
	 * @param k1
	 * @param k2
	 * @throws TypeError
	 */
	public void unifyKind(Kind k1, Kind k2) throws TypeError {
		if (k1 instanceof Kind.Star && k2 instanceof Kind.Star) {
			return;
		} else if (k1 instanceof Kind.Func && k2 instanceof Kind.Func) {
			Kind.Func f1 = (Kind.Func) k1;
			Kind.Func f2 = (Kind.Func) k2;
			unifyKind(f1.getFrom(), f2.getFrom());
			unifyKind(context.resolve(f1.getTo()), context.resolve(f2.getTo()));
		} else if (k1 instanceof Kind.MetaVar) {
			bind(((Kind.MetaVar) k1).getName(), k2);
		} else if (k2 instanceof Kind.MetaVar) {
			bind(((Kind.MetaVar) k2).getName(), k1);
		} else {
			throw new TypeError.KindUnifyFailed(k1, k2, k1.getLoc());
		}
	}

	private void bind(Name a, Kind k) throws TypeError {
		if (k instanceof Kind.MetaVar && ((Kind.MetaVar) k).getName().equals(a)) {
			return;
		}
		Kind solution = context.solution(a);
		if (solution != null) {
			unifyKind(solution, k);
			return;
		} else if (!context.isUnsolved(a)) {
			throw new IllegalStateException("unknown kind metavariable " + a);
		}
		Kind promoted = promote(a, context.resolve(k));
		if (Kind.occurs(a, promoted)) {
			throw new TypeError.KindUnifyFailed(new Kind.MetaVar(a), k, k.getLoc());
		}
		context.solve(a, promoted);
	}

	/**
	 * Ensure every unsolved metavariable in a kind is positioned before a given
	 * metavariable, by solving later ones to fresh metavariables inserted
	 * immediately before it.
	 *
	 * @param a
	 * @param kind
	 * @return
	 */
	private Kind promote(Name a, Kind kind) {
		if (kind instanceof Kind.Func) {
			Kind.Func f = (Kind.Func) kind;
			Kind from = promote(a, f.getFrom());
			Kind to = promote(a, context.resolve(f.getTo()));
			return new Kind.Func(from, to, f.getLoc());
		} else if (kind instanceof Kind.MetaVar) {
			Name b = ((Kind.MetaVar) kind).getName();
			int aIndex = context.indexOfUnsolved(a);
			int bIndex = context.indexOfUnsolved(b);
			if (bIndex <= aIndex) {
				return kind;
			}
			Name b1 = fresh.fresh("k", b.getLoc());
			context.insertUnsolved(aIndex, b1);
			context.solve(b, new Kind.MetaVar(b1));
			return new Kind.MetaVar(b1);
		} else {
			return kind;
		}
	}

	/**
	 * Infer the kinds of a group of datatype definitions, which may refer to
	 * each other in any order. Returns the type of every constructor, where
	 * datatype parameters have become metavariables.
	 *
	 * @param defns
	 * @return
	 * @throws TypeError
	 */
	public Map<Name, Type> inferDataTypes(List<GclFile.Definition.TypeDefn> defns) throws TypeError {
		ArrayList<Name> metas = new ArrayList<>();
		for (GclFile.Definition.TypeDefn defn : defns) {
			Name m = fresh.fresh("k", defn.getName().getLoc());
			metas.add(m);
			context.addUnsolved(m);
		}
		for (int i = 0; i != defns.size(); ++i) {
			context.annotate(defns.get(i).getName(), new Kind.MetaVar(metas.get(i)));
		}
		LinkedHashMap<Name, Type> ctors = new LinkedHashMap<>();
		for (GclFile.Definition.TypeDefn defn : defns) {
			ctors.putAll(inferDataType(defn));
		}
		context.defaultUnsolved();
		for (GclFile.Definition.TypeDefn defn : defns) {
			Kind k = context.resolve(context.lookup(defn.getName()));
			kinds.put(defn.getName(), k);
			LOGGER.debug("inferred kind {} : {}", defn.getName(), k);
		}
		return ctors;
	}

	private Map<Name, Type> inferDataType(GclFile.Definition.TypeDefn defn) throws TypeError {
		List<Name> params = defn.getParameters();
		ArrayList<Name> paramMetas = new ArrayList<>();
		for (Name p : params) {
			Name m = fresh.fresh("k", p.getLoc());
			paramMetas.add(m);
			context.addUnsolved(m);
		}
		Kind expected = new Kind.Star(defn.getLoc());
		for (int i = params.size() - 1; i >= 0; --i) {
			expected = new Kind.Func(new Kind.MetaVar(paramMetas.get(i)), expected);
		}
		unifyKind(context.resolve(context.lookup(defn.getName())), expected);
		// Annotate parameters under fresh names, so they cannot clash with those
		// of other datatypes.
		Map<Name, Type> renaming = new LinkedHashMap<>();
		ArrayList<Name> annotated = new ArrayList<>();
		for (int i = 0; i != params.size(); ++i) {
			Name p = params.get(i);
			Name n = fresh.fresh("Type." + p.getText(), p.getLoc());
			context.annotateAt(paramMetas.get(i), n, context.resolve(new Kind.MetaVar(paramMetas.get(i))));
			renaming.put(p, new Type.MetaVar(n));
			annotated.add(n);
		}
		Substitution sub = Substitution.of(renaming);
		Type result = new Type.Data(defn.getName());
		for (Name n : annotated) {
			result = new Type.App(result, new Type.MetaVar(n));
		}
		LinkedHashMap<Name, Type> ctors = new LinkedHashMap<>();
		for (GclFile.TypeDefnCtor ctor : defn.getConstructors()) {
			Type type = result;
			List<Type> args = ctor.getArguments();
			for (int i = args.size() - 1; i >= 0; --i) {
				type = Type.FUNC(sub.apply(args.get(i)), type);
			}
			inferKind(type);
			ctors.put(ctor.getName(), type);
		}
		for (Name n : annotated) {
			context.remove(n);
		}
		return ctors;
	}

	private static Kind fromArity(int arity, Type type) {
		Kind k = new Kind.Star(type.getLoc());
		for (int i = 0; i != arity; ++i) {
			k = new Kind.Func(new Kind.Star(type.getLoc()), k, type.getLoc());
		}
		return k;
	}
}
