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

import gclverify.core.Loc;
import gclverify.core.Name;
import gclverify.core.Type;

/**
 * <p>
 * Syntactic unification over types. Arrays are treated as functions from
 * <code>Int</code> to their element type, so that
 * <code>array [0 .. N) of Int</code> unifies with <code>Int → Int</code>. This
 * lets array indexing be typed in the same way as function application.
 * </p>
 * <p>
 * The intervals of array types are ignored. Thus
 * <code>array [0 .. N) of Int</code> unifies with
 * <code>array [1 .. M] of Int</code>.
 * </p>
 */
public class Unifier {

	/**
	 * Compute the most general unifier of two types.
	 *
	 * @param t1
	 * @param t2
	 * @param loc Location to report on failure
	 * @return
	 * @throws TypeError
	 */
	public static Substitution unify(Type t1, Type t2, Loc loc) throws TypeError {
		if (t1 instanceof Type.Base && t2 instanceof Type.Base
				&& ((Type.Base) t1).getTag() == ((Type.Base) t2).getTag()) {
			return Substitution.EMPTY;
		} else if (t1 instanceof Type.Array && t2 instanceof Type.Array) {
			return unify(((Type.Array) t1).getElement(), ((Type.Array) t2).getElement(), loc);
		} else if (t1 instanceof Type.Array && Type.isFunction(t2)) {
			return unifyArray((Type.Array) t1, t2, loc);
		} else if (t1 instanceof Type.Arrow && t2 instanceof Type.Arrow) {
			return Substitution.EMPTY;
		} else if (t1 instanceof Type.Tuple && t2 instanceof Type.Tuple
				&& ((Type.Tuple) t1).getArity() == ((Type.Tuple) t2).getArity()) {
			return Substitution.EMPTY;
		} else if (t1 instanceof Type.Data && t2 instanceof Type.Data) {
			if (((Type.Data) t1).getName().equals(((Type.Data) t2).getName())) {
				return Substitution.EMPTY;
			}
			throw new TypeError.UnifyFailed(t1, t2, loc);
		} else if (Type.isFunction(t1) && t2 instanceof Type.Array) {
			return unifyArray((Type.Array) t2, t1, loc);
		} else if (t1 instanceof Type.App && t2 instanceof Type.App) {
			Type.App a1 = (Type.App) t1;
			Type.App a2 = (Type.App) t2;
			Substitution s1 = unify(a1.getLeft(), a2.getLeft(), loc);
			Substitution s2 = unify(s1.apply(a1.getRight()), s1.apply(a2.getRight()), loc);
			return s2.compose(s1);
		} else if (t1 instanceof Type.Var) {
			return bind(((Type.Var) t1).getName(), t2, loc);
		} else if (t2 instanceof Type.Var) {
			return bind(((Type.Var) t2).getName(), t1, loc);
		} else if (t1 instanceof Type.MetaVar) {
			return bind(((Type.MetaVar) t1).getName(), t2, loc);
		} else if (t2 instanceof Type.MetaVar) {
			return bind(((Type.MetaVar) t2).getName(), t1, loc);
		} else {
			throw new TypeError.UnifyFailed(t1, t2, loc);
		}
	}

	/**
	 * Unify an array type with a function type <code>i → t</code>, requiring
	 * <code>i</code> to be <code>Int</code> and <code>t</code> to match the
	 * element type.
	 */
	private static Substitution unifyArray(Type.Array array, Type function, Loc loc) throws TypeError {
		Substitution s1 = unify(Type.domain(function), Type.INT, loc);
		Substitution s2 = unify(s1.apply(array.getElement()), s1.apply(Type.codomain(function)), loc);
		return s2.compose(s1);
	}

	private static Substitution bind(Name name, Type type, Loc loc) throws TypeError {
		if ((type instanceof Type.Var || type instanceof Type.MetaVar) && ((Type.Named) type).getName().equals(name)) {
			return Substitution.EMPTY;
		} else if (Type.occurs(name, type)) {
			throw new TypeError.RecursiveType(name, type, loc);
		} else {
			return Substitution.singleton(name, type);
		}
	}
}
