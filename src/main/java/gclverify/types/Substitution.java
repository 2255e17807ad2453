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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import gclverify.core.Name;
import gclverify.core.Type;
import gclverify.core.TypedFile;
import gclverify.util.AbstractExpressionTransform;

/**
 * A finite mapping from type variable names to types. Substitutions are
 * immutable. Composition follows the usual convention for Algorithm W, so
 * <code>s1.compose(s2)</code> applies <code>s2</code> first and then
 * <code>s1</code>.
 */
public final class Substitution {
	public static final Substitution EMPTY = new Substitution(Collections.emptyMap());

	private final Map<Name, Type> mapping;

	private Substitution(Map<Name, Type> mapping) {
		this.mapping = mapping;
	}

	public static Substitution singleton(Name name, Type type) {
		return new Substitution(Collections.singletonMap(name, type));
	}

	/**
	 * Construct a substitution from an arbitrary mapping.
	 *
	 * @param mapping
	 * @return
	 */
	public static Substitution of(Map<Name, Type> mapping) {
		return new Substitution(Collections.unmodifiableMap(new LinkedHashMap<>(mapping)));
	}

	public boolean isEmpty() {
		return mapping.isEmpty();
	}

	public int size() {
		return mapping.size();
	}

	public Set<Name> domain() {
		return mapping.keySet();
	}

	public Type get(Name name) {
		return mapping.get(name);
	}

	/**
	 * Compose this substitution with another, giving
	 * <code>this ∪ map(apply this, other)</code>. Where both bind the same name,
	 * the binding in this substitution wins.
	 *
	 * @param other
	 * @return
	 */
	public Substitution compose(Substitution other) {
		if (other.isEmpty()) {
			return this;
		}
		LinkedHashMap<Name, Type> result = new LinkedHashMap<>();
		for (Map.Entry<Name, Type> e : other.mapping.entrySet()) {
			result.put(e.getKey(), apply(e.getValue()));
		}
		result.putAll(mapping);
		return new Substitution(Collections.unmodifiableMap(result));
	}

	/**
	 * Apply this substitution to a type.
	 *
	 * @param type
	 * @return
	 */
	public Type apply(Type type) {
		if (mapping.isEmpty()) {
			return type;
		} else if (type instanceof Type.Var || type instanceof Type.MetaVar) {
			Type t = mapping.get(((Type.Named) type).getName());
			return t == null ? type : t;
		} else if (type instanceof Type.App) {
			Type.App t = (Type.App) type;
			Type left = apply(t.getLeft());
			Type right = apply(t.getRight());
			if (left == t.getLeft() && right == t.getRight()) {
				return type;
			} else {
				return new Type.App(left, right, t.getLoc());
			}
		} else if (type instanceof Type.Array) {
			Type.Array t = (Type.Array) type;
			Type element = apply(t.getElement());
			return element == t.getElement() ? type : new Type.Array(t.getInterval(), element, t.getLoc());
		} else {
			return type;
		}
	}

	/**
	 * Apply this substitution to every type within a typed expression.
	 *
	 * @param expr
	 * @return
	 */
	public TypedFile.Expr apply(TypedFile.Expr expr) {
		if (mapping.isEmpty()) {
			return expr;
		}
		return new AbstractExpressionTransform() {
			@Override
			protected Type transformType(Type type) {
				return apply(type);
			}
		}.visitExpression(expr);
	}

	@Override
	public boolean equals(Object o) {
		return (o instanceof Substitution) && ((Substitution) o).mapping.equals(mapping);
	}

	@Override
	public int hashCode() {
		return mapping.hashCode();
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("{");
		String sep = "";
		for (Map.Entry<Name, Type> e : mapping.entrySet()) {
			sb.append(sep).append(e.getKey()).append(" ↦ ").append(e.getValue());
			sep = ", ";
		}
		return sb.append("}").toString();
	}
}
