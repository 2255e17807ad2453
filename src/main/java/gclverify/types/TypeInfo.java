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

import gclverify.core.Type;

/**
 * Describes how a name is bound in the type environment. Only
 * {@link TypeInfo.Var} bindings may be assigned.
 */
public abstract class TypeInfo {
	private final Type type;

	public TypeInfo(Type type) {
		this.type = type;
	}

	public Type getType() {
		return type;
	}

	/**
	 * Construct a binding of the same kind with a different type.
	 *
	 * @param type
	 * @return
	 */
	public abstract TypeInfo with(Type type);

	public TypeInfo apply(Substitution s) {
		Type t = s.apply(type);
		return t == type ? this : with(t);
	}

	/**
	 * A constructor of a user-defined datatype.
	 */
	public static class TypeDefnCtor extends TypeInfo {
		public TypeDefnCtor(Type type) {
			super(type);
		}

		@Override
		public TypeInfo with(Type type) {
			return new TypeDefnCtor(type);
		}
	}

	/**
	 * A declared constant, function signature or function definition.
	 */
	public static class Const extends TypeInfo {
		public Const(Type type) {
			super(type);
		}

		@Override
		public TypeInfo with(Type type) {
			return new Const(type);
		}
	}

	/**
	 * A declared (mutable) variable.
	 */
	public static class Var extends TypeInfo {
		public Var(Type type) {
			super(type);
		}

		@Override
		public TypeInfo with(Type type) {
			return new Var(type);
		}
	}

	@Override
	public boolean equals(Object o) {
		return o != null && o.getClass() == getClass() && ((TypeInfo) o).type.equals(type);
	}

	@Override
	public int hashCode() {
		return type.hashCode();
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "(" + type + ")";
	}
}
