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
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import gclverify.core.Name;
import gclverify.core.Type;

/**
 * An ordered, immutable mapping from names to their bindings. A name may be
 * bound more than once, in which case lookup finds the most recent binding.
 */
public final class TypeEnvironment {
	public static final TypeEnvironment EMPTY = new TypeEnvironment(Collections.emptyList());

	private final List<Map.Entry<Name, TypeInfo>> entries;

	private TypeEnvironment(List<Map.Entry<Name, TypeInfo>> entries) {
		this.entries = entries;
	}

	public TypeEnvironment extend(Name name, TypeInfo info) {
		ArrayList<Map.Entry<Name, TypeInfo>> nentries = new ArrayList<>(entries);
		nentries.add(Map.entry(name, info));
		return new TypeEnvironment(Collections.unmodifiableList(nentries));
	}

	/**
	 * Bind each name to the corresponding type, as a variable.
	 *
	 * @param names
	 * @param types
	 * @return
	 */
	public TypeEnvironment extend(List<Name> names, List<Type> types) {
		ArrayList<Map.Entry<Name, TypeInfo>> nentries = new ArrayList<>(entries);
		for (int i = 0; i != names.size(); ++i) {
			nentries.add(Map.entry(names.get(i), new TypeInfo.Var(types.get(i))));
		}
		return new TypeEnvironment(Collections.unmodifiableList(nentries));
	}

	/**
	 * Find the most recent binding of a name, or <code>null</code> if it is not
	 * bound.
	 *
	 * @param name
	 * @return
	 */
	public TypeInfo lookup(Name name) {
		for (int i = entries.size() - 1; i >= 0; --i) {
			Map.Entry<Name, TypeInfo> e = entries.get(i);
			if (e.getKey().equals(name)) {
				return e.getValue();
			}
		}
		return null;
	}

	public TypeEnvironment apply(Substitution s) {
		if (s.isEmpty()) {
			return this;
		}
		ArrayList<Map.Entry<Name, TypeInfo>> nentries = new ArrayList<>();
		for (Map.Entry<Name, TypeInfo> e : entries) {
			nentries.add(Map.entry(e.getKey(), e.getValue().apply(s)));
		}
		return new TypeEnvironment(Collections.unmodifiableList(nentries));
	}

	/**
	 * Determine the unification variables free in any binding.
	 *
	 * @return
	 */
	public Set<Name> freeVars() {
		Set<Name> names = new LinkedHashSet<>();
		for (Map.Entry<Name, TypeInfo> e : entries) {
			names.addAll(Type.freeVars(e.getValue().getType()));
		}
		return names;
	}

	/**
	 * Get all bindings, oldest first.
	 *
	 * @return
	 */
	public List<Map.Entry<Name, TypeInfo>> entries() {
		return entries;
	}

	public int size() {
		return entries.size();
	}

	@Override
	public String toString() {
		return entries.toString();
	}
}
