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
 * The result of elaborating a node: its inferred type (if it has one), the
 * typed counterpart of the node and the substitution which was discovered
 * along the way. The type and the typed node already have the substitution
 * applied.
 *
 * @param <T>
 */
public final class Elaborated<T> {
	private final Type type;
	private final T node;
	private final Substitution substitution;

	public Elaborated(Type type, T node, Substitution substitution) {
		this.type = type;
		this.node = node;
		this.substitution = substitution;
	}

	/**
	 * Get the inferred type, or <code>null</code> for nodes (such as
	 * statements) which have no type.
	 *
	 * @return
	 */
	public Type getType() {
		return type;
	}

	public T getNode() {
		return node;
	}

	public Substitution getSubstitution() {
		return substitution;
	}
}
