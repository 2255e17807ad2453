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

import java.util.Objects;

/**
 * A literal constant. The empty heap <code>emp</code> is treated as a boolean
 * literal for typing purposes.
 */
public final class Lit {
	public enum Kind {
		NUM, BOOL, CHAR, EMP
	}

	public static final Lit TRUE = new Lit(Kind.BOOL, Boolean.TRUE);
	public static final Lit FALSE = new Lit(Kind.BOOL, Boolean.FALSE);
	public static final Lit EMP = new Lit(Kind.EMP, null);

	private final Kind kind;
	private final Object value;

	private Lit(Kind kind, Object value) {
		this.kind = kind;
		this.value = value;
	}

	public static Lit num(int n) {
		return new Lit(Kind.NUM, n);
	}

	public static Lit bool(boolean b) {
		return b ? TRUE : FALSE;
	}

	public static Lit chr(char c) {
		return new Lit(Kind.CHAR, c);
	}

	public Kind getKind() {
		return kind;
	}

	public Object getValue() {
		return value;
	}

	/**
	 * Determine the base type of this literal.
	 *
	 * @return
	 */
	public Type.Base.Tag getTag() {
		switch (kind) {
		case NUM:
			return Type.Base.Tag.INT;
		case CHAR:
			return Type.Base.Tag.CHAR;
		default:
			return Type.Base.Tag.BOOL;
		}
	}

	@Override
	public boolean equals(Object o) {
		return (o instanceof Lit) && ((Lit) o).kind == kind && Objects.equals(((Lit) o).value, value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, value);
	}

	@Override
	public String toString() {
		switch (kind) {
		case CHAR:
			return "'" + value + "'";
		case EMP:
			return "emp";
		default:
			return value.toString();
		}
	}
}
