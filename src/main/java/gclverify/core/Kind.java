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

import gclverify.io.GclFilePrinter;

/**
 * The kind of a type, i.e. <code>*</code> for ordinary types and
 * <code>k1 → k2</code> for type constructors.
 */
public interface Kind {

	public static final Star STAR = new Star(Loc.NONE);

	public Loc getLoc();

	public static abstract class AbstractKind implements Kind {
		private final Loc loc;

		public AbstractKind(Loc loc) {
			this.loc = loc == null ? Loc.NONE : loc;
		}

		@Override
		public Loc getLoc() {
			return loc;
		}

		@Override
		public String toString() {
			return GclFilePrinter.toString(this);
		}
	}

	public static class Star extends AbstractKind {
		public Star(Loc loc) {
			super(loc);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Star;
		}

		@Override
		public int hashCode() {
			return 1;
		}
	}

	public static class Func extends AbstractKind {
		private final Kind from;
		private final Kind to;

		public Func(Kind from, Kind to) {
			this(from, to, Loc.NONE);
		}

		public Func(Kind from, Kind to, Loc loc) {
			super(loc);
			this.from = from;
			this.to = to;
		}

		public Kind getFrom() {
			return from;
		}

		public Kind getTo() {
			return to;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Func) {
				Func f = (Func) o;
				return from.equals(f.from) && to.equals(f.to);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return from.hashCode() * 31 + to.hashCode();
		}
	}

	public static class MetaVar extends AbstractKind {
		private final Name name;

		public MetaVar(Name name) {
			super(name.getLoc());
			this.name = name;
		}

		public Name getName() {
			return name;
		}

		@Override
		public boolean equals(Object o) {
			return (o instanceof MetaVar) && ((MetaVar) o).name.equals(name);
		}

		@Override
		public int hashCode() {
			return name.hashCode();
		}
	}

	/**
	 * Check whether a given kind metavariable occurs in a kind.
	 *
	 * @param name
	 * @param kind
	 * @return
	 */
	public static boolean occurs(Name name, Kind kind) {
		if (kind instanceof MetaVar) {
			return ((MetaVar) kind).getName().equals(name);
		} else if (kind instanceof Func) {
			Func f = (Func) kind;
			return occurs(name, f.getFrom()) || occurs(name, f.getTo());
		} else {
			return false;
		}
	}
}
