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

import java.util.List;

import gclverify.core.GclException;
import gclverify.core.GclFile;
import gclverify.core.Loc;
import gclverify.core.Name;
import gclverify.core.Type;

/**
 * A defect in the user's program found during kind inference or type
 * elaboration.
 */
public abstract class TypeError extends GclException {
	private static final long serialVersionUID = 1L;

	public TypeError(String message, Loc location) {
		super(message, location);
	}

	@Override
	public GclException.Kind getKind() {
		return GclException.Kind.TYPE;
	}

	private static Loc span(List<? extends GclFile.Item> items) {
		Loc loc = Loc.NONE;
		for (GclFile.Item i : items) {
			loc = loc.join(i.getLoc());
		}
		return loc;
	}

	private static Loc spanNames(List<Name> names) {
		Loc loc = Loc.NONE;
		for (Name n : names) {
			loc = loc.join(n.getLoc());
		}
		return loc;
	}

	public static class NotInScope extends TypeError {
		private static final long serialVersionUID = 1L;
		private final Name name;

		public NotInScope(Name name) {
			super("not in scope: " + name, name.getLoc());
			this.name = name;
		}

		public Name getName() {
			return name;
		}
	}

	public static class UnifyFailed extends TypeError {
		private static final long serialVersionUID = 1L;
		private final Type left;
		private final Type right;

		public UnifyFailed(Type left, Type right, Loc loc) {
			super("cannot unify " + left + " with " + right, loc);
			this.left = left;
			this.right = right;
		}

		public Type getLeft() {
			return left;
		}

		public Type getRight() {
			return right;
		}
	}

	public static class KindUnifyFailed extends TypeError {
		private static final long serialVersionUID = 1L;
		private final gclverify.core.Kind left;
		private final gclverify.core.Kind right;

		public KindUnifyFailed(gclverify.core.Kind left, gclverify.core.Kind right, Loc loc) {
			super("cannot unify kind " + left + " with " + right, loc);
			this.left = left;
			this.right = right;
		}

		public gclverify.core.Kind getLeft() {
			return left;
		}

		public gclverify.core.Kind getRight() {
			return right;
		}
	}

	/**
	 * Raised by the occurs check, e.g. when unifying <code>a</code> with
	 * <code>a → Int</code>.
	 */
	public static class RecursiveType extends TypeError {
		private static final long serialVersionUID = 1L;
		private final Name name;
		private final Type type;

		public RecursiveType(Name name, Type type, Loc loc) {
			super("recursive type: " + name + " occurs in " + type, loc);
			this.name = name;
			this.type = type;
		}

		public Name getName() {
			return name;
		}

		public Type getType() {
			return type;
		}
	}

	public static class AssignToConst extends TypeError {
		private static final long serialVersionUID = 1L;
		private final Name name;

		public AssignToConst(Name name) {
			super("cannot assign to constant " + name, name.getLoc());
			this.name = name;
		}

		public Name getName() {
			return name;
		}
	}

	public static class UndefinedType extends TypeError {
		private static final long serialVersionUID = 1L;
		private final Name name;

		public UndefinedType(Name name) {
			super("undefined type " + name, name.getLoc());
			this.name = name;
		}

		public Name getName() {
			return name;
		}
	}

	public static class DuplicatedIdentifiers extends TypeError {
		private static final long serialVersionUID = 1L;
		private final List<Name> names;

		public DuplicatedIdentifiers(List<Name> names) {
			super("duplicated identifiers " + names, spanNames(names));
			this.names = names;
		}

		public List<Name> getNames() {
			return names;
		}
	}

	/**
	 * An assignment has more names than expressions.
	 */
	public static class RedundantNames extends TypeError {
		private static final long serialVersionUID = 1L;
		private final List<Name> names;

		public RedundantNames(List<Name> names) {
			super("redundant names " + names, spanNames(names));
			this.names = names;
		}

		public List<Name> getNames() {
			return names;
		}
	}

	/**
	 * An assignment has more expressions than names.
	 */
	public static class RedundantExprs extends TypeError {
		private static final long serialVersionUID = 1L;
		private final List<GclFile.Expr> exprs;

		public RedundantExprs(List<GclFile.Expr> exprs) {
			super("redundant expressions", span(exprs));
			this.exprs = exprs;
		}

		public List<GclFile.Expr> getExprs() {
			return exprs;
		}
	}

	public static class MissingArguments extends TypeError {
		private static final long serialVersionUID = 1L;
		private final List<Name> names;

		public MissingArguments(List<Name> names) {
			super("missing arguments " + names, spanNames(names));
			this.names = names;
		}

		public List<Name> getNames() {
			return names;
		}
	}
}
