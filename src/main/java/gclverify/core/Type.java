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

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import gclverify.io.GclFilePrinter;

/**
 * <p>
 * Represents a type in the Guarded Command Language. Types are immutable trees.
 * A function type <code>a → b</code> has no dedicated node, and is instead the
 * application of the type-level arrow operator, i.e.
 * <code>App(App(Arrow, a), b)</code>. This matters for unification, since an
 * array type is viewed as a function from <code>Int</code> to its element type.
 * </p>
 * <p>
 * There are two kinds of type variable. A <code>Var</code> is a unification
 * variable introduced whilst inferring types, whilst a <code>MetaVar</code> is
 * a generalised (i.e. quantified) variable of a polymorphic type scheme which
 * is replaced by fresh unification variables at each use.
 * </p>
 */
public interface Type {

	public static final Base INT = new Base(Base.Tag.INT);
	public static final Base BOOL = new Base(Base.Tag.BOOL);
	public static final Base CHAR = new Base(Base.Tag.CHAR);
	public static final Arrow ARROW = new Arrow(Loc.NONE);

	public Loc getLoc();

	public static abstract class AbstractType implements Type {
		private final Loc loc;

		public AbstractType(Loc loc) {
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

	public static class Base extends AbstractType {
		public enum Tag {
			INT("Int"), BOOL("Bool"), CHAR("Char");

			private final String text;

			Tag(String text) {
				this.text = text;
			}

			public String getText() {
				return text;
			}
		}

		private final Tag tag;

		public Base(Tag tag) {
			this(tag, Loc.NONE);
		}

		public Base(Tag tag, Loc loc) {
			super(loc);
			this.tag = tag;
		}

		public Tag getTag() {
			return tag;
		}

		@Override
		public boolean equals(Object o) {
			return (o instanceof Base) && ((Base) o).tag == tag;
		}

		@Override
		public int hashCode() {
			return tag.hashCode();
		}
	}

	/**
	 * An array type, e.g. <code>array [0 .. N) of Int</code>.
	 */
	public static class Array extends AbstractType {
		private final Interval interval;
		private final Type element;

		public Array(Interval interval, Type element) {
			this(interval, element, Loc.NONE);
		}

		public Array(Interval interval, Type element, Loc loc) {
			super(loc);
			this.interval = interval;
			this.element = element;
		}

		public Interval getInterval() {
			return interval;
		}

		public Type getElement() {
			return element;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Array) {
				Array a = (Array) o;
				return Objects.equals(interval, a.interval) && element.equals(a.element);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return element.hashCode() * 31;
		}
	}

	/**
	 * The tuple type constructor of a given arity. This is a type operator
	 * rather than a complete type.
	 */
	public static class Tuple extends AbstractType {
		private final int arity;

		public Tuple(int arity) {
			this(arity, Loc.NONE);
		}

		public Tuple(int arity, Loc loc) {
			super(loc);
			this.arity = arity;
		}

		public int getArity() {
			return arity;
		}

		@Override
		public boolean equals(Object o) {
			return (o instanceof Tuple) && ((Tuple) o).arity == arity;
		}

		@Override
		public int hashCode() {
			return arity;
		}
	}

	/**
	 * The type-level function arrow operator <code>→</code>.
	 */
	public static class Arrow extends AbstractType {
		public Arrow(Loc loc) {
			super(loc);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Arrow;
		}

		@Override
		public int hashCode() {
			return 7;
		}
	}

	public static class App extends AbstractType {
		private final Type left;
		private final Type right;

		public App(Type left, Type right) {
			this(left, right, Loc.NONE);
		}

		public App(Type left, Type right, Loc loc) {
			super(loc);
			this.left = left;
			this.right = right;
		}

		public Type getLeft() {
			return left;
		}

		public Type getRight() {
			return right;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof App) {
				App a = (App) o;
				return left.equals(a.left) && right.equals(a.right);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return left.hashCode() * 31 + right.hashCode();
		}
	}

	public static abstract class Named extends AbstractType {
		private final Name name;

		public Named(Name name) {
			super(name.getLoc());
			this.name = name;
		}

		public Name getName() {
			return name;
		}

		@Override
		public boolean equals(Object o) {
			return o != null && o.getClass() == getClass() && ((Named) o).name.equals(name);
		}

		@Override
		public int hashCode() {
			return getClass().hashCode() ^ name.hashCode();
		}
	}

	/**
	 * A reference to a user-defined datatype, such as <code>List</code>.
	 */
	public static class Data extends Named {
		public Data(Name name) {
			super(name);
		}
	}

	/**
	 * A unification variable.
	 */
	public static class Var extends Named {
		public Var(Name name) {
			super(name);
		}
	}

	/**
	 * A generalised variable of a polymorphic type scheme.
	 */
	public static class MetaVar extends Named {
		public MetaVar(Name name) {
			super(name);
		}
	}

	// =========================================================================
	// Intervals
	// =========================================================================

	public static class Interval {
		private final Endpoint lower;
		private final Endpoint upper;
		private final Loc loc;

		public Interval(Endpoint lower, Endpoint upper, Loc loc) {
			this.lower = lower;
			this.upper = upper;
			this.loc = loc == null ? Loc.NONE : loc;
		}

		public Endpoint getLower() {
			return lower;
		}

		public Endpoint getUpper() {
			return upper;
		}

		public Loc getLoc() {
			return loc;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Interval) {
				Interval i = (Interval) o;
				return lower.equals(i.lower) && upper.equals(i.upper);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return lower.hashCode() ^ upper.hashCode();
		}
	}

	public static class Endpoint {
		private final boolean inclusive;
		private final GclFile.Expr bound;

		public Endpoint(boolean inclusive, GclFile.Expr bound) {
			this.inclusive = inclusive;
			this.bound = bound;
		}

		public boolean isInclusive() {
			return inclusive;
		}

		public GclFile.Expr getBound() {
			return bound;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Endpoint) {
				Endpoint e = (Endpoint) o;
				return inclusive == e.inclusive && Objects.equals(bound, e.bound);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return Boolean.hashCode(inclusive);
		}
	}

	// =========================================================================
	// Helpers
	// =========================================================================

	/**
	 * Construct the function type <code>from → to</code>.
	 *
	 * @param from
	 * @param to
	 * @return
	 */
	public static Type FUNC(Type from, Type to) {
		return new App(new App(ARROW, from), to);
	}

	/**
	 * Construct a curried function type, e.g. <code>FUNC(a,b,c)</code> gives
	 * <code>a → b → c</code>.
	 *
	 * @param types
	 * @return
	 */
	public static Type FUNC(Type... types) {
		Type r = types[types.length - 1];
		for (int i = types.length - 2; i >= 0; --i) {
			r = FUNC(types[i], r);
		}
		return r;
	}

	/**
	 * Check whether a given type is a function type <code>a → b</code>.
	 *
	 * @param type
	 * @return
	 */
	public static boolean isFunction(Type type) {
		if (type instanceof App) {
			Type left = ((App) type).getLeft();
			return left instanceof App && ((App) left).getLeft() instanceof Arrow;
		}
		return false;
	}

	/**
	 * Get the domain of a function type (i.e. <code>a</code> in
	 * <code>a → b</code>).
	 *
	 * @param type
	 * @return
	 */
	public static Type domain(Type type) {
		return ((App) ((App) type).getLeft()).getRight();
	}

	/**
	 * Get the codomain of a function type (i.e. <code>b</code> in
	 * <code>a → b</code>).
	 *
	 * @param type
	 * @return
	 */
	public static Type codomain(Type type) {
		return ((App) type).getRight();
	}

	/**
	 * Determine the set of unification variables occurring in a type.
	 *
	 * @param type
	 * @return
	 */
	public static Set<Name> freeVars(Type type) {
		Set<Name> names = new LinkedHashSet<>();
		collect(type, Var.class, names);
		return names;
	}

	/**
	 * Determine the set of generalised variables occurring in a type.
	 *
	 * @param type
	 * @return
	 */
	public static Set<Name> freeMetaVars(Type type) {
		Set<Name> names = new LinkedHashSet<>();
		collect(type, MetaVar.class, names);
		return names;
	}

	/**
	 * Check whether a variable of the given name (of either flavour) occurs in a
	 * type.
	 *
	 * @param name
	 * @param type
	 * @return
	 */
	public static boolean occurs(Name name, Type type) {
		if (type instanceof Var || type instanceof MetaVar) {
			return ((Named) type).getName().equals(name);
		} else if (type instanceof App) {
			App t = (App) type;
			return occurs(name, t.getLeft()) || occurs(name, t.getRight());
		} else if (type instanceof Array) {
			return occurs(name, ((Array) type).getElement());
		} else {
			return false;
		}
	}

	private static void collect(Type type, Class<? extends Named> kind, Set<Name> names) {
		if (kind.isInstance(type)) {
			names.add(((Named) type).getName());
		} else if (type instanceof App) {
			collect(((App) type).getLeft(), kind, names);
			collect(((App) type).getRight(), kind, names);
		} else if (type instanceof Array) {
			collect(((Array) type).getElement(), kind, names);
		}
	}
}
