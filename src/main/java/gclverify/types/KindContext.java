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
import java.util.List;

import gclverify.core.Kind;
import gclverify.core.Name;

/**
 * <p>
 * The ordered context used for kind inference, following "Kind Inference for
 * Datatypes" (Xie, Eisenberg and Oliveira). The context is an arena of slots
 * held oldest first. A slot is either an annotation, giving the kind of a
 * named type, or a kind metavariable which is either unsolved or solved.
 * </p>
 * <p>
 * Order matters: the solution of a metavariable may only mention
 * metavariables positioned before it. Unification maintains this by
 * <i>promoting</i> later metavariables, i.e. solving them to fresh
 * metavariables inserted earlier in the context. Slots are never moved
 * forwards.
 * </p>
 */
public class KindContext {

	public static class Slot {
		public enum Tag {
			ANNOTATED, UNSOLVED, SOLVED
		}

		private final Tag tag;
		private final Name name;
		private final Kind kind;

		private Slot(Tag tag, Name name, Kind kind) {
			this.tag = tag;
			this.name = name;
			this.kind = kind;
		}

		public Tag getTag() {
			return tag;
		}

		public Name getName() {
			return name;
		}

		/**
		 * Get the kind of an annotated slot, or the solution of a solved one. This is
		 * <code>null</code> for unsolved slots.
		 *
		 * @return
		 */
		public Kind getKind() {
			return kind;
		}

		@Override
		public String toString() {
			switch (tag) {
			case ANNOTATED:
				return name + " : " + kind;
			case SOLVED:
				return name + " = " + kind;
			default:
				return name.toString();
			}
		}
	}

	private final ArrayList<Slot> slots = new ArrayList<>();

	/**
	 * Append an annotated slot.
	 *
	 * @param name
	 * @param kind
	 */
	public void annotate(Name name, Kind kind) {
		if (lookup(name) != null) {
			throw new IllegalArgumentException("duplicate kind annotation for " + name);
		}
		slots.add(new Slot(Slot.Tag.ANNOTATED, name, kind));
	}

	/**
	 * Append an unsolved metavariable.
	 *
	 * @param name
	 */
	public void addUnsolved(Name name) {
		slots.add(new Slot(Slot.Tag.UNSOLVED, name, null));
	}

	/**
	 * Insert an unsolved metavariable immediately before the slot at a given
	 * position.
	 *
	 * @param index
	 * @param name
	 */
	public void insertUnsolved(int index, Name name) {
		slots.add(index, new Slot(Slot.Tag.UNSOLVED, name, null));
	}

	/**
	 * Find the kind annotated for a given type name, or <code>null</code> if
	 * there is none.
	 *
	 * @param name
	 * @return
	 */
	public Kind lookup(Name name) {
		for (int i = slots.size() - 1; i >= 0; --i) {
			Slot s = slots.get(i);
			if (s.tag == Slot.Tag.ANNOTATED && s.name.equals(name)) {
				return s.kind;
			}
		}
		return null;
	}

	/**
	 * Get the position of an unsolved metavariable, or <code>-1</code> if there
	 * is no such unsolved metavariable.
	 *
	 * @param name
	 * @return
	 */
	public int indexOfUnsolved(Name name) {
		return indexOf(Slot.Tag.UNSOLVED, name);
	}

	public boolean isUnsolved(Name name) {
		return indexOfUnsolved(name) >= 0;
	}

	/**
	 * Get the solution of a metavariable, or <code>null</code> if it is not
	 * solved.
	 *
	 * @param name
	 * @return
	 */
	public Kind solution(Name name) {
		int i = indexOf(Slot.Tag.SOLVED, name);
		return i < 0 ? null : slots.get(i).kind;
	}

	/**
	 * Solve an unsolved metavariable in place.
	 *
	 * @param name
	 * @param kind
	 */
	public void solve(Name name, Kind kind) {
		int i = indexOfUnsolved(name);
		if (i < 0) {
			throw new IllegalArgumentException("no unsolved metavariable " + name);
		}
		slots.set(i, new Slot(Slot.Tag.SOLVED, name, kind));
	}

	/**
	 * Replace the slot of a metavariable (solved or not) with an annotation.
	 * Unsolved metavariables are kept, and the annotation placed after them.
	 *
	 * @param meta
	 * @param name
	 * @param kind
	 */
	public void annotateAt(Name meta, Name name, Kind kind) {
		int i = indexOf(Slot.Tag.SOLVED, meta);
		Slot s = new Slot(Slot.Tag.ANNOTATED, name, kind);
		if (i >= 0) {
			slots.set(i, s);
		} else {
			i = indexOfUnsolved(meta);
			slots.add(i + 1, s);
		}
	}

	/**
	 * Remove the annotation of a given name.
	 *
	 * @param name
	 */
	public void remove(Name name) {
		int i = indexOf(Slot.Tag.ANNOTATED, name);
		if (i >= 0) {
			slots.remove(i);
		}
	}

	/**
	 * Apply all solutions to a kind, so that it mentions only unsolved
	 * metavariables.
	 *
	 * @param kind
	 * @return
	 */
	public Kind resolve(Kind kind) {
		if (kind instanceof Kind.MetaVar) {
			Kind k = solution(((Kind.MetaVar) kind).getName());
			return k == null ? kind : resolve(k);
		} else if (kind instanceof Kind.Func) {
			Kind.Func f = (Kind.Func) kind;
			Kind from = resolve(f.getFrom());
			Kind to = resolve(f.getTo());
			return from == f.getFrom() && to == f.getTo() ? kind : new Kind.Func(from, to, f.getLoc());
		} else {
			return kind;
		}
	}

	/**
	 * Solve every remaining metavariable to <code>*</code>.
	 */
	public void defaultUnsolved() {
		for (int i = 0; i != slots.size(); ++i) {
			Slot s = slots.get(i);
			if (s.tag == Slot.Tag.UNSOLVED) {
				slots.set(i, new Slot(Slot.Tag.SOLVED, s.name, new Kind.Star(s.name.getLoc())));
			}
		}
	}

	public List<Slot> getSlots() {
		return slots;
	}

	private int indexOf(Slot.Tag tag, Name name) {
		for (int i = 0; i != slots.size(); ++i) {
			Slot s = slots.get(i);
			if (s.tag == tag && s.name.equals(name)) {
				return i;
			}
		}
		return -1;
	}

	@Override
	public String toString() {
		return slots.toString();
	}
}
