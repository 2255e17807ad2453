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
package gclverify.wp;

import gclverify.core.Loc;
import gclverify.core.TypedFile;

/**
 * A predicate which appears on either side of a proof obligation. Predicates
 * written by the user (assertions and loop invariants) remember where they
 * came from, whilst those computed by the weakest precondition calculation
 * are simply constants.
 */
public abstract class Pred {

	/**
	 * Get the logical content of this predicate.
	 *
	 * @return
	 */
	public abstract TypedFile.Expr toExpr();

	public abstract Loc getLoc();

	@Override
	public String toString() {
		return toExpr().toString();
	}

	public static class Constant extends Pred {
		private final TypedFile.Expr expr;

		public Constant(TypedFile.Expr expr) {
			this.expr = expr;
		}

		@Override
		public TypedFile.Expr toExpr() {
			return expr;
		}

		@Override
		public Loc getLoc() {
			return Loc.NONE;
		}
	}

	public static class Assertion extends Pred {
		private final TypedFile.Expr expr;
		private final Loc loc;

		public Assertion(TypedFile.Expr expr, Loc loc) {
			this.expr = expr;
			this.loc = loc;
		}

		@Override
		public TypedFile.Expr toExpr() {
			return expr;
		}

		@Override
		public Loc getLoc() {
			return loc;
		}
	}

	public static class LoopInvariant extends Pred {
		private final TypedFile.Expr invariant;
		private final TypedFile.Expr bound;
		private final Loc loc;

		public LoopInvariant(TypedFile.Expr invariant, TypedFile.Expr bound, Loc loc) {
			this.invariant = invariant;
			this.bound = bound;
			this.loc = loc;
		}

		@Override
		public TypedFile.Expr toExpr() {
			return invariant;
		}

		/**
		 * Get the bound of this loop, or <code>null</code> if none was given.
		 *
		 * @return
		 */
		public TypedFile.Expr getBound() {
			return bound;
		}

		@Override
		public Loc getLoc() {
			return loc;
		}
	}
}
