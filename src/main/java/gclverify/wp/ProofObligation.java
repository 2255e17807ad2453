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

/**
 * A condition of the form <code>pre ⇒ post</code> which must be discharged by
 * a prover. Each obligation carries a hash of its printed form, which is
 * stable across runs and so identifies the obligation whilst the program is
 * edited.
 */
public class ProofObligation {
	private final Pred pre;
	private final Pred post;
	private final String hash;
	private final Origin origin;

	public ProofObligation(Pred pre, Pred post, String hash, Origin origin) {
		this.pre = pre;
		this.post = post;
		this.hash = hash;
		this.origin = origin;
	}

	public Pred getPre() {
		return pre;
	}

	public Pred getPost() {
		return post;
	}

	public String getHash() {
		return hash;
	}

	public Origin getOrigin() {
		return origin;
	}

	public String getLabel() {
		return origin.getKind().getLabel();
	}

	@Override
	public String toString() {
		return getLabel() + " [" + hash + "]: " + pre + " ⇒ " + post;
	}

	/**
	 * Identifies the construct responsible for an obligation.
	 */
	public static class Origin {
		public enum Kind {
			ASSERTION("Assertion"), LOOP_INVARIANT("Loop Invariant Preserved"), LOOP_EXIT("Loop Exit"),
			LOOP_TERMINATION("Loop Termination"), BOUND_DECREMENT("Bound Decrement");

			private final String label;

			Kind(String label) {
				this.label = label;
			}

			public String getLabel() {
				return label;
			}
		}

		private final Kind kind;
		private final Loc loc;

		public Origin(Kind kind, Loc loc) {
			this.kind = kind;
			this.loc = loc;
		}

		public Kind getKind() {
			return kind;
		}

		public Loc getLoc() {
			return loc;
		}
	}
}
