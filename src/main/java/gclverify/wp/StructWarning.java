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
 * A problem with the structure of a program which does not prevent proof
 * obligations from being generated.
 */
public abstract class StructWarning {
	private final Loc loc;

	public StructWarning(Loc loc) {
		this.loc = loc;
	}

	public Loc getLoc() {
		return loc;
	}

	public abstract String getMessage();

	@Override
	public String toString() {
		return getMessage() + " (" + loc + ")";
	}

	/**
	 * A loop whose invariant gives no bound, so termination cannot be checked.
	 */
	public static class MissingBound extends StructWarning {
		public MissingBound(Loc loc) {
			super(loc);
		}

		@Override
		public String getMessage() {
			return "missing bound for loop";
		}
	}
}
