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
import gclverify.types.TypeEnvironment;

/**
 * A hole in the program (written <code>[! !]</code>) which remains to be
 * filled. The hole records what any code placed there must establish, and the
 * names in scope at that point.
 */
public class Specification {
	private final int id;
	private final Pred pre;
	private final Pred post;
	private final TypeEnvironment environment;
	private final Loc range;

	public Specification(int id, Pred pre, Pred post, TypeEnvironment environment, Loc range) {
		this.id = id;
		this.pre = pre;
		this.post = post;
		this.environment = environment;
		this.range = range;
	}

	public int getId() {
		return id;
	}

	public Pred getPre() {
		return pre;
	}

	public Pred getPost() {
		return post;
	}

	public TypeEnvironment getEnvironment() {
		return environment;
	}

	public Loc getRange() {
		return range;
	}

	@Override
	public String toString() {
		return "spec #" + id + " {" + pre + "} {" + post + "}";
	}
}
