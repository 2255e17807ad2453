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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import gclverify.core.Loc;
import gclverify.io.GclFilePrinter;
import gclverify.types.TypeEnvironment;
import gclverify.util.FreshNames;

/**
 * The state of a single run of proof obligation generation. This accumulates
 * the obligations, specification holes and warnings produced, and tracks the
 * names in scope so that fresh names introduced into predicates never clash
 * with program variables.
 */
public class WpSession {
	/**
	 * Obligations keyed by the printed forms of both sides, such that identical
	 * obligations are only recorded once.
	 */
	private final LinkedHashMap<List<String>, ProofObligation> obligations = new LinkedHashMap<>();
	private final ArrayList<Specification> specifications = new ArrayList<>();
	private final ArrayList<StructWarning> warnings = new ArrayList<>();
	/**
	 * Lexical scopes, innermost first.
	 */
	private final Deque<Set<String>> scopes = new ArrayDeque<>();
	private final TypeEnvironment environment;
	private final boolean checkTermination;
	private int specCounter;

	public WpSession(TypeEnvironment environment, boolean checkTermination) {
		this.environment = environment;
		this.checkTermination = checkTermination;
	}

	public TypeEnvironment getEnvironment() {
		return environment;
	}

	public boolean isCheckTermination() {
		return checkTermination;
	}

	/**
	 * Record a proof obligation <code>pre ⇒ post</code>, unless both sides are
	 * syntactically identical or an identical obligation was already recorded.
	 *
	 * @param pre
	 * @param post
	 * @param origin
	 */
	public void tellPO(Pred pre, Pred post, ProofObligation.Origin origin) {
		String lhs = GclFilePrinter.toString(pre.toExpr());
		String rhs = GclFilePrinter.toString(post.toExpr());
		if (lhs.equals(rhs)) {
			return;
		}
		List<String> key = Arrays.asList(lhs, rhs);
		if (!obligations.containsKey(key)) {
			String hash = Integer.toHexString(key.hashCode());
			obligations.put(key, new ProofObligation(pre, post, hash, origin));
		}
	}

	/**
	 * Allocate the identifier of a specification hole. Identifiers are allocated
	 * in the order holes appear in the program.
	 *
	 * @return
	 */
	public int nextSpecId() {
		return specCounter++;
	}

	public void tellSpec(int id, Pred pre, Pred post, Loc range) {
		specifications.add(new Specification(id, pre, post, environment, range));
	}

	public void tellWarning(StructWarning warning) {
		warnings.add(warning);
	}

	public List<ProofObligation> getObligations() {
		return new ArrayList<>(obligations.values());
	}

	public List<Specification> getSpecifications() {
		ArrayList<Specification> specs = new ArrayList<>(specifications);
		specs.sort(Comparator.comparingInt(Specification::getId));
		return specs;
	}

	public List<StructWarning> getWarnings() {
		return warnings;
	}

	// =========================================================================
	// Scopes
	// =========================================================================

	public void enterScope(Collection<String> names) {
		scopes.push(new LinkedHashSet<>(names));
	}

	public void exitScope() {
		scopes.pop();
	}

	/**
	 * Get every name currently in scope.
	 *
	 * @return
	 */
	public Set<String> getNamesInScope() {
		LinkedHashSet<String> names = new LinkedHashSet<>();
		for (Set<String> s : scopes) {
			names.addAll(s);
		}
		return names;
	}

	public boolean isInScope(String name) {
		for (Set<String> s : scopes) {
			if (s.contains(name)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Choose a readable name based on a given prefix which is neither in scope,
	 * nor in any of the additional name sets given.
	 *
	 * @param prefix
	 * @param avoid
	 * @return
	 */
	@SafeVarargs
	public final String freshInScope(String prefix, Collection<String>... avoid) {
		ArrayList<Collection<String>> all = new ArrayList<>(scopes);
		all.addAll(Arrays.asList(avoid));
		return FreshNames.freshInScope(prefix, all);
	}
}
