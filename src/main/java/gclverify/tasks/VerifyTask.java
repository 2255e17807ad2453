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
package gclverify.tasks;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gclverify.core.GclException;
import gclverify.core.GclFile;
import gclverify.core.Kind;
import gclverify.core.Name;
import gclverify.core.TypedFile;
import gclverify.types.Elaborator;
import gclverify.types.TypeEnvironment;
import gclverify.wp.ObligationGenerator;
import gclverify.wp.ProofObligation;
import gclverify.wp.Specification;
import gclverify.wp.StructWarning;

/**
 * Runs the two phases of verification over a parsed program: elaboration
 * (kind and type inference) followed by proof obligation generation. The task
 * performs no I/O, and stops at the first failure of either phase.
 */
public class VerifyTask {
	private static final Logger LOGGER = LoggerFactory.getLogger(VerifyTask.class);
	/**
	 * Specify whether to print verbose progress messages or not
	 */
	private boolean verbose = false;
	/**
	 * Specify whether termination (and bound decrement) obligations are
	 * generated for loops.
	 */
	private boolean checkTermination = true;

	public VerifyTask setVerbose(boolean flag) {
		this.verbose = flag;
		return this;
	}

	public VerifyTask setCheckTermination(boolean flag) {
		this.checkTermination = flag;
		return this;
	}

	public boolean isCheckTermination() {
		return checkTermination;
	}

	/**
	 * The business end of a verification task. Elaborates the given program and
	 * then generates its proof obligations, specification holes and warnings.
	 *
	 * @param program --- The parsed program being verified.
	 * @return
	 * @throws GclException
	 */
	public Result run(GclFile.Program program) throws GclException {
		long start = System.currentTimeMillis();
		Elaborator elaborator = new Elaborator();
		TypedFile.Program typed = elaborator.elaborate(program);
		TypeEnvironment env = elaborator.getEnvironment();
		if (verbose) {
			LOGGER.info("elaborated program ({} bindings, {} datatypes) in {}ms", env.size(),
					elaborator.getKinds().size(), System.currentTimeMillis() - start);
		}
		start = System.currentTimeMillis();
		ObligationGenerator generator = ObligationGenerator.create(env, checkTermination);
		generator.structProgram(typed);
		Result result = new Result(typed, env, elaborator.getKinds(), generator.getSession().getObligations(),
				generator.getSession().getSpecifications(), generator.getSession().getWarnings());
		if (verbose) {
			LOGGER.info("generated {} obligations, {} specifications, {} warnings in {}ms",
					result.getObligations().size(), result.getSpecifications().size(), result.getWarnings().size(),
					System.currentTimeMillis() - start);
		}
		return result;
	}

	public static class Result {
		private final TypedFile.Program program;
		private final TypeEnvironment environment;
		private final Map<Name, Kind> kinds;
		private final List<ProofObligation> obligations;
		private final List<Specification> specifications;
		private final List<StructWarning> warnings;

		public Result(TypedFile.Program program, TypeEnvironment environment, Map<Name, Kind> kinds,
				List<ProofObligation> obligations, List<Specification> specifications, List<StructWarning> warnings) {
			this.program = program;
			this.environment = environment;
			this.kinds = kinds;
			this.obligations = obligations;
			this.specifications = specifications;
			this.warnings = warnings;
		}

		public TypedFile.Program getProgram() {
			return program;
		}

		public TypeEnvironment getEnvironment() {
			return environment;
		}

		/**
		 * Get the inferred kind of each declared datatype.
		 *
		 * @return
		 */
		public Map<Name, Kind> getKinds() {
			return kinds;
		}

		public List<ProofObligation> getObligations() {
			return obligations;
		}

		public List<Specification> getSpecifications() {
			return specifications;
		}

		public List<StructWarning> getWarnings() {
			return warnings;
		}
	}
}
