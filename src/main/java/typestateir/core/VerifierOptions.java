// This file is part of the Typestate IR Verifier (tiv).
//
// The Typestate IR Verifier is free software; you can redistribute
// it and/or modify it under the terms of the GNU General Public
// License as published by the Free Software Foundation; either
// version 3 of the License, or (at your option) any later version.
//
// The Typestate IR Verifier is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the
// implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR
// PURPOSE. See the GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public
// License along with the Typestate IR Verifier. If not, see
// <http://www.gnu.org/licenses/>
//
// Copyright 2018, David James Pearce.
package typestateir.core;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Options controlling how verification is dispatched. Defaults are read from
 * the <code>typestate.verifier</code> section of the configuration (see
 * <code>reference.conf</code>), and may be overridden programmatically.
 *
 * @author David J. Pearce
 *
 */
public class VerifierOptions {
	public static final String PATH = "typestate.verifier";
	public static final String PARALLELISM = "parallelism";
	public static final String PARALLEL_NODES = "parallel-nodes";
	public static final String TRACE = "trace";

	/**
	 * Number of threads used to verify functions, where zero means one per
	 * available processor.
	 */
	private int parallelism = 0;

	/**
	 * Flag whether the nodes of a single function are checked as a parallel
	 * batch.
	 */
	private boolean parallelNodes = false;

	/**
	 * Flag whether each node judgement is logged.
	 */
	private boolean trace = false;

	/**
	 * Load options from the default configuration (system properties, then
	 * <code>application.conf</code>, then <code>reference.conf</code>).
	 *
	 * @return
	 */
	public static VerifierOptions load() {
		return from(ConfigFactory.load());
	}

	/**
	 * Extract options from a given configuration. Keys which are absent retain
	 * their defaults.
	 *
	 * @param config
	 * @return
	 */
	public static VerifierOptions from(Config config) {
		VerifierOptions options = new VerifierOptions();
		if (!config.hasPath(PATH)) {
			return options;
		}
		Config c = config.getConfig(PATH);
		if (c.hasPath(PARALLELISM)) {
			options.setParallelism(c.getInt(PARALLELISM));
		}
		if (c.hasPath(PARALLEL_NODES)) {
			options.setParallelNodes(c.getBoolean(PARALLEL_NODES));
		}
		if (c.hasPath(TRACE)) {
			options.setTrace(c.getBoolean(TRACE));
		}
		return options;
	}

	public VerifierOptions setParallelism(int parallelism) {
		if (parallelism < 0) {
			throw new IllegalArgumentException("parallelism cannot be negative");
		}
		this.parallelism = parallelism;
		return this;
	}

	public VerifierOptions setParallelNodes(boolean parallelNodes) {
		this.parallelNodes = parallelNodes;
		return this;
	}

	public VerifierOptions setTrace(boolean trace) {
		this.trace = trace;
		return this;
	}

	public int parallelism() {
		return parallelism;
	}

	/**
	 * Determine the actual number of threads to use.
	 *
	 * @return
	 */
	public int threads() {
		return parallelism == 0 ? Runtime.getRuntime().availableProcessors() : parallelism;
	}

	public boolean parallelNodes() {
		return parallelNodes;
	}

	public boolean trace() {
		return trace;
	}

	@Override
	public String toString() {
		return "{parallelism=" + parallelism + ", parallel-nodes=" + parallelNodes + ", trace=" + trace + "}";
	}
}
