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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import typestateir.core.Syntax.Function;
import typestateir.core.Syntax.Program;

/**
 * Verifies every function of a program. Functions are verified independently
 * of each other on a pool of threads, sharing only the (immutable) type and
 * static contexts. A rejected function does not affect the verdict for any
 * other function. Judgements are returned in declaration order.
 *
 * @author David J. Pearce
 *
 */
public class ProgramVerifier {
	private static final Logger LOG = LoggerFactory.getLogger(ProgramVerifier.class);

	private final VerifierOptions options;

	public ProgramVerifier(VerifierOptions options) {
		this.options = options;
	}

	public ProgramVerifier() {
		this(VerifierOptions.load());
	}

	public List<Judgement> apply(Program program) throws InterruptedException, ExecutionException {
		final FunctionVerifier verifier = new FunctionVerifier(program.context(), program.statics(), options);
		final Function[] functions = program.functions();
		final ArrayList<Judgement> judgements = new ArrayList<>();
		if (functions.length == 0) {
			return judgements;
		}
		final ExecutorService executor = Executors.newFixedThreadPool(Math.min(options.threads(), functions.length));
		try {
			final ArrayList<Future<Judgement>> futures = new ArrayList<>();
			for (Function f : functions) {
				futures.add(executor.submit(() -> verifier.apply(f)));
			}
			for (Future<Judgement> f : futures) {
				judgements.add(get(f));
			}
		} finally {
			executor.shutdown();
		}
		int rejected = 0;
		for (Judgement j : judgements) {
			if (!j.accepted()) {
				LOG.info("{}", j);
				rejected++;
			}
		}
		LOG.info("verified {} function(s), {} rejected", judgements.size(), rejected);
		return judgements;
	}

	/**
	 * Wait for a judgement, rethrowing any unchecked exception raised whilst
	 * producing it.
	 */
	private static Judgement get(Future<Judgement> f) throws InterruptedException, ExecutionException {
		try {
			return f.get();
		} catch (ExecutionException e) {
			if (e.getCause() instanceof RuntimeException) {
				throw (RuntimeException) e.getCause();
			}
			throw e;
		}
	}
}
