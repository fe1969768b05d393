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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import typestateir.core.Syntax.Bound;
import typestateir.core.Syntax.Function;
import typestateir.core.Syntax.Location;
import typestateir.core.Syntax.NodeType;
import typestateir.core.Syntax.Signature;
import typestateir.core.Syntax.Type;
import typestateir.util.VerificationError;
import typestateir.util.VerificationError.Kind;

/**
 * Responsible for verifying a single function. This checks the declared
 * typing of the <code>entry</code> label against the function's signature,
 * then checks every node of the body. Control reaching the (virtual)
 * <code>exit</code> label must have consumed every parameter and local,
 * initialised the return slot, and ended every local lifetime.
 *
 * @author David J. Pearce
 *
 */
public class FunctionVerifier {
	private static final Logger LOG = LoggerFactory.getLogger(FunctionVerifier.class);

	// Error messages
	public final static String MISSING_ENTRY = "function has no entry label";
	public final static String DEFINED_EXIT = "exit label cannot be defined";
	public final static String INCOMPATIBLE_PARAMETER = "parameter type incompatible with entry";
	public final static String INITIALISED_LOCAL = "local initialised on entry";
	public final static String INVALID_RETURN_SLOT = "return slot invalid on entry";
	public final static String INVALID_ENTRY_LIFETIMES = "entry lifetimes must be the lifetime parameters";
	public final static String UNSUPPORTED_ASSUMPTION = "entry assumption not implied by where-clauses";
	public final static String UNCONSUMED_LOCATION = "location not consumed on exit";
	public final static String INCOMPATIBLE_RETURN = "return value incompatible with return type";
	public final static String UNENDED_LIFETIME = "local lifetime not ended on exit";
	public final static String UNESTABLISHED_BOUND = "where-clause not established on exit";

	private final TypeContext context;
	private final LocationContext statics;
	private final VerifierOptions options;

	public FunctionVerifier(TypeContext context, LocationContext statics, VerifierOptions options) {
		this.context = context;
		this.statics = statics;
		this.options = options;
	}

	/**
	 * Verify a given function, producing a judgement which either accepts it or
	 * records why it was rejected.
	 *
	 * @param f
	 * @return
	 */
	public Judgement apply(Function f) {
		try {
			check(f);
			LOG.debug("accepted {}", f.name());
			return new Judgement(f.signature(), null);
		} catch (VerificationError e) {
			LOG.debug("rejected {}: {}", f.name(), e.getMessage());
			return new Judgement(f.signature(), e);
		}
	}

	/**
	 * Verify a given function, throwing an error on the first failure.
	 *
	 * @param f
	 */
	public void check(Function f) {
		Signature s = f.signature();
		TypeContext ctx = context.extend(s.typeParameters(), s.lifetimeParameters(), s.where());
		Typing typing = new Typing(ctx, statics);
		Exit exit = new Exit(typing, f);
		try {
			int entry = f.indexOf(Function.ENTRY);
			check(entry >= 0, Kind.MALFORMED_CONTEXT, MISSING_ENTRY);
			check(f.indexOf(Function.EXIT) < 0, Kind.MALFORMED_CONTEXT, DEFINED_EXIT);
			for (Type t : s.parameters()) {
				ctx.checkWellFormed(t);
			}
			entry(typing, f, f.typeAt(entry), exit.where);
		} catch (VerificationError e) {
			throw e.at(Function.ENTRY);
		}
		new CfgChecker(typing, f, exit, options.parallelNodes(), options.trace()).check();
	}

	/**
	 * T-Entry
	 */
	private void entry(Typing typing, Function f, NodeType T, BoundContext where) {
		final String rule = "T-Entry";
		Signature s = f.signature();
		LocationContext R = T.locations();
		for (int i = 0; i != s.parameters().length; ++i) {
			Location p = f.parameter(i);
			Type declared = s.parameters()[i];
			Type actual = R.get(p);
			check(actual != null, Kind.MALFORMED_CONTEXT, CfgChecker.INCOMPLETE_CONTEXT, p);
			if (!typing.isSubtype(declared, actual, where)) {
				throw new VerificationError(Kind.TYPE_MISMATCH, rule, INCOMPATIBLE_PARAMETER, actual, declared, p);
			}
		}
		for (String name : f.locals()) {
			Location l = Location.local(name);
			Type t = R.get(l);
			check(t != null, Kind.MALFORMED_CONTEXT, CfgChecker.INCOMPLETE_CONTEXT, l);
			if (!(t instanceof Type.Uninit)) {
				throw new VerificationError(Kind.TYPE_MISMATCH, rule, INITIALISED_LOCAL, "uninit", t, l);
			}
		}
		Type ret = R.get(Location.RETURN);
		if (s.diverges()) {
			check(ret instanceof Type.Uninit, Kind.TYPE_MISMATCH, INVALID_RETURN_SLOT, Location.RETURN);
		} else {
			Type expected = new Type.Uninit(typing.context().sizeOf(s.returnType()));
			if (!expected.equals(ret)) {
				throw new VerificationError(Kind.TYPE_MISMATCH, rule, INVALID_RETURN_SLOT, expected, ret,
						Location.RETURN);
			}
		}
		LifetimeContext D = new LifetimeContext(s.lifetimeParameters());
		if (!D.equals(T.lifetimes())) {
			throw new VerificationError(Kind.TYPE_MISMATCH, rule, INVALID_ENTRY_LIFETIMES, D, T.lifetimes());
		}
		Bound.Fact f1 = Obligations.unproved(where, T.bounds().facts());
		if (f1 != null) {
			throw new VerificationError(Kind.OBLIGATION_UNPROVED, rule, UNSUPPORTED_ASSUMPTION, f1, where);
		}
	}

	/**
	 * Extract the outlives facts from a where-clause.
	 *
	 * @param where
	 * @return
	 */
	public static BoundContext facts(Bound[] where) {
		ArrayList<Bound.Fact> facts = new ArrayList<>();
		for (Bound b : where) {
			if (b instanceof Bound.Fact) {
				facts.add((Bound.Fact) b);
			}
		}
		return new BoundContext(facts);
	}

	private static void check(boolean result, Kind kind, String msg, Location... locations) {
		if (!result) {
			throw new VerificationError(kind, "T-Entry", msg, locations);
		}
	}

	/**
	 * The requirements placed on control reaching the <code>exit</code> label of
	 * a given function.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Exit {
		private final Typing typing;
		private final Function function;
		private final LifetimeContext lifetimes;
		private final BoundContext where;

		public Exit(Typing typing, Function function) {
			this.typing = typing;
			this.function = function;
			this.lifetimes = new LifetimeContext(function.signature().lifetimeParameters());
			this.where = facts(function.signature().where());
		}

		/**
		 * T-Exit
		 *
		 * @param rule The rule of the node transferring control to exit.
		 * @param R    The context on transfer.
		 * @param D    The active lifetimes on transfer.
		 * @param F    The facts established on transfer.
		 */
		public void check(String rule, LocationContext R, LifetimeContext D, BoundContext F) {
			Location[] locations = function.locations();
			for (int i = 1; i < locations.length; ++i) {
				Type t = R.get(locations[i]);
				if (!(t instanceof Type.Uninit)) {
					throw new VerificationError(Kind.TYPE_MISMATCH, rule, UNCONSUMED_LOCATION, required(R), R,
							locations[i]);
				}
			}
			Type declared = function.signature().returnType();
			Type actual = R.get(Location.RETURN);
			if (actual == null || !typing.isSubtype(actual, declared, F)) {
				throw new VerificationError(Kind.TYPE_MISMATCH, rule, INCOMPATIBLE_RETURN, required(R), R,
						Location.RETURN);
			}
			if (!lifetimes.equals(D)) {
				throw new VerificationError(Kind.DANGLING_LIFETIME, rule, UNENDED_LIFETIME, lifetimes, D);
			}
			Bound.Fact f = Obligations.unproved(F, where.facts());
			if (f != null) {
				throw new VerificationError(Kind.OBLIGATION_UNPROVED, rule, UNESTABLISHED_BOUND, f, F);
			}
		}

		/**
		 * Construct the context required on exit, relative to the context on
		 * transfer. The return slot holds the declared return type, and every
		 * other location of the function is uninitialised.
		 *
		 * @param R
		 * @return
		 */
		private LocationContext required(LocationContext R) {
			LocationContext E = R.put(Location.RETURN, function.signature().returnType());
			Location[] locations = function.locations();
			for (int i = 1; i < locations.length; ++i) {
				Type t = R.get(locations[i]);
				if (t != null && !(t instanceof Type.Uninit)) {
					E = E.put(locations[i], new Type.Uninit(typing.context().sizeOf(t)));
				}
			}
			return E;
		}
	}
}
