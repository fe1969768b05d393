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

import java.util.Arrays;
import java.util.HashSet;
import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import typestateir.core.Syntax.Bound;
import typestateir.core.Syntax.Function;
import typestateir.core.Syntax.Lifetime;
import typestateir.core.Syntax.Location;
import typestateir.core.Syntax.Node;
import typestateir.core.Syntax.NodeType;
import typestateir.core.Syntax.Operand;
import typestateir.core.Syntax.Signature;
import typestateir.core.Syntax.Type;
import typestateir.core.TypeContext.Substitution;
import typestateir.util.AbstractNodeChecker;
import typestateir.util.Pair;
import typestateir.util.VerificationError;
import typestateir.util.VerificationError.Kind;

/**
 * Responsible for checking every node of a function's control-flow graph
 * against its declared typing. Since every label is annotated, each node is
 * checked exactly once against its own typing and those of its successors,
 * and no fixpoint iteration is required. Nodes are therefore independent of
 * each other and may be checked in any order.
 *
 * @author David J. Pearce
 *
 */
public class CfgChecker extends AbstractNodeChecker<NodeType> {
	private static final Logger LOG = LoggerFactory.getLogger(CfgChecker.class);

	// Error messages
	public final static String UNKNOWN_LABEL = "unknown label";
	public final static String UNKNOWN_FUNCTION = "unknown function";
	public final static String UNKNOWN_LOCATION = "location undeclared";
	public final static String INCOMPLETE_CONTEXT = "context missing location";
	public final static String INCONSISTENT_STATIC = "static location inconsistent with static context";
	public final static String INACTIVE_LIFETIME = "lifetime not active";
	public final static String LIFETIME_ALREADY_ACTIVE = "lifetime already active";
	public final static String STATIC_LIFETIME = "static lifetime cannot begin or end";
	public final static String LIFETIME_IN_USE = "lifetime ends whilst still mentioned";
	public final static String INCOMPATIBLE_LIFETIMES = "incompatible active lifetimes";
	public final static String INCOMPATIBLE_CONTEXT = "incompatible context";
	public final static String INCOMPATIBLE_ARGUMENT = "incompatible argument";
	public final static String INVALID_ARITY = "incorrect number of arguments";
	public final static String INVALID_TYPE_ARGUMENT = "invalid type argument";
	public final static String TARGET_INITIALISED = "target location already initialised";
	public final static String CONDITION_NOT_COPY = "condition type is not copy";
	public final static String SCRUTINEE_MISMATCH = "switched location does not match switch type";
	public final static String BRANCH_MISMATCH = "branch type does not match switch type";
	public final static String NON_EXHAUSTIVE = "switch branches do not cover switch type";
	public final static String INVALID_NARROWING = "branch type cannot narrow switched location";
	public final static String STATIC_SWITCH = "cannot switch on static location";
	public final static String UNSATISFIED_TRAIT = "trait bound not satisfied";
	public final static String UNSATISFIED_BOUND = "outlives bound not entailed";
	public final static String REACHABLE_DEAD_CODE = "dead code is reachable";

	private final Typing typing;
	private final TypeContext context;
	private final Function function;
	private final FunctionVerifier.Exit exit;
	private final boolean parallel;
	private final boolean trace;

	public CfgChecker(Typing typing, Function function, FunctionVerifier.Exit exit, boolean parallel,
			boolean trace) {
		this.typing = typing;
		this.context = typing.context();
		this.function = function;
		this.exit = exit;
		this.parallel = parallel;
		this.trace = trace;
	}

	/**
	 * Check every node in the function. When nodes are checked in parallel, the
	 * failure reported is that of the first failing node in label table order,
	 * exactly as for a sequential check.
	 */
	public void check() {
		if (!parallel) {
			for (int i = 0; i != function.size(); ++i) {
				check(i);
			}
		} else {
			final VerificationError[] errors = new VerificationError[function.size()];
			IntStream.range(0, function.size()).parallel().forEach(i -> {
				try {
					check(i);
				} catch (VerificationError e) {
					errors[i] = e;
				}
			});
			for (VerificationError e : errors) {
				if (e != null) {
					throw e;
				}
			}
		}
	}

	/**
	 * Check the node at a given index in the label table.
	 *
	 * @param index
	 */
	public void check(int index) {
		apply(function.label(index), function.typeAt(index), function.nodeAt(index));
	}

	@Override
	public void apply(String label, NodeType T, Node node) {
		try {
			if (trace) {
				LOG.trace("{} {} |- {}", label, T, node);
			}
			wellFormed(T);
			if (T.locations().containsAbsurd()) {
				// Unreachable, hence vacuously valid
				for (String k : node.successors()) {
					label("T-Absurd", k);
				}
			} else {
				super.apply(label, T, node);
			}
		} catch (VerificationError e) {
			throw e.at(label).at(node);
		}
	}

	/**
	 * T-Assign
	 */
	@Override
	protected void apply(String label, NodeType T, Node.Assign n) {
		LocationContext R1 = T.locations();
		uninitialised("T-Assign", n.target(), R1);
		Pair<LocationContext, Type> p = typing.evaluate(n.rvalue(), R1, T.bounds());
		LocationContext R2 = typing.assign(n.target(), p.second(), p.first());
		successor(label, "T-Assign", n.next(), R2, T.lifetimes(), T.bounds());
	}

	/**
	 * T-Call
	 */
	@Override
	protected void apply(String label, NodeType T, Node.Call n) {
		final String rule = "T-Call";
		LifetimeContext D = T.lifetimes();
		BoundContext F = T.bounds();
		Signature s = context.signature(n.callee());
		check(s != null, Kind.UNRESOLVED_TRAIT_BOUND, rule, UNKNOWN_FUNCTION + " " + n.callee());
		check(s.typeParameters().length == n.typeArguments().length, Kind.TYPE_MISMATCH, rule, INVALID_ARITY);
		check(s.lifetimeParameters().length == n.lifetimeArguments().length, Kind.TYPE_MISMATCH, rule,
				INVALID_ARITY);
		check(s.parameters().length == n.operands().length, Kind.TYPE_MISMATCH, rule, INVALID_ARITY);
		for (Type t : n.typeArguments()) {
			check(!(t instanceof Type.Uninit) && !(t instanceof Type.Absurd), Kind.TYPE_MISMATCH, rule,
					INVALID_TYPE_ARGUMENT);
			context.checkWellFormed(t);
			HashSet<Lifetime> ls = new HashSet<>();
			t.lifetimes(ls);
			for (Lifetime l : ls) {
				check(D.contains(l), Kind.DANGLING_LIFETIME, rule, INACTIVE_LIFETIME + " " + l);
			}
		}
		for (Lifetime l : n.lifetimeArguments()) {
			check(D.contains(l), Kind.DANGLING_LIFETIME, rule, INACTIVE_LIFETIME + " " + l);
		}
		LocationContext R = T.locations();
		uninitialised(rule, n.target(), R);
		Substitution sub = context.bind(s, n.typeArguments(), n.lifetimeArguments());
		// Evaluate arguments left to right
		Operand[] operands = n.operands();
		for (int i = 0; i != operands.length; ++i) {
			Pair<LocationContext, Type> p = typing.evaluate(operands[i], R);
			Type parameter = s.parameters()[i].substitute(sub);
			if (!typing.isSubtype(p.second(), parameter, F)) {
				throw new VerificationError(Kind.TYPE_MISMATCH, rule, INCOMPATIBLE_ARGUMENT, parameter, p.second());
			}
			R = p.first();
		}
		// Check instantiated where-clauses
		for (Bound b : s.where()) {
			Bound bi = b.substitute(sub);
			if (bi instanceof Bound.Trait) {
				Bound.Trait t = (Bound.Trait) bi;
				check(context.holds(t.type(), t.trait()), Kind.UNRESOLVED_TRAIT_BOUND, rule,
						UNSATISFIED_TRAIT + " " + t);
			} else if (!Obligations.entails(F, (Bound.Fact) bi)) {
				throw new VerificationError(Kind.OBLIGATION_UNPROVED, rule, UNSATISFIED_BOUND, bi, F);
			}
		}
		Type ret = s.diverges() ? Type.Absurd : s.returnType().substitute(sub);
		R = typing.assign(n.target(), ret, R);
		successor(label, rule, n.next(), R, D, F);
	}

	/**
	 * T-If
	 */
	@Override
	protected void apply(String label, NodeType T, Node.If n) {
		Pair<LocationContext, Type> p = typing.evaluate(n.condition(), T.locations());
		if (!context.isCopy(p.second())) {
			throw new VerificationError(Kind.TYPE_MISMATCH, "T-If", CONDITION_NOT_COPY, "copy type", p.second());
		}
		successor(label, "T-If", n.trueBranch(), p.first(), T.lifetimes(), T.bounds());
		successor(label, "T-If", n.falseBranch(), p.first(), T.lifetimes(), T.bounds());
	}

	/**
	 * T-Switch
	 */
	@Override
	protected void apply(String label, NodeType T, Node.Switch n) {
		final String rule = "T-Switch";
		LocationContext R = T.locations();
		BoundContext F = T.bounds();
		Location l = n.location();
		check(!l.isStatic(), Kind.TYPE_MISMATCH, rule, STATIC_SWITCH, l);
		Type current = R.get(l);
		check(current != null, Kind.MALFORMED_CONTEXT, rule, UNKNOWN_LOCATION, l);
		check(!(current instanceof Type.Uninit), Kind.USE_AFTER_MOVE, rule, Typing.LOCATION_MOVED, l);
		context.checkWellFormed(n.staticType());
		if (!typing.isSubtype(current, n.staticType(), F)) {
			throw new VerificationError(Kind.TYPE_MISMATCH, rule, SCRUTINEE_MISMATCH, R.put(l, n.staticType()), R,
					l);
		}
		for (Type b : n.branchTypes()) {
			context.checkWellFormed(b);
			if (!typing.isSubtype(b, n.staticType(), F)) {
				throw new VerificationError(Kind.TYPE_MISMATCH, rule, BRANCH_MISMATCH, n.staticType(), b, l);
			}
		}
		if (!typing.covers(n.staticType(), n.branchTypes(), F)) {
			throw new VerificationError(Kind.NON_EXHAUSTIVE_SWITCH, rule, NON_EXHAUSTIVE, n.staticType(),
					Arrays.toString(n.branchTypes()), l);
		}
		for (int i = 0; i != n.branchTypes().length; ++i) {
			Type narrowed = typing.narrow(current, n.branchTypes()[i], F);
			if (narrowed == null) {
				throw new VerificationError(Kind.TYPE_MISMATCH, rule, INVALID_NARROWING,
						R.put(l, n.branchTypes()[i]), R, l);
			}
			successor(label, rule, n.branchLabels()[i], R.put(l, narrowed), T.lifetimes(), F);
		}
	}

	/**
	 * T-Drop
	 */
	@Override
	protected void apply(String label, NodeType T, Node.Drop n) {
		LocationContext R = typing.drop(n.location(), T.locations());
		successor(label, "T-Drop", n.next(), R, T.lifetimes(), T.bounds());
	}

	/**
	 * T-Begin
	 */
	@Override
	protected void apply(String label, NodeType T, Node.LifetimeBegin n) {
		Lifetime l = n.lifetime();
		LifetimeContext D = T.lifetimes();
		check(!l.isStatic(), Kind.MALFORMED_CONTEXT, "T-Begin", STATIC_LIFETIME);
		check(!D.contains(l), Kind.MALFORMED_CONTEXT, "T-Begin", LIFETIME_ALREADY_ACTIVE + " " + l);
		BoundContext F = T.bounds().union(new BoundContext(Obligations.begin(D, l)));
		successor(label, "T-Begin", n.next(), T.locations(), D.add(l), F);
	}

	/**
	 * T-End
	 */
	@Override
	protected void apply(String label, NodeType T, Node.LifetimeEnd n) {
		final String rule = "T-End";
		Lifetime l = n.lifetime();
		LifetimeContext D1 = T.lifetimes();
		check(!l.isStatic(), Kind.MALFORMED_CONTEXT, rule, STATIC_LIFETIME);
		check(D1.contains(l), Kind.MALFORMED_CONTEXT, rule, INACTIVE_LIFETIME + " " + l);
		Location[] ls = T.locations().mentioning(l);
		check(ls.length == 0, Kind.DANGLING_LIFETIME, rule, LIFETIME_IN_USE + " " + l, ls);
		LifetimeContext D2 = D1.remove(l);
		Bound.Fact f = Obligations.unproved(T.bounds(), Obligations.end(D2, l));
		if (f != null) {
			throw new VerificationError(Kind.OBLIGATION_UNPROVED, rule, UNSATISFIED_BOUND, f, T.bounds());
		}
		int k = function.indexOf(n.next());
		if (k >= 0) {
			check(!function.typeAt(k).bounds().mentions(l), Kind.DANGLING_LIFETIME, rule,
					LIFETIME_IN_USE + " " + l);
		}
		successor(label, rule, n.next(), T.locations(), D2, T.bounds());
	}

	/**
	 * T-Dead
	 */
	@Override
	protected void apply(String label, NodeType T, Node.DeadCode n) {
		// Only reached when no location is absurd
		throw new VerificationError(Kind.TYPE_MISMATCH, "T-Dead", REACHABLE_DEAD_CODE, Type.Absurd,
				T.locations());
	}

	/**
	 * Check that control may be transferred to a given label, given the context,
	 * active lifetimes and facts established by the current node.
	 *
	 * @param label
	 * @param rule
	 * @param k
	 * @param R
	 * @param D
	 * @param F
	 */
	private void successor(String label, String rule, String k, LocationContext R, LifetimeContext D,
			BoundContext F) {
		if (trace) {
			LOG.trace("{} => {} : {}; {}; {}", label, k, R, D, F);
		}
		if (R.containsAbsurd()) {
			label(rule, k);
		} else if (k.equals(Function.EXIT)) {
			exit.check(rule, R, D, F);
		} else {
			int index = function.indexOf(k);
			check(index >= 0, Kind.MALFORMED_CONTEXT, rule, UNKNOWN_LABEL + " " + k);
			NodeType Tk = function.typeAt(index);
			if (!D.equals(Tk.lifetimes())) {
				throw new VerificationError(Kind.TYPE_MISMATCH, rule, INCOMPATIBLE_LIFETIMES + " for " + k,
						Tk.lifetimes(), D);
			}
			Location l = typing.mismatch(R, Tk.locations(), F);
			if (l != null) {
				throw new VerificationError(Kind.TYPE_MISMATCH, rule, INCOMPATIBLE_CONTEXT + " for " + k,
						Tk.locations(), R, l);
			}
			Bound.Fact f = Obligations.unproved(F, Tk.bounds().facts());
			if (f != null) {
				throw new VerificationError(Kind.OBLIGATION_UNPROVED, rule, UNSATISFIED_BOUND + " for " + k, f, F);
			}
		}
	}

	private void label(String rule, String k) {
		check(k.equals(Function.EXIT) || function.indexOf(k) >= 0, Kind.MALFORMED_CONTEXT, rule,
				UNKNOWN_LABEL + " " + k);
	}

	/**
	 * Check a declared node typing is well-formed. It must mention every
	 * location of the function and nothing else (bar statics, which must agree
	 * with the static context), its types must be well-formed, and every
	 * lifetime it mentions must be active.
	 *
	 * @param T
	 */
	private void wellFormed(NodeType T) {
		final String rule = "T-WellFormed";
		LocationContext R = T.locations();
		HashSet<Location> scope = new HashSet<>();
		for (Location l : function.locations()) {
			check(R.contains(l), Kind.MALFORMED_CONTEXT, rule, INCOMPLETE_CONTEXT, l);
			scope.add(l);
		}
		HashSet<Lifetime> lifetimes = new HashSet<>();
		for (Location l : R.locations()) {
			Type t = R.get(l);
			if (l.isStatic()) {
				check(t.equals(typing.statics().get(l)), Kind.MALFORMED_CONTEXT, rule, INCONSISTENT_STATIC, l);
			} else {
				check(scope.contains(l), Kind.MALFORMED_CONTEXT, rule, UNKNOWN_LOCATION, l);
			}
			context.checkWellFormed(t);
			t.lifetimes(lifetimes);
		}
		T.bounds().lifetimes(lifetimes);
		for (Lifetime l : lifetimes) {
			check(T.lifetimes().contains(l), Kind.DANGLING_LIFETIME, rule, INACTIVE_LIFETIME + " " + l);
		}
	}

	/**
	 * Check a location is a valid target for initialisation in a given context.
	 */
	private void uninitialised(String rule, Location target, LocationContext R) {
		check(!target.isStatic(), Kind.TYPE_MISMATCH, rule, Typing.STATIC_ASSIGNMENT, target);
		Type t = R.get(target);
		check(t != null, Kind.MALFORMED_CONTEXT, rule, UNKNOWN_LOCATION, target);
		if (!(t instanceof Type.Uninit)) {
			throw new VerificationError(Kind.DOUBLE_INIT, rule, TARGET_INITIALISED, "uninit", t, target);
		}
	}

	private static void check(boolean result, Kind kind, String rule, String msg, Location... locations) {
		if (!result) {
			throw new VerificationError(kind, rule, msg, locations);
		}
	}
}
