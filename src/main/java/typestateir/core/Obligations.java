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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import typestateir.core.Syntax.Bound;
import typestateir.core.Syntax.Lifetime;
import typestateir.core.Syntax.Type;

/**
 * Decides entailment of outlives facts, and derives the facts introduced when
 * a lifetime begins or ends. Entailment is closed under reflexivity and
 * transitivity, and <code>'static</code> outlives everything.
 *
 * @author David J. Pearce
 *
 */
public class Obligations {

	/**
	 * Determine whether <code>a: b</code> follows from a given set of facts.
	 *
	 * @param facts
	 * @param a
	 * @param b
	 * @return
	 */
	public static boolean outlives(BoundContext facts, Lifetime a, Lifetime b) {
		if (a.equals(b) || a.isStatic()) {
			return true;
		}
		HashSet<Lifetime> visited = new HashSet<>();
		ArrayDeque<Lifetime> worklist = new ArrayDeque<>();
		worklist.add(a);
		visited.add(a);
		while (!worklist.isEmpty()) {
			Lifetime l = worklist.poll();
			for (Bound.Fact f : facts.facts()) {
				if (f instanceof Bound.Outlives) {
					Bound.Outlives o = (Bound.Outlives) f;
					if (o.longer().equals(l) && visited.add(o.shorter())) {
						if (o.shorter().equals(b) || o.shorter().isStatic()) {
							return true;
						}
						worklist.add(o.shorter());
					}
				}
			}
		}
		return false;
	}

	/**
	 * Determine whether a given fact follows from a given set of facts. A
	 * type-outlives fact <code>T: a</code> holds either when stated (for some
	 * lifetime outliving <code>a</code>), or structurally when every lifetime
	 * reachable through <code>T</code> outlives <code>a</code>.
	 *
	 * @param facts
	 * @param fact
	 * @return
	 */
	public static boolean entails(BoundContext facts, Bound.Fact fact) {
		if (fact instanceof Bound.Outlives) {
			Bound.Outlives o = (Bound.Outlives) fact;
			return outlives(facts, o.longer(), o.shorter());
		} else {
			Bound.TypeOutlives o = (Bound.TypeOutlives) fact;
			return entails(facts, o.type(), o.shorter());
		}
	}

	private static boolean entails(BoundContext facts, Type type, Lifetime shorter) {
		for (Bound.Fact f : facts.facts()) {
			if (f instanceof Bound.TypeOutlives) {
				Bound.TypeOutlives o = (Bound.TypeOutlives) f;
				if (o.type().equals(type) && outlives(facts, o.shorter(), shorter)) {
					return true;
				}
			}
		}
		if (type instanceof Type.Uninit || type instanceof Type.Absurd) {
			// no references reachable
			return true;
		} else if (type instanceof Type.Named) {
			Type.Named t = (Type.Named) type;
			for (Lifetime l : t.lifetimeArguments()) {
				if (!outlives(facts, l, shorter)) {
					return false;
				}
			}
			for (Type arg : t.arguments()) {
				if (!entails(facts, arg, shorter)) {
					return false;
				}
			}
			return true;
		}
		// Parameters must be stated
		return false;
	}

	/**
	 * Determine whether every fact in <code>required</code> follows from
	 * <code>facts</code>.
	 *
	 * @param facts
	 * @param required
	 * @return
	 */
	public static boolean entails(BoundContext facts, BoundContext required) {
		return unproved(facts, required.facts()) == null;
	}

	/**
	 * Find the first fact in a given collection which does not follow from
	 * <code>facts</code>, or <code>null</code> if they all do.
	 *
	 * @param facts
	 * @param required
	 * @return
	 */
	public static Bound.Fact unproved(BoundContext facts, Iterable<? extends Bound.Fact> required) {
		for (Bound.Fact f : required) {
			if (!entails(facts, f)) {
				return f;
			}
		}
		return null;
	}

	/**
	 * Derive the facts available when beginning a lifetime <code>l</code>: every
	 * already active lifetime outlives it.
	 *
	 * @param active
	 * @param l
	 * @return
	 */
	public static List<Bound.Fact> begin(LifetimeContext active, Lifetime l) {
		return outlivedBy(active, l);
	}

	/**
	 * Derive the facts which must hold when ending a lifetime <code>l</code>:
	 * every lifetime still active must outlive it.
	 *
	 * @param remaining
	 * @param l
	 * @return
	 */
	public static List<Bound.Fact> end(LifetimeContext remaining, Lifetime l) {
		return outlivedBy(remaining, l);
	}

	private static List<Bound.Fact> outlivedBy(LifetimeContext lifetimes, Lifetime l) {
		ArrayList<Bound.Fact> r = new ArrayList<>();
		for (Lifetime a : lifetimes.lifetimes()) {
			if (!a.equals(l)) {
				r.add(new Bound.Outlives(a, l));
			}
		}
		return r;
	}
}
