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
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import typestateir.core.Syntax.Bound;
import typestateir.core.Syntax.Lifetime;

/**
 * A set of outlives facts assumed (or established) at a given point.
 *
 * @author David J. Pearce
 *
 */
public class BoundContext {
	public final static BoundContext EMPTY = new BoundContext();

	private final HashSet<Bound.Fact> facts;

	public BoundContext(Bound.Fact... facts) {
		this.facts = new HashSet<>();
		Collections.addAll(this.facts, facts);
	}

	public BoundContext(Collection<? extends Bound.Fact> facts) {
		this.facts = new HashSet<>(facts);
	}

	public boolean contains(Bound.Fact f) {
		return facts.contains(f);
	}

	public BoundContext add(Bound.Fact f) {
		BoundContext r = new BoundContext(facts);
		r.facts.add(f);
		return r;
	}

	public BoundContext remove(Bound.Fact f) {
		BoundContext r = new BoundContext(facts);
		r.facts.remove(f);
		return r;
	}

	public BoundContext union(BoundContext other) {
		BoundContext r = new BoundContext(facts);
		r.facts.addAll(other.facts);
		return r;
	}

	public Set<Bound.Fact> facts() {
		return Collections.unmodifiableSet(facts);
	}

	public boolean isEmpty() {
		return facts.isEmpty();
	}

	/**
	 * Check whether any fact in this context refers to a given lifetime.
	 *
	 * @param l
	 * @return
	 */
	public boolean mentions(Lifetime l) {
		for (Bound.Fact f : facts) {
			if (f.mentions(l)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Collect all lifetimes referred to by facts in this context.
	 *
	 * @param lifetimes
	 */
	public void lifetimes(Set<Lifetime> lifetimes) {
		for (Bound.Fact f : facts) {
			if (f instanceof Bound.Outlives) {
				Bound.Outlives o = (Bound.Outlives) f;
				lifetimes.add(o.longer());
				lifetimes.add(o.shorter());
			} else {
				Bound.TypeOutlives o = (Bound.TypeOutlives) f;
				o.type().lifetimes(lifetimes);
				lifetimes.add(o.shorter());
			}
		}
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof BoundContext && ((BoundContext) o).facts.equals(facts);
	}

	@Override
	public int hashCode() {
		return facts.hashCode();
	}

	@Override
	public String toString() {
		ArrayList<String> fs = new ArrayList<>();
		for (Bound.Fact f : facts) {
			fs.add(f.toString());
		}
		Collections.sort(fs);
		String r = "";
		for (String f : fs) {
			r += r.isEmpty() ? f : ", " + f;
		}
		return "{" + r + "}";
	}
}
