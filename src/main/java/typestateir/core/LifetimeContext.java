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

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

import typestateir.core.Syntax.Lifetime;

/**
 * The set of lifetimes active at a given point. The static lifetime is always
 * active, and cannot be removed.
 *
 * @author David J. Pearce
 *
 */
public class LifetimeContext {
	private final TreeSet<Lifetime> lifetimes;

	public LifetimeContext(Lifetime... lifetimes) {
		this.lifetimes = new TreeSet<>();
		this.lifetimes.add(Lifetime.Static);
		Collections.addAll(this.lifetimes, lifetimes);
	}

	public LifetimeContext(Collection<Lifetime> lifetimes) {
		this.lifetimes = new TreeSet<>(lifetimes);
		this.lifetimes.add(Lifetime.Static);
	}

	public boolean contains(Lifetime l) {
		return lifetimes.contains(l);
	}

	public LifetimeContext add(Lifetime l) {
		LifetimeContext r = new LifetimeContext(lifetimes);
		r.lifetimes.add(l);
		return r;
	}

	public LifetimeContext remove(Lifetime l) {
		if (l.isStatic()) {
			throw new IllegalArgumentException("static lifetime cannot be removed");
		}
		LifetimeContext r = new LifetimeContext(lifetimes);
		r.lifetimes.remove(l);
		return r;
	}

	/**
	 * Get the active lifetimes, with <code>'static</code> first.
	 *
	 * @return
	 */
	public Set<Lifetime> lifetimes() {
		return Collections.unmodifiableSet(lifetimes);
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof LifetimeContext && ((LifetimeContext) o).lifetimes.equals(lifetimes);
	}

	@Override
	public int hashCode() {
		return lifetimes.hashCode();
	}

	@Override
	public String toString() {
		String r = "";
		for (Lifetime l : lifetimes) {
			r += r.isEmpty() ? l : ", " + l;
		}
		return "{" + r + "}";
	}
}
