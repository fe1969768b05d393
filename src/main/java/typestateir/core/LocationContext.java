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
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import typestateir.core.Syntax.Lifetime;
import typestateir.core.Syntax.Location;
import typestateir.core.Syntax.Type;
import typestateir.util.Pair;
import typestateir.util.VerificationError;

/**
 * A single-valued mapping from locations to their current types. Contexts are
 * values: every update produces a fresh context and leaves the original
 * untouched.
 *
 * @author David J. Pearce
 *
 */
public class LocationContext {
	/**
	 * Constant to reduce unnecessary context instances.
	 */
	public final static LocationContext EMPTY = new LocationContext();

	private final TreeMap<Location, Type> mapping;

	/**
	 * Construct a context from a list of bindings. Each location may be bound at
	 * most once.
	 *
	 * @param bindings
	 */
	@SafeVarargs
	public LocationContext(Pair<Location, Type>... bindings) {
		this.mapping = new TreeMap<>();
		for (Pair<Location, Type> b : bindings) {
			if (mapping.put(b.first(), b.second()) != null) {
				throw new VerificationError(VerificationError.Kind.MALFORMED_CONTEXT, "T-Context",
						"location bound more than once", b.first());
			}
		}
	}

	private LocationContext(Map<Location, Type> mapping) {
		this.mapping = new TreeMap<>(mapping);
	}

	/**
	 * Get the type currently associated with a given location, or
	 * <code>null</code> if it is not mentioned.
	 *
	 * @param location
	 * @return
	 */
	public Type get(Location location) {
		return mapping.get(location);
	}

	public boolean contains(Location location) {
		return mapping.containsKey(location);
	}

	/**
	 * Update the type associated with a given location.
	 *
	 * @param location
	 * @param type
	 * @return
	 */
	public LocationContext put(Location location, Type type) {
		LocationContext nctx = new LocationContext(mapping);
		nctx.mapping.put(location, type);
		return nctx;
	}

	/**
	 * Remove a given location from this context.
	 *
	 * @param location
	 * @return
	 */
	public LocationContext remove(Location location) {
		LocationContext nctx = new LocationContext(mapping);
		nctx.mapping.remove(location);
		return nctx;
	}

	/**
	 * Get the locations mentioned in this context, in order.
	 *
	 * @return
	 */
	public Set<Location> locations() {
		return Collections.unmodifiableSet(mapping.keySet());
	}

	public int size() {
		return mapping.size();
	}

	/**
	 * Check whether any location is typed with the uninhabited type. Such a
	 * context cannot arise at runtime.
	 *
	 * @return
	 */
	public boolean containsAbsurd() {
		return mapping.containsValue(Type.Absurd);
	}

	/**
	 * Determine which locations have types mentioning a given lifetime.
	 *
	 * @param l
	 * @return
	 */
	public Location[] mentioning(Lifetime l) {
		ArrayList<Location> r = new ArrayList<>();
		for (Map.Entry<Location, Type> e : mapping.entrySet()) {
			if (e.getValue().mentions(l)) {
				r.add(e.getKey());
			}
		}
		return r.toArray(new Location[r.size()]);
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof LocationContext && ((LocationContext) o).mapping.equals(mapping);
	}

	@Override
	public int hashCode() {
		return mapping.hashCode();
	}

	@Override
	public String toString() {
		String body = "{";
		boolean firstTime = true;
		for (Map.Entry<Location, Type> e : mapping.entrySet()) {
			if (!firstTime) {
				body = body + ", ";
			}
			firstTime = false;
			body = body + e.getKey() + ": " + e.getValue();
		}
		return body + "}";
	}
}
