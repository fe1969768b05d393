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

import typestateir.core.Syntax.Signature;
import typestateir.util.VerificationError;

/**
 * The verdict reached for a single function. A generic function is judged
 * once, universally quantified over its parameters and where-clauses.
 *
 * @author David J. Pearce
 *
 */
public class Judgement {
	private final Signature signature;
	private final VerificationError error;

	public Judgement(Signature signature, VerificationError error) {
		this.signature = signature;
		this.error = error;
	}

	public Signature signature() {
		return signature;
	}

	public String name() {
		return signature.name();
	}

	public boolean accepted() {
		return error == null;
	}

	/**
	 * Get the reason for rejection, or <code>null</code> if the function was
	 * accepted.
	 *
	 * @return
	 */
	public VerificationError error() {
		return error;
	}

	@Override
	public String toString() {
		String q = signature.quantifier();
		String r = (q.isEmpty() ? "" : q + " ") + signature.name() + " : ";
		return r + (error == null ? "ok" : "rejected: " + error.getMessage());
	}
}
