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
package typestateir.util;

import java.io.PrintStream;
import java.util.Arrays;

import typestateir.core.Syntax.Location;
import typestateir.util.SyntacticElement.Attribute;

/**
 * This exception is thrown when a node (or the entry/exit contract of a
 * function) fails to type check. Verification is a static decision procedure,
 * hence there is no recovery: the first failure aborts checking of the
 * enclosing function.
 *
 * @author David J. Pearce
 */
public class VerificationError extends RuntimeException {

	/**
	 * The taxonomy of failures reported by the verifier.
	 */
	public enum Kind {
		TYPE_MISMATCH("TypeMismatch"),
		USE_AFTER_MOVE("UseAfterMove"),
		DOUBLE_INIT("DoubleInit"),
		DANGLING_LIFETIME("DanglingLifetime"),
		OBLIGATION_UNPROVED("ObligationUnproved"),
		NON_EXHAUSTIVE_SWITCH("NonExhaustiveSwitch"),
		UNRESOLVED_TRAIT_BOUND("UnresolvedTraitBound"),
		MALFORMED_CONTEXT("MalformedContext");

		private final String name;

		private Kind(String name) {
			this.name = name;
		}

		@Override
		public String toString() {
			return name;
		}
	}

	private static final Location[] NO_LOCATIONS = new Location[0];

	private final Kind kind;
	private final String rule;
	private final String label;
	private final String msg;
	private final String expected;
	private final String actual;
	private final Location[] locations;
	private final Attribute.Source source;

	public VerificationError(Kind kind, String rule, String msg, Location... locations) {
		this(kind, rule, null, msg, null, null, locations, null);
	}

	public VerificationError(Kind kind, String rule, String msg, Object expected, Object actual,
			Location... locations) {
		this(kind, rule, null, msg, str(expected), str(actual), locations, null);
	}

	private VerificationError(Kind kind, String rule, String label, String msg, String expected, String actual,
			Location[] locations, Attribute.Source source) {
		this.kind = kind;
		this.rule = rule;
		this.label = label;
		this.msg = msg;
		this.expected = expected;
		this.actual = actual;
		this.locations = locations == null ? NO_LOCATIONS : locations;
		this.source = source;
	}

	/**
	 * Attach the label of the node being checked when this error was raised. If
	 * the error already identifies a label, it is returned unchanged.
	 *
	 * @param label
	 * @return
	 */
	public VerificationError at(String label) {
		if (this.label != null) {
			return this;
		}
		VerificationError e = new VerificationError(kind, rule, label, msg, expected, actual, locations, source);
		e.setStackTrace(getStackTrace());
		return e;
	}

	/**
	 * Attach the source position (if any) of a given element to this error.
	 *
	 * @param element
	 * @return
	 */
	public VerificationError at(SyntacticElement element) {
		Attribute.Source s = element == null ? null : element.attribute(Attribute.Source.class);
		if (s == null || source != null) {
			return this;
		}
		VerificationError e = new VerificationError(kind, rule, label, msg, expected, actual, locations, s);
		e.setStackTrace(getStackTrace());
		return e;
	}

	public Kind kind() {
		return kind;
	}

	/**
	 * Name of the typing rule which failed (e.g. <code>T-Assign</code>).
	 *
	 * @return
	 */
	public String rule() {
		return rule;
	}

	/**
	 * Label of the node being checked, or <code>null</code> if the failure was not
	 * attributable to a specific node.
	 *
	 * @return
	 */
	public String label() {
		return label;
	}

	public String msg() {
		return msg;
	}

	public String expected() {
		return expected;
	}

	public String actual() {
		return actual;
	}

	public Location[] locations() {
		return locations;
	}

	public Attribute.Source source() {
		return source;
	}

	@Override
	public String getMessage() {
		String r = (label == null ? "" : label + ": ") + kind + " (" + rule + "): " + msg;
		if (locations.length > 0) {
			r += " at " + Arrays.toString(locations);
		}
		if (expected != null || actual != null) {
			r += " [expected " + expected + ", found " + actual + "]";
		}
		return r;
	}

	/**
	 * Output this error to a given output stream, prefixed by the source position
	 * when one is known.
	 */
	public void outputSourceError(PrintStream output) {
		if (source == null) {
			output.println("verification error: " + getMessage());
		} else {
			output.println(source + ": " + getMessage());
		}
		if (expected != null) {
			output.println("  expected: " + expected);
		}
		if (actual != null) {
			output.println("  found:    " + actual);
		}
	}

	private static String str(Object o) {
		return o == null ? null : o.toString();
	}

	public static final long serialVersionUID = 1l;
}
