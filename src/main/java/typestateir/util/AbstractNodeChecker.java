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

import typestateir.core.Syntax.Node;

/**
 * Dispatches a node of the control-flow graph to the rule for its kind. The set
 * of node kinds is closed, hence every kind has exactly one abstract method
 * here: adding a kind without a rule leaves a gap in every subclass.
 *
 * @author David J. Pearce
 *
 * @param <T> The typing against which a node is checked.
 */
public abstract class AbstractNodeChecker<T> {

	public void apply(String label, T typing, Node node) {
		switch (node.getKind()) {
		case ASSIGN:
			apply(label, typing, (Node.Assign) node);
			return;
		case CALL:
			apply(label, typing, (Node.Call) node);
			return;
		case IF:
			apply(label, typing, (Node.If) node);
			return;
		case SWITCH:
			apply(label, typing, (Node.Switch) node);
			return;
		case DROP:
			apply(label, typing, (Node.Drop) node);
			return;
		case LIFETIME_BEGIN:
			apply(label, typing, (Node.LifetimeBegin) node);
			return;
		case LIFETIME_END:
			apply(label, typing, (Node.LifetimeEnd) node);
			return;
		case DEAD_CODE:
			apply(label, typing, (Node.DeadCode) node);
			return;
		}
		throw new IllegalArgumentException("Invalid node encountered: " + node);
	}

	/**
	 * Check a given assignment node.
	 *
	 * @param label  The label of the node being checked.
	 * @param typing The declared typing of the node.
	 * @param node   The node being checked.
	 */
	protected abstract void apply(String label, T typing, Node.Assign node);

	/**
	 * Check a given call node.
	 *
	 * @param label  The label of the node being checked.
	 * @param typing The declared typing of the node.
	 * @param node   The node being checked.
	 */
	protected abstract void apply(String label, T typing, Node.Call node);

	/**
	 * Check a given conditional branch.
	 *
	 * @param label  The label of the node being checked.
	 * @param typing The declared typing of the node.
	 * @param node   The node being checked.
	 */
	protected abstract void apply(String label, T typing, Node.If node);

	/**
	 * Check a given multi-way branch over the variants of a location.
	 *
	 * @param label  The label of the node being checked.
	 * @param typing The declared typing of the node.
	 * @param node   The node being checked.
	 */
	protected abstract void apply(String label, T typing, Node.Switch node);

	/**
	 * Check a given drop node.
	 *
	 * @param label  The label of the node being checked.
	 * @param typing The declared typing of the node.
	 * @param node   The node being checked.
	 */
	protected abstract void apply(String label, T typing, Node.Drop node);

	/**
	 * Check a node which begins a lifetime.
	 *
	 * @param label  The label of the node being checked.
	 * @param typing The declared typing of the node.
	 * @param node   The node being checked.
	 */
	protected abstract void apply(String label, T typing, Node.LifetimeBegin node);

	/**
	 * Check a node which ends a lifetime.
	 *
	 * @param label  The label of the node being checked.
	 * @param typing The declared typing of the node.
	 * @param node   The node being checked.
	 */
	protected abstract void apply(String label, T typing, Node.LifetimeEnd node);

	/**
	 * Check a node marked as unreachable.
	 *
	 * @param label  The label of the node being checked.
	 * @param typing The declared typing of the node.
	 * @param node   The node being checked.
	 */
	protected abstract void apply(String label, T typing, Node.DeadCode node);
}
