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
package typestateir.testing;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static typestateir.testing.IrBuilder.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import typestateir.core.BoundContext;
import typestateir.core.CfgChecker;
import typestateir.core.FunctionVerifier;
import typestateir.core.LocationContext;
import typestateir.core.Syntax.Bound;
import typestateir.core.Syntax.Function;
import typestateir.core.Syntax.Lifetime;
import typestateir.core.Syntax.Location;
import typestateir.core.Syntax.Node;
import typestateir.core.Syntax.Operand;
import typestateir.core.Syntax.RValue;
import typestateir.core.Syntax.Type;
import typestateir.core.VerifierOptions;
import typestateir.util.VerificationError;
import typestateir.util.VerificationError.Kind;

/**
 * Tests for checking the nodes of a function body against their declared
 * typings. Every function is checked both sequentially and with its nodes
 * checked as a parallel batch, and both must agree on the outcome.
 *
 * @author David J. Pearce
 *
 */
public class CfgCheckerTests {
	private static final Location p = param("p");
	private static final Location q = param("q");
	private static final Location s = param("s");
	private static final Location x = local("x");
	private static final Location r = local("r");
	private static final Location u = local("u");
	private static final Location G = global("G");
	private static final Location H = global("H");

	private static final LocationContext STATICS = ctx(G, Int, H, Box(Int));

	private static final Type[] NO_TYPES = new Type[0];
	private static final Lifetime[] NO_LIFETIMES = new Lifetime[0];
	private static final String[] NO_PARAMETERS = new String[0];

	// ==============================================================
	// Assignment
	// ==============================================================

	@Test
	public void test_assign_01() {
		// fn mv(p: Box<Int>) -> Box<Int> { entry: ret = p; }
		Function f = new Function.Builder(sig("mv", Box(Int), Box(Int))).parameters("p")
				.node("entry", nt(ctx(RET, Uninit(8), p, Box(Int))), new Node.Assign(RET, rv(p), "exit")).build();
		checkValid(f);
	}

	@Test
	public void test_assign_02() {
		// Use after move
		Function f = new Function.Builder(sig("dup", Unit, Box(Int))).parameters("p").locals("x", "r")
				.node("entry", nt(ctx(RET, Uninit(0), p, Box(Int), x, Uninit(8), r, Uninit(8))),
						new Node.Assign(x, rv(p), "n1"))
				.node("n1", nt(ctx(RET, Uninit(0), p, Uninit(8), x, Box(Int), r, Uninit(8))),
						new Node.Assign(r, rv(p), "exit"))
				.build();
		checkInvalid(Kind.USE_AFTER_MOVE, "n1", f);
	}

	@Test
	public void test_assign_03() {
		// Double initialisation
		Function f = new Function.Builder(sig("twice", Int))
				.node("entry", nt(ctx(RET, Uninit(4))), new Node.Assign(RET, rv(constant(Int, "1")), "n1"))
				.node("n1", nt(ctx(RET, Int)), new Node.Assign(RET, rv(constant(Int, "2")), "exit")).build();
		checkInvalid(Kind.DOUBLE_INIT, "n1", f);
	}

	@Test
	public void test_assign_04() {
		// Declared typing of successor disagrees
		Function f = new Function.Builder(sig("wrong", Int))
				.node("entry", nt(ctx(RET, Uninit(4))), new Node.Assign(RET, rv(constant(Int, "1")), "n1"))
				.node("n1", nt(ctx(RET, Bool)), new Node.Assign(RET, rv(constant(Int, "2")), "exit")).build();
		checkInvalid(Kind.TYPE_MISMATCH, "entry", f);
	}

	@Test
	public void test_assign_05() {
		// Arithmetic on copy values leaves them intact
		Function f = new Function.Builder(sig("inc", Int, Int)).parameters("p")
				.node("entry", nt(ctx(RET, Uninit(4), p, Int)),
						new Node.Assign(RET, new RValue.Binary("add", use(p), constant(Int, "1")), "n1"))
				.node("n1", nt(ctx(RET, Int, p, Int)), new Node.Drop(p, "exit")).build();
		checkValid(f);
	}

	@Test
	public void test_assign_06() {
		// A linear parameter must be consumed before exit
		Function f = new Function.Builder(sig("leak", Unit, Box(Int))).parameters("p")
				.node("entry", nt(ctx(RET, Uninit(0), p, Box(Int))), new Node.Assign(RET, UNIT, "exit")).build();
		checkInvalid(Kind.TYPE_MISMATCH, "entry", f);
	}

	@Test
	public void test_assign_07() {
		Function f = new Function.Builder(sig("lost", Unit))
				.node("entry", nt(ctx(RET, Uninit(0))), new Node.Assign(RET, UNIT, "nowhere")).build();
		checkInvalid(Kind.MALFORMED_CONTEXT, "entry", f);
	}

	// ==============================================================
	// Statics
	// ==============================================================

	@Test
	public void test_static_01() {
		Function f = new Function.Builder(sig("read", Int))
				.node("entry", nt(ctx(RET, Uninit(4))), new Node.Assign(RET, rv(G), "exit")).build();
		checkValid(f);
	}

	@Test
	public void test_static_02() {
		// Statics may appear in a typing, provided they agree
		Function f = new Function.Builder(sig("read", Int))
				.node("entry", nt(ctx(RET, Uninit(4), G, Int)), new Node.Assign(RET, rv(G), "exit")).build();
		checkValid(f);
		f = new Function.Builder(sig("read", Int))
				.node("entry", nt(ctx(RET, Uninit(4), G, Bool)), new Node.Assign(RET, rv(G), "exit")).build();
		checkInvalid(Kind.MALFORMED_CONTEXT, "entry", f);
	}

	@Test
	public void test_static_03() {
		// Cannot move out of a static
		Function f = new Function.Builder(sig("steal", Box(Int)))
				.node("entry", nt(ctx(RET, Uninit(8))), new Node.Assign(RET, rv(H), "exit")).build();
		checkInvalid(Kind.TYPE_MISMATCH, "entry", f);
	}

	@Test
	public void test_static_04() {
		Function f = new Function.Builder(sig("write", Unit))
				.node("entry", nt(ctx(RET, Uninit(0))), new Node.Assign(G, rv(constant(Int, "1")), "exit"))
				.build();
		checkInvalid(Kind.TYPE_MISMATCH, "entry", f);
	}

	@Test
	public void test_static_05() {
		// A static mentioned before an edge may be omitted after it
		Function f = new Function.Builder(sig("read", Int))
				.node("entry", nt(ctx(RET, Uninit(4), G, Int)), new Node.Assign(RET, rv(G), "n1"))
				.node("n1", nt(ctx(RET, Int)), new Node.If(constant(Bool, "true"), Function.EXIT, Function.EXIT))
				.build();
		checkValid(f);
	}

	@Test
	public void test_static_06() {
		// A static omitted before an edge may be mentioned after it
		Function f = new Function.Builder(sig("read", Int))
				.node("entry", nt(ctx(RET, Uninit(4))), new Node.Assign(RET, rv(G), "n1"))
				.node("n1", nt(ctx(RET, Int, G, Int, H, Box(Int))),
						new Node.If(use(G), Function.EXIT, Function.EXIT))
				.build();
		checkValid(f);
	}

	// ==============================================================
	// Tracing
	// ==============================================================

	@Test
	public void test_trace_01() {
		Function f = new Function.Builder(sig("one", Int))
				.node("entry", nt(ctx(RET, Uninit(4))), new Node.Assign(RET, rv(constant(Int, "1")), "n1"))
				.node("n1", nt(ctx(RET, Int)), new Node.If(constant(Bool, "true"), Function.EXIT, Function.EXIT))
				.build();
		Logger logger = (Logger) LoggerFactory.getLogger(CfgChecker.class);
		ListAppender<ILoggingEvent> appender = new ListAppender<>();
		appender.start();
		Level level = logger.getLevel();
		logger.setLevel(Level.TRACE);
		logger.addAppender(appender);
		try {
			new FunctionVerifier(CONTEXT, STATICS, new VerifierOptions().setTrace(true)).check(f);
		} finally {
			logger.detachAppender(appender);
			logger.setLevel(level);
		}
		List<String> messages = new ArrayList<>();
		for (ILoggingEvent e : appender.list) {
			messages.add(e.getFormattedMessage());
		}
		// Incoming typing of each node, then the context on each edge
		assertTrue(messages.toString(), contains(messages, "entry " + nt(ctx(RET, Uninit(4)))));
		assertTrue(messages.toString(), contains(messages, "entry => n1 : " + ctx(RET, Int)));
		assertTrue(messages.toString(), contains(messages, "n1 => exit : " + ctx(RET, Int)));
	}

	private static boolean contains(List<String> messages, String prefix) {
		for (String m : messages) {
			if (m.startsWith(prefix)) {
				return true;
			}
		}
		return false;
	}

	// ==============================================================
	// Lifetimes
	// ==============================================================

	@Test
	public void test_lifetime_01() {
		// Lifetime ends whilst a reference into it remains
		Function f = new Function.Builder(sig("scope", Unit)).locals("r")
				.node("entry", nt(ctx(RET, Uninit(0), r, Uninit(8))), new Node.LifetimeBegin(l, "n1"))
				.node("n1", nt(ctx(RET, Uninit(0), r, Uninit(8)), lifetimes(l)),
						new Node.Assign(r, rv(constant(Ref(l, Int), "&x")), "n2"))
				.node("n2", nt(ctx(RET, Uninit(0), r, Ref(l, Int)), lifetimes(l)), new Node.LifetimeEnd(l, "n3"))
				.node("n3", nt(ctx(RET, Uninit(0), r, Ref(l, Int))), new Node.Drop(r, "n4"))
				.node("n4", nt(ctx(RET, Uninit(0), r, Uninit(8))), new Node.Assign(RET, UNIT, "exit")).build();
		checkInvalid(Kind.DANGLING_LIFETIME, "n2", f);
	}

	@Test
	public void test_lifetime_02() {
		// Reference discarded before its lifetime ends
		Function f = new Function.Builder(sig("scope", Unit)).locals("r")
				.node("entry", nt(ctx(RET, Uninit(0), r, Uninit(8))), new Node.LifetimeBegin(l, "n1"))
				.node("n1", nt(ctx(RET, Uninit(0), r, Uninit(8)), lifetimes(l)),
						new Node.Assign(r, rv(constant(Ref(l, Int), "&x")), "n2"))
				.node("n2", nt(ctx(RET, Uninit(0), r, Ref(l, Int)), lifetimes(l)), new Node.Drop(r, "n3"))
				.node("n3", nt(ctx(RET, Uninit(0), r, Uninit(8)), lifetimes(l)), new Node.LifetimeEnd(l, "n4"))
				.node("n4", nt(ctx(RET, Uninit(0), r, Uninit(8))), new Node.Assign(RET, UNIT, "exit")).build();
		checkValid(f);
	}

	@Test
	public void test_lifetime_03() {
		// Local lifetime still active on exit
		Function f = new Function.Builder(sig("open", Unit))
				.node("entry", nt(ctx(RET, Uninit(0))), new Node.LifetimeBegin(l, "n1"))
				.node("n1", nt(ctx(RET, Uninit(0)), lifetimes(l)), new Node.Assign(RET, UNIT, "exit")).build();
		checkInvalid(Kind.DANGLING_LIFETIME, "n1", f);
	}

	@Test
	public void test_lifetime_04() {
		// Ending a local lifetime nested within a lifetime parameter
		Function f = nested(facts(outlives(a, l)));
		checkValid(f);
	}

	@Test
	public void test_lifetime_05() {
		// Without 'a: 'l, the parameter lifetime may end first
		Function f = nested(facts());
		checkInvalid(Kind.OBLIGATION_UNPROVED, "n1", f);
	}

	@Test
	public void test_lifetime_06() {
		Function f = new Function.Builder(sig("twice", Unit))
				.node("entry", nt(ctx(RET, Uninit(0))), new Node.LifetimeBegin(l, "n1"))
				.node("n1", nt(ctx(RET, Uninit(0)), lifetimes(l)), new Node.LifetimeBegin(l, "n2"))
				.node("n2", nt(ctx(RET, Uninit(0)), lifetimes(l)), new Node.LifetimeEnd(l, "n3"))
				.node("n3", nt(ctx(RET, Uninit(0))), new Node.Assign(RET, UNIT, "exit")).build();
		checkInvalid(Kind.MALFORMED_CONTEXT, "n1", f);
	}

	@Test
	public void test_lifetime_07() {
		Function f = new Function.Builder(sig("never", Unit))
				.node("entry", nt(ctx(RET, Uninit(0))), new Node.LifetimeEnd(l, "n1"))
				.node("n1", nt(ctx(RET, Uninit(0))), new Node.Assign(RET, UNIT, "exit")).build();
		checkInvalid(Kind.MALFORMED_CONTEXT, "entry", f);
		f = new Function.Builder(sig("never", Unit))
				.node("entry", nt(ctx(RET, Uninit(0))), new Node.LifetimeEnd(Static, "n1"))
				.node("n1", nt(ctx(RET, Uninit(0))), new Node.Assign(RET, UNIT, "exit")).build();
		checkInvalid(Kind.MALFORMED_CONTEXT, "entry", f);
	}

	@Test
	public void test_lifetime_08() {
		// Active lifetimes disagree with successor
		Function f = new Function.Builder(sig("skip", Unit))
				.node("entry", nt(ctx(RET, Uninit(0))), new Node.Assign(RET, UNIT, "n1"))
				.node("n1", nt(ctx(RET, Unit), lifetimes(l)), new Node.LifetimeEnd(l, "exit")).build();
		checkInvalid(Kind.TYPE_MISMATCH, "entry", f);
	}

	@Test
	public void test_lifetime_09() {
		// Typing mentions an inactive lifetime. The first label in the table is
		// reported, regardless of where entry lies.
		Function f = new Function.Builder(sig("f", Unit, Int)).parameters("p")
				.node("n1", nt(ctx(RET, Unit, p, Ref(l, Int))), new Node.Drop(p, "exit"))
				.node("entry", nt(ctx(RET, Uninit(0), p, Int)), new Node.Assign(RET, UNIT, "n1")).build();
		checkInvalid(Kind.DANGLING_LIFETIME, "n1", f);
	}

	@Test
	public void test_lifetime_10() {
		// Successor assumes facts which do not follow
		Function f = new Function.Builder(sig("assume", Unit))
				.node("entry", nt(ctx(RET, Uninit(0))), new Node.LifetimeBegin(l, "n1"))
				.node("n1", nt(ctx(RET, Uninit(0)), lifetimes(l)), new Node.LifetimeBegin(b, "n2"))
				.node("n2", nt(ctx(RET, Uninit(0)), lifetimes(l, b), facts(outlives(b, l))),
						new Node.LifetimeEnd(b, "n3"))
				.node("n3", nt(ctx(RET, Uninit(0)), lifetimes(l)), new Node.LifetimeEnd(l, "n4"))
				.node("n4", nt(ctx(RET, Uninit(0))), new Node.Assign(RET, UNIT, "exit")).build();
		checkInvalid(Kind.OBLIGATION_UNPROVED, "n1", f);
	}

	// ==============================================================
	// Control Flow
	// ==============================================================

	@Test
	public void test_if_01() {
		Function f = new Function.Builder(sig("choose", Int, Bool)).parameters("p")
				.node("entry", nt(ctx(RET, Uninit(4), p, Bool)), new Node.If(use(p), "n1", "n2"))
				.node("n1", nt(ctx(RET, Uninit(4), p, Bool)), new Node.Assign(RET, rv(constant(Int, "1")), "n3"))
				.node("n2", nt(ctx(RET, Uninit(4), p, Bool)), new Node.Assign(RET, rv(constant(Int, "2")), "n3"))
				.node("n3", nt(ctx(RET, Int, p, Bool)), new Node.Drop(p, "exit")).build();
		checkValid(f);
	}

	@Test
	public void test_if_02() {
		Function f = new Function.Builder(sig("choose", Unit, Box(Int))).parameters("p")
				.node("entry", nt(ctx(RET, Uninit(0), p, Box(Int))), new Node.If(use(p), "n1", "n1"))
				.node("n1", nt(ctx(RET, Uninit(0), p, Uninit(8))), new Node.Assign(RET, UNIT, "exit")).build();
		checkInvalid(Kind.TYPE_MISMATCH, "entry", f);
	}

	@Test
	public void test_loop_01() {
		// Cyclic control flow requires no special treatment
		Function f = new Function.Builder(sig("spin", Unit, Int)).parameters("p").locals("x")
				.node("entry", nt(ctx(RET, Uninit(0), p, Int, x, Uninit(1))),
						new Node.Assign(x, new RValue.Binary("lt", use(p), constant(Int, "10")), "n1"))
				.node("n1", nt(ctx(RET, Uninit(0), p, Int, x, Bool)), new Node.If(use(x), "n2", "n3"))
				.node("n2", nt(ctx(RET, Uninit(0), p, Int, x, Bool)), new Node.Drop(x, "entry"))
				.node("n3", nt(ctx(RET, Uninit(0), p, Int, x, Bool)), new Node.Drop(x, "n4"))
				.node("n4", nt(ctx(RET, Uninit(0), p, Int, x, Uninit(1))), new Node.Drop(p, "n5"))
				.node("n5", nt(ctx(RET, Uninit(0), p, Uninit(4), x, Uninit(1))), new Node.Assign(RET, UNIT, "exit"))
				.build();
		checkValid(f);
	}

	@Test
	public void test_loop_02() {
		// Looping back having moved a box
		Function f = new Function.Builder(sig("spin", Unit, Box(Int))).parameters("p").locals("x", "u")
				.node("entry", nt(ctx(RET, Uninit(0), p, Box(Int), x, Uninit(8), u, Uninit(0))),
						new Node.Assign(x, rv(p), "n1"))
				.node("n1", nt(ctx(RET, Uninit(0), p, Uninit(8), x, Box(Int), u, Uninit(0))),
						new Node.Call(u, "free", new Type[] { Int }, NO_LIFETIMES, new Operand[] { use(x) }, "entry"))
				.build();
		checkInvalid(Kind.TYPE_MISMATCH, "n1", f);
	}

	@Test
	public void test_dead_01() {
		Function f = new Function.Builder(sig("fail", Unit))
				.node("entry", nt(ctx(RET, Uninit(0))),
						new Node.Call(RET, "abort", NO_TYPES, NO_LIFETIMES, new Operand[0], "n1"))
				.node("n1", nt(ctx(RET, Absurd)), new Node.DeadCode()).build();
		checkValid(f);
	}

	@Test
	public void test_dead_02() {
		Function f = new Function.Builder(sig("diverge", Absurd))
				.node("entry", nt(ctx(RET, Uninit(0))),
						new Node.Call(RET, "abort", NO_TYPES, NO_LIFETIMES, new Operand[0], "exit"))
				.build();
		checkValid(f);
	}

	@Test
	public void test_dead_03() {
		Function f = new Function.Builder(sig("bad", Unit)).node("entry", nt(ctx(RET, Uninit(0))), new Node.DeadCode())
				.build();
		checkInvalid(Kind.TYPE_MISMATCH, "entry", f);
	}

	@Test
	public void test_dead_04() {
		// An unreachable node still names only known labels
		Function f = new Function.Builder(sig("fail", Unit))
				.node("entry", nt(ctx(RET, Uninit(0))),
						new Node.Call(RET, "abort", NO_TYPES, NO_LIFETIMES, new Operand[0], "n1"))
				.node("n1", nt(ctx(RET, Absurd)), new Node.Assign(RET, UNIT, "nowhere")).build();
		checkInvalid(Kind.MALFORMED_CONTEXT, "n1", f);
	}

	// ==============================================================
	// Switch
	// ==============================================================

	@Test
	public void test_switch_01() {
		Function f = shapes(new Type[] { Circle, Square, Triangle }, Shape);
		checkValid(f);
	}

	@Test
	public void test_switch_02() {
		Function f = shapes(new Type[] { Circle, Square }, Shape);
		checkInvalid(Kind.NON_EXHAUSTIVE_SWITCH, "entry", f);
	}

	@Test
	public void test_switch_03() {
		// Branches disjoint from the switched value are unreachable
		Function f = new Function.Builder(sig("circles", Unit, Circle)).parameters("s")
				.node("entry", nt(ctx(RET, Uninit(0), s, Circle)),
						new Node.Switch(s, Shape, new Type[] { Circle, Square, Triangle },
								new String[] { "c", "q", "t" }))
				.node("c", nt(ctx(RET, Uninit(0), s, Circle)), destroy("exit"))
				.node("q", nt(ctx(RET, Uninit(0), s, Absurd)), new Node.DeadCode())
				.node("t", nt(ctx(RET, Uninit(0), s, Absurd)), new Node.DeadCode()).build();
		checkValid(f);
	}

	@Test
	public void test_switch_04() {
		// Switched value must match the switch type
		Function f = shapes(new Type[] { Circle, Square, Triangle }, Option(Int));
		checkInvalid(Kind.TYPE_MISMATCH, "entry", f);
	}

	@Test
	public void test_switch_05() {
		Function f = new Function.Builder(sig("maybe", Unit, Option(Int))).parameters("p")
				.node("entry", nt(ctx(RET, Uninit(0), p, Option(Int))),
						new Node.Switch(p, Option(Int), new Type[] { Some(Int), None(Int) }, new String[] { "n1", "n2" }))
				.node("n1", nt(ctx(RET, Uninit(0), p, Some(Int))), new Node.Drop(p, "n3"))
				.node("n2", nt(ctx(RET, Uninit(0), p, None(Int))), new Node.Drop(p, "n3"))
				.node("n3", nt(ctx(RET, Uninit(0), p, Uninit(16))), new Node.Assign(RET, UNIT, "exit")).build();
		checkValid(f);
	}

	@Test
	public void test_switch_06() {
		Function f = new Function.Builder(sig("global", Unit))
				.node("entry", nt(ctx(RET, Uninit(0))), new Node.Switch(G, Int, new Type[] { Int }, new String[] { "n1" }))
				.node("n1", nt(ctx(RET, Uninit(0))), new Node.Assign(RET, UNIT, "exit")).build();
		checkInvalid(Kind.TYPE_MISMATCH, "entry", f);
	}

	// ==============================================================
	// Calls
	// ==============================================================

	@Test
	public void test_call_01() {
		// fn free_box(p: Box<Int>) { entry: ret = free<Int>(p); }
		Function f = new Function.Builder(sig("free_box", Unit, Box(Int))).parameters("p")
				.node("entry", nt(ctx(RET, Uninit(0), p, Box(Int))),
						new Node.Call(RET, "free", new Type[] { Int }, NO_LIFETIMES, new Operand[] { use(p) }, "exit"))
				.build();
		checkValid(f);
	}

	@Test
	public void test_call_02() {
		Function f = new Function.Builder(sig("nope", Unit))
				.node("entry", nt(ctx(RET, Uninit(0))),
						new Node.Call(RET, "missing", NO_TYPES, NO_LIFETIMES, new Operand[0], "exit"))
				.build();
		checkInvalid(Kind.UNRESOLVED_TRAIT_BOUND, "entry", f);
	}

	@Test
	public void test_call_03() {
		// Wrong number of type arguments
		Function f = new Function.Builder(sig("free_box", Unit, Box(Int))).parameters("p")
				.node("entry", nt(ctx(RET, Uninit(0), p, Box(Int))),
						new Node.Call(RET, "free", NO_TYPES, NO_LIFETIMES, new Operand[] { use(p) }, "exit"))
				.build();
		checkInvalid(Kind.TYPE_MISMATCH, "entry", f);
	}

	@Test
	public void test_call_04() {
		// Argument incompatible with parameter
		Function f = new Function.Builder(sig("free_int", Unit, Int)).parameters("p")
				.node("entry", nt(ctx(RET, Uninit(0), p, Int)),
						new Node.Call(RET, "free", new Type[] { Int }, NO_LIFETIMES, new Operand[] { use(p) }, "exit"))
				.build();
		checkInvalid(Kind.TYPE_MISMATCH, "entry", f);
	}

	@Test
	public void test_call_05() {
		Function f = pick(new Bound[] { outlives(a, b) }, facts(outlives(a, b)), new Lifetime[] { a, b });
		checkValid(f);
	}

	@Test
	public void test_call_06() {
		// Callee requires 'a: 'b which is not known
		Function f = pick(new Bound[0], facts(), new Lifetime[] { a, b });
		checkInvalid(Kind.OBLIGATION_UNPROVED, "entry", f);
	}

	@Test
	public void test_call_07() {
		// Lifetime arguments swapped
		Function f = pick(new Bound[] { outlives(a, b) }, facts(outlives(a, b)), new Lifetime[] { b, a });
		checkInvalid(Kind.TYPE_MISMATCH, "entry", f);
	}

	@Test
	public void test_call_08() {
		// copy<Box<Int>> has no Copy impl
		Function f = new Function.Builder(sig("cp", Box(Int), Box(Int))).parameters("p")
				.node("entry", nt(ctx(RET, Uninit(8), p, Box(Int))), new Node.Call(RET, "copy",
						new Type[] { Box(Int) }, NO_LIFETIMES, new Operand[] { use(p) }, "exit"))
				.build();
		checkInvalid(Kind.UNRESOLVED_TRAIT_BOUND, "entry", f);
	}

	@Test
	public void test_call_09() {
		Function f = new Function.Builder(sig("cp", Int, Int)).parameters("p")
				.node("entry", nt(ctx(RET, Uninit(4), p, Int)),
						new Node.Call(RET, "copy", new Type[] { Int }, NO_LIFETIMES, new Operand[] { use(p) }, "n1"))
				.node("n1", nt(ctx(RET, Int, p, Int)), new Node.Drop(p, "exit")).build();
		checkValid(f);
	}

	@Test
	public void test_call_10() {
		// Generic function checked once for all T: Copy
		checkValid(generic(new Bound[] { new Bound.Trait(Param("T"), "Copy") }));
	}

	@Test
	public void test_call_11() {
		// Without T: Copy, the parameter is moved and copy<T> unresolved
		checkInvalid(Kind.UNRESOLVED_TRAIT_BOUND, "entry", generic(new Bound[0]));
	}

	@Test
	public void test_call_12() {
		// keep<Int>['a] requires Int: 'a, which holds structurally
		Function f = keep(a, NO_PARAMETERS, Int, new Bound[0], facts());
		checkValid(f);
	}

	@Test
	public void test_call_13() {
		// Lifetime argument not active
		Function f = keep(l, NO_PARAMETERS, Int, new Bound[0], facts());
		checkInvalid(Kind.DANGLING_LIFETIME, "entry", f);
	}

	@Test
	public void test_call_14() {
		// keep<T>['a] requires T: 'a, which must be stated
		Bound.TypeOutlives Ta = new Bound.TypeOutlives(Param("T"), a);
		checkInvalid(Kind.OBLIGATION_UNPROVED, "entry", keep(a, new String[] { "T" }, Param("T"), new Bound[0], facts()));
		checkValid(keep(a, new String[] { "T" }, Param("T"), new Bound[] { Ta }, facts(Ta)));
	}

	@Test
	public void test_call_15() {
		// Allocating moves the argument into the box
		Function f = new Function.Builder(sig("boxed", Box(Box(Int)), Box(Int))).parameters("p")
				.node("entry", nt(ctx(RET, Uninit(8), p, Box(Int))), new Node.Call(RET, "alloc",
						new Type[] { Box(Int) }, NO_LIFETIMES, new Operand[] { use(p) }, "exit"))
				.build();
		checkValid(f);
	}

	// ==============================================================
	// Helpers
	// ==============================================================

	/**
	 * <pre>
	 * fn nested&lt;'a&gt;(p: Ref&lt;'a, Int&gt;) {
	 *   entry: begin 'l
	 *   n1:    end 'l
	 *   n2:    drop p
	 *   n3:    ret = ()
	 * }
	 * </pre>
	 *
	 * The facts assumed at <code>n1</code> are given.
	 */
	private static Function nested(BoundContext facts) {
		return new Function.Builder(sig("nested", NO_PARAMETERS, new Lifetime[] { a }, new Bound[0], Unit, Ref(a, Int)))
				.parameters("p")
				.node("entry", nt(ctx(RET, Uninit(0), p, Ref(a, Int)), lifetimes(a)), new Node.LifetimeBegin(l, "n1"))
				.node("n1", nt(ctx(RET, Uninit(0), p, Ref(a, Int)), lifetimes(a, l), facts),
						new Node.LifetimeEnd(l, "n2"))
				.node("n2", nt(ctx(RET, Uninit(0), p, Ref(a, Int)), lifetimes(a)), new Node.Drop(p, "n3"))
				.node("n3", nt(ctx(RET, Uninit(0), p, Uninit(8)), lifetimes(a)), new Node.Assign(RET, UNIT, "exit"))
				.build();
	}

	/**
	 * A function consuming a shape by switching on it, and then destroying it in
	 * each branch.
	 */
	private static Function shapes(Type[] branches, Type switchType) {
		String[] labels = new String[branches.length];
		Function.Builder builder = new Function.Builder(sig("consume", Unit, Shape)).parameters("s");
		for (int i = 0; i != branches.length; ++i) {
			labels[i] = "b" + i;
		}
		builder.node("entry", nt(ctx(RET, Uninit(0), s, Shape)), new Node.Switch(s, switchType, branches, labels));
		for (int i = 0; i != branches.length; ++i) {
			builder.node(labels[i], nt(ctx(RET, Uninit(0), s, branches[i])), destroy("exit"));
		}
		return builder.build();
	}

	private static Node destroy(String next) {
		return new Node.Call(RET, "destroy", NO_TYPES, NO_LIFETIMES, new Operand[] { use(s) }, next);
	}

	/**
	 * <pre>
	 * fn pick&lt;'a, 'b&gt;(p: Ref&lt;'a, Int&gt;, q: Ref&lt;'b, Int&gt;) -&gt; Ref&lt;'b, Int&gt; where ... {
	 *   entry: ret = longest&lt;...&gt;(p, q)
	 *   n1:    drop p
	 *   n2:    drop q
	 * }
	 * </pre>
	 */
	private static Function pick(Bound[] where, BoundContext facts, Lifetime[] arguments) {
		Lifetime[] ab = { a, b };
		return new Function.Builder(sig("pick", NO_PARAMETERS, ab, where, Ref(b, Int), Ref(a, Int), Ref(b, Int)))
				.parameters("p", "q")
				.node("entry", nt(ctx(RET, Uninit(8), p, Ref(a, Int), q, Ref(b, Int)), lifetimes(ab), facts),
						new Node.Call(RET, "longest", NO_TYPES, arguments, new Operand[] { use(p), use(q) }, "n1"))
				.node("n1", nt(ctx(RET, Ref(b, Int), p, Ref(a, Int), q, Ref(b, Int)), lifetimes(ab), facts),
						new Node.Drop(p, "n2"))
				.node("n2", nt(ctx(RET, Ref(b, Int), p, Uninit(8), q, Ref(b, Int)), lifetimes(ab), facts),
						new Node.Drop(q, "exit"))
				.build();
	}

	/**
	 * <pre>
	 * fn gen&lt;T&gt;(p: T) -&gt; T where ... {
	 *   entry: ret = copy&lt;T&gt;(p)
	 *   n1:    drop p
	 * }
	 * </pre>
	 */
	private static Function generic(Bound[] where) {
		Type T = Param("T");
		return new Function.Builder(sig("gen", new String[] { "T" }, NO_LIFETIMES, where, T, T)).parameters("p")
				.node("entry", nt(ctx(RET, Uninit("T"), p, T)),
						new Node.Call(RET, "copy", new Type[] { T }, NO_LIFETIMES, new Operand[] { use(p) }, "n1"))
				.node("n1", nt(ctx(RET, T, p, T)), new Node.Drop(p, "exit")).build();
	}

	/**
	 * <pre>
	 * fn k&lt;'a, ...&gt;(p: Ref&lt;'a, T&gt;) where ... {
	 *   entry: ret = keep&lt;T&gt;['l](p)
	 *   n1:    drop p
	 * }
	 * </pre>
	 */
	private static Function keep(Lifetime argument, String[] parameters, Type T, Bound[] where,
			BoundContext facts) {
		Lifetime[] la = { a };
		return new Function.Builder(sig("k", parameters, la, where, Unit, Ref(a, T))).parameters("p")
				.node("entry", nt(ctx(RET, Uninit(0), p, Ref(a, T)), lifetimes(la), facts),
						new Node.Call(RET, "keep", new Type[] { T }, new Lifetime[] { argument },
								new Operand[] { use(p) }, "n1"))
				.node("n1", nt(ctx(RET, Unit, p, Ref(a, T)), lifetimes(la), facts), new Node.Drop(p, "exit"))
				.build();
	}

	/**
	 * Check a function verifies, both sequentially and with nodes checked in
	 * parallel.
	 *
	 * @param f
	 */
	public static void checkValid(Function f) {
		for (VerifierOptions options : options()) {
			try {
				new FunctionVerifier(CONTEXT, STATICS, options).check(f);
			} catch (VerificationError e) {
				e.outputSourceError(System.out);
				fail("function should have verified: " + e.getMessage());
			}
		}
	}

	/**
	 * Check a function fails to verify, and that the first failure found has a
	 * given kind and occurs at a given label, both sequentially and with nodes
	 * checked in parallel.
	 *
	 * @param kind
	 * @param label
	 * @param f
	 */
	public static void checkInvalid(Kind kind, String label, Function f) {
		for (VerifierOptions options : options()) {
			try {
				new FunctionVerifier(CONTEXT, STATICS, options).check(f);
				fail("function shouldn't have verified");
			} catch (VerificationError e) {
				e.outputSourceError(System.out);
				assertEquals(e.getMessage(), kind, e.kind());
				assertEquals(e.getMessage(), label, e.label());
			}
		}
	}

	private static VerifierOptions[] options() {
		return new VerifierOptions[] { new VerifierOptions(), new VerifierOptions().setParallelNodes(true) };
	}
}
