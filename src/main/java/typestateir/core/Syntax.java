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
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import typestateir.core.TypeContext.Substitution;
import typestateir.util.SyntacticElement;
import typestateir.util.VerificationError;

/**
 * The syntax of the typestate intermediate representation. Every function is a
 * table of labelled nodes, where each label carries the typing (a
 * <code>NodeType</code>) required of whoever transfers control to it.
 *
 * @author David J. Pearce
 *
 */
public class Syntax {

	/**
	 * An addressable slot whose type can change over time. A location carries no
	 * type itself; this lives in a <code>LocationContext</code>.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Location implements Comparable<Location> {
		public enum Kind {
			RETURN, PARAMETER, LOCAL, STATIC
		}

		/**
		 * The return slot of the enclosing function.
		 */
		public static final Location RETURN = new Location(Kind.RETURN, "ret");

		private final Kind kind;
		private final String name;

		private Location(Kind kind, String name) {
			this.kind = kind;
			this.name = name;
		}

		public static Location parameter(String name) {
			return new Location(Kind.PARAMETER, name);
		}

		public static Location local(String name) {
			return new Location(Kind.LOCAL, name);
		}

		public static Location global(String name) {
			return new Location(Kind.STATIC, name);
		}

		public Kind kind() {
			return kind;
		}

		public String name() {
			return name;
		}

		/**
		 * Statics are visible program-wide, whilst all other locations are scoped to
		 * a single function.
		 *
		 * @return
		 */
		public boolean isStatic() {
			return kind == Kind.STATIC;
		}

		@Override
		public int compareTo(Location o) {
			int c = kind.compareTo(o.kind);
			return c != 0 ? c : name.compareTo(o.name);
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Location) {
				Location l = (Location) o;
				return kind == l.kind && name.equals(l.name);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return kind.hashCode() ^ name.hashCode();
		}

		@Override
		public String toString() {
			return kind == Kind.STATIC ? "::" + name : name;
		}
	}

	/**
	 * The byte size of a type. This is either known outright, or is the size of
	 * some (as yet uninstantiated) type parameter.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static abstract class Size {

		public static Size of(int bytes) {
			return new Fixed(bytes);
		}

		public static Size of(String parameter) {
			return new Of(parameter);
		}

		public abstract Size substitute(Substitution s);

		public static class Fixed extends Size {
			private final int bytes;

			public Fixed(int bytes) {
				if (bytes < 0) {
					throw new IllegalArgumentException("negative size");
				}
				this.bytes = bytes;
			}

			public int bytes() {
				return bytes;
			}

			@Override
			public Size substitute(Substitution s) {
				return this;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Fixed && ((Fixed) o).bytes == bytes;
			}

			@Override
			public int hashCode() {
				return bytes;
			}

			@Override
			public String toString() {
				return Integer.toString(bytes);
			}
		}

		public static class Of extends Size {
			private final String parameter;

			public Of(String parameter) {
				this.parameter = parameter;
			}

			public String parameter() {
				return parameter;
			}

			@Override
			public Size substitute(Substitution s) {
				return s.sizeOf(parameter);
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Of && ((Of) o).parameter.equals(parameter);
			}

			@Override
			public int hashCode() {
				return parameter.hashCode();
			}

			@Override
			public String toString() {
				return "size(" + parameter + ")";
			}
		}
	}

	public interface Type {

		/**
		 * Apply a given substitution of type and lifetime parameters to this type.
		 *
		 * @param s
		 * @return
		 */
		public Type substitute(Substitution s);

		/**
		 * Check whether this type refers to a given lifetime anywhere within it.
		 *
		 * @param l
		 * @return
		 */
		public boolean mentions(Lifetime l);

		/**
		 * Collect all lifetimes referred to by this type.
		 *
		 * @param lifetimes
		 */
		public void lifetimes(Set<Lifetime> lifetimes);

		/**
		 * Collect all type parameters referred to by this type.
		 *
		 * @param parameters
		 */
		public void parameters(Set<String> parameters);

		/**
		 * Constant representing the uninhabited type.
		 */
		public static final Type Absurd = new Absurd();

		public static abstract class AbstractType implements Type {
			@Override
			public Type substitute(Substitution s) {
				return this;
			}

			@Override
			public boolean mentions(Lifetime l) {
				return false;
			}

			@Override
			public void lifetimes(Set<Lifetime> lifetimes) {

			}

			@Override
			public void parameters(Set<String> parameters) {

			}
		}

		/**
		 * Represents a location which holds no value, but which retains the size of
		 * whatever it held (or will hold).
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class Uninit extends AbstractType {
			private final Size size;

			public Uninit(Size size) {
				this.size = size;
			}

			public Uninit(int bytes) {
				this(Size.of(bytes));
			}

			public Size size() {
				return size;
			}

			@Override
			public Type substitute(Substitution s) {
				return new Uninit(size.substitute(s));
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Uninit && ((Uninit) o).size.equals(size);
			}

			@Override
			public int hashCode() {
				return 7 ^ size.hashCode();
			}

			@Override
			public String toString() {
				return "uninit<" + size + ">";
			}
		}

		/**
		 * The uninhabited type. No value has this type, hence a location typed with
		 * it witnesses that control cannot reach the point in question. It is valid
		 * at any size.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class Absurd extends AbstractType {
			private Absurd() {
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Absurd;
			}

			@Override
			public int hashCode() {
				return 0;
			}

			@Override
			public String toString() {
				return "!";
			}
		}

		public static class Param extends AbstractType {
			private final String name;

			public Param(String name) {
				this.name = name;
			}

			public String name() {
				return name;
			}

			@Override
			public Type substitute(Substitution s) {
				Type t = s.type(name);
				return t == null ? this : t;
			}

			@Override
			public void parameters(Set<String> parameters) {
				parameters.add(name);
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Param && ((Param) o).name.equals(name);
			}

			@Override
			public int hashCode() {
				return name.hashCode();
			}

			@Override
			public String toString() {
				return name;
			}
		}

		/**
		 * A user-defined type, possibly instantiated with type and lifetime
		 * arguments. For example, <code>Ref&lt;'a, Int&gt;</code>.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class Named extends AbstractType {
			private static final Type[] NO_TYPES = new Type[0];
			private static final Lifetime[] NO_LIFETIMES = new Lifetime[0];

			private final String name;
			private final Type[] arguments;
			private final Lifetime[] lifetimes;

			public Named(String name) {
				this(name, NO_TYPES, NO_LIFETIMES);
			}

			public Named(String name, Type[] arguments, Lifetime[] lifetimes) {
				this.name = name;
				this.arguments = arguments;
				this.lifetimes = lifetimes;
			}

			public String name() {
				return name;
			}

			public Type[] arguments() {
				return arguments;
			}

			public Lifetime[] lifetimeArguments() {
				return lifetimes;
			}

			@Override
			public Type substitute(Substitution s) {
				Type[] nargs = new Type[arguments.length];
				Lifetime[] nlifetimes = new Lifetime[lifetimes.length];
				for (int i = 0; i != arguments.length; ++i) {
					nargs[i] = arguments[i].substitute(s);
				}
				for (int i = 0; i != lifetimes.length; ++i) {
					nlifetimes[i] = lifetimes[i].substitute(s);
				}
				return new Named(name, nargs, nlifetimes);
			}

			@Override
			public boolean mentions(Lifetime l) {
				for (int i = 0; i != lifetimes.length; ++i) {
					if (lifetimes[i].equals(l)) {
						return true;
					}
				}
				for (int i = 0; i != arguments.length; ++i) {
					if (arguments[i].mentions(l)) {
						return true;
					}
				}
				return false;
			}

			@Override
			public void lifetimes(Set<Lifetime> ls) {
				ls.addAll(Arrays.asList(lifetimes));
				for (Type t : arguments) {
					t.lifetimes(ls);
				}
			}

			@Override
			public void parameters(Set<String> ps) {
				for (Type t : arguments) {
					t.parameters(ps);
				}
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Named) {
					Named n = (Named) o;
					return name.equals(n.name) && Arrays.equals(arguments, n.arguments)
							&& Arrays.equals(lifetimes, n.lifetimes);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return name.hashCode() ^ Arrays.hashCode(arguments) ^ Arrays.hashCode(lifetimes);
			}

			@Override
			public String toString() {
				if (arguments.length == 0 && lifetimes.length == 0) {
					return name;
				}
				String r = "";
				for (Lifetime l : lifetimes) {
					r += r.isEmpty() ? l : ", " + l;
				}
				for (Type t : arguments) {
					r += r.isEmpty() ? t : ", " + t;
				}
				return name + "<" + r + ">";
			}
		}
	}

	/**
	 * A lifetime is either the single static lifetime, or a function-local (or
	 * parameter) lifetime identified by name.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Lifetime implements Comparable<Lifetime> {
		public static final Lifetime Static = new Lifetime("static");

		private final String name;

		public Lifetime(String name) {
			this.name = name;
		}

		public String name() {
			return name;
		}

		public boolean isStatic() {
			return name.equals(Static.name);
		}

		public Lifetime substitute(Substitution s) {
			return s.lifetime(this);
		}

		@Override
		public int compareTo(Lifetime o) {
			if (isStatic() || o.isStatic()) {
				return Boolean.compare(o.isStatic(), isStatic());
			}
			return name.compareTo(o.name);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Lifetime && ((Lifetime) o).name.equals(name);
		}

		@Override
		public int hashCode() {
			return name.hashCode();
		}

		@Override
		public String toString() {
			return "'" + name;
		}
	}

	/**
	 * A bound appearing in a where-clause, or (for outlives facts) within a
	 * <code>BoundContext</code>.
	 *
	 * @author David J. Pearce
	 *
	 */
	public interface Bound {

		public Bound substitute(Substitution s);

		public boolean mentions(Lifetime l);

		/**
		 * An outlives fact, as held in a <code>BoundContext</code>.
		 */
		public interface Fact extends Bound {
			@Override
			public Fact substitute(Substitution s);

			/**
			 * The lifetime which must be outlived.
			 *
			 * @return
			 */
			public Lifetime shorter();
		}

		/**
		 * Represents the fact <code>'a: 'b</code>, meaning <code>'a</code> outlives
		 * <code>'b</code>.
		 */
		public static class Outlives implements Fact {
			private final Lifetime longer;
			private final Lifetime shorter;

			public Outlives(Lifetime longer, Lifetime shorter) {
				this.longer = longer;
				this.shorter = shorter;
			}

			public Lifetime longer() {
				return longer;
			}

			@Override
			public Lifetime shorter() {
				return shorter;
			}

			@Override
			public Outlives substitute(Substitution s) {
				return new Outlives(longer.substitute(s), shorter.substitute(s));
			}

			@Override
			public boolean mentions(Lifetime l) {
				return longer.equals(l) || shorter.equals(l);
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Outlives) {
					Outlives b = (Outlives) o;
					return longer.equals(b.longer) && shorter.equals(b.shorter);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return longer.hashCode() ^ (31 * shorter.hashCode());
			}

			@Override
			public String toString() {
				return longer + ": " + shorter;
			}
		}

		/**
		 * Represents the fact <code>T: 'a</code>, meaning every reference reachable
		 * through a value of type <code>T</code> outlives <code>'a</code>.
		 */
		public static class TypeOutlives implements Fact {
			private final Type type;
			private final Lifetime shorter;

			public TypeOutlives(Type type, Lifetime shorter) {
				this.type = type;
				this.shorter = shorter;
			}

			public Type type() {
				return type;
			}

			@Override
			public Lifetime shorter() {
				return shorter;
			}

			@Override
			public TypeOutlives substitute(Substitution s) {
				return new TypeOutlives(type.substitute(s), shorter.substitute(s));
			}

			@Override
			public boolean mentions(Lifetime l) {
				return shorter.equals(l) || type.mentions(l);
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof TypeOutlives) {
					TypeOutlives b = (TypeOutlives) o;
					return type.equals(b.type) && shorter.equals(b.shorter);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return type.hashCode() ^ (31 * shorter.hashCode());
			}

			@Override
			public String toString() {
				return type + ": " + shorter;
			}
		}

		/**
		 * Represents the bound <code>T: Trait</code>.
		 */
		public static class Trait implements Bound {
			private final Type type;
			private final String trait;

			public Trait(Type type, String trait) {
				this.type = type;
				this.trait = trait;
			}

			public Type type() {
				return type;
			}

			public String trait() {
				return trait;
			}

			@Override
			public Trait substitute(Substitution s) {
				return new Trait(type.substitute(s), trait);
			}

			@Override
			public boolean mentions(Lifetime l) {
				return type.mentions(l);
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Trait) {
					Trait b = (Trait) o;
					return type.equals(b.type) && trait.equals(b.trait);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return type.hashCode() ^ trait.hashCode();
			}

			@Override
			public String toString() {
				return type + ": " + trait;
			}
		}
	}

	public interface Operand {

		/**
		 * Reads a location. Whether this copies or moves is determined by the type
		 * of the location at the point of use.
		 */
		public static class Access implements Operand {
			private final Location location;

			public Access(Location location) {
				this.location = location;
			}

			public Location location() {
				return location;
			}

			@Override
			public String toString() {
				return location.toString();
			}
		}

		/**
		 * A literal value of a given type.
		 */
		public static class Constant implements Operand {
			private final Type type;
			private final String literal;

			public Constant(Type type, String literal) {
				this.type = type;
				this.literal = literal;
			}

			public Type type() {
				return type;
			}

			public String literal() {
				return literal;
			}

			@Override
			public String toString() {
				return literal + ":" + type;
			}
		}
	}

	/**
	 * The right-hand side of an assignment: an operand, or a primitive operation
	 * over one or two operands.
	 */
	public interface RValue {

		public static class Use implements RValue {
			private final Operand operand;

			public Use(Operand operand) {
				this.operand = operand;
			}

			public Operand operand() {
				return operand;
			}

			@Override
			public String toString() {
				return operand.toString();
			}
		}

		public static class Unary implements RValue {
			private final String operator;
			private final Operand operand;

			public Unary(String operator, Operand operand) {
				this.operator = operator;
				this.operand = operand;
			}

			public String operator() {
				return operator;
			}

			public Operand operand() {
				return operand;
			}

			@Override
			public String toString() {
				return operator + " " + operand;
			}
		}

		public static class Binary implements RValue {
			private final String operator;
			private final Operand lhs;
			private final Operand rhs;

			public Binary(String operator, Operand lhs, Operand rhs) {
				this.operator = operator;
				this.lhs = lhs;
				this.rhs = rhs;
			}

			public String operator() {
				return operator;
			}

			public Operand leftOperand() {
				return lhs;
			}

			public Operand rightOperand() {
				return rhs;
			}

			@Override
			public String toString() {
				return lhs + " " + operator + " " + rhs;
			}
		}
	}

	/**
	 * A node in the control-flow graph. The set of node kinds is closed.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static abstract class Node extends SyntacticElement.Impl {
		public enum Kind {
			ASSIGN, CALL, IF, SWITCH, DROP, LIFETIME_BEGIN, LIFETIME_END, DEAD_CODE
		}

		private final Kind kind;

		public Node(Kind kind, Attribute... attributes) {
			super(attributes);
			this.kind = kind;
		}

		public Kind getKind() {
			return kind;
		}

		/**
		 * Get the labels of all nodes to which this node may transfer control.
		 *
		 * @return
		 */
		public abstract String[] successors();

		/**
		 * Represents an assignment such as <code>x = y + 1; goto k</code>.
		 */
		public static class Assign extends Node {
			private final Location target;
			private final RValue rvalue;
			private final String next;

			public Assign(Location target, RValue rvalue, String next, Attribute... attributes) {
				super(Kind.ASSIGN, attributes);
				this.target = target;
				this.rvalue = rvalue;
				this.next = next;
			}

			public Location target() {
				return target;
			}

			public RValue rvalue() {
				return rvalue;
			}

			public String next() {
				return next;
			}

			@Override
			public String[] successors() {
				return new String[] { next };
			}

			@Override
			public String toString() {
				return target + " = " + rvalue + "; goto " + next;
			}
		}

		/**
		 * Represents a call such as <code>x = f&lt;'a, T&gt;(y, z); goto k</code>.
		 */
		public static class Call extends Node {
			private final Location target;
			private final String callee;
			private final Type[] typeArguments;
			private final Lifetime[] lifetimeArguments;
			private final Operand[] operands;
			private final String next;

			public Call(Location target, String callee, Type[] typeArguments, Lifetime[] lifetimeArguments,
					Operand[] operands, String next, Attribute... attributes) {
				super(Kind.CALL, attributes);
				this.target = target;
				this.callee = callee;
				this.typeArguments = typeArguments;
				this.lifetimeArguments = lifetimeArguments;
				this.operands = operands;
				this.next = next;
			}

			public Location target() {
				return target;
			}

			public String callee() {
				return callee;
			}

			public Type[] typeArguments() {
				return typeArguments;
			}

			public Lifetime[] lifetimeArguments() {
				return lifetimeArguments;
			}

			public Operand[] operands() {
				return operands;
			}

			public String next() {
				return next;
			}

			@Override
			public String[] successors() {
				return new String[] { next };
			}

			@Override
			public String toString() {
				String gs = "";
				for (Lifetime l : lifetimeArguments) {
					gs += gs.isEmpty() ? l : ", " + l;
				}
				for (Type t : typeArguments) {
					gs += gs.isEmpty() ? t : ", " + t;
				}
				String as = "";
				for (Operand o : operands) {
					as += as.isEmpty() ? o : ", " + o;
				}
				return target + " = " + callee + (gs.isEmpty() ? "" : "<" + gs + ">") + "(" + as + "); goto " + next;
			}
		}

		public static class If extends Node {
			private final Operand condition;
			private final String trueBranch;
			private final String falseBranch;

			public If(Operand condition, String trueBranch, String falseBranch, Attribute... attributes) {
				super(Kind.IF, attributes);
				this.condition = condition;
				this.trueBranch = trueBranch;
				this.falseBranch = falseBranch;
			}

			public Operand condition() {
				return condition;
			}

			public String trueBranch() {
				return trueBranch;
			}

			public String falseBranch() {
				return falseBranch;
			}

			@Override
			public String[] successors() {
				return new String[] { trueBranch, falseBranch };
			}

			@Override
			public String toString() {
				return "if " + condition + " goto " + trueBranch + " else " + falseBranch;
			}
		}

		/**
		 * Represents a branch over the variants of a location. Each branch label
		 * receives the location narrowed to the corresponding branch type.
		 */
		public static class Switch extends Node {
			private final Location location;
			private final Type staticType;
			private final Type[] branchTypes;
			private final String[] branchLabels;

			public Switch(Location location, Type staticType, Type[] branchTypes, String[] branchLabels,
					Attribute... attributes) {
				super(Kind.SWITCH, attributes);
				if (branchTypes.length != branchLabels.length) {
					throw new IllegalArgumentException("branch types and labels differ in length");
				}
				this.location = location;
				this.staticType = staticType;
				this.branchTypes = branchTypes;
				this.branchLabels = branchLabels;
			}

			public Location location() {
				return location;
			}

			public Type staticType() {
				return staticType;
			}

			public Type[] branchTypes() {
				return branchTypes;
			}

			public String[] branchLabels() {
				return branchLabels;
			}

			@Override
			public String[] successors() {
				return branchLabels;
			}

			@Override
			public String toString() {
				String r = "switch " + location + " : " + staticType + " {";
				for (int i = 0; i != branchTypes.length; ++i) {
					r += " " + branchTypes[i] + " => " + branchLabels[i] + ";";
				}
				return r + " }";
			}
		}

		public static class Drop extends Node {
			private final Location location;
			private final String next;

			public Drop(Location location, String next, Attribute... attributes) {
				super(Kind.DROP, attributes);
				this.location = location;
				this.next = next;
			}

			public Location location() {
				return location;
			}

			public String next() {
				return next;
			}

			@Override
			public String[] successors() {
				return new String[] { next };
			}

			@Override
			public String toString() {
				return "drop " + location + "; goto " + next;
			}
		}

		public static class LifetimeBegin extends Node {
			private final Lifetime lifetime;
			private final String next;

			public LifetimeBegin(Lifetime lifetime, String next, Attribute... attributes) {
				super(Kind.LIFETIME_BEGIN, attributes);
				this.lifetime = lifetime;
				this.next = next;
			}

			public Lifetime lifetime() {
				return lifetime;
			}

			public String next() {
				return next;
			}

			@Override
			public String[] successors() {
				return new String[] { next };
			}

			@Override
			public String toString() {
				return "begin " + lifetime + "; goto " + next;
			}
		}

		public static class LifetimeEnd extends Node {
			private final Lifetime lifetime;
			private final String next;

			public LifetimeEnd(Lifetime lifetime, String next, Attribute... attributes) {
				super(Kind.LIFETIME_END, attributes);
				this.lifetime = lifetime;
				this.next = next;
			}

			public Lifetime lifetime() {
				return lifetime;
			}

			public String next() {
				return next;
			}

			@Override
			public String[] successors() {
				return new String[] { next };
			}

			@Override
			public String toString() {
				return "end " + lifetime + "; goto " + next;
			}
		}

		/**
		 * Marks a point which control cannot reach (e.g. after a call to a
		 * function which never returns).
		 */
		public static class DeadCode extends Node {
			public DeadCode(Attribute... attributes) {
				super(Kind.DEAD_CODE, attributes);
			}

			@Override
			public String[] successors() {
				return new String[0];
			}

			@Override
			public String toString() {
				return "unreachable";
			}
		}
	}

	/**
	 * The typing required of whoever transfers control to a given label.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class NodeType {
		private final LocationContext locations;
		private final LifetimeContext lifetimes;
		private final BoundContext bounds;

		public NodeType(LocationContext locations, LifetimeContext lifetimes, BoundContext bounds) {
			this.locations = locations;
			this.lifetimes = lifetimes;
			this.bounds = bounds;
		}

		public LocationContext locations() {
			return locations;
		}

		public LifetimeContext lifetimes() {
			return lifetimes;
		}

		public BoundContext bounds() {
			return bounds;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof NodeType) {
				NodeType t = (NodeType) o;
				return locations.equals(t.locations) && lifetimes.equals(t.lifetimes) && bounds.equals(t.bounds);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return locations.hashCode() ^ lifetimes.hashCode() ^ bounds.hashCode();
		}

		@Override
		public String toString() {
			return "(" + locations + "; " + lifetimes + "; " + bounds + ")";
		}
	}

	/**
	 * The signature of a (possibly generic) function, as seen by its callers.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Signature {
		private final String name;
		private final String[] typeParameters;
		private final Lifetime[] lifetimeParameters;
		private final Bound[] where;
		private final Type[] parameters;
		private final Type ret;

		public Signature(String name, String[] typeParameters, Lifetime[] lifetimeParameters, Bound[] where,
				Type[] parameters, Type ret) {
			this.name = name;
			this.typeParameters = typeParameters;
			this.lifetimeParameters = lifetimeParameters;
			this.where = where;
			this.parameters = parameters;
			this.ret = ret;
		}

		public String name() {
			return name;
		}

		public String[] typeParameters() {
			return typeParameters;
		}

		public Lifetime[] lifetimeParameters() {
			return lifetimeParameters;
		}

		public Bound[] where() {
			return where;
		}

		public Type[] parameters() {
			return parameters;
		}

		public Type returnType() {
			return ret;
		}

		/**
		 * A function whose return type is uninhabited never returns.
		 *
		 * @return
		 */
		public boolean diverges() {
			return ret instanceof Type.Absurd;
		}

		public boolean isGeneric() {
			return typeParameters.length > 0 || lifetimeParameters.length > 0;
		}

		/**
		 * Print the quantifier prefix (e.g. <code>forall&lt;'a, T&gt; where T: Copy</code>)
		 * under which this signature is checked.
		 *
		 * @return
		 */
		public String quantifier() {
			if (!isGeneric() && where.length == 0) {
				return "";
			}
			String r = "";
			for (Lifetime l : lifetimeParameters) {
				r += r.isEmpty() ? l : ", " + l;
			}
			for (String t : typeParameters) {
				r += r.isEmpty() ? t : ", " + t;
			}
			r = "forall<" + r + ">";
			if (where.length > 0) {
				String w = "";
				for (Bound b : where) {
					w += w.isEmpty() ? b : ", " + b;
				}
				r += " where " + w;
			}
			return r;
		}

		@Override
		public String toString() {
			String ps = "";
			for (Type p : parameters) {
				ps += ps.isEmpty() ? p : ", " + p;
			}
			String q = quantifier();
			return (q.isEmpty() ? "" : q + " ") + "fn " + name + "(" + ps + ") -> " + ret;
		}
	}

	/**
	 * A function is a table of labelled nodes, each carrying its declared typing.
	 * Successors are referenced by label and resolved through an index, rather
	 * than by pointer, so cyclic control flow needs no special treatment.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Function {
		public static final String ENTRY = "entry";
		public static final String EXIT = "exit";

		private final Signature signature;
		private final String[] parameterNames;
		private final String[] locals;
		private final String[] labels;
		private final NodeType[] types;
		private final Node[] nodes;
		private final HashMap<String, Integer> index;

		public Function(Signature signature, String[] parameterNames, String[] locals, String[] labels,
				NodeType[] types, Node[] nodes) {
			if (parameterNames.length != signature.parameters().length) {
				throw new IllegalArgumentException("parameter names do not match signature");
			} else if (labels.length != types.length || labels.length != nodes.length) {
				throw new IllegalArgumentException("label table is not rectangular");
			}
			this.signature = signature;
			this.parameterNames = parameterNames;
			this.locals = locals;
			this.labels = labels;
			this.types = types;
			this.nodes = nodes;
			this.index = new HashMap<>();
			// Sanity check names
			Set<String> names = new HashSet<>();
			for (String n : parameterNames) {
				check(names.add(n), "duplicate parameter or local " + n);
			}
			for (String n : locals) {
				check(names.add(n), "duplicate parameter or local " + n);
			}
			for (int i = 0; i != labels.length; ++i) {
				check(index.put(labels[i], i) == null, "duplicate label " + labels[i]);
			}
		}

		public String name() {
			return signature.name();
		}

		public Signature signature() {
			return signature;
		}

		public String[] parameterNames() {
			return parameterNames;
		}

		public String[] locals() {
			return locals;
		}

		/**
		 * Get the number of labelled nodes in this function.
		 *
		 * @return
		 */
		public int size() {
			return labels.length;
		}

		public String label(int i) {
			return labels[i];
		}

		public NodeType typeAt(int i) {
			return types[i];
		}

		public Node nodeAt(int i) {
			return nodes[i];
		}

		/**
		 * Determine the index of a given label, or <code>-1</code> if it is not
		 * defined.
		 *
		 * @param label
		 * @return
		 */
		public int indexOf(String label) {
			Integer i = index.get(label);
			return i == null ? -1 : i;
		}

		public Location parameter(int i) {
			return Location.parameter(parameterNames[i]);
		}

		/**
		 * Get every function-scoped location: the return slot, the parameters and
		 * the locals.
		 *
		 * @return
		 */
		public Location[] locations() {
			Location[] ls = new Location[1 + parameterNames.length + locals.length];
			ls[0] = Location.RETURN;
			for (int i = 0; i != parameterNames.length; ++i) {
				ls[1 + i] = Location.parameter(parameterNames[i]);
			}
			for (int i = 0; i != locals.length; ++i) {
				ls[1 + parameterNames.length + i] = Location.local(locals[i]);
			}
			return ls;
		}

		@Override
		public String toString() {
			String r = signature.toString() + " {\n";
			for (int i = 0; i != labels.length; ++i) {
				r += "  " + labels[i] + " " + types[i] + ": " + nodes[i] + "\n";
			}
			return r + "}";
		}

		private static void check(boolean result, String msg) {
			if (!result) {
				throw new VerificationError(VerificationError.Kind.MALFORMED_CONTEXT, "T-Function", msg);
			}
		}

		/**
		 * Incrementally constructs a function, as done by a lowering stage.
		 */
		public static class Builder {
			private final Signature signature;
			private final List<String> parameterNames = new ArrayList<>();
			private final List<String> locals = new ArrayList<>();
			private final List<String> labels = new ArrayList<>();
			private final List<NodeType> types = new ArrayList<>();
			private final List<Node> nodes = new ArrayList<>();

			public Builder(Signature signature) {
				this.signature = signature;
			}

			public Builder parameters(String... names) {
				parameterNames.addAll(Arrays.asList(names));
				return this;
			}

			public Builder locals(String... names) {
				locals.addAll(Arrays.asList(names));
				return this;
			}

			public Builder node(String label, NodeType type, Node node) {
				labels.add(label);
				types.add(type);
				nodes.add(node);
				return this;
			}

			public Function build() {
				return new Function(signature, parameterNames.toArray(new String[0]), locals.toArray(new String[0]),
						labels.toArray(new String[0]), types.toArray(new NodeType[0]), nodes.toArray(new Node[0]));
			}
		}
	}

	/**
	 * A unit of verification: a set of functions sharing a read-only type context
	 * and static context.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Program {
		private final TypeContext context;
		private final LocationContext statics;
		private final Function[] functions;

		public Program(TypeContext context, LocationContext statics, Function... functions) {
			for (Location l : statics.locations()) {
				if (!l.isStatic()) {
					throw new VerificationError(VerificationError.Kind.MALFORMED_CONTEXT, "T-Program",
							"static context mentions non-static location", l);
				}
			}
			this.context = context;
			this.statics = statics;
			this.functions = functions;
		}

		public TypeContext context() {
			return context;
		}

		public LocationContext statics() {
			return statics;
		}

		public Function[] functions() {
			return functions;
		}
	}
}
