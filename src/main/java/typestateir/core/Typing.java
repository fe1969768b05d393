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
import java.util.HashSet;
import java.util.List;

import typestateir.core.Syntax.Bound;
import typestateir.core.Syntax.Lifetime;
import typestateir.core.Syntax.Location;
import typestateir.core.Syntax.NodeType;
import typestateir.core.Syntax.Operand;
import typestateir.core.Syntax.RValue;
import typestateir.core.Syntax.Size;
import typestateir.core.Syntax.Type;
import typestateir.core.TypeContext.Operator;
import typestateir.core.TypeContext.Variance;
import typestateir.util.Pair;
import typestateir.util.VerificationError;
import typestateir.util.VerificationError.Kind;

/**
 * The rules governing how location types evolve: subtyping of types and
 * contexts, consuming (copying or moving) a location, assigning and dropping
 * locations, evaluating right-hand sides, and narrowing locations across a
 * switch.
 *
 * @author David J. Pearce
 *
 */
public class Typing {
	// Error messages
	public final static String UNDECLARED_LOCATION = "location undeclared";
	public final static String LOCATION_MOVED = "use of moved location";
	public final static String LOCATION_INITIALISED = "location already initialised";
	public final static String STATIC_NOT_COPY = "cannot move out of static location";
	public final static String STATIC_ASSIGNMENT = "cannot assign to static location";
	public final static String STATIC_DROP = "cannot drop static location";
	public final static String INCOMPATIBLE_SIZE = "incompatible size";
	public final static String DROP_NOT_COPY = "type cannot be dropped (not copy)";
	public final static String INVALID_CONSTANT = "invalid constant type";
	public final static String NO_MATCHING_OPERATOR = "no matching operator";
	public final static String INVALID_CONTEXT_KEYS = "invalid context keys";
	public final static String INVALID_CONTEXT_TYPES = "incompatible context types";
	public final static String INVALID_CONTEXT_LIFETIMES = "incompatible active lifetimes";

	private final TypeContext context;
	private final LocationContext statics;

	public Typing(TypeContext context, LocationContext statics) {
		this.context = context;
		this.statics = statics;
	}

	public TypeContext context() {
		return context;
	}

	public LocationContext statics() {
		return statics;
	}

	// ==================================================================================
	// Subtyping
	// ==================================================================================

	/**
	 * Determine whether one type is a subtype of another, given a set of
	 * outlives facts. The uninhabited type is a subtype of everything, and a
	 * variant is a subtype of its parent. For two instances of the same type,
	 * type arguments are invariant whilst lifetime arguments follow their
	 * declared variance.
	 *
	 * @param sub
	 * @param sup
	 * @param facts
	 * @return
	 */
	public boolean isSubtype(Type sub, Type sup, BoundContext facts) {
		if (sub.equals(sup) || sub instanceof Type.Absurd) {
			return true;
		} else if (sub instanceof Type.Named && sup instanceof Type.Named) {
			Type.Named s = (Type.Named) sub;
			Type.Named t = (Type.Named) sup;
			if (s.name().equals(t.name())) {
				if (!Arrays.equals(s.arguments(), t.arguments())
						|| s.lifetimeArguments().length != t.lifetimeArguments().length) {
					return false;
				}
				Variance[] variances = context.variancesOf(s);
				for (int i = 0; i != variances.length; ++i) {
					Lifetime sl = s.lifetimeArguments()[i];
					Lifetime tl = t.lifetimeArguments()[i];
					if (variances[i] == Variance.COVARIANT ? !Obligations.outlives(facts, sl, tl) : !sl.equals(tl)) {
						return false;
					}
				}
				return true;
			}
			Type.Named p = context.parentOf(s);
			return p != null && isSubtype(p, sup, facts);
		}
		return false;
	}

	/**
	 * Find the first location at which a given context fails to be a subtype of
	 * a required context, or <code>null</code> if there is none. Both contexts
	 * must mention the same locations, except for statics. A static omitted by
	 * either context is typed by the static context.
	 *
	 * @param actual
	 * @param required
	 * @param facts
	 * @return
	 */
	public Location mismatch(LocationContext actual, LocationContext required, BoundContext facts) {
		for (Location l : required.locations()) {
			Type t = actual.get(l);
			if (t == null && l.isStatic()) {
				t = statics.get(l);
			}
			if (t == null || !isSubtype(t, required.get(l), facts)) {
				return l;
			}
		}
		for (Location l : actual.locations()) {
			if (!l.isStatic() && !required.contains(l)) {
				return l;
			}
		}
		return null;
	}

	public boolean isSubtype(LocationContext sub, LocationContext sup, BoundContext facts) {
		return mismatch(sub, sup, facts) == null;
	}

	/**
	 * Determine whether one node type is a subtype of another. The active
	 * lifetimes must be identical, the locations must be subtypes under the
	 * facts known to the subtype, and those facts must entail the facts assumed
	 * by the supertype.
	 *
	 * @param sub
	 * @param sup
	 * @return
	 */
	public boolean isSubtype(NodeType sub, NodeType sup) {
		return sub.lifetimes().equals(sup.lifetimes())
				&& isSubtype(sub.locations(), sup.locations(), sub.bounds())
				&& Obligations.entails(sub.bounds(), sup.bounds());
	}

	// ==================================================================================
	// Location Operations
	// ==================================================================================

	/**
	 * Read a location, either by copy or by move. A copy leaves the context
	 * unchanged, whilst a move leaves the location uninitialised (retaining its
	 * size). Static locations may only be copied.
	 *
	 * @param location
	 * @param ctx
	 * @return
	 */
	public Pair<LocationContext, Type> consume(Location location, LocationContext ctx) {
		if (location.isStatic()) {
			Type t = statics.get(location);
			check(t != null, Kind.MALFORMED_CONTEXT, "T-Consume", UNDECLARED_LOCATION, location);
			check(context.isCopy(t), Kind.TYPE_MISMATCH, "T-Consume", STATIC_NOT_COPY, location);
			return new Pair<>(ctx, t);
		}
		Type t = ctx.get(location);
		check(t != null, Kind.MALFORMED_CONTEXT, "T-Consume", UNDECLARED_LOCATION, location);
		check(!(t instanceof Type.Uninit), Kind.USE_AFTER_MOVE, "T-Consume", LOCATION_MOVED, location);
		if (t instanceof Type.Absurd || context.isCopy(t)) {
			return new Pair<>(ctx, t);
		}
		return new Pair<>(ctx.put(location, new Type.Uninit(context.sizeOf(t))), t);
	}

	/**
	 * Initialise an uninitialised location with a value of a given type. The
	 * size of the type must match the size retained by the location.
	 *
	 * @param location
	 * @param type
	 * @param ctx
	 * @return
	 */
	public LocationContext assign(Location location, Type type, LocationContext ctx) {
		check(!location.isStatic(), Kind.TYPE_MISMATCH, "T-Init", STATIC_ASSIGNMENT, location);
		Type current = ctx.get(location);
		check(current != null, Kind.MALFORMED_CONTEXT, "T-Init", UNDECLARED_LOCATION, location);
		if (!(current instanceof Type.Uninit)) {
			throw new VerificationError(Kind.DOUBLE_INIT, "T-Init", LOCATION_INITIALISED, "uninit", current,
					location);
		}
		Size expected = ((Type.Uninit) current).size();
		Size actual = context.sizeOf(type);
		if (actual != null && !actual.equals(expected)) {
			throw new VerificationError(Kind.MALFORMED_CONTEXT, "T-Init", INCOMPATIBLE_SIZE, expected, actual,
					location);
		}
		return ctx.put(location, type);
	}

	/**
	 * Explicitly discard the value held in a location. Only values of copy types
	 * may be discarded, since anything else represents a resource which must be
	 * consumed.
	 *
	 * @param location
	 * @param ctx
	 * @return
	 */
	public LocationContext drop(Location location, LocationContext ctx) {
		check(!location.isStatic(), Kind.TYPE_MISMATCH, "T-Drop", STATIC_DROP, location);
		Type current = ctx.get(location);
		check(current != null, Kind.MALFORMED_CONTEXT, "T-Drop", UNDECLARED_LOCATION, location);
		check(!(current instanceof Type.Uninit), Kind.USE_AFTER_MOVE, "T-Drop", LOCATION_MOVED, location);
		if (!context.isCopy(current)) {
			throw new VerificationError(Kind.TYPE_MISMATCH, "T-Drop", DROP_NOT_COPY, "copy type", current, location);
		}
		return ctx.put(location, new Type.Uninit(context.sizeOf(current)));
	}

	// ==================================================================================
	// Evaluation
	// ==================================================================================

	public Pair<LocationContext, Type> evaluate(Operand operand, LocationContext ctx) {
		if (operand instanceof Operand.Access) {
			return consume(((Operand.Access) operand).location(), ctx);
		} else {
			Type t = ((Operand.Constant) operand).type();
			check(!(t instanceof Type.Uninit) && !(t instanceof Type.Absurd), Kind.TYPE_MISMATCH, "T-Const",
					INVALID_CONSTANT);
			context.checkWellFormed(t);
			return new Pair<>(ctx, t);
		}
	}

	/**
	 * Evaluate a right-hand side, threading the context through each operand
	 * from left to right. Primitive operators are resolved by name and arity,
	 * and the first operator whose operand types accept the evaluated operands
	 * is selected.
	 *
	 * @param rvalue
	 * @param ctx
	 * @param facts
	 * @return
	 */
	public Pair<LocationContext, Type> evaluate(RValue rvalue, LocationContext ctx, BoundContext facts) {
		String name;
		Operand[] operands;
		if (rvalue instanceof RValue.Use) {
			return evaluate(((RValue.Use) rvalue).operand(), ctx);
		} else if (rvalue instanceof RValue.Unary) {
			RValue.Unary u = (RValue.Unary) rvalue;
			name = u.operator();
			operands = new Operand[] { u.operand() };
		} else {
			RValue.Binary b = (RValue.Binary) rvalue;
			name = b.operator();
			operands = new Operand[] { b.leftOperand(), b.rightOperand() };
		}
		Type[] types = new Type[operands.length];
		for (int i = 0; i != operands.length; ++i) {
			Pair<LocationContext, Type> p = evaluate(operands[i], ctx);
			ctx = p.first();
			types[i] = p.second();
		}
		List<Operator> candidates = context.operators(name, operands.length);
		for (Operator o : candidates) {
			boolean r = true;
			for (int i = 0; i != types.length; ++i) {
				r &= isSubtype(types[i], o.operands()[i], facts);
			}
			if (r) {
				return new Pair<>(ctx, o.result());
			}
		}
		throw new VerificationError(Kind.TYPE_MISMATCH, "T-Operator", NO_MATCHING_OPERATOR + " " + name, candidates,
				Arrays.toString(types));
	}

	// ==================================================================================
	// Switches
	// ==================================================================================

	/**
	 * Determine whether a given set of branch types covers every value of a
	 * given type. A type with variants is covered when each of its variants is.
	 *
	 * @param type
	 * @param branches
	 * @param facts
	 * @return
	 */
	public boolean covers(Type type, Type[] branches, BoundContext facts) {
		if (type instanceof Type.Absurd) {
			return true;
		}
		for (Type b : branches) {
			if (isSubtype(type, b, facts)) {
				return true;
			}
		}
		if (type instanceof Type.Named) {
			List<Type.Named> variants = context.variantsOf((Type.Named) type);
			if (variants.isEmpty()) {
				return false;
			}
			for (Type.Named v : variants) {
				if (!covers(v, branches, facts)) {
					return false;
				}
			}
			return true;
		}
		return false;
	}

	/**
	 * Determine the type of a location within a branch of a switch. Where the
	 * current and branch types lie in disjoint parts of a variant hierarchy, the
	 * branch is unreachable and the uninhabited type results. Returns
	 * <code>null</code> where no narrowing is sound.
	 *
	 * @param current
	 * @param branch
	 * @param facts
	 * @return
	 */
	public Type narrow(Type current, Type branch, BoundContext facts) {
		if (isSubtype(current, branch, facts)) {
			return current;
		} else if (isSubtype(branch, current, facts)) {
			return branch;
		} else if (current instanceof Type.Named && branch instanceof Type.Named) {
			HashSet<String> cs = ancestors((Type.Named) current);
			HashSet<String> bs = ancestors((Type.Named) branch);
			if (!cs.contains(((Type.Named) branch).name()) && !bs.contains(((Type.Named) current).name())) {
				return Type.Absurd;
			}
		}
		return null;
	}

	private HashSet<String> ancestors(Type.Named t) {
		HashSet<String> r = new HashSet<>();
		for (Type.Named p = t; p != null; p = context.parentOf(p)) {
			r.add(p.name());
		}
		return r;
	}

	// ==================================================================================
	// Join
	// ==================================================================================

	/**
	 * Determine the least type of which both given types are subtypes. This is
	 * either one of them, or their closest common ancestor in a variant
	 * hierarchy.
	 *
	 * @param a
	 * @param b
	 * @param facts
	 * @return
	 */
	public Type join(Type a, Type b, BoundContext facts) {
		if (isSubtype(a, b, facts)) {
			return b;
		} else if (isSubtype(b, a, facts)) {
			return a;
		} else if (a instanceof Type.Named) {
			for (Type.Named p = context.parentOf((Type.Named) a); p != null; p = context.parentOf(p)) {
				if (isSubtype(b, p, facts)) {
					return p;
				}
			}
		}
		throw new VerificationError(Kind.MALFORMED_CONTEXT, "T-Join", INVALID_CONTEXT_TYPES, a, b);
	}

	/**
	 * Join two contexts location by location. Both must mention exactly the same
	 * locations.
	 *
	 * @param a
	 * @param b
	 * @param facts
	 * @return
	 */
	public LocationContext join(LocationContext a, LocationContext b, BoundContext facts) {
		if (!a.locations().equals(b.locations())) {
			throw new VerificationError(Kind.MALFORMED_CONTEXT, "T-Join", INVALID_CONTEXT_KEYS, a.locations(),
					b.locations());
		}
		LocationContext r = a;
		for (Location l : a.locations()) {
			try {
				r = r.put(l, join(a.get(l), b.get(l), facts));
			} catch (VerificationError e) {
				throw new VerificationError(Kind.MALFORMED_CONTEXT, "T-Join", INVALID_CONTEXT_TYPES, a.get(l),
						b.get(l), l);
			}
		}
		return r;
	}

	/**
	 * Join two node types, as needed where control-flow paths merge. The
	 * resulting facts are those entailed on both paths.
	 *
	 * @param a
	 * @param b
	 * @return
	 */
	public NodeType join(NodeType a, NodeType b) {
		if (!a.lifetimes().equals(b.lifetimes())) {
			throw new VerificationError(Kind.MALFORMED_CONTEXT, "T-Join", INVALID_CONTEXT_LIFETIMES, a.lifetimes(),
					b.lifetimes());
		}
		ArrayList<Bound.Fact> facts = new ArrayList<>();
		for (Bound.Fact f : a.bounds().facts()) {
			if (Obligations.entails(b.bounds(), f)) {
				facts.add(f);
			}
		}
		for (Bound.Fact f : b.bounds().facts()) {
			if (Obligations.entails(a.bounds(), f)) {
				facts.add(f);
			}
		}
		BoundContext phi = new BoundContext(facts);
		return new NodeType(join(a.locations(), b.locations(), phi), a.lifetimes(), phi);
	}

	private static void check(boolean result, Kind kind, String rule, String msg, Location... locations) {
		if (!result) {
			throw new VerificationError(kind, rule, msg, locations);
		}
	}
}
