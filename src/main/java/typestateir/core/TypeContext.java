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
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import typestateir.core.Syntax.Bound;
import typestateir.core.Syntax.Lifetime;
import typestateir.core.Syntax.Signature;
import typestateir.core.Syntax.Size;
import typestateir.core.Syntax.Type;
import typestateir.util.VerificationError;

/**
 * The read-only store of everything the verifier knows about types: user type
 * declarations (including variants of enum types), trait implementations and
 * postulated trait bounds, primitive operator signatures and function
 * signatures. Trait resolution is purely by lookup; there is no search over
 * user code.
 *
 * @author David J. Pearce
 *
 */
public class TypeContext {
	/**
	 * The trait identifying types whose values are duplicated rather than moved.
	 */
	public static final String COPY = "Copy";
	/**
	 * Bounds the nesting of impl requirements explored by trait resolution.
	 */
	private static final int MAX_RESOLUTION_DEPTH = 32;

	// Error messages
	public final static String UNDECLARED_TYPE = "undeclared type";
	public final static String UNDECLARED_PARAMETER = "undeclared type parameter";
	public final static String UNDECLARED_LIFETIME = "undeclared lifetime parameter";
	public final static String INVALID_ARITY = "incorrect number of arguments";
	public final static String INVALID_ARGUMENT = "invalid type argument";
	public final static String DUPLICATE_DECLARATION = "duplicate declaration";
	public final static String INVALID_VARIANT = "variant inconsistent with parent";
	public final static String CYCLIC_VARIANT = "cyclic variant declaration";

	private final Map<String, Declaration> declarations;
	private final Map<String, List<Declaration>> variants;
	private final List<Impl> impls;
	private final List<Bound.Trait> postulates;
	private final Map<String, List<Operator>> operators;
	private final Map<String, Signature> signatures;
	private final Set<String> typeParameters;
	private final Set<Lifetime> lifetimeParameters;

	private TypeContext(Map<String, Declaration> declarations, List<Impl> impls, List<Bound.Trait> postulates,
			Map<String, List<Operator>> operators, Map<String, Signature> signatures, Set<String> typeParameters,
			Set<Lifetime> lifetimeParameters) {
		this.declarations = declarations;
		this.impls = impls;
		this.postulates = postulates;
		this.operators = operators;
		this.signatures = signatures;
		this.typeParameters = typeParameters;
		this.lifetimeParameters = lifetimeParameters;
		this.variants = new HashMap<>();
		for (Declaration d : declarations.values()) {
			if (d.parent() != null) {
				variants.computeIfAbsent(d.parent(), k -> new ArrayList<>()).add(d);
			}
		}
	}

	public Declaration declaration(String name) {
		return declarations.get(name);
	}

	public Signature signature(String name) {
		return signatures.get(name);
	}

	public Collection<Signature> signatures() {
		return Collections.unmodifiableCollection(signatures.values());
	}

	public Set<String> typeParameters() {
		return Collections.unmodifiableSet(typeParameters);
	}

	public Set<Lifetime> lifetimeParameters() {
		return Collections.unmodifiableSet(lifetimeParameters);
	}

	/**
	 * Determine all operators with a given name and number of operands.
	 *
	 * @param name
	 * @param arity
	 * @return
	 */
	public List<Operator> operators(String name, int arity) {
		ArrayList<Operator> r = new ArrayList<>();
		for (Operator o : operators.getOrDefault(name, Collections.emptyList())) {
			if (o.operands().length == arity) {
				r.add(o);
			}
		}
		return r;
	}

	/**
	 * Determine whether a given trait is known to hold for a given type. This
	 * succeeds if a postulate states it outright, or if some impl whose pattern
	 * matches the type exists and each of its requirements (instantiated by the
	 * match) holds in turn.
	 *
	 * @param type
	 * @param trait
	 * @return
	 */
	public boolean holds(Type type, String trait) {
		return holds(type, trait, 0);
	}

	private boolean holds(Type type, String trait, int depth) {
		if (type instanceof Type.Uninit || type instanceof Type.Absurd || depth > MAX_RESOLUTION_DEPTH) {
			return false;
		}
		for (Bound.Trait p : postulates) {
			if (p.trait().equals(trait) && p.type().equals(type)) {
				return true;
			}
		}
		for (Impl impl : impls) {
			if (!impl.trait().equals(trait)) {
				continue;
			}
			HashMap<String, Type> binding = new HashMap<>();
			if (impl.match(type, binding)) {
				Substitution s = new Substitution(this, binding, Collections.emptyMap());
				boolean r = true;
				for (Bound.Trait b : impl.requires()) {
					r &= holds(b.type().substitute(s), b.trait(), depth + 1);
				}
				if (r) {
					return true;
				}
			}
		}
		return false;
	}

	public boolean isCopy(Type type) {
		return holds(type, COPY);
	}

	/**
	 * Determine the size of a given type. The uninhabited type has no size (it is
	 * compatible with every size) and, for this, <code>null</code> is returned.
	 *
	 * @param type
	 * @return
	 */
	public Size sizeOf(Type type) {
		if (type instanceof Type.Uninit) {
			return ((Type.Uninit) type).size();
		} else if (type instanceof Type.Param) {
			return Size.of(((Type.Param) type).name());
		} else if (type instanceof Type.Named) {
			Type.Named t = (Type.Named) type;
			Declaration d = lookup(t);
			return d.size().substitute(bind(d, t));
		} else {
			return null;
		}
	}

	/**
	 * Construct the substitution which instantiates a given declaration to a
	 * given instance of it.
	 *
	 * @param d
	 * @param t
	 * @return
	 */
	public Substitution bind(Declaration d, Type.Named t) {
		return bind(d.typeParameters(), d.lifetimeParameters(), t.arguments(), t.lifetimeArguments());
	}

	/**
	 * Construct the substitution which instantiates a given signature with given
	 * type and lifetime arguments.
	 *
	 * @param s
	 * @param typeArguments
	 * @param lifetimeArguments
	 * @return
	 */
	public Substitution bind(Signature s, Type[] typeArguments, Lifetime[] lifetimeArguments) {
		return bind(s.typeParameters(), s.lifetimeParameters(), typeArguments, lifetimeArguments);
	}

	private Substitution bind(String[] typeParameters, Lifetime[] lifetimeParameters, Type[] typeArguments,
			Lifetime[] lifetimeArguments) {
		if (typeParameters.length != typeArguments.length || lifetimeParameters.length != lifetimeArguments.length) {
			throw new IllegalArgumentException("invalid number of arguments");
		}
		HashMap<String, Type> types = new HashMap<>();
		HashMap<Lifetime, Lifetime> lifetimes = new HashMap<>();
		for (int i = 0; i != typeParameters.length; ++i) {
			types.put(typeParameters[i], typeArguments[i]);
		}
		for (int i = 0; i != lifetimeParameters.length; ++i) {
			lifetimes.put(lifetimeParameters[i], lifetimeArguments[i]);
		}
		return new Substitution(this, types, lifetimes);
	}

	/**
	 * Determine the parent of a given variant type, instantiated with the same
	 * arguments. If the type is not a variant, <code>null</code> is returned.
	 *
	 * @param t
	 * @return
	 */
	public Type.Named parentOf(Type.Named t) {
		Declaration d = lookup(t);
		if (d.parent() == null) {
			return null;
		}
		return new Type.Named(d.parent(), t.arguments(), t.lifetimeArguments());
	}

	/**
	 * Determine the variants of a given type, instantiated with the same
	 * arguments. If the type has no variants, an empty list is returned.
	 *
	 * @param t
	 * @return
	 */
	public List<Type.Named> variantsOf(Type.Named t) {
		ArrayList<Type.Named> r = new ArrayList<>();
		for (Declaration d : variants.getOrDefault(t.name(), Collections.emptyList())) {
			r.add(new Type.Named(d.name(), t.arguments(), t.lifetimeArguments()));
		}
		return r;
	}

	/**
	 * Get the declared variance of each lifetime parameter for a given type.
	 *
	 * @param t
	 * @return
	 */
	public Variance[] variancesOf(Type.Named t) {
		return lookup(t).variances();
	}

	/**
	 * Check that a given type is well-formed in this context. That is, every
	 * named type is declared with the right number of arguments, every type
	 * parameter is in scope, and no type argument is uninitialised or
	 * uninhabited. Lifetimes are not checked here, since their validity depends
	 * on which lifetimes are active.
	 *
	 * @param type
	 */
	public void checkWellFormed(Type type) {
		checkWellFormed(type, typeParameters, "T-WellFormed");
	}

	private void checkWellFormed(Type type, Set<String> parameters, String rule) {
		if (type instanceof Type.Param) {
			check(parameters.contains(((Type.Param) type).name()), rule, UNDECLARED_PARAMETER, type);
		} else if (type instanceof Type.Named) {
			Type.Named t = (Type.Named) type;
			Declaration d = declarations.get(t.name());
			check(d != null, rule, UNDECLARED_TYPE, type);
			check(d.typeParameters().length == t.arguments().length, rule, INVALID_ARITY, type);
			check(d.lifetimeParameters().length == t.lifetimeArguments().length, rule, INVALID_ARITY, type);
			for (Type arg : t.arguments()) {
				check(!(arg instanceof Type.Uninit) && !(arg instanceof Type.Absurd), rule, INVALID_ARGUMENT, type);
				checkWellFormed(arg, parameters, rule);
			}
		}
	}

	/**
	 * Check that every lifetime mentioned by a given type is either static or
	 * one of the given lifetimes.
	 */
	private void checkLifetimes(Type type, Set<Lifetime> lifetimes, String rule) {
		HashSet<Lifetime> ls = new HashSet<>();
		type.lifetimes(ls);
		for (Lifetime l : ls) {
			check(l.isStatic() || lifetimes.contains(l), rule, UNDECLARED_LIFETIME, type);
		}
	}

	/**
	 * Construct a new context in which the generic parameters of some function
	 * are in scope. Trait bounds from the where-clause are postulated, whilst
	 * outlives bounds are left for the obligation tracker.
	 *
	 * @param typeParameters
	 * @param lifetimeParameters
	 * @param where
	 * @return
	 */
	public TypeContext extend(String[] typeParameters, Lifetime[] lifetimeParameters, Bound[] where) {
		HashSet<String> ntypes = new HashSet<>(this.typeParameters);
		HashSet<Lifetime> nlifetimes = new HashSet<>(this.lifetimeParameters);
		for (String t : typeParameters) {
			check(!ntypes.contains(t) && !declarations.containsKey(t), "T-Generic", DUPLICATE_DECLARATION, t);
			ntypes.add(t);
		}
		for (Lifetime l : lifetimeParameters) {
			check(!l.isStatic() && !nlifetimes.contains(l), "T-Generic", DUPLICATE_DECLARATION, l);
			nlifetimes.add(l);
		}
		ArrayList<Bound.Trait> npostulates = new ArrayList<>(postulates);
		for (Bound b : where) {
			checkBound(b, ntypes, nlifetimes, "T-Generic");
			if (b instanceof Bound.Trait) {
				npostulates.add((Bound.Trait) b);
			}
		}
		return new TypeContext(declarations, impls, npostulates, operators, signatures, ntypes, nlifetimes);
	}

	private void checkBound(Bound b, Set<String> types, Set<Lifetime> lifetimes, String rule) {
		if (b instanceof Bound.Outlives) {
			Bound.Outlives o = (Bound.Outlives) b;
			check(o.longer().isStatic() || lifetimes.contains(o.longer()), rule, UNDECLARED_LIFETIME, b);
			check(o.shorter().isStatic() || lifetimes.contains(o.shorter()), rule, UNDECLARED_LIFETIME, b);
		} else if (b instanceof Bound.TypeOutlives) {
			Bound.TypeOutlives o = (Bound.TypeOutlives) b;
			checkWellFormed(o.type(), types, rule);
			checkLifetimes(o.type(), lifetimes, rule);
			check(o.shorter().isStatic() || lifetimes.contains(o.shorter()), rule, UNDECLARED_LIFETIME, b);
		} else {
			Bound.Trait t = (Bound.Trait) b;
			checkWellFormed(t.type(), types, rule);
			checkLifetimes(t.type(), lifetimes, rule);
		}
	}

	private Declaration lookup(Type.Named t) {
		Declaration d = declarations.get(t.name());
		check(d != null, "T-WellFormed", UNDECLARED_TYPE, t);
		return d;
	}

	/**
	 * Validate all declarations and signatures held in this context.
	 */
	private void validate() {
		for (Declaration d : declarations.values()) {
			HashSet<String> ps = new HashSet<>(Arrays.asList(d.typeParameters()));
			HashSet<Lifetime> ls = new HashSet<>(Arrays.asList(d.lifetimeParameters()));
			check(ps.size() == d.typeParameters().length, "T-Declaration", DUPLICATE_DECLARATION, d);
			check(ls.size() == d.lifetimeParameters().length, "T-Declaration", DUPLICATE_DECLARATION, d);
			if (d.size() instanceof Size.Of) {
				check(ps.contains(((Size.Of) d.size()).parameter()), "T-Declaration", UNDECLARED_PARAMETER, d);
			}
			if (d.parent() != null) {
				Declaration p = declarations.get(d.parent());
				check(p != null, "T-Declaration", UNDECLARED_TYPE, d);
				check(p.typeParameters().length == d.typeParameters().length, "T-Declaration", INVALID_VARIANT, d);
				check(Arrays.equals(p.lifetimeParameters(), d.lifetimeParameters()), "T-Declaration",
						INVALID_VARIANT, d);
				check(Arrays.equals(p.variances(), d.variances()), "T-Declaration", INVALID_VARIANT, d);
				// Sizes compared with the variant's parameters renamed to the parent's
				Type[] args = new Type[p.typeParameters().length];
				for (int i = 0; i != args.length; ++i) {
					args[i] = new Type.Param(p.typeParameters()[i]);
				}
				Size s = d.size().substitute(bind(d.typeParameters(), new Lifetime[0], args, new Lifetime[0]));
				check(s.equals(p.size()), "T-Declaration", INVALID_VARIANT, d);
				// Check parent chain terminates
				HashSet<String> visited = new HashSet<>();
				for (Declaration a = d; a != null; a = a.parent() == null ? null : declarations.get(a.parent())) {
					check(visited.add(a.name()), "T-Declaration", CYCLIC_VARIANT, d);
				}
			}
		}
		for (Impl impl : impls) {
			HashSet<String> vs = new HashSet<>(Arrays.asList(impl.variables()));
			checkWellFormed(impl.pattern(), vs, "T-Impl");
			for (Bound.Trait b : impl.requires()) {
				checkWellFormed(b.type(), vs, "T-Impl");
			}
		}
		for (List<Operator> os : operators.values()) {
			for (Operator o : os) {
				for (Type t : o.operands()) {
					checkWellFormed(t, typeParameters, "T-Operator");
				}
				checkWellFormed(o.result(), typeParameters, "T-Operator");
			}
		}
		for (Signature s : signatures.values()) {
			HashSet<String> ps = new HashSet<>(typeParameters);
			ps.addAll(Arrays.asList(s.typeParameters()));
			HashSet<Lifetime> ls = new HashSet<>(lifetimeParameters);
			ls.addAll(Arrays.asList(s.lifetimeParameters()));
			for (Type t : s.parameters()) {
				checkWellFormed(t, ps, "T-Signature");
				checkLifetimes(t, ls, "T-Signature");
			}
			if (!s.diverges()) {
				checkWellFormed(s.returnType(), ps, "T-Signature");
				checkLifetimes(s.returnType(), ls, "T-Signature");
			}
			for (Bound b : s.where()) {
				checkBound(b, ps, ls, "T-Signature");
			}
		}
	}

	private static void check(boolean result, String rule, String msg, Object item) {
		if (!result) {
			throw new VerificationError(VerificationError.Kind.MALFORMED_CONTEXT, rule, msg + " (" + item + ")");
		}
	}

	/**
	 * Distinguishes how a lifetime argument of a named type relates to subtyping
	 * of that type.
	 */
	public enum Variance {
		COVARIANT, INVARIANT
	}

	/**
	 * A user-defined type declaration. A declaration with a parent is a variant
	 * of that parent, and must agree with it on parameters and size.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Declaration {
		private final String name;
		private final String[] typeParameters;
		private final Lifetime[] lifetimeParameters;
		private final Variance[] variances;
		private final Size size;
		private final String parent;

		public Declaration(String name, String[] typeParameters, Lifetime[] lifetimeParameters, Variance[] variances,
				Size size, String parent) {
			if (lifetimeParameters.length != variances.length) {
				throw new IllegalArgumentException("variance required for each lifetime parameter");
			}
			this.name = name;
			this.typeParameters = typeParameters;
			this.lifetimeParameters = lifetimeParameters;
			this.variances = variances;
			this.size = size;
			this.parent = parent;
		}

		public Declaration(String name, Size size) {
			this(name, new String[0], new Lifetime[0], new Variance[0], size, null);
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

		public Variance[] variances() {
			return variances;
		}

		public Size size() {
			return size;
		}

		public String parent() {
			return parent;
		}

		@Override
		public String toString() {
			return name + (parent == null ? "" : " < " + parent);
		}
	}

	/**
	 * A trait implementation fact, such as <code>impl&lt;T: Copy&gt; Copy for
	 * Option&lt;T&gt;</code>. Lifetimes in the pattern match any lifetime, except
	 * for <code>'static</code> which matches only itself.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Impl {
		private final String trait;
		private final String[] variables;
		private final Type pattern;
		private final Bound.Trait[] requires;

		public Impl(String trait, String[] variables, Type pattern, Bound.Trait... requires) {
			this.trait = trait;
			this.variables = variables;
			this.pattern = pattern;
			this.requires = requires;
		}

		public String trait() {
			return trait;
		}

		public String[] variables() {
			return variables;
		}

		public Type pattern() {
			return pattern;
		}

		public Bound.Trait[] requires() {
			return requires;
		}

		/**
		 * Attempt to unify this impl's pattern against a given type, accumulating
		 * bindings for its variables.
		 *
		 * @param type
		 * @param binding
		 * @return
		 */
		public boolean match(Type type, Map<String, Type> binding) {
			return match(pattern, type, binding);
		}

		private boolean match(Type pattern, Type type, Map<String, Type> binding) {
			if (pattern instanceof Type.Param && Arrays.asList(variables).contains(((Type.Param) pattern).name())) {
				String v = ((Type.Param) pattern).name();
				Type bound = binding.get(v);
				if (bound == null) {
					binding.put(v, type);
					return true;
				}
				return bound.equals(type);
			} else if (pattern instanceof Type.Named && type instanceof Type.Named) {
				Type.Named p = (Type.Named) pattern;
				Type.Named t = (Type.Named) type;
				if (!p.name().equals(t.name()) || p.arguments().length != t.arguments().length
						|| p.lifetimeArguments().length != t.lifetimeArguments().length) {
					return false;
				}
				for (int i = 0; i != p.lifetimeArguments().length; ++i) {
					Lifetime pl = p.lifetimeArguments()[i];
					if (pl.isStatic() && !t.lifetimeArguments()[i].isStatic()) {
						return false;
					}
				}
				for (int i = 0; i != p.arguments().length; ++i) {
					if (!match(p.arguments()[i], t.arguments()[i], binding)) {
						return false;
					}
				}
				return true;
			}
			return pattern.equals(type);
		}

		@Override
		public String toString() {
			return "impl " + trait + " for " + pattern;
		}
	}

	/**
	 * The signature of a primitive operator, such as <code>add(Int, Int) -&gt;
	 * Int</code>.
	 */
	public static class Operator {
		private final String name;
		private final Type[] operands;
		private final Type result;

		public Operator(String name, Type[] operands, Type result) {
			this.name = name;
			this.operands = operands;
			this.result = result;
		}

		public String name() {
			return name;
		}

		public Type[] operands() {
			return operands;
		}

		public Type result() {
			return result;
		}

		@Override
		public String toString() {
			return name + Arrays.toString(operands) + " -> " + result;
		}
	}

	/**
	 * A mapping from type parameters to types and from lifetimes to lifetimes.
	 * Parameters not in the mapping are left unchanged.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Substitution {
		private final TypeContext context;
		private final Map<String, Type> types;
		private final Map<Lifetime, Lifetime> lifetimes;

		public Substitution(TypeContext context, Map<String, Type> types, Map<Lifetime, Lifetime> lifetimes) {
			this.context = context;
			this.types = types;
			this.lifetimes = lifetimes;
		}

		/**
		 * Get the type bound to a given parameter, or <code>null</code> if it is
		 * unbound.
		 *
		 * @param parameter
		 * @return
		 */
		public Type type(String parameter) {
			return types.get(parameter);
		}

		public Lifetime lifetime(Lifetime l) {
			Lifetime r = lifetimes.get(l);
			return r == null ? l : r;
		}

		public Size sizeOf(String parameter) {
			Type t = types.get(parameter);
			Size s = t == null ? null : context.sizeOf(t);
			return s == null ? Size.of(parameter) : s;
		}
	}

	/**
	 * Constructs a type context. Type parameters must be declared before any
	 * postulate referring to them.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Builder {
		private final LinkedHashMap<String, Declaration> declarations = new LinkedHashMap<>();
		private final ArrayList<Impl> impls = new ArrayList<>();
		private final ArrayList<Bound.Trait> postulates = new ArrayList<>();
		private final LinkedHashMap<String, List<Operator>> operators = new LinkedHashMap<>();
		private final LinkedHashMap<String, Signature> signatures = new LinkedHashMap<>();
		private final HashSet<String> typeParameters = new HashSet<>();
		private final HashSet<Lifetime> lifetimeParameters = new HashSet<>();

		public Builder declare(Declaration d) {
			check(!declarations.containsKey(d.name()) && !typeParameters.contains(d.name()), "T-Declaration",
					DUPLICATE_DECLARATION, d.name());
			declarations.put(d.name(), d);
			return this;
		}

		public Builder typeParameter(String name) {
			check(!declarations.containsKey(name) && typeParameters.add(name), "T-Declaration", DUPLICATE_DECLARATION,
					name);
			return this;
		}

		public Builder lifetimeParameter(Lifetime l) {
			check(!l.isStatic() && lifetimeParameters.add(l), "T-Declaration", DUPLICATE_DECLARATION, l);
			return this;
		}

		public Builder implement(Impl impl) {
			impls.add(impl);
			return this;
		}

		public Builder postulate(Bound.Trait b) {
			HashSet<String> ps = new HashSet<>();
			b.type().parameters(ps);
			for (String p : ps) {
				check(typeParameters.contains(p), "T-Postulate", UNDECLARED_PARAMETER, b);
			}
			postulates.add(b);
			return this;
		}

		public Builder operator(Operator o) {
			operators.computeIfAbsent(o.name(), k -> new ArrayList<>()).add(o);
			return this;
		}

		public Builder function(Signature s) {
			check(!signatures.containsKey(s.name()), "T-Signature", DUPLICATE_DECLARATION, s.name());
			signatures.put(s.name(), s);
			return this;
		}

		public TypeContext build() {
			TypeContext c = new TypeContext(new LinkedHashMap<>(declarations), new ArrayList<>(impls),
					new ArrayList<>(postulates), new LinkedHashMap<>(operators), new LinkedHashMap<>(signatures),
					new HashSet<>(typeParameters), new HashSet<>(lifetimeParameters));
			c.validate();
			return c;
		}
	}
}
