// Part of Relay: https://relay.machinezoo.com
package com.machinezoo.relay;

import static java.util.stream.Collectors.*;
import java.lang.reflect.*;
import java.util.*;
import java.util.concurrent.*;
import com.machinezoo.noexception.*;
import com.machinezoo.stagean.*;
import it.unimi.dsi.fastutil.objects.*;

/*
 * Registry is computed once per class and never changes afterwards.
 * Classes register their declarations from static initializer, which runs before the first instance is created.
 * Registry lookup forces class initialization, so registries can be queried before the class is used.
 * Instance created by static initializer before the declarations are registered would freeze an incomplete registry.
 * Late declare() is therefore rejected instead of being silently lost.
 *
 * Reflection returns fields in source order on all JVMs we know of, but the JLS does not promise that.
 * Classes that need guaranteed order should use declare() instead of annotations.
 */
/**
 * Ordered set of {@link Declaration}s visible on a class, including inherited ones.
 * Registry of a subclass starts as a copy of the parent registry.
 * Declarations of the subclass are then layered on top of it.
 * Declaration with a name already present in the parent replaces the parent's declaration without changing its position.
 * New names are appended. Direct declarations come first, annotated ones after them.
 *
 * @see Declaration
 * @see Declared
 */
@DraftApi("consider replacing reflection with annotation processor")
public class DeclarationRegistry {
	private static final DeclarationRegistry EMPTY = new DeclarationRegistry(List.of());
	private static final Map<Class<?>, List<Declaration>> direct = new ConcurrentHashMap<>();
	private static final Set<Class<?>> built = ConcurrentHashMap.newKeySet();
	private static final ClassValue<DeclarationRegistry> registries = new ClassValue<>() {
		@Override
		protected DeclarationRegistry computeValue(Class<?> type) {
			return build(type);
		}
	};
	private final List<Declaration> ordered;
	private final Object2IntMap<String> positions = new Object2IntOpenHashMap<>();
	private DeclarationRegistry(List<Declaration> ordered) {
		this.ordered = List.copyOf(ordered);
		positions.defaultReturnValue(-1);
		for (int i = 0; i < this.ordered.size(); ++i)
			positions.put(this.ordered.get(i).name(), i);
	}
	/**
	 * Registers declarations of the given class.
	 * This is meant to be called from static initializer of the class.
	 * Declarations are listed in the order they are passed to this method.
	 *
	 * @param owner
	 *            class that owns the declarations
	 * @param declarations
	 *            declarations in the order they should appear in the registry
	 * @throws IllegalStateException
	 *             if the class already declared its fields or if its registry was already built,
	 *             for example because an instance was created earlier in the static initializer
	 */
	public static void declare(Class<?> owner, Declaration... declarations) {
		Objects.requireNonNull(owner);
		for (var declaration : declarations)
			Objects.requireNonNull(declaration);
		if (built.contains(owner))
			throw new IllegalStateException("Declarations of " + owner.getName() + " must be registered before its registry is used.");
		if (direct.putIfAbsent(owner, List.of(declarations)) != null)
			throw new IllegalStateException("Declarations of " + owner.getName() + " were already registered.");
	}
	/**
	 * Gets registry for the given class.
	 * Class is initialized if it has not been initialized yet.
	 *
	 * @param type
	 *            class to inspect
	 * @return registry of the class
	 */
	public static DeclarationRegistry of(Class<?> type) {
		Objects.requireNonNull(type);
		return registries.get(type);
	}
	private static DeclarationRegistry build(Class<?> type) {
		if (type.getSuperclass() == null)
			return EMPTY;
		Exceptions.sneak().run(() -> Class.forName(type.getName(), true, type.getClassLoader()));
		built.add(type);
		var parent = of(type.getSuperclass());
		var own = new ArrayList<Declaration>(direct.getOrDefault(type, List.of()));
		var named = own.stream().map(Declaration::name).collect(toSet());
		for (var field : type.getDeclaredFields()) {
			if (!field.isAnnotationPresent(Declared.class))
				continue;
			int modifiers = field.getModifiers();
			if (!Modifier.isStatic(modifiers))
				throw new IllegalStateException("Declared field must be static: " + field);
			field.trySetAccessible();
			var value = Exceptions.sneak().get(() -> field.get(null));
			/*
			 * Annotated values of other kinds are silently ignored like any other ordinary static member.
			 */
			if (value instanceof Declaration declaration && named.add(declaration.name()))
				own.add(declaration);
		}
		if (own.isEmpty())
			return parent;
		var merged = new ArrayList<>(parent.ordered);
		for (var declaration : own) {
			int position = parent.positions.getInt(declaration.name());
			if (position >= 0)
				merged.set(position, declaration);
			else
				merged.add(declaration);
		}
		return new DeclarationRegistry(merged);
	}
	public List<Declaration> all() {
		return ordered;
	}
	public List<String> names() {
		return ordered.stream().map(Declaration::name).collect(toList());
	}
	public boolean contains(String name) {
		return positions.containsKey(name);
	}
	/**
	 * Gets declaration by name.
	 *
	 * @param name
	 *            declared name
	 * @return declaration registered under the name
	 * @throws IllegalArgumentException
	 *             if there is no such declaration
	 */
	public Declaration get(String name) {
		int position = positions.getInt(name);
		if (position < 0)
			throw new IllegalArgumentException("No declaration named '" + name + "'.");
		return ordered.get(position);
	}
	/**
	 * Lists declarations of the given kind in registry order.
	 *
	 * @param <D>
	 *            kind of declarations to collect
	 * @param kind
	 *            class of the declarations to collect
	 * @return ordered map from declared name to declaration
	 */
	public <D extends Declaration> Map<String, D> collect(Class<D> kind) {
		var collected = new LinkedHashMap<String, D>();
		for (var declaration : ordered)
			if (kind.isInstance(declaration))
				collected.put(declaration.name(), kind.cast(declaration));
		return collected;
	}
	/**
	 * Gets declaration of the given kind by name.
	 *
	 * @throws IllegalArgumentException
	 *             if there is no such declaration or it is of a different kind
	 */
	public <D extends Declaration> D get(Class<D> kind, String name) {
		var declaration = get(name);
		if (!kind.isInstance(declaration))
			throw new IllegalArgumentException("Declaration '" + name + "' is not " + kind.getSimpleName() + ".");
		return kind.cast(declaration);
	}
	@Override
	public String toString() {
		return names().toString();
	}
}
