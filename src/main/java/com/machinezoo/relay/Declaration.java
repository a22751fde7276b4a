// Part of Relay: https://relay.machinezoo.com
package com.machinezoo.relay;

import com.machinezoo.stagean.*;

/**
 * Class-level declaration tracked by {@link DeclarationRegistry}.
 * Only values implementing this interface are recorded in the registry.
 * Everything else declared on the class remains an ordinary static member.
 * 
 * @see FieldSpec
 * @see DeclarationRegistry
 */
@StubDocs
public interface Declaration {
	/**
	 * Gets the name under which this declaration is registered.
	 * Subclasses can replace a parent's declaration by declaring another one with the same name.
	 * 
	 * @return declared name
	 */
	String name();
}
