// Part of Relay: https://relay.machinezoo.com
package com.machinezoo.relay;

import java.lang.annotation.*;

/**
 * Marks a static {@link Declaration} constant for discovery by {@link DeclarationRegistry}.
 * Annotated constants are registered after those passed to {@link DeclarationRegistry#declare(Class, Declaration...)}.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface Declared {
}
