// Part of Relay: https://relay.machinezoo.com
/**
 * Storage backends used as caches of computation results.
 */
package com.machinezoo.relay.storage;
