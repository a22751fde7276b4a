// Part of Relay: https://relay.machinezoo.com
/**
 * Computation units, pipelines composed of them, and task fields holding units in pipelines.
 */
package com.machinezoo.relay.units;
