// Part of Relay: https://relay.machinezoo.com
/*
 * Conventions followed by all configurable classes:
 * - Fields are declared as public static final constants and registered in static initializer.
 * - Registration happens before any instance of the class is created.
 * - Absent values are represented by null. Null is never a meaningful field value.
 * - Type errors are reported when values are assigned. Missing mandatory values are reported when read.
 * - Method toString() lists non-absent fields.
 */
/**
 * Declarative field framework.
 * Classes extending {@link com.machinezoo.relay.FieldContainer} declare typed fields with defaults,
 * which are then configured through constructor arguments or individually.
 */
package com.machinezoo.relay;
