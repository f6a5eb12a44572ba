/**
 * Decoded schematic volumes.
 *
 * <p>{@link com.hellblazer.schematic.core.Schematic} is the immutable result of a decode and the query surface for
 * per-cell material lookups.
 *
 * @author hal.hildebrand
 */
package com.hellblazer.schematic.core;
