/**
 * Named binary tag reading.
 *
 * <p>A big-endian cursor over an already decompressed tag stream:
 *
 * <ul>
 *   <li>{@link com.hellblazer.schematic.nbt.TagReader} - primitive values and tag framing</li>
 *   <li>{@link com.hellblazer.schematic.nbt.TagKind} - closed set of tag kind discriminators</li>
 *   <li>{@link com.hellblazer.schematic.nbt.TagHeader} - kind plus optional name of one tag</li>
 *   <li>{@link com.hellblazer.schematic.nbt.DecodeException} - failure taxonomy shared by every decode layer</li>
 * </ul>
 *
 * <p>Only the payload kinds needed by the schematic schema are decoded. There is no writer.
 *
 * @author hal.hildebrand
 */
package com.hellblazer.schematic.nbt;
