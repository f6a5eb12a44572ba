/**
 * Schematic decoding.
 *
 * <p>Layered on {@link com.hellblazer.schematic.nbt.TagReader}:
 *
 * <ul>
 *   <li>{@link com.hellblazer.schematic.io.SchematicReader} - entry point, gzip envelope and source handling</li>
 *   <li>{@link com.hellblazer.schematic.io.SchematicParser} - tag dispatch and schema validation</li>
 *   <li>{@link com.hellblazer.schematic.io.SchematicReaderConfig} - decode limits</li>
 * </ul>
 *
 * @author hal.hildebrand
 * @see com.hellblazer.schematic.core.Schematic
 */
package com.hellblazer.schematic.io;
