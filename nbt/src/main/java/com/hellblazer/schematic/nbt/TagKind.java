/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Schematic reader.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.schematic.nbt;

import com.hellblazer.schematic.nbt.DecodeException.SchemaViolationException;

/**
 * Tag kind discriminators of the named binary tag format.
 * <p>
 * The reader decodes payloads only for the kinds the schematic schema uses; the remaining kinds are recognized so
 * that diagnostics can name them.
 *
 * @author hal.hildebrand
 */
public enum TagKind {
    /** Terminates the member sequence of a compound, carries no name */
    END(0),
    BYTE(1),
    SHORT(2),
    INT(3),
    LONG(4),
    FLOAT(5),
    DOUBLE(6),
    BYTE_ARRAY(7),
    STRING(8),
    LIST(9),
    COMPOUND(10);

    private static final TagKind[] BY_ID = values();

    private final int id;

    TagKind(int id) {
        this.id = id;
    }

    /**
     * Map a discriminator byte to its kind.
     *
     * @param id the unsigned discriminator value
     * @return the kind
     * @throws SchemaViolationException if no kind has this id
     */
    public static TagKind fromId(int id) throws SchemaViolationException {
        if (id < 0 || id >= BY_ID.length) {
            throw new SchemaViolationException("Unknown tag kind: " + id);
        }
        return BY_ID[id];
    }

    /**
     * @return the wire discriminator of this kind
     */
    public int id() {
        return id;
    }
}
