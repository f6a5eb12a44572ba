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
package com.hellblazer.schematic.core;

/**
 * One member of a schematic's entity list.
 * <p>
 * The current schema generation recognizes no entity fields, so decoded records carry an empty id.
 *
 * @param id entity identifier, never null
 * @author hal.hildebrand
 */
public record EntityRecord(String id) {

    public EntityRecord {
        if (id == null) {
            throw new IllegalArgumentException("Entity id must not be null");
        }
    }

    /**
     * @return a record with no recognized fields
     */
    public static EntityRecord anonymous() {
        return new EntityRecord("");
    }
}
