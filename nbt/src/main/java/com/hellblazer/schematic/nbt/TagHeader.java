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

/**
 * Framing of a single tag: its kind and, unless it is the End sentinel, its name.
 *
 * @param kind the tag kind
 * @param name the tag name, {@code null} for {@link TagKind#END}
 * @author hal.hildebrand
 */
public record TagHeader(TagKind kind, String name) {

    private static final TagHeader END = new TagHeader(TagKind.END, null);

    public TagHeader {
        if (kind == null) {
            throw new IllegalArgumentException("Tag kind must not be null");
        }
        if ((kind == TagKind.END) != (name == null)) {
            throw new IllegalArgumentException("Only the END tag is unnamed: " + kind + " '" + name + "'");
        }
    }

    /**
     * @return the shared End sentinel header
     */
    public static TagHeader end() {
        return END;
    }

    public boolean isEnd() {
        return kind == TagKind.END;
    }

    @Override
    public String toString() {
        return isEnd() ? "END" : kind + " '" + name + "'";
    }
}
