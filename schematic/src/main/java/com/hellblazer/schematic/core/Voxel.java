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
 * A filled schematic cell.
 *
 * @param x        cell x, in {@code [0, width)}
 * @param y        cell y, in {@code [0, height)}
 * @param z        cell z, in {@code [0, length)}
 * @param material unsigned 16-bit material code, non-zero
 * @author hal.hildebrand
 */
public record Voxel(int x, int y, int z, int material) {
}
