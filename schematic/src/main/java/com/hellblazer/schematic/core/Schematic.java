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

import com.hellblazer.schematic.nbt.DecodeException.SchemaViolationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Decoded schematic volume: a rectangular grid of material codes plus placement offsets and entity records.
 * <p>
 * Cells are stored in two parallel byte buffers. {@code blocks} carries the low eight bits of each material code,
 * the optional {@code data} buffer carries the high eight bits. Buffers are flattened with x varying fastest, then
 * z, then y:
 * <pre>
 *   index = y * (width * length) + z * width + x
 * </pre>
 * Axis mapping: x spans {@code width}, y spans {@code height}, z spans {@code length}.
 * <p>
 * Instances are immutable and safe for concurrent readers.
 *
 * @author hal.hildebrand
 */
public final class Schematic {

    /**
     * The only supported value of the {@code Materials} field.
     */
    public static final String ALPHA = "Alpha";

    private final int                width;
    private final int                length;
    private final int                height;
    private final int                weOffsetX;
    private final int                weOffsetY;
    private final int                weOffsetZ;
    private final String             materials;
    private final byte[]             blocks;
    private final byte[]             data;
    private final List<EntityRecord> entities;

    private Schematic(Builder builder) {
        this.width = builder.width;
        this.length = builder.length;
        this.height = builder.height;
        this.weOffsetX = builder.weOffsetX;
        this.weOffsetY = builder.weOffsetY;
        this.weOffsetZ = builder.weOffsetZ;
        this.materials = builder.materials;
        this.blocks = builder.blocks == null ? new byte[0] : builder.blocks.clone();
        this.data = builder.data == null ? null : builder.data.clone();
        this.entities = List.copyOf(builder.entities);
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getWidth() {
        return width;
    }

    public int getLength() {
        return length;
    }

    public int getHeight() {
        return height;
    }

    public int getWeOffsetX() {
        return weOffsetX;
    }

    public int getWeOffsetY() {
        return weOffsetY;
    }

    public int getWeOffsetZ() {
        return weOffsetZ;
    }

    public String getMaterials() {
        return materials;
    }

    /**
     * @return copy of the low-bits buffer
     */
    public byte[] getBlocks() {
        return blocks.clone();
    }

    /**
     * @return copy of the high-bits buffer, if the source carried one
     */
    public Optional<byte[]> getData() {
        return data == null ? Optional.empty() : Optional.of(data.clone());
    }

    public boolean hasExtension() {
        return data != null;
    }

    public List<EntityRecord> getEntities() {
        return entities;
    }

    /**
     * @return number of cells along x
     */
    public int dimensionX() {
        return width;
    }

    /**
     * @return number of cells along y
     */
    public int dimensionY() {
        return height;
    }

    /**
     * @return number of cells along z
     */
    public int dimensionZ() {
        return length;
    }

    /**
     * @return total number of cells, {@code width * length * height}
     */
    public long volume() {
        return (long) width * length * height;
    }

    /**
     * Compute the flattened buffer index of a cell.
     *
     * @return the index, or -1 if any coordinate is out of bounds
     */
    public long indexOf(int x, int y, int z) {
        if (x < 0 || y < 0 || z < 0 || x >= width || y >= height || z >= length) {
            return -1;
        }
        return (long) y * width * length + (long) z * width + x;
    }

    /**
     * Material code of a cell.
     * <p>
     * The low byte comes from {@code blocks}, the high byte from {@code data} when present. Out-of-bounds
     * coordinates read as 0, meaning empty.
     *
     * @return unsigned 16-bit material code
     */
    public int materialAt(int x, int y, int z) {
        var index = indexOf(x, y, z);
        if (index < 0) {
            return 0;
        }
        return materialAtIndex(index);
    }

    /**
     * @return true if the cell holds a non-zero material code
     */
    public boolean isFilled(int x, int y, int z) {
        return materialAt(x, y, z) != 0;
    }

    /**
     * @return number of cells with a non-zero material code
     */
    public int filledCount() {
        var count = 0;
        for (long i = 0, n = populatedCells(); i < n; i++) {
            if (materialAtIndex(i) != 0) {
                count++;
            }
        }
        return count;
    }

    /**
     * @return fraction of cells that are filled, 0 for an empty volume
     */
    public float occupancyRatio() {
        var total = volume();
        return total == 0 ? 0.0f : (float) filledCount() / total;
    }

    /**
     * Collect the filled cells in flattening order.
     *
     * @return filled cells with their material codes
     */
    public List<Voxel> filledVoxels() {
        var voxels = new ArrayList<Voxel>();
        var layer = (long) width * length;
        for (long i = 0, n = populatedCells(); i < n; i++) {
            var material = materialAtIndex(i);
            if (material != 0) {
                voxels.add(new Voxel((int) (i % width), (int) (i / layer), (int) (i % layer / width), material));
            }
        }
        return voxels;
    }

    // Cells past both buffer ends are empty, so scans stop at the longer buffer
    private long populatedCells() {
        var buffered = Math.max(blocks.length, data == null ? 0 : data.length);
        return Math.min(volume(), buffered);
    }

    // Indices past a buffer end read as zero; only reachable when length validation was disabled
    private int materialAtIndex(long index) {
        var low = index < blocks.length ? blocks[(int) index] & 0xFF : 0;
        if (data == null || index >= data.length) {
            return low;
        }
        return ((data[(int) index] & 0xFF) << 8) | low;
    }

    @Override
    public String toString() {
        return String.format("Schematic[%dx%dx%d, offset=(%d,%d,%d), materials=%s, extension=%s, entities=%d]",
                             width, height, length, weOffsetX, weOffsetY, weOffsetZ, materials, hasExtension(),
                             entities.size());
    }

    /**
     * Builder for {@link Schematic}.
     * <p>
     * {@link #build()} checks the structural invariants: non-negative dimensions and, unless disabled, buffer lengths
     * equal to {@code width * length * height}.
     */
    public static class Builder {
        private final List<EntityRecord> entities               = new ArrayList<>();
        private       int                width;
        private       int                length;
        private       int                height;
        private       int                weOffsetX;
        private       int                weOffsetY;
        private       int                weOffsetZ;
        private       String             materials;
        private       byte[]             blocks;
        private       byte[]             data;
        private       boolean            validateBufferLengths = true;

        private Builder() {
        }

        public Builder withWidth(int width) {
            this.width = width;
            return this;
        }

        public Builder withLength(int length) {
            this.length = length;
            return this;
        }

        public Builder withHeight(int height) {
            this.height = height;
            return this;
        }

        public Builder withOffset(int x, int y, int z) {
            this.weOffsetX = x;
            this.weOffsetY = y;
            this.weOffsetZ = z;
            return this;
        }

        public Builder withWeOffsetX(int weOffsetX) {
            this.weOffsetX = weOffsetX;
            return this;
        }

        public Builder withWeOffsetY(int weOffsetY) {
            this.weOffsetY = weOffsetY;
            return this;
        }

        public Builder withWeOffsetZ(int weOffsetZ) {
            this.weOffsetZ = weOffsetZ;
            return this;
        }

        public Builder withMaterials(String materials) {
            this.materials = materials;
            return this;
        }

        /**
         * The buffer is copied when the schematic is built.
         */
        public Builder withBlocks(byte[] blocks) {
            this.blocks = blocks;
            return this;
        }

        /**
         * The buffer is copied when the schematic is built.
         */
        public Builder withData(byte[] data) {
            this.data = data;
            return this;
        }

        public Builder addEntity(EntityRecord entity) {
            if (entity == null) {
                throw new IllegalArgumentException("Entity must not be null");
            }
            entities.add(entity);
            return this;
        }

        public Builder withEntities(List<EntityRecord> entities) {
            this.entities.clear();
            entities.forEach(this::addEntity);
            return this;
        }

        /**
         * Controls whether {@link #build()} rejects buffers whose length differs from the cell count.
         */
        public Builder withBufferLengthValidation(boolean validate) {
            this.validateBufferLengths = validate;
            return this;
        }

        /**
         * @return the schematic
         * @throws SchemaViolationException if a dimension is negative or a buffer length does not match the volume
         */
        public Schematic build() throws SchemaViolationException {
            if (width < 0 || length < 0 || height < 0) {
                throw new SchemaViolationException(
                "Negative dimensions: width=" + width + ", length=" + length + ", height=" + height);
            }
            if (validateBufferLengths) {
                var volume = (long) width * length * height;
                checkLength("Blocks", blocks == null ? 0 : blocks.length, volume);
                if (data != null) {
                    checkLength("Data", data.length, volume);
                }
            }
            return new Schematic(this);
        }

        private void checkLength(String field, int actual, long expected) throws SchemaViolationException {
            if (actual != expected) {
                throw new SchemaViolationException(
                String.format("%s holds %,d bytes but the %dx%dx%d volume needs %,d", field, actual, width, height,
                              length, expected));
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Schematic other)) {
            return false;
        }
        return width == other.width && length == other.length && height == other.height
               && weOffsetX == other.weOffsetX && weOffsetY == other.weOffsetY && weOffsetZ == other.weOffsetZ
               && Objects.equals(materials, other.materials) && Arrays.equals(blocks, other.blocks)
               && Arrays.equals(data, other.data) && entities.equals(other.entities);
    }

    @Override
    public int hashCode() {
        var result = Objects.hash(width, length, height, weOffsetX, weOffsetY, weOffsetZ, materials, entities);
        result = 31 * result + Arrays.hashCode(blocks);
        return 31 * result + Arrays.hashCode(data);
    }
}
