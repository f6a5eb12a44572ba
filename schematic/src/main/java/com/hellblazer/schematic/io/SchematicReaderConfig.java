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
package com.hellblazer.schematic.io;

import com.hellblazer.schematic.nbt.TagReader;

/**
 * Configuration for {@link SchematicReader}.
 * <p>
 * Controls the hardening limits applied while decoding; the accepted schema itself is fixed.
 *
 * @author hal.hildebrand
 */
public class SchematicReaderConfig {

    private static final SchematicReaderConfig DEFAULTS = builder().build();

    private final int     maxArrayLength;
    private final boolean validateBufferLengths;

    private SchematicReaderConfig(Builder builder) {
        this.maxArrayLength = builder.maxArrayLength;
        this.validateBufferLengths = builder.validateBufferLengths;
    }

    /**
     * @return configuration with default limits and buffer length validation enabled
     */
    public static SchematicReaderConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Creates a new builder for SchematicReaderConfig
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the largest byte array length prefix accepted
     *
     * @return maximum array length in bytes
     */
    public int getMaxArrayLength() {
        return maxArrayLength;
    }

    /**
     * Returns whether {@code Blocks} and {@code Data} must hold exactly one byte per cell
     *
     * @return true if mismatched buffers are rejected
     */
    public boolean isValidateBufferLengths() {
        return validateBufferLengths;
    }

    @Override
    public String toString() {
        return "SchematicReaderConfig[maxArrayLength=" + maxArrayLength + ", validateBufferLengths="
               + validateBufferLengths + "]";
    }

    /**
     * Builder class for SchematicReaderConfig
     */
    public static class Builder {
        private int     maxArrayLength        = TagReader.DEFAULT_MAX_ARRAY_LENGTH;
        private boolean validateBufferLengths = true;

        private Builder() {
            // Private constructor to enforce builder pattern
        }

        /**
         * Sets the largest byte array length prefix accepted
         *
         * @param maxArrayLength maximum array length in bytes
         * @return this builder instance
         * @throws IllegalArgumentException if the length is negative
         */
        public Builder withMaxArrayLength(int maxArrayLength) {
            if (maxArrayLength < 0) {
                throw new IllegalArgumentException("Maximum array length must be non-negative");
            }
            this.maxArrayLength = maxArrayLength;
            return this;
        }

        /**
         * Sets whether buffer lengths are checked against the volume
         *
         * @param validate true to reject mismatched buffers
         * @return this builder instance
         */
        public Builder withBufferLengthValidation(boolean validate) {
            this.validateBufferLengths = validate;
            return this;
        }

        /**
         * Builds the configuration
         *
         * @return a new SchematicReaderConfig instance
         */
        public SchematicReaderConfig build() {
            return new SchematicReaderConfig(this);
        }
    }
}
