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

import java.io.IOException;

/**
 * Sealed exception hierarchy for tag stream decoding.
 * <p>
 * Decoding is all-or-nothing: the first failure aborts the decode and surfaces as exactly one of these types. Callers
 * branch on {@link #kind()} or on the concrete subclass rather than on the message text.
 * <p>
 * Exception types:
 * <ul>
 * <li>{@link TransportException} - the byte source or its compression envelope cannot be opened or read</li>
 * <li>{@link TruncatedInputException} - the stream ended before a value was complete</li>
 * <li>{@link SchemaViolationException} - well-framed data that does not match the expected schema</li>
 * <li>{@link MalformedLengthException} - a length prefix is negative or exceeds the configured bound</li>
 * </ul>
 *
 * @author hal.hildebrand
 */
public abstract sealed class DecodeException extends IOException
    permits DecodeException.TransportException, DecodeException.TruncatedInputException,
            DecodeException.SchemaViolationException {

    /**
     * Failure category, one per concrete exception type.
     */
    public enum Kind {
        TRANSPORT, TRUNCATED_INPUT, SCHEMA_VIOLATION, MALFORMED_LENGTH
    }

    protected DecodeException(String message) {
        super(message);
    }

    protected DecodeException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return the failure category of this exception
     */
    public abstract Kind kind();

    /**
     * Transport exception.
     * <p>
     * Thrown when the byte source, or the decompression envelope wrapping it, cannot be opened or fails while being
     * read.
     */
    public static final class TransportException extends DecodeException {

        public TransportException(String message) {
            super(message);
        }

        public TransportException(String message, Throwable cause) {
            super(message, cause);
        }

        @Override
        public Kind kind() {
            return Kind.TRANSPORT;
        }
    }

    /**
     * Truncated input exception.
     * <p>
     * Thrown when fewer bytes remain than a primitive or framed value requires.
     */
    public static final class TruncatedInputException extends DecodeException {
        private final long position;

        /**
         * @param what     description of the value being read
         * @param position stream offset at which the read started
         * @param cause    the underlying end-of-stream condition
         */
        public TruncatedInputException(String what, long position, Throwable cause) {
            super(String.format("Truncated input: stream ended while reading %s at offset %,d", what, position),
                  cause);
            this.position = position;
        }

        /**
         * @return stream offset at which the incomplete value started
         */
        public long getPosition() {
            return position;
        }

        @Override
        public Kind kind() {
            return Kind.TRUNCATED_INPUT;
        }
    }

    /**
     * Schema violation exception.
     * <p>
     * Thrown for structurally well-framed tag data that violates the expected schema: wrong root kind or name, an
     * unrecognized field, an unexpected tag kind, a wrong schema variant or inconsistent buffer sizes.
     */
    public static sealed class SchemaViolationException extends DecodeException permits MalformedLengthException {

        public SchemaViolationException(String message) {
            super(message);
        }

        @Override
        public Kind kind() {
            return Kind.SCHEMA_VIOLATION;
        }
    }

    /**
     * Malformed length exception.
     * <p>
     * Thrown when a length prefix is negative or larger than the configured maximum array length.
     */
    public static final class MalformedLengthException extends SchemaViolationException {
        private final long length;

        /**
         * @param length   the declared length
         * @param maximum  the largest accepted length
         * @param position stream offset of the length prefix
         */
        public MalformedLengthException(long length, int maximum, long position) {
            super(String.format("Malformed length %,d at offset %,d (accepted range 0..%,d)", length, position,
                                maximum));
            this.length = length;
        }

        /**
         * @return the declared length that was rejected
         */
        public long getLength() {
            return length;
        }

        @Override
        public Kind kind() {
            return Kind.MALFORMED_LENGTH;
        }
    }
}
