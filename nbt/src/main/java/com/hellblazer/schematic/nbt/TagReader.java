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

import com.hellblazer.schematic.nbt.DecodeException.MalformedLengthException;
import com.hellblazer.schematic.nbt.DecodeException.TransportException;
import com.hellblazer.schematic.nbt.DecodeException.TruncatedInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Cursor over a decompressed named binary tag stream.
 * <p>
 * Decodes primitive values and tag framing in big-endian byte order:
 * <pre>
 * Tag header:  kind(1) [name length(2) name bytes]   name omitted for END
 * Short:       2 bytes, signed
 * Int:         4 bytes, signed
 * String:      length(2, unsigned) + bytes
 * Byte array:  length(4, signed) + bytes
 * </pre>
 * The reader has no knowledge of any schema and never looks ahead. It does not own the underlying stream; closing
 * it is the caller's business.
 * <p>
 * Not thread safe. A reader is meant for a single consumer decoding a single document.
 *
 * @author hal.hildebrand
 */
public class TagReader {
    private static final Logger log = LoggerFactory.getLogger(TagReader.class);

    /**
     * Default upper bound for byte array length prefixes: 64 MiB.
     */
    public static final int DEFAULT_MAX_ARRAY_LENGTH = 64 * 1024 * 1024;

    // Arrays are filled in steps of this size so a bogus length does not allocate up front
    private static final int CHUNK_SIZE = 64 * 1024;

    private final DataInputStream in;
    private final int             maxArrayLength;
    private final byte[]          scratch = new byte[4];
    private       long            position;

    /**
     * Create a reader with the default maximum array length.
     *
     * @param in decompressed tag stream
     */
    public TagReader(InputStream in) {
        this(in, DEFAULT_MAX_ARRAY_LENGTH);
    }

    /**
     * Create a reader.
     *
     * @param in             decompressed tag stream
     * @param maxArrayLength largest byte array length prefix accepted
     */
    public TagReader(InputStream in, int maxArrayLength) {
        if (in == null) {
            throw new IllegalArgumentException("Input stream must not be null");
        }
        if (maxArrayLength < 0) {
            throw new IllegalArgumentException("Maximum array length must be non-negative: " + maxArrayLength);
        }
        this.in = new DataInputStream(in instanceof BufferedInputStream ? in : new BufferedInputStream(in));
        this.maxArrayLength = maxArrayLength;
    }

    /**
     * @return number of bytes consumed so far
     */
    public long position() {
        return position;
    }

    /**
     * @return largest byte array length prefix this reader accepts
     */
    public int maxArrayLength() {
        return maxArrayLength;
    }

    /**
     * Read a big-endian unsigned 16-bit value.
     *
     * @return value in {@code 0..65535}
     */
    public int readUnsignedShort() throws DecodeException {
        fill(scratch, 0, 2, "short", position);
        return ((scratch[0] & 0xFF) << 8) | (scratch[1] & 0xFF);
    }

    /**
     * Read a big-endian signed 16-bit value.
     */
    public short readShort() throws DecodeException {
        return (short) readUnsignedShort();
    }

    /**
     * Read a big-endian two's complement 32-bit value.
     */
    public int readInt() throws DecodeException {
        fill(scratch, 0, 4, "int", position);
        return ((scratch[0] & 0xFF) << 24)
               | ((scratch[1] & 0xFF) << 16)
               | ((scratch[2] & 0xFF) << 8)
               | (scratch[3] & 0xFF);
    }

    /**
     * Read a string: an unsigned 16-bit length followed by that many bytes.
     * <p>
     * The bytes are decoded as UTF-8 without validation; malformed sequences are replaced rather than rejected.
     */
    public String readString() throws DecodeException {
        var start = position;
        var length = readUnsignedShort();
        var bytes = new byte[length];
        fill(bytes, 0, length, "string of " + length + " bytes", start);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    /**
     * Read a byte array: a signed 32-bit length followed by that many bytes.
     *
     * @throws MalformedLengthException if the length is negative or above {@link #maxArrayLength()}
     */
    public byte[] readByteArray() throws DecodeException {
        var start = position;
        var length = readInt();
        if (length < 0 || length > maxArrayLength) {
            throw new MalformedLengthException(length, maxArrayLength, start);
        }
        var what = "byte array of " + length + " bytes";
        var data = new byte[Math.min(length, CHUNK_SIZE)];
        var filled = 0;
        while (filled < length) {
            if (filled == data.length) {
                data = Arrays.copyOf(data, (int) Math.min(length, (long) data.length * 2));
            }
            var count = Math.min(data.length, length) - filled;
            fill(data, filled, count, what, start);
            filled += count;
        }
        return data;
    }

    /**
     * Read a single kind discriminator byte.
     */
    public TagKind readTagKind() throws DecodeException {
        fill(scratch, 0, 1, "tag kind", position);
        return TagKind.fromId(scratch[0] & 0xFF);
    }

    /**
     * Read a tag header: a kind and, unless the kind is {@link TagKind#END}, a name.
     */
    public TagHeader readTagHeader() throws DecodeException {
        var kind = readTagKind();
        if (kind == TagKind.END) {
            return TagHeader.end();
        }
        var header = new TagHeader(kind, readString());
        log.trace("Tag {} at offset {}", header, position);
        return header;
    }

    private void fill(byte[] buffer, int offset, int length, String what, long start) throws DecodeException {
        try {
            in.readFully(buffer, offset, length);
        } catch (EOFException e) {
            throw new TruncatedInputException(what, start, e);
        } catch (IOException e) {
            throw new TransportException("Failed reading " + what + " at offset " + start, e);
        }
        position += length;
    }
}
