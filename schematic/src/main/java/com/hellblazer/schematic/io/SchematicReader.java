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

import com.hellblazer.schematic.core.Schematic;
import com.hellblazer.schematic.nbt.DecodeException;
import com.hellblazer.schematic.nbt.DecodeException.TransportException;
import com.hellblazer.schematic.nbt.DecodeException.TruncatedInputException;
import com.hellblazer.schematic.nbt.TagReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;

/**
 * Reader for {@code .schematic} files: a gzip envelope around a named binary tag document.
 * <p>
 * Decoding is eager and all-or-nothing. Every failure surfaces as a {@link DecodeException} whose
 * {@link DecodeException#kind() kind} tells transport problems, truncation and schema violations apart.
 * <pre>
 *   var schematic = new SchematicReader().readResource("/schematics/cylinder.schematic");
 *   schematic.isFilled(64, 64, 64);
 * </pre>
 * Instances hold only immutable configuration and may be shared between threads; each decode uses its own cursor.
 *
 * @author hal.hildebrand
 */
public class SchematicReader {
    private static final Logger log = LoggerFactory.getLogger(SchematicReader.class);

    private final SchematicReaderConfig config;

    public SchematicReader() {
        this(SchematicReaderConfig.defaults());
    }

    public SchematicReader(SchematicReaderConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Config must not be null");
        }
        this.config = config;
    }

    public SchematicReaderConfig getConfig() {
        return config;
    }

    /**
     * Decode a schematic from the classpath.
     *
     * @param resourcePath Resource path (e.g., "/schematics/cylinder.schematic")
     * @return the decoded schematic
     * @throws DecodeException If the resource is missing or cannot be decoded
     */
    public Schematic readResource(String resourcePath) throws DecodeException {
        var stream = getClass().getResourceAsStream(resourcePath);
        if (stream == null) {
            throw new TransportException("Resource not found: " + resourcePath);
        }
        try (stream) {
            return decode(stream, resourcePath);
        } catch (DecodeException e) {
            throw e;
        } catch (IOException e) {
            throw new TransportException("Failed to close resource: " + resourcePath, e);
        }
    }

    /**
     * Decode a schematic file.
     *
     * @param file Path to the schematic file
     * @return the decoded schematic
     * @throws DecodeException If the file cannot be opened or decoded
     */
    public Schematic read(Path file) throws DecodeException {
        InputStream stream;
        try {
            stream = Files.newInputStream(file);
        } catch (IOException e) {
            throw new TransportException("Cannot open schematic file: " + file, e);
        }
        try (stream) {
            return decode(stream, file.toString());
        } catch (DecodeException e) {
            throw e;
        } catch (IOException e) {
            throw new TransportException("Failed to close schematic file: " + file, e);
        }
    }

    /**
     * Decode a gzip-compressed schematic. The stream is consumed but not closed.
     *
     * @param source compressed byte source
     * @return the decoded schematic
     * @throws DecodeException If the gzip envelope is invalid or the document cannot be decoded
     */
    public Schematic decode(InputStream source) throws DecodeException {
        return decode(source, "stream");
    }

    /**
     * Decode a gzip-compressed schematic. The stream is consumed but not closed.
     *
     * @param source     compressed byte source
     * @param sourceName Name for logging and diagnostics (file path or resource name)
     * @return the decoded schematic
     */
    public Schematic decode(InputStream source, String sourceName) throws DecodeException {
        var envelope = openEnvelope(source, sourceName);
        var reader = new TagReader(envelope, config.getMaxArrayLength());
        var schematic = parse(reader);
        verifyTrailer(envelope, reader, sourceName);
        logLoaded(sourceName, schematic, reader);
        return schematic;
    }

    /**
     * Decode an already decompressed tag stream. The stream is consumed but not closed.
     */
    public Schematic decodeUncompressed(InputStream tags) throws DecodeException {
        return decodeUncompressed(tags, "stream");
    }

    /**
     * Decode an already decompressed tag stream. The stream is consumed but not closed.
     *
     * @param tags       raw tag stream
     * @param sourceName Name for logging and diagnostics
     * @return the decoded schematic
     */
    public Schematic decodeUncompressed(InputStream tags, String sourceName) throws DecodeException {
        var reader = new TagReader(tags, config.getMaxArrayLength());
        var schematic = parse(reader);
        logLoaded(sourceName, schematic, reader);
        return schematic;
    }

    private Schematic parse(TagReader reader) throws DecodeException {
        return new SchematicParser(reader, config.isValidateBufferLengths()).parseDocument();
    }

    /**
     * Read the envelope to its end so the gzip trailer (CRC-32 and size) is checked. The parser stops at the root End
     * tag, which precedes the trailer.
     */
    private void verifyTrailer(InputStream envelope, TagReader reader, String sourceName) throws DecodeException {
        try {
            envelope.transferTo(OutputStream.nullOutputStream());
        } catch (EOFException e) {
            throw new TruncatedInputException("gzip trailer of " + sourceName, reader.position(), e);
        } catch (IOException e) {
            throw new TransportException("Corrupt gzip envelope of " + sourceName, e);
        }
    }

    private void logLoaded(String sourceName, Schematic schematic, TagReader reader) {
        log.info("Loaded {} ({}x{}x{}): {} bytes of tags, {} entities, extension {}", sourceName,
                 schematic.dimensionX(), schematic.dimensionY(), schematic.dimensionZ(), reader.position(),
                 schematic.getEntities().size(), schematic.hasExtension() ? "present" : "absent");
    }

    private InputStream openEnvelope(InputStream source, String sourceName) throws DecodeException {
        if (source == null) {
            throw new IllegalArgumentException("Source stream must not be null");
        }
        try {
            return new GZIPInputStream(new BufferedInputStream(source));
        } catch (IOException e) {
            throw new TransportException("Cannot open gzip envelope of " + sourceName, e);
        }
    }
}
