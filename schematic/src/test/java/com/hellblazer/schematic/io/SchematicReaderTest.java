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

import com.hellblazer.schematic.nbt.DecodeException;
import com.hellblazer.schematic.nbt.DecodeException.MalformedLengthException;
import com.hellblazer.schematic.nbt.DecodeException.SchemaViolationException;
import com.hellblazer.schematic.nbt.DecodeException.TransportException;
import com.hellblazer.schematic.nbt.DecodeException.TruncatedInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SchematicReader - gzip envelope handling and end-to-end decoding.
 *
 * @author hal.hildebrand
 */
class SchematicReaderTest {

    private static final String CYLINDER            = "/schematics/cylinder.schematic";
    private static final int    GZIP_HEADER_LENGTH  = 10;
    private static final int    GZIP_TRAILER_LENGTH = 8;

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Load 128³ cylinder from resources")
    void testLoadCylinder() throws Exception {
        var schematic = new SchematicReader().readResource(CYLINDER);

        assertEquals(128, schematic.dimensionX());
        assertEquals(128, schematic.dimensionY());
        assertEquals(128, schematic.dimensionZ());
        assertTrue(schematic.isFilled(64, 64, 64));
        assertFalse(schematic.isFilled(0, 0, 0));
    }

    @Test
    @DisplayName("Cylinder metadata and occupancy")
    void testCylinderContents() throws Exception {
        var schematic = new SchematicReader().readResource(CYLINDER);

        assertEquals("Alpha", schematic.getMaterials());
        assertEquals(-64, schematic.getWeOffsetX());
        assertEquals(0, schematic.getWeOffsetY());
        assertEquals(-64, schematic.getWeOffsetZ());
        assertFalse(schematic.hasExtension());
        assertTrue(schematic.getEntities().isEmpty());

        // radius 40 disk around (64, 64) in x/z, extruded over y in [16, 112)
        assertEquals(482_400, schematic.filledCount());
        assertEquals(1, schematic.materialAt(64, 16, 64));
        assertEquals(1, schematic.materialAt(104, 111, 64));
        assertEquals(0, schematic.materialAt(64, 15, 64));
        assertEquals(0, schematic.materialAt(64, 112, 64));
        assertEquals(0, schematic.materialAt(105, 64, 64));
        assertEquals(0, schematic.materialAt(128, 64, 64));
        assertEquals(0, schematic.materialAt(64, -1, 64));
    }

    @Test
    void readFromFile() throws Exception {
        byte[] compressed;
        try (var in = getClass().getResourceAsStream(CYLINDER)) {
            assertNotNull(in);
            compressed = in.readAllBytes();
        }
        var file = tempDir.resolve("cylinder.schematic");
        Files.write(file, compressed);

        var schematic = new SchematicReader().read(file);
        assertEquals(128, schematic.dimensionX());
        assertTrue(schematic.isFilled(64, 64, 64));
    }

    @Test
    void decodeStream() throws Exception {
        var blocks = new byte[] { 0, 3, 0, 0 };
        var compressed = TagStreamBuilder.schematic(2, 2, 1, blocks).end().toGzip();

        var schematic = new SchematicReader().decode(new ByteArrayInputStream(compressed));
        assertTrue(schematic.isFilled(1, 0, 0));
        assertEquals(1, schematic.filledVoxels().size());
    }

    @Test
    void decodeUncompressed() throws Exception {
        var stream = TagStreamBuilder.schematic(1, 1, 1, new byte[] { 7 }).end().toStream();
        var schematic = new SchematicReader().decodeUncompressed(stream, "raw");
        assertEquals(7, schematic.materialAt(0, 0, 0));

        var anonymous = TagStreamBuilder.schematic(1, 1, 1, new byte[] { 9 }).end().toStream();
        assertEquals(9, new SchematicReader().decodeUncompressed(anonymous).materialAt(0, 0, 0));
    }

    @Test
    void missingResource() {
        var e = assertThrows(TransportException.class, () -> new SchematicReader().readResource("/nope.schematic"));
        assertEquals(DecodeException.Kind.TRANSPORT, e.kind());
    }

    @Test
    void missingFile() {
        assertThrows(TransportException.class, () -> new SchematicReader().read(tempDir.resolve("absent")));
    }

    @Test
    @DisplayName("Bytes that are not a gzip stream are a transport error")
    void notGzip() {
        var raw = TagStreamBuilder.schematic(1, 1, 1).end().toByteArray();
        var e = assertThrows(TransportException.class,
                             () -> new SchematicReader().decode(new ByteArrayInputStream(raw)));
        assertNotNull(e.getCause());
    }

    @Test
    void textIsNotGzip() {
        var text = "just some text, definitely not compressed".getBytes(StandardCharsets.UTF_8);
        assertThrows(TransportException.class, () -> new SchematicReader().decode(new ByteArrayInputStream(text)));
    }

    @Test
    void emptySourceCannotOpenEnvelope() {
        assertThrows(TransportException.class,
                     () -> new SchematicReader().decode(new ByteArrayInputStream(new byte[0])));
    }

    @Test
    @DisplayName("A gzip stream whose content is cut short fails as truncated input")
    void truncatedContent() {
        var raw = TagStreamBuilder.schematic(4, 4, 4).end().toByteArray();
        var compressed = TagStreamBuilder.gzip(Arrays.copyOf(raw, raw.length - 10));
        assertThrows(TruncatedInputException.class,
                     () -> new SchematicReader().decode(new ByteArrayInputStream(compressed)));
    }

    @Test
    @DisplayName("Every cut of the compressed bytes fails, inside the header as transport, later as truncation")
    void everyCompressedPrefixFails() {
        var compressed = TagStreamBuilder.schematic(2, 2, 2, new byte[] { 1, 0, 2, 0, 0, 3, 0, 4 }).end().toGzip();

        for (int cut = 0; cut < compressed.length; cut++) {
            var prefix = Arrays.copyOf(compressed, cut);
            var e = assertThrows(DecodeException.class,
                                 () -> new SchematicReader().decode(new ByteArrayInputStream(prefix)),
                                 "prefix of " + cut + " bytes");
            var expected = cut < GZIP_HEADER_LENGTH ? DecodeException.Kind.TRANSPORT
                                                    : DecodeException.Kind.TRUNCATED_INPUT;
            assertEquals(expected, e.kind(), "prefix of " + cut + " bytes");
        }
    }

    @Test
    @DisplayName("Cylinder with a cut gzip trailer fails as truncated input")
    void cylinderWithoutTrailer() throws Exception {
        byte[] compressed;
        try (var in = getClass().getResourceAsStream(CYLINDER)) {
            assertNotNull(in);
            compressed = in.readAllBytes();
        }
        for (int cut = 1; cut <= GZIP_TRAILER_LENGTH; cut++) {
            var prefix = Arrays.copyOf(compressed, compressed.length - cut);
            assertThrows(TruncatedInputException.class,
                         () -> new SchematicReader().decode(new ByteArrayInputStream(prefix)),
                         "missing last " + cut + " bytes");
        }
    }

    @Test
    @DisplayName("A CRC mismatch in the gzip trailer is a transport error")
    void corruptChecksum() {
        var compressed = TagStreamBuilder.schematic(2, 2, 2, new byte[] { 1, 0, 2, 0, 0, 3, 0, 4 }).end().toGzip();
        var corrupt = compressed.clone();
        corrupt[corrupt.length - 6] ^= 0x55;

        var e = assertThrows(TransportException.class,
                             () -> new SchematicReader().decode(new ByteArrayInputStream(corrupt)));
        assertEquals(DecodeException.Kind.TRANSPORT, e.kind());
    }

    @Test
    void schemaViolationThroughEnvelope() {
        var compressed = new TagStreamBuilder().compound("Level").end().toGzip();
        var e = assertThrows(SchemaViolationException.class,
                             () -> new SchematicReader().decode(new ByteArrayInputStream(compressed)));
        assertEquals(DecodeException.Kind.SCHEMA_VIOLATION, e.kind());
    }

    @Test
    @DisplayName("Configured array limit rejects larger buffers")
    void maxArrayLengthFromConfig() {
        var config = SchematicReaderConfig.builder().withMaxArrayLength(1024).build();
        var reader = new SchematicReader(config);

        assertThrows(MalformedLengthException.class, () -> reader.readResource(CYLINDER));
    }

    @Test
    void lengthValidationFromConfig() throws Exception {
        var compressed = TagStreamBuilder.schematic(2, 2, 2, new byte[] { 1 }).end().toGzip();

        assertThrows(SchemaViolationException.class,
                     () -> new SchematicReader().decode(new ByteArrayInputStream(compressed)));

        var lenient = new SchematicReader(SchematicReaderConfig.builder().withBufferLengthValidation(false).build());
        var schematic = lenient.decode(new ByteArrayInputStream(compressed));
        assertEquals(1, schematic.materialAt(0, 0, 0));
        assertEquals(0, schematic.materialAt(1, 1, 1));
    }

    @Test
    void rejectsNullConfig() {
        assertThrows(IllegalArgumentException.class, () -> new SchematicReader(null));
    }
}
