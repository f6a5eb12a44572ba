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

import com.hellblazer.schematic.core.EntityRecord;
import com.hellblazer.schematic.core.Schematic;
import com.hellblazer.schematic.nbt.DecodeException;
import com.hellblazer.schematic.nbt.DecodeException.SchemaViolationException;
import com.hellblazer.schematic.nbt.TagHeader;
import com.hellblazer.schematic.nbt.TagKind;
import com.hellblazer.schematic.nbt.TagReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Interprets a tag stream as a schematic document.
 * <p>
 * Document layout:
 * <pre>
 * COMPOUND "Schematic"
 *   SHORT      Width, Length, Height
 *   STRING     Materials        must be "Alpha"
 *   BYTE_ARRAY Blocks           low bits, one byte per cell
 *   BYTE_ARRAY Data             optional high bits, one byte per cell
 *   INT        WEOffsetX, WEOffsetY, WEOffsetZ
 *   LIST       Entities         kind byte + compound payload per entity, END terminated
 * END
 * </pre>
 * Decoding is strict: an unknown member name, a member with the wrong kind, a repeated member or any entity field is a
 * {@link SchemaViolationException}. Member names are resolved through static tables so the supported field set can be
 * audited in one place.
 * <p>
 * A parser decodes exactly one document and is not thread safe.
 *
 * @author hal.hildebrand
 */
public class SchematicParser {
    private static final Logger log = LoggerFactory.getLogger(SchematicParser.class);

    /**
     * Name of the root compound.
     */
    public static final String ROOT_NAME = "Schematic";

    private static final Map<String, Field<SchematicParser>> DOCUMENT_FIELDS = Map.of(
    "Width", field(TagKind.SHORT, (r, p) -> p.builder.withWidth(r.readShort())),
    "Length", field(TagKind.SHORT, (r, p) -> p.builder.withLength(r.readShort())),
    "Height", field(TagKind.SHORT, (r, p) -> p.builder.withHeight(r.readShort())),
    "Materials", field(TagKind.STRING, (r, p) -> p.materials = r.readString()),
    "Blocks", field(TagKind.BYTE_ARRAY, (r, p) -> p.builder.withBlocks(r.readByteArray())),
    "Data", field(TagKind.BYTE_ARRAY, (r, p) -> p.builder.withData(r.readByteArray())),
    "WEOffsetX", field(TagKind.INT, (r, p) -> p.builder.withWeOffsetX(r.readInt())),
    "WEOffsetY", field(TagKind.INT, (r, p) -> p.builder.withWeOffsetY(r.readInt())),
    "WEOffsetZ", field(TagKind.INT, (r, p) -> p.builder.withWeOffsetZ(r.readInt())),
    "Entities", field(TagKind.LIST, (r, p) -> p.builder.withEntities(p.parseEntityList())));

    // No entity members are recognized in this schema generation
    private static final Map<String, Field<EntityFields>> ENTITY_FIELDS = Map.of();

    private final TagReader         reader;
    private final Schematic.Builder builder;
    private final Set<String>       seen  = new HashSet<>();
    private       String            materials;
    private       State             state = State.EXPECT_ROOT;

    /**
     * @param reader                tag stream positioned at the root tag
     * @param validateBufferLengths whether buffer lengths must match the volume
     */
    public SchematicParser(TagReader reader, boolean validateBufferLengths) {
        if (reader == null) {
            throw new IllegalArgumentException("Tag reader must not be null");
        }
        this.reader = reader;
        this.builder = Schematic.builder().withBufferLengthValidation(validateBufferLengths);
    }

    /**
     * @return where this parser is in its single-document lifecycle
     */
    public State getState() {
        return state;
    }

    /**
     * Decode the document.
     *
     * @return the decoded schematic
     * @throws DecodeException       on the first read or validation failure; no partial result is produced
     * @throws IllegalStateException if this parser has already been used
     */
    public Schematic parseDocument() throws DecodeException {
        if (state != State.EXPECT_ROOT) {
            throw new IllegalStateException("Parser already used, state: " + state);
        }
        try {
            var schematic = parse();
            state = State.DONE;
            return schematic;
        } catch (DecodeException | RuntimeException e) {
            state = State.FAILED;
            throw e;
        }
    }

    private Schematic parse() throws DecodeException {
        var root = reader.readTagHeader();
        if (root.kind() != TagKind.COMPOUND) {
            throw new SchemaViolationException("Top level tag must be COMPOUND, got: " + root.kind());
        }
        if (!ROOT_NAME.equals(root.name())) {
            throw new SchemaViolationException(
            "Unexpected root tag name: '" + root.name() + "', want: '" + ROOT_NAME + "'");
        }

        state = State.READING_FIELDS;
        for (var header = reader.readTagHeader(); !header.isEnd(); header = reader.readTagHeader()) {
            if (!seen.add(header.name())) {
                throw new SchemaViolationException(
                "Duplicate field: '" + header.name() + "' at offset " + reader.position());
            }
            dispatch(DOCUMENT_FIELDS, header, this, "field");
        }

        state = State.EXPECT_VARIANT_CHECK;
        if (!Schematic.ALPHA.equals(materials)) {
            throw new SchemaViolationException(
            "Materials must have '" + Schematic.ALPHA + "' value, got: '" + materials + "'");
        }
        var schematic = builder.withMaterials(materials).build();
        log.debug("Parsed schematic fields {} -> {}", seen, schematic);
        return schematic;
    }

    /**
     * Read an entity list: kind bytes, each followed by a compound payload, until an END kind.
     */
    private List<EntityRecord> parseEntityList() throws DecodeException {
        var entities = new ArrayList<EntityRecord>();
        for (var kind = reader.readTagKind(); kind != TagKind.END; kind = reader.readTagKind()) {
            if (kind != TagKind.COMPOUND) {
                throw new SchemaViolationException(
                "Entity list element must be COMPOUND, got: " + kind + " at offset " + reader.position());
            }
            entities.add(parseEntity());
        }
        log.trace("Parsed {} entities", entities.size());
        return entities;
    }

    private EntityRecord parseEntity() throws DecodeException {
        var fields = new EntityFields();
        for (var header = reader.readTagHeader(); !header.isEnd(); header = reader.readTagHeader()) {
            dispatch(ENTITY_FIELDS, header, fields, "entity field");
        }
        return new EntityRecord(fields.id);
    }

    private <T> void dispatch(Map<String, Field<T>> table, TagHeader header, T target, String what)
    throws DecodeException {
        var field = table.get(header.name());
        if (field == null) {
            throw new SchemaViolationException(
            "Unknown " + what + ": '" + header.name() + "' (" + header.kind() + ") at offset " + reader.position());
        }
        if (field.kind() != header.kind()) {
            throw new SchemaViolationException(
            "Unexpected kind for " + what + " '" + header.name() + "': " + header.kind() + ", want: "
            + field.kind());
        }
        field.handler().read(reader, target);
    }

    /**
     * Lifecycle of a parser. {@code DONE} and {@code FAILED} are terminal.
     */
    public enum State {
        EXPECT_ROOT, READING_FIELDS, EXPECT_VARIANT_CHECK, DONE, FAILED
    }

    @FunctionalInterface
    private interface FieldHandler<T> {
        void read(TagReader reader, T target) throws DecodeException;
    }

    private record Field<T>(TagKind kind, FieldHandler<T> handler) {
    }

    private static Field<SchematicParser> field(TagKind kind, FieldHandler<SchematicParser> handler) {
        return new Field<>(kind, handler);
    }

    private static final class EntityFields {
        private String id = "";
    }
}
