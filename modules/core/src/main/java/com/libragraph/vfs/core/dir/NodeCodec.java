package com.libragraph.vfs.core.dir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.libragraph.vfs.core.doc.StoredDocument;
import com.libragraph.vfs.types.NodeType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Maps directory and file nodes to document bodies and back.
 *
 * <p>Files and directories share one doctype and are told apart by the {@code type} field.
 */
public final class NodeCodec {

    /** Doctype shared by all file and directory documents. */
    public static final String DOCTYPE = "io.libragraph.vfs.files";

    static final String TYPE = "type";
    static final String NAME = "name";
    static final String FOLDER_ID = "folder_id";
    static final String PATH = "path";
    static final String TAGS = "tags";
    static final String CREATED_AT = "created_at";
    static final String UPDATED_AT = "updated_at";
    static final String SIZE = "size";
    static final String MIME = "mime";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private NodeCodec() {
    }

    public static ObjectNode encode(DirectoryNode dir) {
        ObjectNode body = common(NodeType.DIRECTORY, dir.name(), dir.folderId(), dir.tags(),
                dir.createdAt(), dir.updatedAt());
        body.put(PATH, dir.path());
        return body;
    }

    public static ObjectNode encode(FileNode file) {
        ObjectNode body = common(NodeType.FILE, file.name(), file.folderId(), file.tags(),
                file.createdAt(), file.updatedAt());
        body.put(SIZE, file.size());
        if (file.mime() != null) {
            body.put(MIME, file.mime());
        }
        return body;
    }

    public static DirectoryNode decodeDirectory(StoredDocument doc) {
        ObjectNode body = doc.body();
        return new DirectoryNode(
                doc.id(),
                doc.rev(),
                doc.text(NAME),
                doc.text(FOLDER_ID),
                doc.text(PATH),
                tags(body),
                instant(body, CREATED_AT),
                instant(body, UPDATED_AT));
    }

    public static FileNode decodeFile(StoredDocument doc) {
        ObjectNode body = doc.body();
        return new FileNode(
                doc.id(),
                doc.rev(),
                doc.text(NAME),
                doc.text(FOLDER_ID),
                body.path(SIZE).asLong(0),
                doc.text(MIME),
                tags(body),
                instant(body, CREATED_AT),
                instant(body, UPDATED_AT));
    }

    /** Type discriminator of a document, empty if missing or unknown. */
    public static Optional<NodeType> typeOf(StoredDocument doc) {
        String label = doc.text(TYPE);
        if (label == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(NodeType.fromLabel(label));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static ObjectNode common(NodeType type, String name, String folderId, List<String> tags,
                                     Instant createdAt, Instant updatedAt) {
        ObjectNode body = NODES.objectNode();
        body.put(TYPE, type.label());
        body.put(NAME, name);
        body.put(FOLDER_ID, folderId);
        ArrayNode tagArray = body.putArray(TAGS);
        tags.forEach(tagArray::add);
        body.put(CREATED_AT, createdAt.toString());
        body.put(UPDATED_AT, updatedAt.toString());
        return body;
    }

    private static List<String> tags(ObjectNode body) {
        List<String> tags = new ArrayList<>();
        JsonNode array = body.get(TAGS);
        if (array != null && array.isArray()) {
            array.forEach(t -> tags.add(t.asText()));
        }
        return tags;
    }

    private static Instant instant(ObjectNode body, String field) {
        JsonNode value = body.get(field);
        return value == null || value.isNull() ? null : Instant.parse(value.asText());
    }
}
