package work.lcod.notebook.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.lcod.notebook.format.CellLanguage;
import work.lcod.notebook.format.CellSplitter;
import work.lcod.notebook.format.SourceFormat;
import work.lcod.notebook.model.Cell;
import work.lcod.notebook.model.MalformedInputException;
import work.lcod.notebook.model.Notebook;

/**
 * Maps notebooks to and from the document tree
 * {@code {"format": "SOURCE", "cells": [{"index", "content", "language"}]}}.
 *
 * <p>Decoding trusts the stored {@code language}; directives are not re-detected.
 */
public final class NotebookJsonCodec {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectWriter JSON_WRITER = JSON.writerWithDefaultPrettyPrinter();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private NotebookJsonCodec() {}

    public static ObjectNode toTree(Notebook notebook) {
        Objects.requireNonNull(notebook, "notebook");
        ObjectNode root = JSON.createObjectNode();
        root.put("format", SourceFormat.FORMAT_TAG);
        ArrayNode cells = root.putArray("cells");
        for (Cell cell : notebook.cells()) {
            ObjectNode node = cells.addObject();
            node.put("index", cell.index());
            node.put("content", cell.content());
            node.put("language", cell.languageToken());
        }
        return root;
    }

    public static String toJson(Notebook notebook) {
        try {
            return JSON_WRITER.writeValueAsString(toTree(notebook));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize notebook: " + ex.getOriginalMessage(), ex);
        }
    }

    public static String toYaml(Notebook notebook) {
        try {
            return YAML_MAPPER.writeValueAsString(toTree(notebook));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize notebook: " + ex.getOriginalMessage(), ex);
        }
    }

    public static Notebook fromJson(String json) {
        return fromTree(readTree(JSON, json, "JSON"));
    }

    public static Notebook fromYaml(String yaml) {
        return fromTree(readTree(YAML_MAPPER, yaml, "YAML"));
    }

    public static Notebook fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new MalformedInputException("Notebook document must be an object");
        }
        JsonNode cellsNode = root.get("cells");
        if (cellsNode == null || !cellsNode.isArray()) {
            throw new MalformedInputException("Notebook document requires a 'cells' array");
        }
        List<Cell> cells = new ArrayList<>(cellsNode.size());
        for (int position = 0; position < cellsNode.size(); position++) {
            cells.add(readCell(cellsNode.get(position), position));
        }
        cells.sort(Comparator.comparingInt(Cell::index));
        return new Notebook(cells);
    }

    private static Cell readCell(JsonNode node, int position) {
        if (node == null || !node.isObject()) {
            throw new MalformedInputException("cells[" + position + "] must be an object");
        }
        JsonNode content = node.get("content");
        if (content == null || !content.isTextual()) {
            throw new MalformedInputException("cells[" + position + "].content must be a string");
        }
        if (CellSplitter.containsDelimiter(content.asText())) {
            throw new MalformedInputException("cells[" + position + "].content must not contain a cell delimiter line");
        }
        return new Cell(readIndex(node.get("index"), position), content.asText(), readLanguage(node.get("language"), position));
    }

    private static int readIndex(JsonNode index, int position) {
        if (index == null || index.isNull()) {
            return position;
        }
        if (!index.isIntegralNumber() || !index.canConvertToInt() || index.intValue() < 0) {
            throw new MalformedInputException("cells[" + position + "].index must be a non-negative integer");
        }
        return index.intValue();
    }

    private static Optional<CellLanguage> readLanguage(JsonNode language, int position) {
        if (language == null || language.isNull()) {
            return Optional.empty();
        }
        if (!language.isTextual()) {
            throw new MalformedInputException("cells[" + position + "].language must be a string or null");
        }
        String token = language.asText();
        return Optional.of(CellLanguage.fromToken(token).orElseThrow(
            () -> new MalformedInputException("cells[" + position + "].language is not recognized: " + token)
        ));
    }

    private static JsonNode readTree(ObjectMapper mapper, String text, String kind) {
        Objects.requireNonNull(text, "text");
        try {
            return mapper.readTree(text);
        } catch (JsonProcessingException ex) {
            throw new MalformedInputException("Invalid " + kind + " document: " + ex.getOriginalMessage(), ex);
        }
    }
}
