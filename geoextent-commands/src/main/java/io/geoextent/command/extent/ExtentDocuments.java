/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.geoextent.command.extent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.geoextent.extent.model.AggregateExtent;
import io.geoextent.extent.model.ExtentRecord;
import io.geoextent.extent.model.MergedExtent;
import io.geoextent.extent.model.Vertex;
import io.geoextent.selection.ByteSize;
import io.geoextent.selection.CandidateFile;
import io.geoextent.selection.SelectionResult;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/// JSON reading and writing for the extent commands.
///
/// Input documents are JSON arrays. Values that have the wrong shape inside a record
/// (a non-numeric ordinate, a bbox that is not an array) are passed on as invalid
/// values so the merger skips that record; a document that is not an array of objects
/// is rejected as a whole.
public final class ExtentDocuments {

    /// Shared mapper, pretty-printing results.
    public static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    private ExtentDocuments() {
    }

    /// Read a JSON array document.
    /// @param path the document
    /// @return the array
    /// @throws IOException if the file cannot be read
    /// @throws IllegalArgumentException if the file is not JSON or not an array
    public static ArrayNode readArray(Path path) throws IOException {
        JsonNode root;
        try {
            root = MAPPER.readTree(path.toFile());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Not a JSON document: " + path + ": " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new IllegalArgumentException("Expected a JSON array in " + path);
        }
        return (ArrayNode) root;
    }

    /// Map `[{"name", "bbox", "crs", "tbox", "hull"}, ...]` to extent records.
    public static List<ExtentRecord> toRecords(ArrayNode array) {
        List<ExtentRecord> records = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            JsonNode node = array.get(i);
            if (!node.isObject()) {
                throw new IllegalArgumentException("Record #" + i + " is not a JSON object");
            }
            records.add(new ExtentRecord(
                text(node, "name"),
                ordinates(node.get("bbox")),
                text(node, "crs"),
                dates(node.get("tbox")),
                vertices(node.get("hull"))));
        }
        return records;
    }

    /// Map `[{"name", "url", "size"}, ...]` to candidate files. A missing or null size is unknown.
    /// @throws IllegalArgumentException for a missing name or a negative size
    public static List<CandidateFile> toCandidates(ArrayNode array) {
        List<CandidateFile> files = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            JsonNode node = array.get(i);
            if (!node.isObject()) {
                throw new IllegalArgumentException("Candidate #" + i + " is not a JSON object");
            }
            JsonNode size = node.get("size");
            if (size != null && !size.isNull() && !size.canConvertToLong()) {
                throw new IllegalArgumentException("Candidate #" + i + " has a non-integer size: " + size);
            }
            long bytes = size == null || size.isNull() ? CandidateFile.UNKNOWN_SIZE : size.asLong();
            files.add(new CandidateFile(text(node, "name"), text(node, "url"), bytes));
        }
        return files;
    }

    public static ObjectNode toJson(AggregateExtent extent) {
        MergedExtent spatial = extent.spatial();
        ObjectNode out = MAPPER.createObjectNode();
        if (spatial.isEmpty()) {
            out.putNull("bbox");
            out.putNull("crs");
        } else {
            ArrayNode bbox = out.putArray("bbox");
            for (double ordinate : spatial.bbox().toArray()) {
                bbox.add(ordinate);
            }
            out.put("crs", spatial.crs());
        }
        if (extent.temporal() != null) {
            ArrayNode tbox = out.putArray("tbox");
            for (String date : extent.temporal().toStrings()) {
                tbox.add(date);
            }
        } else {
            out.putNull("tbox");
        }
        if (spatial.isConvexHull()) {
            ArrayNode hull = out.putArray("hull");
            spatial.hull().forEach(vertex -> hull.add(pair(vertex)));
        }
        out.put("isPoint", spatial.isPoint());
        if (spatial.isPoint()) {
            out.set("point", pair(spatial.point()));
        }
        out.put("recordCount", extent.recordCount());
        return out;
    }

    public static ObjectNode toJson(SelectionResult result) {
        ObjectNode out = MAPPER.createObjectNode();
        ArrayNode selected = out.putArray("selected");
        result.selected().forEach(file -> selected.add(toJson(file)));
        out.put("totalBytes", result.totalBytes());
        out.put("totalSize", ByteSize.format(result.totalBytes()));
        ArrayNode skipped = out.putArray("skipped");
        result.skipped().forEach(file -> skipped.add(toJson(file)));
        return out;
    }

    private static ObjectNode toJson(CandidateFile file) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("name", file.name());
        if (file.url() != null) {
            node.put("url", file.url());
        }
        node.put("size", file.size());
        return node;
    }

    private static ArrayNode pair(Vertex vertex) {
        return MAPPER.createArrayNode().add(vertex.x()).add(vertex.y());
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static double[] ordinates(JsonNode node) {
        if (node == null || !node.isArray()) {
            return null;
        }
        double[] values = new double[node.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = number(node.get(i));
        }
        return values;
    }

    private static String[] dates(JsonNode node) {
        if (node == null || !node.isArray()) {
            return null;
        }
        String[] values = new String[node.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = node.get(i).asText();
        }
        return values;
    }

    private static List<Vertex> vertices(JsonNode node) {
        if (node == null || !node.isArray()) {
            return null;
        }
        List<Vertex> vertices = new ArrayList<>(node.size());
        for (JsonNode item : node) {
            if (item.isArray() && item.size() >= 2) {
                vertices.add(new Vertex(number(item.get(0)), number(item.get(1))));
            } else {
                vertices.add(new Vertex(Double.NaN, Double.NaN));
            }
        }
        return vertices;
    }

    private static double number(JsonNode node) {
        return node != null && node.isNumber() ? node.doubleValue() : Double.NaN;
    }
}
