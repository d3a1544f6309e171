package com.ttennebkram.schematic.serialization;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonParseException;
import com.ttennebkram.schematic.model.BoundingBox;
import com.ttennebkram.schematic.model.DetectedComponent;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads the symbol detector's component list.
 *
 * Accepts either a bare array or an object with a "components" array. Each
 * entry needs an "id" (or "component_id") and a four-number "bbox"; the type
 * label, designation, value and tolerance are optional.
 */
public class ComponentListReader {

    public static List<DetectedComponent> read(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public static List<DetectedComponent> read(Reader reader) throws IOException {
        JsonElement parsed;
        try {
            parsed = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new IOException("Invalid component list: " + e.getMessage(), e);
        }
        return fromJson(parsed);
    }

    public static List<DetectedComponent> fromJson(JsonElement root) throws ComponentListException {
        JsonArray array;
        if (root != null && root.isJsonArray()) {
            array = root.getAsJsonArray();
        } else if (root != null && root.isJsonObject() && root.getAsJsonObject().has("components")
                && root.getAsJsonObject().get("components").isJsonArray()) {
            array = root.getAsJsonObject().getAsJsonArray("components");
        } else {
            throw new ComponentListException("Invalid component list: expected an array or an object with a 'components' array");
        }

        List<DetectedComponent> components = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        for (int i = 0; i < array.size(); i++) {
            JsonElement elem = array.get(i);
            if (!elem.isJsonObject()) {
                throw new ComponentListException("Component " + i + " is not a JSON object");
            }
            DetectedComponent component = readComponent(elem.getAsJsonObject(), i);
            if (!seenIds.add(component.getComponentId())) {
                throw new ComponentListException("Duplicate component id: " + component.getComponentId());
            }
            components.add(component);
        }
        return components;
    }

    private static DetectedComponent readComponent(JsonObject json, int index) throws ComponentListException {
        String id = getJsonString(json, "id", null);
        if (id == null) {
            id = getJsonString(json, "component_id", null);
        }
        if (id == null || id.isEmpty()) {
            throw new ComponentListException("Component " + index + " has no 'id'");
        }

        if (!json.has("bbox") || !json.get("bbox").isJsonArray()) {
            throw new ComponentListException("Component " + id + " has no 'bbox' array");
        }
        JsonArray bbox = json.getAsJsonArray("bbox");
        if (bbox.size() != 4) {
            throw new ComponentListException("Component " + id + " bbox must have 4 numbers, found " + bbox.size());
        }
        double[] coords = new double[4];
        for (int i = 0; i < 4; i++) {
            JsonElement c = bbox.get(i);
            if (!c.isJsonPrimitive() || !c.getAsJsonPrimitive().isNumber()) {
                throw new ComponentListException("Component " + id + " bbox[" + i + "] is not a number");
            }
            coords[i] = c.getAsDouble();
        }

        return new DetectedComponent(id,
            new BoundingBox(coords[0], coords[1], coords[2], coords[3]),
            getJsonString(json, "component_type", null),
            getJsonString(json, "designation", null),
            getJsonString(json, "value", null),
            getJsonString(json, "tolerance", null));
    }

    private static String getJsonString(JsonObject json, String key, String defaultValue) {
        if (json.has(key) && !json.get(key).isJsonNull()) {
            return json.get(key).getAsString();
        }
        return defaultValue;
    }
}
