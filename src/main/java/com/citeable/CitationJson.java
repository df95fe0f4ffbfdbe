package com.citeable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON form of a citation collection.
 *
 * <p>Unlike BibTeX, the JSON form keeps everything a host needs to rebuild its collection:
 * a {@code "type"} discriminator with the variant name, every populated field (including
 * {@code thesis_type}), the current {@code key} and {@code app}.
 * <pre>
 * [{"type":"Software","author":["Dev, Jane"],"title":"my-tool","year":2024,"key":"Dev.2024","app":"my-plugin"}]
 * </pre>
 */
public final class CitationJson {

    private static final Logger log = LoggerFactory.getLogger(CitationJson.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<Map<String, Object>>> LIST_OF_MAPS = new TypeReference<>() {
    };

    private CitationJson() {
    }

    public static String toJson(Iterable<? extends Citation> citations) throws JsonProcessingException {
        List<Map<String, Object>> out = new ArrayList<>();
        for (Citation c : citations) {
            out.add(toMap(c));
        }
        return MAPPER.writeValueAsString(out);
    }

    /**
     * @throws ValidationException if an object has no or an unknown {@code "type"}, or fails validation
     */
    public static List<Citation> fromJson(String json) throws JsonProcessingException {
        List<Citation> out = new ArrayList<>();
        for (Map<String, Object> data : MAPPER.readValue(json, LIST_OF_MAPS)) {
            out.add(fromMap(data));
        }
        return out;
    }

    public static void writeJson(Iterable<? extends Citation> citations, Path path) throws IOException {
        Files.writeString(path, toJson(citations), StandardCharsets.UTF_8);
        log.info("Wrote citations as JSON to {}", path);
    }

    public static List<Citation> loadJson(Path path) throws IOException {
        return fromJson(Files.readString(path, StandardCharsets.UTF_8));
    }

    static Map<String, Object> toMap(Citation c) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("type", c.type().displayName());
        for (FieldSpec f : c.type().schema().fields()) {
            Object v = c.get(f.name());
            if (v != null) data.put(f.name(), v);
        }
        data.put("key", c.key());
        data.put("app", c.app());
        return data;
    }

    static Citation fromMap(Map<String, Object> data) {
        Object typeName = data.get("type");
        if (typeName == null) {
            throw new ValidationException("Citation", "type", "JSON citation is missing required 'type' key");
        }
        EntryType type = EntryType.fromName(typeName.toString());
        if (type == null) {
            throw new ValidationException(typeName.toString(), "type", "unknown citation type '" + typeName + "'");
        }

        Citation.Builder<?> b = type.newBuilder();
        for (FieldSpec f : type.schema().fields()) {
            Object raw = data.get(f.name());
            if (raw == null) continue;
            try {
                b.field(f.name(), f.type().fromJson(raw));
            } catch (NumberFormatException e) {
                throw new ValidationException(type.displayName(), f.name(),
                        type.displayName() + " field '" + f.name() + "' must be an integer; received '" + raw + "'", e);
            }
        }
        Object key = data.get("key");
        Object app = data.get("app");
        return b.key(key == null ? null : key.toString())
                .app(app == null ? null : app.toString())
                .build();
    }
}
