package work.stackenv.config;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * YAML document converted to plain maps and lists, remembering the line of every mapping key so schema errors
 * can point at the offending line.
 */
public final class YamlDocument {
    private static final YAMLFactory YAML = new YAMLFactory();

    private final String source;
    private final Map<String, Object> root;
    private final Map<String, Integer> keyLines;

    private YamlDocument(String source, Map<String, Object> root, Map<String, Integer> keyLines) {
        this.source = source;
        this.root = root;
        this.keyLines = keyLines;
    }

    public static YamlDocument read(Path path, String displayName) {
        try (var in = Files.newInputStream(path)) {
            return read(in, displayName);
        } catch (IOException ex) {
            throw new ConfigFormatException(displayName, -1, "unable to read file: " + ex.getMessage(), ex);
        }
    }

    public static YamlDocument parse(String text, String displayName) {
        try (JsonParser parser = YAML.createParser(new StringReader(text))) {
            return build(parser, displayName);
        } catch (IOException ex) {
            throw new ConfigFormatException(displayName, errorLine(ex), "invalid YAML: " + ex.getMessage(), ex);
        }
    }

    public static YamlDocument read(InputStream in, String displayName) {
        try (JsonParser parser = YAML.createParser(in)) {
            return build(parser, displayName);
        } catch (IOException ex) {
            throw new ConfigFormatException(displayName, errorLine(ex), "invalid YAML: " + ex.getMessage(), ex);
        }
    }

    private static YamlDocument build(JsonParser parser, String displayName) throws IOException {
        Map<String, Integer> lines = new HashMap<>();
        JsonToken first = parser.nextToken();
        if (first == null) {
            return new YamlDocument(displayName, new LinkedHashMap<>(), lines);
        }
        if (first != JsonToken.START_OBJECT) {
            throw new ConfigFormatException(
                displayName,
                parser.currentTokenLocation().getLineNr(),
                "top level must be a mapping"
            );
        }
        Map<String, Object> root = readObject(parser, "", lines);
        return new YamlDocument(displayName, root, lines);
    }

    private static Map<String, Object> readObject(JsonParser parser, String prefix, Map<String, Integer> lines) throws IOException {
        Map<String, Object> map = new LinkedHashMap<>();
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
            String key = parser.currentName();
            String path = prefix.isEmpty() ? key : prefix + "/" + key;
            lines.put(path, parser.currentTokenLocation().getLineNr());
            parser.nextToken();
            map.put(key, readValue(parser, path, lines));
        }
        return map;
    }

    private static Object readValue(JsonParser parser, String path, Map<String, Integer> lines) throws IOException {
        JsonToken token = parser.currentToken();
        switch (token) {
            case START_OBJECT:
                return readObject(parser, path, lines);
            case START_ARRAY: {
                List<Object> list = new ArrayList<>();
                int index = 0;
                while (parser.nextToken() != JsonToken.END_ARRAY) {
                    list.add(readValue(parser, path + "/" + index, lines));
                    index++;
                }
                return list;
            }
            case VALUE_NUMBER_INT:
                return parser.getLongValue();
            case VALUE_NUMBER_FLOAT:
                // keep the literal so "2.10" stays distinct from "2.1"
                return parser.getText();
            case VALUE_TRUE:
                return Boolean.TRUE;
            case VALUE_FALSE:
                return Boolean.FALSE;
            case VALUE_NULL:
                return null;
            default:
                return parser.getText();
        }
    }

    private static int errorLine(IOException ex) {
        if (ex instanceof JsonProcessingException processing && processing.getLocation() != null) {
            return processing.getLocation().getLineNr();
        }
        return -1;
    }

    public String source() {
        return source;
    }

    public Map<String, Object> root() {
        return Collections.unmodifiableMap(root);
    }

    /**
     * Line of the mapping key at {@code path} (keys joined with {@code /}), or -1 when unknown.
     */
    public int lineOf(String... path) {
        return keyLines.getOrDefault(String.join("/", path), -1);
    }
}
