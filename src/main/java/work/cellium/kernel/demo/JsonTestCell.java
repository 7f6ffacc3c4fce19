package work.cellium.kernel.demo;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.cellium.kernel.cell.AbstractCell;
import work.cellium.kernel.cell.ArgumentValue;

/**
 * Exercises the three argument shapes: plain text, JSON objects and JSON arrays.
 */
public final class JsonTestCell extends AbstractCell {
    public JsonTestCell() {
        super("jsontest");
        command("echo", "Echoes text: jsontest:echo:hi", args -> "Echo: " + args.asText());
        command("greet", "Greets {\"name\", \"language\": en|de|zh}", JsonTestCell::greet);
        command("batch", "Summarises a JSON array", JsonTestCell::batch);
        command("complex", "Echoes user, tags and metadata of a JSON object", JsonTestCell::complex);
    }

    private static String greet(ArgumentValue args) {
        var data = requireMap(args);
        var name = data.getText("name", "Unknown");
        switch (data.getText("language", "en")) {
            case "zh":
                return "你好，" + name + "！";
            case "de":
                return "Hallo, " + name + "!";
            default:
                return "Hello, " + name + "!";
        }
    }

    private static String batch(ArgumentValue args) {
        var items = args.asList();
        var rendered = new ArrayList<String>(items.size());
        for (var item : items) {
            rendered.add(String.valueOf(item.toPlain()));
        }
        return "Received " + items.size() + " items: " + String.join(", ", rendered);
    }

    private static Map<String, Object> complex(ArgumentValue args) {
        var data = requireMap(args).entries();
        var result = new LinkedHashMap<String, Object>();
        result.put("status", "success");
        result.put("user", plainOr(data.get("user"), Map.of()));
        result.put("tags", plainOr(data.get("tags"), List.of()));
        result.put("metadata", plainOr(data.get("metadata"), Map.of()));
        return result;
    }

    private static ArgumentValue.MapValue requireMap(ArgumentValue args) {
        if (args instanceof ArgumentValue.MapValue map) {
            return map;
        }
        throw new IllegalArgumentException("Expected a JSON object but got " + args.kindName());
    }

    private static Object plainOr(ArgumentValue value, Object fallback) {
        return value == null ? fallback : value.toPlain();
    }
}
