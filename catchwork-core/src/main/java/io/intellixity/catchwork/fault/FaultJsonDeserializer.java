package io.intellixity.catchwork.fault;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Canonical JSON deserializer for {@link Fault}.
 * <p>
 * {@code lineage} wins over {@code type} when both are present; a bare {@code type} becomes a direct
 * child of the root type.
 */
public final class FaultJsonDeserializer extends JsonDeserializer<Fault> {
  @Override
  public Fault deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    JsonNode root = p.getCodec().readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new IllegalArgumentException("Fault JSON must be an object");

    List<String> lineage = new ArrayList<>();
    JsonNode ln = root.get("lineage");
    if (ln != null && ln.isArray()) {
      for (JsonNode n : ln) {
        if (!n.isTextual() || n.asText().isBlank()) {
          throw new IllegalArgumentException("Fault JSON lineage entries must be non-blank strings, got: " + n);
        }
        lineage.add(n.asText());
      }
    }
    if (lineage.isEmpty()) {
      JsonNode type = root.get("type");
      if (type == null || type.isNull() || type.asText().isBlank()) {
        throw new IllegalArgumentException("Fault JSON requires 'type' or 'lineage'");
      }
      lineage.add(type.asText());
    }

    Fault.Builder b = Fault.builder(lineage);
    JsonNode message = root.get("message");
    if (message != null && !message.isNull()) b.message(message.asText());
    JsonNode file = root.get("file");
    if (file != null && !file.isNull()) b.file(file.asText());
    JsonNode line = root.get("line");
    if (line != null && line.canConvertToInt()) b.line(line.asInt());
    JsonNode code = root.get("code");
    if (code != null && code.canConvertToInt()) b.code(code.asInt());
    return b.build();
  }
}
