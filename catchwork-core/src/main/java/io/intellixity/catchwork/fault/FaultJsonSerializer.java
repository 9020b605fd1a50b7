package io.intellixity.catchwork.fault;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/** Canonical JSON serializer for {@link Fault}. The cause is not serialized. */
public final class FaultJsonSerializer extends JsonSerializer<Fault> {
  @Override
  public void serialize(Fault f, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (f == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();
    g.writeStringField("type", f.type());
    g.writeArrayFieldStart("lineage");
    for (String t : f.lineage()) g.writeString(t);
    g.writeEndArray();
    if (f.message() != null) g.writeStringField("message", f.message());
    g.writeStringField("file", f.file());
    g.writeNumberField("line", f.line());
    if (f.code() != null) g.writeNumberField("code", f.code());
    g.writeEndObject();
  }
}
