package com.ospicorp.modeltypes.models;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;

/**
 * Reads {@code [id, "name"]}. Anything but a two element array holding an integer
 * and a string is rejected.
 */
public final class RecordIdWithNameDeserializer extends JsonDeserializer<RecordIdWithName> {
  @Override
  public RecordIdWithName deserialize(JsonParser parser, DeserializationContext ctxt)
      throws IOException {
    JsonNode node = parser.getCodec().readTree(parser);
    if (node == null || !node.isArray()) {
      throw JsonMappingException.from(parser,
          String.format("Record id with name must be an array, found: %s",
              node == null ? "nothing" : node.getNodeType()));
    }
    if (node.size() != 2) {
      throw JsonMappingException.from(parser,
          String.format("Record id with name must have 2 elements, found: %d", node.size()));
    }
    JsonNode id = node.get(0);
    JsonNode name = node.get(1);
    if (!id.isIntegralNumber() || !id.canConvertToLong()) {
      throw JsonMappingException.from(parser,
          String.format("Record id must be an integer, found: %s", id.getNodeType()));
    }
    if (!name.isTextual()) {
      throw JsonMappingException.from(parser,
          String.format("Record name must be a string, found: %s", name.getNodeType()));
    }
    return new RecordIdWithName(id.longValue(), name.textValue());
  }
}
