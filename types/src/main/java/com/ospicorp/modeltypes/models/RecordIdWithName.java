package com.ospicorp.modeltypes.models;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

/**
 * A record id with the record's display name, written to JSON as the pair
 * {@code [id, "name"]}.
 */
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"id", "name"})
@JsonDeserialize(using = RecordIdWithNameDeserializer.class)
public record RecordIdWithName(long id, String name) {}
