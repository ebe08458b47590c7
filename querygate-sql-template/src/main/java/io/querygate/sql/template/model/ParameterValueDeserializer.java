package io.querygate.sql.template.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;

public class ParameterValueDeserializer extends StdDeserializer<ParameterValue> {

    public ParameterValueDeserializer() {
        super(ParameterValue.class);
    }

    @Override
    public ParameterValue deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonNode node = parser.readValueAsTree();
        return ParameterValues.fromJson(node);
    }
}
