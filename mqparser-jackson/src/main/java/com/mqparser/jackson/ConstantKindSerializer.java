package com.mqparser.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.mqparser.ast.ConstantKind;

import java.io.IOException;

/**
 * Writes a constant kind as the source text it stands for, e.g. {@code "=>"} rather than {@code "FAT_ARROW"}.
 */
public class ConstantKindSerializer extends JsonSerializer<ConstantKind> {
    @Override
    public void serialize(ConstantKind value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        gen.writeString(value.text());
    }
}
