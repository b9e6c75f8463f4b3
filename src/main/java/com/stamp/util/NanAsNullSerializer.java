package com.stamp.util;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;

import java.io.IOException;

/**
 * Serialize non-finite doubles as JSON null. Missing cells in a cube are NaN, and plain JSON has no NaN literal.
 * Writing null keeps "missing" distinguishable from zero on the receiving side.
 */
public class NanAsNullSerializer extends JsonSerializer<Double> {

    /** Create a module covering boxed and primitive doubles as well as the 1-D arrays that make up matrices. */
    public static SimpleModule makeModule () {
        Version moduleVersion = new Version(1, 0, 0, null, null, null);
        SimpleModule module = new SimpleModule("NanAsNull", moduleVersion);
        module.addSerializer(Double.class, new NanAsNullSerializer());
        module.addSerializer(Double.TYPE, new NanAsNullSerializer());
        module.addSerializer(double[].class, new ArraySerializer());
        return module;
    }

    @Override
    public void serialize (Double value, JsonGenerator generator, SerializerProvider provider) throws IOException {
        writeDouble(value, generator);
    }

    private static void writeDouble (double value, JsonGenerator generator) throws IOException {
        if (Double.isFinite(value)) {
            generator.writeNumber(value);
        } else {
            generator.writeNull();
        }
    }

    private static class ArraySerializer extends JsonSerializer<double[]> {
        @Override
        public void serialize (double[] values, JsonGenerator generator, SerializerProvider provider)
                throws IOException {
            generator.writeStartArray();
            for (double value : values) {
                writeDouble(value, generator);
            }
            generator.writeEndArray();
        }
    }

}
