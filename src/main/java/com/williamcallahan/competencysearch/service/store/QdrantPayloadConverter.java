package com.williamcallahan.competencysearch.service.store;

import io.qdrant.client.ValueFactory;
import io.qdrant.client.grpc.JsonWithInt.ListValue;
import io.qdrant.client.grpc.JsonWithInt.NullValue;
import io.qdrant.client.grpc.JsonWithInt.Struct;
import io.qdrant.client.grpc.JsonWithInt.Value;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between plain Java payload maps and Qdrant protobuf {@link Value}s, nested maps and
 * lists included.
 *
 * <p>Integral numbers are stored as Qdrant integers so {@code eq} filters on them match; all other
 * numbers are stored as doubles. Integers read back as {@code Long}.</p>
 */
final class QdrantPayloadConverter {

    private QdrantPayloadConverter() {}

    static Map<String, Value> toQdrantPayload(Map<String, Object> payload) {
        Map<String, Value> qdrantPayload = new LinkedHashMap<>();
        payload.forEach((key, fieldValue) -> {
            if (fieldValue != null) {
                qdrantPayload.put(key, toValue(fieldValue));
            }
        });
        return qdrantPayload;
    }

    static Map<String, Object> fromQdrantPayload(Map<String, Value> qdrantPayload) {
        Map<String, Object> payload = new LinkedHashMap<>();
        qdrantPayload.forEach((key, fieldValue) -> payload.put(key, fromValue(fieldValue)));
        return payload;
    }

    static Value toValue(Object rawValue) {
        if (rawValue == null) {
            return Value.newBuilder().setNullValue(NullValue.NULL_VALUE).build();
        }
        if (rawValue instanceof String stringValue) {
            return ValueFactory.value(stringValue);
        }
        if (rawValue instanceof Boolean booleanValue) {
            return ValueFactory.value(booleanValue);
        }
        if (rawValue instanceof Integer || rawValue instanceof Long || rawValue instanceof Short
                || rawValue instanceof Byte) {
            return ValueFactory.value(((Number) rawValue).longValue());
        }
        if (rawValue instanceof Number numberValue) {
            return ValueFactory.value(numberValue.doubleValue());
        }
        if (rawValue instanceof Map<?, ?> mapValue) {
            Struct.Builder structBuilder = Struct.newBuilder();
            mapValue.forEach((key, nestedValue) -> structBuilder.putFields(String.valueOf(key), toValue(nestedValue)));
            return Value.newBuilder().setStructValue(structBuilder).build();
        }
        if (rawValue instanceof Collection<?> collectionValue) {
            ListValue.Builder listBuilder = ListValue.newBuilder();
            for (Object element : collectionValue) {
                listBuilder.addValues(toValue(element));
            }
            return Value.newBuilder().setListValue(listBuilder).build();
        }
        return ValueFactory.value(String.valueOf(rawValue));
    }

    static Object fromValue(Value qdrantValue) {
        return switch (qdrantValue.getKindCase()) {
            case STRING_VALUE -> qdrantValue.getStringValue();
            case INTEGER_VALUE -> qdrantValue.getIntegerValue();
            case DOUBLE_VALUE -> qdrantValue.getDoubleValue();
            case BOOL_VALUE -> qdrantValue.getBoolValue();
            case STRUCT_VALUE -> fromQdrantPayload(qdrantValue.getStructValue().getFieldsMap());
            case LIST_VALUE -> {
                List<Object> elements = new ArrayList<>();
                for (Value element : qdrantValue.getListValue().getValuesList()) {
                    elements.add(fromValue(element));
                }
                yield elements;
            }
            default -> null;
        };
    }
}
