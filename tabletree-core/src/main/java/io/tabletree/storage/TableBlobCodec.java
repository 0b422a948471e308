package io.tabletree.storage;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.ToNumberPolicy;
import com.google.gson.reflect.TypeToken;
import io.tabletree.core.UnserializationException;

import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Encodes the own rows of one table (sub-tables excluded) into an opaque blob and back.
 * <p>
 * The blob is UTF-8 JSON keyed by row id, the summary row under {@code -1}:
 * <pre>
 * {"0":{"columns":{"label":"Google","visits":12},"idsubdatatable":4},
 *  "-1":{"columns":{"label":-1,"visits":3}}}
 * </pre>
 * Integral numbers come back as {@code Long}, other numbers as {@code Double}. JSON has no literal
 * for {@code NaN} or the infinities, so non-finite doubles are written as
 * {@code {"@double":"NaN"}} and read back as {@code Double}.
 */
public final class TableBlobCodec {

    private static final Type BLOB_TYPE = new TypeToken<LinkedHashMap<String, Object>>() { }.getType();

    static final String NON_FINITE_DOUBLE = "@double";

    private static final Gson GSON = new GsonBuilder()
            .serializeNulls()
            .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
            .create();

    private TableBlobCodec() {
    }

    /**
     * @param rowsById rows keyed by row id; a null value (absent summary row) is skipped
     */
    public static byte[] encode(Map<Integer, Row> rowsById) {
        Map<String, Object> blob = new LinkedHashMap<>();
        for (Map.Entry<Integer, Row> entry : rowsById.entrySet()) {
            Row row = entry.getValue();
            if (row != null) {
                blob.put(String.valueOf(entry.getKey()), toMap(row));
            }
        }
        return GSON.toJson(blob).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * @return row maps keyed by row id, in blob order
     * @throws UnserializationException if the blob is not a valid encoded table
     */
    public static Map<Integer, Map<?, ?>> decode(byte[] blob) {
        if (blob == null || blob.length == 0) {
            throw new UnserializationException("The unserialization has failed: empty blob");
        }
        Map<String, Object> decoded;
        try {
            decoded = GSON.fromJson(new String(blob, StandardCharsets.UTF_8), BLOB_TYPE);
        } catch (JsonParseException e) {
            throw new UnserializationException("The unserialization has failed!", e);
        }
        if (decoded == null) {
            throw new UnserializationException("The unserialization has failed: no content");
        }
        Map<Integer, Map<?, ?>> rows = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : decoded.entrySet()) {
            int rowId;
            try {
                rowId = Integer.parseInt(entry.getKey());
            } catch (NumberFormatException e) {
                throw new UnserializationException("Invalid row id '" + entry.getKey() + "'", e);
            }
            if (!(entry.getValue() instanceof Map<?, ?> rowMap)) {
                throw new UnserializationException("Row " + rowId + " is not an object");
            }
            rows.put(rowId, (Map<?, ?>) restoreNonFinite(rowMap));
        }
        return rows;
    }

    private static Map<String, Object> toMap(Row row) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(Row.COLUMNS, tagNonFinite(row.getColumns()));
        if (!row.getAllMetadata().isEmpty()) {
            map.put(Row.METADATA, tagNonFinite(row.getAllMetadata()));
        }
        if (row.getSubtableId() != null) {
            map.put(Row.SUBTABLE_ID, row.getSubtableId());
        }
        return map;
    }

    private static Object tagNonFinite(Object value) {
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (Double.isNaN(number) || Double.isInfinite(number)) {
                return Map.of(NON_FINITE_DOUBLE, Double.toString(number));
            }
            return value;
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> tagged = new LinkedHashMap<>();
            map.forEach((key, nested) -> tagged.put(key, tagNonFinite(nested)));
            return tagged;
        }
        if (value instanceof List<?> list) {
            List<Object> tagged = new ArrayList<>(list.size());
            list.forEach(nested -> tagged.add(tagNonFinite(nested)));
            return tagged;
        }
        return value;
    }

    private static Object restoreNonFinite(Object value) {
        if (value instanceof Map<?, ?> map) {
            if (map.size() == 1 && map.get(NON_FINITE_DOUBLE) instanceof String literal) {
                try {
                    return Double.valueOf(literal);
                } catch (NumberFormatException e) {
                    throw new UnserializationException("Invalid non-finite double '" + literal + "'", e);
                }
            }
            Map<Object, Object> restored = new LinkedHashMap<>();
            map.forEach((key, nested) -> restored.put(key, restoreNonFinite(nested)));
            return restored;
        }
        if (value instanceof List<?> list) {
            List<Object> restored = new ArrayList<>(list.size());
            list.forEach(nested -> restored.add(restoreNonFinite(nested)));
            return restored;
        }
        return value;
    }
}
