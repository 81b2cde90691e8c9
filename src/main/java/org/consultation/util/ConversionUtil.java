package org.consultation.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.reflect.TypeToken;

import java.lang.reflect.Type;
import java.util.List;
import java.util.Map;

/**
 * Utility class for converting between Java objects and JSON strings.
 * <p>
 * All records kept in the state store and in the event log go through here,
 * using a single shared Gson instance.
 * </p>
 */
public class ConversionUtil {

    private static final Gson gson = new GsonBuilder()
            .disableHtmlEscaping()
            .create();

    /**
     * Converts any Java object into its JSON string representation.
     *
     * @param object The object to serialize.
     * @return The JSON string representation of the object, or {@code null} for {@code null}.
     */
    public static String toJson(Object object) {
        if (object == null) {
            return null;
        }
        return gson.toJson(object);
    }

    /**
     * Converts a JSON string into an object of the specified class type.
     *
     * @param jsonString The JSON string to convert.
     * @param tClass     The class type to deserialize into.
     * @param <T>        The object type.
     * @return An instance of the specified class type, or {@code null} if input is empty.
     */
    public static <T> T fromJson(String jsonString, Class<T> tClass) {
        if (jsonString == null || jsonString.isEmpty() || tClass == null) {
            return null;
        }
        return gson.fromJson(jsonString, tClass);
    }

    /**
     * Converts a JSON array into a {@code List<T>}.
     *
     * @return the list, or {@code null} if input is empty.
     */
    public static <T> List<T> jsonToList(String jsonString, Class<T> tClass) {
        if (jsonString == null || jsonString.isEmpty() || tClass == null) {
            return null;
        }
        Type type = TypeToken.getParameterized(List.class, tClass).getType();
        return gson.fromJson(jsonString, type);
    }

    /**
     * Converts a flat JSON object into a {@code Map<String, String>}.
     */
    public static Map<String, String> jsonToMap(String jsonString) {
        if (jsonString == null || jsonString.isEmpty()) {
            return null;
        }
        Type type = new TypeToken<Map<String, String>>() {}.getType();
        return gson.fromJson(jsonString, type);
    }
}
