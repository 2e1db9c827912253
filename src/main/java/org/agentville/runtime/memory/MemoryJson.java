package org.agentville.runtime.memory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

/**
 * Shared Gson setup and time formats of the JSON memory stores.
 */
final class MemoryJson {

    static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .serializeNulls()
        .disableHtmlEscaping()
        .create();

    /** Format of the working state's clock, e.g. {@code "February 13, 2023, 14:30:00"}. */
    static final DateTimeFormatter CLOCK_FORMAT =
        DateTimeFormatter.ofPattern("MMMM dd, yyyy, HH:mm:ss", Locale.US);

    /** Format of memory node timestamps, e.g. {@code "2023-02-13 14:30:00"}. */
    static final DateTimeFormatter NODE_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.US);

    private MemoryJson() {
    }

    static JsonObject readObject(Path file) throws IOException {
        JsonElement root;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            root = GSON.fromJson(reader, JsonElement.class);
        }
        if (root == null || !root.isJsonObject()) {
            throw new JsonParseException("Expected a JSON object in " + file);
        }
        return root.getAsJsonObject();
    }

    static void write(Object content, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            GSON.toJson(content, writer);
        }
    }

    static String optString(JsonObject obj, String key) {
        JsonElement e = obj.get(key);
        return (e == null || e.isJsonNull()) ? null : e.getAsString();
    }

    static LocalDateTime optTime(JsonObject obj, String key, DateTimeFormatter format) {
        String text = optString(obj, key);
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return LocalDateTime.parse(text, format);
        } catch (DateTimeParseException e) {
            throw new JsonParseException("Invalid timestamp for '" + key + "': " + text, e);
        }
    }

    static String formatTime(LocalDateTime time, DateTimeFormatter format) {
        return time == null ? null : time.format(format);
    }
}
