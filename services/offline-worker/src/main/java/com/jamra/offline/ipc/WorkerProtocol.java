package com.jamra.offline.ipc;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.jamra.offline.service.event.ConsolidatedEvent;

import java.time.Duration;

/**
 * Line framing shared by both ends: each frame is one compact JSON object followed by a newline.
 */
public final class WorkerProtocol {

    public static final Duration START_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration STOP_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration QUERY_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration READY_TIMEOUT = Duration.ofSeconds(15);
    /** Archive export and import copy every page of a manga. */
    public static final Duration ARCHIVE_TIMEOUT = Duration.ofMinutes(10);

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    private WorkerProtocol() {
    }

    public static Gson gson() {
        return GSON;
    }

    public static String encode(Object frame) {
        return GSON.toJson(frame);
    }

    public static JsonElement toTree(Object value) {
        return GSON.toJsonTree(value);
    }

    /**
     * @throws JsonParseException when the line is not a JSON object or has no string {@code type}
     */
    public static WorkerRequest decodeRequest(String line) {
        JsonObject object = parseFrame(line);
        return GSON.fromJson(object, WorkerRequest.class);
    }

    public static WorkerMessage decodeMessage(String line) {
        JsonObject object = parseFrame(line);
        return GSON.fromJson(object, WorkerMessage.class);
    }

    /**
     * Restores the concrete envelope class from its {@code type} discriminator.
     *
     * @return {@code null} for an unknown envelope type
     */
    public static ConsolidatedEvent decodeEnvelope(JsonElement element) {
        if (element == null || !element.isJsonObject() || !element.getAsJsonObject().has("type")) {
            return null;
        }
        switch (element.getAsJsonObject().get("type").getAsString()) {
            case "queue-update":
                return GSON.fromJson(element, ConsolidatedEvent.QueueUpdate.class);
            case "download-update":
                return GSON.fromJson(element, ConsolidatedEvent.DownloadUpdate.class);
            case "content-update":
                return GSON.fromJson(element, ConsolidatedEvent.ContentUpdate.class);
            case "system":
                return GSON.fromJson(element, ConsolidatedEvent.SystemUpdate.class);
            default:
                return null;
        }
    }

    private static JsonObject parseFrame(String line) {
        JsonElement element = JsonParser.parseString(line);
        if (!element.isJsonObject()) {
            throw new JsonParseException("Frame is not a JSON object");
        }
        JsonObject object = element.getAsJsonObject();
        JsonElement type = object.get("type");
        if (type == null || !type.isJsonPrimitive() || !type.getAsJsonPrimitive().isString()) {
            throw new JsonParseException("Frame has no type");
        }
        return object;
    }
}
