package com.jamra.offline.ipc;

import com.google.gson.JsonElement;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * One line the worker writes back to its controller. Only the fields relevant to {@code type}
 * are set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkerMessage {

    public static final String READY = "ready";
    public static final String STARTED = "started";
    public static final String STOPPED = "stopped";
    public static final String EVENT = "event";
    public static final String RESULT = "result";
    public static final String ERROR = "error";
    public static final String FATAL_ERROR = "fatal-error";

    private String type;
    private String requestId;
    private String command;
    private JsonElement result;
    private JsonElement event;
    private String error;
    private String stack;
    private Long timestamp;

    public static WorkerMessage lifecycle(String type, String requestId, long timestamp) {
        return builder().type(type).requestId(requestId).timestamp(timestamp).build();
    }

    public static WorkerMessage result(String requestId, WorkerCommandType command, JsonElement result) {
        return builder().type(RESULT).requestId(requestId).command(command.getValue()).result(result).build();
    }

    public static WorkerMessage event(JsonElement envelope) {
        return builder().type(EVENT).event(envelope).build();
    }

    public static WorkerMessage error(String requestId, Throwable error) {
        return builder().type(ERROR).requestId(requestId).error(messageOf(error)).stack(stackOf(error)).build();
    }

    public static WorkerMessage fatal(Throwable error) {
        return builder().type(FATAL_ERROR).error(messageOf(error)).stack(stackOf(error)).build();
    }

    private static String messageOf(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private static String stackOf(Throwable error) {
        StringWriter writer = new StringWriter();
        error.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }
}
