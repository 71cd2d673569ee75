package com.jamra.offline.ipc;

import com.google.gson.JsonElement;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One command line sent to the worker. {@code requestId} is optional; without it the worker
 * runs the command but sends no result.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class WorkerRequest {
    private String type;
    private String requestId;
    private JsonElement payload;
}
