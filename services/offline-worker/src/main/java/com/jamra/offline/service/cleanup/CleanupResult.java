package com.jamra.offline.service.cleanup;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CleanupResult {
    private boolean success = true;
    private long freedBytes;
    private int itemsRemoved;
    private List<String> errors = new ArrayList<>();
}
