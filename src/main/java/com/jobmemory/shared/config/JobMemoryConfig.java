package com.jobmemory.shared.config;

import java.nio.file.Path;

/**
 * @param rulesFile               extraction rule table replacing the bundled one, or null
 * @param generalItemsPerCategory how many items each category contributes to general advice
 */
public record JobMemoryConfig(
    int serverPort,
    StoreConfig store,
    Path rulesFile,
    int generalItemsPerCategory
) {
    public static JobMemoryConfig defaults() {
        return new JobMemoryConfig(18790, StoreConfig.defaults(), null, 2);
    }
}
