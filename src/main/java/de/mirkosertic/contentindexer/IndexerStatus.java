package de.mirkosertic.contentindexer;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import de.mirkosertic.contentindexer.indexer.IndexState;
import de.mirkosertic.contentindexer.indexer.IndexStatistics;
import de.mirkosertic.contentindexer.store.FingerprintRecord;
import org.jspecify.annotations.Nullable;

/**
 * Snapshot printed by the {@code status} and {@code scan} commands. Values that could not be
 * determined, for example because another process holds the index, are left out.
 */
public record IndexerStatus(
        String version,
        String contentDirectory,
        String indexPath,
        @Nullable Integer schemaVersion,
        /** Pending work items plus tasks waiting for the indexing worker. */
        @Nullable Integer queueDepth,
        @Nullable Integer fingerprintCount,
        @Nullable Integer entryCount,
        @Nullable Integer categoryCount,
        /** Most recently modified file known to the index. */
        @Nullable FingerprintRecord lastModified,
        @Nullable IndexStatistics statistics,
        @Nullable IndexState lastScan
) {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .enable(SerializationFeature.INDENT_OUTPUT);

    public String toJson() {
        try {
            return OBJECT_MAPPER.writeValueAsString(this);
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize indexer status", e);
        }
    }
}
