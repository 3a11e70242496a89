package com.flowline.coordinator.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.flowline.coordinator.model.BuildInput;
import com.flowline.coordinator.model.LedgerOutput;
import com.flowline.coordinator.model.MetadataField;
import com.flowline.coordinator.model.SavedVersionedResource;
import com.flowline.coordinator.model.VersionedResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Database access helper for versioned_resources, build_inputs and build_outputs.
 *
 * Versions are stored as JSON with keys in sorted order so that two equal
 * maps always produce the same column value; the unique key
 * (pipeline_id, resource_name, type, version) then gives map equality.
 * Metadata is stored as a JSON array to keep its order.
 */
@Repository
public class VersionedResourceStore {

    private static final TypeReference<Map<String, String>> VERSION_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<MetadataField>> METADATA_TYPE = new TypeReference<>() {};

    private static final String SELECT_SAVED = """
            vr.id, vr.pipeline_id, vr.resource_name, vr.type, vr.version, vr.metadata,
            vr.check_order, vr.modified_time
            """;

    private final JdbcTemplate jdbc;
    private final ObjectMapper mapper;
    private final ObjectWriter canonicalWriter;

    public VersionedResourceStore(JdbcTemplate jdbc, ObjectMapper mapper) {
        this.jdbc            = jdbc;
        this.mapper          = mapper;
        this.canonicalWriter = mapper.writer().with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    /**
     * Insert the version if it is new, otherwise refresh its metadata.
     * Empty metadata never overwrites metadata that is already stored.
     */
    public SavedVersionedResource upsert(VersionedResource vr) {
        String sql = """
                INSERT INTO versioned_resources (pipeline_id, resource_name, type, version, metadata, modified_time)
                VALUES (?, ?, ?, ?, ?, now())
                ON CONFLICT (pipeline_id, resource_name, type, version) DO UPDATE
                SET metadata = CASE WHEN EXCLUDED.metadata = '[]' THEN versioned_resources.metadata
                                    ELSE EXCLUDED.metadata END,
                    modified_time = now()
                RETURNING id, pipeline_id, resource_name, type, version, metadata, check_order, modified_time
                """;
        return jdbc.queryForObject(sql, (rs, i) -> mapSaved(rs),
                vr.pipelineId(), vr.resource(), vr.type(),
                writeVersion(vr.version()), writeMetadata(vr.metadata()));
    }

    /** Link as input; a second save under the same name points the input at the new version. */
    public void linkInput(long buildId, long versionedResourceId, String inputName) {
        jdbc.update("""
                INSERT INTO build_inputs (build_id, versioned_resource_id, name)
                VALUES (?, ?, ?)
                ON CONFLICT (build_id, name) DO UPDATE SET versioned_resource_id = EXCLUDED.versioned_resource_id
                """, buildId, versionedResourceId, inputName);
    }

    public void linkOutput(long buildId, long versionedResourceId, boolean explicit) {
        jdbc.update("""
                INSERT INTO build_outputs (build_id, versioned_resource_id, explicit)
                VALUES (?, ?, ?)
                ON CONFLICT (build_id, versioned_resource_id, explicit) DO NOTHING
                """, buildId, versionedResourceId, explicit);
    }

    /**
     * Inputs of a build in name order. first_occurrence is computed against
     * earlier builds of the same job; one-off builds always report true.
     */
    public List<BuildInput> findInputs(long buildId) {
        String sql = "SELECT bi.name, " + SELECT_SAVED + """
                , NOT EXISTS (
                    SELECT 1
                    FROM build_inputs prev
                    JOIN builds pb ON pb.id = prev.build_id
                    WHERE prev.versioned_resource_id = bi.versioned_resource_id
                      AND prev.name = bi.name
                      AND pb.job_id = b.job_id
                      AND pb.id < b.id
                  ) AS first_occurrence
                FROM build_inputs bi
                JOIN builds b ON b.id = bi.build_id
                JOIN versioned_resources vr ON vr.id = bi.versioned_resource_id
                WHERE bi.build_id = ?
                ORDER BY bi.name ASC
                """;
        return jdbc.query(sql, (rs, i) -> new BuildInput(
                rs.getString("name"),
                mapSaved(rs).versionedResource(),
                rs.getBoolean("first_occurrence")), buildId);
    }

    /** Saved versions of the build's inputs, ordered by input name. */
    public List<SavedVersionedResource> findInputVersions(long buildId) {
        String sql = "SELECT " + SELECT_SAVED + """
                FROM build_inputs bi
                JOIN versioned_resources vr ON vr.id = bi.versioned_resource_id
                WHERE bi.build_id = ?
                ORDER BY bi.name ASC
                """;
        return jdbc.query(sql, (rs, i) -> mapSaved(rs), buildId);
    }

    /** Every output link of a build, implicit ones included. */
    public List<LedgerOutput> findOutputs(long buildId) {
        String sql = "SELECT bo.explicit, " + SELECT_SAVED + """
                FROM build_outputs bo
                JOIN versioned_resources vr ON vr.id = bo.versioned_resource_id
                WHERE bo.build_id = ?
                ORDER BY vr.id ASC, bo.explicit DESC
                """;
        return jdbc.query(sql, (rs, i) -> new LedgerOutput(mapSaved(rs), rs.getBoolean("explicit")), buildId);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private SavedVersionedResource mapSaved(ResultSet rs) throws SQLException {
        VersionedResource vr = new VersionedResource(
                rs.getString("resource_name"),
                rs.getString("type"),
                readVersion(rs.getString("version")),
                readMetadata(rs.getString("metadata")),
                rs.getLong("pipeline_id"));
        Timestamp modified = rs.getTimestamp("modified_time");
        return new SavedVersionedResource(
                rs.getLong("id"),
                vr,
                rs.getInt("check_order"),
                modified == null ? null : modified.toInstant());
    }

    private String writeVersion(Map<String, String> version) {
        try {
            return canonicalWriter.writeValueAsString(new TreeMap<>(version));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize resource version to JSON", e);
        }
    }

    private String writeMetadata(List<MetadataField> metadata) {
        try {
            return mapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize resource metadata to JSON", e);
        }
    }

    private Map<String, String> readVersion(String json) {
        try {
            return mapper.readValue(json, VERSION_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored resource version is not valid JSON: " + json, e);
        }
    }

    private List<MetadataField> readMetadata(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return mapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored resource metadata is not valid JSON: " + json, e);
        }
    }
}
