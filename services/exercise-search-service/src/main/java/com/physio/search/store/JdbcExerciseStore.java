package com.physio.search.store;

import com.physio.search.execution.SortSpec;
import com.physio.search.predicate.PredicateSet;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcExerciseStore implements ExerciseStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcExerciseStore.class);

    private static final String COLUMNS = "id, name, description, category, subcategory, body_parts, equipment, "
        + "difficulty, duration, therapeutic_goals, ai_categorized, ai_confidence, status, video_url, "
        + "thumbnail_url, created_at ";

    private final JdbcTemplate jdbcTemplate;

    public JdbcExerciseStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<ExerciseRecord> find(PredicateSet predicates, SortSpec sort, int limit, int offset, boolean includeMedia) {
        SqlFragment where = SqlPredicateRenderer.where(predicates);
        StringBuilder sql = new StringBuilder()
            .append("SELECT ").append(COLUMNS)
            .append("FROM exercises ")
            .append(where.sql())
            .append(SqlPredicateRenderer.orderBy(sort))
            .append("LIMIT ? OFFSET ?");

        List<Object> params = new ArrayList<>(where.params());
        params.add(limit);
        params.add(offset);

        List<Map<String, Object>> rows = query(sql.toString(), params);
        List<ExerciseRecord> records = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            records.add(mapExercise(row));
        }
        if (!includeMedia || records.isEmpty()) {
            return records;
        }
        return attachMedia(records);
    }

    @Override
    public long count(PredicateSet predicates) {
        SqlFragment where = SqlPredicateRenderer.where(predicates);
        String sql = "SELECT COUNT(*) FROM exercises " + where.sql();
        try {
            Long total = jdbcTemplate.queryForObject(sql, Long.class, where.params().toArray());
            return total == null ? 0L : total;
        } catch (DataAccessException ex) {
            throw new ExerciseStoreException("exercise count failed", ex);
        }
    }

    @Override
    public Map<String, Long> countBy(PredicateSet predicates, ScalarFacet facet) {
        SqlFragment where = SqlPredicateRenderer.where(predicates);
        String column = facet.column();
        StringBuilder sql = new StringBuilder()
            .append("SELECT ").append(column).append(" AS facet_value, COUNT(*) AS facet_count ")
            .append("FROM exercises ")
            .append(where.sql())
            .append(where.sql().isEmpty() ? "WHERE " : "AND ")
            .append(column).append(" IS NOT NULL ")
            .append("GROUP BY ").append(column).append(' ')
            .append("ORDER BY facet_count DESC, facet_value ASC");
        return toCounts(query(sql.toString(), where.params()));
    }

    @Override
    public Map<String, Long> countListValues(PredicateSet predicates, ListFacet facet, int limit) {
        if (limit <= 0) {
            return Map.of();
        }
        SqlFragment where = SqlPredicateRenderer.where(predicates);
        StringBuilder sql = new StringBuilder()
            .append("SELECT facet_value, COUNT(*) AS facet_count FROM (")
            .append("SELECT UNNEST(").append(facet.column()).append(") AS facet_value ")
            .append("FROM exercises ")
            .append(where.sql())
            .append(") unnested ")
            .append("WHERE facet_value IS NOT NULL ")
            .append("GROUP BY facet_value ")
            .append("ORDER BY facet_count DESC, facet_value ASC ")
            .append("LIMIT ?");

        List<Object> params = new ArrayList<>(where.params());
        params.add(limit);
        return toCounts(query(sql.toString(), params));
    }

    private List<ExerciseRecord> attachMedia(List<ExerciseRecord> records) {
        StringJoiner placeholders = new StringJoiner(", ");
        List<Object> params = new ArrayList<>(records.size());
        for (ExerciseRecord record : records) {
            placeholders.add("?");
            params.add(record.id());
        }
        String sql = "SELECT exercise_id, type, url, is_primary, quality FROM exercise_media "
            + "WHERE exercise_id IN (" + placeholders + ") "
            + "ORDER BY exercise_id ASC, is_primary DESC, id ASC";

        Map<String, List<ExerciseMedia>> byExercise = new LinkedHashMap<>();
        for (Map<String, Object> row : query(sql, params)) {
            String exerciseId = JdbcUtils.asString(row.get("exercise_id"));
            byExercise.computeIfAbsent(exerciseId, key -> new ArrayList<>()).add(new ExerciseMedia(
                JdbcUtils.asString(row.get("type")),
                JdbcUtils.asString(row.get("url")),
                JdbcUtils.asBoolean(row.get("is_primary")),
                JdbcUtils.asString(row.get("quality"))
            ));
        }

        List<ExerciseRecord> enriched = new ArrayList<>(records.size());
        for (ExerciseRecord record : records) {
            enriched.add(record.withMedia(byExercise.getOrDefault(record.id(), List.of())));
        }
        return enriched;
    }

    private List<Map<String, Object>> query(String sql, List<Object> params) {
        try {
            return jdbcTemplate.queryForList(sql, params.toArray());
        } catch (DataAccessException ex) {
            log.debug("exercise store query failed: {}", sql);
            throw new ExerciseStoreException("exercise store query failed", ex);
        }
    }

    private static Map<String, Long> toCounts(List<Map<String, Object>> rows) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            String value = JdbcUtils.asString(row.get("facet_value"));
            Long count = JdbcUtils.asLong(row.get("facet_count"));
            if (value != null && count != null) {
                counts.put(value, count);
            }
        }
        return counts;
    }

    private static ExerciseRecord mapExercise(Map<String, Object> row) {
        return new ExerciseRecord(
            JdbcUtils.asString(row.get("id")),
            JdbcUtils.asString(row.get("name")),
            JdbcUtils.asString(row.get("description")),
            JdbcUtils.asString(row.get("category")),
            JdbcUtils.asString(row.get("subcategory")),
            JdbcUtils.asStringList(row.get("body_parts")),
            JdbcUtils.asStringList(row.get("equipment")),
            JdbcUtils.asString(row.get("difficulty")),
            JdbcUtils.asInt(row.get("duration")),
            JdbcUtils.asString(row.get("therapeutic_goals")),
            JdbcUtils.asBoolean(row.get("ai_categorized")),
            JdbcUtils.asDouble(row.get("ai_confidence")),
            JdbcUtils.asString(row.get("status")),
            JdbcUtils.asString(row.get("video_url")),
            JdbcUtils.asString(row.get("thumbnail_url")),
            List.of(),
            JdbcUtils.asInstant(row.get("created_at"))
        );
    }
}
