package net.salescoach.adapters.persistence;

import java.util.Optional;
import java.util.UUID;
import net.salescoach.domain.insight.AccountInsightSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Postgres adapter for the account insight snapshot stored on {@code prospects.ai_extracted_info}.
 */
@Repository
public class AccountInsightRepository {

    private static final Logger log = LoggerFactory.getLogger(AccountInsightRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public AccountInsightRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Loads the stored snapshot; empty when the account is missing or was never analyzed.
     */
    @Transactional(readOnly = true)
    public Optional<AccountInsightSnapshot> findSnapshot(UUID accountId) {
        if (accountId == null) {
            return Optional.empty();
        }
        return jdbcTemplate.query(
            "SELECT ai_extracted_info FROM prospects WHERE id = ? AND deleted_at IS NULL",
            rs -> {
                if (!rs.next()) {
                    return Optional.<AccountInsightSnapshot>empty();
                }
                String json = rs.getString("ai_extracted_info");
                return json == null ? Optional.<AccountInsightSnapshot>empty() : Optional.of(deserialize(json));
            },
            accountId
        );
    }

    /**
     * Replaces the snapshot wholesale in one statement. The snapshot's industry only fills an
     * unset or blank account industry.
     *
     * @throws EmptyResultDataAccessException when no live account row matched
     */
    @Transactional
    public void replaceSnapshot(UUID accountId, AccountInsightSnapshot snapshot) {
        int updated = jdbcTemplate.update("""
            UPDATE prospects
            SET ai_extracted_info = CAST(? AS jsonb),
                industry = CASE WHEN NULLIF(BTRIM(industry), '') IS NULL THEN ? ELSE industry END,
                updated_at = NOW()
            WHERE id = ? AND deleted_at IS NULL
            """,
            serialize(snapshot),
            snapshot.industry(),
            accountId
        );
        if (updated == 0) {
            throw new EmptyResultDataAccessException("No live account row for " + accountId, 1);
        }
    }

    private String serialize(AccountInsightSnapshot snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JacksonException ex) {
            throw new IllegalStateException("Failed to serialize account insight snapshot", ex);
        }
    }

    private AccountInsightSnapshot deserialize(String json) {
        try {
            return objectMapper.readValue(json, AccountInsightSnapshot.class);
        } catch (JacksonException ex) {
            log.error("Failed to deserialize stored account insights: {}", json, ex);
            throw new IllegalStateException("Stored account insight payload is invalid", ex);
        }
    }
}
