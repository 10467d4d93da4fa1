package net.salescoach.adapters.persistence;

import java.util.List;
import java.util.UUID;
import net.salescoach.domain.account.Stakeholder;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public class StakeholderRepository {

    private final JdbcTemplate jdbcTemplate;

    public StakeholderRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional(readOnly = true)
    public List<Stakeholder> findByAccount(UUID accountId) {
        String sql = """
            SELECT id, name, job_title, influence_level, champion_score, is_primary_contact, email
            FROM stakeholders
            WHERE prospect_id = ? AND deleted_at IS NULL
            ORDER BY is_primary_contact DESC, name
            """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> new Stakeholder(
            rs.getObject("id", UUID.class),
            rs.getString("name"),
            rs.getString("job_title"),
            rs.getString("influence_level"),
            rs.getObject("champion_score", Integer.class),
            rs.getBoolean("is_primary_contact"),
            rs.getString("email")
        ), accountId);
    }
}
