package net.salescoach.adapters.persistence;

import java.sql.Date;
import java.util.List;
import java.util.UUID;
import net.salescoach.domain.account.EmailLogEntry;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public class EmailLogRepository {

    private final JdbcTemplate jdbcTemplate;

    public EmailLogRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Lists an account's logged emails, most recent first.
     */
    @Transactional(readOnly = true)
    public List<EmailLogEntry> findByAccountNewestFirst(UUID accountId) {
        String sql = """
            SELECT direction, subject, body, email_date, contact_name, stakeholder_id, notes
            FROM email_logs
            WHERE prospect_id = ? AND deleted_at IS NULL
            ORDER BY email_date DESC NULLS LAST
            """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> {
            Date emailDate = rs.getDate("email_date");
            return new EmailLogEntry(
                rs.getString("direction"),
                rs.getString("subject"),
                rs.getString("body"),
                emailDate != null ? emailDate.toLocalDate() : null,
                rs.getString("contact_name"),
                rs.getObject("stakeholder_id", UUID.class),
                rs.getString("notes")
            );
        }, accountId);
    }
}
