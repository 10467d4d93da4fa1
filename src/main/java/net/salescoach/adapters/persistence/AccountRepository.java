package net.salescoach.adapters.persistence;

import java.util.Optional;
import java.util.UUID;
import net.salescoach.domain.account.Account;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Postgres adapter for prospect accounts.
 */
@Repository
public class AccountRepository {

    private final JdbcTemplate jdbcTemplate;

    public AccountRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Loads a live (not soft-deleted) account.
     */
    @Transactional(readOnly = true)
    public Optional<Account> findById(UUID accountId) {
        if (accountId == null) {
            return Optional.empty();
        }
        String sql = """
            SELECT id, COALESCE(account_name, prospect_name) AS account_name, status, heat_score,
                   potential_revenue, industry
            FROM prospects
            WHERE id = ? AND deleted_at IS NULL
            """;
        return jdbcTemplate.query(sql, rs -> {
            if (!rs.next()) {
                return Optional.<Account>empty();
            }
            return Optional.of(new Account(
                rs.getObject("id", UUID.class),
                rs.getString("account_name"),
                rs.getString("status"),
                rs.getObject("heat_score", Integer.class),
                rs.getBigDecimal("potential_revenue"),
                rs.getString("industry")
            ));
        }, accountId);
    }
}
