package com.resellerhub.credits.repository;

import com.resellerhub.credits.exception.InsufficientFundsException;
import com.resellerhub.credits.model.Account;
import com.resellerhub.credits.model.Role;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Accounts table, including the balance column that backs the balance store.
 *
 * {@link #debit} and {@link #credit} must only run inside the transfer engine's
 * transaction, after {@link #lockForUpdate} has been taken on the same rows.
 */
@Repository
@RequiredArgsConstructor
public class AccountRepository {

    private final NamedParameterJdbcTemplate namedJdbc;

    private static final String COLUMNS =
            "id, role, name, balance, owning_reseller_id, active, created_at";

    private static final RowMapper<Account> ROW_MAPPER = (rs, rowNum) -> Account.builder()
            .id(rs.getLong("id"))
            .role(Role.valueOf(rs.getString("role")))
            .name(rs.getString("name"))
            .balance(rs.getLong("balance"))
            .owningResellerId(rs.getObject("owning_reseller_id", Long.class))
            .active(rs.getBoolean("active"))
            .createdAt(rs.getObject("created_at", java.time.OffsetDateTime.class))
            .build();

    public Optional<Account> findById(long id) {
        List<Account> results = namedJdbc.query(
                "SELECT " + COLUMNS + " FROM accounts WHERE id = :id",
                new MapSqlParameterSource("id", id),
                ROW_MAPPER
        );
        return results.stream().findFirst();
    }

    public List<Account> findAll(Role role, Long owningResellerId) {
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM accounts WHERE 1 = 1");
        MapSqlParameterSource params = new MapSqlParameterSource();
        if (role != null) {
            sql.append(" AND role = :role");
            params.addValue("role", role.name());
        }
        if (owningResellerId != null) {
            sql.append(" AND owning_reseller_id = :resellerId");
            params.addValue("resellerId", owningResellerId);
        }
        sql.append(" ORDER BY id");
        return namedJdbc.query(sql.toString(), params, ROW_MAPPER);
    }

    public Account save(Role role, String name, Long owningResellerId) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        namedJdbc.update(
                "INSERT INTO accounts (role, name, owning_reseller_id) VALUES (:role, :name, :resellerId)",
                new MapSqlParameterSource()
                        .addValue("role", role.name())
                        .addValue("name", name)
                        .addValue("resellerId", owningResellerId),
                keyHolder,
                new String[]{"id"}
        );
        long id = keyHolder.getKey().longValue();
        return findById(id).orElseThrow();
    }

    /**
     * Soft delete. Balance and history stay in place.
     *
     * @return true if the account existed and was active
     */
    public boolean deactivate(long id) {
        return namedJdbc.update(
                "UPDATE accounts SET active = FALSE WHERE id = :id AND active",
                new MapSqlParameterSource("id", id)
        ) == 1;
    }

    /**
     * Locks the given account rows in ASCENDING ID ORDER and returns their current state.
     *
     * Every writer takes its locks in the same order, so two transfers touching the same
     * pair of accounts can block each other but never wait on each other in a cycle.
     * Ids that do not exist are simply absent from the result.
     *
     * Must be called within a transaction.
     */
    public Map<Long, Account> lockForUpdate(List<Long> sortedAccountIds) {
        List<Account> locked = namedJdbc.query(
                "SELECT " + COLUMNS + " FROM accounts WHERE id IN (:ids) ORDER BY id ASC FOR UPDATE",
                new MapSqlParameterSource("ids", sortedAccountIds),
                ROW_MAPPER
        );
        return locked.stream().collect(Collectors.toMap(Account::getId, Function.identity()));
    }

    public long getBalance(long id) {
        Long balance = namedJdbc.queryForObject(
                "SELECT balance FROM accounts WHERE id = :id",
                new MapSqlParameterSource("id", id),
                Long.class
        );
        return balance != null ? balance : 0L;
    }

    /**
     * Subtracts {@code amount} and returns the new balance. The guard in the WHERE clause
     * keeps the row non-negative even if a caller skipped the balance check.
     */
    public long debit(long id, long amount) {
        List<Long> updated = namedJdbc.queryForList(
                "UPDATE accounts SET balance = balance - :amount " +
                "WHERE id = :id AND balance >= :amount RETURNING balance",
                new MapSqlParameterSource(Map.of("id", id, "amount", amount)),
                Long.class
        );
        if (updated.isEmpty()) {
            throw new InsufficientFundsException(id, getBalance(id), amount);
        }
        return updated.get(0);
    }

    /**
     * Adds {@code amount} and returns the new balance.
     */
    public long credit(long id, long amount) {
        Long balance = namedJdbc.queryForObject(
                "UPDATE accounts SET balance = balance + :amount WHERE id = :id RETURNING balance",
                new MapSqlParameterSource(Map.of("id", id, "amount", amount)),
                Long.class
        );
        if (balance == null) {
            throw new IllegalStateException("Credit did not return a balance for account " + id);
        }
        return balance;
    }

    public long sumBalances() {
        Long total = namedJdbc.queryForObject(
                "SELECT COALESCE(SUM(balance), 0) FROM accounts",
                new MapSqlParameterSource(),
                Long.class
        );
        return total != null ? total : 0L;
    }

    public long countBusinessOwners(long resellerId) {
        Long count = namedJdbc.queryForObject(
                "SELECT COUNT(*) FROM accounts WHERE owning_reseller_id = :id",
                new MapSqlParameterSource("id", resellerId),
                Long.class
        );
        return count != null ? count : 0L;
    }
}
