package com.resellerhub.credits.repository;

import com.resellerhub.credits.model.AccountStats;
import com.resellerhub.credits.model.EntryType;
import com.resellerhub.credits.model.LedgerEntry;
import com.resellerhub.credits.model.LedgerQuery;
import com.resellerhub.credits.model.PlatformSummary;
import com.resellerhub.credits.model.ResellerBreakdown;
import com.resellerhub.credits.model.SortDirection;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Append-only store of ledger entries: rows are inserted, never updated or deleted.
 *
 * An entry's id is the id of the transaction that appended it, and every movement appends
 * exactly one entry. Transaction ids are handed out in increasing order, and any transaction
 * still in flight has an id at or above the reader's snapshot xmin. Cursor reads therefore
 * only return ids below that watermark: an entry that commits later can never land behind
 * a cursor that has already passed it, and writers on disjoint accounts share no lock.
 */
@Repository
@RequiredArgsConstructor
public class LedgerRepository {

    private final NamedParameterJdbcTemplate namedJdbc;

    private static final String COLUMNS =
            "le.id, le.entry_type, le.from_account_id, le.to_account_id, le.amount, " +
            "le.from_balance_after, le.to_balance_after, le.note, le.actor_id, " +
            "le.idempotency_key, le.created_at";

    private static final RowMapper<LedgerEntry> ENTRY_ROW_MAPPER = (rs, rowNum) -> LedgerEntry.builder()
            .id(rs.getLong("id"))
            .entryType(EntryType.valueOf(rs.getString("entry_type")))
            .fromAccountId(rs.getObject("from_account_id", Long.class))
            .toAccountId(rs.getLong("to_account_id"))
            .amount(rs.getLong("amount"))
            .fromBalanceAfter(rs.getObject("from_balance_after", Long.class))
            .toBalanceAfter(rs.getLong("to_balance_after"))
            .note(rs.getString("note"))
            .actorId(rs.getLong("actor_id"))
            .idempotencyKey(rs.getString("idempotency_key"))
            .createdAt(rs.getObject("created_at", OffsetDateTime.class))
            .build();

    private static final RowMapper<ResellerBreakdown> BREAKDOWN_ROW_MAPPER = (rs, rowNum) -> ResellerBreakdown.builder()
            .resellerId(rs.getLong("id"))
            .name(rs.getString("name"))
            .balance(rs.getLong("balance"))
            .totalSent(rs.getLong("total_sent"))
            .transferCount(rs.getLong("transfer_count"))
            .businessOwnerCount(rs.getLong("business_owner_count"))
            .businessOwnerBalance(rs.getLong("business_owner_balance"))
            .build();

    /**
     * Appends an entry and returns it as stored, id assigned by the column default.
     *
     * Must be called within a transaction, at most once per transaction.
     */
    public LedgerEntry append(LedgerEntry entry) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("entryType", entry.getEntryType().name())
                .addValue("fromAccountId", entry.getFromAccountId())
                .addValue("toAccountId", entry.getToAccountId())
                .addValue("amount", entry.getAmount())
                .addValue("fromBalanceAfter", entry.getFromBalanceAfter())
                .addValue("toBalanceAfter", entry.getToBalanceAfter())
                .addValue("note", entry.getNote())
                .addValue("actorId", entry.getActorId())
                .addValue("idempotencyKey", entry.getIdempotencyKey());
        return namedJdbc.queryForObject(
                "INSERT INTO ledger_entries AS le (entry_type, from_account_id, to_account_id, amount, " +
                "from_balance_after, to_balance_after, note, actor_id, idempotency_key) " +
                "VALUES (:entryType, :fromAccountId, :toAccountId, :amount, " +
                ":fromBalanceAfter, :toBalanceAfter, :note, :actorId, :idempotencyKey) " +
                "RETURNING " + COLUMNS,
                params,
                ENTRY_ROW_MAPPER
        );
    }

    public Optional<LedgerEntry> findById(long id) {
        List<LedgerEntry> results = namedJdbc.query(
                "SELECT " + COLUMNS + " FROM ledger_entries le WHERE le.id = :id",
                new MapSqlParameterSource("id", id),
                ENTRY_ROW_MAPPER
        );
        return results.stream().findFirst();
    }

    public Optional<LedgerEntry> findByIdempotencyKey(String idempotencyKey) {
        List<LedgerEntry> results = namedJdbc.query(
                "SELECT " + COLUMNS + " FROM ledger_entries le WHERE le.idempotency_key = :key",
                new MapSqlParameterSource("key", idempotencyKey),
                ENTRY_ROW_MAPPER
        );
        return results.stream().findFirst();
    }

    /**
     * Committed entries where the account is either sender or receiver, keyset-paginated on id.
     */
    public List<LedgerEntry> findForAccount(LedgerQuery query, int limit) {
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM ledger_entries le ");
        MapSqlParameterSource params = new MapSqlParameterSource("accountId", query.getAccountId());

        if (query.getCounterpartRole() != null) {
            // Issuance rows have no counterpart account and drop out of the join.
            sql.append("JOIN accounts cp ON cp.id = CASE WHEN le.from_account_id = :accountId " +
                       "THEN le.to_account_id ELSE le.from_account_id END ");
        }
        sql.append("WHERE (le.from_account_id = :accountId OR le.to_account_id = :accountId) ");
        if (query.getCounterpartRole() != null) {
            sql.append("AND cp.role = :counterpartRole ");
            params.addValue("counterpartRole", query.getCounterpartRole().name());
        }
        if (query.getFrom() != null) {
            sql.append("AND le.created_at >= :from ");
            params.addValue("from", query.getFrom());
        }
        if (query.getTo() != null) {
            sql.append("AND le.created_at < :to ");
            params.addValue("to", query.getTo());
        }
        appendCursorAndOrder(sql, params, query.getCursor(), query.getDirection(), limit);
        return namedJdbc.query(sql.toString(), params, ENTRY_ROW_MAPPER);
    }

    public List<LedgerEntry> findAll(Long cursor, SortDirection direction, int limit) {
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM ledger_entries le WHERE 1 = 1 ");
        MapSqlParameterSource params = new MapSqlParameterSource();
        appendCursorAndOrder(sql, params, cursor, direction, limit);
        return namedJdbc.query(sql.toString(), params, ENTRY_ROW_MAPPER);
    }

    private static void appendCursorAndOrder(StringBuilder sql, MapSqlParameterSource params,
                                             Long cursor, SortDirection direction, int limit) {
        boolean descending = direction == SortDirection.DESC;
        sql.append("AND le.id < pg_snapshot_xmin(pg_current_snapshot())::text::bigint ");
        if (cursor != null) {
            sql.append(descending ? "AND le.id < :cursor " : "AND le.id > :cursor ");
            params.addValue("cursor", cursor);
        }
        sql.append(descending ? "ORDER BY le.id DESC " : "ORDER BY le.id ASC ");
        sql.append("LIMIT :limit");
        params.addValue("limit", limit);
    }

    /**
     * Ledger-side figures for one account. Balance and role are filled in by the caller.
     */
    public AccountStats.AccountStatsBuilder statsFor(long accountId) {
        return namedJdbc.queryForObject(
                "SELECT COALESCE(SUM(CASE WHEN from_account_id = :id THEN amount ELSE 0 END), 0) AS total_sent, " +
                "       COALESCE(SUM(CASE WHEN to_account_id = :id THEN amount ELSE 0 END), 0)   AS total_received, " +
                "       COUNT(*) AS entry_count, " +
                "       MIN(created_at) AS first_entry_time, " +
                "       MAX(created_at) AS last_entry_time " +
                "FROM ledger_entries WHERE from_account_id = :id OR to_account_id = :id",
                new MapSqlParameterSource("id", accountId),
                (rs, rowNum) -> AccountStats.builder()
                        .accountId(accountId)
                        .totalSent(rs.getLong("total_sent"))
                        .totalReceived(rs.getLong("total_received"))
                        .entryCount(rs.getLong("entry_count"))
                        .firstEntryTime(rs.getObject("first_entry_time", OffsetDateTime.class))
                        .lastEntryTime(rs.getObject("last_entry_time", OffsetDateTime.class))
        );
    }

    /**
     * Ledger-side platform totals. Circulation and the per-reseller rows are filled in by the caller.
     */
    public PlatformSummary.PlatformSummaryBuilder platformTotals() {
        return namedJdbc.queryForObject(
                "SELECT COUNT(*) FILTER (WHERE entry_type = 'TRANSFER')                  AS total_transfers, " +
                "       COALESCE(SUM(amount) FILTER (WHERE entry_type = 'TRANSFER'), 0) AS total_volume, " +
                "       COALESCE(SUM(amount) FILTER (WHERE entry_type = 'ISSUANCE'), 0) AS total_issued " +
                "FROM ledger_entries",
                new MapSqlParameterSource(),
                (rs, rowNum) -> PlatformSummary.builder()
                        .totalTransfers(rs.getLong("total_transfers"))
                        .totalVolume(rs.getLong("total_volume"))
                        .totalIssued(rs.getLong("total_issued"))
        );
    }

    public List<ResellerBreakdown> resellerBreakdown() {
        return namedJdbc.query(
                "SELECT r.id, r.name, r.balance, " +
                "       COALESCE((SELECT SUM(le.amount) FROM ledger_entries le " +
                "                 WHERE le.from_account_id = r.id AND le.entry_type = 'TRANSFER'), 0) AS total_sent, " +
                "       (SELECT COUNT(*) FROM ledger_entries le " +
                "         WHERE le.from_account_id = r.id AND le.entry_type = 'TRANSFER') AS transfer_count, " +
                "       (SELECT COUNT(*) FROM accounts b WHERE b.owning_reseller_id = r.id) AS business_owner_count, " +
                "       COALESCE((SELECT SUM(b.balance) FROM accounts b " +
                "                 WHERE b.owning_reseller_id = r.id), 0) AS business_owner_balance " +
                "FROM accounts r WHERE r.role = 'RESELLER' ORDER BY r.id",
                new MapSqlParameterSource(),
                BREAKDOWN_ROW_MAPPER
        );
    }
}
