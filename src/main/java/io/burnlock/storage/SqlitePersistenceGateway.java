package io.burnlock.storage;

import io.burnlock.error.LifecycleException;
import io.burnlock.model.HandshakeSession;
import io.burnlock.model.HandshakeState;
import io.burnlock.model.MessageView;
import io.burnlock.model.NewMessage;
import io.burnlock.model.PendingBurn;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class SqlitePersistenceGateway implements PersistenceGateway {
    private static final String SESSION_COLUMNS =
            "session_id,initiator_user_id,responder_user_id,state,created_at_ms,updated_at_ms,"
                    + "expires_at_ms,retry_count,last_retry_at_ms,failure_reason";
    private static final String MESSAGE_COLUMNS =
            "id,conversation_id,sender_id,created_at_ms,unlock_condition,scheduled_burn_at_ms,"
                    + "acknowledged_at_ms,burned_at_ms";

    private final Database database;

    public SqlitePersistenceGateway(Database database) {
        this.database = database;
    }

    @Override
    public void insertMessage(NewMessage m) {
        exec("""
                INSERT INTO messages(id,conversation_id,sender_id,body,created_at_ms,unlock_condition,scheduled_burn_at_ms)
                VALUES(?,?,?,?,?,?,?)
                """, ps -> {
            ps.setString(1, m.messageId());
            ps.setString(2, m.conversationId());
            ps.setString(3, m.senderId());
            ps.setString(4, m.body());
            ps.setLong(5, m.createdAtMs());
            setNullableLong(ps, 6, m.unlockCondition());
            setNullableLong(ps, 7, m.scheduledBurnAtMs());
        }, "Failed to insert message: " + m.messageId());
    }

    @Override
    public Optional<MessageView> findMessage(String messageId) {
        String sql = "SELECT " + MESSAGE_COLUMNS + " FROM messages WHERE id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, messageId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(new MessageView(
                        rs.getString("id"),
                        rs.getString("conversation_id"),
                        rs.getString("sender_id"),
                        rs.getLong("created_at_ms"),
                        getNullableLong(rs, "unlock_condition"),
                        getNullableLong(rs, "scheduled_burn_at_ms"),
                        getNullableLong(rs, "acknowledged_at_ms"),
                        getNullableLong(rs, "burned_at_ms")
                ));
            }
        } catch (SQLException e) {
            throw LifecycleException.transientIo("Failed to read message: " + messageId, e);
        }
    }

    @Override
    public Optional<String> readBody(String messageId) {
        String sql = "SELECT body FROM messages WHERE id=? AND burned_at_ms IS NULL";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, messageId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.ofNullable(rs.getString("body"));
            }
        } catch (SQLException e) {
            throw LifecycleException.transientIo("Failed to read message body: " + messageId, e);
        }
    }

    @Override
    public AckOutcome acknowledge(String messageId, long acknowledgedAtMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement update = c.prepareStatement(
                    "UPDATE messages SET acknowledged_at_ms=? WHERE id=? AND acknowledged_at_ms IS NULL AND burned_at_ms IS NULL");
                 PreparedStatement check = c.prepareStatement(
                         "SELECT acknowledged_at_ms,burned_at_ms FROM messages WHERE id=?")) {
                update.setLong(1, acknowledgedAtMs);
                update.setString(2, messageId);
                if (update.executeUpdate() == 1) {
                    c.commit();
                    return AckOutcome.ACKNOWLEDGED;
                }
                check.setString(1, messageId);
                AckOutcome outcome;
                try (ResultSet rs = check.executeQuery()) {
                    if (!rs.next() || getNullableLong(rs, "burned_at_ms") != null) {
                        outcome = AckOutcome.NOT_FOUND;
                    } else {
                        outcome = AckOutcome.ALREADY_ACKNOWLEDGED;
                    }
                }
                c.commit();
                return outcome;
            } catch (Exception e) {
                rollback(c, e);
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw LifecycleException.transientIo("Failed to acknowledge message: " + messageId, e);
        }
    }

    @Override
    public boolean updateScheduledBurn(String messageId, Long scheduledBurnAtMs) {
        String sql = "UPDATE messages SET scheduled_burn_at_ms=? WHERE id=? AND burned_at_ms IS NULL";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            setNullableLong(ps, 1, scheduledBurnAtMs);
            ps.setString(2, messageId);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw LifecycleException.transientIo("Failed to update burn deadline: " + messageId, e);
        }
    }

    @Override
    public List<PendingBurn> getPendingBurns() {
        String sql = """
                SELECT id,conversation_id,scheduled_burn_at_ms FROM messages
                WHERE burned_at_ms IS NULL AND scheduled_burn_at_ms IS NOT NULL
                ORDER BY scheduled_burn_at_ms ASC
                """;
        List<PendingBurn> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new PendingBurn(
                        rs.getString("id"),
                        rs.getString("conversation_id"),
                        rs.getLong("scheduled_burn_at_ms")
                ));
            }
            return out;
        } catch (SQLException e) {
            throw LifecycleException.transientIo("Failed to read pending burns", e);
        }
    }

    @Override
    public BurnOutcome burnMessage(String messageId, long burnedAtMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE messages SET body=NULL,burned_at_ms=?,scheduled_burn_at_ms=NULL WHERE id=? AND burned_at_ms IS NULL")) {
                ps.setLong(1, burnedAtMs);
                ps.setString(2, messageId);
                int rows = ps.executeUpdate();
                c.commit();
                return rows == 1 ? BurnOutcome.BURNED : BurnOutcome.NOT_FOUND;
            } catch (Exception e) {
                rollback(c, e);
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw LifecycleException.transientIo("Failed to burn message: " + messageId, e);
        }
    }

    @Override
    public SessionInsertOutcome insertSession(HandshakeSession s) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement byId = c.prepareStatement("SELECT 1 FROM x3dh_sessions WHERE session_id=?");
                 PreparedStatement livePair = c.prepareStatement(
                         "SELECT 1 FROM x3dh_sessions WHERE initiator_user_id=? AND responder_user_id=? AND state IN ('PENDING','ACTIVE')");
                 PreparedStatement insert = c.prepareStatement(
                         "INSERT INTO x3dh_sessions(" + SESSION_COLUMNS + ") VALUES(?,?,?,?,?,?,?,?,?,?)")) {
                byId.setString(1, s.sessionId());
                try (ResultSet rs = byId.executeQuery()) {
                    if (rs.next()) {
                        c.rollback();
                        return SessionInsertOutcome.SESSION_ID_TAKEN;
                    }
                }
                livePair.setString(1, s.initiatorUserId());
                livePair.setString(2, s.responderUserId());
                try (ResultSet rs = livePair.executeQuery()) {
                    if (rs.next()) {
                        c.rollback();
                        return SessionInsertOutcome.LIVE_PAIR_EXISTS;
                    }
                }
                insert.setString(1, s.sessionId());
                insert.setString(2, s.initiatorUserId());
                insert.setString(3, s.responderUserId());
                insert.setString(4, s.state().name());
                insert.setLong(5, s.createdAtMs());
                insert.setLong(6, s.updatedAtMs());
                setNullableLong(insert, 7, s.expiresAtMs());
                insert.setInt(8, s.retryCount());
                setNullableLong(insert, 9, s.lastRetryAtMs());
                insert.setString(10, s.failureReason());
                insert.executeUpdate();
                c.commit();
                return SessionInsertOutcome.CREATED;
            } catch (Exception e) {
                rollback(c, e);
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            // A concurrent initiate can slip past the pre-check; the unique indexes settle it.
            if (findSession(s.sessionId()).isPresent()) {
                return SessionInsertOutcome.SESSION_ID_TAKEN;
            }
            if (findLiveSession(s.initiatorUserId(), s.responderUserId()).isPresent()) {
                return SessionInsertOutcome.LIVE_PAIR_EXISTS;
            }
            throw LifecycleException.transientIo("Failed to insert handshake session: " + s.sessionId(), e);
        }
    }

    @Override
    public Optional<HandshakeSession> findSession(String sessionId) {
        return querySession("SELECT " + SESSION_COLUMNS + " FROM x3dh_sessions WHERE session_id=?",
                ps -> ps.setString(1, sessionId),
                "Failed to read handshake session: " + sessionId);
    }

    @Override
    public Optional<HandshakeSession> findLiveSession(String initiatorUserId, String responderUserId) {
        return querySession("""
                        SELECT %s FROM x3dh_sessions
                        WHERE initiator_user_id=? AND responder_user_id=? AND state IN ('PENDING','ACTIVE')
                        ORDER BY created_at_ms DESC LIMIT 1
                        """.formatted(SESSION_COLUMNS),
                ps -> {
                    ps.setString(1, initiatorUserId);
                    ps.setString(2, responderUserId);
                },
                "Failed to read live handshake session");
    }

    @Override
    public boolean tryTransition(String sessionId, HandshakeState from, HandshakeState to, long nowMs,
                                 String failureReason, Long expiresAtMs) {
        String sql = "UPDATE x3dh_sessions SET state=?,updated_at_ms=?,failure_reason=?,expires_at_ms=? WHERE session_id=? AND state=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, to.name());
            ps.setLong(2, nowMs);
            ps.setString(3, failureReason);
            setNullableLong(ps, 4, expiresAtMs);
            ps.setString(5, sessionId);
            ps.setString(6, from.name());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw LifecycleException.transientIo("Failed to transition handshake session: " + sessionId, e);
        }
    }

    @Override
    public boolean tryExpire(String sessionId, long nowMs) {
        String sql = """
                UPDATE x3dh_sessions SET state='EXPIRED',updated_at_ms=?
                WHERE session_id=?
                  AND (state='PENDING' OR (state='ACTIVE' AND expires_at_ms IS NOT NULL AND expires_at_ms<=?))
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, nowMs);
            ps.setString(2, sessionId);
            ps.setLong(3, nowMs);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw LifecycleException.transientIo("Failed to expire handshake session: " + sessionId, e);
        }
    }

    @Override
    public boolean recordRetry(String sessionId, long nowMs) {
        String sql = "UPDATE x3dh_sessions SET retry_count=retry_count+1,last_retry_at_ms=?,updated_at_ms=? WHERE session_id=? AND state='PENDING'";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, nowMs);
            ps.setLong(2, nowMs);
            ps.setString(3, sessionId);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw LifecycleException.transientIo("Failed to record handshake retry: " + sessionId, e);
        }
    }

    @Override
    public List<String> expireDueSessions(long nowMs) {
        String due = """
                SELECT session_id FROM x3dh_sessions
                WHERE state IN ('PENDING','ACTIVE') AND expires_at_ms IS NOT NULL AND expires_at_ms<=?
                """;
        String expire = """
                UPDATE x3dh_sessions SET state='EXPIRED',updated_at_ms=?
                WHERE session_id=? AND state IN ('PENDING','ACTIVE')
                """;
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement select = c.prepareStatement(due);
                 PreparedStatement update = c.prepareStatement(expire)) {
                select.setLong(1, nowMs);
                List<String> candidates = new ArrayList<>();
                try (ResultSet rs = select.executeQuery()) {
                    while (rs.next()) {
                        candidates.add(rs.getString("session_id"));
                    }
                }
                List<String> expired = new ArrayList<>(candidates.size());
                for (String sessionId : candidates) {
                    update.setLong(1, nowMs);
                    update.setString(2, sessionId);
                    if (update.executeUpdate() == 1) {
                        expired.add(sessionId);
                    }
                }
                c.commit();
                return expired;
            } catch (Exception e) {
                rollback(c, e);
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw LifecycleException.transientIo("Failed to sweep expired handshake sessions", e);
        }
    }

    @Override
    public void setMetadata(String key, String value, long nowMs) {
        exec("""
                INSERT INTO metadata(meta_key,meta_value,updated_at_ms) VALUES(?,?,?)
                ON CONFLICT(meta_key) DO UPDATE SET meta_value=excluded.meta_value,updated_at_ms=excluded.updated_at_ms
                """, ps -> {
            ps.setString(1, key);
            ps.setString(2, value);
            ps.setLong(3, nowMs);
        }, "Failed to write metadata: " + key);
    }

    @Override
    public Optional<String> getMetadata(String key) {
        String sql = "SELECT meta_value FROM metadata WHERE meta_key=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.ofNullable(rs.getString("meta_value")) : Optional.empty();
            }
        } catch (SQLException e) {
            throw LifecycleException.transientIo("Failed to read metadata: " + key, e);
        }
    }

    private Optional<HandshakeSession> querySession(String sql, Binder binder, String failure) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(new HandshakeSession(
                        rs.getString("session_id"),
                        rs.getString("initiator_user_id"),
                        rs.getString("responder_user_id"),
                        HandshakeState.fromString(rs.getString("state")),
                        rs.getLong("created_at_ms"),
                        rs.getLong("updated_at_ms"),
                        getNullableLong(rs, "expires_at_ms"),
                        rs.getInt("retry_count"),
                        getNullableLong(rs, "last_retry_at_ms"),
                        rs.getString("failure_reason")
                ));
            }
        } catch (SQLException e) {
            throw LifecycleException.transientIo(failure, e);
        }
    }

    private void exec(String sql, Binder binder, String failure) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw LifecycleException.transientIo(failure, e);
        }
    }

    private static void setNullableLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.BIGINT);
        } else {
            ps.setLong(index, value);
        }
    }

    private static Long getNullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    /**
     * Rolls back {@code c}, attaching a rollback failure to {@code cause} so the original error survives.
     */
    static void rollback(Connection c, Exception cause) {
        try {
            c.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
        }
    }
}
