package com.flamingo.ai.digest.storage;

import com.flamingo.ai.digest.exception.StorageException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import javax.sql.DataSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.support.JdbcUtils;
import org.springframework.stereotype.Component;

/**
 * Session-level PostgreSQL advisory locks. A held lock pins its own pooled connection until it is
 * released, so it survives transaction boundaries inside the critical section.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PostgresAdvisoryLocks {

  private final DataSource dataSource;
  private final Map<Long, Connection> held = new ConcurrentHashMap<>();

  public boolean tryAcquire(long lockId) {
    Connection connection = null;
    try {
      connection = dataSource.getConnection();
      connection.setAutoCommit(true);
      if (query(connection, "SELECT pg_try_advisory_lock(?)", lockId)) {
        held.put(lockId, connection);
        log.debug("Acquired advisory lock {}", lockId);
        return true;
      }
      JdbcUtils.closeConnection(connection);
      return false;
    } catch (SQLException e) {
      JdbcUtils.closeConnection(connection);
      throw new StorageException("Failed to acquire advisory lock " + lockId, e, true);
    }
  }

  public void release(long lockId) {
    Connection connection = held.remove(lockId);
    if (connection == null) {
      log.warn("Advisory lock {} is not held by this process", lockId);
      return;
    }
    try {
      if (!query(connection, "SELECT pg_advisory_unlock(?)", lockId)) {
        log.warn("Advisory lock {} was already released on the server", lockId);
      }
    } catch (SQLException e) {
      throw new StorageException("Failed to release advisory lock " + lockId, e, true);
    } finally {
      JdbcUtils.closeConnection(connection);
    }
  }

  private static boolean query(Connection connection, String sql, long lockId)
      throws SQLException {
    try (PreparedStatement statement = connection.prepareStatement(sql)) {
      statement.setLong(1, lockId);
      try (ResultSet rs = statement.executeQuery()) {
        return rs.next() && rs.getBoolean(1);
      }
    }
  }
}
