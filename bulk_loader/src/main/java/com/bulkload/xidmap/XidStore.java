package com.bulkload.xidmap;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

/**
 * Disposable on-disk xid → uid table behind {@link XidMap}.
 *
 * Lives only for the map stage, so durability is traded for speed: no
 * journal, no fsync, memory-mapped reads. Calls are serialized on the single
 * connection.
 */
public class XidStore implements Closeable {

  private static final Logger LOG = LoggerFactory.getLogger(XidStore.class);

  private static final long MMAP_SIZE = 1L << 30; // 1GB
  private static final int CACHE_SIZE_KB = 64 * 1024;

  private final File dbFile;
  private final Connection conn;
  private final PreparedStatement select;
  private final PreparedStatement insert;

  private XidStore(File dbFile, Connection conn) throws SQLException {
    this.dbFile = dbFile;
    this.conn = conn;
    this.select = conn.prepareStatement("SELECT uid FROM xids WHERE xid = ?");
    this.insert = conn.prepareStatement(
      "INSERT OR REPLACE INTO xids (xid, uid) VALUES (?, ?)"
    );
  }

  /** Creates a fresh store in {@code dir}, which must not hold one already. */
  public static XidStore open(File dir) throws IOException {
    if (!dir.mkdirs() && !dir.isDirectory()) {
      throw new IOException("cannot create xid store directory " + dir);
    }
    File dbFile = new File(dir, "xids.db");
    if (dbFile.exists()) {
      throw new IOException("xid store already exists: " + dbFile);
    }
    SQLiteConfig config = new SQLiteConfig();
    config.setCacheSize(-CACHE_SIZE_KB);
    try {
      Connection conn = DriverManager.getConnection(
        "jdbc:sqlite:" + dbFile.getAbsolutePath(),
        config.toProperties()
      );
      try (Statement stmt = conn.createStatement()) {
        stmt.execute("PRAGMA synchronous = OFF");
        stmt.execute("PRAGMA journal_mode = OFF");
        stmt.execute("PRAGMA mmap_size = " + MMAP_SIZE);
        stmt.execute("PRAGMA temp_store = MEMORY");
        stmt.execute(
          "CREATE TABLE xids (xid TEXT PRIMARY KEY, uid INTEGER NOT NULL) WITHOUT ROWID"
        );
      }
      conn.setAutoCommit(false);
      LOG.debug("Opened xid store {}", dbFile);
      return new XidStore(dbFile, conn);
    } catch (SQLException e) {
      throw new IOException("cannot open xid store at " + dbFile, e);
    }
  }

  /** Uid stored for {@code xid}, or null. */
  public synchronized Long get(String xid) throws IOException {
    try {
      select.setString(1, xid);
      try (ResultSet rs = select.executeQuery()) {
        return rs.next() ? rs.getLong(1) : null;
      }
    } catch (SQLException e) {
      throw new IOException("xid store lookup failed for " + xid, e);
    }
  }

  /** Writes a batch of mappings in one transaction. */
  public synchronized void putAll(Map<String, Long> batch) throws IOException {
    if (batch.isEmpty()) return;
    try {
      for (Map.Entry<String, Long> e : batch.entrySet()) {
        insert.setString(1, e.getKey());
        insert.setLong(2, e.getValue());
        insert.addBatch();
      }
      insert.executeBatch();
      conn.commit();
    } catch (SQLException e) {
      throw new IOException("xid store write failed", e);
    }
  }

  public synchronized long count() throws IOException {
    try (
      Statement stmt = conn.createStatement();
      ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM xids")
    ) {
      rs.next();
      return rs.getLong(1);
    } catch (SQLException e) {
      throw new IOException("xid store count failed", e);
    }
  }

  @Override
  public synchronized void close() throws IOException {
    try {
      select.close();
      insert.close();
      conn.commit();
      conn.close();
    } catch (SQLException e) {
      throw new IOException("cannot close xid store " + dbFile, e);
    }
  }
}
