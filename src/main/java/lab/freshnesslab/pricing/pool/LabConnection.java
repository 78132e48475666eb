package lab.freshnesslab.pricing.pool;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.concurrent.atomic.AtomicBoolean;
import lab.freshnesslab.pricing.domain.BackendFamily;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pooled connection handle that knows which backend family it talks to.
 *
 * <p>Closing returns the connection to its pool. For families without session reset support
 * the close path issues at most one best-effort rollback first. Closing is idempotent.
 */
public class LabConnection implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LabConnection.class);

    private final Connection delegate;
    private final BackendFamily family;
    private final AtomicBoolean closed = new AtomicBoolean();

    public LabConnection(Connection delegate, BackendFamily family) {
        this.delegate = delegate;
        this.family = family;
    }

    public BackendFamily family() {
        return family;
    }

    public PreparedStatement prepareStatement(String sql) throws SQLException {
        return delegate.prepareStatement(sql);
    }

    public Statement createStatement() throws SQLException {
        return delegate.createStatement();
    }

    public void setAutoCommit(boolean autoCommit) throws SQLException {
        delegate.setAutoCommit(autoCommit);
    }

    public void commit() throws SQLException {
        delegate.commit();
    }

    /**
     * Rolls back the current transaction and logs instead of throwing; used on error paths
     * where the original failure is the one worth propagating.
     */
    public void rollbackAfterFailure() {
        try {
            delegate.rollback();
        } catch (SQLException ex) {
            log.warn("Rollback failed family={} message={}", family, ex.getMessage());
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (!family.supportsSessionReset()) {
            try {
                if (!delegate.getAutoCommit()) {
                    delegate.rollback();
                }
            } catch (SQLException ex) {
                log.debug("Ignoring error during cleanup family={} message={}", family, ex.getMessage());
            }
        }
        try {
            delegate.close();
        } catch (SQLException ex) {
            log.warn("{} connection already closing message={}", family.displayName(), ex.getMessage());
        }
    }
}
