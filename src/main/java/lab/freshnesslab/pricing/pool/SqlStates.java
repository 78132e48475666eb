package lab.freshnesslab.pricing.pool;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;

/**
 * Classifies driver and pool failures by SQLSTATE and exception type.
 */
public final class SqlStates {

    public static final String TOO_MANY_CONNECTIONS = "53300";
    public static final String QUERY_CANCELED = "57014";
    public static final String UNDEFINED_TABLE = "42P01";
    public static final String UNDEFINED_OBJECT = "42704";
    private static final String CONNECTION_EXCEPTION_CLASS = "08";

    private SqlStates() {
    }

    /**
     * Hikari reports an acquisition timeout as {@link SQLTransientConnectionException};
     * the server reports a full connection table as 53300.
     */
    public static boolean isPoolExhausted(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof SQLTransientConnectionException) {
                return true;
            }
            if (hasState(current, TOO_MANY_CONNECTIONS)) {
                return true;
            }
        }
        return false;
    }

    public static boolean isTimeout(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof SQLTimeoutException || hasState(current, QUERY_CANCELED)) {
                return true;
            }
        }
        return false;
    }

    public static boolean isUndefinedRelation(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (hasState(current, UNDEFINED_TABLE) || hasState(current, UNDEFINED_OBJECT)) {
                return true;
            }
        }
        return false;
    }

    public static boolean isConnectionLoss(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof SQLNonTransientConnectionException
                    || current instanceof SQLRecoverableException) {
                return true;
            }
            if (current instanceof SQLException sqlException
                    && sqlException.getSQLState() != null
                    && sqlException.getSQLState().startsWith(CONNECTION_EXCEPTION_CLASS)) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasState(Throwable error, String state) {
        return error instanceof SQLException sqlException && state.equals(sqlException.getSQLState());
    }
}
