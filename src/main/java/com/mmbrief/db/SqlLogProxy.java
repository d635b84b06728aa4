package com.mmbrief.db;

import org.apache.logging.log4j.Logger;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.Statement;
import java.util.Locale;
import java.util.Set;

final class SqlLogProxy {
    private static final Set<String> EXECUTE_METHODS = Set.of(
            "execute", "executeQuery", "executeUpdate", "executeLargeUpdate", "executeBatch", "executeLargeBatch");

    private SqlLogProxy() {
    }

    static Connection wrapConnection(Connection delegate, Logger logger) {
        return (Connection) Proxy.newProxyInstance(
                Connection.class.getClassLoader(),
                new Class[]{Connection.class},
                (proxy, method, args) -> {
                    Object out = invoke(delegate, method, args);
                    String name = method.getName();
                    if ("prepareStatement".equals(name) && out instanceof PreparedStatement && args[0] instanceof String) {
                        return wrap(PreparedStatement.class, (PreparedStatement) out, (String) args[0], logger);
                    }
                    if ("createStatement".equals(name) && out instanceof Statement) {
                        return wrap(Statement.class, (Statement) out, null, logger);
                    }
                    return out;
                }
        );
    }

    private static <T extends Statement> T wrap(Class<T> type, T delegate, String preparedSql, Logger logger) {
        InvocationHandler handler = new StatementHandler(delegate, preparedSql, logger);
        return type.cast(Proxy.newProxyInstance(type.getClassLoader(), new Class[]{type}, handler));
    }

    private static Object invoke(Object target, Method method, Object[] args) throws Throwable {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            throw e.getTargetException();
        }
    }

    private static final class StatementHandler implements InvocationHandler {
        private final Statement delegate;
        private final String preparedSql;
        private final Logger logger;
        private int pendingBatchCount;

        private StatementHandler(Statement delegate, String preparedSql, Logger logger) {
            this.delegate = delegate;
            this.preparedSql = preparedSql;
            this.logger = logger;
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            String name = method.getName();
            if ("addBatch".equals(name) && (args == null || args.length == 0)) {
                pendingBatchCount++;
            }
            if (!EXECUTE_METHODS.contains(name)) {
                return SqlLogProxy.invoke(delegate, method, args);
            }
            String sql = preparedSql;
            if (sql == null && args != null && args.length > 0 && args[0] instanceof String) {
                sql = (String) args[0];
            }
            if (name.endsWith("Batch")) {
                sql = sql + " [batched_statements=" + pendingBatchCount + "]";
                pendingBatchCount = 0;
            }
            long started = System.nanoTime();
            try {
                Object out = SqlLogProxy.invoke(delegate, method, args);
                logger.info("SQL ok method={} elapsed_ms={}{} sql={}",
                        name, elapsedMs(started), resultSummary(out), normalizeSql(sql));
                return out;
            } catch (Throwable e) {
                logger.warn("SQL fail method={} elapsed_ms={} err={} sql={}",
                        name, elapsedMs(started), e.getMessage(), normalizeSql(sql));
                throw e;
            }
        }
    }

    private static String elapsedMs(long startedNanos) {
        return String.format(Locale.US, "%.3f", (System.nanoTime() - startedNanos) / 1_000_000.0);
    }

    private static String normalizeSql(String sql) {
        if (sql == null) {
            return "";
        }
        String normalized = sql.replaceAll("\\s+", " ").trim();
        return normalized.length() <= 800 ? normalized : normalized.substring(0, 800) + "...";
    }

    private static String resultSummary(Object result) {
        if (result instanceof Integer || result instanceof Long) {
            return " rows=" + result;
        }
        if (result instanceof int[]) {
            return " batch_size=" + ((int[]) result).length;
        }
        if (result instanceof long[]) {
            return " batch_size=" + ((long[]) result).length;
        }
        if (result instanceof Boolean) {
            return " has_result_set=" + result;
        }
        return "";
    }
}
