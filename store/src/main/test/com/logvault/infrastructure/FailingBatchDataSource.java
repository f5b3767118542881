package com.logvault.infrastructure;

import javax.sql.DataSource;
import java.io.PrintWriter;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

// The chosen executeBatch call writes its rows and then fails, leaving them in the open transaction.
class FailingBatchDataSource implements DataSource {

    private final DataSource delegate;
    private final int failingBatch;
    private final boolean failRollback;
    private final AtomicInteger batches = new AtomicInteger();

    FailingBatchDataSource(DataSource delegate, int failingBatch, boolean failRollback) {
        this.delegate = delegate;
        this.failingBatch = failingBatch;
        this.failRollback = failRollback;
    }

    @Override
    public Connection getConnection() throws SQLException {
        return wrap(delegate.getConnection());
    }

    @Override
    public Connection getConnection(String username, String password) throws SQLException {
        return wrap(delegate.getConnection(username, password));
    }

    private Connection wrap(Connection conn) {
        InvocationHandler handler = (proxy, method, args) -> {
            if (failRollback && method.getName().equals("rollback") && method.getParameterCount() == 0) {
                throw new SQLException("rollback failed");
            }
            Object result = invoke(conn, method, args);
            if (result instanceof PreparedStatement stmt) {
                return wrap(stmt);
            }
            return result;
        };
        return (Connection) Proxy.newProxyInstance(
                Connection.class.getClassLoader(), new Class<?>[]{Connection.class}, handler);
    }

    private PreparedStatement wrap(PreparedStatement stmt) {
        InvocationHandler handler = (proxy, method, args) -> {
            Object result = invoke(stmt, method, args);
            if (method.getName().equals("executeBatch") && batches.incrementAndGet() == failingBatch) {
                throw new SQLException("disk I/O error");
            }
            return result;
        };
        return (PreparedStatement) Proxy.newProxyInstance(
                PreparedStatement.class.getClassLoader(), new Class<?>[]{PreparedStatement.class}, handler);
    }

    private static Object invoke(Object target, Method method, Object[] args) throws Throwable {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            throw e.getCause();
        }
    }

    @Override
    public PrintWriter getLogWriter() throws SQLException {
        return delegate.getLogWriter();
    }

    @Override
    public void setLogWriter(PrintWriter out) throws SQLException {
        delegate.setLogWriter(out);
    }

    @Override
    public void setLoginTimeout(int seconds) throws SQLException {
        delegate.setLoginTimeout(seconds);
    }

    @Override
    public int getLoginTimeout() throws SQLException {
        return delegate.getLoginTimeout();
    }

    @Override
    public Logger getParentLogger() throws SQLFeatureNotSupportedException {
        return delegate.getParentLogger();
    }

    @Override
    public <T> T unwrap(Class<T> iface) throws SQLException {
        return delegate.unwrap(iface);
    }

    @Override
    public boolean isWrapperFor(Class<?> iface) throws SQLException {
        return delegate.isWrapperFor(iface);
    }
}
