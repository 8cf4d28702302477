package com.placeguide.recommend.store.jdbc;

import com.placeguide.recommend.store.StoreRequestException;
import com.placeguide.recommend.store.StoreUnavailableException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;

public final class JdbcErrors {
    private JdbcErrors() {
    }

    public static RuntimeException translate(String operation, DataAccessException e) {
        if (e instanceof DataAccessResourceFailureException
            || e instanceof TransientDataAccessException
            || e instanceof RecoverableDataAccessException) {
            return new StoreUnavailableException(operation + " unavailable", e);
        }
        return new StoreRequestException(operation + " failed", e);
    }
}
