package com.koni.mobility.infrastructure.persistence.repository;

import com.koni.mobility.domain.exception.DatabaseUnavailableException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.util.function.Supplier;

/**
 * Translates Spring's infrastructure failures into {@link DatabaseUnavailableException}.
 * Other data access exceptions pass through unchanged.
 */
final class DataAccessFailures {

    private DataAccessFailures() {
    }

    static <T> T translate(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessResourceFailureException | TransientDataAccessException
                 | RecoverableDataAccessException | CannotCreateTransactionException e) {
            throw new DatabaseUnavailableException("Store unavailable during " + operation + ": " + e.getMessage(), e);
        }
    }
}
