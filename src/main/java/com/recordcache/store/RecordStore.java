package com.recordcache.store;

import com.recordcache.exception.StoreException;
import com.recordcache.model.Record;

import java.util.List;
import java.util.Optional;

/**
 * Authoritative source of records behind the repository cache.
 * Implementations must be safe for concurrent use.
 */
public interface RecordStore extends AutoCloseable {

    Optional<Record> fetch(long id) throws StoreException;

    /**
     * Persists a new record. The store assigns the identity.
     */
    Record insert(String name, String email) throws StoreException;

    /**
     * @return false if no record with {@code record.getId()} exists
     */
    boolean update(Record record) throws StoreException;

    /**
     * @return false if no record with {@code id} existed
     */
    boolean delete(long id) throws StoreException;

    /**
     * Every stored record, ordered by id.
     */
    List<Record> findAll() throws StoreException;

    @Override
    default void close() {
    }
}
