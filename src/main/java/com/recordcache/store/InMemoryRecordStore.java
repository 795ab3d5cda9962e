package com.recordcache.store;

import com.recordcache.model.Record;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local record store. Nothing survives the process.
 */
public class InMemoryRecordStore implements RecordStore {
    private final ConcurrentSkipListMap<Long, Record> data;
    private final AtomicLong nextId;

    public InMemoryRecordStore() {
        this.data = new ConcurrentSkipListMap<>();
        this.nextId = new AtomicLong(0);
    }

    @Override
    public Optional<Record> fetch(long id) {
        return Optional.ofNullable(data.get(id));
    }

    @Override
    public Record insert(String name, String email) {
        Record record = new Record(nextId.incrementAndGet(), name, email);
        data.put(record.getId(), record);
        return record;
    }

    @Override
    public boolean update(Record record) {
        return data.replace(record.getId(), record) != null;
    }

    @Override
    public boolean delete(long id) {
        return data.remove(id) != null;
    }

    @Override
    public List<Record> findAll() {
        return new ArrayList<>(data.values());
    }

    public long size() {
        return data.size();
    }
}
