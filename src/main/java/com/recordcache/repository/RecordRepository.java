package com.recordcache.repository;

import com.recordcache.cache.BoundedCache;
import com.recordcache.cache.CacheStats;
import com.recordcache.config.RecordCacheConfig;
import com.recordcache.exception.InvalidInputException;
import com.recordcache.exception.StoreException;
import com.recordcache.model.Record;
import com.recordcache.store.RecordStore;
import com.recordcache.store.RecordStores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Read-through record repository.
 * <p>
 * Reads consult the cache and fall back to the store on a miss, populating the
 * cache only with records the store actually returned. Writes go to the store
 * first; the cache is touched only once the store has acknowledged. No cache
 * lock is held while the store is called.
 */
public class RecordRepository implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RecordRepository.class);

    private final RecordStore store;
    private final BoundedCache<Long, Record> cache;
    private final ExecutorService asyncExecutor;
    private final boolean ownsStore;

    public RecordRepository(RecordStore store, BoundedCache<Long, Record> cache, int asyncThreads) {
        this(store, cache, asyncThreads, false);
    }

    private RecordRepository(RecordStore store, BoundedCache<Long, Record> cache, int asyncThreads,
                             boolean ownsStore) {
        this.store = store;
        this.cache = cache;
        this.asyncExecutor = Executors.newFixedThreadPool(asyncThreads, new RepositoryThreadFactory());
        this.ownsStore = ownsStore;
    }

    /**
     * Builds a repository and the store it reads through from configuration.
     * The returned repository closes the store when it is closed.
     */
    public static RecordRepository open(RecordCacheConfig config) throws StoreException {
        RecordStore store = RecordStores.create(config);
        return new RecordRepository(store, new BoundedCache<>(config.getCacheCapacity()),
                                    config.getAsyncThreads(), true);
    }

    public Optional<Record> findById(long id) throws StoreException {
        Optional<Record> cached = cache.get(id);
        if (cached.isPresent()) {
            return cached;
        }

        // Absent results are not cached: every miss asks the store again.
        long stamp = cache.invalidationStamp();
        Optional<Record> loaded = store.fetch(id);
        loaded.ifPresent(record -> populate(record, stamp));
        return loaded;
    }

    public Record create(String name, String email) throws InvalidInputException, StoreException {
        if (name == null || name.isEmpty()) {
            throw new InvalidInputException("name", "Name must not be empty");
        }
        if (!validateEmail(email)) {
            throw new InvalidInputException("email", "Malformed email address: " + email);
        }

        long stamp = cache.invalidationStamp();
        Record record = store.insert(name, email);
        populate(record, stamp);
        log.debug("create id={}", record.getId());
        return record;
    }

    // Skipped when a write invalidated anything while the store call was in flight.
    private void populate(Record record, long stamp) {
        if (!cache.putIfNotInvalidatedSince(record.getId(), record, stamp)) {
            log.debug("skip caching id={}: invalidated during load", record.getId());
        }
    }

    /**
     * Persists a changed record and drops its cached copy, so the next read
     * fetches the stored version.
     *
     * @return false if the store has no record with that id
     */
    public boolean update(Record record) throws StoreException {
        boolean updated = store.update(record);
        if (updated) {
            cache.invalidate(record.getId());
        }
        log.debug("update id={} updated={}", record.getId(), updated);
        return updated;
    }

    public boolean deleteById(long id) throws StoreException {
        boolean deleted = store.delete(id);
        cache.invalidate(id);
        log.debug("delete id={} deleted={}", id, deleted);
        return deleted;
    }

    public List<Record> findAll() throws StoreException {
        return store.findAll();
    }

    public List<Record> filter(Predicate<Record> predicate) throws StoreException {
        return store.findAll().stream()
            .filter(predicate)
            .collect(Collectors.toList());
    }

    /**
     * Records whose email matches a case-insensitive glob, where {@code *}
     * matches any run of characters and {@code ?} exactly one.
     */
    public List<Record> findByEmailPattern(String glob) throws StoreException {
        Pattern pattern = globToPattern(glob);
        return filter(record -> record.getEmail() != null && pattern.matcher(record.getEmail()).matches());
    }

    public CompletableFuture<Record> createAsync(String name, String email) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return create(name, email);
            } catch (InvalidInputException | StoreException e) {
                throw new CompletionException(e);
            }
        }, asyncExecutor);
    }

    public CompletableFuture<List<Record>> findAllAsync() {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return findAll();
            } catch (StoreException e) {
                throw new CompletionException(e);
            }
        }, asyncExecutor);
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }

    /**
     * Structural email check: exactly one {@code @} with something on both sides.
     */
    public static boolean validateEmail(String email) {
        if (email == null) {
            return false;
        }
        int at = email.indexOf('@');
        return at > 0
            && at == email.lastIndexOf('@')
            && at < email.length() - 1;
    }

    static Pattern globToPattern(String glob) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    }

    @Override
    public void close() {
        asyncExecutor.shutdown();
        try {
            if (!asyncExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                asyncExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            asyncExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        if (ownsStore) {
            store.close();
        }
        log.info("Record repository closed: {}", cache.stats());
    }

    private static final class RepositoryThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "record-repository-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
