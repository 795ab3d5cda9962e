package com.recordcache.repository;

import com.recordcache.cache.BoundedCache;
import com.recordcache.config.RecordCacheConfig;
import com.recordcache.exception.InvalidInputException;
import com.recordcache.exception.StoreException;
import com.recordcache.model.Record;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordRepositoryTest {

    private CountingRecordStore store;
    private BoundedCache<Long, Record> cache;
    private RecordRepository repository;

    @BeforeEach
    void setUp() {
        store = new CountingRecordStore();
        cache = new BoundedCache<>(8);
        repository = new RecordRepository(store, cache, 2);
    }

    @AfterEach
    void tearDown() {
        repository.close();
    }

    @Nested
    @DisplayName("findById")
    class FindById {

        @Test
        @DisplayName("a miss loads from the store and caches the record")
        void missPopulatesCache() throws Exception {
            Record ada = store.seed("Ada", "ada@example.com");

            assertThat(repository.findById(ada.getId())).contains(ada);
            assertThat(repository.findById(ada.getId())).contains(ada);

            assertThat(store.fetchCalls.get()).isEqualTo(1);
            assertThat(cache.contains(ada.getId())).isTrue();
        }

        @Test
        @DisplayName("absent records are not cached")
        void noNegativeCaching() throws Exception {
            assertThat(repository.findById(404)).isEmpty();
            assertThat(repository.findById(404)).isEmpty();

            assertThat(store.fetchCalls.get()).isEqualTo(2);
            assertThat(cache.contains(404L)).isFalse();
        }

        @Test
        @DisplayName("store failure propagates and caches nothing")
        void storeFailurePropagates() {
            store.seed("Ada", "ada@example.com");
            store.failWith(true);

            assertThatThrownBy(() -> repository.findById(1))
                .isInstanceOf(StoreException.class);
            assertThat(cache.isEmpty()).isTrue();
        }

        @Test
        void hitsShowUpInStats() throws Exception {
            Record ada = store.seed("Ada", "ada@example.com");

            repository.findById(ada.getId());
            repository.findById(ada.getId());

            assertThat(repository.cacheStats().getHitCount()).isEqualTo(1);
            assertThat(repository.cacheStats().getMissCount()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        void persistsAndCaches() throws Exception {
            Record ada = repository.create("Ada", "ada@example.com");

            assertThat(ada.getId()).isPositive();
            assertThat(store.insertCalls.get()).isEqualTo(1);
            assertThat(repository.findById(ada.getId())).contains(ada);
            assertThat(store.fetchCalls.get()).isZero();
        }

        @Test
        @DisplayName("empty name is rejected before the store is touched")
        void rejectsEmptyName() {
            assertThatThrownBy(() -> repository.create("", "a@b"))
                .isInstanceOf(InvalidInputException.class)
                .hasFieldOrPropertyWithValue("field", "name");

            assertThat(store.totalCalls()).isZero();
            assertThat(cache.isEmpty()).isTrue();
        }

        @ParameterizedTest
        @ValueSource(strings = {"noatsign", "@example.com", "ada@", "a@b@c", ""})
        @DisplayName("malformed email is rejected before the store is touched")
        void rejectsMalformedEmail(String email) {
            assertThatThrownBy(() -> repository.create("x", email))
                .isInstanceOf(InvalidInputException.class)
                .hasFieldOrPropertyWithValue("field", "email");

            assertThat(store.totalCalls()).isZero();
        }

        @Test
        void storeFailureLeavesCacheEmpty() {
            store.failWith(true);

            assertThatThrownBy(() -> repository.create("Ada", "ada@example.com"))
                .isInstanceOf(StoreException.class)
                .hasMessage("store unavailable");
            assertThat(cache.isEmpty()).isTrue();
        }
    }

    @Nested
    @DisplayName("update")
    class Update {

        @Test
        @DisplayName("update invalidates so the next read re-fetches")
        void invalidatesCachedEntry() throws Exception {
            Record ada = store.seed("Ada", "ada@example.com");
            repository.findById(ada.getId());
            assertThat(store.fetchCalls.get()).isEqualTo(1);

            Record renamed = ada.withName("Ada Lovelace");
            assertThat(repository.update(renamed)).isTrue();

            assertThat(cache.contains(ada.getId())).isFalse();
            assertThat(repository.findById(ada.getId())).contains(renamed);
            assertThat(store.fetchCalls.get()).isEqualTo(2);
        }

        @Test
        void unknownRecordReturnsFalse() throws Exception {
            assertThat(repository.update(new Record(77, "Ghost", "ghost@example.com"))).isFalse();
        }

        @Test
        @DisplayName("a failed update keeps the cached value")
        void failedUpdateKeepsCache() throws Exception {
            Record ada = repository.create("Ada", "ada@example.com");
            store.failWith(true);

            assertThatThrownBy(() -> repository.update(ada.withName("Nope")))
                .isInstanceOf(StoreException.class);
            assertThat(cache.get(ada.getId())).contains(ada);
        }
    }

    @Nested
    @DisplayName("deleteById")
    class DeleteById {

        @Test
        void removesFromStoreAndCache() throws Exception {
            Record ada = repository.create("Ada", "ada@example.com");

            assertThat(repository.deleteById(ada.getId())).isTrue();

            assertThat(cache.contains(ada.getId())).isFalse();
            assertThat(repository.findById(ada.getId())).isEmpty();
        }

        @Test
        @DisplayName("deleting an absent id is harmless and returns false")
        void idempotent() throws Exception {
            Record ada = repository.create("Ada", "ada@example.com");
            repository.deleteById(ada.getId());

            assertThat(repository.deleteById(ada.getId())).isFalse();
            assertThat(repository.deleteById(12345)).isFalse();
        }
    }

    @Nested
    @DisplayName("writes racing a read-through load")
    class RacingWrites {

        private ExecutorService loader;

        @BeforeEach
        void startLoader() {
            loader = Executors.newSingleThreadExecutor();
        }

        @AfterEach
        void stopLoader() {
            loader.shutdownNow();
        }

        @Test
        @DisplayName("an update during a miss leaves no stale record cached")
        void updateDuringLoad() throws Exception {
            Record ada = store.seed("Ada", "ada@example.com");
            CountingRecordStore.Pause pause = store.pauseNextFetch();

            Future<Optional<Record>> pending = loader.submit(() -> repository.findById(ada.getId()));
            pause.awaitReached();
            Record renamed = ada.withName("Ada Lovelace");
            assertThat(repository.update(renamed)).isTrue();
            pause.release.countDown();

            assertThat(pending.get(10, TimeUnit.SECONDS)).contains(ada);
            assertThat(cache.contains(ada.getId())).isFalse();
            assertThat(repository.findById(ada.getId())).contains(renamed);
            assertThat(store.fetchCalls.get()).isEqualTo(2);
        }

        @Test
        @DisplayName("a delete during a miss leaves nothing cached")
        void deleteDuringLoad() throws Exception {
            Record ada = store.seed("Ada", "ada@example.com");
            CountingRecordStore.Pause pause = store.pauseNextFetch();

            Future<Optional<Record>> pending = loader.submit(() -> repository.findById(ada.getId()));
            pause.awaitReached();
            assertThat(repository.deleteById(ada.getId())).isTrue();
            pause.release.countDown();

            assertThat(pending.get(10, TimeUnit.SECONDS)).contains(ada);
            assertThat(repository.findById(ada.getId())).isEmpty();
        }

        @Test
        @DisplayName("a delete landing between insert and caching wins")
        void deleteDuringCreate() throws Exception {
            CountingRecordStore.Pause pause = store.pauseNextInsert();

            Future<Record> pending = loader.submit(() -> repository.create("Ada", "ada@example.com"));
            pause.awaitReached();
            // the store hands out ids from 1
            assertThat(repository.deleteById(1)).isTrue();
            pause.release.countDown();

            Record ada = pending.get(10, TimeUnit.SECONDS);
            assertThat(ada.getId()).isEqualTo(1);
            assertThat(cache.contains(1L)).isFalse();
            assertThat(repository.findById(1)).isEmpty();
        }
    }

    @Nested
    @DisplayName("queries")
    class Queries {

        @BeforeEach
        void seed() {
            store.seed("Ada", "ada@example.com");
            store.seed("Bob", "bob@example.org");
            store.seed("Cy", "CY@EXAMPLE.COM");
        }

        @Test
        void findByEmailPatternIsCaseInsensitiveGlob() throws Exception {
            List<Record> matches = repository.findByEmailPattern("*@example.com");

            assertThat(matches).extracting(Record::getName).containsExactly("Ada", "Cy");
        }

        @Test
        void questionMarkMatchesOneCharacter() throws Exception {
            assertThat(repository.findByEmailPattern("?ob@*")).extracting(Record::getName).containsExactly("Bob");
            assertThat(repository.findByEmailPattern("?b@*")).isEmpty();
        }

        @Test
        @DisplayName("regex metacharacters in the pattern are literal")
        void dotIsLiteral() throws Exception {
            assertThat(repository.findByEmailPattern("bob@example.org")).hasSize(1);
            assertThat(repository.findByEmailPattern("bob@exampleXorg")).isEmpty();
        }

        @Test
        void filterAppliesPredicate() throws Exception {
            assertThat(repository.filter(r -> r.getName().length() == 2))
                .extracting(Record::getName)
                .containsExactly("Cy");
        }

        @Test
        void findAllAsyncReturnsEveryRecord() throws Exception {
            List<Record> all = repository.findAllAsync().get(5, TimeUnit.SECONDS);

            assertThat(all).hasSize(3);
        }
    }

    @Nested
    @DisplayName("async create")
    class AsyncCreate {

        @Test
        void completesWithCreatedRecord() throws Exception {
            Record ada = repository.createAsync("Ada", "ada@example.com").get(5, TimeUnit.SECONDS);

            assertThat(cache.contains(ada.getId())).isTrue();
        }

        @Test
        void invalidInputCompletesExceptionally() {
            CompletableFuture<Record> future = repository.createAsync("", "ada@example.com");

            assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(InvalidInputException.class);
            assertThat(store.totalCalls()).isZero();
        }
    }

    @Test
    @DisplayName("open builds a working repository from configuration")
    void openFromConfig() throws Exception {
        RecordCacheConfig config = RecordCacheConfig.builder().cacheCapacity(2).asyncThreads(1).build();

        try (RecordRepository opened = RecordRepository.open(config)) {
            Record ada = opened.create("Ada", "ada@example.com");
            Optional<Record> found = opened.findById(ada.getId());

            assertThat(found).contains(ada);
            assertThat(opened.cacheStats().getCapacity()).isEqualTo(2);
        }
    }

    @Test
    void validateEmail() {
        assertThat(RecordRepository.validateEmail("a@b")).isTrue();
        assertThat(RecordRepository.validateEmail("noatsign")).isFalse();
        assertThat(RecordRepository.validateEmail(null)).isFalse();
    }
}
