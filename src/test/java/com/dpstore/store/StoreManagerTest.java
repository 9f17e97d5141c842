package com.dpstore.store;

import com.dpstore.backend.memory.InMemoryBackend;
import com.dpstore.error.DpsException;
import com.dpstore.error.ErrorCode;
import com.dpstore.keys.KeySchema;
import com.dpstore.lock.LockManager;
import com.dpstore.util.MetricsCollector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

class StoreManagerTest {

    private FlakyBackend backend;
    private LockManager lockManager;
    private StoreManager stores;
    private DataItemEngine items;

    @BeforeEach
    void setUp() {
        backend = new FlakyBackend();
        lockManager = new LockManager(backend, new MetricsCollector());
        stores = new StoreManager(backend, lockManager, nanos -> { });
        items = new DataItemEngine(backend, stores, lockManager);
    }

    @AfterEach
    void tearDown() {
        backend.close();
    }

    @Test
    void createStore_writesNameMappingAndReservedFields() throws Exception {
        long id = stores.createStore("orders", "int64", "rstring");

        assertThat(backend.read(KeySchema.storeNameKey("orders")))
            .hasValueSatisfying(v -> assertThat(new String(v, StandardCharsets.UTF_8)).isEqualTo(Long.toString(id)));
        assertThat(backend.fieldCount(KeySchema.storeContentsKey(id))).isEqualTo(KeySchema.RESERVED_FIELD_COUNT);
        assertThat(stores.getStoreName(id)).isEqualTo("orders");
        assertThat(stores.getKeyTypeName(id)).isEqualTo("int64");
        assertThat(stores.getValueTypeName(id)).isEqualTo("rstring");
        assertThat(stores.size(id)).isZero();
    }

    @Test
    void createStore_duplicateName_throws() throws Exception {
        stores.createStore("orders", "int64", "rstring");

        assertThatThrownBy(() -> stores.createStore("orders", "int64", "rstring"))
            .isInstanceOfSatisfying(DpsException.class,
                e -> assertThat(e.getCode()).isEqualTo(ErrorCode.DPS_STORE_EXISTS));
    }

    @Test
    void createStore_distinctIds() throws Exception {
        long a = stores.createStore("a", "", "");
        long b = stores.createStore("b", "", "");

        assertThat(a).isNotEqualTo(b);
    }

    @Test
    void createStore_nameWithSpacesAndUnicode() throws Exception {
        long id = stores.createStore("my store ✓", "tuple<int32 a>", "list<rstring>");

        assertThat(stores.findStore("my store ✓")).isEqualTo(id);
        assertThat(stores.getStoreName(id)).isEqualTo("my store ✓");
        assertThat(stores.getKeyTypeName(id)).isEqualTo("tuple<int32 a>");
    }

    @Test
    void createStore_emptyName_throws() {
        assertThatThrownBy(() -> stores.createStore("", "a", "b"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void createStore_metadataWriteFails_undoesEarlierWrites() {
        backend.failSetFieldOn = KeySchema.FIELD_KEY_TYPE;

        assertThatThrownBy(() -> stores.createStore("orders", "int64", "rstring"))
            .isInstanceOfSatisfying(DpsException.class,
                e -> assertThat(e.getCode()).isEqualTo(ErrorCode.DPS_STORE_HASH_METADATA2_CREATION_ERROR));
        assertThat(backend.read(KeySchema.storeNameKey("orders"))).isEmpty();
        assertThat(backend.size()).isEqualTo(1); // only the id counter remains
    }

    @Test
    void createStore_undoFails_reportsFatal() {
        backend.failSetFieldOn = KeySchema.FIELD_VALUE_TYPE;
        backend.failDeletePrefix = KeySchema.TAG_STORE_NAME;

        assertThatThrownBy(() -> stores.createStore("orders", "int64", "rstring"))
            .isInstanceOfSatisfying(DpsException.class,
                e -> assertThat(e.getCode()).isEqualTo(ErrorCode.DPS_STORE_FATAL_ERROR));
    }

    @Test
    void createOrGetStore_returnsExistingId() throws Exception {
        long first = stores.createOrGetStore("orders", "int64", "rstring");
        long second = stores.createOrGetStore("orders", "other", "types");

        assertThat(second).isEqualTo(first);
        assertThat(stores.getKeyTypeName(first)).isEqualTo("int64");
    }

    @Test
    void findStore_missing_throws() {
        assertThatThrownBy(() -> stores.findStore("nope"))
            .isInstanceOfSatisfying(DpsException.class,
                e -> assertThat(e.getCode()).isEqualTo(ErrorCode.DPS_STORE_DOES_NOT_EXIST));
    }

    @Test
    void removeStore_deletesContainerAndName() throws Exception {
        long id = stores.createStore("orders", "int64", "rstring");
        items.put(id, bytes("1"), bytes("x"));

        stores.removeStore(id);

        assertThat(stores.storeExists(id)).isFalse();
        assertThat(stores.findStoreId("orders")).isEmpty();
        assertThat(backend.fieldCount(KeySchema.storeContentsKey(id))).isZero();
        assertThat(stores.createStore("orders", "int64", "rstring")).isNotEqualTo(id);
    }

    @Test
    void removeStore_unknownId_throws() {
        assertThatThrownBy(() -> stores.removeStore(12345))
            .isInstanceOfSatisfying(DpsException.class,
                e -> assertThat(e.getCode()).isEqualTo(ErrorCode.DPS_INVALID_STORE_ID_ERROR));
    }

    @Test
    void clear_dropsItemsKeepsIdentity() throws Exception {
        long id = stores.createStore("orders", "int64", "rstring");
        for (int i = 0; i < 10; i++) {
            items.put(id, bytes("k" + i), bytes("v" + i));
        }
        assertThat(stores.size(id)).isEqualTo(10);

        stores.clear(id);

        assertThat(stores.size(id)).isZero();
        assertThat(stores.findStore("orders")).isEqualTo(id);
        assertThat(stores.getStoreName(id)).isEqualTo("orders");
        assertThat(stores.getValueTypeName(id)).isEqualTo("rstring");
        assertThat(items.get(id, bytes("k1"))).isEmpty();
    }

    @Test
    void clear_reservedFieldNeverRestored_reportsFatal() throws Exception {
        long id = stores.createStore("orders", "int64", "rstring");
        backend.failSetFieldOn = KeySchema.FIELD_KEY_TYPE;

        assertThatThrownBy(() -> stores.clear(id))
            .isInstanceOfSatisfying(DpsException.class,
                e -> assertThat(e.getCode()).isEqualTo(ErrorCode.DPS_STORE_FATAL_ERROR));
        assertThat(backend.setFieldFailures).isEqualTo(StoreManager.METADATA_WRITE_ATTEMPTS);
    }

    @Test
    void clear_transientWriteFailure_isRetried() throws Exception {
        long id = stores.createStore("orders", "int64", "rstring");
        backend.failSetFieldOn = KeySchema.FIELD_VALUE_TYPE;
        backend.remainingFailures = 2;

        stores.clear(id);

        assertThat(stores.getValueTypeName(id)).isEqualTo("rstring");
        assertThat(backend.setFieldFailures).isEqualTo(2);
    }

    @Test
    void size_unknownStore_throws() {
        assertThatThrownBy(() -> stores.size(42))
            .isInstanceOfSatisfying(DpsException.class,
                e -> assertThat(e.getCode()).isEqualTo(ErrorCode.DPS_INVALID_STORE_ID_ERROR));
    }

    @Test
    void getItemKeys_skipsReservedFields() throws Exception {
        long id = stores.createStore("orders", "int64", "rstring");
        items.put(id, bytes("alpha"), bytes("1"));
        items.put(id, bytes("dps_name_of_this_store"), bytes("2"));

        List<String> keys = stores.getItemKeys(id).stream()
            .map(k -> new String(k, StandardCharsets.UTF_8))
            .collect(Collectors.toList());

        assertThat(keys).containsExactlyInAnyOrder("alpha", "dps_name_of_this_store");
        assertThat(stores.size(id)).isEqualTo(2);
    }

    @Test
    void getStoreName_unknownStore_throws() {
        assertThatThrownBy(() -> stores.getStoreName(42))
            .isInstanceOfSatisfying(DpsException.class,
                e -> assertThat(e.getCode()).isEqualTo(ErrorCode.DPS_GET_STORE_NAME_ERROR));
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * In-memory backend that can be told to fail field writes and deletes.
     */
    static class FlakyBackend extends InMemoryBackend {
        volatile String failSetFieldOn;
        volatile int remainingFailures = Integer.MAX_VALUE;
        volatile String failDeletePrefix;
        int setFieldFailures;

        @Override
        public void setField(String containerKey, String field, byte[] value) {
            if (field.equals(failSetFieldOn) && remainingFailures > 0) {
                remainingFailures--;
                setFieldFailures++;
                throw new IllegalStateException("injected write failure");
            }
            super.setField(containerKey, field, value);
        }

        @Override
        public boolean delete(String key) {
            if (failDeletePrefix != null && key.startsWith(failDeletePrefix)) {
                throw new IllegalStateException("injected delete failure");
            }
            return super.delete(key);
        }
    }
}
