package com.dpstore;

import com.dpstore.backend.memory.InMemoryBackend;
import com.dpstore.config.DpsConfig;
import com.dpstore.config.ServerEndpoint;
import com.dpstore.error.DpsException;
import com.dpstore.error.ErrorCode;
import com.dpstore.lock.Lock;
import com.dpstore.store.KeyValuePair;
import com.dpstore.store.Store;
import com.dpstore.store.StoreIterator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class DistributedProcessStoreTest {

    private InMemoryBackend backend;
    private DistributedProcessStore dps;
    private DistributedProcessStore peer;

    @BeforeEach
    void setUp() {
        backend = new InMemoryBackend();
        backend.connect(Collections.emptyList());
        dps = new DistributedProcessStore(backend);
        peer = new DistributedProcessStore(backend);
    }

    @AfterEach
    void tearDown() {
        backend.close();
    }

    @Test
    void storeLifecycle_ordersExample() throws Exception {
        Store orders = dps.createStore("orders", "int64", "rstring");
        orders.put("42", "shipped");

        assertThat(orders.get("42")).contains("shipped");
        assertThat(orders.has("42")).isTrue();
        assertThat(orders.size()).isEqualTo(1);

        Store seenByPeer = peer.findStore("orders");
        assertThat(seenByPeer).isEqualTo(orders);
        assertThat(seenByPeer.get("42")).contains("shipped");

        assertThat(orders.remove("42")).isTrue();
        assertThat(orders.size()).isZero();

        dps.removeStore(orders);
        assertThatThrownBy(() -> peer.findStore("orders"))
            .isInstanceOfSatisfying(DpsException.class,
                e -> assertThat(e.getCode()).isEqualTo(ErrorCode.DPS_STORE_DOES_NOT_EXIST));
    }

    @Test
    void createStore_twice_reportsExists() throws Exception {
        dps.createStore("orders", "int64", "rstring");

        assertThatThrownBy(() -> peer.createStore("orders", "int64", "rstring"))
            .isInstanceOfSatisfying(DpsException.class,
                e -> assertThat(e.getErrorCode()).isEqualTo(109));
        assertThat(peer.getMetrics().getErrorCount("DPS_STORE_EXISTS")).isEqualTo(1);
    }

    @Test
    void createOrGetStore_sameHandleFromBothContexts() throws Exception {
        Store first = dps.createOrGetStore("orders", "int64", "rstring");
        Store second = peer.createOrGetStore("orders", "int64", "rstring");

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(second.getStoreName()).isEqualTo("orders");
        assertThat(second.getKeyTypeName()).isEqualTo("int64");
        assertThat(second.getValueTypeName()).isEqualTo("rstring");
    }

    @Test
    void getStore_byId() throws Exception {
        Store orders = dps.createStore("orders", "int64", "rstring");

        assertThat(peer.getStore(orders.getId())).isEqualTo(orders);
        assertThatThrownBy(() -> peer.getStore(orders.getId() + 100))
            .isInstanceOfSatisfying(DpsException.class,
                e -> assertThat(e.getCode()).isEqualTo(ErrorCode.DPS_INVALID_STORE_ID_ERROR));
    }

    @Test
    void size_tracksPutsAndClear() throws Exception {
        Store store = dps.createStore("sizes", "rstring", "rstring");
        for (int i = 0; i < 20; i++) {
            store.put("k" + i, "v");
        }
        store.put("k0", "again");
        assertThat(store.size()).isEqualTo(20);

        store.clear();

        assertThat(store.size()).isZero();
        assertThat(dps.findStore("sizes")).isEqualTo(store);
        store.putSafe("after", "clear");
        assertThat(store.getSafe("after")).contains("clear");
    }

    @Test
    void iterator_seesEveryItem() throws Exception {
        Store store = dps.createStore("items", "rstring", "rstring");
        Set<String> expected = new HashSet<>();
        for (int i = 0; i < 30; i++) {
            store.put("key " + i, "value " + i);
            expected.add("key " + i);
        }

        Set<String> seen = new HashSet<>();
        StoreIterator it = store.newIterator();
        Optional<KeyValuePair> next;
        while ((next = it.getNext()).isPresent()) {
            seen.add(next.get().getKeyAsString());
        }
        dps.deleteIterator(store.getId(), it);

        assertThat(seen).isEqualTo(expected);
        assertThat(it.isClosed()).isTrue();
    }

    @Test
    void deleteIterator_wrongStore_throws() throws Exception {
        Store a = dps.createStore("a", "", "");
        Store b = dps.createStore("b", "", "");
        StoreIterator it = a.newIterator();

        assertThatThrownBy(() -> dps.deleteIterator(b.getId(), it))
            .isInstanceOfSatisfying(DpsException.class,
                e -> assertThat(e.getCode()).isEqualTo(ErrorCode.DPS_INVALID_STORE_ID_ERROR));
    }

    @Test
    void ttlNamespace_putGetRemove() throws Exception {
        dps.putTTL("session", "abc", 0);

        assertThat(peer.getTTL("session")).contains("abc");
        assertThat(peer.hasTTL("session")).isTrue();
        assertThat(peer.removeTTL("session")).isTrue();
        assertThat(dps.hasTTL("session")).isFalse();
        assertThat(dps.getTTL("session")).isEmpty();
    }

    @Test
    void lock_batchJobExample() throws Exception {
        Lock mine = dps.createOrGetLock("batch-job");
        Lock theirs = peer.createOrGetLock("batch-job");
        assertThat(theirs.getId()).isEqualTo(mine.getId());

        mine.acquireLock(5, 3);
        assertThat(peer.getPidForLock("batch-job")).isEqualTo(ProcessHandle.current().pid());

        long start = System.nanoTime();
        assertThatThrownBy(() -> theirs.acquireLock(5, 1))
            .isInstanceOfSatisfying(DpsException.class,
                e -> assertThat(e.getCode()).isEqualTo(ErrorCode.DL_GET_LOCK_TIMEOUT_ERROR));
        assertThat(System.nanoTime() - start).isGreaterThanOrEqualTo(900_000_000L);

        mine.releaseLock();
        assertThat(peer.getPidForLock("batch-job")).isZero();

        theirs.acquireLock(5, 1);
        theirs.releaseLock();
    }

    @Test
    void removeLock_freeLockIsGone() throws Exception {
        Lock lock = dps.createOrGetLock("temp");

        dps.removeLock(lock);

        assertThat(dps.getPidForLock("temp")).isZero();
        assertThatThrownBy(lock::acquireLock)
            .isInstanceOfSatisfying(DpsException.class,
                e -> assertThat(e.getCode()).isEqualTo(ErrorCode.DL_INVALID_LOCK_ID_ERROR));
    }

    @Test
    void runDataStoreCommand_unsupported() throws Exception {
        assertThat(dps.runDataStoreCommand("PING")).isEqualTo("PONG");

        assertThatThrownBy(() -> dps.runDataStoreCommand("FLUSHALL"))
            .isInstanceOfSatisfying(DpsException.class,
                e -> assertThat(e.getCode()).isEqualTo(ErrorCode.DPS_RUN_DATA_STORE_COMMAND_ERROR));
    }

    @Test
    void base64_helpers() {
        assertThat(DistributedProcessStore.base64Encode("orders")).isEqualTo("b3JkZXJz");
        assertThat(DistributedProcessStore.base64Decode("b3JkZXJz")).isEqualTo("orders");
    }

    @Test
    void productNameAndConnection() throws Exception {
        assertThat(dps.getNoSqlDbProductName()).isEqualTo(InMemoryBackend.NAME);
        assertThat(dps.isConnected()).isTrue();

        dps.reconnect();
        assertThat(dps.isConnected()).isTrue();

        dps.close();
        assertThat(dps.isConnected()).isFalse();
    }

    @Test
    void metrics_countOperations() throws Exception {
        Store store = dps.createStore("metered", "", "");
        dps.findStore("metered");
        dps.findStore("metered");

        assertThat(dps.getMetrics().getOperationCount("createStore")).isEqualTo(1);
        assertThat(dps.getMetrics().getOperationCount("findStore")).isEqualTo(2);
        assertThat(store.getId()).isPositive();
    }

    @Test
    void open_unknownBackend_reportsInitializeError() {
        assertThatThrownBy(() -> DistributedProcessStore.open(DpsConfig.of("nosuchdb")))
            .isInstanceOfSatisfying(DpsException.class,
                e -> assertThat(e.getCode()).isEqualTo(ErrorCode.DPS_INITIALIZE_ERROR));
    }

    @Test
    void open_memoryBackend() throws Exception {
        try (DistributedProcessStore local = DistributedProcessStore.open(DpsConfig.of("memory"))) {
            assertThat(local.isConnected()).isTrue();
            Store store = local.createOrGetStore("local", "", "");
            store.put("k", "v");
            assertThat(store.get("k")).contains("v");
        }
    }

    @Test
    void open_remoteBackend_sharesStateAcrossContexts() throws Exception {
        DpsServer server = new DpsServer(0, null);
        server.start();
        try {
            DpsConfig config = DpsConfig.of("dps-server", ServerEndpoint.of("localhost", server.getPort()));
            try (DistributedProcessStore a = DistributedProcessStore.open(config);
                 DistributedProcessStore b = DistributedProcessStore.open(config)) {
                assertThat(a.getNoSqlDbProductName()).isEqualTo("dps-server");

                Store orders = a.createOrGetStore("orders", "int64", "rstring");
                orders.put("42", "shipped");
                assertThat(b.findStore("orders").get("42")).contains("shipped");

                Lock lock = a.createOrGetLock("batch-job");
                lock.acquireLock(5, 3);
                assertThatThrownBy(() -> b.createOrGetLock("batch-job").acquireLock(5, 0))
                    .isInstanceOfSatisfying(DpsException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.DL_GET_LOCK_TIMEOUT_ERROR));
                lock.releaseLock();

                assertThatThrownBy(() -> a.runDataStoreCommand("FLUSHALL"))
                    .isInstanceOf(DpsException.class);
            }
        } finally {
            server.stop();
        }
    }

    @Test
    void open_remoteBackendWithoutToken_reportsAuthenticationError() throws Exception {
        DpsServer server = new DpsServer(0, "s3cret");
        server.start();
        try {
            DpsConfig config = DpsConfig.of("dps-server", ServerEndpoint.of("localhost", server.getPort()));

            assertThatThrownBy(() -> DistributedProcessStore.open(config))
                .isInstanceOfSatisfying(DpsException.class,
                    e -> assertThat(e.getCode()).isEqualTo(ErrorCode.DPS_AUTHENTICATION_ERROR));
        } finally {
            server.stop();
        }
    }
}
