package io.blogapi.server.core;

import io.blogapi.server.spi.RegisterOutcome;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryCredentialStoreTest {

    private final InMemoryCredentialStore store = new InMemoryCredentialStore(new BCryptPasswordHasher(4));

    @Test
    void registerStoresHashNotPlaintext() {
        RegisterOutcome out = store.register("alice", "a@x.io", "pw1");

        assertThat(out.status()).isEqualTo(RegisterOutcome.Status.CREATED);
        assertThat(out.user().passwordHash()).isNotEqualTo("pw1").startsWith("$2");
        assertThat(store.exists("alice")).isTrue();
        assertThat(store.exists("bob")).isFalse();
    }

    @Test
    void duplicateUsernameIsRejected() {
        store.register("alice", "a@x.io", "pw1");

        assertThat(store.register("alice", "other@x.io", "pw2").status())
                .isEqualTo(RegisterOutcome.Status.USERNAME_TAKEN);
        assertThat(store.verify("alice", "pw1")).isTrue();
    }

    @Test
    void usernamesAreCaseSensitive() {
        store.register("alice", "a@x.io", "pw1");

        assertThat(store.register("Alice", "a@x.io", "pw1").status()).isEqualTo(RegisterOutcome.Status.CREATED);
    }

    @Test
    void verifyRejectsWrongPasswordAndUnknownUser() {
        store.register("alice", "a@x.io", "pw1");

        assertThat(store.verify("alice", "pw1")).isTrue();
        assertThat(store.verify("alice", "nope")).isFalse();
        assertThat(store.verify("nobody", "pw1")).isFalse();
        assertThat(store.verify(null, "pw1")).isFalse();
    }

    @Test
    void concurrentRegistrationCreatesExactlyOnce() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<RegisterOutcome>> tasks = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                tasks.add(() -> store.register("race", "r@x.io", "pw"));
            }
            long created = 0;
            for (Future<RegisterOutcome> f : pool.invokeAll(tasks)) {
                if (f.get().status() == RegisterOutcome.Status.CREATED) created++;
            }
            assertThat(created).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
