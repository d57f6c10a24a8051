package io.github.hongjungwan.zkvault.core.internal;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 공용 I/O Executor. 저장소 왕복과 복호화 fan-out 전용 데몬 스레드 풀.
 */
public final class VaultExecutors {

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private static final ExecutorService SHARED = Executors.newCachedThreadPool(daemonFactory("zkvault-io"));

    private VaultExecutors() {}

    public static ExecutorService shared() {
        return SHARED;
    }

    static ThreadFactory daemonFactory(String prefix) {
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + THREAD_COUNTER.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
