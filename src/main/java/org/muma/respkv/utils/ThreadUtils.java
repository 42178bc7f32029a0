package org.muma.respkv.utils;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 线程工厂与管理工具
 */
public class ThreadUtils {

    private ThreadUtils() {
    }

    public static ThreadFactory namedThreadFactory(String prefix) {
        return new RespKvThreadFactory(prefix, false);
    }

    public static ThreadFactory daemonThreadFactory(String prefix) {
        return new RespKvThreadFactory(prefix, true);
    }

    private static class RespKvThreadFactory implements ThreadFactory {
        private final String prefix;
        private final boolean daemon;
        private final AtomicInteger counter = new AtomicInteger(1);

        RespKvThreadFactory(String prefix, boolean daemon) {
            this.prefix = prefix;
            this.daemon = daemon;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + counter.getAndIncrement());
            t.setDaemon(daemon);
            return t;
        }
    }
}
