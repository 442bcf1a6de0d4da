/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an &quot;AS IS&quot; BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.stimulussoft.util;

import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public class ThreadUtil {

    public static ThreadFactory getFlexibleThreadFactory(String name) {
        return new FlexibleThreadFactory(name, false);
    }

    public static ThreadFactory getFlexibleThreadFactory(String name, boolean daemon) {
        return new FlexibleThreadFactory(name, daemon);
    }

    /**
     * Unbounded pool creating one named thread per concurrently running task. Idle threads are reclaimed.
     *
     * @param name   thread name prefix
     * @param daemon whether threads are daemon threads
     * @return listening executor
     */
    public static ListeningExecutorService newCachedThreadPool(String name, boolean daemon) {
        return MoreExecutors.listeningDecorator(Executors.newCachedThreadPool(getFlexibleThreadFactory(name, daemon)));
    }

    public static void shutdownAndAwaitTermination(ExecutorService pool, long timeout, TimeUnit timeUnit) throws InterruptedException {
        pool.shutdown(); // Disable new tasks from being submitted
        try {
            // Wait a while for existing tasks to terminate
            if (!pool.awaitTermination(timeout, timeUnit)) {
                pool.shutdownNow(); // Cancel currently executing tasks
                pool.awaitTermination(timeout, timeUnit);
            }
        } catch (InterruptedException ie) {
            pool.shutdownNow();
            throw ie;
        }
    }

    private static class FlexibleThreadFactory implements ThreadFactory {

        private final AtomicInteger threadNumber = new AtomicInteger(1);
        protected String name;
        protected boolean daemon;

        public FlexibleThreadFactory(String name, boolean daemon) {
            this.name = name;
            this.daemon = daemon;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = Executors.defaultThreadFactory().newThread(r);
            t.setDaemon(daemon);
            t.setName(name + "-" + threadNumber.getAndIncrement());
            return t;
        }

    }

}
