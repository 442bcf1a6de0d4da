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

package com.stimulussoft.messagequeue.processor;

import com.stimulussoft.messagequeue.QueueBrokerException;
import com.stimulussoft.messagequeue.QueueNotFoundException;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

public class QueueTableTest {

    @Test
    public void createIsIdempotent() {
        QueueTable<String> table = new QueueTable<>();
        AtomicInteger created = new AtomicInteger();
        QueueRecord<String> first = table.create("orders", () -> "handle-" + created.incrementAndGet());
        QueueRecord<String> second = table.create("orders", () -> "handle-" + created.incrementAndGet());
        Assert.assertSame(first, second);
        Assert.assertEquals(1, created.get());
        Assert.assertEquals("handle-1", table.get("orders").getHandle());
        Assert.assertEquals(1, table.size());
    }

    @Test(expected = QueueNotFoundException.class)
    public void unknownQueue() {
        new QueueTable<String>().get("missing");
    }

    @Test
    public void listenersAreCounted() throws QueueBrokerException {
        QueueTable<String> table = new QueueTable<>();
        table.create("orders", () -> "orders");
        Assert.assertEquals(1, table.addListener("orders", handle -> { }));
        Assert.assertEquals(2, table.addListener("orders", handle -> { }));
        Assert.assertEquals(2, table.listenerCount("orders"));
        Assert.assertEquals(0, table.listenerCount("missing"));
    }

    @Test
    public void failedRegistrationIsNotCounted() {
        QueueTable<String> table = new QueueTable<>();
        table.create("orders", () -> "orders");
        try {
            table.addListener("orders", handle -> {
                throw new QueueBrokerException("no channel");
            });
            Assert.fail("registration failure must propagate");
        } catch (QueueBrokerException e) {
            Assert.assertEquals("no channel", e.getMessage());
        }
        Assert.assertEquals(0, table.listenerCount("orders"));
    }

    @Test
    public void removeDetachesRecord() throws QueueBrokerException {
        QueueTable<String> table = new QueueTable<>();
        table.create("orders", () -> "orders");
        table.addListener("orders", handle -> { });
        QueueRecord<String> removed = table.remove("orders");
        Assert.assertEquals(1, removed.getListeners());
        Assert.assertFalse(table.contains("orders"));
        Assert.assertEquals(0, table.listenerCount("orders"));
        Assert.assertNull(table.remove("orders"));
        table.create("orders", () -> "orders");
        Assert.assertEquals(0, table.listenerCount("orders"));
    }

    @Test
    public void subscriberRacingRemoveIsCountedOrRejected() throws Exception {
        QueueTable<String> table = new QueueTable<>();
        table.create("orders", () -> "orders");
        int subscribers = 16;
        AtomicInteger registered = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        CountDownLatch go = new CountDownLatch(1);
        List<Thread> threads = new ArrayList<>();
        for (int i = 0; i < subscribers; i++) {
            Thread thread = new Thread(() -> {
                try {
                    go.await();
                    table.addListener("orders", handle -> registered.incrementAndGet());
                } catch (QueueNotFoundException e) {
                    rejected.incrementAndGet();
                } catch (Exception e) {
                    throw new RuntimeException(e);
                }
            });
            thread.start();
            threads.add(thread);
        }
        go.countDown();
        QueueRecord<String> removed = table.remove("orders");
        for (Thread thread : threads)
            thread.join();
        Assert.assertEquals(registered.get(), removed.getListeners());
        Assert.assertEquals(subscribers, registered.get() + rejected.get());
    }
}
