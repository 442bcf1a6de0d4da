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

package com.stimulussoft.messagequeue;

import org.junit.Assert;
import org.junit.Test;

public class MessageTest {

    @Test
    public void repeatCountDefaultsToZero() {
        Message message = Message.of("index-concept");
        Assert.assertEquals(0, message.getRepeatCount());
        Assert.assertFalse(message.isQuit());
    }

    @Test
    public void withRepeatCountLeavesOriginalUntouched() {
        Message message = Message.of("charge").put("order_id", "O1");
        Message retry = message.withRepeatCount(2);
        retry.put("note", "changed");

        Assert.assertEquals(0, message.getRepeatCount());
        Assert.assertNull(message.get("note"));
        Assert.assertEquals(2, retry.getRepeatCount());
        Assert.assertEquals("O1", retry.get("order_id"));
        Assert.assertEquals("charge", retry.getAction());
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeRepeatCountIsRejected() {
        Message.of("charge").setRepeatCount(-1);
    }

    @Test(expected = UnsupportedOperationException.class)
    public void payloadViewIsReadOnly() {
        Message.of("charge").getPayload().put("order_id", "O1");
    }

    @Test
    public void envelopeFieldsNeverEnterPayload() {
        Message message = Message.of("charge").put("repeat-count", 2).put("action", "refund").put("order_id", "O1");
        Assert.assertEquals(2, message.getRepeatCount());
        Assert.assertEquals("refund", message.getAction());
        Assert.assertEquals(1, message.getPayload().size());
        Assert.assertEquals(3, message.withRepeatCount(3).getRepeatCount());

        Assert.assertTrue(Message.of("charge").put("action", "quit").isQuit());
    }

    @Test(expected = IllegalArgumentException.class)
    public void repeatCountFieldMustBeInteger() {
        Message.of("charge").put("repeat-count", "3");
    }

    @Test
    public void quitSentinel() {
        Assert.assertTrue(Message.quit().isQuit());
        Assert.assertEquals(Message.QUIT_ACTION, Message.quit().getAction());
        Assert.assertEquals(Message.quit(), Message.of("quit"));
    }
}
