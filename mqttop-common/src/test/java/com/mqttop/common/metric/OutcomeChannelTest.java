/**
 * 更新结果通道测试
 *
 * @author zhenglin
 * @date 2025/08/13
 */
package com.mqttop.common.metric;

import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 更新结果通道单元测试
 */
class OutcomeChannelTest {

    @Test
    void testSendAndReceiveInOrder() throws InterruptedException {
        OutcomeChannel channel = new OutcomeChannel();

        assertTrue(channel.send(UpdateOutcome.changed()));
        assertTrue(channel.send(UpdateOutcome.unchanged()));

        assertEquals(UpdateOutcome.Kind.CHANGED, channel.receive().orElseThrow().getKind());
        assertEquals(UpdateOutcome.Kind.UNCHANGED, channel.receive().orElseThrow().getKind());
        assertEquals(0, channel.size());
    }

    @Test
    void testFullChannelDropsOldest() throws InterruptedException {
        OutcomeChannel channel = new OutcomeChannel(2);

        channel.send(UpdateOutcome.changed());
        channel.send(UpdateOutcome.unchanged());
        channel.send(UpdateOutcome.rescanned());

        assertEquals(2, channel.size());
        assertEquals(1, channel.getDropped());
        assertEquals(UpdateOutcome.Kind.UNCHANGED, channel.receive().orElseThrow().getKind());
        assertEquals(UpdateOutcome.Kind.RESCANNED, channel.receive().orElseThrow().getKind());
    }

    @Test
    void testClosedChannelDrainsThenReturnsEmpty() throws InterruptedException {
        OutcomeChannel channel = new OutcomeChannel();
        channel.send(UpdateOutcome.changed());

        channel.close();

        assertTrue(channel.isClosed());
        assertFalse(channel.send(UpdateOutcome.changed()));
        assertTrue(channel.receive().isPresent());
        assertTrue(channel.receive().isEmpty());
    }

    @Test
    void testCloseWakesBlockedReceiver() throws Exception {
        OutcomeChannel channel = new OutcomeChannel();
        CompletableFuture<Optional<UpdateOutcome>> received = CompletableFuture.supplyAsync(() -> {
            try {
                return channel.receive();
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });

        Thread.sleep(50);
        channel.close();

        assertTrue(received.get(1, TimeUnit.SECONDS).isEmpty());
    }

    @Test
    void testPollTimesOut() throws InterruptedException {
        OutcomeChannel channel = new OutcomeChannel();

        assertTrue(channel.poll(20, TimeUnit.MILLISECONDS).isEmpty());
        assertFalse(channel.isClosed());
    }

    @Test
    void testInvalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new OutcomeChannel(0));
    }

    @Test
    void testFailedOutcomeKeepsCause() {
        IllegalStateException cause = new IllegalStateException("boom");

        UpdateOutcome outcome = UpdateOutcome.failed(cause);

        assertTrue(outcome.isFailed());
        assertSame(cause, outcome.getCause());
        assertFalse(UpdateOutcome.changed().isFailed());
    }
}
