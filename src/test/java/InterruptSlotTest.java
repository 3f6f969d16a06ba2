import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;

import com.lumen.session.CancellationToken;
import com.lumen.session.InterruptOutcome;
import com.lumen.session.InterruptSlot;

public class InterruptSlotTest {

    @Test
    void idle_slot_reports_idle() {
        InterruptSlot slot = new InterruptSlot();
        assertEquals(InterruptOutcome.Kind.IDLE, slot.interrupt("x").kind());
        assertEquals(InterruptOutcome.Kind.IDLE, slot.interrupt(null).kind());
        assertFalse(slot.isActive());
    }

    @Test
    void mismatched_id_is_not_interrupted() {
        InterruptSlot slot = new InterruptSlot();
        CancellationToken token = slot.begin("eval-1");
        try {
            assertEquals(InterruptOutcome.Kind.NO_MATCH, slot.interrupt("eval-2").kind());
            assertFalse(token.isCancelled());
            assertEquals("eval-1", slot.activeId());
        } finally {
            assertFalse(slot.end());
        }
    }

    @Test
    void matching_id_cancels_and_end_reports_interrupted() {
        InterruptSlot slot = new InterruptSlot();
        CancellationToken token = slot.begin("eval-1");

        InterruptOutcome outcome = slot.interrupt("eval-1");
        assertEquals(InterruptOutcome.Kind.INTERRUPTED, outcome.kind());
        assertEquals("eval-1", outcome.taskId());
        assertTrue(token.isCancelled());

        // A second interrupt must not announce the same task again.
        assertEquals(InterruptOutcome.Kind.IDLE, slot.interrupt("eval-1").kind());

        assertTrue(slot.end());
        assertFalse(Thread.interrupted(), "end() clears the interrupt delivered to the worker");
        assertFalse(slot.isActive());
    }

    @Test
    void absent_id_matches_whatever_runs() {
        InterruptSlot slot = new InterruptSlot();
        slot.begin("anything");
        InterruptOutcome outcome = slot.interrupt(null);
        assertEquals(InterruptOutcome.Kind.INTERRUPTED, outcome.kind());
        assertEquals("anything", outcome.taskId());
        assertTrue(slot.end());
        Thread.interrupted();
    }

    @Test
    void finished_task_is_never_reported_as_interrupted() {
        InterruptSlot slot = new InterruptSlot();
        slot.begin("eval-1");
        assertFalse(slot.end());
        assertEquals(InterruptOutcome.Kind.IDLE, slot.interrupt("eval-1").kind());
    }

    @Test
    void begin_while_active_fails() {
        InterruptSlot slot = new InterruptSlot();
        slot.begin("a");
        try {
            assertThrows(IllegalStateException.class, () -> slot.begin("b"));
        } finally {
            slot.end();
        }
    }

    @Test
    void cancel_wakes_blocked_worker() throws Exception {
        InterruptSlot slot = new InterruptSlot();
        CountDownLatch started = new CountDownLatch(1);
        AtomicBoolean woke = new AtomicBoolean(false);
        AtomicReference<Boolean> endResult = new AtomicReference<>();

        Thread worker = new Thread(() -> {
            slot.begin("sleepy");
            try {
                started.countDown();
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                woke.set(true);
            } finally {
                endResult.set(slot.end());
            }
        });
        worker.start();
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertEquals(InterruptOutcome.Kind.INTERRUPTED, slot.interrupt("sleepy").kind());
        worker.join(5000);

        assertFalse(worker.isAlive());
        assertTrue(woke.get());
        assertTrue(endResult.get());
    }

    @Test
    void racing_interrupts_and_end_agree() throws Exception {
        for (int round = 0; round < 200; round++) {
            InterruptSlot slot = new InterruptSlot();
            CountDownLatch go = new CountDownLatch(1);
            AtomicReference<InterruptOutcome> outcome = new AtomicReference<>();
            AtomicReference<Boolean> ended = new AtomicReference<>();

            Thread worker = new Thread(() -> {
                slot.begin("t");
                go.countDown();
                ended.set(slot.end());
            });
            Thread interrupter = new Thread(() -> {
                try {
                    go.await();
                } catch (InterruptedException e) {
                    return;
                }
                outcome.set(slot.interrupt("t"));
            });
            worker.start();
            interrupter.start();
            worker.join(5000);
            interrupter.join(5000);

            boolean announced = outcome.get().kind() == InterruptOutcome.Kind.INTERRUPTED;
            assertEquals(announced, ended.get(), "interrupt announcement and end() must agree");
        }
    }

    @Test
    void interrupt_waits_for_a_send_in_progress_and_blocks_later_ones() throws Exception {
        InterruptSlot slot = new InterruptSlot();
        CountDownLatch inside = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch interruptReturned = new CountDownLatch(1);
        AtomicBoolean sent = new AtomicBoolean();
        AtomicBoolean sentAfterInterrupt = new AtomicBoolean(true);
        AtomicBoolean sentWhenInterruptReturned = new AtomicBoolean();

        Thread worker = new Thread(() -> {
            CancellationToken token = slot.begin("eval-1");
            try {
                token.runUnlessCancelled(() -> {
                    inside.countDown();
                    try {
                        release.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    sent.set(true);
                });
                while (!token.isCancelled()) Thread.onSpinWait();
                sentAfterInterrupt.set(token.runUnlessCancelled(() -> {}));
            } finally {
                slot.end();
            }
        });
        worker.start();
        assertTrue(inside.await(5, TimeUnit.SECONDS));

        Thread interrupter = new Thread(() -> {
            slot.interrupt("eval-1");
            sentWhenInterruptReturned.set(sent.get());
            interruptReturned.countDown();
        });
        interrupter.start();

        assertFalse(interruptReturned.await(100, TimeUnit.MILLISECONDS));
        release.countDown();
        assertTrue(interruptReturned.await(5, TimeUnit.SECONDS));
        worker.join(5000);

        assertTrue(sentWhenInterruptReturned.get());
        assertFalse(sentAfterInterrupt.get());
    }
}
