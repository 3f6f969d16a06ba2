import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.lumen.session.TaskQueue;

public class TaskQueueTest {

    @Test
    void fifo_order_and_persistence() {
        TaskQueue<String> empty = TaskQueue.empty();
        TaskQueue<String> q = empty.enqueue("a").enqueue("b").enqueue("c");

        assertTrue(empty.isEmpty());
        assertEquals(3, q.size());
        assertEquals("a", q.peek());

        TaskQueue<String> rest = q.pop();
        assertEquals("b", rest.peek());
        assertEquals("a", q.peek()); // original untouched

        TaskQueue<String> more = rest.enqueue("d").pop().pop();
        assertEquals("d", more.peek());
        assertEquals(1, more.size());
        assertTrue(more.pop().isEmpty());
    }

    @Test
    void pop_of_empty_stays_empty() {
        TaskQueue<String> q = TaskQueue.<String>empty().pop();
        assertTrue(q.isEmpty());
        assertNull(q.peek());
    }
}
