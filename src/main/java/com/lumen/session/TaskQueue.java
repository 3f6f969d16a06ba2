package com.lumen.session;

/**
 * Immutable FIFO. Every operation returns a new queue and leaves the receiver untouched,
 * so a queue value can be published through a single atomic reference.
 *
 * Two cons lists: {@code front} in dequeue order, {@code rear} in reverse arrival order.
 * The rear is reversed into the front when the front runs out (amortized O(1)).
 */
public final class TaskQueue<T> {

    private static final class Node<T> {
        final T head;
        final Node<T> tail;

        Node(T head, Node<T> tail) {
            this.head = head;
            this.tail = tail;
        }
    }

    private static final TaskQueue<Object> EMPTY = new TaskQueue<>(null, null, 0);

    private final Node<T> front;
    private final Node<T> rear;
    private final int size;

    private TaskQueue(Node<T> front, Node<T> rear, int size) {
        this.front = front;
        this.rear = rear;
        this.size = size;
    }

    @SuppressWarnings("unchecked")
    public static <T> TaskQueue<T> empty() {
        return (TaskQueue<T>) EMPTY;
    }

    public boolean isEmpty() { return size == 0; }

    public int size() { return size; }

    public TaskQueue<T> enqueue(T item) {
        if (item == null) throw new IllegalArgumentException("item is null");
        if (front == null) {
            return new TaskQueue<>(new Node<>(item, null), rear, size + 1);
        }
        return new TaskQueue<>(front, new Node<>(item, rear), size + 1);
    }

    /** Oldest element, or null when empty. */
    public T peek() {
        return (front == null) ? null : front.head;
    }

    /** Queue without its oldest element; popping an empty queue yields the empty queue. */
    public TaskQueue<T> pop() {
        if (front == null) return this;
        Node<T> nextFront = front.tail;
        Node<T> nextRear = rear;
        if (nextFront == null) {
            nextFront = reverse(rear);
            nextRear = null;
        }
        if (size == 1) return empty();
        return new TaskQueue<>(nextFront, nextRear, size - 1);
    }

    private static <T> Node<T> reverse(Node<T> list) {
        Node<T> out = null;
        for (Node<T> n = list; n != null; n = n.tail) out = new Node<>(n.head, out);
        return out;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("TaskQueue[");
        boolean first = true;
        for (TaskQueue<T> q = this; !q.isEmpty(); q = q.pop()) {
            if (!first) sb.append(", ");
            sb.append(q.peek());
            first = false;
        }
        return sb.append(']').toString();
    }
}
