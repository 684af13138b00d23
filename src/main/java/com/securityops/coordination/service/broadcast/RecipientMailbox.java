package com.securityops.coordination.service.broadcast;

import com.securityops.coordination.dto.QueuedMessage;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Pending events of one recipient, in publish order.
 *
 * Not thread-safe on its own: every access happens between {@link #lock()} and {@link #unlock()}.
 * A retired mailbox has been removed from the router's index and must not be used again.
 */
class RecipientMailbox {

    private final String recipientId;
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<QueuedMessage> queue = new ArrayDeque<>();
    private boolean retired;

    RecipientMailbox(String recipientId) {
        this.recipientId = recipientId;
    }

    String recipientId() {
        return recipientId;
    }

    void lock() {
        lock.lock();
    }

    void unlock() {
        lock.unlock();
    }

    boolean isRetired() {
        return retired;
    }

    void retire() {
        retired = true;
    }

    boolean hasBacklog() {
        return !queue.isEmpty();
    }

    int size() {
        return queue.size();
    }

    /**
     * Appends a message, dropping the oldest ones first when the mailbox is full.
     *
     * @return the messages dropped to make room
     */
    List<QueuedMessage> enqueue(QueuedMessage message, int capacity) {
        List<QueuedMessage> dropped = new ArrayList<>();
        while (queue.size() >= capacity) {
            dropped.add(queue.pollFirst());
        }
        queue.addLast(message);
        return dropped;
    }

    QueuedMessage peek() {
        return queue.peekFirst();
    }

    QueuedMessage poll() {
        return queue.pollFirst();
    }

    void replaceHead(QueuedMessage message) {
        queue.pollFirst();
        queue.addFirst(message);
    }

    List<QueuedMessage> removeIf(Predicate<QueuedMessage> filter) {
        List<QueuedMessage> removed = queue.stream().filter(filter).toList();
        queue.removeIf(filter);
        return removed;
    }
}
