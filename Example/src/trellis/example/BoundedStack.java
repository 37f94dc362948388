package trellis.example;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * A last-in first-out stack holding at most a fixed number of elements.
 *
 * @param <E> The type of the elements.
 */
public final class BoundedStack<E> {
    private final int capacity;
    private final List<E> elements = new ArrayList<>();

    public BoundedStack(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1 but was: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Pushes the element onto the top of the stack.
     *
     * @param element The element.
     * @throws IllegalStateException If the stack is full.
     */
    public synchronized void push(E element) {
        if (isFull()) {
            throw new IllegalStateException("stack is full: " + this.capacity);
        }
        this.elements.add(element);
    }

    /**
     * Removes and returns the element on top of the stack.
     *
     * @return the top element.
     * @throws NoSuchElementException If the stack is empty.
     */
    public synchronized E pop() {
        E top = peek();
        this.elements.remove(this.elements.size() - 1);
        return top;
    }

    public synchronized E peek() {
        if (this.elements.isEmpty()) {
            throw new NoSuchElementException("stack is empty");
        }
        return this.elements.get(this.elements.size() - 1);
    }

    public synchronized int size() {
        return this.elements.size();
    }

    public synchronized boolean isEmpty() {
        return this.elements.isEmpty();
    }

    public synchronized boolean isFull() {
        return this.elements.size() == this.capacity;
    }

    public int capacity() {
        return this.capacity;
    }

    @Override
    public synchronized String toString() {
        return this.getClass().getSimpleName() + " { " + this.elements + ", capacity: " + this.capacity + " }";
    }
}
