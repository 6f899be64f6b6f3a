package com.mediavault.service;

import com.mediavault.model.ProgressEvent;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Blocking, ordered view of the events of one running operation.
 * The worker never blocks on it (unbounded queue); iteration ends after complete or error.
 */
public class ProgressStream implements Iterator<ProgressEvent>, AutoCloseable {

    private final BlockingQueue<ProgressEvent> queue = new LinkedBlockingQueue<>();
    private final OperationControl control;
    private ProgressEvent next;
    private boolean finished;

    public ProgressStream(OperationControl control) {
        this.control = control;
    }

    /**
     * The producer side, handed to the worker.
     */
    public ProgressSink sink() {
        return queue::add;
    }

    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        if (finished) {
            return false;
        }
        try {
            next = queue.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        if (next.getType().isTerminal()) {
            finished = true;
        }
        return true;
    }

    @Override
    public ProgressEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        ProgressEvent event = next;
        next = null;
        return event;
    }

    /**
     * Blocks until the operation ends and returns every event, the terminal one last.
     */
    public List<ProgressEvent> drain() {
        List<ProgressEvent> events = new ArrayList<>();
        while (hasNext()) {
            events.add(next());
        }
        return events;
    }

    /**
     * Asks the worker to stop after the current file.
     */
    public void cancel() {
        control.cancel();
    }

    public boolean isCancelled() {
        return control.isCancelled();
    }

    @Override
    public void close() {
        if (!finished) {
            cancel();
        }
    }
}
