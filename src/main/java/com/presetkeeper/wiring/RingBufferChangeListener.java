package com.presetkeeper.wiring;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.presetkeeper.api.EntityChangeListener;
import com.presetkeeper.api.PresetChange;
import com.presetkeeper.util.ErrorRateLimiter;

import java.util.concurrent.TimeUnit;

import lombok.extern.log4j.Log4j2;

/**
 * An {@link EntityChangeListener} that moves change handling off the dispatch
 * thread.
 *
 * <h3>Workflow</h3>
 * <ol>
 * <li>The dispatcher calls {@link #onPresetChanged} while holding its lock.
 * The change is copied into a pre-allocated {@link ChangeEvent} slot and
 * published; nothing else happens on the caller's thread.</li>
 * <li>A single daemon consumer thread hands each event to the
 * {@link ChangeEventHandler} in publish order.</li>
 * </ol>
 *
 * <p>
 * Multiple producer threads are supported. When the buffer is full the
 * publishing thread waits for a free slot, which also holds up the dispatch.
 * Handler exceptions are logged (rate limited) and do not stop the consumer.
 */
@Log4j2
public final class RingBufferChangeListener implements EntityChangeListener, AutoCloseable {
    private final Disruptor<ChangeEvent> disruptor;
    private final RingBuffer<ChangeEvent> ringBuffer;

    /**
     * Builds and starts the ring buffer.
     *
     * @param bufferSize Slot count, a power of two.
     * @param handler    Consumer of the changes.
     */
    public RingBufferChangeListener(int bufferSize, ChangeEventHandler handler) {
        if (bufferSize < 1 || Integer.bitCount(bufferSize) != 1)
            throw new IllegalArgumentException("Ring buffer size must be a power of two: " + bufferSize);
        this.disruptor = new Disruptor<>(
                ChangeEvent::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        disruptor.handleEventsWith(new ChangeConsumer(handler));
        this.ringBuffer = disruptor.start();
    }

    @Override
    public void onPresetChanged(int entityId, PresetChange change) {
        long seq = ringBuffer.next();
        try {
            ringBuffer.get(seq).set(entityId, change);
        } finally {
            ringBuffer.publish(seq);
        }
    }

    /** Slots not yet consumed. */
    public long backlog() {
        return ringBuffer.getBufferSize() - ringBuffer.remainingCapacity();
    }

    /**
     * Waits up to the timeout for published changes to be consumed, then stops
     * the consumer thread.
     */
    public void close(long timeout, TimeUnit unit) {
        try {
            disruptor.shutdown(timeout, unit);
        } catch (TimeoutException e) {
            log.warn("{} changes still pending when the ring buffer was halted", backlog());
            disruptor.halt();
        }
    }

    @Override
    public void close() {
        close(5, TimeUnit.SECONDS);
    }

    private static final class ChangeConsumer implements EventHandler<ChangeEvent> {
        private final ChangeEventHandler handler;
        private final ErrorRateLimiter errorLimiter = new ErrorRateLimiter(log, 1000);

        ChangeConsumer(ChangeEventHandler handler) {
            this.handler = handler;
        }

        @Override
        public void onEvent(ChangeEvent event, long sequence, boolean endOfBatch) {
            try {
                handler.onChange(event, endOfBatch);
            } catch (Exception e) {
                errorLimiter.log("Change handler failed for entity " + event.entityId() + " (seq "
                        + sequence + ")", e);
            } finally {
                event.clear();
            }
        }
    }
}
