package fr.lapetina.watchman.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Factory for creating RoundEvent instances in the Disruptor ring buffer.
 */
public final class RoundEventFactory implements EventFactory<RoundEvent> {

    @Override
    public RoundEvent newInstance() {
        return new RoundEvent();
    }
}
