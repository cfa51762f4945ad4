package fr.lapetina.genrouter.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates ring buffer slots; events are reused by clearing and re-initializing them.
 */
public final class GenerationRequestEventFactory implements EventFactory<GenerationRequestEvent> {

    @Override
    public GenerationRequestEvent newInstance() {
        return new GenerationRequestEvent();
    }
}
