package com.prudhvi.llm_gateway.stream;

import com.prudhvi.llm_gateway.events.GatewayEventSink;
import com.prudhvi.llm_gateway.events.StateTransitionEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe registry of open SSE connections watching breaker transitions.
 *
 * CopyOnWriteArrayList is safe to iterate while dashboards connect and
 * disconnect concurrently, which is the access pattern here: the event
 * dispatcher broadcasts while clients come and go.
 */
@Component
public class SseEmitterRegistry implements GatewayEventSink {

    private final List<SseEmitter> emitters = new CopyOnWriteArrayList<>();

    /**
     * Creates a new emitter with no server-side timeout and registers cleanup
     * callbacks. A comment is sent straight away to commit the response
     * headers, otherwise the browser's EventSource never sees the connection
     * open and keeps reconnecting.
     */
    public SseEmitter register() {
        SseEmitter emitter = new SseEmitter(0L);
        emitters.add(emitter);
        emitter.onCompletion(() -> emitters.remove(emitter));
        emitter.onTimeout(()   -> emitters.remove(emitter));
        emitter.onError(e      -> emitters.remove(emitter));
        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            emitters.remove(emitter);
        }
        return emitter;
    }

    @Override
    public void onTransition(StateTransitionEvent event) {
        broadcast(event);
    }

    /**
     * Sends an event to every connected client, dropping those that have
     * disconnected (send() throws IOException for them).
     */
    void broadcast(StateTransitionEvent event) {
        for (SseEmitter emitter : emitters) {
            try {
                emitter.send(SseEmitter.event().name("transition").data(event));
            } catch (IOException e) {
                emitters.remove(emitter);
            }
        }
    }

    int size() {
        return emitters.size();
    }
}
