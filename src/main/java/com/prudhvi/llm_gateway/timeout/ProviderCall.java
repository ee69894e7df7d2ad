package com.prudhvi.llm_gateway.timeout;

/**
 * One invocation of an LLM provider, as supplied by the AI-flow layer.
 *
 * The gateway does not know what the call does. It may block; it is run on a
 * worker thread and interrupted if its deadline passes or the caller gives up,
 * so implementations should use interruptible I/O (e.g. {@code HttpClient.send}).
 */
@FunctionalInterface
public interface ProviderCall<T> {

    T call() throws Exception;
}
