package com.prudhvi.llm_gateway.error;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps whatever an attempt threw onto the gateway's typed error surface.
 *
 * Gateway exceptions pass through unchanged. Anything else is wrapped:
 * <ul>
 *   <li>socket/HTTP/future timeouts      -> {@link CallTimeoutException}</li>
 *   <li>interruption and cancellation    -> {@link CallCancelledException}</li>
 *   <li>other {@link IOException}s       -> network {@link ProviderException}</li>
 *   <li>{@link IllegalArgumentException} -> non-retryable {@link ProviderException}</li>
 *   <li>everything else                  -> retryable {@link ProviderException} without status</li>
 * </ul>
 */
public final class ErrorClassifier {

    private ErrorClassifier() {
    }

    public static GatewayException classify(String provider, Throwable error, Duration elapsed) {
        Throwable cause = unwrap(error);

        if (cause instanceof GatewayException gatewayException) {
            return gatewayException;
        }
        if (cause instanceof HttpTimeoutException
                || cause instanceof SocketTimeoutException
                || cause instanceof TimeoutException) {
            return new CallTimeoutException(provider, elapsed, cause);
        }
        // InterruptedIOException is left to the IOException branch: it is raised
        // by transports cutting off a slow exchange, not by the caller.
        if (cause instanceof InterruptedException || cause instanceof CancellationException) {
            return new CallCancelledException(provider, cause);
        }
        if (cause instanceof IOException) {
            return ProviderException.network(provider, cause);
        }
        if (cause instanceof IllegalArgumentException) {
            return ProviderException.malformedRequest(provider, cause);
        }
        return ProviderException.unexpected(provider, cause);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
