package org.sunbreeze.http.dispatch;

import org.slf4j.Logger;
import org.sunbreeze.exception.ProcessTerminationException;
import org.sunbreeze.http.message.Response;
import org.sunbreeze.http.template.TemplateRenderer;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

public class ErrorBoundary {

    public static final String GENERIC_MESSAGE = "Something ducky happened.";
    public static final String TRACE_MARKER = "Stack trace:";
    public static final String ERROR_TEMPLATE = "error.html";

    private final Logger log;
    private final TemplateRenderer templates;

    public ErrorBoundary(Logger log, TemplateRenderer templates) {
        this.log = log;
        this.templates = templates;
    }

    /**
     * Runs the invocation and converts any failure, thrown or completed exceptionally,
     * into a 500 response. The returned future only fails for process termination.
     */
    public CompletableFuture<Response> guard(DispatchContext context,
                                             Callable<? extends CompletionStage<Response>> invocation) {
        CompletionStage<Response> stage;
        try {
            stage = invocation.call();
        } catch (Throwable failure) {
            return CompletableFuture.completedFuture(handleFailure(context, failure, true));
        }
        if (stage == null) {
            return CompletableFuture.completedFuture(
                    handleFailure(context, new IllegalStateException("Handler returned no response stage"), true));
        }

        CompletableFuture<Response> result = new CompletableFuture<>();
        stage.whenComplete((response, failure) -> {
            if (failure == null && response != null) {
                result.complete(response);
                return;
            }
            Throwable cause = failure == null
                    ? new IllegalStateException("Handler completed without a response")
                    : unwrap(failure);
            try {
                result.complete(handleFailure(context, cause, false));
            } catch (Throwable termination) {
                result.completeExceptionally(termination);
            }
        });
        return result;
    }

    Response handleFailure(DispatchContext context, Throwable failure, boolean onFailingThread) {
        if (isProcessTermination(failure)) {
            log.error("Application stopped while handling {} {}", context.method(), context.path(), failure);
            throw propagate(failure, onFailingThread);
        }
        log.error("Unhandled failure while handling {} {}", context.method(), context.path(), failure);
        if (!context.debug()) {
            return Response.text(500, GENERIC_MESSAGE);
        }
        return debugResponse(context, failure);
    }

    private Response debugResponse(DispatchContext context, Throwable failure) {
        String message = failure.toString();
        String trace = stackTraceOf(failure);
        Response response = new Response().setStatus(500);
        if (templates != null) {
            try {
                byte[] page = templates.render(ERROR_TEMPLATE, Map.of(
                        "message", message,
                        "traceback", trace,
                        "method", context.method(),
                        "path", context.path()));
                return response.setBody(page).setMediaType(Response.TEXT_HTML);
            } catch (RuntimeException renderFailure) {
                log.warn("Could not render {}, falling back to plain text", ERROR_TEMPLATE, renderFailure);
            }
        }
        return response.setText(message + "\n\n" + TRACE_MARKER + "\n" + trace);
    }

    static boolean isProcessTermination(Throwable failure) {
        return failure instanceof Error
                || failure instanceof InterruptedException
                || failure instanceof ProcessTerminationException;
    }

    private static RuntimeException propagate(Throwable failure, boolean onFailingThread) {
        if (failure instanceof Error error) {
            throw error;
        }
        if (failure instanceof InterruptedException) {
            if (onFailingThread) {
                Thread.currentThread().interrupt();
            }
            return new ProcessTerminationException("Interrupted during dispatch", failure);
        }
        return (RuntimeException) failure;
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String stackTraceOf(Throwable failure) {
        StringWriter writer = new StringWriter();
        failure.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }

}
