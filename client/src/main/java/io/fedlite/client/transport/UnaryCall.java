package io.fedlite.client.transport;

/**
 * One request, one response. Blocking stub methods fit directly,
 * e.g. {@code stub::getTasks}.
 */
@FunctionalInterface
public interface UnaryCall<Req, Resp> {

    Resp invoke(Req request);
}
