package com.syro.core.execution;

import com.syro.api.InboundMessage;

import java.util.List;
import java.util.function.Consumer;

/**
 * A parsed message ready for admission.
 *
 * @param identifier lower-cased name or alias as typed
 * @param replier    sink for handler replies, may be {@code null}
 */
public record Invocation(String identifier,
                         String argumentText,
                         List<String> args,
                         String prefix,
                         InboundMessage message,
                         Consumer<String> replier) {
}
