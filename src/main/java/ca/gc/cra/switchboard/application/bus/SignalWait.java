package ca.gc.cra.switchboard.application.bus;

import ca.gc.cra.switchboard.domain.node.HandlerNames;
import ca.gc.cra.switchboard.domain.node.Message;
import ca.gc.cra.switchboard.domain.node.SignalReply;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Predicate;

/**
 * Pending lock of one instance: the awaited signal, an optional payload matcher and the timeout timer.
 */
final class SignalWait {
  private final String signal;
  private final Predicate<Message> matcher;
  private final CompletableFuture<SignalReply> future = new CompletableFuture<>();
  private ScheduledFuture<?> timeout;

  SignalWait(String signal, Predicate<Message> matcher) {
    this.signal = HandlerNames.canonicalSignal(signal);
    this.matcher = matcher;
  }

  String signal() {
    return signal;
  }

  boolean matches(Message message) {
    return signal.equals(HandlerNames.canonicalSignal(message.signal())) && matcher.test(message);
  }

  CompletableFuture<SignalReply> future() {
    return future;
  }

  void timeout(ScheduledFuture<?> timer) {
    this.timeout = timer;
  }

  void cancelTimeout() {
    if (timeout != null) {
      timeout.cancel(false);
    }
  }
}
