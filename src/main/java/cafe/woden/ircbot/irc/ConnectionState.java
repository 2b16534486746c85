package cafe.woden.ircbot.irc;

import io.reactivex.rxjava3.disposables.Disposable;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/** Mutable liveness state for one connection, shared between the reader, writers and timers. */
final class ConnectionState {
  final AtomicLong lastInboundMs = new AtomicLong(0);
  final AtomicLong lastOutboundMs = new AtomicLong(0);
  final AtomicBoolean localTimeoutEmitted = new AtomicBoolean(false);
  final AtomicReference<Disposable> watchdogDisposable = new AtomicReference<>();

  void touchInbound(long nowMs) {
    lastInboundMs.set(nowMs);
  }

  void touchOutbound(long nowMs) {
    lastOutboundMs.set(nowMs);
  }
}
