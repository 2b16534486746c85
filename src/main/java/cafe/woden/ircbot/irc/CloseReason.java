package cafe.woden.ircbot.irc;

/** Why a connection ended, and the process exit status that goes with it. */
public enum CloseReason {
  QUIT(0),
  NICK_IN_USE(1),
  PING_TIMEOUT(1),
  SERVER_CLOSED(1),
  TRANSPORT_ERROR(1),
  AUTHENTICATION_FAILED(1),
  SHUTDOWN(0);

  private final int exitCode;

  CloseReason(int exitCode) {
    this.exitCode = exitCode;
  }

  public int exitCode() {
    return exitCode;
  }
}
