package com.aiadvent.codegraph.parser.model;

/**
 * Raw call expression captured by a language adapter before resolution.
 *
 * @param ownerIndex index of the enclosing symbol in {@link ParsedFile#symbols()}
 * @param receiver identifier or dotted path the call is made on; {@code this} for self
 *     references, {@code null} when the call is bare
 * @param chained whether the receiver is itself an expression (a call result, an index access)
 */
public record CallSite(
    int ownerIndex, String name, String receiver, CallKind kind, boolean chained, int line) {

  public static final String SELF_RECEIVER = "this";

  public CallSite {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Call site name must not be blank");
    }
    if (kind == null) {
      throw new IllegalArgumentException("Call site kind must not be null");
    }
  }

  public boolean bare() {
    return receiver == null && !chained;
  }

  public boolean selfReceiver() {
    return SELF_RECEIVER.equals(receiver);
  }
}
