package com.example.mcp_bridge.service;

public class UpstreamLoginFailedException extends RuntimeException {

  public enum Reason {
    REJECTED,
    UNAVAILABLE
  }

  private final Reason reason;

  public UpstreamLoginFailedException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
