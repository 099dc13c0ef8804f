package com.flamingo.ai.digest.exception;

/** Exception thrown when no channel has the given username. */
public class ChannelNotFoundException extends RuntimeException {

  private final String username;

  public ChannelNotFoundException(String username) {
    super("Channel not found: " + username);
    this.username = username;
  }

  public String getUsername() {
    return username;
  }
}
