package com.example.secretsmanager.core.exception;

import com.example.secretsmanager.core.model.Action;

/** The access policy does not allow the requester to perform the action on the path. */
public class AccessDeniedException extends SecretsException {

  private final String requester;
  private final Action action;
  private final String path;

  public AccessDeniedException(
      final String requester, final Action action, final String path, final String reason) {
    super("Access denied: %s may not %s %s (%s)".formatted(requester, action.code(), path, reason));
    this.requester = requester;
    this.action = action;
    this.path = path;
  }

  public String requester() {
    return requester;
  }

  public Action action() {
    return action;
  }

  public String path() {
    return path;
  }
}
