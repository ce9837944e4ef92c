package com.solanaeda.eventbus;

/**
 * The broker refused a declaration because an entity with the same name exists with
 * different parameters (reply code 406 PRECONDITION_FAILED).
 */
public class TopologyConflictException extends EventBusException {
  public TopologyConflictException(String message, Throwable cause) { super(message, cause); }
}
