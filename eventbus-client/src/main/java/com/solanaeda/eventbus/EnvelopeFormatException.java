package com.solanaeda.eventbus;

public class EnvelopeFormatException extends EventBusException {
  public EnvelopeFormatException(String message) { super(message); }
  public EnvelopeFormatException(String message, Throwable cause) { super(message, cause); }
}
