package com.solanaeda.eventbus.producer;

public enum WorkerStatus {
  STARTING, RUNNING, STOPPING, STOPPED, ERROR
}
