package com.example.leadengine.collaborator;

public class GenerativeClientException extends RuntimeException {

  public GenerativeClientException(String message) {
    super(message);
  }

  public GenerativeClientException(String message, Throwable cause) {
    super(message, cause);
  }
}
