package com.example.pipeline.orchestrator;

public class EntityNotFoundException extends RuntimeException {

  public EntityNotFoundException(String entity, long id) {
    super(entity + " not found: " + id);
  }
}
