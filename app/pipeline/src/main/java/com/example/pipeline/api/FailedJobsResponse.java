package com.example.pipeline.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FailedJobsResponse(String queueName, List<JobView> jobs) {

  public FailedJobsResponse {
    jobs = jobs == null ? List.of() : List.copyOf(jobs);
  }
}
