package com.aiadvent.codegraph.job.domain;

public enum JobType {
  PARSE,
  DETECT_ENTRY_POINTS,
  GENERATE_FLOW
}
