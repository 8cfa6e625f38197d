package com.aiadvent.codegraph.flow;

/**
 * Turns traversal evidence into a readable flow. Each round receives the steps of the previous
 * one and returns the complete, refined step list.
 */
public interface FlowNarrator {

  FlowNarration narrate(FlowNarrationRequest request);
}
