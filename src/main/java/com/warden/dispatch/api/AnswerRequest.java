package com.warden.dispatch.api;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Inbound JSON body for POST /api/v1/sandboxes/{threadId}/answer.
 *
 * @param answers answers to the agent's pending question, keyed by question
 */
public record AnswerRequest(JsonNode answers) {}
