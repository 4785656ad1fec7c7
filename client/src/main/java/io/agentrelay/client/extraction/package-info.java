/**
 * Text extraction from agent stream envelopes: per-payload extraction, recovery of
 * concatenated envelopes and accumulation of an invocation's result.
 */
@NullMarked
package io.agentrelay.client.extraction;

import org.jspecify.annotations.NullMarked;
