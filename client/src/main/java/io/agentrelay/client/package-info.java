/**
 * Client side of the agent relay: {@link io.agentrelay.client.RelayClient} invokes one agent
 * and returns its text reply.
 */
@NullMarked
package io.agentrelay.client;

import org.jspecify.annotations.NullMarked;
