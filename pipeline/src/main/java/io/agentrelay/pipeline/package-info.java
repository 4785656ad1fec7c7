/**
 * Chains agents into a pipeline where the text output of one stage is the input of the next.
 */
@NullMarked
package io.agentrelay.pipeline;

import org.jspecify.annotations.NullMarked;
