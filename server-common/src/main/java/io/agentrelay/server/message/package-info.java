@NullMarked
package io.agentrelay.server.message;

import org.jspecify.annotations.NullMarked;
