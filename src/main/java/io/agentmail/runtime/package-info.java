/**
 * Runtime facade package.
 *
 * <p>{@link io.agentmail.runtime.AgentMailRuntime} wires the coordination components over one
 * database, supplies the clock, and audit-logs every mutating operation. It is the surface the
 * operator CLI and embedding transports call.
 */
package io.agentmail.runtime;
