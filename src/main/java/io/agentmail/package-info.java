/**
 * Agent Mail coordination core.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.agentmail.Main} bootstraps the operator CLI.</li>
 *   <li>{@code io.agentmail.cli.AgentMailCommand} maps operator commands to runtime APIs.</li>
 *   <li>{@code io.agentmail.runtime.AgentMailRuntime} is the caller-facing facade over all components.</li>
 *   <li>{@code io.agentmail.storage.Database} owns schema, migrations and transaction demarcation.</li>
 * </ul>
 */
package io.agentmail;
