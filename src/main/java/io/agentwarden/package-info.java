/**
 * AgentWarden source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.agentwarden.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.agentwarden.cli.AgentWardenCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.agentwarden.supervisor.ProcessSupervisor} launches, monitors, restarts and stops workers.</li>
 *   <li>{@code io.agentwarden.storage} holds the role locks, work queue and health store shared by every process.</li>
 * </ul>
 */
package io.agentwarden;
