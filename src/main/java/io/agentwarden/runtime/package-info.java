/**
 * Runtime wiring package.
 *
 * <p>{@link io.agentwarden.runtime.AgentWardenRuntime} binds one runtime root
 * (SQLite database, settings file, audit log) to the stores, the supervisor
 * and the built-in worker used by the CLI.
 */
package io.agentwarden.runtime;
