/**
 * Looming source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.looming.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.looming.cli.LoomingCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.looming.narrative.NarrativeExecutor} drives one narrative run act by act.</li>
 *   <li>{@code io.looming.scheduler.TaskScheduler} polls due tasks and feeds the worker pool.</li>
 *   <li>{@code io.looming.storage.TaskStore} is the authoritative record of schedules, leases and failure counters.</li>
 * </ul>
 */
package io.looming;
