/**
 * Runtime wiring package.
 *
 * <p>{@link io.looming.runtime.LoomingRuntime} builds storage, the narrative
 * engine and the scheduler for one data root, and exposes the operations the
 * CLI calls.
 */
package io.looming.runtime;
